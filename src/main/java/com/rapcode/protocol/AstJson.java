package com.rapcode.protocol;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Expr;
import com.rapcode.script.parser.Expr.ExprInterface;
import com.rapcode.script.parser.Expr.ExprVisitor;
import com.rapcode.script.parser.Expr.Operator;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.StmtVisitor;
import com.rapcode.script.parser.Statement.While;
import com.rapcode.script.parser.Value;

/**
 * Canonical JSON form of the AST.
 *
 * Every node is an object with a {@code type} discriminator. Source positions are not
 * part of the format; integral numbers are written as JSON integers.
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private AstJson() {}

    public static ObjectMapper mapper() { return om; }

    // -------------------------- Writing --------------------------

    public static ObjectNode toJson(Program program) {
        ObjectNode root = om.createObjectNode();
        root.put("type", "Program");
        root.set("body", statements(program.body));
        return root;
    }

    public static String write(Program program) {
        try {
            return om.writeValueAsString(toJson(program)) + "\n";
        } catch (JsonProcessingException e) {
            throw new RapcodeException(ErrorKind.IO, "Cannot serialize program: " + e.getOriginalMessage(), 0, 0, e);
        }
    }

    private static ArrayNode statements(List<Stmt> body) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : body) arr.add(s.accept(STMT_WRITER));
        return arr;
    }

    private static ObjectNode node(String type) {
        ObjectNode n = om.createObjectNode();
        n.put("type", type);
        return n;
    }

    private static final StmtVisitor<ObjectNode> STMT_WRITER = new StmtVisitor<ObjectNode>() {
        @Override
        public ObjectNode visitAssignmentStmt(Assignment stmt) {
            ObjectNode n = node("Assignment");
            n.put("target", stmt.target.name);
            n.set("value", expr(stmt.value));
            return n;
        }

        @Override
        public ObjectNode visitOutputStmt(Output stmt) {
            ObjectNode n = node("Output");
            n.set("value", expr(stmt.value));
            return n;
        }

        @Override
        public ObjectNode visitIfStmt(If stmt) {
            ObjectNode n = node("If");
            n.set("test", expr(stmt.test));
            n.set("consequent", statements(stmt.consequent));
            if (stmt.hasAlternate()) n.set("alternate", statements(stmt.alternate));
            else n.putNull("alternate");
            return n;
        }

        @Override
        public ObjectNode visitWhileStmt(While stmt) {
            ObjectNode n = node("While");
            n.set("test", expr(stmt.test));
            n.set("body", statements(stmt.body));
            return n;
        }

        @Override
        public ObjectNode visitBreakStmt(Break stmt) {
            return node("Break");
        }
    };

    private static ObjectNode expr(ExprInterface e) {
        return e.accept(EXPR_WRITER);
    }

    private static final ExprVisitor<ObjectNode> EXPR_WRITER = new ExprVisitor<ObjectNode>() {
        @Override
        public ObjectNode visitLiteralExpr(Expr.Literal expr) {
            ObjectNode n = node("Literal");
            Value v = expr.value;
            switch (v.type) {
                case NUMBER: {
                    double d = v.asNumber();
                    if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.0e15) n.put("value", (long) d);
                    else n.put("value", d);
                    break;
                }
                case BOOL:
                    n.put("value", v.asBool());
                    break;
                default:
                    n.put("value", v.asString());
            }
            return n;
        }

        @Override
        public ObjectNode visitIdentifierExpr(Expr.Identifier expr) {
            ObjectNode n = node("Identifier");
            n.put("name", expr.name);
            return n;
        }

        @Override
        public ObjectNode visitBinaryExpr(Expr.Binary expr) {
            ObjectNode n = node("Binary");
            n.put("operator", expr.operator.symbol);
            n.set("left", expr(expr.left));
            n.set("right", expr(expr.right));
            return n;
        }

        @Override
        public ObjectNode visitUnaryExpr(Expr.Unary expr) {
            ObjectNode n = node("Unary");
            n.put("operator", expr.operator.symbol);
            n.set("operand", expr(expr.operand));
            return n;
        }

        @Override
        public ObjectNode visitInputExpr(Expr.Input expr) {
            ObjectNode n = node("Input");
            n.set("prompt", expr(expr.prompt));
            return n;
        }
    };

    // -------------------------- Reading --------------------------

    public static Program read(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RapcodeException(ErrorKind.LOWERING, "Malformed AST JSON: " + e.getOriginalMessage(), 0, 0, e);
        }
        return fromJson(root);
    }

    public static boolean isAst(JsonNode root) {
        return root != null && root.isObject() && root.has("type");
    }

    public static Program fromJson(JsonNode root) {
        if (!"Program".equals(type(root))) {
            throw new RapcodeException(ErrorKind.LOWERING, "AST JSON root must be a 'Program' node.");
        }
        return new Program(new Reader().block(field(root, "body")));
    }

    private static String type(JsonNode n) {
        if (n == null || !n.isObject() || !n.path("type").isTextual()) {
            throw new RapcodeException(ErrorKind.LOWERING, "AST JSON node must be an object with a string 'type'.");
        }
        return n.get("type").asText();
    }

    private static JsonNode field(JsonNode n, String name) {
        JsonNode f = n.get(name);
        if (f == null) {
            throw new RapcodeException(ErrorKind.LOWERING,
                    "AST JSON '" + n.path("type").asText() + "' node is missing '" + name + "'.");
        }
        return f;
    }

    private static String text(JsonNode n, String name) {
        JsonNode f = field(n, name);
        if (!f.isTextual()) {
            throw new RapcodeException(ErrorKind.LOWERING,
                    "AST JSON '" + n.path("type").asText() + "." + name + "' must be a string.");
        }
        return f.asText();
    }

    /** Stateful only in the loop depth used to reject a stray Break. */
    private static final class Reader {
        private int loopDepth = 0;

        List<Stmt> block(JsonNode arr) {
            if (!arr.isArray()) {
                throw new RapcodeException(ErrorKind.LOWERING, "AST JSON statement list must be an array.");
            }
            List<Stmt> out = new ArrayList<>(arr.size());
            Iterator<JsonNode> it = arr.elements();
            while (it.hasNext()) out.add(statement(it.next()));
            return out;
        }

        Stmt statement(JsonNode n) {
            String type = type(n);
            switch (type) {
                case "Assignment":
                    return new Assignment(new Expr.Identifier(text(n, "target")), expression(field(n, "value")));
                case "Output":
                    return new Output(expression(field(n, "value")));
                case "If": {
                    ExprInterface test = expression(field(n, "test"));
                    List<Stmt> consequent = block(field(n, "consequent"));
                    JsonNode alt = n.get("alternate");
                    List<Stmt> alternate = (alt == null || alt.isNull()) ? null : block(alt);
                    return new If(test, consequent, alternate);
                }
                case "While": {
                    ExprInterface test = expression(field(n, "test"));
                    loopDepth++;
                    try {
                        return new While(test, block(field(n, "body")));
                    } finally {
                        loopDepth--;
                    }
                }
                case "Break":
                    if (loopDepth == 0) {
                        throw new RapcodeException(ErrorKind.STRUCTURAL, "BREAK outside of a loop.");
                    }
                    return new Break();
                default:
                    throw new RapcodeException(ErrorKind.LOWERING, "Unknown AST statement type '" + type + "'.");
            }
        }

        ExprInterface expression(JsonNode n) {
            String type = type(n);
            switch (type) {
                case "Literal":
                    return new Expr.Literal(literal(field(n, "value")));
                case "Identifier":
                    return new Expr.Identifier(text(n, "name"));
                case "Binary": {
                    Operator op = operator(text(n, "operator"), false);
                    return new Expr.Binary(expression(field(n, "left")), op, expression(field(n, "right")));
                }
                case "Unary": {
                    Operator op = operator(text(n, "operator"), true);
                    return new Expr.Unary(op, expression(field(n, "operand")));
                }
                case "Input":
                    return new Expr.Input(expression(field(n, "prompt")));
                default:
                    throw new RapcodeException(ErrorKind.LOWERING, "Unknown AST expression type '" + type + "'.");
            }
        }

        private static Value literal(JsonNode v) {
            if (v.isNumber()) return Value.number(v.asDouble());
            if (v.isBoolean()) return Value.bool(v.asBoolean());
            if (v.isTextual()) return Value.string(v.asText());
            throw new RapcodeException(ErrorKind.LOWERING, "AST JSON literal must be a number, boolean or string.");
        }

        private static Operator operator(String symbol, boolean unary) {
            try {
                return Operator.fromSymbol(symbol, unary);
            } catch (IllegalArgumentException e) {
                throw new RapcodeException(ErrorKind.LOWERING, e.getMessage(), 0, 0, e);
            }
        }
    }
}
