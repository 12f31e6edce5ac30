import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.rapcode.protocol.AstJson;
import com.rapcode.script.RapcodeScript;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Parser;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Program;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonTest {

    @Test
    void writesTypedNodes() {
        JsonNode json = AstJson.toJson(Parser.parseProgram("x := 2.5 + 1\nIF NOT done THEN OUTPUT \"hi\" ENDIF"));
        assertEquals("Program", json.get("type").asText());

        JsonNode assign = json.get("body").get(0);
        assertEquals("Assignment", assign.get("type").asText());
        assertEquals("x", assign.get("target").asText());
        assertEquals("+", assign.get("value").get("operator").asText());
        assertEquals(2.5, assign.get("value").get("left").get("value").asDouble(), 1e-9);
        assertTrue(assign.get("value").get("right").get("value").isIntegralNumber());

        JsonNode branch = json.get("body").get(1);
        assertEquals("If", branch.get("type").asText());
        assertEquals("Unary", branch.get("test").get("type").asText());
        assertEquals("NOT", branch.get("test").get("operator").asText());
        assertTrue(branch.get("alternate").isNull());
        assertEquals("hi", branch.get("consequent").get(0).get("value").get("value").asText());
    }

    @Test
    void writeThenRead_preservesStructure() {
        Program p = Parser.parseProgram(String.join("\n",
                "n := INPUT(\"n?\")",
                "WHILE n > 0 DO",
                "  IF n % 2 = 0 THEN OUTPUT n ELSE OUTPUT -n ENDIF",
                "  n := n - 1",
                "  LOOP BREAK ENDLOOP",
                "ENDLOOP",
                "flag := TRUE"));
        assertEquals(p, AstJson.read(AstJson.write(p)));
    }

    @Test
    void facadeAcceptsAstJson() {
        RapcodeScript rs = new RapcodeScript();
        Program p = rs.readJson("{\"type\":\"Program\",\"body\":[{\"type\":\"Output\","
                + "\"value\":{\"type\":\"Binary\",\"operator\":\"=\",\"left\":{\"type\":\"Literal\",\"value\":1},"
                + "\"right\":{\"type\":\"Literal\",\"value\":1}}}]}").program();
        assertEquals(Parser.parseProgram("OUTPUT 1 == 1"), p);
    }

    @Test
    void unknownType_isLoweringError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> AstJson.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Goto\"}]}"));
        assertEquals(ErrorKind.LOWERING, ex.kind());
        assertTrue(ex.detail().contains("Goto"), ex.detail());
    }

    @Test
    void missingField_isLoweringError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> AstJson.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Output\"}]}"));
        assertEquals(ErrorKind.LOWERING, ex.kind());
    }

    @Test
    void unknownOperator_isLoweringError() {
        assertEquals(ErrorKind.LOWERING, assertThrows(RapcodeException.class, () -> AstJson.read(
                "{\"type\":\"Program\",\"body\":[{\"type\":\"Output\",\"value\":{\"type\":\"Binary\",\"operator\":\"^\","
                        + "\"left\":{\"type\":\"Literal\",\"value\":1},\"right\":{\"type\":\"Literal\",\"value\":1}}}]}")).kind());
    }

    @Test
    void breakOutsideWhile_isStructuralError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> AstJson.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Break\"}]}"));
        assertEquals(ErrorKind.STRUCTURAL, ex.kind());
    }

    @Test
    void malformedJson_isLoweringError() {
        assertEquals(ErrorKind.LOWERING, assertThrows(RapcodeException.class, () -> AstJson.read("{\"type\":")).kind());
    }
}
