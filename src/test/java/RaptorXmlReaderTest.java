import org.junit.jupiter.api.Test;

import com.rapcode.script.RapcodeScript;
import com.rapcode.script.flowchart.FlowNode;
import com.rapcode.script.flowchart.LoweringResult;
import com.rapcode.script.flowchart.RaptorXmlReader;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Parser;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Program;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RaptorXmlReaderTest {

    private static final String NS =
            "xmlns:i=\"http://www.w3.org/2001/XMLSchema-instance\" xmlns:a=\"urn:raptor\"";

    private static Path fixture(String name) throws Exception {
        return Path.of(RaptorXmlReaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    void readsComponentsAndLinks() throws Exception {
        FlowNode start = new RaptorXmlReader().read(fixture("sum.rap"));
        assertEquals(FlowNode.Kind.START, start.kind);

        FlowNode first = start.successor;
        assertEquals(FlowNode.Kind.ASSIGNMENT, first.kind);
        assertEquals("total := 0", first.text);

        FlowNode loop = first.successor.successor;
        assertEquals(FlowNode.Kind.LOOP, loop.kind);
        assertEquals("i > 3", loop.text);
        assertNull(loop.before);
        assertEquals("total := total + i", loop.after.text);
        assertEquals("i := i + 1", loop.after.successor.text);

        FlowNode decision = loop.successor;
        assertEquals(FlowNode.Kind.DECISION, decision.kind);
        assertEquals(FlowNode.Kind.OUTPUT, decision.left.kind);
        assertNull(decision.right);

        FlowNode comment = decision.successor;
        assertEquals(FlowNode.Kind.UNKNOWN, comment.kind);
        assertEquals("Comment_Box", comment.sourceType);

        FlowNode input = comment.successor;
        assertEquals(FlowNode.Kind.INPUT, input.kind);
        assertEquals("n", input.text);
        assertEquals("\"Enter n\"", input.prompt);
        assertEquals(FlowNode.Kind.END, input.successor.successor.kind);
    }

    @Test
    void loadedChart_lowersAndRuns() throws Exception {
        RapcodeScript rs = new RapcodeScript();
        List<String> printed = new ArrayList<>();
        rs.setOutputSink(printed::add);
        rs.setInputProvider(prompt -> "4");

        LoweringResult result = rs.load(fixture("sum.rap"));
        assertEquals(1, result.warnings().size());

        Program expected = Parser.parseProgram(String.join("\n",
                "total := 0",
                "i := 1",
                "LOOP",
                "  IF i > 3 THEN",
                "    BREAK",
                "  ENDIF",
                "  total := total + i",
                "  i := i + 1",
                "ENDLOOP",
                "IF total = 6 THEN",
                "  OUTPUT \"ok\"",
                "ENDIF",
                "n := INPUT(\"Enter n\")",
                "OUTPUT total + n"));
        assertEquals(expected, result.program());

        rs.run(result.program());
        assertEquals(List.of("ok", "10"), printed);
    }

    @Test
    void elementNamesWork_withoutTypeAttributes() {
        String xml = "<Chart " + NS + "><Start><_Successor i:type=\"a:Rectangle\">"
                + "<_text_str>x := 5</_text_str><_Successor i:nil=\"true\"/>"
                + "</_Successor></Start></Chart>";
        FlowNode start = new RaptorXmlReader().readString(xml);
        assertEquals("x := 5", start.successor.text);
        assertNull(start.successor.successor);
    }

    @Test
    void missingStart_isLoweringError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> new RaptorXmlReader().readString("<Chart " + NS + "><Other/></Chart>"));
        assertEquals(ErrorKind.LOWERING, ex.kind());
    }

    @Test
    void malformedXml_isLoweringError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> new RaptorXmlReader().readString("<Chart><Start></Chart>"));
        assertEquals(ErrorKind.LOWERING, ex.kind());
    }

    @Test
    void missingFile_isIoError() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> new RaptorXmlReader().read(Path.of("does-not-exist.rap")));
        assertEquals(ErrorKind.IO, ex.kind());
    }

    @Test
    void longStraightLineChart_doesNotOverflow() {
        int count = 20000;
        StringBuilder xml = new StringBuilder("<Chart " + NS + "><Start>");
        for (int i = 0; i < count; i++) {
            xml.append("<_Successor i:type=\"a:Rectangle\"><_text_str>x := ").append(i).append("</_text_str>");
        }
        for (int i = 0; i < count; i++) xml.append("</_Successor>");
        xml.append("</Start></Chart>");

        FlowNode node = new RaptorXmlReader().readString(xml.toString()).successor;
        int seen = 0;
        while (node != null) {
            assertEquals("x := " + seen, node.text);
            seen++;
            node = node.successor;
        }
        assertEquals(count, seen);
    }
}
