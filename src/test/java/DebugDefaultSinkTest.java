import org.junit.jupiter.api.Test;

import com.rapcode.debug.Debug;
import com.rapcode.debug.DebugSink;
import com.rapcode.script.RapcodeScript;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs in its own JVM (surefire reuseForks=false) and never installs a sink,
 * so the hub is exercised exactly as an embedding host first sees it.
 */
public class DebugDefaultSinkTest {

    @Test
    void untouchedHub_isSilentAndNotNull() {
        assertSame(DebugSink.SILENT, Debug.get().getSink());
    }

    @Test
    void libraryPipeline_runsWithoutInstalledSink() {
        List<String> printed = new ArrayList<>();
        RapcodeScript rs = new RapcodeScript();
        rs.setOutputSink(printed::add);

        assertDoesNotThrow(() -> {
            rs.run(rs.parse("x := 1\nLOOP\n  x := x + 1\n  IF x > 2 THEN\n    BREAK\n  ENDIF\nENDLOOP\nOUTPUT x"));
            rs.toMermaid(rs.parse("OUTPUT 1"));
        });
        assertEquals(List.of("3"), printed);
    }
}
