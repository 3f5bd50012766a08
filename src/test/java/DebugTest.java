import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.lox.debug.Debug;
import com.lox.debug.DebugLevel;
import com.lox.script.LoxScript;
import com.lox.script.parser.ScriptError;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private static final class Entry {
        final DebugLevel level;
        final String tag;
        final String message;
        final Throwable error;

        Entry(DebugLevel level, String tag, String message, Throwable error) {
            this.level = level;
            this.tag = tag;
            this.message = message;
            this.error = error;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    private LoxScript engine() {
        Debug.get().setSink((level, tag, message, error) -> entries.add(new Entry(level, tag, message, error)));
        LoxScript es = new LoxScript();
        es.setOutput(line -> { });
        return es;
    }

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void forDesugaringIsTraced() {
        engine().run("for (var i = 0; i < 1; i = i + 1) print i;");

        assertTrue(entries.stream().anyMatch(e ->
                e.level == DebugLevel.TRACE && e.tag.equals("TreeBuilder") && e.message.contains("for loop")));
    }

    @Test
    void runsAreLoggedAtDebug() {
        engine().run("print 1;");

        assertTrue(entries.stream().anyMatch(e -> e.level == DebugLevel.DEBUG && e.tag.equals("LoxScript")));
    }

    @Test
    void failuresAreLoggedWithTheError() {
        LoxScript es = engine();
        ScriptError thrown = assertThrows(ScriptError.class, () -> es.run("print missing;"));

        Entry logged = entries.stream().filter(e -> e.level == DebugLevel.ERROR).findFirst().orElseThrow();
        assertSame(thrown, logged.error);
        assertTrue(logged.message.startsWith("NAME_ERROR"), logged.message);
    }

    @Test
    void nullSinkFallsBackToNoop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        Debug.get().i("DebugTest", "dropped");
    }
}
