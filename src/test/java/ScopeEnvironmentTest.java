import org.junit.jupiter.api.Test;

import com.lox.script.parser.ScopeEnvironment;
import com.lox.script.parser.Value;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeEnvironmentTest {

    @Test
    void lookupWalksOutward() {
        ScopeEnvironment global = new ScopeEnvironment(Map.of("a", Value.number(1)));
        ScopeEnvironment inner = global.childScope().childScope();

        assertEquals(1.0, inner.lookup("a").orElseThrow().asNumber(), 0.0);
        assertTrue(inner.lookup("missing").isEmpty());
    }

    @Test
    void declareShadowsWithoutTouchingParent() {
        ScopeEnvironment global = new ScopeEnvironment();
        global.declare("a", Value.string("outer"));
        ScopeEnvironment inner = global.childScope();
        inner.declare("a", Value.string("inner"));

        assertEquals("inner", inner.lookup("a").orElseThrow().asString());
        assertEquals("outer", global.lookup("a").orElseThrow().asString());
        assertTrue(inner.existsInCurrentScope("a"));
    }

    @Test
    void assignUpdatesNearestBinding() {
        ScopeEnvironment global = new ScopeEnvironment();
        global.declare("a", Value.number(1));
        ScopeEnvironment inner = global.childScope();

        assertTrue(inner.assign("a", Value.number(2)));
        assertEquals(2.0, global.lookup("a").orElseThrow().asNumber(), 0.0);
        assertFalse(inner.existsInCurrentScope("a"));
    }

    @Test
    void assignToUndeclaredNameFails() {
        ScopeEnvironment global = new ScopeEnvironment();
        assertFalse(global.childScope().assign("nope", Value.nil()));
        assertTrue(global.lookup("nope").isEmpty());
    }

    @Test
    void redeclarationReplacesInSameScope() {
        ScopeEnvironment global = new ScopeEnvironment();
        global.declare("a", Value.number(1));
        global.declare("a", Value.string("again"));
        assertEquals("again", global.lookup("a").orElseThrow().asString());
    }

    @Test
    void snapshotCoversOnlyThisScope() {
        ScopeEnvironment global = new ScopeEnvironment();
        global.declare("g", Value.number(1));
        ScopeEnvironment inner = global.childScope();
        inner.declare("l", Value.number(2));

        Map<String, Value> snap = inner.snapshot();
        assertEquals(1, snap.size());
        assertTrue(snap.containsKey("l"));

        snap.put("x", Value.nil());
        assertFalse(inner.existsInCurrentScope("x"));
    }

    @Test
    void initialBindingsRejectNulls() {
        Map<String, Value> bad = new HashMap<>();
        bad.put("x", null);
        assertThrows(IllegalArgumentException.class, () -> new ScopeEnvironment(bad));
    }
}
