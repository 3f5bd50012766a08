import org.junit.jupiter.api.Test;

import com.lox.script.LoxScript;
import com.lox.script.parser.ScriptError;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoxScriptErrorHandlingTest {

    private final List<String> out = new ArrayList<>();

    private LoxScript engine() {
        LoxScript es = new LoxScript();
        es.setOutput(out::add);
        return es;
    }

    private ScriptError fails(String src) {
        LoxScript es = engine();
        return assertThrows(ScriptError.class, () -> es.run(src));
    }

    @Test
    void divisionByZeroStopsTheRunAndKeepsEarlierOutput() {
        ScriptError e = fails(
                "print \"before\";\n" +
                "print 1 / 0;\n" +
                "print \"after\";\n"
        );
        assertEquals(ScriptError.Kind.DIVISION_BY_ZERO, e.kind());
        assertEquals(List.of("before"), out);
    }

    @Test
    void undefinedVariableIsANameErrorBeforeAnyOutput() {
        ScriptError e = fails("print undefinedThing; print \"never\";");
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
        assertTrue(e.getMessage().contains("undefinedThing"), e.getMessage());
        assertTrue(out.isEmpty());
    }

    @Test
    void assignmentToUndeclaredNameIsANameError() {
        assertEquals(ScriptError.Kind.NAME_ERROR, fails("y = 3;").kind());
    }

    @Test
    void operandTypesAreChecked() {
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("print \"a\" + 1;").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("print 1 + nil;").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("print -\"a\";").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("print \"a\" < \"b\";").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("print true * 2;").kind());
    }

    @Test
    void callingANonCallableIsATypeError() {
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("var x = 1; x();").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("\"text\"();").kind());
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("nil();").kind());
    }

    @Test
    void wrongArgumentCountIsAnArityError() {
        assertEquals(ScriptError.Kind.ARITY_ERROR, fails("fun f(a, b) {} f(1);").kind());
        assertEquals(ScriptError.Kind.ARITY_ERROR, fails("fun f() {} f(1, 2);").kind());
    }

    @Test
    void nativeArityIsChecked() {
        LoxScript es = engine();
        es.registerFunction("one", 1, args -> args.get(0));

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("one();"));
        assertEquals(ScriptError.Kind.ARITY_ERROR, e.kind());
    }

    @Test
    void runawayRecursionHitsTheDepthLimit() {
        LoxScript es = engine();
        es.setMaxCallDepth(50);

        ScriptError e = assertThrows(ScriptError.class, () -> es.run(
                "fun down(x) { return down(x + 1); }\n" +
                "down(0);\n"
        ));
        assertEquals(ScriptError.Kind.RECURSION_DEPTH, e.kind());
    }

    @Test
    void recursionBelowTheLimitSucceeds() {
        LoxScript es = engine();
        es.setMaxCallDepth(50);
        es.run(
                "fun sumTo(x) { if (x == 0) return 0; return x + sumTo(x - 1); }\n" +
                "print sumTo(40);\n"
        );
        assertEquals(List.of("820"), out);
    }

    @Test
    void defaultDepthLimitAllowsDeepRecursion() {
        LoxScript es = engine();
        assertEquals(10_000, es.getMaxCallDepth());
        es.run(
                "fun count(n) { if (n > 0) return count(n - 1); return 0; }\n" +
                "print count(300);\n"
        );
        assertEquals(List.of("0"), out);
        assertThrows(IllegalArgumentException.class, () -> es.setMaxCallDepth(0));
    }

    @Test
    void superInsideARootClassIsANameError() {
        ScriptError e = fails(
                "class A { m() { return \"A\"; } }\n" +
                "class B < A {\n" +
                "  m() {\n" +
                "    class Inner { get() { return super.m(); } }\n" +
                "    return Inner().get();\n" +
                "  }\n" +
                "}\n" +
                "print B().m();\n"
        );
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
        assertTrue(out.isEmpty());
    }

    @Test
    void superAtTopLevelIsANameError() {
        assertEquals(ScriptError.Kind.NAME_ERROR, fails("super.m();").kind());
    }

    @Test
    void syntaxErrorsAreReportedWithLine() {
        ScriptError e = fails("print 1;\nvar = 2;\n");
        assertEquals(ScriptError.Kind.SYNTAX_ERROR, e.kind());
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
        assertTrue(out.isEmpty());
    }

    @Test
    void invalidAssignmentTargetIsASyntaxError() {
        assertEquals(ScriptError.Kind.SYNTAX_ERROR, fails("1 = 2;").kind());
    }

    @Test
    void unterminatedStringIsASyntaxError() {
        assertEquals(ScriptError.Kind.SYNTAX_ERROR, fails("print \"open;").kind());
    }

    @Test
    void errorReporterSeesEveryFailure() {
        List<ScriptError> reported = new ArrayList<>();
        LoxScript es = engine();
        es.setErrorReporter(reported::add);

        ScriptError e = assertThrows(ScriptError.class, () -> es.run("print 1 / 0;"));

        assertEquals(1, reported.size());
        assertSame(e, reported.get(0));
    }

    @Test
    void errorToStringNamesTheKind() {
        ScriptError e = fails("print 1 / 0;");
        assertTrue(e.toString().startsWith("DIVISION_BY_ZERO: "), e.toString());
    }

    @Test
    void engineIsReusableAfterAFailure() {
        LoxScript es = engine();
        assertThrows(ScriptError.class, () -> es.run("print missing;"));
        es.run("print \"recovered\";");
        assertEquals(List.of("recovered"), out);
    }
}
