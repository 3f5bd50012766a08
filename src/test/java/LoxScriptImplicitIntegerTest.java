import org.junit.jupiter.api.Test;

import com.lox.script.LoxScript;
import com.lox.script.parser.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LoxScriptImplicitIntegerTest {

    private static List<String> run(String src) {
        List<String> out = new ArrayList<>();
        LoxScript es = new LoxScript();
        es.setOutput(out::add);
        es.run(src);
        return out;
    }

    @Test
    void declarationTruncatesForNamesStartingWithIThroughN() {
        List<String> out = run(
                "var i = 3.9;\n" +
                "var x = 3.9;\n" +
                "var n = -2.7;\n" +
                "var alpha = 1.25;\n" +
                "print i;\n" +
                "print x;\n" +
                "print n;\n" +
                "print alpha;\n"
        );
        assertEquals(List.of("3", "3.9", "-2", "1.25"), out);
    }

    @Test
    void divisionResultIsTruncatedOnlyForIntegerNames() {
        List<String> out = run(
                "var j = 7 / 2;\n" +
                "var y = 7 / 2;\n" +
                "print j;\n" +
                "print y;\n"
        );
        assertEquals(List.of("3", "3.5"), out);
    }

    @Test
    void assignmentTruncates() {
        List<String> out = run(
                "var m = 0;\n" +
                "m = 7.8;\n" +
                "print m;\n" +
                "m = m / 2;\n" +
                "print m;\n"
        );
        assertEquals(List.of("7", "3"), out);
    }

    @Test
    void integerStringsAndBoolsAreCoerced() {
        List<String> out = run(
                "var k = \"42\";\n" +
                "print k + 1;\n" +
                "var level = true;\n" +
                "print level;\n" +
                "var name = \"bob\";\n" +
                "print name;\n" +
                "var nothing = nil;\n" +
                "print nothing;\n"
        );
        assertEquals(List.of("43", "1", "bob", "nil"), out);
    }

    @Test
    void parametersAreCoerced() {
        List<String> out = run(
                "fun show(n, x) { print n; print x; }\n" +
                "show(4.6, 4.6);\n"
        );
        assertEquals(List.of("4", "4.6"), out);
    }

    @Test
    void fieldsFollowTheSameRule() {
        List<String> out = run(
                "class Box {}\n" +
                "var b = Box();\n" +
                "b.index = 2.5;\n" +
                "b.weight = 2.5;\n" +
                "print b.index;\n" +
                "print b.weight;\n"
        );
        assertEquals(List.of("2", "2.5"), out);
    }

    @Test
    void upperCaseNamesAreNotCoerced() {
        List<String> out = run("var Index = 1.5; print Index;");
        assertEquals(List.of("1.5"), out);
    }

    @Test
    void initialGlobalsAreNotCoerced() {
        LoxScript es = new LoxScript();
        es.setOutput(line -> { });
        Map<String, Value> env = es.run("var copy = input;", Map.of("input", Value.number(2.5)));

        assertEquals(2.5, env.get("input").asNumber(), 0.0);
        assertEquals(2.5, env.get("copy").asNumber(), 0.0);
    }
}
