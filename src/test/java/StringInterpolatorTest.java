import org.junit.jupiter.api.Test;

import com.lox.script.interpolation.StringInterpolator;
import com.lox.script.parser.ScriptError;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StringInterpolatorTest {

    @Test
    void substitutesVariables() {
        assertEquals("foo x bar", StringInterpolator.interpolate("\"foo ${x} bar\"", Map.of("x", "x")));
        assertEquals("1 + 2 = 3", StringInterpolator.interpolate("\"${x} + ${y} = ${_result}\"",
                Map.of("x", "1", "y", "2", "_result", "3")));
    }

    @Test
    void doubleDollarIsALiteralDollar() {
        assertEquals("valor: R$10,00", StringInterpolator.interpolate("\"valor: R$$10,00\"", Map.of()));
        assertEquals("foo ${x} bar", StringInterpolator.interpolate("\"foo $${x} bar\"", Map.of("x", "ignored")));
        assertEquals("$var = ok", StringInterpolator.interpolate("\"$$var = ${var}\"", Map.of("var", "ok")));
    }

    @Test
    void spacesInsideBracesAreIgnored() {
        assertEquals("[v]", StringInterpolator.interpolate("\"[${  name }]\"", Map.of("name", "v")));
    }

    @Test
    void missingVariablesBecomeEmpty() {
        assertEquals("a  b", StringInterpolator.interpolate("\"a ${missing} b\"", Map.of()));
        assertEquals("", StringInterpolator.interpolate("\"${x}\"", null));
        assertEquals("", StringInterpolator.interpolate("\"\"", Map.of()));
    }

    @Test
    void malformedInputIsASyntaxError() {
        String[] bad = { "no quotes", "\"$5\"", "\"${x\"", "\"${1x}\"", "\"${}\"", "\"a\"b\"", "\"" };
        for (String literal : bad) {
            ScriptError e = assertThrows(ScriptError.class, () -> StringInterpolator.interpolate(literal, Map.of()),
                    literal);
            assertEquals(ScriptError.Kind.SYNTAX_ERROR, e.kind(), literal);
        }
    }
}
