import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lox.script.LoxScript;
import com.lox.script.parser.Expr;
import com.lox.script.parser.Program;
import com.lox.script.parser.utils.AstCursor;
import com.lox.script.parser.utils.AstJson;
import com.lox.script.parser.utils.AstPrinter;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AstUtilsTest {

    private static Program parse(String src) {
        return new LoxScript().parse(src);
    }

    @Test
    void printerIndentsByDepth() {
        String dump = AstPrinter.print(parse("print 1 + 2;"));
        assertEquals(
                "Program\n" +
                "  Print\n" +
                "    BinOp +\n" +
                "      Literal 1\n" +
                "      Literal 2\n",
                dump);
    }

    @Test
    void printerShowsDesugaredForLoop() {
        String dump = AstPrinter.print(parse("for (var i = 0; i < 2; i = i + 1) print i;"));
        assertTrue(dump.contains("  Block\n    VarDecl i\n      Literal 0\n    While\n"), dump);
    }

    @Test
    void cursorFindsNodesByType() {
        AstCursor root = AstCursor.of(parse("var a = 1; print a + 2; print \"s\";"));

        List<Expr.Literal> literals = root.find(Expr.Literal.class);
        assertEquals(3, literals.size());
        assertEquals(1, root.find(Expr.Var.class).size());
    }

    @Test
    void cursorTracksPathAndDepth() {
        AstCursor root = AstCursor.of(parse("print -x;"));

        AstCursor var = root.stream()
                .filter(c -> c.node() instanceof Expr.Var)
                .findFirst()
                .orElseThrow();

        assertEquals(3, var.depth());
        assertEquals(List.of("Program", "Print", "UnaryOp -", "Var x"), var.path());
        assertTrue(root.parent().isEmpty());
        assertEquals("UnaryOp -", var.parent().orElseThrow().node().label());
    }

    @Test
    void streamIsPreOrder() {
        List<String> labels = AstCursor.of(parse("print 1 * 2;")).stream()
                .map(c -> c.node().label())
                .collect(Collectors.toList());
        assertEquals(List.of("Program", "Print", "BinOp *", "Literal 1", "Literal 2"), labels);
    }

    @Test
    void jsonNestsChildren() {
        ObjectNode json = AstJson.toJson(parse("print \"hi\";"));

        assertEquals("Program", json.get("node").asText());
        ObjectNode print = (ObjectNode) json.get("children").get(0);
        assertEquals("Print", print.get("node").asText());

        ObjectNode literal = (ObjectNode) print.get("children").get(0);
        assertEquals("Literal \"hi\"", literal.get("node").asText());
        assertFalse(literal.has("children"));
    }

    @Test
    void jsonWriteIsParseable() throws Exception {
        String text = AstJson.write(parse("var x = 1;"));
        assertTrue(text.contains("\"VarDecl x\""), text);
        assertNotNull(new com.fasterxml.jackson.databind.ObjectMapper().readTree(text));
    }
}
