import org.junit.jupiter.api.Test;

import com.lox.script.LoxScript;
import com.lox.script.parser.ScriptError;
import com.lox.script.parser.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LoxScriptClassTest {

    private static List<String> run(String src) {
        List<String> out = new ArrayList<>();
        LoxScript es = new LoxScript();
        es.setOutput(out::add);
        es.run(src);
        return out;
    }

    private static ScriptError fails(String src) {
        LoxScript es = new LoxScript();
        es.setOutput(line -> { });
        return assertThrows(ScriptError.class, () -> es.run(src));
    }

    @Test
    void initializerSetsFields() {
        List<String> out = run(
                "class Point {\n" +
                "  init(x, y) { this.x = x; this.y = y; }\n" +
                "  sum() { return this.x + this.y; }\n" +
                "}\n" +
                "var p = Point(3, 4);\n" +
                "print p.x;\n" +
                "print p.sum();\n"
        );
        assertEquals(List.of("3", "7"), out);
    }

    @Test
    void fieldsCanBeAddedAndUpdatedFromOutside() {
        List<String> out = run(
                "class Bag {}\n" +
                "var b = Bag();\n" +
                "b.color = \"red\";\n" +
                "print b.color;\n" +
                "b.color = \"blue\";\n" +
                "print b.color;\n"
        );
        assertEquals(List.of("red", "blue"), out);
    }

    @Test
    void fieldsShadowMethods() {
        List<String> out = run(
                "class A { greet() { return \"method\"; } }\n" +
                "var a = A();\n" +
                "print a.greet();\n" +
                "a.greet = \"field\";\n" +
                "print a.greet;\n"
        );
        assertEquals(List.of("method", "field"), out);
    }

    @Test
    void boundMethodsKeepTheirReceiver() {
        List<String> out = run(
                "class Cat {\n" +
                "  init(sound) { this.sound = sound; }\n" +
                "  speak() { return this.sound; }\n" +
                "}\n" +
                "var speak = Cat(\"meow\").speak;\n" +
                "print speak();\n"
        );
        assertEquals(List.of("meow"), out);
    }

    @Test
    void methodsAreInheritedThroughTheChain() {
        List<String> out = run(
                "class A { hello() { return \"A.hello\"; } }\n" +
                "class B < A {}\n" +
                "class C < B {}\n" +
                "print C().hello();\n"
        );
        assertEquals(List.of("A.hello"), out);
    }

    @Test
    void superResolvesFromTheDefiningClass() {
        List<String> out = run(
                "class A { method() { return \"A\"; } }\n" +
                "class B < A { method() { return \"B>\" + super.method(); } }\n" +
                "class C < B {}\n" +
                "print C().method();\n"
        );
        assertEquals(List.of("B>A"), out);
    }

    @Test
    void superChainsAcrossThreeLevels() {
        List<String> out = run(
                "class A { method() { return \"A\"; } }\n" +
                "class B < A { method() { return \"B>\" + super.method(); } }\n" +
                "class C < B { method() { return \"C>\" + super.method(); } }\n" +
                "print C().method();\n"
        );
        assertEquals(List.of("C>B>A"), out);
    }

    @Test
    void superBindsTheCurrentInstance() {
        List<String> out = run(
                "class Base { describe() { return \"I am \" + this.name; } }\n" +
                "class Derived < Base {\n" +
                "  init(name) { this.name = name; }\n" +
                "  describe() { return super.describe() + \"!\"; }\n" +
                "}\n" +
                "print Derived(\"derived\").describe();\n"
        );
        assertEquals(List.of("I am derived!"), out);
    }

    @Test
    void inheritedInitializerRunsForSubclass() {
        List<String> out = run(
                "class A { init(v) { this.v = v; } }\n" +
                "class B < A {}\n" +
                "print B(\"ok\").v;\n"
        );
        assertEquals(List.of("ok"), out);
    }

    @Test
    void instancesCompareByIdentity() {
        List<String> out = run(
                "class P {}\n" +
                "var a = P();\n" +
                "var b = a;\n" +
                "print a == b;\n" +
                "print P() == P();\n"
        );
        assertEquals(List.of("true", "false"), out);
    }

    @Test
    void instancesAreSharedByReference() {
        List<String> out = run(
                "class P {}\n" +
                "fun mutate(obj) { obj.value = \"changed\"; }\n" +
                "var a = P();\n" +
                "a.value = \"original\";\n" +
                "mutate(a);\n" +
                "print a.value;\n"
        );
        assertEquals(List.of("changed"), out);
    }

    @Test
    void hostSeesInstanceFields() {
        LoxScript es = new LoxScript();
        es.setOutput(line -> { });
        Map<String, Value> env = es.run("class P { init() { this.name = \"p\"; } } var p = P();");

        Value.ClassInstance p = env.get("p").asInstance();
        assertEquals("P", p.klass.name);
        assertEquals("p", p.fieldsView().get("name").asString());
        assertThrows(UnsupportedOperationException.class, () -> p.fieldsView().put("x", Value.nil()));
    }

    @Test
    void undefinedAttributeIsAnAttributeError() {
        ScriptError e = fails("class A {} print A().missing;");
        assertEquals(ScriptError.Kind.ATTRIBUTE_ERROR, e.kind());
    }

    @Test
    void attributeOnNonInstanceIsAnAttributeError() {
        assertEquals(ScriptError.Kind.ATTRIBUTE_ERROR, fails("var x = 1; print x.field;").kind());
        assertEquals(ScriptError.Kind.ATTRIBUTE_ERROR, fails("var s = \"str\"; s.field = 1;").kind());
    }

    @Test
    void missingSuperMethodIsAnAttributeError() {
        ScriptError e = fails(
                "class A {}\n" +
                "class B < A { m() { return super.missing(); } }\n" +
                "B().m();\n"
        );
        assertEquals(ScriptError.Kind.ATTRIBUTE_ERROR, e.kind());
    }

    @Test
    void undefinedSuperclassIsANameError() {
        assertEquals(ScriptError.Kind.NAME_ERROR, fails("class B < Missing {}").kind());
    }

    @Test
    void nonClassSuperclassIsATypeError() {
        assertEquals(ScriptError.Kind.TYPE_ERROR, fails("var NotAClass = 1; class B < NotAClass {}").kind());
    }

    @Test
    void thisOutsideMethodIsANameError() {
        assertEquals(ScriptError.Kind.NAME_ERROR, fails("print this;").kind());
    }

    @Test
    void constructorArityIsChecked() {
        assertEquals(ScriptError.Kind.ARITY_ERROR, fails("class A { init(x) {} } A();").kind());
        assertEquals(ScriptError.Kind.ARITY_ERROR, fails("class A {} A(1);").kind());
    }
}
