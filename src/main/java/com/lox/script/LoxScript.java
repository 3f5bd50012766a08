package com.lox.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lox.debug.Debug;
import com.lox.script.parser.Interpreter;
import com.lox.script.parser.Lexer;
import com.lox.script.parser.LoxCallable;
import com.lox.script.parser.NativeFunction;
import com.lox.script.parser.ParseTree;
import com.lox.script.parser.Parser;
import com.lox.script.parser.PrintSink;
import com.lox.script.parser.Program;
import com.lox.script.parser.RunResult;
import com.lox.script.parser.ScopeEnvironment;
import com.lox.script.parser.ScriptError;
import com.lox.script.parser.TreeBuilder;
import com.lox.script.parser.Value;
import com.lox.script.parser.utils.ParseTreeJson;

/**
 * Host entry point of the engine.
 *
 * - C-like syntax: var / fun / class / if / else / while / for / print / return
 * - Values: number (double), bool, string, nil, functions, classes, instances
 * - Closures capture their scope by reference; classes have single inheritance
 * - Names starting with i..n hold integers (assigned values are truncated)
 * - Host natives via registerFunction
 *
 * Pipeline: source -> Lexer -> Parser (ParseTree) -> TreeBuilder (Program) -> Interpreter.
 */
public class LoxScript {
    private static final String TAG = "LoxScript";

    /** Functional interface for host-provided functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Hook notified of every failure before it is rethrown to the host. */
    public interface ErrorReporter {
        void report(ScriptError error);
    }

    public static final int DEFAULT_MAX_CALL_DEPTH = 10_000;

    private final Map<String, NativeFunction> functions = new LinkedHashMap<>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private PrintSink output = PrintSink.stdout();
    private ErrorReporter errorReporter = null;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("Max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setOutput(PrintSink output) {
        this.output = (output == null) ? PrintSink.stdout() : output;
    }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    /**
     * Registers a native bound as a global before each run.
     * Use {@link LoxCallable#VARIADIC} as arity to accept any argument count.
     */
    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Function name must not be empty");
        if (fn == null) throw new IllegalArgumentException("Function must not be null: " + name);
        functions.put(name, new NativeFunction(name, arity, fn));
    }

    // -------------------------
    // Front-end
    // -------------------------

    public ParseTree.Node parseTree(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public Program build(ParseTree tree) {
        return new TreeBuilder().build(tree);
    }

    public Program parse(String source) {
        return build(parseTree(source));
    }

    // -------------------------
    // Execution
    // -------------------------

    /** Runs a script and returns the global bindings afterwards. */
    public Map<String, Value> run(String source) {
        return runWithResult(source, null).globals();
    }

    /** Runs a script against pre-populated globals. */
    public Map<String, Value> run(String source, Map<String, Value> initialGlobals) {
        return runWithResult(source, initialGlobals).globals();
    }

    public RunResult runWithResult(String source) {
        return runWithResult(source, null);
    }

    public RunResult runWithResult(String source, Map<String, Value> initialGlobals) {
        Program program = guarded(() -> parse(source));
        return execute(program, initialGlobals);
    }

    /** Runs a parse tree produced by an external front-end and serialized as JSON. */
    public RunResult runParseTreeJson(String json) {
        Program program = guarded(() -> build(ParseTreeJson.read(json)));
        return execute(program, null);
    }

    public RunResult execute(Program program, Map<String, Value> initialGlobals) {
        ScopeEnvironment globals = new ScopeEnvironment(initialGlobals);
        for (NativeFunction fn : functions.values()) {
            if (!globals.existsInCurrentScope(fn.name())) globals.declare(fn.name(), Value.func(fn));
        }

        Interpreter interpreter = new Interpreter(globals, output, maxCallDepth);
        Debug.get().d(TAG, "run: " + program.statements.size() + " top-level statements");

        Value value = guarded(() -> interpreter.execute(program));
        Debug.get().d(TAG, "run finished");
        return new RunResult(globals.snapshot(), value);
    }

    /**
     * Calls a script value (function or class) from host code, e.g. a function taken
     * from the globals returned by {@link #run(String)}. Functions run in their own closure.
     */
    public Value call(Value callee, List<Value> args) {
        Interpreter interpreter = new Interpreter(new ScopeEnvironment(), output, maxCallDepth);
        return guarded(() -> interpreter.call(callee, args));
    }

    private interface Step<T> {
        T run();
    }

    private <T> T guarded(Step<T> step) {
        try {
            return step.run();
        } catch (ScriptError e) {
            Debug.get().e(TAG, e.toString(), e);
            if (errorReporter != null) errorReporter.report(e);
            throw e;
        } catch (StackOverflowError e) {
            ScriptError wrapped = new ScriptError(ScriptError.Kind.RECURSION_DEPTH,
                    "Java stack exhausted; lower the max call depth");
            Debug.get().e(TAG, wrapped.toString(), e);
            if (errorReporter != null) errorReporter.report(wrapped);
            throw wrapped;
        }
    }
}
