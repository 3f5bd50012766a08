package com.lox.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.lox.debug.Debug;
import com.lox.script.parser.ParseTree;
import com.lox.script.parser.ScriptError;
import com.lox.script.parser.Value;
import com.lox.script.parser.utils.AstJson;
import com.lox.script.parser.utils.AstPrinter;
import com.lox.script.parser.utils.ParseTreeJson;

public final class LoxCli {

    private static final String USAGE = "Usage: LoxCli [--debug] [--ast | --ast-json | --parse-tree] <script-file>";

    enum Action { RUN, AST, AST_JSON, PARSE_TREE }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Action action = Action.RUN;
        String file = null;

        for (String arg : args) {
            switch (arg) {
                case "--debug": Debug.useStdErr(); break;
                case "--ast": action = Action.AST; break;
                case "--ast-json": action = Action.AST_JSON; break;
                case "--parse-tree": action = Action.PARSE_TREE; break;
                default:
                    if (arg.startsWith("--") || file != null) {
                        System.err.println(USAGE);
                        return 2;
                    }
                    file = arg;
            }
        }
        if (file == null) {
            System.err.println(USAGE);
            return 2;
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            Debug.get().e("LoxCli", "read failed: " + scriptPath, e);
            return 3;
        }

        final LoxScript engine = new LoxScript();
        engine.registerFunction("clock", 0, a -> Value.number(System.currentTimeMillis() / 1000.0));

        try {
            switch (action) {
                case AST:
                    System.out.print(AstPrinter.print(engine.parse(script)));
                    break;
                case AST_JSON:
                    System.out.println(AstJson.write(engine.parse(script)));
                    break;
                case PARSE_TREE: {
                    ParseTree tree = engine.parseTree(script);
                    System.out.println(ParseTreeJson.write(tree));
                    break;
                }
                default:
                    engine.run(script);
            }
            return 0;
        } catch (ScriptError e) {
            System.out.flush();
            System.err.println(e);
            return 1;
        }
    }

    private LoxCli() {}
}
