package com.bella.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.bella.debug.Debug;
import com.bella.debug.Slf4jDebugSink;
import com.bella.script.ast.AstFormatException;
import com.bella.script.ast.AstJsonReader;
import com.bella.script.ast.Program;
import com.bella.script.interpreter.BellaError;
import com.bella.script.interpreter.Value;
import com.bella.script.interpreter.ValueJson;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs a Bella program given as a JSON syntax tree.
 *
 *   BellaCli [--dump-env] program.json
 *
 * Exit status: 0 ok, 1 evaluation error, 2 usage, 3 unreadable file or malformed tree.
 */
public final class BellaCli {

    static final int EXIT_OK = 0;
    static final int EXIT_RUNTIME_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BAD_INPUT = 3;

    private static final ObjectMapper om = new ObjectMapper();

    public static void main(String[] args) {
        Debug.get().setSink(new Slf4jDebugSink());
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean dumpEnv = false;
        String file = null;
        for (String a : args) {
            if ("--dump-env".equals(a)) {
                dumpEnv = true;
            } else if (file == null && !a.startsWith("--")) {
                file = a;
            } else {
                file = null;
                break;
            }
        }
        if (file == null) {
            err.println("Usage: BellaCli [--dump-env] <program.json>");
            return EXIT_USAGE;
        }

        final Path programPath = Path.of(file);
        final Program program;
        try (InputStream in = Files.newInputStream(programPath)) {
            program = new AstJsonReader(om).read(in);
        } catch (IOException e) {
            err.println("Failed to read program file: " + programPath + " (" + e.getMessage() + ")");
            return EXIT_BAD_INPUT;
        } catch (AstFormatException e) {
            err.println("Malformed program: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        final BellaScript engine = new BellaScript();
        engine.setOutput(out::println);

        final Map<String, Value> env;
        try {
            env = engine.run(program);
        } catch (BellaError e) {
            out.flush();
            err.println(e.diagnostic());
            return EXIT_RUNTIME_ERROR;
        } catch (StackOverflowError e) {
            out.flush();
            err.println("ResourceExhausted: call stack exhausted");
            return EXIT_RUNTIME_ERROR;
        }

        if (dumpEnv) {
            Map<String, Value> user = new LinkedHashMap<>(env);
            user.keySet().removeAll(engine.builtinNames());
            try {
                out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(ValueJson.toJson(user)));
            } catch (IOException e) {
                err.println("Failed to write environment: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
        return EXIT_OK;
    }

    private BellaCli() {}
}
