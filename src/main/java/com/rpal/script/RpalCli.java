package com.rpal.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.rpal.debug.Debug;
import com.rpal.debug.DebugLevel;
import com.rpal.protocol.util.TreeJson;
import com.rpal.script.cse.Value;
import com.rpal.script.parser.Standardizer;
import com.rpal.script.parser.TreeNode;

public final class RpalCli {

    private static final String USAGE =
            "Usage: RpalCli [-l] [-ast] [-st] [-r] [-json] [--maxSteps=N] [--trace] <file>";

    public static void main(String[] args) {
        int code = execute(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /**
     * Runs one invocation and returns the process exit code:
     * 0 ok, 1 language error, 2 usage error, 3 unreadable input.
     */
    public static int execute(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE);
            return 2;
        }

        final Map<String, String> flags;
        try {
            flags = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        final Path sourcePath = Path.of(args[args.length - 1]);
        final String source;
        try {
            source = Files.readString(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read source file: " + sourcePath);
            return 3;
        }

        if (flags.containsKey("trace")) Debug.useSysOut(DebugLevel.TRACE);

        final RpalScript engine = new RpalScript();
        engine.setOut(out);
        if (flags.containsKey("maxSteps")) {
            try {
                engine.setMaxSteps(Long.parseLong(flags.get("maxSteps")));
            } catch (NumberFormatException e) {
                err.println("--maxSteps expects a number, got: " + flags.get("maxSteps"));
                return 2;
            }
        }

        boolean json = flags.containsKey("json");
        boolean listing = flags.containsKey("l");
        boolean ast = flags.containsKey("ast");
        boolean st = flags.containsKey("st");
        boolean result = flags.containsKey("r");

        try {
            if (listing) {
                out.println(source);
                out.println();
            }

            if (!ast && !st && !result && listing) return 0;

            TreeNode raw = sourcePath.toString().endsWith(".json")
                    ? TreeJson.readTree(source)
                    : engine.parse(source);

            if (ast) printTree(out, raw, json);
            if (st) printTree(out, Standardizer.standardize(raw), json);
            if (ast || st) {
                if (!result) return 0;
            }

            Value value = engine.run(raw);
            if (result) {
                if (engine.hasPrinted()) out.println();
                out.println(json ? TreeJson.pretty(TreeJson.toJson(value)) : engine.render(value));
            } else if (engine.hasPrinted()) {
                out.println();
            }
            return 0;
        } catch (RpalRuntimeException e) {
            out.flush();
            err.println("Error [" + e.kind() + "]: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Invalid tree input: " + e.getMessage());
            return 3;
        } finally {
            if (flags.containsKey("trace")) Debug.reset();
        }
    }

    private static void printTree(PrintStream out, TreeNode tree, boolean json) {
        if (json) {
            out.println(TreeJson.pretty(TreeJson.toJson(tree)));
        } else {
            out.print(tree.render());
        }
        out.println();
    }

    /**
     * Minimal arg parser (the last argument is the source file):
     *   -l -ast -st -r -json
     *   --maxSteps=100000 --trace
     */
    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < args.length - 1; i++) {
            String a = args[i];
            if (a.startsWith("--") && a.contains("=")) {
                int eq = a.indexOf('=');
                out.put(a.substring(2, eq), a.substring(eq + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else if (a.startsWith("-")) {
                out.put(a.substring(1), "true");
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + a);
            }
        }
        for (String k : out.keySet()) {
            switch (k) {
                case "l": case "ast": case "st": case "r": case "json": case "maxSteps": case "trace":
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + k);
            }
        }
        return out;
    }

    private RpalCli() {}
}
