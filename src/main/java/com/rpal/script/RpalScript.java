package com.rpal.script;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rpal.debug.Debug;
import com.rpal.script.cse.ControlBlock;
import com.rpal.script.cse.ControlLinearizer;
import com.rpal.script.cse.CseMachine;
import com.rpal.script.cse.Value;
import com.rpal.script.parser.Lexer;
import com.rpal.script.parser.Parser;
import com.rpal.script.parser.Standardizer;
import com.rpal.script.parser.Token;
import com.rpal.script.parser.TreeNode;

/**
 * Core RPAL engine.
 *
 * - Pipeline: source -> tokens -> raw tree -> standardized tree -> control blocks -> CSE machine
 * - Types: integer, truth value, string, tuple (nil is the empty tuple), function, dummy
 * - Built-ins live in the primitive environment and are curried one argument at a time
 * - Print writes to {@link #setOut(PrintStream)} (System.out by default)
 * - Every failure is an {@link RpalRuntimeException}; nothing is recovered
 */
public class RpalScript {

    /** Functional interface for built-in functions; receives exactly {@code arity} arguments. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Observer for failures; notified before the exception reaches the caller. */
    public interface SystemErrorReporter {
        void report(RpalRuntimeException e, String stage, String message);
    }

    private static final String TAG = "RPAL";

    private final Map<String, Value> functions = new LinkedHashMap<>();
    private PrintStream out = System.out;
    private boolean printed = false;
    private long maxSteps = 0;
    private SystemErrorReporter errorReporter = null;

    public RpalScript() {
        registerCoreBuiltins();
    }

    public void setOut(PrintStream out) { this.out = (out == null) ? System.out : out; }

    public void setMaxSteps(long maxSteps) { this.maxSteps = maxSteps; }

    public long getMaxSteps() { return maxSteps; }

    public void setErrorReporter(SystemErrorReporter reporter) { this.errorReporter = reporter; }

    /** True once any Print call has written to the output stream. */
    public boolean hasPrinted() { return printed; }

    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        if (arity < 1) throw new IllegalArgumentException("Built-in '" + name + "' must take at least one argument");
        functions.put(name, Value.builtin(new Value.Builtin(name, arity, fn)));
    }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    // ===================== PIPELINE =====================

    public TreeNode parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        return guarded("parse", () -> {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Parser(tokens).parse();
        });
    }

    public TreeNode standardize(String source) {
        return Standardizer.standardize(parse(source));
    }

    public List<ControlBlock> linearize(String source) {
        return ControlLinearizer.linearize(standardize(source));
    }

    public Value run(String source) {
        return run(parse(source));
    }

    /** Evaluates a raw (un-standardized) tree, e.g. one supplied by an external parser. */
    public Value run(TreeNode raw) {
        List<ControlBlock> blocks = guarded("standardize",
                () -> ControlLinearizer.linearize(Standardizer.standardize(raw)));
        return guarded("execute", () -> new CseMachine(blocks, functions, maxSteps).run());
    }

    public String render(Value v) {
        return String.valueOf(v);
    }

    private interface Stage<T> {
        T get();
    }

    private <T> T guarded(String stage, Stage<T> body) {
        try {
            return body.get();
        } catch (RpalRuntimeException e) {
            onInterpreterError(e, stage);
            throw e;
        } catch (IllegalArgumentException e) {
            // malformed input tree
            Debug.get().e(TAG, stage + " failed: " + e.getMessage(), e);
            throw e;
        }
    }

    private void onInterpreterError(RpalRuntimeException e, String stage) {
        Debug.get().e(TAG, stage + " failed [" + e.kind() + "]: " + e.getMessage());
        if (errorReporter == null) return;
        try {
            errorReporter.report(e, stage, e.getMessage());
        } catch (RuntimeException reporterFailure) {
            Debug.get().e(TAG, "error reporter failed", reporterFailure);
        }
    }

    // ===================== BUILT-INS =====================

    private void registerCoreBuiltins() {
        BuiltinFunction print = args -> {
            out.print(printable(args.get(0)));
            out.flush();
            printed = true;
            return Value.dummy();
        };
        registerFunction("Print", 1, print);
        registerFunction("print", 1, print);

        registerFunction("Stem", 1, args -> {
            String s = requireString("Stem", args.get(0));
            if (s.isEmpty()) throw RpalRuntimeException.type("Stem() expects a non-empty string");
            return Value.string(s.substring(0, 1));
        });

        registerFunction("Stern", 1, args -> {
            String s = requireString("Stern", args.get(0));
            if (s.isEmpty()) throw RpalRuntimeException.type("Stern() expects a non-empty string");
            return Value.string(s.substring(1));
        });

        registerFunction("Conc", 2, args ->
                Value.string(requireString("Conc", args.get(0)) + requireString("Conc", args.get(1))));

        registerFunction("Order", 1, args -> {
            Value v = args.get(0);
            if (v.getType() != Value.Type.TUPLE) throw RpalRuntimeException.type("Order() expects a tuple, got " + v.getType());
            return Value.integer(v.asTuple().size());
        });

        registerFunction("Null", 1, args -> {
            Value v = args.get(0);
            return Value.truth(v.getType() == Value.Type.TUPLE && v.asTuple().isEmpty());
        });

        registerFunction("Isinteger", 1, args -> Value.truth(args.get(0).getType() == Value.Type.INTEGER));
        registerFunction("Istruthvalue", 1, args -> Value.truth(args.get(0).getType() == Value.Type.TRUTH));
        registerFunction("Isstring", 1, args -> Value.truth(args.get(0).getType() == Value.Type.STRING));
        registerFunction("Istuple", 1, args -> Value.truth(args.get(0).getType() == Value.Type.TUPLE));
        registerFunction("Isfunction", 1, args -> Value.truth(args.get(0).isFunction()));
        registerFunction("Isdummy", 1, args -> Value.truth(args.get(0).getType() == Value.Type.DUMMY));

        registerFunction("ItoS", 1, args -> {
            Value v = args.get(0);
            if (v.getType() != Value.Type.INTEGER) throw RpalRuntimeException.type("ItoS() expects an integer, got " + v.getType());
            return Value.string(Long.toString(v.asInteger()));
        });
    }

    // \n and \t inside strings are written as real newline / tab
    private static String printable(Value v) {
        if (v.getType() != Value.Type.STRING) return v.toString();
        return v.asString().replace("\\n", "\n").replace("\\t", "\t");
    }

    private static String requireString(String name, Value v) {
        if (v.getType() != Value.Type.STRING) {
            throw RpalRuntimeException.type(name + "() expects a string, got " + v.getType());
        }
        return v.asString();
    }
}
