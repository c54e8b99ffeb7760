import org.junit.jupiter.api.Test;

import com.rpal.script.RpalScript;
import com.rpal.script.cse.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RpalScriptTest {

    private static String eval(String src) {
        return new RpalScript().run(src).toString();
    }

    private static long integer(String src) {
        return new RpalScript().run(src).asInteger();
    }

    private static boolean truth(String src) {
        return new RpalScript().run(src).asTruth();
    }

    @Test
    void let_addsOne() {
        assertEquals(4, integer("let X = 3 in X + 1"));
    }

    @Test
    void arithmetic_precedence() {
        assertEquals(14, integer("2 + 3 * 4"));
        assertEquals(20, integer("(2 + 3) * 4"));
        assertEquals(1024, integer("2 ** 10"));
        assertEquals(-3, integer("-7 / 2"));
        assertEquals(-5, integer("1 - 2 * 3"));
    }

    @Test
    void factorial_viaRecursiveFunctionForm() {
        assertEquals(120, integer("let rec F N = N eq 0 -> 1 | N * F (N - 1) in F 5"));
    }

    @Test
    void factorial_viaRecursiveLambda() {
        assertEquals(720, integer("let rec F = fn N . N eq 0 -> 1 | N * F (N - 1) in F 6"));
    }

    @Test
    void tupleSelection_isOneBased() {
        assertEquals(20, integer("(10, 20, 30) 2"));
        assertEquals(10, integer("let T = (10, 20, 30) in T 1"));
    }

    @Test
    void conditional_onlyEvaluatesChosenArm() {
        assertEquals(1, integer("true -> 1 | 1 / 0"));
        assertEquals(2, integer("false -> 1 / 0 | 2"));
    }

    @Test
    void simultaneousDefinitions_bindTogether() {
        assertEquals("(1, 2)", eval("let X = 1 and Y = 2 in (X, Y)"));
        assertEquals(-1, integer("let Y = 2 and X = 1 in X - Y"));
    }

    @Test
    void where_and_within() {
        assertEquals(42, integer("X * 2 where X = 21"));
        assertEquals(6, integer("let X = 2 within Y = X * 3 in Y"));
    }

    @Test
    void closures_captureTheirDefiningEnvironment() {
        assertEquals("(2, 11)", eval("let F = fn x . x + 1 in (F 1, F 10)"));
        assertEquals("(6, 4)", eval(
                "let Add x y = x + y in\n" +
                "let Inc = Add 1 and Dec = Add (-1) in\n" +
                "(Inc 5, Dec 5)"));
    }

    @Test
    void applicationFrames_doNotLeakIntoCaller() {
        // x inside G refers to the outer binding, not F's parameter
        assertEquals(101, integer(
                "let x = 100 in\n" +
                "let G y = x + y in\n" +
                "let F x = G 1 in\n" +
                "F 5"));
    }

    @Test
    void higherOrderFunctions() {
        assertEquals(18, integer("let Twice f x = f (f x) in Twice (fn n . n * 3) 2"));
    }

    @Test
    void tuplePatternParameters() {
        assertEquals(42, integer("let Mul (a, b) = a * b in Mul (6, 7)"));
        assertEquals(7, integer("let K () = 7 in K nil"));
    }

    @Test
    void recursionOverTuple() {
        assertEquals(10, integer(
                "let rec Sum T N = N eq 0 -> 0 | T N + Sum T (N - 1) in\n" +
                "let T = (1, 2, 3, 4) in\n" +
                "Sum T (Order T)"));
    }

    @Test
    void infixAt_appliesNamedFunction() {
        assertEquals(5, integer("let Add x y = x + y in 2 @Add 3"));
    }

    @Test
    void aug_buildsTuples() {
        assertEquals("(1, 2)", eval("nil aug 1 aug 2"));
        assertEquals("(5)", eval("nil aug 5"));
        assertEquals("(1, 2, 3, 4)", eval("(1, 2) aug (3, 4)"));
    }

    @Test
    void plus_concatenatesStringsAndTuples() {
        assertEquals("abcd", eval("'ab' + 'cd'"));
        assertEquals("(1, 2, 3)", eval("(1, 2) + (nil aug 3)"));
    }

    @Test
    void comparisonsAndLogic() {
        assertTrue(truth("3 gr 2"));
        assertFalse(truth("2 >= 3"));
        assertTrue(truth("2 < 3 & 3 <= 3"));
        assertTrue(truth("'a' eq 'a'"));
        assertTrue(truth("(1, 'x') eq (1, 'x')"));
        assertTrue(truth("1 ne 2"));
        assertTrue(truth("not false or false"));
    }

    @Test
    void equality_acrossTypesIsFalse() {
        assertFalse(truth("1 eq 'a'"));
        assertTrue(truth("'a' ne 1"));
        assertFalse(truth("nil eq dummy"));
        assertFalse(truth("(1, 'x') eq ('x', 1)"));
        assertTrue(truth("(1, (true, 'x')) eq (1, (true, 'x'))"));
    }

    @Test
    void typeGuard_withStrictAnd() {
        assertEquals(2, integer("let F x = (Isinteger x) & (x eq 0) -> 1 | 2 in F 'a'"));
        assertEquals(1, integer("let F x = (Isinteger x) & (x eq 0) -> 1 | 2 in F 0"));
    }

    @Test
    void predicates() {
        assertTrue(truth("Isinteger 5"));
        assertFalse(truth("Isinteger 'x'"));
        assertTrue(truth("Istuple nil"));
        assertTrue(truth("Istuple (1, 2)"));
        assertTrue(truth("Null nil"));
        assertFalse(truth("Null (nil aug 1)"));
        assertTrue(truth("Istruthvalue false"));
        assertTrue(truth("Isstring 'a'"));
        assertTrue(truth("Isdummy dummy"));
        assertTrue(truth("Isfunction Print"));
        assertTrue(truth("Isfunction (fn x . x)"));
        assertFalse(truth("Isfunction 3"));
    }

    @Test
    void stringBuiltins() {
        assertEquals("h", eval("Stem 'hello'"));
        assertEquals("ello", eval("Stern 'hello'"));
        assertEquals("abcd", eval("Conc 'ab' 'cd'"));
        assertEquals("(xy, xz)", eval("let C = Conc 'x' in (C 'y', C 'z')"));
        assertEquals("42", eval("ItoS 42"));
        assertEquals(Value.Type.STRING, new RpalScript().run("ItoS 42").getType());
        assertEquals(3, integer("Order (1, 2, 3)"));
        assertEquals(0, integer("Order nil"));
    }

    @Test
    void print_writesToConfiguredStream() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        RpalScript es = new RpalScript();
        es.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));

        Value result = es.run("Print (1, 'a', true, nil)");

        assertEquals("(1, a, true, nil)", buf.toString(StandardCharsets.UTF_8));
        assertEquals(Value.Type.DUMMY, result.getType());
        assertTrue(es.hasPrinted());
    }

    @Test
    void print_translatesEscapes() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        RpalScript es = new RpalScript();
        es.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));

        es.run("Print 'a\\nb\\tc'");

        assertEquals("a\nb\tc", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void print_tupleItemsEvaluateLeftToRight() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        RpalScript es = new RpalScript();
        es.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));

        es.run("(Print 1, print 2, Print 3)");

        assertEquals("123", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void results_renderInDisplayForm() {
        assertEquals("nil", eval("nil"));
        assertEquals("", eval("dummy"));
        assertEquals("true", eval("true"));
        assertEquals("[lambda closure: x: 1]", eval("fn x . x"));
        assertEquals("[eta closure: f: 1]", eval("let rec f n = n in f"));
        assertEquals("Print", eval("Print"));
    }

    @Test
    void registeredFunction_isCurriedLikeBuiltins() {
        RpalScript es = new RpalScript();
        es.registerFunction("Max", 2, args -> Value.integer(Math.max(args.get(0).asInteger(), args.get(1).asInteger())));

        assertTrue(es.hasFunction("Max"));
        assertEquals(9, es.run("Max 4 9").asInteger());
        assertEquals("(5, 7)", es.run("let M = Max 5 in (M 1, M 7)").toString());
    }

    @Test
    void registerFunction_rejectsZeroArity() {
        RpalScript es = new RpalScript();
        assertThrows(IllegalArgumentException.class, () -> es.registerFunction("Nothing", 0, args -> Value.dummy()));
    }

    @Test
    void runRawTree_fromParser() {
        RpalScript es = new RpalScript();
        assertEquals(9, es.run(es.parse("let Sq x = x * x in Sq 3")).asInteger());
    }
}
