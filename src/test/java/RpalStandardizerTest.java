import org.junit.jupiter.api.Test;

import com.rpal.script.RpalScript;
import com.rpal.script.parser.NodeType;
import com.rpal.script.parser.Standardizer;
import com.rpal.script.parser.TreeNode;

import static org.junit.jupiter.api.Assertions.*;

public class RpalStandardizerTest {

    private final RpalScript es = new RpalScript();

    private String st(String src) {
        return es.standardize(src).toString();
    }

    @Test
    void let_becomesAppliedLambda() {
        assertEquals("gamma(lambda(<ID:X>,+(<ID:X>,<INT:1>)),<INT:3>)", st("let X = 3 in X + 1"));
    }

    @Test
    void where_matchesEquivalentLet() {
        assertEquals(st("let X = 3 in X + 1"), st("X + 1 where X = 3"));
    }

    @Test
    void functionForm_curriesParameters() {
        assertEquals("gamma(lambda(<ID:f>,<ID:f>),lambda(<ID:x>,lambda(<ID:y>,<ID:x>)))",
                st("let f x y = x in f"));
    }

    @Test
    void multiParameterLambda_isCurried() {
        assertEquals("lambda(<ID:x>,lambda(<ID:y>,<ID:x>))", st("fn x y . x"));
    }

    @Test
    void rec_introducesYStar() {
        assertEquals(
                "gamma(lambda(<ID:f>,<ID:f>),gamma(<Y*>,lambda(<ID:f>,lambda(<ID:n>,gamma(<ID:f>,<ID:n>)))))",
                st("let rec f n = f n in f"));
    }

    @Test
    void and_becomesTuplePatternOverTau() {
        assertEquals("gamma(lambda(,(<ID:x>,<ID:y>),<ID:x>),tau(<INT:1>,<INT:2>))",
                st("let x = 1 and y = 2 in x"));
    }

    @Test
    void within_scopesInnerDefinition() {
        assertEquals("gamma(lambda(<ID:y>,<ID:y>),gamma(lambda(<ID:x>,<ID:x>),<INT:1>))",
                st("let x = 1 within y = x in y"));
    }

    @Test
    void at_becomesDoubleApplication() {
        assertEquals("gamma(gamma(<ID:f>,<ID:x>),<ID:y>)", st("x @ f y"));
    }

    @Test
    void operatorsAndConditionals_passThrough() {
        assertEquals("->(gr(<ID:a>,<INT:0>),neg(<ID:a>),aug(<nil>,<ID:a>))",
                st("a > 0 -> -a | (nil aug a)"));
    }

    @Test
    void nestedDefinitions_standardizedBottomUp() {
        TreeNode t = es.standardize("let f = fn x . let y = x in y where z = 1 in f");
        assertNoSugar(t);
    }

    @Test
    void standardize_isIdempotent() {
        String[] programs = {
                "let X = 3 in X + 1",
                "let rec F N = N eq 0 -> 1 | N * F (N - 1) in F 5",
                "let x = 1 and y = 2 within z = x + y in z",
                "f x where f (a, b) = a",
                "2 @ g 3"
        };
        for (String p : programs) {
            TreeNode once = es.standardize(p);
            assertEquals(once, Standardizer.standardize(once), p);
        }
    }

    @Test
    void standardize_leavesInputUntouched() {
        TreeNode raw = es.parse("let x = 1 and y = 2 in x + y");
        TreeNode copy = es.parse("let x = 1 and y = 2 in x + y");

        Standardizer.standardize(raw);
        assertEquals(copy, raw);
    }

    private static void assertNoSugar(TreeNode n) {
        switch (n.type) {
            case LET: case WHERE: case WITHIN: case AND: case REC: case AT: case FCN_FORM: case EQUAL:
                fail("unexpected " + n.type + " in " + n);
                break;
            default:
                break;
        }
        if (n.type == NodeType.LAMBDA) assertEquals(2, n.arity());
        for (TreeNode c : n.children) assertNoSugar(c);
    }
}
