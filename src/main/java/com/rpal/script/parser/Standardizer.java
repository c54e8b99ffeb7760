package com.rpal.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.rpal.debug.Debug;

/**
 * Lowers a raw tree to the core calculus: identifiers and literals, {@code gamma},
 * {@code lambda}, {@code tau}, {@code ->} and {@code <Y*>}, plus the operators the machine
 * reduces directly. Children are standardized before the rule for their parent fires, and the
 * input tree is never modified.
 *
 * <pre>
 *   let  (= X E1) E2              =>  gamma (lambda X E2) E1
 *   where E1 (= X E2)             =>  gamma (lambda X E1) E2
 *   function_form P V1..Vn E      =>  = P (lambda V1 (.. (lambda Vn E)))
 *   lambda V1..Vn E               =>  lambda V1 (.. (lambda Vn E))
 *   within (= X1 E1) (= X2 E2)    =>  = X2 (gamma (lambda X1 E2) E1)
 *   and (= X1 E1) .. (= Xn En)    =>  = (, X1..Xn) (tau E1..En)
 *   rec (= X E)                   =>  = X (gamma Y* (lambda X E))
 *   @ E1 N E2                     =>  gamma (gamma N E1) E2
 * </pre>
 */
public final class Standardizer {

    private static final String TAG = "STD";

    private Standardizer() {}

    public static TreeNode standardize(TreeNode node) {
        List<TreeNode> kids = new ArrayList<>(node.arity());
        for (TreeNode c : node.children) kids.add(standardize(c));

        switch (node.type) {
            case LET:
                if (isDefinition(kids.get(0))) {
                    TreeNode def = kids.get(0);
                    return trace(node, gamma(lambda(def.child(0), kids.get(1)), def.child(1)));
                }
                break;

            case WHERE:
                if (isDefinition(kids.get(1))) {
                    TreeNode def = kids.get(1);
                    return trace(node, gamma(lambda(def.child(0), kids.get(0)), def.child(1)));
                }
                break;

            case FCN_FORM: {
                TreeNode name = kids.get(0);
                TreeNode curried = curry(kids.subList(1, kids.size() - 1), kids.get(kids.size() - 1));
                return trace(node, TreeNode.of(NodeType.EQUAL, name, curried));
            }

            case LAMBDA:
                if (kids.size() > 2) {
                    return trace(node, curry(kids.subList(0, kids.size() - 1), kids.get(kids.size() - 1)));
                }
                break;

            case WITHIN:
                if (isDefinition(kids.get(0)) && isDefinition(kids.get(1))) {
                    TreeNode inner = kids.get(0);
                    TreeNode outer = kids.get(1);
                    TreeNode body = gamma(lambda(inner.child(0), outer.child(1)), inner.child(1));
                    return trace(node, TreeNode.of(NodeType.EQUAL, outer.child(0), body));
                }
                break;

            case AND: {
                if (!allDefinitions(kids)) break;
                List<TreeNode> names = new ArrayList<>(kids.size());
                List<TreeNode> values = new ArrayList<>(kids.size());
                for (TreeNode def : kids) {
                    names.add(def.child(0));
                    values.add(def.child(1));
                }
                return trace(node, TreeNode.of(NodeType.EQUAL,
                        TreeNode.of(NodeType.COMMA, names),
                        TreeNode.of(NodeType.TAU, values)));
            }

            case REC: {
                if (!isDefinition(kids.get(0))) break;
                TreeNode def = kids.get(0);
                TreeNode fixed = gamma(TreeNode.leaf(NodeType.YSTAR), lambda(def.child(0), def.child(1)));
                return trace(node, TreeNode.of(NodeType.EQUAL, def.child(0), fixed));
            }

            case AT:
                return trace(node, gamma(gamma(kids.get(1), kids.get(0)), kids.get(2)));

            default:
                break;
        }

        if (node.type.isLeaf()) return node;
        return TreeNode.of(node.type, kids);
    }

    // right-most parameter ends up innermost
    private static TreeNode curry(List<TreeNode> params, TreeNode body) {
        TreeNode out = body;
        for (int i = params.size() - 1; i >= 0; i--) {
            out = lambda(params.get(i), out);
        }
        return out;
    }

    private static boolean isDefinition(TreeNode n) {
        return n.type == NodeType.EQUAL;
    }

    private static boolean allDefinitions(List<TreeNode> nodes) {
        for (TreeNode n : nodes) {
            if (!isDefinition(n)) return false;
        }
        return true;
    }

    private static TreeNode gamma(TreeNode rator, TreeNode rand) {
        return TreeNode.of(NodeType.GAMMA, rator, rand);
    }

    private static TreeNode lambda(TreeNode param, TreeNode body) {
        return TreeNode.of(NodeType.LAMBDA, param, body);
    }

    private static TreeNode trace(TreeNode from, TreeNode to) {
        if (Debug.get().enabled()) Debug.get().t(TAG, from.type.tag + " => " + to.type.tag);
        return to;
    }
}
