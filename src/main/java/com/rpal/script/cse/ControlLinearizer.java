package com.rpal.script.cse;

import java.util.ArrayList;
import java.util.List;

import com.rpal.debug.Debug;
import com.rpal.script.parser.NodeType;
import com.rpal.script.parser.TreeNode;

/**
 * Flattens a standardized tree into control blocks. Block 0 is the program body; every
 * lambda body and every conditional arm gets its own block, numbered in the order a
 * depth-first walk meets them, so a given tree always yields the same indices.
 *
 * <p>Operands are laid out before their operator: {@code gamma} evaluates its rand, then its
 * rator; binary operators and {@code tau} evaluate left to right.
 */
public final class ControlLinearizer {

    private static final String TAG = "LIN";

    private final List<List<Instruction>> blocks = new ArrayList<>();

    private ControlLinearizer() {}

    public static List<ControlBlock> linearize(TreeNode standardized) {
        ControlLinearizer lin = new ControlLinearizer();
        int top = lin.allocate();
        lin.walk(standardized, lin.blocks.get(top));

        List<ControlBlock> out = new ArrayList<>(lin.blocks.size());
        for (int i = 0; i < lin.blocks.size(); i++) {
            out.add(new ControlBlock(i, lin.blocks.get(i)));
        }
        if (Debug.get().enabled()) {
            for (ControlBlock b : out) Debug.get().d(TAG, b.toString());
        }
        return out;
    }

    private int allocate() {
        blocks.add(new ArrayList<>());
        return blocks.size() - 1;
    }

    private void walk(TreeNode node, List<Instruction> out) {
        switch (node.type) {
            case LAMBDA: {
                int k = allocate();
                out.add(lambdaOf(node.child(0), k));
                walk(node.child(1), blocks.get(k));
                return;
            }
            case CONDITIONAL: {
                walk(node.child(0), out);
                int thenBlock = allocate();
                walk(node.child(1), blocks.get(thenBlock));
                int elseBlock = allocate();
                walk(node.child(2), blocks.get(elseBlock));
                out.add(Instruction.conditional(thenBlock, elseBlock));
                return;
            }
            case GAMMA:
                walk(node.child(1), out);
                walk(node.child(0), out);
                out.add(Instruction.gamma());
                return;
            case TAU:
                for (TreeNode c : node.children) walk(c, out);
                out.add(Instruction.tau(node.arity()));
                return;
            case IDENTIFIER:
                out.add(Instruction.identifier(node.value));
                return;
            case INTEGER:
                out.add(Instruction.literal(Value.integer(Long.parseLong(node.value))));
                return;
            case STRING:
                out.add(Instruction.literal(Value.string(node.value)));
                return;
            case TRUE:
                out.add(Instruction.literal(Value.truth(true)));
                return;
            case FALSE:
                out.add(Instruction.literal(Value.truth(false)));
                return;
            case NIL:
                out.add(Instruction.literal(Value.nil()));
                return;
            case DUMMY:
                out.add(Instruction.literal(Value.dummy()));
                return;
            case YSTAR:
                out.add(Instruction.ystar());
                return;
            default:
                break;
        }

        if (node.type.isBinaryOperator()) {
            walk(node.child(0), out);
            walk(node.child(1), out);
            out.add(Instruction.binary(node.type.tag));
            return;
        }
        if (node.type.isUnaryOperator()) {
            walk(node.child(0), out);
            out.add(Instruction.unary(node.type.tag));
            return;
        }
        throw new IllegalArgumentException("Tree is not standardized; unexpected node '" + node.type.tag + "'");
    }

    private static Instruction lambdaOf(TreeNode param, int block) {
        switch (param.type) {
            case IDENTIFIER: {
                List<String> one = new ArrayList<>(1);
                one.add(param.value);
                return Instruction.lambda(one, false, block);
            }
            case COMMA: {
                List<String> names = new ArrayList<>(param.arity());
                for (TreeNode n : param.children) {
                    if (n.type != NodeType.IDENTIFIER) {
                        throw new IllegalArgumentException("Tuple pattern may only bind identifiers, got '" + n.label() + "'");
                    }
                    names.add(n.value);
                }
                return Instruction.lambda(names, true, block);
            }
            case EMPTY_PARAMS:
                return Instruction.lambda(new ArrayList<>(), true, block);
            default:
                throw new IllegalArgumentException("Unsupported lambda parameter '" + param.label() + "'");
        }
    }
}
