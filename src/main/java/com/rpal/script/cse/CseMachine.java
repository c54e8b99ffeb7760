package com.rpal.script.cse;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rpal.debug.Debug;
import com.rpal.script.ErrorKind;
import com.rpal.script.RpalRuntimeException;

/**
 * Control / stack / environment machine over linearized control blocks.
 *
 * <p>One instance evaluates one program: {@link #run()} loads block 0 with the primitive
 * environment current and reduces until control is empty. Not thread-safe.
 */
public class CseMachine {

    private static final String TAG = "CSE";

    private final List<ControlBlock> blocks;
    private final Deque<Instruction> control = new ArrayDeque<>();
    private final Deque<Value> stack = new ArrayDeque<>();
    private final Deque<Environment> environments = new ArrayDeque<>();
    private final long maxSteps;

    private int nextEnvId = 1;
    private long steps = 0;

    /**
     * @param primitives names bound in the root environment (built-in functions)
     * @param maxSteps   reduction budget; 0 or negative means unlimited
     */
    public CseMachine(List<ControlBlock> blocks, Map<String, Value> primitives, long maxSteps) {
        if (blocks == null || blocks.isEmpty()) throw new IllegalArgumentException("No control blocks to run");
        this.blocks = blocks;
        this.maxSteps = maxSteps;
        environments.push(Environment.root(primitives));
    }

    public Value run() {
        load(0);
        while (!control.isEmpty()) {
            step(control.pop());
        }

        if (stack.size() != 1) {
            throw new RpalRuntimeException(ErrorKind.MACHINE_CONSISTENCY,
                    "Control exhausted with " + stack.size() + " values on the stack");
        }
        Debug.get().d(TAG, "finished after " + steps + " steps");
        return stack.pop();
    }

    public long steps() {
        return steps;
    }

    public Environment currentEnvironment() {
        return environments.peek();
    }

    private void step(Instruction ins) {
        steps++;
        if (maxSteps > 0 && steps > maxSteps) {
            throw new RpalRuntimeException(ErrorKind.STEP_LIMIT, "Step limit of " + maxSteps + " exceeded");
        }
        if (Debug.get().enabled()) {
            Debug.get().t(TAG, steps + ": " + ins + " | stack=" + stack.size() + " env=" + currentEnvironment());
        }

        switch (ins.kind) {
            case LITERAL:
                stack.push(ins.literal);
                break;

            case IDENTIFIER:
                stack.push(currentEnvironment().get(ins.name));
                break;

            case LAMBDA:
                stack.push(Value.lambda(new Value.Lambda(ins.params, ins.tuplePattern, ins.block, currentEnvironment())));
                break;

            case YSTAR:
                stack.push(Value.ystar());
                break;

            case GAMMA:
                apply();
                break;

            case BINARY_OP: {
                Value right = pop();
                Value left = pop();
                stack.push(Operators.binary(ins.name, left, right));
                break;
            }

            case UNARY_OP:
                stack.push(Operators.unary(ins.name, pop()));
                break;

            case CONDITIONAL: {
                Value cond = pop();
                if (cond.type != Value.Type.TRUTH) {
                    throw RpalRuntimeException.type("Conditional expects a truth value, got " + cond.type);
                }
                load(cond.asTruth() ? ins.block : ins.elseBlock);
                break;
            }

            case TAU: {
                Value[] items = new Value[ins.arity];
                for (int i = ins.arity - 1; i >= 0; i--) items[i] = pop();
                stack.push(Value.tuple(Arrays.asList(items)));
                break;
            }

            case ENV_RESTORE:
                environments.pop();
                break;

            default:
                throw new IllegalStateException("Unknown instruction kind: " + ins.kind);
        }
    }

    private void apply() {
        Value rator = pop();
        Value rand = pop();

        switch (rator.type) {
            case LAMBDA: {
                Value.Lambda closure = rator.asLambda();
                Environment env = closure.env.childScope(nextEnvId++, bind(closure, rand));
                environments.push(env);
                control.push(Instruction.envRestore(env));
                load(closure.block);
                break;
            }

            case TUPLE: {
                if (rand.type != Value.Type.INTEGER) {
                    throw RpalRuntimeException.type("Tuple selection expects an integer index, got " + rand.type);
                }
                List<Value> items = rator.asTuple();
                long n = rand.asInteger();
                if (n < 1 || n > items.size()) {
                    throw RpalRuntimeException.arity("Tuple index " + n + " out of range 1.." + items.size());
                }
                stack.push(items.get((int) (n - 1)));
                break;
            }

            case YSTAR:
                if (rand.type != Value.Type.LAMBDA) {
                    throw RpalRuntimeException.type("Y* expects a lambda closure, got " + rand.type);
                }
                stack.push(Value.eta(new Value.Eta(rand.asLambda())));
                break;

            case ETA:
                // (lambda X. E) eta  yields the function body bound to itself, then apply it to rand
                control.push(Instruction.gamma());
                control.push(Instruction.gamma());
                stack.push(rand);
                stack.push(rator);
                stack.push(Value.lambda(rator.asEta().lambda));
                break;

            case BUILTIN:
                stack.push(rator.asBuiltin().apply(rand));
                break;

            default:
                throw RpalRuntimeException.type("Cannot apply a value of type " + rator.type + " (" + rator + ")");
        }
    }

    private static Map<String, Value> bind(Value.Lambda closure, Value arg) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (!closure.tuplePattern) {
            out.put(closure.params.get(0), arg);
            return out;
        }
        if (closure.params.isEmpty()) return out;

        if (arg.type != Value.Type.TUPLE) {
            throw RpalRuntimeException.type("Tuple pattern (" + closure.paramSpec() + ") applied to " + arg.type);
        }
        List<Value> items = arg.asTuple();
        if (items.size() != closure.params.size()) {
            throw RpalRuntimeException.arity("Tuple pattern (" + closure.paramSpec() + ") expects "
                    + closure.params.size() + " elements, got " + items.size());
        }
        for (int i = 0; i < items.size(); i++) {
            out.put(closure.params.get(i), items.get(i));
        }
        return out;
    }

    private void load(int block) {
        List<Instruction> ins = blocks.get(block).instructions;
        for (int i = ins.size() - 1; i >= 0; i--) {
            control.push(ins.get(i));
        }
    }

    private Value pop() {
        Value v = stack.poll();
        if (v == null) {
            throw new RpalRuntimeException(ErrorKind.MACHINE_CONSISTENCY, "Value stack unexpectedly empty");
        }
        return v;
    }
}
