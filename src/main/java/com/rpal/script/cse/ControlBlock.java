package com.rpal.script.cse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An indexed delta: instructions in execution order, first to run at position 0. */
public final class ControlBlock {
    public final int index;
    public final List<Instruction> instructions;

    public ControlBlock(int index, List<Instruction> instructions) {
        this.index = index;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("delta_").append(index).append(": ");
        for (int i = 0; i < instructions.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(instructions.get(i));
        }
        return sb.toString();
    }
}
