package org.evmkit.runtime.model;

import java.util.ArrayList;
import java.util.List;

import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;

/**
 * Bounded, array-backed operand stack. Index 0 is the top.
 */
public final class OperandStack {

    private final Word[] items;
    private int depth = 0;

    /**
     * @param maxDepth The number of words the stack can hold.
     */
    public OperandStack(int maxDepth) {
        this.items = new Word[maxDepth];
    }

    public int depth() {
        return depth;
    }

    public void push(Word word) throws VmException {
        if (depth == items.length) {
            throw new VmException(VmError.Kind.STACK_OVERFLOW);
        }
        items[depth++] = word;
    }

    public Word pop() throws VmException {
        if (depth == 0) {
            throw new VmException(VmError.Kind.STACK_UNDERFLOW);
        }
        Word word = items[--depth];
        items[depth] = null;
        return word;
    }

    /**
     * Returns the word {@code n} positions below the top without removing it.
     */
    public Word peek(int n) throws VmException {
        if (n < 0 || n >= depth) {
            throw new VmException(VmError.Kind.STACK_UNDERFLOW);
        }
        return items[depth - 1 - n];
    }

    /**
     * Replaces the word {@code n} positions below the top.
     */
    public void set(int n, Word word) throws VmException {
        if (n < 0 || n >= depth) {
            throw new VmException(VmError.Kind.STACK_UNDERFLOW);
        }
        items[depth - 1 - n] = word;
    }

    /**
     * Returns the stack contents, top first.
     */
    public List<Word> toList() {
        List<Word> out = new ArrayList<>(depth);
        for (int i = depth - 1; i >= 0; i--) {
            out.add(items[i]);
        }
        return out;
    }
}
