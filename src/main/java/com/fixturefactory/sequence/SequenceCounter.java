package com.fixturefactory.sequence;

/**
 * A plain read-then-increment integer cell.
 */
public final class SequenceCounter {

    private int next;

    public SequenceCounter(int initial) {
        this.next = initial;
    }

    public int next() {
        int value = next;
        next++;
        return value;
    }

    public int peek() {
        return next;
    }

    public void reset(int value) {
        this.next = value;
    }
}
