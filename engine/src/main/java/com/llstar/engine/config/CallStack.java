package com.llstar.engine.config;

import com.llstar.engine.atn.AtnState;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable stack of follow states awaiting a rule return. Pushing shares the tail, so configs
 * branching from one another share their common stack. Equality is structural over state ids.
 */
public final class CallStack {
    public static final CallStack EMPTY = new CallStack(null, null, 0);

    private final AtnState top;
    private final CallStack parent;
    private final int size;
    private final int hash;

    private CallStack(AtnState top, CallStack parent, int size) {
        this.top = top;
        this.parent = parent;
        this.size = size;
        this.hash = top == null ? 1 : 31 * parent.hash + top.id;
    }

    public CallStack push(AtnState followState) {
        return new CallStack(followState, this, size + 1);
    }

    public AtnState peek() {
        if (top == null) {
            throw new IllegalStateException("peek on empty call stack");
        }
        return top;
    }

    public CallStack pop() {
        if (top == null) {
            throw new IllegalStateException("pop on empty call stack");
        }
        return parent;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /** Follow states from the top of the stack down. */
    public List<AtnState> toList() {
        List<AtnState> states = new ArrayList<>(size);
        for (CallStack s = this; s.top != null; s = s.parent) {
            states.add(s.top);
        }
        return states;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallStack other) || other.size != size || other.hash != hash) {
            return false;
        }
        CallStack a = this;
        CallStack b = other;
        while (a.top != null) {
            if (a == b) {
                return true;
            }
            if (a.top.id != b.top.id) {
                return false;
            }
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toList().stream().map(s -> Integer.toString(s.id)).toList().toString();
    }
}
