/* @LICENSE@
 */
package org.semrep.lang;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Lexical scopes as a stack of <code>name -&gt; type</code> frames. The
 * innermost frame shadows the outer ones; a popped frame is dropped, never
 * merged into its parent.
 */
public final class ScopeStack {

    private final Deque<Map<String, String>> frames = new ArrayDeque<Map<String, String>>();

    /**
     * Creates a stack holding a single (file level) frame.
     */
    public ScopeStack() {
        push();
    }

    public void push() {
        frames.push(new HashMap<String, String>());
    }

    /**
     * Drops the innermost frame. Popping an empty stack is a no-op, so an
     * unbalanced closing brace cannot break the scan.
     */
    public void pop() {
        if (!frames.isEmpty()) frames.pop();
    }

    /**
     * Binds <code>name</code> in the innermost frame. Does nothing while the
     * stack is empty.
     */
    public void declare(String name, String type) {
        Map<String, String> top = frames.peek();
        if (top != null) top.put(name, type);
    }

    /**
     * @return the type bound to <code>name</code> in the innermost frame that
     *         binds it, or null.
     */
    public String resolve(String name) {
        for (Iterator<Map<String, String>> it = frames.iterator(); it.hasNext();) {
            String type = it.next().get(name);
            if (type != null) return type;
        }
        return null;
    }

    public int depth() {
        return frames.size();
    }

    @Override
    public String toString() {
        return frames.toString();
    }
}
