/* @LICENSE@
 */
package org.semrep;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A simulation context: the set of automaton nodes currently reachable. A
 * context is an immutable value; {@link #step(Automaton, char)} computes a new
 * one and never touches the receiver or the automaton, so any number of
 * contexts may walk the same automaton independently.
 * <p>
 * Closures follow every {@linkplain Transition.Kind#isTraversable()
 * traversable} zero width edge: epsilons and the capture group markers.
 * {@link Transition.Kind#SEMANTIC_PREDICATE} edges are neither matched by a
 * symbol nor followed by a closure.
 */
public final class Context implements Iterable<NodePointer> {

    private final SortedSet<NodePointer> nodes;

    private Context(SortedSet<NodePointer> nodes) {
        this.nodes = Collections.unmodifiableSortedSet(nodes);
    }

    /**
     * @return the closure of the pattern's start node.
     */
    public static Context initial(CompiledPattern pattern) {
        return closure(pattern.automaton(), Collections.singleton(pattern.start()));
    }

    /**
     * Computes the closure of <code>seed</code>: every node reachable from it
     * using traversable zero width edges only. The returned context is always
     * a fixpoint.
     */
    public static Context closure(Automaton automaton, Collection<NodePointer> seed) {
        TreeSet<NodePointer> closed = new TreeSet<NodePointer>();
        Deque<NodePointer> work = new ArrayDeque<NodePointer>();
        for (NodePointer p : seed) {
            if (!automaton.isValid(p)) {
                throw new Automaton.InvalidTransitionSourceException(
                    "invalid node for this automaton: " + p);
            }
            if (closed.add(p)) work.push(p);
        }
        while (!work.isEmpty()) {
            NodePointer p = work.pop();
            for (Transition t : automaton.rawTransitions(p)) {
                if (t.label.kind.traversable && closed.add(t.dest)) {
                    work.push(t.dest);
                }
            }
        }
        return new Context(closed);
    }

    /**
     * Advances this context over one input symbol.
     *
     * @throws Automaton.InvalidTransitionSourceException
     *             if this context holds a node of another automaton.
     */
    public Context step(Automaton automaton, char input) {
        TreeSet<NodePointer> next = new TreeSet<NodePointer>();
        for (NodePointer p : nodes) {
            if (!automaton.isValid(p)) {
                throw new Automaton.InvalidTransitionSourceException(
                    "invalid node for this automaton: " + p);
            }
            for (Transition t : automaton.rawTransitions(p)) {
                if (t.label.matches(input)) {
                    next.add(t.dest);
                }
            }
        }
        return closure(automaton, next);
    }

    public boolean contains(NodePointer p) {
        return nodes.contains(p);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return the nodes of this context in canonical (index) order.
     */
    public SortedSet<NodePointer> nodes() {
        return nodes;
    }

    public Iterator<NodePointer> iterator() {
        return nodes.iterator();
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Context))
            return false;
        return nodes.equals(((Context) obj).nodes);
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
