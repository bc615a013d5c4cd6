/*
 * @LICENSE@
 */

package org.semrep;

import static org.semrep.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An append-only arena of nodes, each owning an ordered list of outgoing
 * {@link Transition}s. Nodes are addressed by {@link NodePointer}s minted by
 * the arena; nodes are never removed, so a pointer stays valid for the life
 * of the arena. Several outgoing transitions per node are allowed, which is
 * what makes the structure nondeterministic; cycles (e.g. epsilon loops) are
 * plain index references.
 * <p>
 * All structural edits go through the arena. Once {@linkplain #freeze()
 * frozen} (a {@link CompiledPattern} always freezes its automaton) the arena
 * is immutable and may be shared freely.
 */
public final class Automaton {

    /**
     * Thrown when a builder call references a node which is out of range for
     * the arena, or which was minted by another arena. This is always a
     * programming error in the code building the automaton.
     */
    public static final class InvalidTransitionSourceException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public InvalidTransitionSourceException(String msg) {
            super(msg);
        }
    }

    private static final class Node {

        private final List<Transition> transitions = new ArrayList<Transition>(2);

        @Override
        public String toString() {
            return transitions.toString();
        }
    }

    private final List<Node> nodes = new ArrayList<Node>();
    private boolean frozen = false;

    public NodePointer newNode() {
        checkMutable();
        nodes.add(new Node());
        return new NodePointer(this, nodes.size() - 1);
    }

    public void addTransition(NodePointer from, Transition.Label label, NodePointer to) {
        checkMutable();
        Node node = nodeAt(from, "source");
        checkValid(to, "destination");
        if (label == null) throw new NullPointerException("label");
        node.transitions.add(new Transition(label, to));
    }

    public void addEpsilon(NodePointer from, NodePointer to) {
        addTransition(from, Transition.Label.EPSILON, to);
    }

    public void addLiteral(NodePointer from, NodePointer to, char c) {
        addTransition(from, Transition.Label.literal(c), to);
    }

    public void addCharSet(NodePointer from, NodePointer to, SymbolSet set) {
        addTransition(from, Transition.Label.charSet(set), to);
    }

    public void addNegatedCharSet(NodePointer from, NodePointer to, SymbolSet set) {
        addTransition(from, Transition.Label.negatedCharSet(set), to);
    }

    public void addSemanticPredicate(NodePointer from, NodePointer to, String expression) {
        addTransition(from, Transition.Label.semanticPredicate(expression), to);
    }

    /**
     * Adds a {@link Transition.Kind#GROUP_OPEN} edge from
     * <code>startFrom</code> to <code>startTo</code> and a
     * {@link Transition.Kind#GROUP_CLOSE} edge from <code>endFrom</code> to
     * <code>endTo</code>, both carrying <code>group</code>.
     */
    public void addCaptureGroup(NodePointer startFrom, NodePointer startTo,
            NodePointer endFrom, NodePointer endTo, int group) {
        // validate both edges before adding either one
        checkValid(startFrom, "source");
        checkValid(startTo, "destination");
        checkValid(endFrom, "source");
        checkValid(endTo, "destination");
        addTransition(startFrom, Transition.Label.groupOpen(group), startTo);
        addTransition(endFrom, Transition.Label.groupClose(group), endTo);
    }

    /**
     * Makes this arena immutable. Idempotent.
     */
    public Automaton freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isValid(NodePointer p) {
        return p != null && p.owner == this && 0 <= p.id && p.id < nodes.size();
    }

    /**
     * @return the outgoing transitions of <code>p</code>, in insertion order.
     */
    public List<Transition> transitions(NodePointer p) {
        return Collections.unmodifiableList(nodeAt(p, "node").transitions);
    }

    /**
     * @return the pointer for node index <code>id</code>.
     */
    public NodePointer pointer(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new InvalidTransitionSourceException(
                "node index out of range: " + id + " (size " + nodes.size() + ")");
        }
        return new NodePointer(this, id);
    }

    /*
     * unchecked fast path for the simulators: p already validated
     */
    List<Transition> rawTransitions(NodePointer p) {
        assert isValid(p) : p;
        return nodes.get(p.id).transitions;
    }

    private Node nodeAt(NodePointer p, String role) {
        checkValid(p, role);
        return nodes.get(p.id);
    }

    private void checkValid(NodePointer p, String role) {
        if (p == null) {
            throw new InvalidTransitionSourceException("invalid " + role + ": null");
        }
        if (p.owner != this) {
            throw new InvalidTransitionSourceException(
                "invalid " + role + ": " + p + " belongs to another automaton");
        }
        if (p.id < 0 || p.id >= nodes.size()) {
            throw new InvalidTransitionSourceException(
                "invalid " + role + ": " + p + " (size " + nodes.size() + ")");
        }
    }

    private void checkMutable() {
        if (frozen) throw new IllegalStateException("frozen automaton");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total nodes: ").append(nodes.size()).append(LS);
        for (int i = 0; i < nodes.size(); ++i) {
            sb.append("    #").append(i).append(' ').append(nodes.get(i)).append(LS);
        }
        return sb.toString();
    }
}
