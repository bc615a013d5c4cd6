/* @LICENSE@
 */
package org.semrep;

/**
 * Identifies a node inside exactly one {@link Automaton}. A pointer carries the
 * identity of the arena which minted it; pointers minted by different arenas
 * are never equal, and an arena rejects pointers it did not mint.
 */
public final class NodePointer implements Comparable<NodePointer> {

    final Automaton owner;
    final int id;

    NodePointer(Automaton owner, int id) {
        this.owner = owner;
        this.id = id;
    }

    public int id() {
        return id;
    }

    public int compareTo(NodePointer o) {
        return id < o.id ? -1 : id == o.id ? 0 : 1;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof NodePointer))
            return false;
        final NodePointer other = (NodePointer) obj;
        return owner == other.owner && id == other.id;
    }

    @Override
    public String toString() {
        return "#" + id;
    }
}
