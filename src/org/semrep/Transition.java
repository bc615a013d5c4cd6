/* @LICENSE@
 */
package org.semrep;

/**
 * An outgoing edge of an {@link Automaton} node: a {@link Label} and the
 * destination node. Instances are immutable.
 */
public final class Transition {

    /**
     * The closed set of edge kinds. Adding a kind means extending this enum,
     * {@link Label#matches(char)} and {@link Kind#isTraversable()}; the arena
     * itself is kind agnostic.
     */
    public enum Kind {
        /** zero width, always traversable */
        EPSILON(true),
        LITERAL(false),
        CHAR_SET(false),
        NEGATED_CHAR_SET(false),
        /**
         * A placeholder for a condition on externally supplied context (e.g.
         * "type=Session"). Never matched by an input symbol and never
         * traversed by a closure; evaluated after the fact by the
         * {@link Matcher}.
         */
        SEMANTIC_PREDICATE(false),
        GROUP_OPEN(true),
        GROUP_CLOSE(true);

        final boolean traversable;

        private Kind(boolean traversable) {
            this.traversable = traversable;
        }

        /**
         * @return true if a closure follows edges of this kind.
         */
        public boolean isTraversable() {
            return traversable;
        }
    }

    /**
     * The tagged value carried by a transition: kind plus payload. Labels have
     * value semantics, so equal labels can be merged by the
     * {@link DfaCompiler}.
     */
    public static final class Label {

        public static final Label EPSILON = new Label(Kind.EPSILON, '\0', null, null, 0);

        final Kind kind;
        private final char c;
        private final SymbolSet set;
        private final String expression;
        private final int group;

        private Label(Kind kind, char c, SymbolSet set, String expression, int group) {
            this.kind = kind;
            this.c = c;
            this.set = set;
            this.expression = expression;
            this.group = group;
        }

        public static Label literal(char c) {
            return new Label(Kind.LITERAL, c, null, null, 0);
        }

        public static Label charSet(SymbolSet set) {
            return new Label(Kind.CHAR_SET, '\0', checkNotNull(set), null, 0);
        }

        public static Label negatedCharSet(SymbolSet set) {
            return new Label(Kind.NEGATED_CHAR_SET, '\0', checkNotNull(set), null, 0);
        }

        public static Label semanticPredicate(String expression) {
            return new Label(Kind.SEMANTIC_PREDICATE, '\0', null,
                checkNotNull(expression), 0);
        }

        public static Label groupOpen(int group) {
            return new Label(Kind.GROUP_OPEN, '\0', null, null, checkGroup(group));
        }

        public static Label groupClose(int group) {
            return new Label(Kind.GROUP_CLOSE, '\0', null, null, checkGroup(group));
        }

        private static <T> T checkNotNull(T t) {
            if (t == null) throw new NullPointerException();
            return t;
        }

        private static int checkGroup(int group) {
            if (group < 1) {
                throw new IllegalArgumentException("group id must be positive: " + group);
            }
            return group;
        }

        public Kind kind() {
            return kind;
        }

        public SymbolSet set() {
            return set;
        }

        public String expression() {
            return expression;
        }

        public int group() {
            return group;
        }

        /**
         * Tests an input symbol against this label. Zero width kinds never
         * match a symbol.
         */
        public boolean matches(char input) {
            switch (kind) {
            case LITERAL:
                return c == input;
            case CHAR_SET:
                return set.contains(input);
            case NEGATED_CHAR_SET:
                return !set.contains(input);
            case EPSILON:
            case SEMANTIC_PREDICATE:
            case GROUP_OPEN:
            case GROUP_CLOSE:
                return false;
            default:
                throw new AssertionError(kind);
            }
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = kind.hashCode();
            result = prime * result + c;
            result = prime * result + ((set == null) ? 0 : set.hashCode());
            result = prime * result + ((expression == null) ? 0 : expression.hashCode());
            result = prime * result + group;
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Label))
                return false;
            final Label other = (Label) obj;
            if (kind != other.kind || c != other.c || group != other.group)
                return false;
            if (set == null) {
                if (other.set != null)
                    return false;
            } else if (!set.equals(other.set))
                return false;
            if (expression == null) {
                if (other.expression != null)
                    return false;
            } else if (!expression.equals(other.expression))
                return false;
            return true;
        }

        @Override
        public String toString() {
            switch (kind) {
            case EPSILON:            return "eps";
            case LITERAL:            return "'" + c + "'";
            case CHAR_SET:           return set.toString();
            case NEGATED_CHAR_SET:   return "^" + set;
            case SEMANTIC_PREDICATE: return "[[" + expression + "]]";
            case GROUP_OPEN:         return "(" + group;
            case GROUP_CLOSE:        return group + ")";
            default:
                throw new AssertionError(kind);
            }
        }
    }

    final Label label;
    final NodePointer dest;

    Transition(Label label, NodePointer dest) {
        this.label = label;
        this.dest = dest;
    }

    public Label label() {
        return label;
    }

    public Kind kind() {
        return label.kind;
    }

    public NodePointer dest() {
        return dest;
    }

    @Override
    public String toString() {
        return label + " -> " + dest;
    }
}
