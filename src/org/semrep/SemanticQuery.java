/* @LICENSE@
 */
package org.semrep;

import java.util.regex.PatternSyntaxException;

import org.semrep.lang.IdentifierRecord;

/**
 * A parsed semantic predicate expression such as <code>type=Session</code> or
 * <code>name!=tmp</code>. Semantic predicates ride along in the automaton as
 * {@link Transition.Kind#SEMANTIC_PREDICATE} edges and are evaluated after a
 * candidate match has been found, against the {@link IdentifierRecord} whose
 * span is exactly the span of the candidate.
 */
public final class SemanticQuery {

    public enum Key {
        TYPE("type"),
        NAME("name");

        final String label;

        private Key(String label) {
            this.label = label;
        }

        String valueOf(IdentifierRecord r) {
            return this == TYPE ? r.type() : r.name();
        }

        static Key forLabel(String label) {
            for (Key k : values()) {
                if (k.label.equals(label)) return k;
            }
            return null;
        }
    }

    private final String expression;
    private final Key key;
    private final boolean negated;
    private final String value;

    private SemanticQuery(String expression, Key key, boolean negated, String value) {
        this.expression = expression;
        this.key = key;
        this.negated = negated;
        this.value = value;
    }

    /**
     * @throws PatternSyntaxException
     *             if the expression is not of the form <code>key=value</code>
     *             or <code>key!=value</code> with a known key.
     */
    public static SemanticQuery parse(String expression) {
        int eq = expression.indexOf('=');
        if (eq < 0) {
            throw new PatternSyntaxException(
                "semantic predicate needs '=' or '!='", expression, -1);
        }
        boolean negated = eq > 0 && expression.charAt(eq - 1) == '!';
        String k = expression.substring(0, negated ? eq - 1 : eq).trim();
        String v = expression.substring(eq + 1).trim();
        Key key = Key.forLabel(k);
        if (key == null) {
            throw new PatternSyntaxException(
                "unknown semantic predicate key: " + k, expression, 0);
        }
        if (v.length() == 0) {
            throw new PatternSyntaxException(
                "missing semantic predicate value", expression, eq + 1);
        }
        return new SemanticQuery(expression, key, negated, v);
    }

    public Key key() {
        return key;
    }

    public String value() {
        return value;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * @param context
     *            the identifier spanning the candidate match, or null if there
     *            is none; a candidate without context never satisfies a
     *            semantic predicate.
     */
    public boolean matches(IdentifierRecord context) {
        if (context == null) return false;
        return value.equals(key.valueOf(context)) != negated;
    }

    @Override
    public String toString() {
        return expression;
    }
}
