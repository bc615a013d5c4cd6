/* @LICENSE@
 */
package org.semrep;

import org.semrep.lang.IdentifierRecord;

/**
 * Caller supplied veto over individual replacements.
 */
public abstract class MatchPredicate {

    /**
     * Accepts every match.
     */
    public static final MatchPredicate ALWAYS = new MatchPredicate() {
        @Override
        public boolean accept(String matchedText, IdentifierRecord context) {
            return true;
        }

        @Override
        public String toString() {
            return "ALWAYS";
        }
    };

    /**
     * @return a predicate accepting only matches whose semantic context has
     *         type <code>type</code>.
     */
    public static MatchPredicate typeIs(final String type) {
        return new MatchPredicate() {
            @Override
            public boolean accept(String matchedText, IdentifierRecord context) {
                return context != null && type.equals(context.type());
            }

            @Override
            public String toString() {
                return "type=" + type;
            }
        };
    }

    /**
     * @param matchedText
     *            the text of the match
     * @param context
     *            the identifier spanning exactly the match, or null
     * @return true to replace this match.
     */
    public abstract boolean accept(String matchedText, IdentifierRecord context);
}
