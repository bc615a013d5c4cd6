/* @LICENSE@
 */
package org.semrep;

import java.util.Arrays;

import org.semrep.lang.SourceModel;

/**
 * A matching algorithm bound to one {@link CompiledPattern}. Engines are
 * immutable; all per-evaluation state is local to {@link #eval}.
 */
abstract class Engine {

    /**
     * Represents an array of capture groups, group 0 being the whole match.
     * A single flat array of <code>int</code>s holds a start and an end per
     * group; -1 marks an offset that was never recorded.
     */
    static final class CGA {

        final int ngroups;
        final int[] a;

        CGA(int ngroups) {
            a = new int[ngroups << 1];
            this.ngroups = ngroups;
            Arrays.fill(a, -1);
        }

        CGA(CGA src) {
            a = src.a.clone();
            ngroups = src.ngroups;
        }

        int start(int group) {return a[group << 1];}
        int end(int group)   {return a[(group << 1) + 1];}

        void start(int group, int start) {a[group << 1] = start;}
        void end(int group, int end)     {a[(group << 1) + 1] = end;}

        /**
         * A group matched only if both its markers fired, open first.
         */
        boolean match(int group) {
            int s = start(group), e = end(group);
            return s != -1 && e != -1 && s <= e;
        }

        String toString(int group) {
            return new StringBuilder()
                .append('(').append(start(group)).append(',')
                .append(end(group)).append(')')
                .toString();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int g=0; g<ngroups; ++g) sb.append(toString(g));
            return sb.toString();
        }
    }

    final EngineStyle style;
    final CompiledPattern pattern;

    protected Engine(EngineStyle style, CompiledPattern pattern) {
        this.style = style;
        this.pattern = pattern;
    }

    /**
     * Runs one anchored, leftmost-longest attempt.
     *
     * @param csq
     *            the input
     * @param start
     *            the offset where the attempt begins
     * @param end
     *            the offset where the input ends (exclusive)
     * @param model
     *            semantic context for the qualifiers of the pattern, never
     *            null
     * @return the capture groups of the longest match beginning at
     *         <code>start</code> whose path satisfies its qualifiers, or null
     *         if no match begins there.
     */
    abstract CGA eval(CharSequence csq, int start, int end, SourceModel model);

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getName() + "@" + Integer.toHexString(hashCode());
    }
}
