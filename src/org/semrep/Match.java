/* @LICENSE@
 */
package org.semrep;

import java.util.regex.MatchResult;

import org.semrep.lang.IdentifierRecord;

/**
 * One match found by a {@link Matcher}. Offsets are absolute offsets into
 * the matched text. A capture group which did not participate reports -1
 * offsets and a null group.
 */
public final class Match implements MatchResult {

    private final Engine.CGA cga;
    private final String[] groups;
    private final IdentifierRecord context;

    Match(CharSequence text, Engine.CGA cga, IdentifierRecord context) {
        this.cga = new Engine.CGA(cga);
        this.context = context;
        groups = new String[cga.ngroups];
        for (int g = 0; g < cga.ngroups; ++g) {
            if (cga.match(g)) {
                groups[g] = text.subSequence(cga.start(g), cga.end(g)).toString();
            } else {
                this.cga.start(g, -1);
                this.cga.end(g, -1);
            }
        }
        assert groups[0] != null;
    }

    public int start() {
        return cga.start(0);
    }

    public int start(int group) {
        check(group);
        return cga.start(group);
    }

    public int end() {
        return cga.end(0);
    }

    public int end(int group) {
        check(group);
        return cga.end(group);
    }

    public String group() {
        return groups[0];
    }

    public String group(int group) {
        check(group);
        return groups[group];
    }

    public int groupCount() {
        return groups.length - 1;
    }

    /**
     * @return the identifier whose span is exactly the span of this match,
     *         or null.
     */
    public IdentifierRecord semanticContext() {
        return context;
    }

    private void check(int group) {
        if (group < 0 || group >= groups.length) {
            throw new IndexOutOfBoundsException("no group " + group);
        }
    }

    @Override
    public String toString() {
        return cga.toString();
    }
}
