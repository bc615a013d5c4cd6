/* @LICENSE@
 */
package org.semrep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled replacement template: literal text interleaved with group
 * references <code>$0</code> to <code>$9</code>. <code>\$</code> and
 * <code>\\</code> stand for a literal dollar sign and backslash.
 */
public final class Replacement {

    private abstract static class Replacer {
        abstract void appendReplacement(StringBuilder sb, MatchResult m);
    }

    private static final class GroupReplacer extends Replacer {
        private final int group;
        GroupReplacer(int group) {
            this.group = group;
        }
        /*
         * a group that did not participate inserts nothing
         */
        @Override
        void appendReplacement(StringBuilder sb, MatchResult m) {
            String g = m.group(group);
            if (g != null) sb.append(g);
        }
    }

    private static final class LiteralReplacer extends Replacer {
        private final String literal;
        LiteralReplacer(String literal) {
            this.literal = literal;
        }
        @Override
        void appendReplacement(StringBuilder sb, MatchResult m) {
            sb.append(literal);
        }
    }

    private final String template;
    private final List<Replacer> replacers;

    private Replacement(String template, List<Replacer> replacers) {
        this.template = template;
        this.replacers = Collections.unmodifiableList(replacers);
    }

    /**
     * @param groupCount
     *            the number of capture groups of the pattern the template will
     *            be used with
     * @throws PatternSyntaxException
     *             on a dangling <code>$</code> or <code>\</code>, an unknown
     *             escape, or a reference beyond <code>groupCount</code>.
     */
    public static Replacement parse(String template, int groupCount) {
        List<Replacer> replacers = new ArrayList<Replacer>();
        StringBuilder rsb = new StringBuilder();
        for (int i = 0; i < template.length(); ++i) {
            char c = template.charAt(i);
            if (c == '$') {
                if (i + 1 == template.length()) {
                    throw new PatternSyntaxException("dangling '$'", template, i);
                }
                char d = template.charAt(++i);
                if (d < '0' || '9' < d) {
                    throw new PatternSyntaxException("'$' must be followed by a digit", template, i);
                }
                int group = d - '0';
                if (group > groupCount) {
                    throw new PatternSyntaxException(
                        "no such capture group: " + group, template, i);
                }
                if (rsb.length() > 0) {
                    replacers.add(new LiteralReplacer(rsb.toString()));
                    Misc.clear(rsb);
                }
                replacers.add(new GroupReplacer(group));
            } else if (c == '\\') {
                if (i + 1 == template.length()) {
                    throw new PatternSyntaxException("dangling '\\'", template, i);
                }
                char d = template.charAt(++i);
                if (d != '$' && d != '\\') {
                    throw new PatternSyntaxException("unsupported escape sequence", template, i);
                }
                rsb.append(d);
            } else {
                rsb.append(c);
            }
        }
        if (rsb.length() > 0) {
            replacers.add(new LiteralReplacer(rsb.toString()));
        }
        return new Replacement(template, replacers);
    }

    /**
     * Appends the rendering of this template for <code>m</code> to
     * <code>sb</code>.
     */
    public StringBuilder appendTo(StringBuilder sb, MatchResult m) {
        for (Replacer r : replacers) {
            r.appendReplacement(sb, m);
        }
        return sb;
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }
}
