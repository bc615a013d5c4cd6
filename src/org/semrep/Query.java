/* @LICENSE@
 */
package org.semrep;

import java.util.regex.PatternSyntaxException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.semrep.Misc.FlagMgr;
import org.semrep.lang.SourceModel;

/**
 * A compiled substitution query, <code>[%]s/find/replace/flags</code>. The
 * find part is compiled to a {@link CompiledPattern} and bound to an
 * {@link Engine}; the replace part to a {@link Replacement}. A slash inside
 * either part is written <code>\/</code>.
 * <p>
 * Flags: <code>g</code> replaces every accepted match instead of the first
 * one only; <code>d</code> and <code>n</code> force the {@link EngineStyle#DFA}
 * and {@link EngineStyle#NFA} styles. Instances are immutable.
 */
public final class Query {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    public static final int GLOBAL = flagMgr.next("GLOBAL");

    public static final int FORCE_DFA = flagMgr.next("FORCE_DFA");

    public static final int FORCE_NFA = flagMgr.next("FORCE_NFA");

    static {
        flagMgr.freeze();
    }

    private final String query;
    private final String find;
    private final int flags;
    private final CompiledPattern pattern;
    private final Replacement replacement;
    private final Engine engine;

    private Query(String query, String find, String template, int flags) {
        flagMgr.check(flags);
        this.query = query;
        this.find = find;
        this.flags = flags;
        this.pattern = compilePattern(find);
        this.replacement = Replacement.parse(template, pattern.groupCount());
        EngineStyle style = Misc.isSet(flags, FORCE_DFA) ? EngineStyle.DFA
                          : Misc.isSet(flags, FORCE_NFA) ? EngineStyle.NFA
                          : EngineStyle.DYNAMIC;
        try {
            this.engine = style.newEngine(pattern);
        } catch (EngineStyle.ConstructionException e) {
            PatternSyntaxException pse = new PatternSyntaxException(e.getMessage(), query, -1);
            pse.initCause(e);
            throw pse;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "query: " + query + " flags: " + flagMgr.stringFrom(flags)
                + " engine: " + engine);
        }
    }

    /**
     * Compiles a find expression on its own.
     *
     * @throws PatternSyntaxException
     *             if <code>find</code> is malformed.
     */
    public static CompiledPattern compilePattern(String find) {
        return new QueryParser().parse(find);
    }

    /**
     * @throws PatternSyntaxException
     *             if any part of the query is malformed, or if a forced engine
     *             style cannot handle the pattern.
     */
    public static Query compile(String query) {
        int i = 0;
        if (query.startsWith("%")) ++i;
        if (!query.startsWith("s/", i)) {
            throw new PatternSyntaxException("query must start with \"s/\"", query, i);
        }
        i += 2;
        StringBuilder sb = new StringBuilder();
        String[] parts = new String[2];
        int n = 0;
        for (; i < query.length() && n < 2; ++i) {
            char c = query.charAt(i);
            if (c == '\\' && i + 1 < query.length()) {
                char d = query.charAt(++i);
                if (d != '/') sb.append('\\');
                sb.append(d);
            } else if (c == '/') {
                parts[n++] = sb.toString();
                Misc.clear(sb);
            } else {
                sb.append(c);
            }
        }
        if (n == 1) {               // s/find/replace without the final slash
            parts[n++] = sb.toString();
            Misc.clear(sb);
        }
        if (n < 2) {
            throw new PatternSyntaxException("missing replacement", query, query.length());
        }
        int flags = 0;
        for (int j = i; j < query.length(); ++j) {
            switch (query.charAt(j)) {
            case 'g':
                flags |= GLOBAL;
                break;
            case 'd':
                flags |= FORCE_DFA;
                break;
            case 'n':
                flags |= FORCE_NFA;
                break;
            default:
                throw new PatternSyntaxException(
                    "unknown flag '" + query.charAt(j) + "'", query, j);
            }
        }
        if (Misc.isSet(flags, FORCE_DFA) && Misc.isSet(flags, FORCE_NFA)) {
            throw new PatternSyntaxException("flags 'd' and 'n' exclude each other", query, i);
        }
        return new Query(query, parts[0], parts[1], flags);
    }

    public Matcher matcher(CharSequence text, SourceModel model) {
        return new Matcher(engine, text, model);
    }

    /**
     * Applies this query to <code>text</code>.
     *
     * @return the rewritten text, or the text itself if no match was accepted.
     */
    public String apply(CharSequence text, SourceModel model, MatchPredicate predicate) {
        return matcher(text, model).replace(replacement, predicate, isGlobal());
    }

    public CompiledPattern pattern() {
        return pattern;
    }

    public Replacement replacement() {
        return replacement;
    }

    public String find() {
        return find;
    }

    public int flags() {
        return flags;
    }

    public boolean isGlobal() {
        return Misc.isSet(flags, GLOBAL);
    }

    /**
     * @return the style of the engine actually selected.
     */
    public EngineStyle style() {
        return engine.style;
    }

    Engine engine() {
        return engine;
    }

    @Override
    public String toString() {
        return query;
    }
}
