/* @LICENSE@
 */
package org.semrep;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.semrep.lang.IdentifierRecord;
import org.semrep.lang.SourceModel;

/**
 * Finds leftmost-longest, non-overlapping matches of a pattern in a text,
 * and rewrites them. Semantic qualifiers are checked against the
 * {@link SourceModel} of the text by the engine, per accepting path: a
 * candidate counts only if it is spanned exactly by an identifier satisfying
 * every qualifier on the path that accepted it.
 * <p>
 * Instances of this class are not safe for use by multiple concurrent
 * threads.
 */
public final class Matcher {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINEST;

    private final Engine engine;
    private final CharSequence text;
    private final SourceModel model;

    private int from = 0;
    private int replaced = 0;

    Matcher(Engine engine, CharSequence text, SourceModel model) {
        if (text == null) throw new NullPointerException("text");
        this.engine = engine;
        this.text = text;
        this.model = model != null ? model : SourceModel.EMPTY;
    }

    /**
     * Matches <code>pattern</code> with the engine chosen by
     * {@link EngineStyle#DYNAMIC}.
     */
    public Matcher(CompiledPattern pattern, CharSequence text, SourceModel model) {
        this(EngineStyle.DYNAMIC.newEngine(pattern), text, model);
    }

    public Matcher(Query query, CharSequence text, SourceModel model) {
        this(query.engine(), text, model);
    }

    /**
     * @return the next match, or null if there is none.
     */
    public Match find() {
        final int len = text.length();
        while (from <= len) {
            Engine.CGA cga = engine.eval(text, from, len, model);
            if (cga != null) {
                int s = cga.start(0), e = cga.end(0);
                IdentifierRecord context = model.identifierAt(s, e);
                from = (e == s) ? e + 1 : e;
                Match m = new Match(text, cga, context);
                if (logger.isLoggable(level)) {
                    logger.log(level, "match " + m + " context " + context);
                }
                return m;
            }
            ++from;
        }
        return null;
    }

    /**
     * @return every remaining match, in text order.
     */
    public List<Match> findAll() {
        List<Match> ret = new ArrayList<Match>();
        for (Match m; (m = find()) != null;) {
            ret.add(m);
        }
        return ret;
    }

    /**
     * Restarts matching at the beginning of the text.
     */
    public Matcher reset() {
        from = 0;
        replaced = 0;
        return this;
    }

    /**
     * Rewrites the text: each match, in increasing offset order, is offered
     * to <code>predicate</code> and replaced by the rendered
     * <code>replacement</code> if accepted. Without <code>global</code>, stops
     * after the first accepted replacement. Starts from the beginning of the
     * text.
     *
     * @return the rewritten text; the original text if nothing was accepted.
     */
    public String replace(Replacement replacement, MatchPredicate predicate, boolean global) {
        reset();
        StringBuilder sb = new StringBuilder(text.length());
        int append = 0;
        for (Match m; (m = find()) != null;) {
            if (!predicate.accept(m.group(), m.semanticContext())) continue;
            sb.append(text, append, m.start());
            replacement.appendTo(sb, m);
            append = m.end();
            ++replaced;
            if (!global) break;
        }
        if (replaced == 0) return text.toString();
        sb.append(text, append, text.length());
        return sb.toString();
    }

    public String replaceAll(Replacement replacement) {
        return replace(replacement, MatchPredicate.ALWAYS, true);
    }

    public String replaceFirst(Replacement replacement) {
        return replace(replacement, MatchPredicate.ALWAYS, false);
    }

    /**
     * @return the number of replacements made by the last
     *         {@link #replace(Replacement, MatchPredicate, boolean)}.
     */
    public int replaced() {
        return replaced;
    }

    /**
     * @return the engine style doing the matching.
     */
    public EngineStyle style() {
        return engine.style;
    }

    @Override
    public String toString() {
        return "Matcher[" + engine + " at " + from + "]";
    }
}
