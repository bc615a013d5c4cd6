/*
 * @LICENSE@
 */

package org.semrep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An {@link Automaton} bundled with a designated start node and a designated
 * accepting node: the unit produced by pattern compilation and consumed by
 * matching. The automaton is frozen on construction, so instances are
 * immutable and thread safe.
 */
public final class CompiledPattern {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINEST;

    /**
     * Characteristics of a pattern which determine the selection of a
     * matching algorithm, as represented by the {@link EngineStyle} class.
     */
    public enum Feature {
        /**
         * The automaton has at least one capture group marker. Group 0 (the
         * whole match) does not count.
         */
        CAPTURING_GROUPS,
        /**
         * The automaton carries at least one semantic predicate, evaluated
         * after the fact against the {@link org.semrep.lang.SourceModel}.
         */
        SEMANTIC_PREDICATES;
    }

    private final Automaton automaton;
    private final NodePointer start;
    private final NodePointer accept;
    private final int groupCount;
    private final List<SemanticQuery> semanticQueries;
    private final Set<Feature> requirements;

    public CompiledPattern(Automaton automaton, NodePointer start, NodePointer accept) {
        if (!automaton.isValid(start)) {
            throw new Automaton.InvalidTransitionSourceException("invalid start node: " + start);
        }
        if (!automaton.isValid(accept)) {
            throw new Automaton.InvalidTransitionSourceException("invalid accept node: " + accept);
        }
        this.automaton = automaton.freeze();
        this.start = start;
        this.accept = accept;

        int ncg = 0;
        Set<String> expressions = new LinkedHashSet<String>();
        for (int i = 0; i < automaton.size(); ++i) {
            for (Transition t : automaton.rawTransitions(automaton.pointer(i))) {
                switch (t.kind()) {
                case GROUP_OPEN:
                case GROUP_CLOSE:
                    ncg = Math.max(ncg, t.label.group());
                    break;
                case SEMANTIC_PREDICATE:
                    expressions.add(t.label.expression());
                    break;
                default:
                    break;
                }
            }
        }
        this.groupCount = ncg;
        List<SemanticQuery> queries = new ArrayList<SemanticQuery>(expressions.size());
        for (String x : expressions) {
            queries.add(SemanticQuery.parse(x));
        }
        this.semanticQueries = Collections.unmodifiableList(queries);

        EnumSet<Feature> req = EnumSet.noneOf(Feature.class);
        if (groupCount > 0) req.add(Feature.CAPTURING_GROUPS);
        if (!semanticQueries.isEmpty()) req.add(Feature.SEMANTIC_PREDICATES);
        this.requirements = Collections.unmodifiableSet(req);

        if (logger.isLoggable(level)) {
            logger.log(level, "compiled pattern: start=" + start + " accept=" + accept
                + " ncg=" + groupCount + " req=" + requirements + Misc.LS + automaton);
        }
    }

    public Automaton automaton() {
        return automaton;
    }

    public NodePointer start() {
        return start;
    }

    public NodePointer accept() {
        return accept;
    }

    /**
     * @return the highest capture group id found on a group marker, 0 if
     *         there are none.
     */
    public int groupCount() {
        return groupCount;
    }

    public List<SemanticQuery> semanticQueries() {
        return semanticQueries;
    }

    /**
     * The set of {@linkplain Feature features} which engines matching this
     * pattern must implement; {@linkplain Collections#unmodifiableSet(Set)
     * unmodifiable}.
     */
    public Set<Feature> requirements() {
        return requirements;
    }

    /**
     * @return the deterministic form of this pattern, built by subset
     *         construction. Capture group markers are absorbed.
     * @throws EngineStyle.ConstructionException
     *             if the construction exceeds the state budget.
     */
    public CompiledPattern toDfa() {
        return new DfaCompiler(this).compile();
    }

    @Override
    public String toString() {
        return "start=" + start + " accept=" + accept + Misc.LS + automaton;
    }
}
