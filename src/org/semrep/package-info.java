/*
 * @LICENSE@
 */

/**
 * <h3><b>semrep</b> - semantics aware structural find and replace for source
 * code.</h3>
 * <p>
 * <h4>Queries.</h4>
 * <p>
 * A query reads like an editor substitution, <code>%s/find/replace/g</code>.
 * The find half is a regular expression, extended with <i>semantic
 * qualifiers</i>: <code>[[type=Session]]</code> matches an identifier, but
 * only one whose declared type, as found by a lightweight scan of the file
 * (see {@link org.semrep.lang}), is <code>Session</code>. The replace half may
 * reference capture groups as <code>$1</code> to <code>$9</code>.
 * <p>
 * <h4>Automata.</h4>
 * <p>
 * Patterns compile to an {@link org.semrep.Automaton}: an append-only arena of
 * nodes with labeled, ordered transitions. The same arena represents both the
 * nondeterministic form built by the parser and the deterministic form built
 * from it by subset construction; a {@link org.semrep.Context} simulates
 * either one, one input symbol at a time.
 * <p>
 * <h4>Requirements based matching algorithm selection.</h4>
 * <p>
 * As with any automaton based regex package, "engines are cheap". Each
 * {@link org.semrep.EngineStyle} has a set of capabilities; a pattern has a
 * set of requirements (capture groups, semantic predicates), and the first
 * style whose capabilities cover them is used. Patterns without capture
 * groups run on the deterministic form; capture groups are supported by the
 * ("tagged") NFA engine.
 * <p>
 * <h4>Matching.</h4>
 * <p>
 * Matches are leftmost-longest and never overlap. Semantic qualifiers are
 * checked once a candidate has been found; a caller supplied
 * {@link org.semrep.MatchPredicate} has the final say on each replacement.
 * {@link org.semrep.FileTreeRewriter} and {@link org.semrep.Main} apply a
 * query to a whole source tree.
 */
package org.semrep;
