/* @LICENSE@
 */

package org.semrep;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subset construction: flattens a {@link CompiledPattern} into an equivalent
 * one whose every node stands for one canonical set of nodes of the source
 * automaton. The result is built from the same primitives (a fresh
 * {@link Automaton}), so it is simulated by the same {@link Context}.
 */
final class DfaCompiler {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINER;

    static final int MAX_STATE_COUNT = 10 * 1000;

    private final CompiledPattern source;

    DfaCompiler(CompiledPattern source) {
        this.source = source;
    }

    CompiledPattern compile() {

        final Automaton src = source.automaton();
        final Automaton dfa = new Automaton();
        final NodePointer start = dfa.newNode();
        final NodePointer accept = dfa.newNode();

        /*
         * canonical node set -> destination node. A set is enqueued exactly
         * once, when it is first interned.
         */
        final Map<SortedSet<NodePointer>, NodePointer> interned =
                new LinkedHashMap<SortedSet<NodePointer>, NodePointer>();
        final Queue<SortedSet<NodePointer>> worklist =
                new ArrayDeque<SortedSet<NodePointer>>();

        SortedSet<NodePointer> init = Context.initial(source).nodes();
        interned.put(init, start);
        worklist.add(init);

        while (!worklist.isEmpty()) {
            SortedSet<NodePointer> set = worklist.remove();
            NodePointer from = interned.get(set);
            if (from == null) {
                throw new AssertionError("node set was never interned: " + set);
            }
            if (set.contains(source.accept())) {
                dfa.addEpsilon(from, accept);
            }

            /*
             * group the symbol consuming (and semantic) moves of all members
             * by label; epsilons and group markers are absorbed by the closure.
             */
            Map<Transition.Label, Set<NodePointer>> moves =
                    new LinkedHashMap<Transition.Label, Set<NodePointer>>();
            for (NodePointer p : set) {
                for (Transition t : src.rawTransitions(p)) {
                    if (t.kind().isTraversable()) continue;
                    Set<NodePointer> dests = moves.get(t.label);
                    if (dests == null) {
                        moves.put(t.label, dests = new LinkedHashSet<NodePointer>());
                    }
                    dests.add(t.dest);
                }
            }

            for (Map.Entry<Transition.Label, Set<NodePointer>> e : moves.entrySet()) {
                SortedSet<NodePointer> next = Context.closure(src, e.getValue()).nodes();
                NodePointer to = interned.get(next);
                if (to == null) {
                    if (interned.size() >= MAX_STATE_COUNT) {
                        throw new EngineStyle.ConstructionException(
                            "DFA state count exceeded: " + MAX_STATE_COUNT);
                    }
                    to = dfa.newNode();
                    interned.put(next, to);
                    worklist.add(next);
                }
                dfa.addTransition(from, e.getKey(), to);
            }
        }

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + interned.size() + " states from "
                + src.size() + " nodes" + Misc.LS + dfa);
        }
        return new CompiledPattern(dfa, start, accept);
    }
}
