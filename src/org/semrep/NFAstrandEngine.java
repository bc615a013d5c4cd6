/*@LICENSE@
 */
package org.semrep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.semrep.lang.IdentifierRecord;
import org.semrep.lang.SourceModel;

/**
 * Full featured engine: simulates the nondeterministic automaton directly,
 * carrying capture offsets along every path. Each active node is a
 * {@link Strand}; strands are kept in priority order (the order in which
 * transitions were added to the arena), so when several paths reach the same
 * node the first one wins, and the accepting strand of highest priority
 * supplies the groups.
 * <p>
 * A strand also remembers which semantic qualifiers it went through. Strands
 * on the same node with different qualifier sets are kept apart, and an
 * accepting strand counts only if every qualifier on its own path holds for
 * the identifier spanning the candidate.
 */
final class NFAstrandEngine extends Engine {

    static final Set<CompiledPattern.Feature> CAPABILITIES =
            EnumSet.allOf(CompiledPattern.Feature.class);

    /*
     * why "Strand"? Because it's not a Thread, dammit.
     */
    private static final class Strand {

        final NodePointer node;
        final CGA cga;
        final BitSet passed;    // indices into qualifiers; never mutated once shared

        Strand(NodePointer node, CGA cga, BitSet passed) {
            this.node = node;
            this.cga = cga;
            this.passed = passed;
        }

        @Override
        public String toString() {
            return "{s=" + node + ",cg=" + cga + ",q=" + passed + '}';
        }
    }

    private static final BitSet NONE = new BitSet(0);

    private final int ngroups;

    /*
     * entry node of each qualifier -> its index in qualifiers
     */
    private final Map<NodePointer, Integer> entries = new HashMap<NodePointer, Integer>();
    private final List<SemanticQuery> qualifiers = new ArrayList<SemanticQuery>();

    NFAstrandEngine(EngineStyle style, CompiledPattern pattern) {
        super(style, pattern);
        this.ngroups = pattern.groupCount() + 1;
        Automaton automaton = pattern.automaton();
        for (int i = 0; i < automaton.size(); ++i) {
            NodePointer p = automaton.pointer(i);
            for (Transition t : automaton.rawTransitions(p)) {
                if (t.kind() == Transition.Kind.SEMANTIC_PREDICATE) {
                    entries.put(p, Integer.valueOf(qualifiers.size()));
                    qualifiers.add(SemanticQuery.parse(t.label.expression()));
                }
            }
        }
    }

    @Override
    CGA eval(CharSequence csq, int start, int end, SourceModel model) {

        final Automaton automaton = pattern.automaton();
        final NodePointer accept = pattern.accept();

        List<Strand> curr = new ArrayList<Strand>();
        Map<NodePointer, Set<BitSet>> seen = new HashMap<NodePointer, Set<BitSet>>();
        addClosure(curr, seen, new Strand(pattern.start(), new CGA(ngroups), NONE), start);
        assert nodesOf(curr).equals(Context.initial(pattern).nodes());

        CGA best = accepted(curr, accept, start, start, model);

        for (int i = start; i < end && !curr.isEmpty(); ++i) {
            final char c = csq.charAt(i);
            List<Strand> next = new ArrayList<Strand>(curr.size());
            seen.clear();
            for (Strand s : curr) {
                for (Transition t : automaton.rawTransitions(s.node)) {
                    if (t.label.matches(c)) {
                        addClosure(next, seen,
                            new Strand(t.dest, s.cga, entering(s)), i + 1);
                    }
                }
            }
            assert nodesOf(next).equals(
                Context.closure(automaton, nodesOf(curr)).step(automaton, c).nodes());
            curr = next;
            CGA cga = accepted(curr, accept, start, i + 1, model);
            if (cga != null) best = cga;
        }
        return best;
    }

    /*
     * The only symbol edge out of a qualifier's entry node leads into the
     * qualifier body, so consuming from there means taking the qualifier.
     */
    private BitSet entering(Strand s) {
        Integer q = entries.get(s.node);
        if (q == null || s.passed.get(q.intValue())) return s.passed;
        BitSet passed = (BitSet) s.passed.clone();
        passed.set(q.intValue());
        return passed;
    }

    /*
     * Preorder depth first walk over traversable zero width edges, in
     * transition order, recording group offsets as the markers fire.
     */
    private void addClosure(List<Strand> list, Map<NodePointer, Set<BitSet>> seen,
            Strand from, int pos) {

        final Automaton automaton = pattern.automaton();
        Deque<Strand> stack = new ArrayDeque<Strand>();
        stack.push(from);
        while (!stack.isEmpty()) {
            Strand s = stack.pop();
            Set<BitSet> sets = seen.get(s.node);
            if (sets == null) {
                seen.put(s.node, sets = new HashSet<BitSet>(2));
            }
            if (!sets.add(s.passed)) continue;
            list.add(s);
            List<Transition> ts = automaton.rawTransitions(s.node);
            for (int k = ts.size() - 1; k >= 0; --k) {
                Transition t = ts.get(k);
                switch (t.kind()) {
                case EPSILON:
                    stack.push(new Strand(t.dest, s.cga, s.passed));
                    break;
                case GROUP_OPEN: {
                    CGA c = new CGA(s.cga);
                    c.start(t.label.group(), pos);
                    c.end(t.label.group(), -1);
                    stack.push(new Strand(t.dest, c, s.passed));
                    break;
                }
                case GROUP_CLOSE: {
                    CGA c = new CGA(s.cga);
                    c.end(t.label.group(), pos);
                    stack.push(new Strand(t.dest, c, s.passed));
                    break;
                }
                default:
                    break;
                }
            }
        }
    }

    private CGA accepted(List<Strand> strands, NodePointer accept, int start, int pos,
            SourceModel model) {
        for (Strand s : strands) {
            if (s.node.equals(accept) && qualifiersHold(s.passed, model, start, pos)) {
                CGA cga = new CGA(s.cga);
                cga.start(0, start);
                cga.end(0, pos);
                return cga;
            }
        }
        return null;
    }

    private boolean qualifiersHold(BitSet passed, SourceModel model, int start, int pos) {
        if (passed.isEmpty()) return true;
        IdentifierRecord context = model.identifierAt(start, pos);
        for (int q = passed.nextSetBit(0); q >= 0; q = passed.nextSetBit(q + 1)) {
            if (!qualifiers.get(q).matches(context)) return false;
        }
        return true;
    }

    private static SortedSet<NodePointer> nodesOf(List<Strand> strands) {
        SortedSet<NodePointer> ret = new TreeSet<NodePointer>();
        for (Strand s : strands) ret.add(s.node);
        return ret;
    }

    @Override
    protected String doToString() {
        return pattern.automaton().size() + " nfa nodes, " + (ngroups - 1) + " groups, "
            + qualifiers.size() + " qualifiers";
    }
}
