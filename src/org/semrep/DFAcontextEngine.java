/* @LICENSE@
 */
package org.semrep;

import java.util.EnumSet;
import java.util.Set;

import org.semrep.lang.SourceModel;

/**
 * Simulates the subset-constructed form of a pattern with plain
 * {@link Context} stepping. No capture groups: the construction absorbs the
 * group markers. No semantic qualifiers either, since a set of nodes does
 * not know which path reached it.
 */
final class DFAcontextEngine extends Engine {

    static final Set<CompiledPattern.Feature> CAPABILITIES =
            EnumSet.noneOf(CompiledPattern.Feature.class);

    private final CompiledPattern dfa;
    private final Context init;

    DFAcontextEngine(EngineStyle style, CompiledPattern pattern) {
        super(style, pattern);
        this.dfa = pattern.toDfa();
        this.init = Context.initial(dfa);
    }

    @Override
    CGA eval(CharSequence csq, int start, int end, SourceModel model) {
        final Automaton automaton = dfa.automaton();
        final NodePointer accept = dfa.accept();
        Context ctx = init;
        int last = ctx.contains(accept) ? start : -1;
        for (int i = start; i < end && !ctx.isEmpty(); ++i) {
            ctx = ctx.step(automaton, csq.charAt(i));
            if (ctx.contains(accept)) last = i + 1;
        }
        if (last == -1) return null;
        CGA cga = new CGA(pattern.groupCount() + 1);
        cga.start(0, start);
        cga.end(0, last);
        return cga;
    }

    @Override
    protected String doToString() {
        return dfa.automaton().size() + " dfa nodes";
    }
}
