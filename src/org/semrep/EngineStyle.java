/* @LICENSE@
 */
package org.semrep;

import static org.semrep.CompiledPattern.Feature;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The ways a {@link CompiledPattern} can be matched. Each concrete style
 * names an {@link Engine} class, loaded reflectively together with its
 * <code>CAPABILITIES</code>; {@link #newEngine(CompiledPattern)} refuses a
 * pattern whose {@link CompiledPattern#requirements() requirements} the
 * style lacks.
 */
public enum EngineStyle {

    /**
     * Tries {@link #DFA} then {@link #NFA}. Capture groups and semantic
     * qualifiers go straight to NFA; a pattern whose subset construction
     * blows the state budget falls back to NFA as well.
     */
    DYNAMIC {
        @Override
        Engine newEngine(CompiledPattern pattern) {
            Engine engine = null;
            for (EngineStyle style : EngineStyle.values()) {
                if (style == DYNAMIC) continue;
                if (style.capabilities().containsAll(pattern.requirements())) {
                    try {
                        engine = style.newEngine(pattern);
                        logger.log(level, "selected " + style + " for " + pattern.requirements());
                        break;
                    } catch (ConstructionException e) {
                        logger.log(level, style + " refused, trying next: " + e.getMessage());
                    }
                }
            }
            if (engine == null) {
                throw new AssertionError("no engine for " + pattern.requirements());
            }
            return engine;
        }
    },

    /**
     * Steps the subset-built form. Plain patterns only.
     */
    DFA("DFAcontextEngine"),

    /**
     * Strand simulation of the automaton as compiled; handles groups and
     * per-path qualifiers.
     */
    NFA("NFAstrandEngine");

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINEST;

    /**
     * Thrown when a style cannot take a pattern: a missing capability, or a
     * deterministic form over the state budget.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    final String className;

    private final Set<Feature> capabilities;

    /**
     * @return the pattern features engines of this style handle.
     */
    public Set<Feature> capabilities() {
        return capabilities;
    }

    EngineStyle() {
        assert this.name().equals("DYNAMIC");
        this.className = null;
        this.capabilities = EnumSet.allOf(Feature.class);
    }

    @SuppressWarnings("unchecked")
    EngineStyle(String className) {
        this.className = className;
        try {
            Class<?> clazz = Class.forName("org.semrep." + className);
            Field f = clazz.getDeclaredField("CAPABILITIES");
            capabilities = (Set<Feature>) f.get(null);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    Engine newEngine(CompiledPattern pattern) {
        assert className != null;
        if (!capabilities.containsAll(pattern.requirements())) {
            Set<Feature> shortcomings = EnumSet.noneOf(Feature.class);
            shortcomings.addAll(pattern.requirements());
            shortcomings.removeAll(capabilities);
            assert !shortcomings.isEmpty();
            throw new ConstructionException(
                "EngineStyle: " + this + " is missing required features: "
                + shortcomings);
        }
        try {
            Class<?> clazz = Class.forName("org.semrep." + className);
            Constructor<?> ctor = clazz.getDeclaredConstructor(
                    EngineStyle.class, CompiledPattern.class);
            return (Engine) ctor.newInstance(this, pattern);
        } catch (InvocationTargetException e) {
            // the DFA state budget surfaces here
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new AssertionError(e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
