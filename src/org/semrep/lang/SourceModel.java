/* @LICENSE@
 */
package org.semrep.lang;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The semantic context of one text: the functions and typed identifiers its
 * {@link Language} finds in it. Immutable once scanned.
 */
public final class SourceModel {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINER;

    /**
     * A model with no functions and no identifiers, for plain text matching.
     */
    public static final SourceModel EMPTY = new SourceModel(null,
        Collections.<FunctionRecord>emptyList(), Collections.<IdentifierRecord>emptyList());

    private final Language language;
    private final List<FunctionRecord> functions;
    private final List<IdentifierRecord> identifiers;
    private final Map<Long, IdentifierRecord> bySpan = new HashMap<Long, IdentifierRecord>();
    private final Map<String, String> types = new HashMap<String, String>();

    private SourceModel(Language language, List<FunctionRecord> functions,
            List<IdentifierRecord> identifiers) {
        this.language = language;
        this.functions = Collections.unmodifiableList(functions);
        this.identifiers = Collections.unmodifiableList(identifiers);
        for (IdentifierRecord r : identifiers) {
            // first record wins for a span
            Long key = key(r.start(), r.end());
            if (!bySpan.containsKey(key)) bySpan.put(key, r);
            if (!types.containsKey(r.name())) types.put(r.name(), r.type());
        }
    }

    /**
     * Runs both scanners of <code>language</code> over <code>text</code> once.
     */
    public static SourceModel scan(Language language, CharSequence text) {
        SourceModel model = new SourceModel(language,
            language.readFunctions(text), language.readIdentifiers(text));
        if (logger.isLoggable(level)) {
            logger.log(level, language.name() + ": " + model.functions.size()
                + " functions, " + model.identifiers.size() + " identifiers");
        }
        return model;
    }

    private static Long key(int start, int end) {
        return Long.valueOf(((long) start << 32) | (end & 0xffffffffL));
    }

    /**
     * @return the language that produced this model, null for {@link #EMPTY}.
     */
    public Language language() {
        return language;
    }

    public List<FunctionRecord> functions() {
        return functions;
    }

    /**
     * @return every identifier record, in text order.
     */
    public List<IdentifierRecord> identifiers() {
        return identifiers;
    }

    /**
     * @return the identifier record spanning exactly
     *         <code>[start, end)</code>, or null.
     */
    public IdentifierRecord identifierAt(int start, int end) {
        return bySpan.get(key(start, end));
    }

    /**
     * @return the type of the first declaration or use of <code>name</code>
     *         found in the text, or null.
     */
    public String typeOf(String name) {
        return types.get(name);
    }

    @Override
    public String toString() {
        return "functions=" + functions + " identifiers=" + identifiers;
    }
}
