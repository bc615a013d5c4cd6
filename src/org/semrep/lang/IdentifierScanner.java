/* @LICENSE@
 */
package org.semrep.lang;

import static org.semrep.SymbolSet.isAlphabetic;
import static org.semrep.SymbolSet.isAlphanumeric;
import static org.semrep.SymbolSet.isWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds typed identifiers: declarations of the form <code>Type name</code>
 * and later single token uses of a declared name, resolved through a
 * {@link ScopeStack} driven by braces. Qualified chains (<code>a.b.c</code>)
 * are skipped. Instances are single use.
 */
final class IdentifierScanner {

    private static final Logger logger = Logger.getLogger("org.semrep");
    private static final Level level = Level.FINEST;

    enum State {
        IDLE,
        TOKEN1,
        SPACE,
        TOKEN2,
        DOT_SUPPRESSED
    }

    private final Language language;
    private final ScopeStack scopes = new ScopeStack();
    private final List<IdentifierRecord> found = new ArrayList<IdentifierRecord>();

    private State state = State.IDLE;
    private int t1s, t1e, t2s;

    IdentifierScanner(Language language) {
        this.language = language;
    }

    List<IdentifierRecord> scan(CharSequence text) {
        for (int i = 0; i < text.length(); ++i) {
            step(text, i, text.charAt(i));
        }
        return found;
    }

    ScopeStack scopes() {
        return scopes;
    }

    State state() {
        return state;
    }

    private void step(CharSequence text, int i, char c) {
        // braces win over everything; a pending token is dropped
        if (c == '{') {
            scopes.push();
            state = State.IDLE;
            return;
        }
        if (c == '}') {
            scopes.pop();
            state = State.IDLE;
            return;
        }
        switch (state) {
        case IDLE:
            if (c == '.') {
                state = State.DOT_SUPPRESSED;
            } else if (isAlphabetic(c)) {
                state = State.TOKEN1;
                t1s = i;
            }
            break;
        case TOKEN1:
            if (isWhitespace(c)) {
                t1e = i;
                state = State.SPACE;
            } else if (!isAlphanumeric(c)) {
                t1e = i;
                use(text);
                state = c == '.' ? State.DOT_SUPPRESSED : State.IDLE;
            }
            break;
        case SPACE:
            if (isAlphabetic(c)) {
                t2s = i;
                state = State.TOKEN2;
            } else if (!isWhitespace(c)) {
                use(text);
                state = State.IDLE;
            }
            break;
        case TOKEN2:
            if (!isAlphanumeric(c)) {
                declare(text, i);
                state = c == '.' ? State.DOT_SUPPRESSED : State.IDLE;
            }
            break;
        case DOT_SUPPRESSED:
            if (!isAlphanumeric(c) && c != '.') {
                state = State.IDLE;
            }
            break;
        default:
            throw new AssertionError(state);
        }
    }

    private void use(CharSequence text) {
        String name = text.subSequence(t1s, t1e).toString();
        String type = scopes.resolve(name);
        if (type != null) {
            found.add(new IdentifierRecord(name, type, t1s, t1e));
        }
    }

    private void declare(CharSequence text, int t2e) {
        String type = text.subSequence(t1s, t1e).toString();
        String name = text.subSequence(t2s, t2e).toString();
        if (language.isDisallowed(type) || language.isDisallowed(name)) {
            return;
        }
        found.add(new IdentifierRecord(name, type, t2s, t2e));
        scopes.declare(name, type);
        if (logger.isLoggable(level)) {
            logger.log(level, "declared " + type + " " + name + " at depth " + scopes.depth());
        }
    }
}
