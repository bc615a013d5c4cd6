/* @LICENSE@
 */
package org.semrep.lang;

import static org.semrep.SymbolSet.isAlphanumeric;
import static org.semrep.SymbolSet.isWhitespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds function declarations of the form <code>name(...) {</code>, with
 * optional trailing modifiers between the parameter list and the brace
 * (<code>name(...) throws X {</code>). One pass, one character at a time.
 * Instances are single use.
 */
final class FunctionScanner {

    enum State {
        IDLE,
        NAME,
        PAREN_DEPTH,
        SPACE_AFTER_PARENS,
        BRACE_ENTERED
    }

    private State state = State.IDLE;
    private int depth = 0;
    private int nameStart = 0;
    private int nameEnd = 0;

    private final List<FunctionRecord> found = new ArrayList<FunctionRecord>();

    List<FunctionRecord> scan(CharSequence text) {
        for (int i = 0; i < text.length(); ++i) {
            step(text, i, text.charAt(i));
        }
        return found;
    }

    State state() {
        return state;
    }

    private void step(CharSequence text, int i, char c) {
        switch (state) {
        case BRACE_ENTERED:
            // the record went out on the brace; the next char is swallowed
            state = State.IDLE;
            break;
        case IDLE:
            if (isAlphanumeric(c)) {
                state = State.NAME;
                nameStart = i;
            }
            break;
        case NAME:
            if (c == '(') {
                state = State.PAREN_DEPTH;
                depth = 1;
                nameEnd = i;
            } else if (!isAlphanumeric(c)) {
                state = State.IDLE;
            }
            break;
        case PAREN_DEPTH:
            if (c == '(') {
                ++depth;
            } else if (c == ')') {
                --depth;
            } else if (depth == 0 && isWhitespace(c)) {
                state = State.SPACE_AFTER_PARENS;
            } else if (depth == 0 && c == '{') {
                enter(text);
            }
            break;
        case SPACE_AFTER_PARENS:
            if (isAlphanumeric(c)) {
                state = State.NAME;
                nameStart = i;
            } else if (c == '{') {
                enter(text);
            } else if (!isWhitespace(c)) {
                state = State.IDLE;
            }
            break;
        default:
            throw new AssertionError(state);
        }
    }

    private void enter(CharSequence text) {
        state = State.BRACE_ENTERED;
        found.add(new FunctionRecord(
            text.subSequence(nameStart, nameEnd).toString(), nameStart, nameEnd));
    }
}
