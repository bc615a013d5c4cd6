/* @LICENSE@
 */

package org.semrep;

import static org.semrep.SymbolSet.Category;

/**
 * Recursive descent parser for the find half of a query. The automaton is
 * built as the parse goes (Thompson construction), one {@link Frag} per
 * construct, all on a single fresh {@link Automaton}. Alternatives and
 * quantifier loops are wired so that the preferred path is always the first
 * transition out of a node.
 */
final class QueryParser {

    /*
     * a partially built automaton: one entry node, one exit node.
     */
    private static final class Frag {
        final NodePointer in;
        final NodePointer out;

        Frag(NodePointer in, NodePointer out) {
            this.in = in;
            this.out = out;
        }
    }

    private static final int EOX = -1;  // end of expression
    private static final int BACKSLASH = 0x80000000;

    private static final SymbolSet DOT = SymbolSet.of("\n");

    private String regex;
    private Automaton a;
    private int ncg;        // capturing group index

    /*
     * state for nextToken() and pushbackToken()
     */
    private int token;      // bit 31 is set if escaped
    private int iNext;
    private int iCurrent;

    /**
     * @throws java.util.regex.PatternSyntaxException
     *             if <code>regex</code> is malformed.
     */
    CompiledPattern parse(String regex) {
        this.regex = regex;
        this.a = new Automaton();
        ncg = 0;
        iNext = 0;
        iCurrent = -1;
        token = EOX;

        if (regex.length() == 0) {
            syntaxError("empty pattern");
        }
        Frag f = exp();
        switch (token) {
        case EOX:
            break;
        case ')':
            syntaxError("unbalanced parenthesis");
            break;
        default:
            throw new AssertionError("unexpected char at end of expression: " + (char) token);
        }
        return new CompiledPattern(a, f.in, f.out);
    }

    private Frag exp() {
        Frag ret = term();
        if (token == '|') {
            Frag rhs = exp();
            NodePointer in = a.newNode();
            NodePointer out = a.newNode();
            a.addEpsilon(in, ret.in);
            a.addEpsilon(in, rhs.in);
            a.addEpsilon(ret.out, out);
            a.addEpsilon(rhs.out, out);
            ret = new Frag(in, out);
        }
        return ret;
    }

    /*
     * a sequence of quantified factors, up to '|', ')' or the end
     */
    private Frag term() {
        Frag ret = null;
        Frag node;
        loop:
        while (true) {
            nextToken();
            switch (token) {
            case EOX:
            case ')':
            case '|':
                break loop;
            case '*':
            case '+':
            case '?':
                syntaxError("dangling quantifier");
                return null;
            case '(':
                nextToken();
                if (token == '?') {
                    nextToken();
                    if (token != ':') {
                        syntaxError("unsupported group construct");
                    }
                    node = exp();
                } else {
                    pushbackToken();
                    int cg = ++ncg;
                    Frag inner = exp();
                    NodePointer in = a.newNode();
                    NodePointer out = a.newNode();
                    a.addCaptureGroup(in, inner.in, inner.out, out, cg);
                    node = new Frag(in, out);
                }
                if (token != ')') {
                    syntaxError("unbalanced parenthesis");
                }
                break;
            case '.':
                node = single(Transition.Label.negatedCharSet(DOT));
                break;
            case '[':
                if (hasNextChar() && regex.charAt(iNext) == '[') {
                    node = semanticQualifier();
                } else {
                    node = charClass();
                }
                break;
            case BACKSLASH | 'd':
                node = single(Transition.Label.charSet(SymbolSet.DIGIT));
                break;
            case BACKSLASH | 'D':
                node = single(Transition.Label.negatedCharSet(SymbolSet.DIGIT));
                break;
            case BACKSLASH | 's':
                node = single(Transition.Label.charSet(SymbolSet.WHITESPACE));
                break;
            case BACKSLASH | 'S':
                node = single(Transition.Label.negatedCharSet(SymbolSet.WHITESPACE));
                break;
            case BACKSLASH | 'w':
                node = single(Transition.Label.charSet(SymbolSet.WORD));
                break;
            case BACKSLASH | 'W':
                node = single(Transition.Label.negatedCharSet(SymbolSet.WORD));
                break;
            default:
                node = single(Transition.Label.literal(literalChar()));
                break;
            }
            node = maybeQuantify(node);
            ret = (ret == null) ? node : cat(ret, node);
        }
        if (ret == null) {      // empty alternative
            NodePointer in = a.newNode();
            NodePointer out = a.newNode();
            a.addEpsilon(in, out);
            ret = new Frag(in, out);
        }
        return ret;
    }

    private Frag single(Transition.Label label) {
        NodePointer in = a.newNode();
        NodePointer out = a.newNode();
        a.addTransition(in, label, out);
        return new Frag(in, out);
    }

    private Frag cat(Frag f1, Frag f2) {
        a.addEpsilon(f1.out, f2.in);
        return new Frag(f1.in, f2.out);
    }

    private Frag maybeQuantify(Frag f) {
        nextToken();
        NodePointer in, out;
        switch (token) {
        case '*':
            in = a.newNode();
            out = a.newNode();
            a.addEpsilon(in, f.in);
            a.addEpsilon(in, out);
            a.addEpsilon(f.out, in);
            break;
        case '+':
            in = f.in;
            out = a.newNode();
            a.addEpsilon(f.out, f.in);
            a.addEpsilon(f.out, out);
            break;
        case '?':
            in = a.newNode();
            out = f.out;
            a.addEpsilon(in, f.in);
            a.addEpsilon(in, out);
            break;
        default:
            pushbackToken();
            return f;
        }
        nextToken();
        if (token == '*' || token == '+' || token == '?') {
            syntaxError("repeated quantifier");
        }
        pushbackToken();
        return new Frag(in, out);
    }

    /*
     * [[key=value]]: an identifier shaped run of text, plus a parallel
     * semantic predicate edge carrying the expression.
     */
    private Frag semanticQualifier() {
        int begin = iCurrent;
        int close = regex.indexOf("]]", iNext + 1);
        if (close < 0) {
            syntaxError("semantic qualifier missing \"]]\"");
        }
        String expression = regex.substring(iNext + 1, close);
        try {
            SemanticQuery.parse(expression);
        } catch (java.util.regex.PatternSyntaxException e) {
            throw new java.util.regex.PatternSyntaxException(
                e.getDescription(), regex, begin);
        }
        iNext = close + 2;

        NodePointer in = a.newNode();
        NodePointer body = a.newNode();
        NodePointer out = a.newNode();
        a.addCharSet(in, body, SymbolSet.IDENTIFIER_START);
        a.addCharSet(body, body, SymbolSet.WORD);
        a.addEpsilon(body, out);
        a.addSemanticPredicate(in, out, expression);
        return new Frag(in, out);
    }

    private Frag charClass() {
        SymbolSet.Builder ssb = new SymbolSet.Builder();
        boolean comp = false;
        boolean empty = true;
        nextToken();
        if (token == '^') {
            comp = true;
            nextToken();
        }
        loop:
        while (true) {
            switch (token) {
            case EOX:
                syntaxError("char class missing end bracket");
                break loop;
            case ']':
                if (empty) {
                    syntaxError("empty char class");
                }
                break loop;
            case BACKSLASH | 'd':
                ssb.add(Category.DIGIT);
                break;
            case BACKSLASH | 's':
                ssb.add(Category.WHITESPACE);
                break;
            case BACKSLASH | 'w':
                ssb.add(Category.WORD);
                break;
            case BACKSLASH | 'D':
            case BACKSLASH | 'S':
            case BACKSLASH | 'W':
                syntaxError("negated class escape inside a char class");
                break;
            default:
                char first = literalChar();
                nextToken();
                if (token == '-' && hasNextChar() && regex.charAt(iNext) != ']') {
                    nextToken();
                    if (token == (BACKSLASH | 'd') || token == (BACKSLASH | 's')
                            || token == (BACKSLASH | 'w')) {
                        syntaxError("bad range in char class");
                    }
                    char last = literalChar();
                    if (last < first) {
                        syntaxError("non-ascending range in char class");
                    }
                    ssb.add(first, last);
                } else {
                    ssb.add(first);
                    empty = false;
                    continue loop;      // token already read
                }
                break;
            }
            empty = false;
            nextToken();
        }
        SymbolSet set = ssb.build();
        return single(comp ? Transition.Label.negatedCharSet(set)
                           : Transition.Label.charSet(set));
    }

    /*
     * the current token as a literal char, resolving the escapes which stand
     * for one char
     */
    private char literalChar() {
        if ((token & BACKSLASH) == 0) {
            return (char) token;
        }
        char c = (char) (token & ~BACKSLASH);
        switch (c) {
        case 't': return '\t';
        case 'n': return '\n';
        case 'r': return '\r';
        default:
            if (Character.isLetterOrDigit(c)) {
                syntaxError("illegal or unsupported escape sequence");
            }
            return c;
        }
    }

    private boolean hasNextChar() {
        return iNext < regex.length();
    }

    private boolean nextRawChar() {
        if (hasNextChar()) {
            token = regex.charAt(iNext++);
            return true;
        } else {
            return false;
        }
    }

    private void nextToken() {
        iCurrent = iNext;
        if (nextRawChar()) {
            if (token == '\\') {
                if (nextRawChar()) {
                    token |= BACKSLASH;
                } else {
                    syntaxError("dangling backslash");
                }
            }
        } else {
            token = EOX;
        }
    }

    private void pushbackToken() {
        iNext = iCurrent;
    }

    private void syntaxError(String msg) {
        throw new java.util.regex.PatternSyntaxException(msg, regex, iCurrent);
    }
}
