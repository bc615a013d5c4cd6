/*@LICENSE@
 */
package org.semrep.test;

import static org.semrep.SemrepAssert.*;

import org.semrep.AbstractSemrepTestCase;
import org.semrep.Automaton;
import org.semrep.CompiledPattern;
import org.semrep.EngineStyle;
import org.semrep.Match;
import org.semrep.Matcher;
import org.semrep.NodePointer;
import org.semrep.Query;
import org.semrep.Transition;

public class CaptureGroupTestCase extends AbstractSemrepTestCase {

    public CaptureGroupTestCase(String name) {
        super(name);
    }

    public void testSimple() {
        assertFind("(a)(b)", "ab", "(0,2)(0,1)(1,2)", "");
        assertFind("x(\\d+)y", "ax12yx3y", "(1,5)(2,4)", "(5,8)(6,7)", "");
    }

    public void testAltPrio() {
        assertFind("([ab])|([ac])", "a", "(0,1)(0,1)(?,?)", "");
        assertFind("(ab|a)(bc|c)", "abc", "(0,3)(0,2)(2,3)", "");
        assertFind("(?:(foo)|(.*))(bar)", "foobar", "(0,6)(0,3)(?,?)(3,6)", "");
    }

    public void testCaptureGroupFromPreviousRep() {
        assertFind("((a)|(b))*", "ab",
            "(0,2)(1,2)(0,1)(1,2)",
            "(2,2)(?,?)(?,?)(?,?)",
            "");
    }

    public void testNestedGroupsNumberedByOpeningParen() {
        assertFind("((a)(b(c)))", "abc", "(0,3)(0,3)(0,1)(1,3)(2,3)", "");
    }

    public void testOptionalGroupDidNotParticipate() {
        CompiledPattern p = Query.compilePattern("a(b)?c");
        Matcher m = new Matcher(p, "ac", null);
        Match match = m.find();
        assertEquals(EngineStyle.NFA, m.style());
        assertEquals("ac", match.group());
        assertEquals(1, match.groupCount());
        assertNull(match.group(1));
        assertEquals(-1, match.start(1));
        assertEquals(-1, match.end(1));
        try {
            match.group(2);
            fail();
        } catch (IndexOutOfBoundsException e) {/* expected */}
    }

    public void testUnbalancedCloseIsIgnored() {
        // start -1)-> n -'a'-> accept: a close marker without its open
        Automaton a = new Automaton();
        NodePointer start = a.newNode();
        NodePointer n = a.newNode();
        NodePointer accept = a.newNode();
        a.addTransition(start, Transition.Label.groupClose(1), n);
        a.addLiteral(n, accept, 'a');
        CompiledPattern p = new CompiledPattern(a, start, accept);
        assertEquals(1, p.groupCount());

        Match match = new Matcher(p, "ba", null).find();
        assertNotNull(match);
        assertEquals(1, match.start());
        assertEquals(2, match.end());
        assertEquals(-1, match.start(1));
        assertEquals(-1, match.end(1));
        assertNull(match.group(1));
    }

    public void testGroupReplacement() {
        Query q = Query.compile("s/(\\w+)=(\\w+)/$2=$1/g");
        assertEquals("b=a; d=c;", q.apply("a=b; c=d;", null, org.semrep.MatchPredicate.ALWAYS));
        q = Query.compile("s/a(x)?b/[$1]/g");
        assertEquals("[x] []", q.apply("axb ab", null, org.semrep.MatchPredicate.ALWAYS));
    }
}
