/* @LICENSE@
 */

package org.semrep;

import java.util.regex.PatternSyntaxException;

import org.semrep.CompiledPattern.Feature;

public class QueryParserTestCase extends AbstractSemrepTestCase {

    public QueryParserTestCase(String name) {
        super(name);
    }

    private static void assertMalformed(String query) {
        try {
            Query q = Query.compile(query);
            fail("should not compile: " + query + " -> " + q.pattern());
        } catch (PatternSyntaxException e) {
            logger.log(level, e.getMessage());
        }
    }

    public void testMalformedQueries() {
        assertMalformed("");
        assertMalformed("x/a/b/");
        assertMalformed("%x/a/b/");
        assertMalformed("s/a");
        assertMalformed("s//b/");
        assertMalformed("s/a/b/q");
        assertMalformed("s/a/b/g/");
        assertMalformed("s/a/b/dn");
    }

    public void testMalformedFind() {
        assertMalformed("s/a(/b/");
        assertMalformed("s/a)/b/");
        assertMalformed("s/*a/b/");
        assertMalformed("s/a**/b/");
        assertMalformed("s/[a/b/");
        assertMalformed("s/[]/b/");
        assertMalformed("s/[z-a]/b/");
        assertMalformed("s/[\\W]/b/");
        assertMalformed("s/\\q/b/");
        assertMalformed("s/(?=a)/b/");
    }

    public void testMalformedQualifiers() {
        assertMalformed("s/[[type]]/b/");
        assertMalformed("s/[[color=red]]/b/");
        assertMalformed("s/[[type=]]/b/");
        assertMalformed("s/[[type=Session/b/");
    }

    public void testMalformedTemplates() {
        assertMalformed("s/a/$1/");
        assertMalformed("s/(a)/$2/");
        assertMalformed("s/a/b$/");
        assertMalformed("s/a/$x/");
        assertMalformed("s/a/b\\");
        assertMalformed("s/a/\\n/");
    }

    public void testForcedDfaCannotCapture() {
        assertMalformed("s/(a)/b/d");
        assertEquals(EngineStyle.DFA, Query.compile("s/(?:a)/b/d").style());
    }

    public void testSemanticQuery() {
        Query q = Query.compile("%s/[[type=Session]]/sess/g");
        assertTrue(q.isGlobal());
        assertEquals("[[type=Session]]", q.find());
        assertEquals("sess", q.replacement().template());
        assertEquals(1, q.pattern().semanticQueries().size());
        SemanticQuery sq = q.pattern().semanticQueries().get(0);
        assertEquals(SemanticQuery.Key.TYPE, sq.key());
        assertEquals("Session", sq.value());
        assertFalse(sq.isNegated());
        assertTrue(q.pattern().requirements().contains(Feature.SEMANTIC_PREDICATES));
        assertEquals(EngineStyle.NFA, q.style());
        assertMalformed("s/[[type=Session]]/sess/d");
    }

    public void testNegatedQualifier() {
        Query q = Query.compile("s/[[name!=tmp]]/x/");
        SemanticQuery sq = q.pattern().semanticQueries().get(0);
        assertEquals(SemanticQuery.Key.NAME, sq.key());
        assertTrue(sq.isNegated());
        assertEquals("tmp", sq.value());
        assertFalse(q.isGlobal());
    }

    public void testGroups() {
        Query q = Query.compile("s/(a)(?:b)(c)/$2$1/");
        assertEquals(2, q.pattern().groupCount());
        assertTrue(q.pattern().requirements().contains(Feature.CAPTURING_GROUPS));
        assertEquals(EngineStyle.NFA, q.style());
    }

    public void testEscapedDelimiter() {
        Query q = Query.compile("s/a\\/b/c\\/d/");
        assertEquals("a/b", q.find());
        assertEquals("c/d", q.replacement().template());
        assertEquals("x c/d y", q.apply("x a/b y", null, MatchPredicate.ALWAYS));
    }

    public void testOptionalTrailingSlash() {
        Query q = Query.compile("s/a/b");
        assertEquals("bab", q.apply("aab", null, MatchPredicate.ALWAYS));
    }

    public void testFlags() {
        assertEquals(EngineStyle.NFA, Query.compile("s/a/b/n").style());
        assertEquals(EngineStyle.DFA, Query.compile("s/a/b/gd").style());
        Query q = Query.compile("s/a/b/gn");
        assertEquals(Query.GLOBAL | Query.FORCE_NFA, q.flags());
    }

    public void testEscapes() {
        CompiledPattern p = Query.compilePattern("\\.\\*\\t");
        Context c = Context.initial(p);
        for (char ch : ".*\t".toCharArray()) {
            c = c.step(p.automaton(), ch);
        }
        assertTrue(c.contains(p.accept()));
    }
}
