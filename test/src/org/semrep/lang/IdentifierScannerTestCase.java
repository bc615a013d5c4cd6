/* @LICENSE@
 */

package org.semrep.lang;

import java.util.Arrays;
import java.util.List;

import org.semrep.AbstractSemrepTestCase;

public class IdentifierScannerTestCase extends AbstractSemrepTestCase {

    public IdentifierScannerTestCase(String name) {
        super(name);
    }

    private static List<IdentifierRecord> scan(String text) {
        return new IdentifierScanner(CLike.INSTANCE).scan(text);
    }

    public void testShadowing() {
        //                      0         1         2
        //                      01234567890123456789012345
        List<IdentifierRecord> found = scan("Type x; { Type2 x; x; } x;");
        assertEquals(Arrays.asList(
                new IdentifierRecord("x", "Type", 5, 6),
                new IdentifierRecord("x", "Type2", 16, 17),
                new IdentifierRecord("x", "Type2", 19, 20),
                new IdentifierRecord("x", "Type", 24, 25)),
            found);
    }

    public void testQualifiedChainsAreSuppressed() {
        //                      0         1
        //                      012345678901234567
        List<IdentifierRecord> found = scan("Foo f; f.bar; a.f;");
        assertEquals(Arrays.asList(
                new IdentifierRecord("f", "Foo", 4, 5),
                new IdentifierRecord("f", "Foo", 7, 8)),
            found);
    }

    public void testDisallowedKeywords() {
        assertTrue(scan("public int x; x;").isEmpty());
        assertTrue(scan("import java;").isEmpty());
        assertTrue(scan("return true;").isEmpty());
        assertTrue(CLike.INSTANCE.isDisallowed("private"));
        assertTrue(CLike.INSTANCE.isDisallowed("extends"));
        assertFalse(CLike.INSTANCE.isDisallowed("bob"));
    }

    public void testBraceDropsPendingToken() {
        // z is still pending when the brace arrives
        assertEquals(Arrays.asList(new IdentifierRecord("y", "Foo", 12, 13)),
            scan("Foo {x; Foo y; Foo z}"));
    }

    public void testUnbalancedCloseBraces() {
        IdentifierScanner is = new IdentifierScanner(CLike.INSTANCE);
        is.scan("}}} a b;");
        assertEquals(0, is.scopes().depth());
        assertEquals(IdentifierScanner.State.IDLE, is.state());
    }

    public void testFixture() throws Exception {
        String text = fixture("identifiers.java.txt");
        List<IdentifierRecord> found = CLike.INSTANCE.readIdentifiers(text);
        String[][] expected = {
            {"me", "Session"}, {"count", "int"}, {"other", "Session"},
            {"me", "Session"}, {"me", "Session"}, {"me", "Guest"},
            {"other", "Session"}, {"me", "Guest"}, {"me", "Session"},
        };
        assertEquals(expected.length, found.size());
        for (int i = 0; i < expected.length; ++i) {
            IdentifierRecord r = found.get(i);
            assertEquals("name " + i, expected[i][0], r.name());
            assertEquals("type " + i, expected[i][1], r.type());
            assertEquals(r.name(), text.substring(r.start(), r.end()));
        }
    }
}
