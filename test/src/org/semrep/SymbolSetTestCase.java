/* @LICENSE@
 */

package org.semrep;

public class SymbolSetTestCase extends AbstractSemrepTestCase {

    public SymbolSetTestCase(String name) {
        super(name);
    }

    public void testRangesMerge() {
        SymbolSet ss = new SymbolSet.Builder()
            .add('a', 'f').add('d', 'k').add('x').build();
        assertTrue(ss.contains('a'));
        assertTrue(ss.contains('h'));
        assertTrue(ss.contains('k'));
        assertFalse(ss.contains('l'));
        assertTrue(ss.contains('x'));
        assertEquals(ss, new SymbolSet.Builder().add('x').add('a', 'k').build());
    }

    public void testCategories() {
        assertTrue(SymbolSet.WORD.contains('_'));
        assertTrue(SymbolSet.WORD.contains('é'));
        assertFalse(SymbolSet.WORD.contains('-'));
        assertTrue(SymbolSet.DIGIT.contains('7'));
        assertTrue(SymbolSet.WHITESPACE.contains('\t'));
        assertTrue(SymbolSet.IDENTIFIER_START.contains('_'));
        assertFalse(SymbolSet.IDENTIFIER_START.contains('1'));
        assertTrue(SymbolSet.EMPTY.isEmpty());
    }

    public void testBadRange() {
        try {
            new SymbolSet.Builder().add('z', 'a');
            fail();
        } catch (IllegalArgumentException e) {/* expected */}
    }

    public void testClassification() {
        assertTrue(SymbolSet.isAlphabetic('Q'));
        assertFalse(SymbolSet.isAlphabetic('4'));
        assertTrue(SymbolSet.isAlphanumeric('4'));
        assertFalse(SymbolSet.isAlphanumeric('_'));
        assertTrue(SymbolSet.isWhitespace('\n'));
        assertTrue(SymbolSet.isWhitespace(' '));
    }
}
