/* @LICENSE@
 */

package org.semrep.lang;

import junit.framework.TestCase;

public class LanguagesTestCase extends TestCase {

    public LanguagesTestCase(String name) {
        super(name);
    }

    public void testExtensions() {
        assertSame(CLike.INSTANCE, Languages.forFileName("Main.java"));
        assertSame(CLike.INSTANCE, Languages.forFileName("dir.d/x.CPP"));
        assertSame(CLike.INSTANCE, Languages.forFileName("a.b.go"));
        assertNull(Languages.forFileName("README"));
        assertNull(Languages.forFileName("notes.txt"));
        assertNull(Languages.forFileName("trailing."));
    }
}
