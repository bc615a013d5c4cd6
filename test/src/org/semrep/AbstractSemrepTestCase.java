/* @LICENSE@
 */

package org.semrep;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractSemrepTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.semrep.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractSemrepTestCase(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    @Override
    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    /**
     * Reads a test fixture from <code>/fixtures/</code> on the class path.
     */
    protected String fixture(String name) throws IOException {
        InputStream is = AbstractSemrepTestCase.class.getResourceAsStream("/fixtures/" + name);
        assertNotNull("missing fixture: " + name, is);
        try {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            for (int n; (n = is.read(buf)) != -1;) {
                bos.write(buf, 0, n);
            }
            return new String(bos.toByteArray(), StandardCharsets.UTF_8);
        } finally {
            is.close();
        }
    }

    /*
     * wrapper for Misc functions needed by subclasses outside package
     */
    protected static String esc(String s) {
        return Misc.esc(s);
    }
}
