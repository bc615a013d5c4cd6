/* @LICENSE@
 */

package org.semrep.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.semrep.AbstractSemrepTestCase;

public class FunctionScannerTestCase extends AbstractSemrepTestCase {

    public FunctionScannerTestCase(String name) {
        super(name);
    }

    private static List<String> names(List<FunctionRecord> records) {
        List<String> ret = new ArrayList<String>();
        for (FunctionRecord r : records) ret.add(r.name());
        return ret;
    }

    public void testFixture() throws Exception {
        String text = fixture("functions.java.txt");
        List<FunctionRecord> found = CLike.INSTANCE.readFunctions(text);
        assertEquals(Arrays.asList(
                "LightningOvercharge", "getAction", "onSpawn", "getPassiveAction",
                "getCost", "getName", "getTip", "getActionNetwork"),
            names(found));
        for (FunctionRecord r : found) {
            assertEquals(r.name(), text.substring(r.start(), r.end()));
            assertEquals('(', text.charAt(r.end()));
        }
    }

    public void testBraceRightAfterParens() {
        List<FunctionRecord> found = new FunctionScanner().scan("main(){}");
        assertEquals(1, found.size());
        assertEquals(new FunctionRecord("main", 0, 4), found.get(0));
    }

    public void testNestedParens() {
        //                                                  0123456
        List<FunctionRecord> found = new FunctionScanner().scan("void f(int (*cb)(int)) {");
        assertEquals(1, found.size());
        assertEquals(new FunctionRecord("f", 5, 6), found.get(0));
    }

    public void testNameRestartsAfterParens() {
        assertEquals(Arrays.asList("g"),
            names(new FunctionScanner().scan("int f(a) g(b) {")));
    }

    public void testCharAfterBraceIsSwallowed() {
        List<FunctionRecord> found = new FunctionScanner().scan("f(){g(){}}");
        assertEquals(1, found.size());
        assertEquals(new FunctionRecord("f", 0, 1), found.get(0));

        // one char of slack is enough for the nested declaration
        assertEquals(Arrays.asList("f", "g"),
            names(new FunctionScanner().scan("f(){ g(){}}")));
    }

    public void testAbandonedAndUnclosed() {
        assertTrue(new FunctionScanner().scan("foo(x) = {").isEmpty());
        assertTrue(new FunctionScanner().scan("foo(bar").isEmpty());
        assertTrue(new FunctionScanner().scan("foo (x) {").isEmpty());
        assertTrue(new FunctionScanner().scan("").isEmpty());
    }

    public void testStates() {
        FunctionScanner fs = new FunctionScanner();
        fs.scan("f(x) ");
        assertEquals(FunctionScanner.State.SPACE_AFTER_PARENS, fs.state());
        fs = new FunctionScanner();
        fs.scan("f(x){");
        assertEquals(FunctionScanner.State.BRACE_ENTERED, fs.state());
        fs = new FunctionScanner();
        fs.scan("f((x)");
        assertEquals(FunctionScanner.State.PAREN_DEPTH, fs.state());
    }
}
