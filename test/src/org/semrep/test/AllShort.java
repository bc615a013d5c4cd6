/* @LICENSE@
 */


package org.semrep.test;

import org.semrep.AutomatonTestCase;
import org.semrep.ContextTestCase;
import org.semrep.DfaCompilerTestCase;
import org.semrep.EngineStyleTestCase;
import org.semrep.MainTestCase;
import org.semrep.QueryParserTestCase;
import org.semrep.SymbolSetTestCase;
import org.semrep.lang.FunctionScannerTestCase;
import org.semrep.lang.IdentifierScannerTestCase;
import org.semrep.lang.LanguagesTestCase;
import org.semrep.lang.ScopeStackTestCase;
import org.semrep.lang.SourceModelTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(SymbolSetTestCase.class);
        suite.addTestSuite(AutomatonTestCase.class);
        suite.addTestSuite(ContextTestCase.class);
        suite.addTestSuite(DfaCompilerTestCase.class);
        suite.addTestSuite(QueryParserTestCase.class);
        suite.addTestSuite(EngineStyleTestCase.class);
        suite.addTestSuite(ScopeStackTestCase.class);
        suite.addTestSuite(FunctionScannerTestCase.class);
        suite.addTestSuite(IdentifierScannerTestCase.class);
        suite.addTestSuite(LanguagesTestCase.class);
        suite.addTestSuite(SourceModelTestCase.class);
        suite.addTestSuite(MatcherTestCase.class);
        suite.addTestSuite(CaptureGroupTestCase.class);
        suite.addTestSuite(ReplaceIdempotenceTestCase.class);
        suite.addTestSuite(FileTreeRewriterTestCase.class);
        suite.addTestSuite(MainTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
