/*@LICENSE@
 */
package org.semrep.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

import org.semrep.AbstractSemrepTestCase;
import org.semrep.FileTreeRewriter;
import org.semrep.MatchPredicate;
import org.semrep.Query;
import org.semrep.lang.IdentifierRecord;

public class FileTreeRewriterTestCase extends AbstractSemrepTestCase {

    private Path root;
    private String original;

    public FileTreeRewriterTestCase(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        root = Files.createTempDirectory("semrep");
        original = fixture("identifiers.java.txt");
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.write(sub.resolve("A.java"), original.getBytes(StandardCharsets.UTF_8));
        Files.write(root.resolve("notes.txt"), original.getBytes(StandardCharsets.UTF_8));
        Files.write(root.resolve("Bad.java"), new byte[] {'a', (byte) 0xC3, (byte) 0x28, ';'});
    }

    @Override
    protected void tearDown() throws Exception {
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException e)
                    throws IOException {
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        super.tearDown();
    }

    private String read(String name) throws IOException {
        return new String(Files.readAllBytes(root.resolve(name)), StandardCharsets.UTF_8);
    }

    public void testRewrite() throws Exception {
        FileTreeRewriter.Report report =
            new FileTreeRewriter(Query.compile("%s/[[type=Session]]/sess/g")).rewrite(root);
        assertEquals(2, report.visited());
        assertEquals(1, report.failed());
        assertEquals(1, report.changed());
        assertEquals(6, report.matches());
        assertEquals(6, report.replacements());
        assertEquals(fixture("identifiers_replaced.java.txt"), read("sub/A.java"));
        assertEquals(original, read("notes.txt"));

        for (FileTreeRewriter.FileResult r : report.files()) {
            if (r.path().getFileName().toString().equals("Bad.java")) {
                assertTrue(r.isFailed());
                assertNotNull(r.failure());
                assertFalse(r.isChanged());
            } else {
                assertFalse(r.isFailed());
                assertEquals(2, r.functions());
                assertEquals(9, r.identifiers());
            }
        }
    }

    public void testDryRun() throws Exception {
        FileTreeRewriter.Report report =
            new FileTreeRewriter(Query.compile("%s/[[type=Session]]/sess/g"))
                .dryRun(true)
                .rewrite(root);
        assertEquals(1, report.changed());
        assertEquals(6, report.replacements());
        assertEquals(original, read("sub/A.java"));
    }

    public void testCharset() throws Exception {
        Path latin = Files.createDirectory(root.resolve("latin"));
        Path file = latin.resolve("L.java");
        Files.write(file, "Session me; me; // gr\u00fc\u00dfe\n".getBytes(StandardCharsets.ISO_8859_1));
        Query q = Query.compile("%s/[[type=Session]]/sess/g");

        // not valid UTF-8
        assertEquals(1, new FileTreeRewriter(q).rewrite(latin).failed());

        FileTreeRewriter.Report report = new FileTreeRewriter(q)
            .charset(StandardCharsets.ISO_8859_1)
            .rewrite(latin);
        assertEquals(0, report.failed());
        assertEquals(2, report.replacements());
        assertEquals("Session sess; sess; // gr\u00fc\u00dfe\n",
            new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1));
    }

    public void testPredicateVeto() throws Exception {
        MatchPredicate none = new MatchPredicate() {
            @Override
            public boolean accept(String matchedText, IdentifierRecord context) {
                return false;
            }
        };
        FileTreeRewriter.Report report =
            new FileTreeRewriter(Query.compile("%s/[[type=Session]]/sess/g"), none).rewrite(root);
        assertEquals(0, report.changed());
        assertEquals(6, report.matches());
        assertEquals(0, report.replacements());
        assertEquals(original, read("sub/A.java"));
    }
}
