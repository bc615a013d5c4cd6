/* @LICENSE@
 */
package org.semrep;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.semrep.lang.Language;
import org.semrep.lang.Languages;
import org.semrep.lang.SourceModel;

/**
 * Applies one {@link Query} to every supported source file below a root
 * directory. Files are processed independently; a file which cannot be read
 * or written is logged, counted and skipped.
 */
public final class FileTreeRewriter {

    private static final Logger logger = Logger.getLogger("org.semrep");

    /**
     * The outcome for a single file.
     */
    public static final class FileResult {

        final Path path;
        final String language;
        final int functions;
        final int identifiers;
        final int matches;
        final int replacements;
        final boolean changed;
        final IOException failure;

        FileResult(Path path, String language, int functions, int identifiers,
                int matches, int replacements, boolean changed) {
            this.path = path;
            this.language = language;
            this.functions = functions;
            this.identifiers = identifiers;
            this.matches = matches;
            this.replacements = replacements;
            this.changed = changed;
            this.failure = null;
        }

        FileResult(Path path, IOException failure) {
            this.path = path;
            this.language = null;
            this.functions = 0;
            this.identifiers = 0;
            this.matches = 0;
            this.replacements = 0;
            this.changed = false;
            this.failure = failure;
        }

        public Path path() {return path;}
        public int functions() {return functions;}
        public int identifiers() {return identifiers;}
        public int matches() {return matches;}
        public int replacements() {return replacements;}
        public boolean isChanged() {return changed;}
        public boolean isFailed() {return failure != null;}

        /**
         * @return the exception which made this file fail, or null.
         */
        public IOException failure() {return failure;}

        @Override
        public String toString() {
            if (failure != null) return path + ": FAILED " + failure;
            return path + " [" + language + "]: " + functions + " functions, "
                + identifiers + " identifiers, " + matches + " matches, "
                + replacements + " replaced" + (changed ? ", changed" : "");
        }
    }

    /**
     * Totals over a run, plus the per-file results in visiting order.
     */
    public static final class Report {

        private final List<FileResult> files = new ArrayList<FileResult>();

        void add(FileResult r) {
            files.add(r);
        }

        public List<FileResult> files() {
            return Collections.unmodifiableList(files);
        }

        public int visited() {
            return files.size();
        }

        public int changed() {
            int n = 0;
            for (FileResult r : files) if (r.changed) ++n;
            return n;
        }

        public int failed() {
            int n = 0;
            for (FileResult r : files) if (r.failure != null) ++n;
            return n;
        }

        public int matches() {
            int n = 0;
            for (FileResult r : files) n += r.matches;
            return n;
        }

        public int replacements() {
            int n = 0;
            for (FileResult r : files) n += r.replacements;
            return n;
        }

        @Override
        public String toString() {
            return visited() + " files, " + changed() + " changed, " + failed()
                + " failed, " + matches() + " matches, " + replacements() + " replaced";
        }
    }

    private final Query query;
    private final MatchPredicate predicate;
    private boolean dryRun = false;
    private Charset charset = StandardCharsets.UTF_8;

    public FileTreeRewriter(Query query, MatchPredicate predicate) {
        this.query = query;
        this.predicate = predicate;
    }

    public FileTreeRewriter(Query query) {
        this(query, MatchPredicate.ALWAYS);
    }

    /**
     * In a dry run files are scanned and matched, but never written.
     */
    public FileTreeRewriter dryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    public FileTreeRewriter charset(Charset charset) {
        this.charset = charset;
        return this;
    }

    /**
     * Walks the tree below <code>root</code>, following links.
     */
    public Report rewrite(Path root) throws IOException {
        final Report report = new Report();
        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
            new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        Language language = Languages.forFileName(file.getFileName().toString());
                        if (language != null) {
                            report.add(process(file, language));
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.log(Level.WARNING, "skipping " + file + ": " + e);
                    report.add(new FileResult(file, e));
                    return FileVisitResult.CONTINUE;
                }
            });
        logger.log(Level.INFO, (dryRun ? "dry run: " : "") + report);
        return report;
    }

    /**
     * Processes a single file.
     */
    FileResult process(Path file, Language language) {
        try {
            String text = read(file);
            SourceModel model = SourceModel.scan(language, text);
            Matcher m = query.matcher(text, model);
            int matches = m.findAll().size();
            String rewritten = m.replace(query.replacement(), predicate, query.isGlobal());
            boolean changed = !rewritten.equals(text);
            if (changed && !dryRun) {
                Files.write(file, rewritten.getBytes(charset));
            }
            FileResult r = new FileResult(file, language.name(), model.functions().size(),
                model.identifiers().size(), matches, m.replaced(), changed);
            logger.log(Level.FINE, r.toString());
            return r;
        } catch (IOException e) {
            logger.log(Level.WARNING, "skipping " + file + ": " + e);
            return new FileResult(file, e);
        }
    }

    /*
     * strict decoding, so binary files fail instead of being mangled
     */
    private String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }
}
