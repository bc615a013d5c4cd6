/* @LICENSE@
 */
package org.semrep;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command line entry point:
 *
 * <pre>
 * semrep [-p|--path DIR] [-n|--dry-run] [-v|--verbose] QUERY
 * </pre>
 *
 * Exit status 0 on success, 1 on a usage or i/o error, 2 on a malformed
 * query (in which case nothing is touched).
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_MALFORMED = 2;

    /*
     * shared by every run in this VM, added to the logger at most once
     */
    static final Handler VERBOSE = new ConsoleHandler();
    static {
        VERBOSE.setLevel(Level.FINE);
    }

    private Main() {
    } // never instantiated

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        ArgumentParser parser = ArgumentParsers.newFor("semrep").build()
                .defaultHelp(true)
                .description("Semantics aware find and replace over a source tree");

        parser.addArgument("-p", "--path")
                .help("root of the tree to rewrite")
                .setDefault(".");

        parser.addArgument("-n", "--dry-run")
                .help("report matches, write nothing")
                .action(Arguments.storeTrue());

        parser.addArgument("-v", "--verbose")
                .help("log per file results")
                .action(Arguments.storeTrue());

        parser.addArgument("query")
                .help("substitution query, e.g. %s/[[type=Session]]/sess/g");

        Namespace ns;
        try {
            ns = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            PrintWriter pw = new PrintWriter(err);
            parser.handleError(e, pw);
            pw.flush();
            return EXIT_USAGE;
        }

        if (ns.getBoolean("verbose")) {
            Logger logger = Logger.getLogger("org.semrep");
            if (!Arrays.asList(logger.getHandlers()).contains(VERBOSE)) {
                logger.addHandler(VERBOSE);
            }
            logger.setUseParentHandlers(false);
            logger.setLevel(Level.FINE);
        }

        Query query;
        try {
            query = Query.compile(ns.getString("query"));
        } catch (PatternSyntaxException e) {
            err.println(e.getMessage());
            return EXIT_MALFORMED;
        }

        Path root = Paths.get(ns.getString("path"));
        if (!Files.isDirectory(root)) {
            err.println("semrep: not a directory: " + root);
            return EXIT_USAGE;
        }
        FileTreeRewriter.Report report;
        try {
            report = new FileTreeRewriter(query)
                .dryRun(ns.getBoolean("dry_run"))
                .rewrite(root);
        } catch (IOException e) {
            err.println("semrep: " + e);
            return EXIT_USAGE;
        }
        for (FileTreeRewriter.FileResult r : report.files()) {
            out.println(r);
        }
        out.println(report);
        return EXIT_OK;
    }
}
