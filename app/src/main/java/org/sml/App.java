package org.sml;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CancellationException;

import com.google.gson.GsonBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class App {
    private static final Logger log = LogManager.getLogger("app");

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX = 1;
    static final int EXIT_IO = 2;

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        var options = Options.parse(args);

        try {
            // 1. Input Setup
            SourceInput source = getSourceCode(options.file());

            // 2. Token dump, if asked for
            if (options.tokens()) {
                printTokens(source, out);
            }

            // 3. Syntax Analysis
            Tree tree = runParser(source, options.concurrent());
            if (options.tree()) {
                out.print(new PrinterST(tree.text()).print(tree));
            }
            out.println(tree);

            // 4. Reduction, the original tree must survive it
            Tree reduced = tree.reduce();
            out.println(tree);
            out.println(reduced);
            if (options.tree()) {
                out.print(new PrinterST(reduced.text()).print(reduced));
            }
            return EXIT_OK;
        } catch (SmlException e) {
            log.warn("failed on " + e.name() + " at " + e.location());
            err.println(e.getMessage());
            return EXIT_SYNTAX;
        } catch (CancellationException e) {
            err.println(e.getMessage());
            return EXIT_SYNTAX;
        } catch (IOException e) {
            err.println("Critical I/O Error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    // ==========================================================
    // STAGE 0: COMMAND LINE
    // ==========================================================

    // App [--tokens] [--tree] [--concurrent] [file]
    record Options(boolean tokens, boolean tree, boolean concurrent, String file) {
        static Options parse(String[] args) {
            boolean tokens = false;
            boolean tree = false;
            boolean concurrent = false;
            String file = null;
            for (var arg : args) {
                switch (arg) {
                    case "--tokens" -> tokens = true;
                    case "--tree" -> tree = true;
                    case "--concurrent" -> concurrent = true;
                    default -> file = arg;
                }
            }
            return new Options(tokens, tree, concurrent, file);
        }
    }

    // ==========================================================
    // STAGE 1: INPUT HANDLING
    // ==========================================================

    record SourceInput(String code, String name) {}

    static SourceInput getSourceCode(String file) throws IOException {
        if (file == null) {
            // Default code for trying things out
            var code = """
                // two boxes, minus a hole, plus a third
                (rect 4 2 @ 0 0 || rect 2 4 @ 1 -1) - rect 1 1 @ 1 1
                  || rect 0x10 8 @ 2.5 3
                """;
            return new SourceInput(code, "sample");
        }

        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            throw new IOException("Cannot find file: " + file
                + " (current dir: " + System.getProperty("user.dir") + ")");
        }

        var code = Files.readString(path, StandardCharsets.UTF_8);
        var name = path.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }
        return new SourceInput(code, name);
    }

    // ==========================================================
    // STAGE 2: PARSER
    // ==========================================================

    private static Tree runParser(SourceInput source, boolean concurrent) {
        log.debug("parsing " + source.name() + (concurrent ? " with the concurrent scanner" : ""));
        if (concurrent) {
            return Parser.parseConcurrent(source.name(), source.code());
        }
        return Parser.parse(source.name(), source.code());
    }

    // ==========================================================
    // UTILITIES
    // ==========================================================

    private static void printTokens(SourceInput source, PrintStream out) {
        var gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

        out.println(gson.toJson(Lexer.tokenize(source.name(), source.code())));
    }
}
