package org.dxworks.fortranframe;

import org.dxworks.fortranframe.export.TreeExporter;
import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.NodePath;
import org.dxworks.fortranframe.parser.FortranParseException;
import org.dxworks.fortranframe.parser.FortranParser;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class App {

    private static final String LOGGER_NAME = "org.dxworks.fortranframe";

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: java -jar fortranframe.jar <input-file>");
            err.println("  <input-file>: Fortran source file to parse");
            err.println("Options are read from fortranframe-config.yml in the working directory");
            err.println("Output formats: text, json, graph, dot");
            return 2;
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            err.println("Error: Input file does not exist: " + input);
            return 1;
        }

        Logger logger = Logger.getLogger(LOGGER_NAME);
        FortranframeConfig config = FortranframeConfig.load(logger);
        configureLogging(logger, config.getLogLevel());

        try {
            NodePath selectPath = config.getSelectPath();
            Node root = parseFile(input, config, logger);
            Optional<Node> selected = root.find(selectPath);
            if (selected.isEmpty()) {
                err.println("Error: No node at path: " + selectPath);
                return 1;
            }
            out.print(TreeExporter.export(selected.get(), config.getOutputFormat()));
            out.flush();
            return 0;
        } catch (FortranParseException e) {
            err.println("Error: " + input.getFileName() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: Could not process " + input + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            // unknown kind in the select path or a malformed discard pattern
            err.println("Error: Invalid configuration: " + e.getMessage());
            return 1;
        }
    }

    /** Parses one file and applies the configured prune passes. */
    public static Node parseFile(Path file, FortranframeConfig config, Logger logger) throws IOException {
        Node root = new FortranParser(logger, config.interceptors()).parse(file);
        int removed = config.pruneSequence(logger).apply(root);
        if (removed > 0) {
            logger.fine(() -> "Pruned " + removed + " nodes from " + file.getFileName());
        }
        return root;
    }

    static void configureLogging(Logger logger, Level level) {
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(level);
        logger.addHandler(handler);
    }
}
