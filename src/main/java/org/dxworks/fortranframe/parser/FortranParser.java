package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.preprocessor.ConditionalCompilationFilter;
import org.dxworks.fortranframe.preprocessor.LogicalLine;
import org.dxworks.fortranframe.preprocessor.LogicalLineAssembler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Source text to tree: assemble logical lines, drop dead conditional-compilation branches,
 * then classify and fold every statement in physical order. The first error aborts the parse.
 */
public class FortranParser {

    private final Logger logger;
    private final List<StatementInterceptor> interceptors;

    public FortranParser(Logger logger) {
        this(logger, StatementInterceptors.defaults());
    }

    public FortranParser(Logger logger, List<StatementInterceptor> interceptors) {
        this.logger = logger;
        this.interceptors = List.copyOf(interceptors);
    }

    public Node parse(Path file) throws IOException {
        logger.fine(() -> "Parsing " + file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public Node parse(String source) {
        List<LogicalLine> lines = new LogicalLineAssembler(logger).assemble(source);
        return parse(lines);
    }

    public Node parse(List<LogicalLine> logicalLines) {
        List<LogicalLine> live = new ConditionalCompilationFilter(logger).filter(logicalLines);
        StatementClassifier classifier = new StatementClassifier(logger, interceptors);
        BlockStackAutomaton automaton = new BlockStackAutomaton(classifier, logger);
        for (LogicalLine line : live) {
            automaton.accept(line);
        }
        return automaton.finish();
    }
}
