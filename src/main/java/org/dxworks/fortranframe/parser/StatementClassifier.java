package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.NodeKind;
import org.dxworks.fortranframe.model.Origin;
import org.dxworks.fortranframe.preprocessor.LogicalLine;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a statement to a node kind and role through the interceptors and then the ordered rule
 * table. Stateless apart from its configuration.
 */
public class StatementClassifier {

    private static final Pattern STATEMENT_LABEL = Pattern.compile("^(\\d+)\\s+(\\S.*)$");

    private final Logger logger;
    private final List<StatementInterceptor> interceptors;
    private final List<StatementRule> rules;

    public StatementClassifier(Logger logger) {
        this(logger, StatementInterceptors.defaults());
    }

    public StatementClassifier(Logger logger, List<StatementInterceptor> interceptors) {
        this(logger, interceptors, StatementRules.defaults());
    }

    public StatementClassifier(Logger logger, List<StatementInterceptor> interceptors, List<StatementRule> rules) {
        this.logger = logger;
        this.interceptors = List.copyOf(interceptors);
        this.rules = List.copyOf(rules);
    }

    public Optional<ClassifiedStatement> classify(LogicalLine line) {
        return classify(line.text, Origin.line(line.startLine), line.comments);
    }

    /**
     * @return empty when an interceptor consumed the statement
     * @throws FortranParseException when no rule matches
     */
    public Optional<ClassifiedStatement> classify(String text, Origin origin, List<String> comments) {
        for (StatementInterceptor interceptor : interceptors) {
            if (interceptor.intercept(text, origin)) {
                logger.finer(() -> "Discarded @" + origin + ": " + text);
                return Optional.empty();
            }
        }

        ClassifiedStatement statement = matchRules(text, text, origin, comments);
        if (statement == null) {
            // "20 x = y": classify what follows the label, keep the full text on the node
            Matcher labeled = STATEMENT_LABEL.matcher(text);
            if (labeled.matches()) {
                statement = matchRules(labeled.group(2), text, origin, comments);
            }
        }
        if (statement == null) {
            throw FortranParseException.unclassifiable(origin, text);
        }

        warnOnDeepNesting(statement);
        return Optional.of(statement);
    }

    private ClassifiedStatement matchRules(String matchText, String rawText, Origin origin, List<String> comments) {
        for (StatementRule rule : rules) {
            Matcher matcher = rule.match(matchText);
            if (matcher != null) {
                return new ClassifiedStatement(rule, rawText, rule.extractTag(matchText), origin, comments,
                        rule.trailingClause(matcher));
            }
        }
        return null;
    }

    private void warnOnDeepNesting(ClassifiedStatement statement) {
        boolean hasExpression = statement.kind == NodeKind.CONDITIONAL
                || statement.kind == NodeKind.WHERE_LOOP
                || statement.kind == NodeKind.SELECTION;
        if (!hasExpression || statement.role == StatementRole.CLOSE || statement.role == StatementRole.ELSE) {
            return;
        }
        int depth = ParenthesisPatterns.nestingDepth(statement.text);
        if (depth > ParenthesisPatterns.MAX_NESTING_DEPTH) {
            logger.warning("Line " + statement.origin + ": parentheses nested " + depth + " deep, beyond the "
                    + ParenthesisPatterns.MAX_NESTING_DEPTH + " levels matched exactly; classified as '"
                    + statement.ruleName + "' on a best-effort match");
        }
    }
}
