package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.NodeKind;
import org.dxworks.fortranframe.preprocessor.ConditionalCompilationFilter;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.fortranframe.parser.StatementRule.rule;

/**
 * The built-in classification table. Order is load-bearing: patterns overlap, the first
 * match wins, and every rule must precede the more general ones below it (the type
 * declarations before the attribute statements, everything before the assignment fallback).
 */
public final class StatementRules {

    private static final String NAME = "[a-z]\\w*";
    private static final String CONSTRUCT_NAME = "(?:[a-z]\\w*\\s*:(?!:)\\s*)?";
    private static final String OPTIONAL_NAME = "(?:\\s+" + NAME + ")?";
    private static final String PAREN = ParenthesisPatterns.BALANCED;
    private static final String KIND_SELECTOR = "(?:\\s*\\*\\s*\\d+|\\s*\\([^()]*\\))?";

    private static final String FUNCTION_PREFIX = "(?:(?:pure|impure|elemental|recursive|module)\\s+"
            + "|(?:integer|real|logical|complex|double\\s*precision|double\\s*complex|character)" + KIND_SELECTOR + "\\s+"
            + "|type\\s*\\([^()]*\\)\\s+)*";

    // left-hand side of an assignment: name, optional subscript, optional %component chain
    private static final String SUBSCRIPT = "(?:\\s*\\((?:[^()]|\\([^()]*\\))*\\))?";
    private static final String LHS = NAME + SUBSCRIPT + "(?:\\s*%\\s*" + NAME + SUBSCRIPT + ")*";
    private static final String NOT_ASSIGNMENT = "(?!" + LHS + "\\s*=(?!=))";

    private static final String[][] TYPE_SPECS = {
            {"integer", "integer" + KIND_SELECTOR},
            {"real", "real" + KIND_SELECTOR},
            {"double precision", "double\\s*precision"},
            {"double complex", "double\\s*complex"},
            {"complex", "complex" + KIND_SELECTOR},
            {"logical", "logical" + KIND_SELECTOR},
            {"character", "character(?:\\s*\\*\\s*(?:\\d+|\\([^()]*\\)))?(?:\\s*\\((?:[^()]|\\([^()]*\\))*\\))?"},
            {"type", "type\\s*\\([^()]*\\)"},
            {"class", "class\\s*\\([^()]*\\)"},
    };

    private static final String DECLARED_NAME = "(?:\\s*,.*?::|\\s*::|\\s+)\\s*";

    private static final String ATTRIBUTE_KEYWORDS = "(?:parameter|dimension|common|data|external|intrinsic|save"
            + "|equivalence|namelist|allocatable|target|pointer|intent|optional|public|private|volatile)";

    private static final String IO_UNIT = "\\s*\\(\\s*(?:unit\\s*=\\s*)?([^,)]+?)\\s*[,)]";

    private StatementRules() {}

    public static List<StatementRule> defaults() {
        List<StatementRule> rules = new ArrayList<>();

        // passthrough
        rules.add(rule("empty", "^$", NodeKind.EMPTY, StatementRole.SIMPLE).build());
        for (String directive : new String[]{
                ConditionalCompilationFilter.TRUE_OPEN.pattern(),
                ConditionalCompilationFilter.ELSE.pattern(),
                ConditionalCompilationFilter.END.pattern()}) {
            rules.add(rule("preprocessor", directive, NodeKind.PREPROCESSOR_DIRECTIVE, StatementRole.SIMPLE)
                    .tag("^#\\s*(\\w+)").build());
        }

        // closers
        rules.add(closer("end module", "module", NodeKind.MODULE));
        rules.add(closer("end program", "program", NodeKind.PROGRAM));
        rules.add(closer("end function", "function", NodeKind.FUNCTION));
        rules.add(closer("end subroutine", "subroutine", NodeKind.SUBROUTINE));
        rules.add(closer("end select", "select", NodeKind.SELECTION));
        rules.add(closer("end if", "if", NodeKind.CONDITIONAL));
        rules.add(closer("end do", "do", NodeKind.LOOP));
        rules.add(closer("end where", "where", NodeKind.WHERE_LOOP));
        // the kind is not used for CLOSE_UNIT
        rules.add(rule("end", "^end$", NodeKind.ROOT, StatementRole.CLOSE_UNIT).build());

        // openers and branches
        rules.add(rule("module", "^module\\s+(?!procedure\\b)" + NAME + "$", NodeKind.MODULE, StatementRole.OPEN)
                .tag("^module\\s+(" + NAME + ")").build());
        rules.add(rule("program", "^program\\s+" + NAME + "$", NodeKind.PROGRAM, StatementRole.OPEN)
                .tag("^program\\s+(" + NAME + ")").build());
        rules.add(rule("function", "^" + FUNCTION_PREFIX + "function\\s+" + NAME + "\\s*(?:\\(.*)?$",
                NodeKind.FUNCTION, StatementRole.OPEN)
                .tag("function\\s+(" + NAME + ")").build());
        rules.add(rule("subroutine", "^(?:(?:pure|impure|elemental|recursive|module)\\s+)*subroutine\\s+" + NAME + "\\s*(?:\\(.*)?$",
                NodeKind.SUBROUTINE, StatementRole.OPEN)
                .tag("subroutine\\s+(" + NAME + ")").build());
        rules.add(rule("select case", "^" + CONSTRUCT_NAME + "select\\s*case\\s*" + PAREN + "$",
                NodeKind.SELECTION, StatementRole.OPEN)
                .tag("select\\s*case\\s*\\(\\s*(.*?)\\s*\\)$").build());
        rules.add(rule("case", "^case\\s*(?:" + PAREN + "|default)" + OPTIONAL_NAME + "$",
                NodeKind.SELECTION, StatementRole.CASE)
                .tag("^case\\s*(" + PAREN + "|default)").build());
        rules.add(rule("if then", "^" + CONSTRUCT_NAME + "if\\s*" + PAREN + "\\s*then$",
                NodeKind.CONDITIONAL, StatementRole.OPEN).build());
        rules.add(rule("else if", "^else\\s*if\\s*" + PAREN + "\\s*then" + OPTIONAL_NAME + "$",
                NodeKind.CONDITIONAL, StatementRole.ELSE_IF).build());
        rules.add(rule("elsewhere", "^else\\s*where(?:\\s*" + PAREN + ")?" + OPTIONAL_NAME + "$",
                NodeKind.WHERE_LOOP, StatementRole.ELSE).build());
        rules.add(rule("else", "^else" + OPTIONAL_NAME + "$", NodeKind.CONDITIONAL, StatementRole.ELSE).build());
        rules.add(rule("labeled do", "^" + CONSTRUCT_NAME + "do\\s*\\d+\\s*,?\\s*(?:" + NAME + "\\s*=|while\\b).*$",
                NodeKind.ARCHAIC_LABELED_LOOP, StatementRole.OPEN)
                .tag("^" + CONSTRUCT_NAME + "do\\s*(\\d+)").build());
        rules.add(rule("do", "^" + CONSTRUCT_NAME + "do(?:\\s*|\\s+" + NAME + "\\s*=.*|\\s*,\\s*" + NAME + "\\s*=.*"
                        + "|\\s*while\\s*\\(.*|\\s+concurrent\\s*\\(.*)$",
                NodeKind.LOOP, StatementRole.OPEN)
                .tag("^" + CONSTRUCT_NAME + "do\\s*,?\\s*(" + NAME + ")\\s*=").build());
        rules.add(rule("where", "^" + CONSTRUCT_NAME + "where\\s*" + PAREN + "$",
                NodeKind.WHERE_LOOP, StatementRole.OPEN).build());

        // single-statement forms carrying an inline trailing clause
        rules.add(rule("inline if", "^if\\s*" + PAREN + "\\s*(?<trailing>\\S.*)$",
                NodeKind.CONDITIONAL, StatementRole.OPEN).build());
        rules.add(rule("inline where", "^where\\s*" + PAREN + "\\s*(?<trailing>\\S.*)$",
                NodeKind.WHERE_LOOP, StatementRole.OPEN).build());

        // declaration section
        rules.add(rule("implicit", "^implicit\\s+\\w.*$", NodeKind.IMPLICIT, StatementRole.SIMPLE).build());
        rules.add(rule("use", "^use\\b\\s*(?:,\\s*(?:non_)?intrinsic\\s*)?(?:::)?\\s*" + NAME + ".*$",
                NodeKind.USING, StatementRole.SIMPLE)
                .tag("^use\\b\\s*(?:,\\s*(?:non_)?intrinsic\\s*)?(?:::)?\\s*(" + NAME + ")").build());
        for (String[] typeSpec : TYPE_SPECS) {
            rules.add(rule(typeSpec[0], "^" + NOT_ASSIGNMENT + typeSpec[1] + DECLARED_NAME + NAME + ".*$",
                    NodeKind.DECLARATION, StatementRole.SIMPLE)
                    .tag("^" + typeSpec[1] + DECLARED_NAME + "(" + NAME + ")").build());
        }
        rules.add(rule("attribute", "^" + NOT_ASSIGNMENT + ATTRIBUTE_KEYWORDS
                        + "(?:\\s*\\(|\\s*/|\\s*::|\\s*,|\\s+[a-z]|\\s*$).*$",
                NodeKind.DECLARATION, StatementRole.SIMPLE)
                .tag("::\\s*(" + NAME + ")",
                        "^\\w+\\s*/\\s*(" + NAME + ")\\s*/",
                        "^\\w+\\s*\\(\\s*(" + NAME + ")",
                        "^\\w+\\s+(" + NAME + ")")
                .build());

        // simple control flow
        rules.add(rule("call", "^call\\s+[a-z][\\w%]*.*$", NodeKind.CALL, StatementRole.SIMPLE)
                .tag("^call\\s+([a-z][\\w%]*)").build());
        rules.add(rule("stop", "^(?:error\\s*)?stop(?:\\s*(?:\\d+|'[^']*'|\"[^\"]*\"))?$", NodeKind.STOP, StatementRole.SIMPLE).build());
        rules.add(rule("return", "^return(?:\\s+\\w+)?$", NodeKind.RETURN, StatementRole.SIMPLE).build());
        rules.add(rule("cycle", "^cycle" + OPTIONAL_NAME + "$", NodeKind.CYCLE, StatementRole.SIMPLE).build());
        rules.add(rule("exit", "^exit" + OPTIONAL_NAME + "$", NodeKind.EXIT, StatementRole.SIMPLE).build());
        rules.add(rule("continue", "^(?:\\d+\\s+)?continue$", NodeKind.CONTINUE, StatementRole.SIMPLE)
                .tag("^(\\d+)").build());
        rules.add(rule("goto", "^go\\s*to\\s*(?:\\d+|\\(.*\\).*)$", NodeKind.GOTO, StatementRole.SIMPLE)
                .tag("^go\\s*to\\s*\\(?\\s*(\\d+)").build());

        // I/O and miscellaneous
        rules.add(rule("format", "^(?:\\d+\\s+)?format\\s*\\(.*$", NodeKind.FORMAT, StatementRole.SIMPLE)
                .tag("^(\\d+)").build());
        rules.add(rule("read", "^read\\s*(?:\\(.*|\\*.*|\\d+.*)$", NodeKind.READ, StatementRole.SIMPLE)
                .tag("^read" + IO_UNIT).build());
        rules.add(rule("write", "^write\\s*\\(.*$", NodeKind.WRITE, StatementRole.SIMPLE)
                .tag("^write" + IO_UNIT).build());
        rules.add(rule("print", "^print\\s*(?:\\*|\\d+|'|\").*$", NodeKind.PRINT, StatementRole.SIMPLE).build());
        rules.add(rule("allocate", "^(?:de)?allocate\\s*\\(.*$", NodeKind.ALLOCATE, StatementRole.SIMPLE)
                .tag("allocate\\s*\\(\\s*(" + NAME + ")").build());

        // fallback
        rules.add(rule("assignment", "^" + LHS + "\\s*=(?!=).*$", NodeKind.ASSIGNMENT, StatementRole.SIMPLE)
                .tag("^(" + LHS + ")\\s*=").build());

        return rules;
    }

    private static StatementRule closer(String name, String keyword, NodeKind kind) {
        return rule(name, "^end\\s*" + keyword + OPTIONAL_NAME + "$", kind, StatementRole.CLOSE).build();
    }
}
