package org.dxworks.fortranframe.preprocessor;

import org.dxworks.fortranframe.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.fortranframe.preprocessor.ConditionalCompilationFilter.State.*;
import static org.junit.jupiter.api.Assertions.*;

class ConditionalCompilationFilterTest {

    private final ConditionalCompilationFilter filter = new ConditionalCompilationFilter(TestUtils.quietLogger());

    @Test
    void dropsDeadElseBranchButKeepsDirectives() {
        List<LogicalLine> kept = filter.filter(lines(
                "#if 1",
                "a = 1",
                "#else",
                "a = 2",
                "b = 2",
                "#endif",
                "c = 3"));

        assertEquals(List.of("#if 1", "a = 1", "#else", "#endif", "c = 3"), texts(kept));
    }

    @Test
    void dropsDirectivesInsideDeadBranch() {
        List<LogicalLine> kept = filter.filter(lines(
                "#if 1",
                "x = 1",
                "#else",
                "#include \"legacy.h\"",
                "x = 2",
                "#endif"));

        assertEquals(List.of("#if 1", "x = 1", "#else", "#endif"), texts(kept));
    }

    @Test
    void nestedTrueOpenerInDeadBranchStaysDead() {
        List<LogicalLine> kept = filter.filter(lines(
                "#if 1",
                "a = 1",
                "#else",
                "#if 1",
                "a = 2",
                "#endif",
                "b = 3"));

        assertEquals(List.of("#if 1", "a = 1", "#else", "#endif", "b = 3"), texts(kept));
    }

    @Test
    void elseOutsideTrueBlockKeepsEverything() {
        List<LogicalLine> kept = filter.filter(lines("#else", "a = 2", "#endif", "b = 3"));

        assertEquals(List.of("#else", "a = 2", "#endif", "b = 3"), texts(kept));
    }

    @Test
    void liveBranchWithoutElseIsUntouched() {
        List<LogicalLine> kept = filter.filter(lines("#if .true.", "a = 1", "#endif"));

        assertEquals(3, kept.size());
    }

    @Test
    void transitions() {
        assertEquals(CHARGED, ConditionalCompilationFilter.transition(DISCHARGED, "#if 1"));
        assertEquals(CHARGED, ConditionalCompilationFilter.transition(DISCHARGED, "# IF .TRUE."));
        assertEquals(ABLAZE, ConditionalCompilationFilter.transition(CHARGED, "#else"));
        assertEquals(DISCHARGED, ConditionalCompilationFilter.transition(DISCHARGED, "#else"));
        assertEquals(DISCHARGED, ConditionalCompilationFilter.transition(ABLAZE, "#endif /* done */"));
        assertEquals(ABLAZE, ConditionalCompilationFilter.transition(ABLAZE, "#if 0"));
    }

    private static List<LogicalLine> lines(String... texts) {
        List<LogicalLine> lines = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            lines.add(new LogicalLine(i + 1, i + 1, texts[i], List.of()));
        }
        return lines;
    }

    private static List<String> texts(List<LogicalLine> lines) {
        List<String> texts = new ArrayList<>();
        for (LogicalLine line : lines) {
            texts.add(line.text);
        }
        return texts;
    }
}
