package org.dxworks.fortranframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum NodeKind {
    ROOT("root"),
    MODULE("module"),
    PROGRAM("program"),
    FUNCTION("function"),
    SUBROUTINE("subroutine"),
    CONDITIONAL("conditional"),
    SELECTION("selection"),
    LOOP("loop"),
    ARCHAIC_LABELED_LOOP("archaic-labeled-loop"),
    WHERE_LOOP("where-loop"),
    DECLARATION("declaration"),
    USING("using"),
    IMPLICIT("implicit"),
    CALL("call"),
    ASSIGNMENT("assignment"),
    STOP("stop"),
    RETURN("return"),
    CYCLE("cycle"),
    EXIT("exit"),
    CONTINUE("continue"),
    GOTO("goto"),
    FORMAT("format"),
    READ("read"),
    WRITE("write"),
    PRINT("print"),
    ALLOCATE("allocate"),
    EMPTY("empty"),
    PREPROCESSOR_DIRECTIVE("preprocessor-directive");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Program units may be closed by a bare {@code end}. */
    public boolean isProgramUnit() {
        return this == MODULE || this == PROGRAM || this == FUNCTION || this == SUBROUTINE;
    }

    public boolean isLoop() {
        return this == LOOP || this == ARCHAIC_LABELED_LOOP || this == WHERE_LOOP;
    }

    public static Optional<NodeKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (NodeKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
