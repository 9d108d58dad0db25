package org.dxworks.fortranframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * Provenance of a node: the physical line its logical line starts on, plus an ordinal
 * for statements synthesized from an inline trailing clause on that same line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Origin implements Comparable<Origin> {

    private static final Comparator<Origin> ORDER = Comparator
            .comparingInt((Origin o) -> o.physicalLine)
            .thenComparing(o -> o.syntheticOrdinal, Comparator.nullsFirst(Comparator.naturalOrder()));

    public final int physicalLine;
    public final Integer syntheticOrdinal;

    private Origin(int physicalLine, Integer syntheticOrdinal) {
        this.physicalLine = physicalLine;
        this.syntheticOrdinal = syntheticOrdinal;
    }

    public static Origin line(int physicalLine) {
        return new Origin(physicalLine, null);
    }

    public static Origin synthetic(int physicalLine, int ordinal) {
        return new Origin(physicalLine, ordinal);
    }

    @JsonIgnore
    public boolean isSynthetic() {
        return syntheticOrdinal != null;
    }

    /** The origin of the next clause nested inside a statement that starts here. */
    public Origin nextSynthetic() {
        return synthetic(physicalLine, syntheticOrdinal == null ? 1 : syntheticOrdinal + 1);
    }

    @Override
    public int compareTo(Origin other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Origin)) return false;
        Origin other = (Origin) o;
        return physicalLine == other.physicalLine && Objects.equals(syntheticOrdinal, other.syntheticOrdinal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(physicalLine, syntheticOrdinal);
    }

    @Override
    public String toString() {
        return syntheticOrdinal == null ? String.valueOf(physicalLine) : physicalLine + "." + syntheticOrdinal;
    }
}
