package com.marketpulse.survey.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One parsed cell: an optional non-negative value plus quality flags
 */
public final class NormalizedCell {
    private static final NormalizedCell EMPTY = new NormalizedCell(null, EnumSet.noneOf(CellFlag.class));

    private final Double value;
    private final Set<CellFlag> flags;

    // Values are magnitudes; a sign on input is discarded
    private NormalizedCell(Double value, EnumSet<CellFlag> flags) {
        this.value = value != null ? Math.abs(value) : null;
        this.flags = Collections.unmodifiableSet(flags);
    }

    public static NormalizedCell empty() {
        return EMPTY;
    }

    public static NormalizedCell of(double value) {
        return new NormalizedCell(value, EnumSet.noneOf(CellFlag.class));
    }

    public static NormalizedCell of(Double value, Set<CellFlag> flags) {
        EnumSet<CellFlag> copy = EnumSet.noneOf(CellFlag.class);
        if (flags != null) {
            copy.addAll(flags);
        }
        if (value == null && copy.isEmpty()) {
            return EMPTY;
        }
        return new NormalizedCell(value, copy);
    }

    public static NormalizedCell suppressed() {
        return new NormalizedCell(null, EnumSet.of(CellFlag.SUPPRESSED));
    }

    public static NormalizedCell lowReliability(double value) {
        return new NormalizedCell(value, EnumSet.of(CellFlag.LOW_RELIABILITY));
    }

    public static NormalizedCell errorMargin() {
        return new NormalizedCell(null, EnumSet.of(CellFlag.ERROR_MARGIN));
    }

    public Double getValue() {
        return value;
    }

    public Set<CellFlag> getFlags() {
        return flags;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasFlag(CellFlag flag) {
        return flags.contains(flag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedCell)) {
            return false;
        }
        NormalizedCell other = (NormalizedCell) o;
        return Objects.equals(value, other.value) && flags.equals(other.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, flags);
    }

    @Override
    public String toString() {
        return String.format("NormalizedCell{value=%s, flags=%s}", value, flags);
    }
}
