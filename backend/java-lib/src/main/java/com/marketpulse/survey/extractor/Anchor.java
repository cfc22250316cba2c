package com.marketpulse.survey.extractor;

/**
 * Detected header row of a sheet
 */
public final class Anchor {

    public enum Method {
        HEADER_THEN_DATA,
        QUINTILE_LABELS,
        FALLBACK
    }

    private final int rowIndex;
    private final boolean confident;
    private final Method method;

    public Anchor(int rowIndex, boolean confident, Method method) {
        this.rowIndex = rowIndex;
        this.confident = confident;
        this.method = method;
    }

    public static Anchor detected(int rowIndex, Method method) {
        return new Anchor(rowIndex, true, method);
    }

    public static Anchor fallback(int rowIndex) {
        return new Anchor(rowIndex, false, Method.FALLBACK);
    }

    public int getRowIndex() {
        return rowIndex;
    }

    /**
     * False when no row qualified and the configured default row was used
     */
    public boolean isConfident() {
        return confident;
    }

    public Method getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Anchor)) {
            return false;
        }
        Anchor other = (Anchor) o;
        return rowIndex == other.rowIndex && confident == other.confident && method == other.method;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rowIndex + Boolean.hashCode(confident)) + method.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Anchor{row=%d, confident=%s, method=%s}", rowIndex, confident, method);
    }
}
