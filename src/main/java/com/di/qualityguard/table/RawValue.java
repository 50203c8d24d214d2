package com.di.qualityguard.table;

import java.util.Objects;

/**
 * A single raw cell as handed over by the loader: either missing or a text cell carrying the
 * unparsed string. Typing happens later, per column.
 */
public final class RawValue {

    private enum Kind { MISSING, TEXT }

    private static final RawValue MISSING = new RawValue(Kind.MISSING, null);

    private final Kind kind;
    private final String text;

    private RawValue(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static RawValue missing() {
        return MISSING;
    }

    /** Wraps a string cell; a null string becomes {@link #missing()}. */
    public static RawValue text(String text) {
        return text == null ? MISSING : new RawValue(Kind.TEXT, text);
    }

    public boolean isMissing() {
        return kind == Kind.MISSING;
    }

    /**
     * @return the raw string
     * @throws IllegalStateException when the value is missing
     */
    public String getText() {
        if (kind == Kind.MISSING) {
            throw new IllegalStateException("Missing value has no text");
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawValue)) return false;
        RawValue other = (RawValue) o;
        return kind == other.kind && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.MISSING ? "<missing>" : text;
    }
}
