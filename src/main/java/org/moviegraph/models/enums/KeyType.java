package org.moviegraph.models.enums;

import java.math.BigDecimal;

/**
 * How an entity is keyed in the raw data, and therefore whether it receives a surrogate id.
 */
public enum KeyType {
    /** Numeric source id, remapped to a dense surrogate. */
    INTEGER(true),
    /** Short stable code (ISO country or language), kept as the key. */
    CODE(false),
    /** No source id at all; the display name is the natural id. */
    NAME(true);

    private final boolean surrogate;

    KeyType(boolean surrogate) {
        this.surrogate = surrogate;
    }

    public boolean assignsSurrogate() {
        return surrogate;
    }

    /**
     * Brings a raw natural id to its canonical Java form so that {@code 28}, {@code 28L} and
     * {@code "28"} dedupe to the same key.
     *
     * @return the canonical key, or {@code null} when the raw value is absent or blank
     * @throws IllegalArgumentException when the value cannot be read as this key type
     */
    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        switch (this) {
            case INTEGER:
                if (raw instanceof Integer value) {
                    return value;
                }
                if (raw instanceof Number number) {
                    try {
                        return Math.toIntExact(new BigDecimal(number.toString()).longValueExact());
                    } catch (ArithmeticException ex) {
                        throw new IllegalArgumentException("Not an integer id: " + number, ex);
                    }
                }
                String text = raw.toString().trim();
                if (text.isEmpty()) {
                    return null;
                }
                try {
                    return Integer.valueOf(text);
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Not an integer id: '" + text + "'", ex);
                }
            case CODE:
            case NAME:
            default:
                String trimmed = raw.toString().trim();
                return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
