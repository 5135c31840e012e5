package de.htwsaar.socialnet.media.domain;

/**
 * Wert des {@code Content-Disposition}-Headers.
 */
public enum Disposition {
    INLINE("inline"),
    ATTACHMENT("attachment");

    private final String headerValue;

    Disposition(String headerValue) {
        this.headerValue = headerValue;
    }

    public String headerValue() {
        return headerValue;
    }
}
