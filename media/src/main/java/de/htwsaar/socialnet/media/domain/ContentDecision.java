package de.htwsaar.socialnet.media.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Ergebnis der Content-Policy für eine Datei.
 *
 * @param extension   kleingeschriebene Endung inkl. Punkt, leer wenn keine vorhanden
 * @param disposition inline oder attachment
 * @param contentType MIME-Type für den {@code Content-Type}-Header
 * @param headers     vollständiger Satz an Security-Headern inkl. {@code Content-Disposition}
 */
public record ContentDecision(
        String extension, Disposition disposition, String contentType, Map<String, String> headers) {

    public ContentDecision {
        Objects.requireNonNull(extension, "extension must not be null");
        Objects.requireNonNull(disposition, "disposition must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
        headers = Map.copyOf(Objects.requireNonNull(headers, "headers must not be null"));
    }
}
