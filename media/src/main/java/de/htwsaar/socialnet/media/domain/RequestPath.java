package de.htwsaar.socialnet.media.domain;

import java.util.Objects;

/**
 * Angefragter Asset-Pfad relativ zum Mount-Prefix, in zwei Darstellungen.
 *
 * <p>Beide Formen werden geprüft, weil Container und Framework unterschiedlich
 * normalisieren und ein Angreifer jeweils die schwächere Schicht anvisiert.</p>
 *
 * @param raw        Pfad wie auf der Leitung empfangen (ggf. prozentkodiert)
 * @param normalized vom Servlet-Container dekodierter und normalisierter Pfad
 */
public record RequestPath(String raw, String normalized) {

    public RequestPath {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
    }

    /**
     * Pfad, bei dem Roh- und normalisierte Form identisch sind (z. B. in Tests).
     *
     * @param path Pfad
     * @return neuer {@link RequestPath}
     */
    public static RequestPath of(String path) {
        return new RequestPath(path, path);
    }
}
