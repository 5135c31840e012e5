package de.htwsaar.socialnet.media.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Fachliches Ergebnis einer erfolgreich geprüften Asset-Anfrage, ohne HTTP-Framework-Typen.
 *
 * @param file         kanonischer, geprüfter Pfad innerhalb des Static-Roots
 * @param size         Dateigröße in Bytes zum Prüfzeitpunkt
 * @param lastModified letzte Änderung zum Prüfzeitpunkt
 * @param content      Content-Policy-Entscheidung inkl. Headern
 */
public record AssetDelivery(Path file, long size, Instant lastModified, ContentDecision content) {

    public AssetDelivery {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
