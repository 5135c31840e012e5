package de.htwsaar.socialnet.media.security;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Verbindet den relativen Request-Pfad mit dem {@link StaticRoot} und stellt sicher,
 * dass das Ergebnis auch nach Auflösung von Symlinks innerhalb des Roots liegt.
 *
 * <p>Letzte Verteidigungslinie: selbst wenn die Signaturliste lückenhaft ist, wird
 * nie eine Datei außerhalb des Roots geöffnet, weil alle weiteren Zugriffe auf dem
 * hier gelieferten kanonischen Pfad erfolgen.</p>
 */
public class SandboxResolver {

    private final StaticRoot root;

    /**
     * @param root Basisverzeichnis (darf nicht {@code null} sein)
     */
    public SandboxResolver(StaticRoot root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Löst einen relativen Pfad zu einer regulären Datei innerhalb des Roots auf.
     *
     * @param relativePath dekodierter Pfad relativ zum Mount-Prefix
     * @return kanonischer Pfad einer existierenden regulären Datei
     * @throws AssetRejectedException {@code INVALID_PATH} bei Ausbruch aus dem Root,
     *                                {@code FILE_NOT_FOUND} wenn nichts Auslieferbares existiert
     */
    public Path resolve(String relativePath) {
        Path candidate;
        try {
            candidate = root.path().resolve(stripLeadingSlashes(relativePath)).normalize();
        } catch (InvalidPathException ex) {
            throw new AssetRejectedException(DeliveryError.INVALID_PATH, "unparseable path", ex);
        }
        if (!root.contains(candidate)) {
            throw new AssetRejectedException(DeliveryError.INVALID_PATH, "escapes static root");
        }

        Path canonical;
        try {
            canonical = candidate.toRealPath();
        } catch (NoSuchFileException ex) {
            throw new AssetRejectedException(DeliveryError.FILE_NOT_FOUND, "does not exist", ex);
        } catch (IOException | SecurityException ex) {
            // z. B. fehlende Leserechte: nach außen nicht von "nicht vorhanden" unterscheidbar
            throw new AssetRejectedException(DeliveryError.FILE_NOT_FOUND, "not resolvable", ex);
        }
        if (!root.contains(canonical)) {
            throw new AssetRejectedException(DeliveryError.INVALID_PATH, "symlink escapes static root");
        }
        if (!Files.isRegularFile(canonical)) {
            throw new AssetRejectedException(DeliveryError.FILE_NOT_FOUND, "not a regular file");
        }
        return canonical;
    }

    private static String stripLeadingSlashes(String path) {
        if (path == null) return "";
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }
}
