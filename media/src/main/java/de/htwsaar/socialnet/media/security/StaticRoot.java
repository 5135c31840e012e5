package de.htwsaar.socialnet.media.security;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Absolutes, kanonisches Basisverzeichnis aller ausgelieferten Uploads.
 *
 * <p>Wird einmal beim Start aufgelöst und ist danach unveränderlich.</p>
 */
public final class StaticRoot {

    private final Path path;
    private final String prefix;

    private StaticRoot(Path path) {
        this.path = path;
        String root = path.toString();
        this.prefix = root.endsWith(File.separator) ? root : root + File.separator;
    }

    /**
     * Löst das konfigurierte Verzeichnis auf und legt es bei Bedarf an.
     *
     * @param configured konfigurierter Pfad (relativ zum Arbeitsverzeichnis oder absolut)
     * @return kanonischer Static-Root
     * @throws IllegalArgumentException wenn der Pfad leer oder syntaktisch ungültig ist
     * @throws IllegalStateException    wenn das Verzeichnis nicht angelegt oder aufgelöst werden kann
     */
    public static StaticRoot of(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalArgumentException("static root must not be blank");
        }
        Path candidate;
        try {
            candidate = Path.of(configured.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("static root is not a valid path: " + configured, ex);
        }
        try {
            Files.createDirectories(candidate);
            return new StaticRoot(candidate.toRealPath());
        } catch (IOException ex) {
            throw new IllegalStateException("static root is not a usable directory: " + candidate, ex);
        }
    }

    public Path path() {
        return path;
    }

    /**
     * Prefix-Prüfung auf kanonischen Pfaden mit OS-Separator: {@code /data} enthält
     * {@code /data/x}, aber nicht {@code /database/x}.
     *
     * @param candidate kanonischer oder lexikalisch normalisierter Pfad
     * @return {@code true} wenn {@code candidate} der Root selbst oder ein Nachfahre ist
     */
    public boolean contains(Path candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        String value = candidate.toString();
        return value.equals(path.toString()) || value.startsWith(prefix);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
