package de.htwsaar.socialnet.media.security;

import java.util.regex.Pattern;

/**
 * Signaturtabelle für Traversal- und Escape-Versuche.
 *
 * <p>Alle Muster werden case-insensitiv gegen jede Pfaddarstellung geprüft.
 * Neue Signaturen werden hier ergänzt, der Kontrollfluss bleibt unverändert.</p>
 */
public enum TraversalSignature {

    /** {@code ..} an beliebiger Stelle. */
    PARENT_REFERENCE("\\.\\."),

    /** Home-Verzeichnis, auch {@code ~root/}. */
    HOME_REFERENCE("~"),

    NUL_BYTE("\\x00"),

    /** Unter Windows reservierte Zeichen. */
    RESERVED_CHARACTER("[<>:\"|?*]"),

    /** Backslash, auch unter POSIX: wird später u. U. als Separator uminterpretiert. */
    BACKSLASH("\\\\"),

    /** {@code %2e%2e}, {@code %2e.} und {@code .%2e}. */
    ENCODED_PARENT_REFERENCE("%2e(?:%2e|\\.)|\\.%2e"),

    ENCODED_BACKSLASH("%5c"),

    ENCODED_NUL_BYTE("%00"),

    /** Doppelt kodierter Punkt, Slash, Backslash oder NUL ({@code %252e} usw.). */
    DOUBLE_ENCODING("%25(?:2e|2f|5c|00)");

    private final Pattern pattern;

    TraversalSignature(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Prüft, ob die Signatur im gegebenen Pfad vorkommt.
     *
     * @param path zu prüfende Pfaddarstellung
     * @return {@code true} bei Treffer
     */
    public boolean matches(String path) {
        return pattern.matcher(path).find();
    }
}
