package de.htwsaar.socialnet.media.policy;

import de.htwsaar.socialnet.media.domain.ContentDecision;
import de.htwsaar.socialnet.media.domain.Disposition;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Ordnet Dateiendungen eine {@link Disposition} und die festen Security-Header zu.
 *
 * <p>Reine Funktion ohne Zustand. Unbekannte Endungen werden grundsätzlich als
 * {@code attachment} ausgeliefert, nie inline im Browser gerendert.</p>
 */
public class ContentPolicy {

    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    public static final String X_FRAME_OPTIONS = "X-Frame-Options";
    public static final String CONTENT_SECURITY_POLICY_HEADER = "Content-Security-Policy";

    public static final String NOSNIFF = "nosniff";
    public static final String SAMEORIGIN = "SAMEORIGIN";
    public static final String CONTENT_SECURITY_POLICY = "default-src 'none'; img-src 'self'; media-src 'self'";
    public static final String CACHE_CONTROL = "public, max-age=86400";

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".webm", ".mov", ".avi");
    private static final Set<String> AUDIO_EXTENSIONS = Set.of(".mp3", ".wav", ".ogg", ".m4a");
    private static final Set<String> INLINE_DOCUMENT_EXTENSIONS = Set.of(".json");

    /**
     * Endung inkl. Punkt, kleingeschrieben. Führende Punkte ({@code .env}) zählen nicht als Endung.
     *
     * @param fileName Dateiname ohne Verzeichnis
     * @return Endung oder leerer String
     */
    public String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) return "";
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * @param fileName Dateiname ohne Verzeichnis
     * @return {@code INLINE} für Bild/Video/Audio/JSON, sonst {@code ATTACHMENT}
     */
    public Disposition dispositionFor(String fileName) {
        String ext = extensionOf(fileName);
        if (IMAGE_EXTENSIONS.contains(ext)
                || VIDEO_EXTENSIONS.contains(ext)
                || AUDIO_EXTENSIONS.contains(ext)
                || INLINE_DOCUMENT_EXTENSIONS.contains(ext)) {
            return Disposition.INLINE;
        }
        return Disposition.ATTACHMENT;
    }

    /**
     * Vollständige Entscheidung inkl. Content-Type und Header-Satz.
     *
     * @param fileName Dateiname ohne Verzeichnis
     * @return {@link ContentDecision}
     */
    public ContentDecision classify(String fileName) {
        Disposition disposition = dispositionFor(fileName);
        String contentType = MediaTypeFactory.getMediaType(fileName)
                .map(MediaType::toString)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(X_CONTENT_TYPE_OPTIONS, NOSNIFF);
        headers.put(X_FRAME_OPTIONS, SAMEORIGIN);
        headers.put(CONTENT_SECURITY_POLICY_HEADER, CONTENT_SECURITY_POLICY);
        headers.put(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL);
        headers.put(HttpHeaders.CONTENT_DISPOSITION, disposition.headerValue());

        return new ContentDecision(extensionOf(fileName), disposition, contentType, headers);
    }
}
