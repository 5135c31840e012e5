package de.htwsaar.socialnet.media.security;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.domain.RequestPath;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.web.util.UriUtils;

/**
 * Erzeugt alle Darstellungen eines Request-Pfades, die geprüft werden müssen.
 *
 * <p>Reihenfolge: roh, normalisiert (falls abweichend), danach jeweils einfach
 * prozentdekodiert. Es wird genau einmal pro Darstellung dekodiert; mehrfach
 * verschachtelte Kodierungen erkennt der {@link TraversalDetector} an ihren
 * Restfragmenten (z. B. {@code %2e%2e} nach dem ersten Durchlauf).</p>
 */
public class PathNormalizer {

    /**
     * Liefert die geordnete, duplikatfreie Liste aller zu prüfenden Pfadformen.
     *
     * @param path angefragter Pfad
     * @return unveränderliche Liste der Darstellungen
     * @throws AssetRejectedException mit {@link DeliveryError#INVALID_PATH} bei ungültiger Prozentkodierung
     */
    public List<String> representations(RequestPath path) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(path.raw());
        forms.add(path.normalized());
        forms.add(decodeOnce(path.raw()));
        forms.add(decodeOnce(path.normalized()));
        return List.copyOf(forms);
    }

    /**
     * Dekodiert Prozent-Escapes nach RFC 3986; {@code +} bleibt erhalten.
     *
     * @param value zu dekodierender Pfad
     * @return dekodierter Pfad
     * @throws AssetRejectedException bei unvollständigen oder nicht-hexadezimalen Escapes
     */
    static String decodeOnce(String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new AssetRejectedException(DeliveryError.INVALID_PATH, "malformed percent-encoding", ex);
        }
    }
}
