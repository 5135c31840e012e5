package de.htwsaar.socialnet.media.security;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import java.util.List;

/**
 * Blockiert versteckte Dateien ({@code .env}, {@code .htpasswd}) und versteckte
 * Verzeichnisse ({@code .git/config}).
 *
 * <p>Muss nach dem {@link TraversalDetector} laufen: {@code ..} ist Traversal und
 * wird dort als {@code INVALID_PATH} gemeldet, nicht hier als Dotfile.</p>
 */
public class DotfileGuard {

    /**
     * Prüft jedes Segment aller (bereits traversal-geprüften) Pfaddarstellungen.
     *
     * @param representations geprüfte Pfaddarstellungen
     * @throws AssetRejectedException mit {@link DeliveryError#DOTFILE_ACCESS_DENIED}
     */
    public void inspect(List<String> representations) {
        for (String form : representations) {
            for (String segment : form.split("/")) {
                if (isHidden(segment)) {
                    throw new AssetRejectedException(DeliveryError.DOTFILE_ACCESS_DENIED, "hidden segment");
                }
            }
        }
    }

    /**
     * @param segment einzelnes Pfadsegment
     * @return {@code true} für {@code .name}, nicht aber für {@code .} oder {@code ..}
     */
    static boolean isHidden(String segment) {
        return segment.length() > 1 && segment.charAt(0) == '.' && !segment.equals("..");
    }
}
