package de.htwsaar.socialnet.media.security;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Durchsucht alle Darstellungen eines Pfades nach {@link TraversalSignature Traversal-Signaturen}.
 * Ein einziger Treffer in irgendeiner Darstellung genügt für die Ablehnung.
 */
public class TraversalDetector {

    private final Set<TraversalSignature> signatures;

    /**
     * Detector mit allen bekannten Signaturen.
     */
    public TraversalDetector() {
        this(EnumSet.allOf(TraversalSignature.class));
    }

    /**
     * @param signatures aktive Signaturen (darf nicht leer sein)
     */
    public TraversalDetector(Set<TraversalSignature> signatures) {
        Objects.requireNonNull(signatures, "signatures must not be null");
        if (signatures.isEmpty()) {
            throw new IllegalArgumentException("at least one traversal signature is required");
        }
        this.signatures = EnumSet.copyOf(signatures);
    }

    /**
     * Prüft jede Darstellung gegen jede aktive Signatur.
     *
     * @param representations Ausgabe des {@link PathNormalizer}
     * @throws AssetRejectedException mit {@link DeliveryError#INVALID_PATH} beim ersten Treffer
     */
    public void inspect(List<String> representations) {
        for (String form : representations) {
            for (TraversalSignature signature : signatures) {
                if (signature.matches(form)) {
                    throw new AssetRejectedException(
                            DeliveryError.INVALID_PATH, "traversal signature " + signature.name());
                }
            }
        }
    }
}
