package de.htwsaar.socialnet.media.service;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import java.util.Objects;

/**
 * Fachliche Exception für abgelehnte Asset-Anfragen.
 * Wird im Web-Layer in den passenden HTTP-Statuscode und den JSON-Fehlerkörper gemappt.
 *
 * <p>Die Exception-Message enthält das interne Detail (z. B. die getroffene Signatur)
 * und ist nur fürs Log bestimmt, niemals für den Client.</p>
 */
public class AssetRejectedException extends RuntimeException {

    private final DeliveryError error;

    /**
     * Erstellt eine neue Ablehnung.
     *
     * @param error  terminales Fehlerergebnis
     * @param detail interne Begründung (nur Log)
     */
    public AssetRejectedException(DeliveryError error, String detail) {
        super(detail);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    /**
     * Erstellt eine neue Ablehnung mit Ursache.
     *
     * @param error  terminales Fehlerergebnis
     * @param detail interne Begründung (nur Log)
     * @param cause  auslösender Fehler, z. B. eine {@link java.io.IOException}
     */
    public AssetRejectedException(DeliveryError error, String detail, Throwable cause) {
        super(detail, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    /**
     * Gibt das zugehörige Fehlerergebnis zurück.
     *
     * @return Fehlerergebnis mit HTTP-Status und öffentlicher Nachricht
     */
    public DeliveryError getError() {
        return error;
    }
}
