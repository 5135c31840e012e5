package de.htwsaar.socialnet.media.domain;

/**
 * Terminale Fehlerergebnisse der Asset-Auslieferung.
 *
 * <p>Code und Nachricht sind Teil des öffentlichen Vertrages und verraten bewusst
 * nicht, <i>warum</i> ein Pfad abgelehnt wurde.</p>
 */
public enum DeliveryError {
    INVALID_PATH(400, "Invalid file path"),
    DOTFILE_ACCESS_DENIED(403, "Access to dotfiles is not allowed"),
    FILE_NOT_FOUND(404, "File not found");

    private final int status;
    private final String message;

    DeliveryError(int status, String message) {
        this.status = status;
        this.message = message;
    }

    public int status() {
        return status;
    }

    public String message() {
        return message;
    }
}
