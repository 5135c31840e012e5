package de.htwsaar.socialnet.media.domain;

/**
 * Zustände einer einzelnen Auslieferung, in fester Reihenfolge durchlaufen.
 * Jede Ablehnung merkt sich die zuletzt erreichte Stufe (nur fürs Log).
 */
public enum DeliveryStage {
    START,
    PATH_CHECKED,
    DOTFILE_CHECKED,
    SANDBOXED,
    CLASSIFIED,
    DELIVERED
}
