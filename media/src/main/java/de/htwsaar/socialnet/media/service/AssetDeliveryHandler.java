package de.htwsaar.socialnet.media.service;

import de.htwsaar.socialnet.media.domain.AssetDelivery;
import de.htwsaar.socialnet.media.domain.ContentDecision;
import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.domain.DeliveryStage;
import de.htwsaar.socialnet.media.domain.RequestPath;
import de.htwsaar.socialnet.media.policy.ContentPolicy;
import de.htwsaar.socialnet.media.security.DotfileGuard;
import de.htwsaar.socialnet.media.security.PathNormalizer;
import de.htwsaar.socialnet.media.security.SandboxResolver;
import de.htwsaar.socialnet.media.security.TraversalDetector;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Fachlicher Service: prüft Asset-Anfragen in fester Reihenfolge und öffnet die Datei.
 *
 * <p>Pipeline: {@link PathNormalizer} → {@link TraversalDetector} → {@link DotfileGuard}
 * → {@link SandboxResolver} → {@link ContentPolicy}. Die erste Ablehnung beendet die
 * Anfrage; daraus ergibt sich die Priorität Traversal &gt; Dotfile &gt; Not-Found.</p>
 *
 * <p><b>Kein</b> Servlet-Typ hier: das HTTP-Mapping übernimmt der Web-Layer.
 * Der Service hält keinen Zustand zwischen Anfragen und ist damit beliebig parallel nutzbar.</p>
 */
public class AssetDeliveryHandler {

    private final PathNormalizer normalizer;
    private final TraversalDetector traversalDetector;
    private final DotfileGuard dotfileGuard;
    private final SandboxResolver sandboxResolver;
    private final ContentPolicy contentPolicy;
    private final Logger log;

    /**
     * Erstellt den Service mit Constructor Injection.
     *
     * @param normalizer        erzeugt die zu prüfenden Pfaddarstellungen
     * @param traversalDetector Signaturprüfung
     * @param dotfileGuard      Dotfile-Sperre
     * @param sandboxResolver   Root-Auflösung und Prefix-Prüfung
     * @param contentPolicy     Disposition und Security-Header
     * @param log               Logger für Ablehnungen und Auslieferungen
     */
    public AssetDeliveryHandler(
            PathNormalizer normalizer,
            TraversalDetector traversalDetector,
            DotfileGuard dotfileGuard,
            SandboxResolver sandboxResolver,
            ContentPolicy contentPolicy,
            Logger log) {

        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.traversalDetector = Objects.requireNonNull(traversalDetector, "traversalDetector must not be null");
        this.dotfileGuard = Objects.requireNonNull(dotfileGuard, "dotfileGuard must not be null");
        this.sandboxResolver = Objects.requireNonNull(sandboxResolver, "sandboxResolver must not be null");
        this.contentPolicy = Objects.requireNonNull(contentPolicy, "contentPolicy must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    /**
     * Prüft eine Anfrage bis einschließlich Klassifizierung.
     *
     * @param path angefragter Pfad relativ zum Mount-Prefix
     * @return geprüfte Auslieferung
     * @throws AssetRejectedException beim ersten terminalen Ergebnis
     */
    public AssetDelivery resolve(RequestPath path) {
        DeliveryStage stage = DeliveryStage.START;
        try {
            List<String> representations = normalizer.representations(path);
            traversalDetector.inspect(representations);
            stage = DeliveryStage.PATH_CHECKED;

            dotfileGuard.inspect(representations);
            stage = DeliveryStage.DOTFILE_CHECKED;

            Path file = sandboxResolver.resolve(path.normalized());
            BasicFileAttributes attributes = readAttributes(file);
            stage = DeliveryStage.SANDBOXED;

            ContentDecision content = contentPolicy.classify(file.getFileName().toString());
            stage = DeliveryStage.CLASSIFIED;

            log.debug("Asset {} classified as {} ({})", path.normalized(), content.disposition(), content.contentType());
            return new AssetDelivery(
                    file, attributes.size(), attributes.lastModifiedTime().toInstant(), content);
        } catch (AssetRejectedException ex) {
            log.warn(
                    "Rejected asset request {} after {}: {} ({})",
                    quote(path.raw()),
                    stage,
                    ex.getError(),
                    ex.getMessage());
            throw ex;
        }
    }

    /**
     * Öffnet die geprüfte Datei zum Streamen. Der Aufrufer schließt den Stream.
     *
     * <p>Verschwindet die Datei zwischen Prüfung und Lesen oder ist sie nicht lesbar,
     * wird das als {@code FILE_NOT_FOUND} gemeldet, nie als Serverfehler.</p>
     *
     * @param delivery Ergebnis von {@link #resolve(RequestPath)}
     * @return geöffneter Stream
     * @throws AssetRejectedException mit {@link DeliveryError#FILE_NOT_FOUND}
     */
    public InputStream open(AssetDelivery delivery) {
        try {
            // Pfad ist kanonisch: ein nachträglich untergeschobener Symlink wird nicht verfolgt
            return Files.newInputStream(delivery.file(), LinkOption.NOFOLLOW_LINKS);
        } catch (IOException | SecurityException ex) {
            log.warn("Asset {} vanished or became unreadable before streaming: {}", delivery.file(), ex.toString());
            throw new AssetRejectedException(DeliveryError.FILE_NOT_FOUND, "open failed", ex);
        }
    }

    /**
     * Markiert eine Auslieferung als abgeschlossen ({@link DeliveryStage#DELIVERED}).
     *
     * @param delivery ausgelieferte Datei
     * @param bytes    geschriebene Bytes, bei {@code HEAD} 0
     */
    public void delivered(AssetDelivery delivery, long bytes) {
        log.debug("Asset {} reached {} ({} bytes)", delivery.file(), DeliveryStage.DELIVERED, bytes);
    }

    private static BasicFileAttributes readAttributes(Path file) {
        try {
            return Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException | SecurityException ex) {
            throw new AssetRejectedException(DeliveryError.FILE_NOT_FOUND, "attributes not readable", ex);
        }
    }

    /**
     * Maskiert Steuerzeichen, damit Angreifer keine Logzeilen fälschen können.
     */
    private static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
