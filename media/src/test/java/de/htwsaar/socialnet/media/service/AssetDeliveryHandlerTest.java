package de.htwsaar.socialnet.media.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.verify;

import de.htwsaar.socialnet.media.domain.AssetDelivery;
import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.domain.DeliveryStage;
import de.htwsaar.socialnet.media.domain.Disposition;
import de.htwsaar.socialnet.media.domain.RequestPath;
import de.htwsaar.socialnet.media.policy.ContentPolicy;
import de.htwsaar.socialnet.media.security.DotfileGuard;
import de.htwsaar.socialnet.media.security.PathNormalizer;
import de.htwsaar.socialnet.media.security.SandboxResolver;
import de.htwsaar.socialnet.media.security.StaticRoot;
import de.htwsaar.socialnet.media.security.TraversalDetector;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

class AssetDeliveryHandlerTest {

    @TempDir
    Path tmp;

    private StaticRoot root;
    private Logger log;
    private AssetDeliveryHandler handler;

    @BeforeEach
    void setUp() throws IOException {
        root = StaticRoot.of(tmp.resolve("uploads").toString());
        log = mock(Logger.class);
        handler = new AssetDeliveryHandler(
                new PathNormalizer(),
                new TraversalDetector(),
                new DotfileGuard(),
                new SandboxResolver(root),
                new ContentPolicy(),
                log);

        Files.writeString(root.path().resolve("photo.jpg"), "jpeg-bytes");
        Files.writeString(root.path().resolve("report.pdf"), "%PDF-1.7");
        Files.writeString(root.path().resolve(".env"), "SECRET=1");
    }

    @Test
    @DisplayName("Gültige Datei wird mit kanonischem Pfad, Größe und Disposition aufgelöst")
    void resolvesExistingImage() throws IOException {
        AssetDelivery delivery = handler.resolve(RequestPath.of("/photo.jpg"));

        assertEquals(root.path().resolve("photo.jpg").toRealPath(), delivery.file());
        assertEquals(10, delivery.size());
        assertEquals(Disposition.INLINE, delivery.content().disposition());
        assertEquals("image/jpeg", delivery.content().contentType());
    }

    @Test
    void documentIsDeliveredAsAttachment() {
        AssetDelivery delivery = handler.resolve(RequestPath.of("/report.pdf"));

        assertEquals(Disposition.ATTACHMENT, delivery.content().disposition());
    }

    @Test
    @DisplayName("Traversal hat Vorrang vor Dotfile: /../.env ist INVALID_PATH")
    void traversalWinsOverDotfile() {
        assertRejected(DeliveryError.INVALID_PATH, RequestPath.of("/../.env"));
    }

    @Test
    @DisplayName("Dotfile hat Vorrang vor Not-Found")
    void dotfileWinsOverNotFound() {
        assertRejected(DeliveryError.DOTFILE_ACCESS_DENIED, RequestPath.of("/.does-not-exist"));
        assertRejected(DeliveryError.DOTFILE_ACCESS_DENIED, RequestPath.of("/.env"));
    }

    @Test
    void missingFileIsNotFound() {
        assertRejected(DeliveryError.FILE_NOT_FOUND, RequestPath.of("/missing.png"));
    }

    @Test
    void encodedTraversalIsInvalidPath() {
        assertRejected(DeliveryError.INVALID_PATH, new RequestPath("/..%2F..%2Fetc%2Fpasswd", "/../../etc/passwd"));
        assertRejected(DeliveryError.INVALID_PATH, RequestPath.of("/%252e%252e/etc/passwd"));
    }

    @Test
    void rejectionIsLoggedWithStageAndError() {
        assertRejected(DeliveryError.DOTFILE_ACCESS_DENIED, RequestPath.of("/.env"));

        verify(log)
                .warn(
                        anyString(),
                        eq("\"/.env\""),
                        eq(DeliveryStage.PATH_CHECKED),
                        eq(DeliveryError.DOTFILE_ACCESS_DENIED),
                        eq("hidden segment"));
    }

    @Test
    void controlCharactersAreEscapedInLog() {
        assertRejected(DeliveryError.INVALID_PATH, RequestPath.of("/a\u0000\n.png"));

        verify(log)
                .warn(
                        anyString(),
                        eq("\"/a\\u0000\\u000a.png\""),
                        eq(DeliveryStage.START),
                        eq(DeliveryError.INVALID_PATH),
                        eq("traversal signature NUL_BYTE"));
    }

    @Test
    void successfulResolutionDoesNotWarn() {
        handler.resolve(RequestPath.of("/photo.jpg"));

        long warnings = mockingDetails(log).getInvocations().stream()
                .filter(invocation -> invocation.getMethod().getName().equals("warn"))
                .count();
        assertEquals(0, warnings);
    }

    @Test
    void deliveryIsLoggedWithFinalStage() {
        AssetDelivery delivery = handler.resolve(RequestPath.of("/photo.jpg"));

        handler.delivered(delivery, 10);

        verify(log).debug(anyString(), eq(delivery.file()), eq(DeliveryStage.DELIVERED), eq(10L));
    }

    @Test
    void openStreamsFileContent() throws IOException {
        AssetDelivery delivery = handler.resolve(RequestPath.of("/photo.jpg"));

        try (InputStream in = handler.open(delivery)) {
            assertArrayEquals("jpeg-bytes".getBytes(StandardCharsets.UTF_8), in.readAllBytes());
        }
    }

    @Test
    @DisplayName("Datei verschwindet zwischen Prüfung und Lesen: FILE_NOT_FOUND statt Serverfehler")
    void fileRemovedAfterResolveIsNotFound() throws IOException {
        AssetDelivery delivery = handler.resolve(RequestPath.of("/photo.jpg"));
        Files.delete(delivery.file());

        AssetRejectedException ex = assertThrows(AssetRejectedException.class, () -> handler.open(delivery));
        assertEquals(DeliveryError.FILE_NOT_FOUND, ex.getError());
    }

    @Test
    void sameRequestYieldsSameDecision() {
        AssetDelivery first = handler.resolve(RequestPath.of("/report.pdf"));
        AssetDelivery second = handler.resolve(RequestPath.of("/report.pdf"));

        assertEquals(first, second);
    }

    private void assertRejected(DeliveryError expected, RequestPath path) {
        AssetRejectedException ex = assertThrows(AssetRejectedException.class, () -> handler.resolve(path));
        assertEquals(expected, ex.getError());
    }
}
