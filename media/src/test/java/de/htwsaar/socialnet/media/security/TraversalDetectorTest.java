package de.htwsaar.socialnet.media.security;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.domain.RequestPath;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TraversalDetectorTest {

    private final PathNormalizer normalizer = new PathNormalizer();
    private final TraversalDetector detector = new TraversalDetector();

    @ParameterizedTest
    @ValueSource(
            strings = {
                "../etc/passwd",
                "/a/../../etc/passwd",
                "/images/..",
                "/..hidden",
                "..\\windows\\win.ini",
                "/uploads\\..\\secret",
                "/%2e%2e/etc/passwd",
                "/%2E%2E/etc/passwd",
                "/..%2f..%2fetc/passwd",
                "/%2e./secret",
                "/.%2e/secret",
                "/%252e%252e/etc/passwd",
                "/%252E%252E%252Fetc",
                "/dir%5cfile.png",
                "/dir%255cfile.png",
                "/~/.ssh/id_rsa",
                "/~root/.bashrc",
                "/home~/x.png",
                "/photo.jpg%00.png",
                "/photo\u0000.png",
                "/C:/windows/system32",
                "/a<b>.png",
                "/a|b.png",
                "/a\"b.png",
                "/what?.png",
                "/glob*.png"
            })
    void rejectsTraversalSignatures(String path) {
        AssetRejectedException ex = assertThrows(AssetRejectedException.class, () -> inspect(path));
        assertEquals(DeliveryError.INVALID_PATH, ex.getError());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "/photo.jpg",
                "/2024/05/avatar.min.png",
                "/docs/report.v1.0.pdf",
                "/archive.tar.gz",
                "/hello%20world.png",
                "/a+b.mp4",
                "/.env"
            })
    void acceptsOrdinaryPaths(String path) {
        assertDoesNotThrow(() -> inspect(path));
    }

    @Test
    void detectsTraversalOnlyVisibleInNormalizedForm() {
        RequestPath path = new RequestPath("/x%2Fphoto.jpg", "/x/../photo.jpg");

        assertThrows(AssetRejectedException.class, () -> detector.inspect(normalizer.representations(path)));
    }

    @Test
    void signaturesAreCaseInsensitive() {
        assertTrue(TraversalSignature.ENCODED_PARENT_REFERENCE.matches("%2E%2e"));
        assertTrue(TraversalSignature.ENCODED_BACKSLASH.matches("%5C"));
        assertTrue(TraversalSignature.DOUBLE_ENCODING.matches("%252F"));
        assertFalse(TraversalSignature.PARENT_REFERENCE.matches("/a.b.c"));
    }

    @Test
    void signatureTableCanBeNarrowed() {
        TraversalDetector onlyTilde = new TraversalDetector(EnumSet.of(TraversalSignature.HOME_REFERENCE));

        assertDoesNotThrow(() -> onlyTilde.inspect(List.of("/a/../b")));
        assertThrows(AssetRejectedException.class, () -> onlyTilde.inspect(List.of("/~x")));
    }

    @Test
    void emptySignatureTableIsRefused() {
        assertThrows(IllegalArgumentException.class, () -> new TraversalDetector(Set.of()));
    }

    private void inspect(String path) {
        detector.inspect(normalizer.representations(RequestPath.of(path)));
    }
}
