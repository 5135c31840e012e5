package de.htwsaar.socialnet.media.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Probe-Endpunkte (Liveness/Readiness) für Orchestrierung und Monitoring.
 */
@RestController
@RequestMapping("/api/media")
public class MediaProbeController {

    /**
     * Einfacher Liveness-Endpunkt.
     *
     * @return immer {@code ok}
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness-Endpunkt; der Static-Root ist zu diesem Zeitpunkt bereits aufgelöst.
     *
     * @return immer {@code ready}
     */
    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        return ResponseEntity.ok("ready");
    }
}
