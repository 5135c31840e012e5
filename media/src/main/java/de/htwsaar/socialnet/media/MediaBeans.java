package de.htwsaar.socialnet.media;

import de.htwsaar.socialnet.media.policy.ContentPolicy;
import de.htwsaar.socialnet.media.security.DotfileGuard;
import de.htwsaar.socialnet.media.security.PathNormalizer;
import de.htwsaar.socialnet.media.security.SandboxResolver;
import de.htwsaar.socialnet.media.security.StaticRoot;
import de.htwsaar.socialnet.media.security.TraversalDetector;
import de.htwsaar.socialnet.media.service.AssetDeliveryHandler;
import de.htwsaar.socialnet.media.web.AssetContainerCustomizer;
import de.htwsaar.socialnet.media.web.AssetDeliveryFilter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Zentrale Spring-Verdrahtung der Media-Komponenten.
 *
 * <p>Schichtung: Filter → Service → Security/Policy → Dateisystem</p>
 */
@Configuration
public class MediaBeans {

    /**
     * Basisverzeichnis der Uploads, einmalig beim Start aufgelöst.
     *
     * @param staticRoot konfigurierter Pfad (Standard: Umgebungsvariable {@code UPLOADS_DIR}, sonst "uploads")
     * @return kanonischer {@link StaticRoot}
     */
    @Bean
    public StaticRoot staticRoot(@Value("${socialnet.media.static-root:${UPLOADS_DIR:uploads}}") String staticRoot) {
        return StaticRoot.of(staticRoot);
    }

    @Bean
    public PathNormalizer pathNormalizer() {
        return new PathNormalizer();
    }

    @Bean
    public TraversalDetector traversalDetector() {
        return new TraversalDetector();
    }

    @Bean
    public DotfileGuard dotfileGuard() {
        return new DotfileGuard();
    }

    @Bean
    public SandboxResolver sandboxResolver(StaticRoot staticRoot) {
        return new SandboxResolver(staticRoot);
    }

    @Bean
    public ContentPolicy contentPolicy() {
        return new ContentPolicy();
    }

    @Bean
    public AssetDeliveryHandler assetDeliveryHandler(
            PathNormalizer pathNormalizer,
            TraversalDetector traversalDetector,
            DotfileGuard dotfileGuard,
            SandboxResolver sandboxResolver,
            ContentPolicy contentPolicy) {

        return new AssetDeliveryHandler(
                pathNormalizer,
                traversalDetector,
                dotfileGuard,
                sandboxResolver,
                contentPolicy,
                LoggerFactory.getLogger(AssetDeliveryHandler.class));
    }

    /**
     * Registriert den Upload-Filter direkt nach dem Trace-ID-Filter für alle URLs;
     * die Prefix-Prüfung erfolgt im Filter selbst auf Roh- und normalisiertem Pfad.
     *
     * @param handler Auslieferungs-Service
     * @param prefix  Mount-Prefix (Standard: {@code /uploads})
     * @return Filter-Registrierung
     */
    @Bean
    public FilterRegistrationBean<AssetDeliveryFilter> assetDeliveryFilter(
            AssetDeliveryHandler handler, @Value("${socialnet.media.prefix:/uploads}") String prefix) {

        FilterRegistrationBean<AssetDeliveryFilter> registration =
                new FilterRegistrationBean<>(new AssetDeliveryFilter(prefix, handler));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    /**
     * Tomcat-Anpassung: kodierte Slashes bis zum Filter durchreichen und
     * vom Container abgelehnte Upload-URIs als JSON-Fehler beantworten.
     */
    @Bean
    public AssetContainerCustomizer assetContainerCustomizer(@Value("${socialnet.media.prefix:/uploads}") String prefix) {
        return new AssetContainerCustomizer(prefix);
    }
}
