package de.htwsaar.socialnet.common.logging;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Konfiguration für Logging und Tracing.
 *
 * <p>Der {@link TraceIdFilter} läuft vor allen anderen Filtern, damit auch frühe
 * Ablehnungen (z. B. ungültige Upload-Pfade) bereits eine Trace-ID im Log tragen.</p>
 */
@Configuration
public class LoggingConfig {

    @Bean
    public TraceIdFilter traceIdFilter() {
        return new TraceIdFilter();
    }

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration(TraceIdFilter traceIdFilter) {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>(traceIdFilter);
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
