package de.htwsaar.socialnet.media.web;

import de.htwsaar.socialnet.common.dto.ApiErrorResponse;
import de.htwsaar.socialnet.common.logging.TraceIdFilter;
import de.htwsaar.socialnet.common.serialization.JacksonCodec;
import de.htwsaar.socialnet.media.domain.AssetDelivery;
import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.domain.RequestPath;
import de.htwsaar.socialnet.media.policy.ContentPolicy;
import de.htwsaar.socialnet.media.service.AssetDeliveryHandler;
import de.htwsaar.socialnet.media.service.AssetRejectedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP-Adapter für Upload-Zugriffe unter einem konfigurierbaren Prefix (Standard {@code /uploads}).
 *
 * <p>Als Filter statt Controller umgesetzt, damit die Prüfung vor jedem Handler-Mapping
 * und unabhängig von dessen Pfad-Normalisierung läuft. Kein Fachcode hier, nur
 * Request-Zerlegung, HTTP-Mapping und Streaming.</p>
 *
 * <p>Nur {@code GET} und {@code HEAD} werden bedient; andere Methoden laufen unverändert
 * durch die Filterkette.</p>
 */
public class AssetDeliveryFilter extends OncePerRequestFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AssetDeliveryFilter.class);

    private final String prefix;
    private final AssetDeliveryHandler handler;

    /**
     * @param prefix  Mount-Prefix, z. B. {@code /uploads}
     * @param handler fachlicher Auslieferungs-Service
     */
    public AssetDeliveryFilter(String prefix, AssetDeliveryHandler handler) {
        this.prefix = normalizePrefix(prefix);
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String method = request.getMethod();
        if (!HttpMethod.GET.matches(method) && !HttpMethod.HEAD.matches(method)) {
            return true;
        }
        return !isMounted(rawPath(request)) && !isMounted(normalizedPath(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        RequestPath path = new RequestPath(stripPrefix(rawPath(request)), stripPrefix(normalizedPath(request)));

        AssetDelivery delivery;
        try {
            delivery = handler.resolve(path);
        } catch (AssetRejectedException ex) {
            writeError(response, ex.getError());
            return;
        }

        if (HttpMethod.HEAD.matches(request.getMethod())) {
            writeHeaders(response, delivery);
            handler.delivered(delivery, 0);
            return;
        }

        InputStream in;
        try {
            in = handler.open(delivery);
        } catch (AssetRejectedException ex) {
            writeError(response, ex.getError());
            return;
        }

        try (in) {
            writeHeaders(response, delivery);
            long written = in.transferTo(response.getOutputStream());
            response.flushBuffer();
            handler.delivered(delivery, written);
        } catch (IOException ex) {
            if (response.isCommitted()) {
                // Client hat abgebrochen oder Datei wurde gekürzt: Status ist bereits raus
                LOG.debug("Streaming of {} aborted: {}", delivery.file(), ex.toString());
                return;
            }
            LOG.warn("Reading {} failed before response was committed: {}", delivery.file(), ex.toString());
            response.reset();
            restoreTraceId(response);
            writeError(response, DeliveryError.FILE_NOT_FOUND);
        }
    }

    private void writeHeaders(HttpServletResponse response, AssetDelivery delivery) {
        response.setStatus(HttpServletResponse.SC_OK);
        for (Map.Entry<String, String> header : delivery.content().headers().entrySet()) {
            response.setHeader(header.getKey(), header.getValue());
        }
        response.setContentType(delivery.content().contentType());
        response.setContentLengthLong(delivery.size());
        response.setDateHeader(HttpHeaders.LAST_MODIFIED, delivery.lastModified().toEpochMilli());
    }

    private void writeError(HttpServletResponse response, DeliveryError error) throws IOException {
        byte[] body = JacksonCodec.toJsonBytes(ApiErrorResponse.of(error.name(), error.message()));
        response.setStatus(error.status());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(ContentPolicy.X_CONTENT_TYPE_OPTIONS, ContentPolicy.NOSNIFF);
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }

    /** {@code reset()} verwirft auch den Trace-Header des {@link TraceIdFilter}. */
    private static void restoreTraceId(HttpServletResponse response) {
        String traceId = MDC.get(TraceIdFilter.TRACE_ID_KEY);
        if (traceId != null) {
            response.setHeader(TraceIdFilter.TRACE_ID_HEADER, traceId);
        }
    }

    private boolean isMounted(String path) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private String stripPrefix(String path) {
        return isMounted(path) ? path.substring(prefix.length()) : path;
    }

    /** Request-URI ohne Context-Path, so wie sie auf der Leitung stand (nicht dekodiert). */
    private static String rawPath(HttpServletRequest request) {
        String uri = request.getRequestURI() != null ? request.getRequestURI() : "";
        String contextPath = request.getContextPath() != null ? request.getContextPath() : "";
        return uri.startsWith(contextPath) ? uri.substring(contextPath.length()) : uri;
    }

    /** Vom Container dekodierter und normalisierter Pfad. */
    private static String normalizedPath(HttpServletRequest request) {
        String servletPath = request.getServletPath() != null ? request.getServletPath() : "";
        String pathInfo = request.getPathInfo() != null ? request.getPathInfo() : "";
        return servletPath + pathInfo;
    }

    /**
     * Normalisiert den Prefix: trimmt, führender Slash, ohne abschließenden Slash.
     *
     * @param raw konfigurierter Prefix
     * @return normalisierter Prefix
     * @throws IllegalArgumentException wenn der Prefix leer ist oder nur aus {@code /} besteht
     */
    static String normalizePrefix(String raw) {
        String p = raw == null ? "" : raw.trim();
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        if (p.isEmpty()) {
            throw new IllegalArgumentException("asset prefix must not be empty or '/'");
        }
        return p.startsWith("/") ? p : "/" + p;
    }
}
