package de.htwsaar.socialnet.media.web;

import de.htwsaar.socialnet.common.dto.ApiErrorResponse;
import de.htwsaar.socialnet.common.serialization.JacksonCodec;
import de.htwsaar.socialnet.media.domain.DeliveryError;
import de.htwsaar.socialnet.media.policy.ContentPolicy;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.apache.catalina.connector.Request;
import org.apache.catalina.connector.Response;
import org.apache.catalina.valves.ErrorReportValve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;

/**
 * Fehlerseite des Tomcat-Hosts für Anfragen, die der Container schon vor der Filterkette
 * ablehnt (z. B. {@code ..} oberhalb des Roots oder ein NUL-Byte in der URI).
 *
 * <p>Für URIs unter dem Upload-Prefix entsteht derselbe JSON-Körper wie im
 * {@link AssetDeliveryFilter}; alle anderen Fehler rendert die Basisklasse ohne
 * Report und ohne Server-Info.</p>
 */
public class AssetErrorReportValve extends ErrorReportValve {

    private static final Logger LOG = LoggerFactory.getLogger(AssetErrorReportValve.class);

    private final String mountPath;

    /**
     * @param mountPath Context-Path plus normalisierter Prefix, z. B. {@code /uploads}
     */
    public AssetErrorReportValve(String mountPath) {
        this.mountPath = mountPath;
        setShowReport(false);
        setShowServerInfo(false);
    }

    public String getMountPath() {
        return mountPath;
    }

    @Override
    protected void report(Request request, Response response, Throwable throwable) {
        if (response.getStatus() != HttpServletResponse.SC_BAD_REQUEST
                || response.getContentWritten() > 0
                || !isMounted(request.getRequestURI())) {
            super.report(request, response, throwable);
            return;
        }
        if (!response.setErrorReported()) {
            return;
        }

        DeliveryError error = DeliveryError.INVALID_PATH;
        LOG.warn("Container rejected asset request before filter chain: {}", error);
        try {
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.setHeader(ContentPolicy.X_CONTENT_TYPE_OPTIONS, ContentPolicy.NOSNIFF);
            Writer writer = response.getReporter();
            if (writer != null) {
                writer.write(JacksonCodec.toJson(ApiErrorResponse.of(error.name(), error.message())));
                response.finishResponse();
            }
        } catch (IOException | IllegalStateException ex) {
            LOG.debug("Writing asset error body failed: {}", ex.toString());
        }
    }

    boolean isMounted(String requestUri) {
        return requestUri != null && (requestUri.equals(mountPath) || requestUri.startsWith(mountPath + "/"));
    }
}
