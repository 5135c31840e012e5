package de.htwsaar.socialnet.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Erzeugung und Verwaltung einer Trace-ID.
 * Für jede eingehende HTTP-Anfrage wird eine Trace-ID erzeugt oder aus einem
 * Request-Header übernommen, im MDC abgelegt und im Response-Header zurückgegeben,
 * sodass abgelehnte Asset-Anfragen über Client und Log hinweg korrelierbar sind.
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    /** Obergrenze für übernommene Trace-IDs, längere Werte werden ersetzt */
    static final int MAX_TRACE_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = sanitize(request.getHeader(TRACE_ID_HEADER));

        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Kontext nach der Anfrage wieder entfernen, Worker-Threads werden wiederverwendet
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * Übernimmt nur druckbare ASCII-Werte, damit keine Steuerzeichen ins Log gelangen.
     */
    private static String sanitize(String incoming) {
        if (incoming == null || incoming.isBlank() || incoming.length() > MAX_TRACE_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        for (int i = 0; i < incoming.length(); i++) {
            char c = incoming.charAt(i);
            if (c < 0x21 || c > 0x7e) {
                return UUID.randomUUID().toString();
            }
        }
        return incoming;
    }
}
