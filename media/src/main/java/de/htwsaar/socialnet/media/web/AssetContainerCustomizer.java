package de.htwsaar.socialnet.media.web;

import org.apache.catalina.Container;
import org.apache.catalina.Context;
import org.apache.catalina.Pipeline;
import org.apache.catalina.Valve;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.core.StandardHost;
import org.apache.catalina.valves.ErrorReportValve;
import org.apache.tomcat.util.buf.EncodedSolidusHandling;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.core.Ordered;

/**
 * Passt den eingebetteten Tomcat an die Upload-Auslieferung an.
 *
 * <p>Kodierte Slashes und Backslashes werden an die Filterkette durchgereicht, damit die
 * Signaturprüfung sie sieht. Was Tomcat trotzdem ablehnt, beantwortet
 * {@link AssetErrorReportValve} mit dem JSON-Fehlerkörper.</p>
 *
 * <p>Läuft nach den Spring-Boot-Customizern, damit deren {@link ErrorReportValve} ersetzt wird.</p>
 */
public class AssetContainerCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory>, Ordered {

    private final String prefix;

    /**
     * @param prefix Mount-Prefix der Uploads
     */
    public AssetContainerCustomizer(String prefix) {
        this.prefix = AssetDeliveryFilter.normalizePrefix(prefix);
    }

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        factory.addConnectorCustomizers(this::customizeConnector);
        factory.addContextCustomizers(this::installErrorValve);
    }

    void customizeConnector(Connector connector) {
        connector.setEncodedSolidusHandling(EncodedSolidusHandling.PASS_THROUGH.getValue());
        connector.setAllowBackslash(true);
    }

    void installErrorValve(Context context) {
        Container host = context.getParent();
        Pipeline pipeline = host.getPipeline();
        for (Valve valve : pipeline.getValves()) {
            if (valve instanceof ErrorReportValve) {
                pipeline.removeValve(valve);
            }
        }
        pipeline.addValve(new AssetErrorReportValve(context.getPath() + prefix));
        if (host instanceof StandardHost) {
            // sonst ergänzt der Host beim Start seine Standard-Fehlerseite
            ((StandardHost) host).setErrorReportValveClass(AssetErrorReportValve.class.getName());
        }
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
