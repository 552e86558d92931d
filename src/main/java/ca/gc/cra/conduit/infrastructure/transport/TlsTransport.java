package ca.gc.cra.conduit.infrastructure.transport;

import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import ca.gc.cra.conduit.validation.Net;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> TLS-over-TCP transport with explicit SNI and optional ALPN.
 * <p><strong>Why:</strong> The SNI name may differ from the dialed host, so the handshake presents
 * {@link TransportConfig.Tls#serverName()} regardless of what {@code connect} resolved.</p>
 * <p><strong>Security:</strong> Certificates and host names are validated against the SNI name by default.
 * {@link TransportConfig.Tls#allowInsecure()} installs a trust-everything validator; it exists for test servers
 * with self-signed certificates and must never be enabled for real traffic.</p>
 *
 * @since 0.1.0
 */
public final class TlsTransport extends AbstractSocketTransport {
  private static final Logger log = LoggerFactory.getLogger(TlsTransport.class);

  private final TransportConfig.Tls tls;
  private final SSLSocketFactory socketFactory;

  /**
   * Creates a TLS transport using the JVM default trust store, or the insecure validator when requested.
   *
   * @param settings timeouts and binding
   * @param tls TLS presentation settings
   */
  public TlsTransport(TransportSettings settings, TransportConfig.Tls tls) {
    this(settings, tls, tls.allowInsecure() ? insecureSocketFactory() : (SSLSocketFactory) SSLSocketFactory.getDefault());
  }

  TlsTransport(TransportSettings settings, TransportConfig.Tls tls, SSLSocketFactory socketFactory) {
    super(settings);
    this.tls = Objects.requireNonNull(tls, "tls");
    this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
  }

  @Override
  protected Socket upgrade(Socket raw, String host, int port) throws IOException {
    SSLSocket ssl = (SSLSocket) socketFactory.createSocket(raw, tls.serverName(), port, true);
    ssl.setSSLParameters(parameters(ssl.getSSLParameters()));
    ssl.setSoTimeout(settings.connectTimeoutMillis());
    try {
      ssl.startHandshake();
    } catch (SocketTimeoutException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new TransportException(TransportError.TLS_HANDSHAKE_FAILED,
          "TLS handshake with " + tls.serverName() + " failed: " + ex.getMessage(), ex);
    }
    ssl.setSoTimeout(settings.readTimeoutMillis());
    log.debug("TLS established with sni={} protocol={} alpn={}",
        tls.serverName(), ssl.getSession().getProtocol(), ssl.getApplicationProtocol());
    return ssl;
  }

  SSLParameters parameters(SSLParameters params) {
    if (!Net.isIpv4Literal(tls.serverName()) && !Net.isIpv6Literal(tls.serverName())) {
      params.setServerNames(List.of(new SNIHostName(tls.serverName())));
    }
    if (!tls.alpn().isEmpty()) {
      params.setApplicationProtocols(tls.alpn().toArray(String[]::new));
    }
    if (!tls.allowInsecure()) {
      params.setEndpointIdentificationAlgorithm("HTTPS");
    }
    return params;
  }

  @Override
  protected String name() {
    return "tls";
  }

  private static SSLSocketFactory insecureSocketFactory() {
    log.warn("TLS certificate validation disabled (allowInsecure); use only against test servers");
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {new InsecureTrustManager()}, new SecureRandom());
      return context.getSocketFactory();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Unable to initialize insecure TLS context", ex);
    }
  }

  /** Accepts every certificate chain. Test-only. */
  private static final class InsecureTrustManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
