package com.phillippitts.uptimemonitor.service.probe.http;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;

/**
 * Opens a TLS connection and reads the leaf certificate.
 *
 * <p>Trust verification is disabled on purpose: the certificate of an expired, self-signed or
 * mismatched endpoint must still be readable so its expiry can be reported. SNI is set so that
 * virtual hosts present the right certificate.
 */
public class TlsCertificateInspector implements CertificateInspector {

    @Override
    public CertificateInfo inspect(String host, int port, Duration timeout) throws IOException {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        SSLContext ctx = trustingContext();
        try (SSLSocket socket = (SSLSocket) ctx.getSocketFactory().createSocket()) {
            socket.setSoTimeout(timeoutMs);
            socket.connect(new InetSocketAddress(host, port), timeoutMs);

            SSLParameters params = socket.getSSLParameters();
            try {
                params.setServerNames(List.of(new SNIHostName(host)));
            } catch (IllegalArgumentException ignored) {
                // IP literals cannot carry SNI
            }
            socket.setSSLParameters(params);
            socket.startHandshake();

            Certificate[] chain = socket.getSession().getPeerCertificates();
            if (chain.length == 0 || !(chain[0] instanceof X509Certificate leaf)) {
                throw new IOException("Server presented no X.509 certificate");
            }
            return new CertificateInfo(
                    leaf.getSubjectX500Principal().getName(),
                    leaf.getIssuerX500Principal().getName(),
                    leaf.getNotAfter().toInstant());
        }
    }

    private static SSLContext trustingContext() throws IOException {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            }}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot initialise TLS context", e);
        }
    }
}
