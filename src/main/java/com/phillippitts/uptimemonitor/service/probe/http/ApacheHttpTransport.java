package com.phillippitts.uptimemonitor.service.probe.http;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;
import org.json.JSONException;
import org.json.JSONTokener;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * {@link HttpTransport} backed by Apache HttpClient 5.
 *
 * <p>A client is built per request because the redirect limit, TLS verification and timeouts are
 * per-monitor settings. Automatic retries are disabled; retrying is the retry policy's job.
 * Connections are never reused, so every redirect hop opens a fresh connection instead of writing
 * to one the server may already have closed.
 */
public class ApacheHttpTransport implements HttpTransport {

    @Override
    public HttpProbeResponse execute(HttpProbeRequest request) throws IOException {
        Timeout timeout = Timeout.ofMilliseconds(request.timeout().toMillis());

        PoolingHttpClientConnectionManagerBuilder connections = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .build());
        if (request.ignoreTls()) {
            connections.setSSLSocketFactory(trustAllSocketFactory());
        }

        RequestConfig requestConfig = RequestConfig.custom()
                .setRedirectsEnabled(request.maxRedirects() > 0)
                .setMaxRedirects(request.maxRedirects())
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build();

        try (CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(connections.build())
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .setConnectionReuseStrategy((req, res, context) -> false)
                .build()) {
            HttpUriRequestBase httpRequest = new HttpUriRequestBase(request.method(), URI.create(request.url()));
            request.headers().forEach(httpRequest::addHeader);
            if (request.body() != null && !request.body().isEmpty()) {
                httpRequest.setEntity(new StringEntity(request.body(), contentTypeOf(request.body())));
            }
            return client.execute(httpRequest, response -> new HttpProbeResponse(
                    response.getCode(),
                    response.getReasonPhrase(),
                    readBody(response.getEntity())));
        }
    }

    private static String readBody(HttpEntity entity) throws IOException, org.apache.hc.core5.http.ParseException {
        if (entity == null) {
            return "";
        }
        return EntityUtils.toString(entity, StandardCharsets.UTF_8);
    }

    /** JSON bodies are labelled as JSON, anything else as plain text. */
    static ContentType contentTypeOf(String body) {
        try {
            Object value = new JSONTokener(body).nextValue();
            if (value instanceof org.json.JSONObject || value instanceof org.json.JSONArray) {
                return ContentType.APPLICATION_JSON;
            }
        } catch (JSONException ignored) {
            // not JSON; fall through to plain text
        }
        return ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8);
    }

    private static SSLConnectionSocketFactory trustAllSocketFactory() throws IOException {
        try {
            SSLContext sslContext = SSLContextBuilder.create()
                    .loadTrustMaterial(TrustAllStrategy.INSTANCE)
                    .build();
            return SSLConnectionSocketFactoryBuilder.create()
                    .setSslContext(sslContext)
                    .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot build trust-all TLS context", e);
        }
    }
}
