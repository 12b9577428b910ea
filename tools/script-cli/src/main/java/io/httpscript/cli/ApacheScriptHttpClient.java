package io.httpscript.cli;

import io.httpscript.runtime.http.HeaderField;
import io.httpscript.runtime.http.HttpClient;
import io.httpscript.runtime.http.HttpResponse;
import io.httpscript.runtime.http.HttpVersion;
import io.httpscript.runtime.http.ResolvedRequest;
import io.httpscript.runtime.http.TransportException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.ProtocolVersion;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link HttpClient} on top of the Apache HttpClient 5 classic API.
 */
public final class ApacheScriptHttpClient implements HttpClient, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ApacheScriptHttpClient.class);

    private static final ContentType PLAIN_TEXT = ContentType.create("text/plain", StandardCharsets.UTF_8);

    private final CloseableHttpClient httpClient;

    public ApacheScriptHttpClient(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheScriptHttpClient create(ClientConfig config) {
        Objects.requireNonNull(config, "config");

        PoolingHttpClientConnectionManagerBuilder connections = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(config.connectTimeout().toMillis()))
                .build());
        if (config.acceptInvalidCertificates()) {
            log.warn("TLS certificate and hostname verification is disabled");
            connections.setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
                .setSslContext(trustAll())
                .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                .build());
        }

        HttpClientBuilder builder = HttpClients.custom()
            .setConnectionManager(connections.build())
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(config.responseTimeout().toMillis()))
                .setRedirectsEnabled(config.followRedirects())
                .build());
        if (!config.followRedirects()) {
            builder.disableRedirectHandling();
        }
        return new ApacheScriptHttpClient(builder.build());
    }

    @Override
    public HttpResponse execute(ResolvedRequest request) {
        Objects.requireNonNull(request, "request");

        URI target;
        try {
            target = URI.create(normalizeTarget(request.target()));
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request target '" + request.target() + "': " + e.getMessage(), e);
        }

        HttpUriRequestBase message = new HttpUriRequestBase(request.method().name(), target);
        String contentType = null;
        for (HeaderField header : request.headers()) {
            message.addHeader(header.name(), header.value());
            if (header.name().equalsIgnoreCase("Content-Type")) {
                contentType = header.value();
            }
        }
        if (request.body() != null) {
            message.setEntity(new StringEntity(request.body(), contentType(contentType)));
        }

        log.debug("Sending {} {}", request.method(), target);
        try {
            return httpClient.execute(message, ApacheScriptHttpClient::toResponse);
        } catch (IOException e) {
            throw new TransportException(request.requestLine() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    /**
     * Targets without a scheme are sent over plain HTTP.
     */
    static String normalizeTarget(String target) {
        if (target.contains("://")) {
            return target;
        }
        if (target.startsWith("//")) {
            return "http:" + target;
        }
        return "http://" + target;
    }

    private static HttpResponse toResponse(ClassicHttpResponse response) throws IOException {
        List<HeaderField> headers = new ArrayList<>();
        for (Header header : response.getHeaders()) {
            headers.add(new HeaderField(header.getName(), header.getValue()));
        }
        String body = null;
        if (response.getEntity() != null) {
            try {
                body = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            } catch (ParseException e) {
                throw new IOException("Cannot read response body: " + e.getMessage(), e);
            }
            if (body.isEmpty()) {
                body = null;
            }
        }
        return new HttpResponse(version(response.getVersion()), response.getCode(), response.getReasonPhrase(),
            headers, body);
    }

    private static HttpVersion version(ProtocolVersion version) {
        if (version == null) {
            return HttpVersion.HTTP_1_1;
        }
        return HttpVersion.of(version.getMajor(), version.getMinor());
    }

    private static ContentType contentType(String value) {
        if (value == null || value.isBlank()) {
            return PLAIN_TEXT;
        }
        ContentType parsed;
        try {
            parsed = ContentType.parse(value);
        } catch (RuntimeException e) {
            return PLAIN_TEXT;
        }
        return parsed.getCharset() == null ? parsed.withCharset(StandardCharsets.UTF_8) : parsed;
    }

    private static SSLContext trustAll() {
        try {
            return SSLContextBuilder.create()
                .loadTrustMaterial(TrustAllStrategy.INSTANCE)
                .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create trust-all TLS context", e);
        }
    }
}
