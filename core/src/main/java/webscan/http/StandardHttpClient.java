package webscan.http;

import com.google.common.net.MediaType;

import javax.net.ssl.*;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Реализация HTTP клиента на основе java.net.HttpURLConnection.
 *
 * <p>Основные особенности:
 * <ul>
 *   <li>Редиректы никогда не выполняются автоматически</li>
 *   <li>Тело ответа читается и для кодов 4xx/5xx, но не больше {@link HttpClientConfig#getMaxResponseBytes()}</li>
 *   <li>Тело декодируется в кодировке из {@code Content-Type}, по умолчанию UTF-8</li>
 *   <li>Проверка TLS включена по умолчанию; отключается только для отдельного клиента</li>
 * </ul>
 */
public final class StandardHttpClient implements HttpClient {
    private static final Logger logger = Logger.getLogger(StandardHttpClient.class.getName());

    private final HttpClientConfig config;
    private final SSLSocketFactory insecureSocketFactory;

    public StandardHttpClient(HttpClientConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");

        if (!config.isVerifySsl()) {
            logger.warning("TLS verification is disabled - use only against test targets!");
            this.insecureSocketFactory = createInsecureSocketFactory();
        } else {
            this.insecureSocketFactory = null;
        }
    }

    @Override
    public HttpResponse execute(HttpRequest request, Duration timeout) throws IOException {
        long startNanos = System.nanoTime();

        HttpURLConnection connection = (HttpURLConnection) new URL(request.getUrl()).openConnection();
        try {
            configureConnection(connection, timeout);
            connection.setRequestMethod(request.getMethod());

            connection.setRequestProperty("User-Agent", config.getUserAgent());
            config.getDefaultHeaders().forEach(connection::setRequestProperty);
            request.getHeaders().forEach(connection::setRequestProperty);

            if (!request.getCookies().isEmpty()) {
                connection.setRequestProperty("Cookie", request.getCookies().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("; ")));
            }

            if (request.hasBody()) {
                connection.setDoOutput(true);
                if (request.getContentType() != null) {
                    connection.setRequestProperty("Content-Type", request.getContentType());
                }
                try (OutputStream os = connection.getOutputStream()) {
                    os.write(request.getBody().getBytes(StandardCharsets.UTF_8));
                    os.flush();
                }
            }

            int statusCode = connection.getResponseCode();
            String body = readResponseBody(connection, statusCode);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

            Map<String, List<String>> headers = new LinkedHashMap<>(connection.getHeaderFields());
            headers.remove(null); // Remove status line

            logger.fine(request.getMethod() + " " + request.getUrl() + " -> " + statusCode +
                        " (" + elapsed.toMillis() + "ms)");

            return HttpResponse.builder()
                .statusCode(statusCode)
                .headers(headers)
                .body(body)
                .elapsed(elapsed)
                .url(request.getUrl())
                .build();
        } finally {
            connection.disconnect();
        }
    }

    @Override
    public void close() {
        // HttpURLConnection keeps no per-client resources
    }

    private void configureConnection(HttpURLConnection connection, Duration timeout) {
        Duration connectTimeout = timeout != null ? timeout : config.getConnectTimeout();
        Duration readTimeout = timeout != null ? timeout : config.getReadTimeout();
        connection.setConnectTimeout((int) connectTimeout.toMillis());
        connection.setReadTimeout((int) readTimeout.toMillis());
        connection.setInstanceFollowRedirects(false);
        connection.setUseCaches(false);

        if (insecureSocketFactory != null && connection instanceof HttpsURLConnection https) {
            https.setSSLSocketFactory(insecureSocketFactory);
            https.setHostnameVerifier((hostname, session) -> true);
        }
    }

    private String readResponseBody(HttpURLConnection connection, int statusCode) throws IOException {
        try (InputStream inputStream = statusCode >= 400
            ? connection.getErrorStream()
            : connection.getInputStream()) {

            if (inputStream == null) {
                return "";
            }
            byte[] bytes = inputStream.readNBytes(config.getMaxResponseBytes());
            if (bytes.length == config.getMaxResponseBytes() && inputStream.read() != -1) {
                logger.fine("Response body of " + connection.getURL() + " truncated to " + bytes.length + " bytes");
            }
            return new String(bytes, charsetOf(connection.getContentType()));
        }
    }

    /**
     * Charset declared by a {@code Content-Type} header value, or UTF-8 when it is
     * missing, malformed or unknown to this JVM.
     */
    static Charset charsetOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return MediaType.parse(contentType).charset().or(StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.log(Level.FINE, "Unusable charset in Content-Type '" + contentType + "', using UTF-8", e);
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * Создает фабрику сокетов, принимающую любые сертификаты (НЕБЕЗОПАСНО).
     * Применяется только к соединениям этого клиента.
     */
    private static SSLSocketFactory createInsecureSocketFactory() {
        TrustManager[] trustAllCerts = new TrustManager[]{
            new X509TrustManager() {
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
        };

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAllCerts, new SecureRandom());
            return sslContext.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to configure insecure TLS", e);
        }
    }
}
