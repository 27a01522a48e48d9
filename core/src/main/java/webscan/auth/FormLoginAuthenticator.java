package webscan.auth;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import webscan.http.*;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Повторная аутентификация через HTML форму входа с CSRF токеном.
 *
 * <p>Алгоритм:
 * <ol>
 *   <li>GET страницы входа, сохранение выданных cookies</li>
 *   <li>извлечение CSRF токена из скрытого поля формы</li>
 *   <li>POST логина, пароля и токена</li>
 *   <li>проверка защищенной страницы: она не должна перенаправлять на вход</li>
 * </ol>
 *
 * <p>Срабатывает только для хоста, указанного в URL страницы входа.
 */
public final class FormLoginAuthenticator implements ReauthHandler {
    private static final Logger logger = Logger.getLogger(FormLoginAuthenticator.class.getName());
    private static final Duration LOGIN_TIMEOUT = Duration.ofSeconds(30);

    private final LoginCredentials credentials;
    private final String targetHost;

    public FormLoginAuthenticator(LoginCredentials credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials cannot be null");
        this.targetHost = hostOf(credentials.getLoginUrl());
        if (targetHost.isEmpty()) {
            throw new IllegalArgumentException("Login URL has no host: " + credentials.getLoginUrl());
        }
    }

    @Override
    public boolean isLoginRedirect(HttpRequest request, HttpResponse response) {
        if (!response.isRedirect() || !targetHost.equals(request.getHost())) {
            return false;
        }
        // The login request itself must not trigger another login
        if (request.getUrl().equals(credentials.getLoginUrl())) {
            return false;
        }
        return response.getLocation()
            .map(location -> resolve(request.getUrl(), location))
            .map(this::isLoginUrl)
            .orElse(false);
    }

    @Override
    public synchronized boolean reauthenticate(HttpClient client, SessionState session) {
        try {
            HttpResponse loginPage = client.execute(
                HttpRequest.builder().url(credentials.getLoginUrl()).cookies(session.getCookies()).build(),
                LOGIN_TIMEOUT);
            session.mergeSetCookieHeaders(loginPage.getHeaderValues("Set-Cookie"));

            Map<String, String> form = new LinkedHashMap<>();
            form.put(credentials.getUsernameField(), credentials.getUsername());
            form.put(credentials.getPasswordField(), credentials.getPassword());
            form.putAll(credentials.getExtraFields());
            extractCsrfToken(loginPage.getBody(), credentials.getCsrfField())
                .ifPresentOrElse(
                    token -> form.put(credentials.getCsrfField(), token),
                    () -> logger.fine("No CSRF token '" + credentials.getCsrfField() + "' on login page"));

            HttpResponse loginResponse = client.execute(
                HttpRequest.builder()
                    .method("POST")
                    .url(credentials.getLoginUrl())
                    .cookies(session.getCookies())
                    .formBody(form)
                    .build(),
                LOGIN_TIMEOUT);
            session.mergeSetCookieHeaders(loginResponse.getHeaderValues("Set-Cookie"));

            if (!verify(client, session, loginResponse)) {
                logger.warning("Login to " + targetHost + " was not accepted");
                return false;
            }

            session.markAuthenticated(targetHost);
            logger.info("Re-authenticated against " + targetHost + " as " + credentials.getUsername());
            return true;

        } catch (IOException e) {
            logger.log(Level.WARNING, "Re-authentication against " + targetHost + " failed", e);
            return false;
        }
    }

    public LoginCredentials getCredentials() {
        return credentials;
    }

    private boolean verify(HttpClient client, SessionState session, HttpResponse loginResponse) throws IOException {
        if (credentials.getVerifyUrl().isEmpty()) {
            if (loginResponse.getStatusCode() >= 400) {
                return false;
            }
            return loginResponse.getLocation()
                .map(location -> !isLoginUrl(resolve(credentials.getLoginUrl(), location)))
                .orElse(true);
        }

        HttpResponse protectedPage = client.execute(
            HttpRequest.builder().url(credentials.getVerifyUrl().get()).cookies(session.getCookies()).build(),
            LOGIN_TIMEOUT);
        session.mergeSetCookieHeaders(protectedPage.getHeaderValues("Set-Cookie"));

        if (protectedPage.getStatusCode() >= 400) {
            return false;
        }
        return protectedPage.getLocation()
            .map(location -> !isLoginUrl(resolve(credentials.getVerifyUrl().get(), location)))
            .orElse(true);
    }

    /**
     * Extracts the value of the hidden CSRF input from a login page.
     */
    static Optional<String> extractCsrfToken(String html, String fieldName) {
        if (html == null || html.isEmpty()) {
            return Optional.empty();
        }

        Element input = Jsoup.parse(html).selectFirst("input[name=" + fieldName + "]");
        if (input != null && !input.attr("value").isEmpty()) {
            return Optional.of(input.attr("value"));
        }

        // Fallback for tokens rendered outside a parsable form, e.g. inside scripts
        Pattern pattern = Pattern.compile(
            "name=[\"']" + Pattern.quote(fieldName) + "[\"']\\s+value=[\"']([^\"']+)[\"']");
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private boolean isLoginUrl(String url) {
        try {
            URI uri = URI.create(url);
            String path = uri.getPath() != null ? uri.getPath().toLowerCase(Locale.ROOT) : "";
            return targetHost.equals(hostOf(url)) && path.contains(credentials.getLoginPathMarker());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String resolve(String base, String location) {
        try {
            return URI.create(base).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            return location;
        }
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
