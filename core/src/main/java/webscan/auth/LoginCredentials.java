package webscan.auth;

import java.util.*;

/**
 * Учетные данные и параметры формы входа для повторной аутентификации на цели.
 *
 * <p>По умолчанию ожидается форма с полями {@code username}, {@code password},
 * кнопкой {@code Login} и CSRF токеном {@code user_token}.
 */
public final class LoginCredentials {
    private final String loginUrl;
    private final String username;
    private final String password;
    private final String usernameField;
    private final String passwordField;
    private final String csrfField;
    private final String loginPathMarker;
    private final Optional<String> verifyUrl;
    private final Map<String, String> extraFields;

    private LoginCredentials(Builder builder) {
        this.loginUrl = Objects.requireNonNull(builder.loginUrl, "loginUrl cannot be null");
        this.username = Objects.requireNonNull(builder.username, "username cannot be null");
        this.password = Objects.requireNonNull(builder.password, "password cannot be null");
        this.usernameField = builder.usernameField;
        this.passwordField = builder.passwordField;
        this.csrfField = builder.csrfField;
        this.loginPathMarker = builder.loginPathMarker.toLowerCase(Locale.ROOT);
        this.verifyUrl = Optional.ofNullable(builder.verifyUrl);
        this.extraFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraFields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLoginUrl() {
        return loginUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getUsernameField() {
        return usernameField;
    }

    public String getPasswordField() {
        return passwordField;
    }

    public String getCsrfField() {
        return csrfField;
    }

    public String getLoginPathMarker() {
        return loginPathMarker;
    }

    public Optional<String> getVerifyUrl() {
        return verifyUrl;
    }

    public Map<String, String> getExtraFields() {
        return extraFields;
    }

    @Override
    public String toString() {
        // Password intentionally omitted
        return "LoginCredentials{loginUrl=" + loginUrl + ", username=" + username + "}";
    }

    public static class Builder {
        private String loginUrl;
        private String username;
        private String password;
        private String usernameField = "username";
        private String passwordField = "password";
        private String csrfField = "user_token";
        private String loginPathMarker = "login";
        private String verifyUrl;
        private final Map<String, String> extraFields = new LinkedHashMap<>(Map.of("Login", "Login"));

        public Builder loginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder usernameField(String usernameField) {
            this.usernameField = usernameField;
            return this;
        }

        public Builder passwordField(String passwordField) {
            this.passwordField = passwordField;
            return this;
        }

        public Builder csrfField(String csrfField) {
            this.csrfField = csrfField;
            return this;
        }

        public Builder loginPathMarker(String loginPathMarker) {
            this.loginPathMarker = Objects.requireNonNull(loginPathMarker, "loginPathMarker cannot be null");
            return this;
        }

        public Builder verifyUrl(String verifyUrl) {
            this.verifyUrl = verifyUrl;
            return this;
        }

        public Builder extraField(String name, String value) {
            this.extraFields.put(name, value);
            return this;
        }

        public LoginCredentials build() {
            return new LoginCredentials(this);
        }
    }
}
