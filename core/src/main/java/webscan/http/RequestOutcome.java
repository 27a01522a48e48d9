package webscan.http;

import java.util.Objects;
import java.util.Optional;

/**
 * Результат отправки запроса через {@link RequestExecutor}.
 *
 * <p>Вместо исключений для неудачных запросов используется явный тип результата:
 * вызывающая сторона обязана обработать неокончательный случай
 * (таймаут, сетевая ошибка, отмена, запрещенный хост) и трактовать его как
 * "неизвестно", а не "не уязвимо".
 */
public final class RequestOutcome {

    public enum Kind {
        OK,
        TIMEOUT,
        NETWORK_ERROR,
        CANCELLED,
        /** The target host was refused by the scan's host filter; nothing was sent. */
        REJECTED
    }

    private final Kind kind;
    private final HttpResponse response;
    private final Exception error;
    private final int attempts;

    private RequestOutcome(Kind kind, HttpResponse response, Exception error, int attempts) {
        this.kind = kind;
        this.response = response;
        this.error = error;
        this.attempts = attempts;
    }

    public static RequestOutcome ok(HttpResponse response, int attempts) {
        return new RequestOutcome(Kind.OK, Objects.requireNonNull(response, "response cannot be null"), null, attempts);
    }

    public static RequestOutcome timeout(Exception error, int attempts) {
        return new RequestOutcome(Kind.TIMEOUT, null, error, attempts);
    }

    public static RequestOutcome networkError(Exception error, int attempts) {
        return new RequestOutcome(Kind.NETWORK_ERROR, null, error, attempts);
    }

    public static RequestOutcome cancelled() {
        return new RequestOutcome(Kind.CANCELLED, null, null, 0);
    }

    public static RequestOutcome rejected() {
        return new RequestOutcome(Kind.REJECTED, null, null, 0);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isInconclusive() {
        return kind != Kind.OK;
    }

    public Optional<HttpResponse> getResponse() {
        return Optional.ofNullable(response);
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OK -> "RequestOutcome{OK, " + response + ", attempts=" + attempts + "}";
            case TIMEOUT, NETWORK_ERROR -> "RequestOutcome{" + kind + ", error=" +
                (error != null ? error.getMessage() : "n/a") + ", attempts=" + attempts + "}";
            case CANCELLED, REJECTED -> "RequestOutcome{" + kind + "}";
        };
    }
}
