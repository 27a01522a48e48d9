package webscan.http;

import java.io.IOException;
import java.time.Duration;

/**
 * Транспортный HTTP клиент, через который {@link RequestExecutor} выполняет запросы.
 *
 * <p>Реализации обязаны не следовать редиректам автоматически: ответ 3xx
 * возвращается вызывающей стороне как есть. Ошибки транспорта сообщаются
 * через {@link IOException}; таймаут сигнализируется
 * {@link java.net.SocketTimeoutException}.
 */
public interface HttpClient extends AutoCloseable {

    /**
     * Выполняет один HTTP запрос без повторов.
     *
     * @param request запрос
     * @param timeout таймаут соединения и чтения
     * @return ответ сервера, включая 4xx/5xx
     * @throws IOException при сетевой ошибке или таймауте
     */
    HttpResponse execute(HttpRequest request, Duration timeout) throws IOException;

    /**
     * Проверяет, поддерживает ли клиент схему URL.
     */
    default boolean supports(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    @Override
    void close();
}
