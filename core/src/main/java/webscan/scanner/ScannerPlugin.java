package webscan.scanner;

import webscan.model.Finding;
import webscan.model.VulnerabilityClass;

import java.util.List;

/**
 * Плагин сканера одного класса уязвимостей.
 *
 * <p>Жизненный цикл в рамках одного сканирования:
 * <ol>
 *   <li>{@link #setup(ScanContext)} выделяет исполнитель запросов и сессию; повторный вызов ничего не меняет</li>
 *   <li>{@link #scan(String)} вызывается для каждого URL, возможно из нескольких потоков одновременно</li>
 *   <li>{@link #cleanup()} освобождает сессию; безопасен при повторном вызове</li>
 * </ol>
 *
 * <p>{@code scan} не бросает исключений из-за отдельной нагрузки: такие ошибки
 * логируются, и проверка продолжается со следующей нагрузкой.
 */
public interface ScannerPlugin {

    /**
     * @return registry name usable in the scan types of a scan request
     */
    String getName();

    String getDescription();

    VulnerabilityClass getVulnerabilityClass();

    /**
     * @throws RuntimeException if the plugin cannot run in this scan; the plugin is then abandoned
     */
    void setup(ScanContext context);

    List<Finding> scan(String url);

    void cleanup();
}
