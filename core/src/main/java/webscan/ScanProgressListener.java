package webscan;

import webscan.model.Finding;
import webscan.model.ScanPhase;
import webscan.model.ScanStatistics;

/**
 * Слушатель прогресса сканирования.
 * Методы вызываются из рабочих потоков сканирования, реализация должна быть потокобезопасной.
 */
public interface ScanProgressListener {

    /**
     * Вызывается при смене фазы сканирования.
     *
     * @param scanId идентификатор сканирования
     * @param phase новая фаза
     */
    void onPhaseChanged(String scanId, ScanPhase phase);

    /**
     * Вызывается после загрузки страницы краулером.
     *
     * @param scanId идентификатор сканирования
     * @param url загруженный URL
     * @param depth глубина, на которой найден URL
     */
    void onUrlCrawled(String scanId, String url, int depth);

    /**
     * Вызывается перед запуском плагина.
     *
     * @param scanId идентификатор сканирования
     * @param pluginName имя плагина
     * @param targetCount количество URL для проверки
     */
    void onPluginStarted(String scanId, String pluginName, int targetCount);

    /**
     * Вызывается после завершения плагина на всех URL.
     *
     * @param scanId идентификатор сканирования
     * @param pluginName имя плагина
     * @param findingCount количество уязвимостей, найденных плагином
     */
    void onPluginCompleted(String scanId, String pluginName, int findingCount);

    /**
     * Вызывается для каждой новой уязвимости.
     */
    void onFinding(String scanId, Finding finding);

    /**
     * Вызывается один раз при переходе сканирования в конечный статус.
     *
     * @param scanId идентификатор сканирования
     * @param statistics итоговая статистика
     */
    void onScanComplete(String scanId, ScanStatistics statistics);

    /**
     * Пустая реализация без операций.
     */
    static ScanProgressListener noOp() {
        return new ScanProgressListener() {
            @Override
            public void onPhaseChanged(String scanId, ScanPhase phase) {}

            @Override
            public void onUrlCrawled(String scanId, String url, int depth) {}

            @Override
            public void onPluginStarted(String scanId, String pluginName, int targetCount) {}

            @Override
            public void onPluginCompleted(String scanId, String pluginName, int findingCount) {}

            @Override
            public void onFinding(String scanId, Finding finding) {}

            @Override
            public void onScanComplete(String scanId, ScanStatistics statistics) {}
        };
    }
}
