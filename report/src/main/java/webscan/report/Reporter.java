package webscan.report;

import java.io.IOException;
import java.io.Writer;

/**
 * Генератор отчета о сканировании в конкретном формате.
 *
 * <p>Пример использования:
 * <pre>{@code
 * Reporter reporter = ReporterFactory.create(ReportFormat.CONSOLE);
 * try (Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
 *     reporter.generate(report, writer);
 * }
 * }</pre>
 *
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Записывает отчет. Поток не закрывается, но сбрасывается по окончании записи.
     *
     * @param report результаты сканирования
     * @param writer поток вывода
     * @throws IOException если запись не удалась
     */
    void generate(ScanReport report, Writer writer) throws IOException;

    ReportFormat getFormat();
}
