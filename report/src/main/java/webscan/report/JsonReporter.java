package webscan.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import webscan.model.*;

import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Генератор отчетов в формате JSON для программной обработки результатов.
 *
 * <p>Документ содержит цель, параметры сканирования, статистику, сводку по уровням риска
 * и полный список уязвимостей с доказательствами. Временные метки пишутся в ISO-8601,
 * длительности в миллисекундах.
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @Override
    public void generate(ScanReport report, Writer writer) throws IOException {
        Objects.requireNonNull(report, "report cannot be null");
        Objects.requireNonNull(writer, "writer cannot be null");

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("targetUrl", report.getTargetUrl());
        json.put("scanTypes", report.getScanTypes());
        json.put("generatedAt", report.getGeneratedAt());
        report.getOptions().ifPresent(options -> json.put("options", optionsToMap(options)));
        json.put("statistics", statisticsToMap(report.getStatistics()));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalFindings", report.getFindings().size());
        Map<String, Long> byRisk = new LinkedHashMap<>();
        report.countByRisk().forEach((severity, count) -> byRisk.put(severity.name(), count));
        summary.put("byRisk", byRisk);
        Map<String, Integer> byClass = new LinkedHashMap<>();
        report.groupByClass().forEach((vulnClass, list) -> byClass.put(vulnClass.name(), list.size()));
        summary.put("byClass", byClass);
        json.put("summary", summary);

        List<Map<String, Object>> findings = new ArrayList<>();
        for (Finding finding : report.getFindings()) {
            findings.add(findingToMap(finding));
        }
        json.put("findings", findings);

        objectMapper.writeValue(writer, json);
        writer.flush();
    }

    private Map<String, Object> optionsToMap(ScanOptions options) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("crawl", options.isCrawlEnabled());
        map.put("maxDepth", options.getMaxDepth());
        map.put("maxUrls", options.getMaxUrls());
        map.put("followRobots", options.isFollowRobots());
        map.put("scope", options.getScopePolicy().name());
        map.put("maxRequests", options.getMaxRequests());
        map.put("requestDelayMs", options.getRequestDelay().toMillis());
        map.put("concurrency", options.getConcurrency());
        map.put("requestTimeoutMs", options.getRequestTimeout().toMillis());
        map.put("scanTimeoutMs", options.getScanTimeout().toMillis());
        map.put("confidenceThreshold", options.getConfidenceThreshold());
        map.put("timeBaseDelayMs", options.getTimeBaseDelay().toMillis());
        map.put("maxUnionColumns", options.getMaxUnionColumns());
        map.put("wafBypass", options.isWafBypass());
        map.put("aggressiveTimePayloads", options.isAggressiveTimePayloads());
        map.put("authenticated", options.getCredentials().isPresent());
        return map;
    }

    private Map<String, Object> statisticsToMap(ScanStatistics stats) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scanId", stats.getScanId());
        map.put("status", stats.getStatus().name());
        map.put("urlsCrawled", stats.getUrlsCrawled());
        map.put("formsDiscovered", stats.getFormsDiscovered());
        map.put("formsTested", stats.getFormsTested());
        map.put("requestsSent", stats.getRequestsSent());
        map.put("vulnerabilitiesFound", stats.getVulnerabilitiesFound());
        map.put("pluginsExecuted", stats.getPluginsExecuted());
        map.put("findingsByPlugin", stats.getFindingsByPlugin());
        map.put("startedAt", stats.getStartedAt());
        map.put("elapsedMs", stats.getElapsed().toMillis());
        map.put("timedOut", stats.isTimedOut());
        stats.getErrorMessage().ifPresent(error -> map.put("error", error));
        return map;
    }

    private Map<String, Object> findingToMap(Finding finding) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", finding.getId());
        map.put("title", finding.getTitle());
        map.put("description", finding.getDescription());
        map.put("class", finding.getVulnerabilityClass().name());
        map.put("strategy", finding.getStrategy().getTag());
        map.put("risk", finding.getRisk().name());
        map.put("confidence", finding.getConfidence());
        map.put("cwe", finding.getCweId());
        map.put("method", finding.getMethod());
        map.put("endpoint", finding.getEndpoint());
        map.put("parameter", finding.getParameter());
        map.put("location", finding.getParameterLocation().name());
        map.put("payload", finding.getPayload());
        map.put("evidence", finding.getEvidence());
        finding.getExchange().ifPresent(exchange -> map.put("exchange", exchangeToMap(exchange)));
        map.put("remediation", finding.getRemediation());
        map.put("discoveredAt", finding.getDiscoveredAt());
        return map;
    }

    private Map<String, Object> exchangeToMap(ExchangeSnapshot exchange) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", exchange.method());
        map.put("url", exchange.url());
        if (exchange.requestBody() != null) {
            map.put("requestBody", exchange.requestBody());
        }
        map.put("statusCode", exchange.statusCode());
        map.put("contentLength", exchange.contentLength());
        map.put("elapsedMs", exchange.elapsedMs());
        map.put("responseExcerpt", exchange.responseExcerpt());
        return map;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
