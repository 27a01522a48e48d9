package webscan.detection;

import webscan.payload.DatabaseDialect;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Библиотека сообщений об ошибках СУБД, сгруппированных по диалекту.
 * Диалект совпавшего шаблона используется для идентификации базы данных.
 */
public final class SqlErrorPatterns {
    static final int EXCERPT_RADIUS = 50;

    private static final Map<DatabaseDialect, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(DatabaseDialect.MYSQL, compile(
            "You have an error in your SQL syntax",
            "SQL syntax.*MySQL",
            "Warning.*mysql_.*",
            "Warning.*mysqli_.*",
            "valid MySQL result",
            "MySqlClient\\.",
            "check the manual that corresponds to your (MySQL|MariaDB) server version",
            "com\\.mysql\\.jdbc",
            "Unknown column '[^']+' in '[^']+'",
            "XPATH syntax error"
        ));
        PATTERNS.put(DatabaseDialect.POSTGRESQL, compile(
            "PostgreSQL.*ERROR",
            "Warning.*\\Wpg_.*",
            "valid PostgreSQL result",
            "Npgsql\\.",
            "PG::SyntaxError",
            "org\\.postgresql\\.util\\.PSQLException",
            "ERROR:\\s+syntax error at or near",
            "unterminated quoted string at or near"
        ));
        PATTERNS.put(DatabaseDialect.MSSQL, compile(
            "Driver.*SQL[\\-_ ]*Server",
            "OLE DB.*SQL Server",
            "\\bSQL Server.*Driver",
            "Warning.*mssql_.*",
            "\\bSQL Server.*[0-9a-fA-F]{8}",
            "System\\.Data\\.SqlClient\\.SqlException",
            "Unclosed quotation mark after the character string",
            "Microsoft SQL Native Client error"
        ));
        PATTERNS.put(DatabaseDialect.ORACLE, compile(
            "\\bORA-[0-9]{5}",
            "Oracle error",
            "Oracle.*Driver",
            "Warning.*\\Woci_.*",
            "Warning.*\\Wora_.*",
            "quoted string not properly terminated"
        ));
        PATTERNS.put(DatabaseDialect.SQLITE, compile(
            "SQLite/JDBCDriver",
            "SQLite\\.Exception",
            "SQLite.*Exception",
            "System\\.Data\\.SQLite\\.SQLiteException",
            "Warning.*sqlite_.*",
            "SQLITE_ERROR",
            "sqlite3\\.OperationalError",
            "unrecognized token:"
        ));
        PATTERNS.put(DatabaseDialect.GENERIC, compile(
            "JDBC.*SQLException",
            "SQLException",
            "Syntax error.*in query expression",
            "unclosed quotation mark",
            "SQL command not properly ended",
            "ODBC.*Driver",
            "syntax error.*near"
        ));
    }

    private SqlErrorPatterns() {
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }

    /**
     * Finds the first database error message in the text. Specific dialects are tried
     * before the generic patterns.
     */
    public static Optional<ErrorMatch> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<DatabaseDialect, List<Pattern>> entry : PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    return Optional.of(new ErrorMatch(
                        entry.getKey(),
                        pattern.pattern(),
                        matcher.group(),
                        excerpt(text, matcher.start(), matcher.end())));
                }
            }
        }
        return Optional.empty();
    }

    static String excerpt(String text, int start, int end) {
        int from = Math.max(0, start - EXCERPT_RADIUS);
        int to = Math.min(text.length(), end + EXCERPT_RADIUS);
        return text.substring(from, to).trim();
    }

    public static List<Pattern> patternsFor(DatabaseDialect dialect) {
        return PATTERNS.getOrDefault(dialect, List.of());
    }
}
