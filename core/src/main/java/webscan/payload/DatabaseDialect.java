package webscan.payload;

/**
 * Database engines recognised by error fingerprints and targeted by time-delay payloads.
 */
public enum DatabaseDialect {
    MYSQL("MySQL"),
    POSTGRESQL("PostgreSQL"),
    MSSQL("Microsoft SQL Server"),
    ORACLE("Oracle"),
    SQLITE("SQLite"),
    GENERIC("Generic SQL");

    private final String displayName;

    DatabaseDialect(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
