package com.platform.scaffold.persistence;

import com.platform.scaffold.error.ConfigurationException;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A DATABASE_URL resolved into JDBC connection settings.
 * 
 * Accepts JDBC URLs unchanged and converts the URL form used by most hosting platforms,
 * e.g. {@code postgresql://user:secret@db:5432/app}, {@code mysql+pymysql://root@localhost/app} or
 * {@code sqlite:///./app.db}.
 * Credentials embedded in the URL are split out so they never end up in the JDBC URL.
 *
 * @param jdbcUrl  URL handed to the driver
 * @param username user, or null when not part of the URL
 * @param password password, or null when not part of the URL
 * @param system   database system name, as reported in the db.system span attribute
 */
public record DatabaseUrl(String jdbcUrl, String username, String password, String system) {
    
    private static final String JDBC_PREFIX = "jdbc:";
    private static final String SQLITE = "sqlite";
    private static final String SQLITE_MEMORY = ":memory:";
    
    public static DatabaseUrl parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw ConfigurationException.databaseNotConfigured();
        }
        String value = raw.trim();
        
        if (value.startsWith(JDBC_PREFIX)) {
            String rest = value.substring(JDBC_PREFIX.length());
            int colon = rest.indexOf(':');
            String subprotocol = colon > 0 ? rest.substring(0, colon) : rest;
            String system = systemFor(subprotocol);
            return new DatabaseUrl(value, null, null, system != null ? system : subprotocol.toLowerCase(Locale.ROOT));
        }
        
        if (value.startsWith("h2:")) {
            return new DatabaseUrl(JDBC_PREFIX + value, null, null, "h2");
        }
        
        int separator = value.indexOf("://");
        if (separator <= 0) {
            throw new ConfigurationException("DATABASE_URL is not a recognised connection URL");
        }
        
        String scheme = value.substring(0, separator);
        String system = systemFor(scheme);
        if (system == null) {
            throw new ConfigurationException("Unsupported DATABASE_URL scheme: " + scheme);
        }
        
        String rest = value.substring(separator + 3);
        if (SQLITE.equals(system)) {
            return sqlite(rest);
        }
        
        String username = null;
        String password = null;
        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            String userInfo = rest.substring(0, at);
            rest = rest.substring(at + 1);
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                username = decode(userInfo.substring(0, colon));
                password = decode(userInfo.substring(colon + 1));
            } else {
                username = decode(userInfo);
            }
        }
        if (rest.isEmpty() || rest.startsWith("/")) {
            throw new ConfigurationException("DATABASE_URL has no host");
        }
        
        return new DatabaseUrl(JDBC_PREFIX + system + "://" + rest, username, password, system);
    }
    
    /**
     * Maps a URL scheme, with or without a {@code +driver} suffix, to the JDBC subprotocol.
     */
    private static String systemFor(String scheme) {
        int plus = scheme.indexOf('+');
        String base = (plus >= 0 ? scheme.substring(0, plus) : scheme).toLowerCase(Locale.ROOT);
        return switch (base) {
            case "postgres", "postgresql" -> "postgresql";
            case "mysql", "mariadb" -> "mysql";
            case "h2" -> "h2";
            case SQLITE -> SQLITE;
            default -> null;
        };
    }
    
    /**
     * {@code sqlite:///relative.db}, {@code sqlite:////absolute.db} and {@code sqlite:///:memory:};
     * an empty path is an in-memory database.
     */
    private static DatabaseUrl sqlite(String rest) {
        if (!rest.isEmpty() && !rest.startsWith("/")) {
            throw new ConfigurationException("sqlite DATABASE_URL must not name a host");
        }
        String path = rest.isEmpty() ? rest : rest.substring(1);
        if (path.isEmpty()) {
            path = SQLITE_MEMORY;
        }
        return new DatabaseUrl(JDBC_PREFIX + SQLITE + ":" + path, null, null, SQLITE);
    }
    
    public boolean isSqlite() {
        return SQLITE.equals(system);
    }
    
    /**
     * Percent-decoding only; a literal {@code +} stays a plus sign.
     */
    private static String decode(String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("DATABASE_URL credentials are not valid percent-encoding", e);
        }
    }
    
    @Override
    public String toString() {
        return "DatabaseUrl[jdbcUrl=" + jdbcUrl + ", username=" + username + ", system=" + system + "]";
    }
}
