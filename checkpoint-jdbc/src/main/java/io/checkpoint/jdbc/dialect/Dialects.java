package io.checkpoint.jdbc.dialect;

import io.checkpoint.jdbc.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dialects registered under {@code META-INF/services/io.checkpoint.jdbc.dialect.Dialect}.
 *
 * <p>A DataSource is matched by its JDBC URL first and by its database product
 * name second, so proxied URLs ({@code jdbc:p6spy:postgresql:...}) still resolve.
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect pinned = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

    private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

    private static final Map<String, Dialect> BY_NAME = DIALECTS.stream()
            .collect(Collectors.toUnmodifiableMap(d -> normalize(d.name()), Function.identity()));

    private Dialects() {
    }

    public static List<Dialect> all() {
        return DIALECTS;
    }

    /**
     * Looks a dialect up by name, ignoring case.
     *
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static Dialect get(String name) {
        Objects.requireNonNull(name, "name");
        Dialect dialect = BY_NAME.get(normalize(name));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
        }
        return dialect;
    }

    /**
     * Finds the dialect whose URL prefix matches, if any.
     */
    public static Optional<Dialect> find(String jdbcUrl) {
        if (jdbcUrl == null) {
            return Optional.empty();
        }
        String url = normalize(jdbcUrl);
        return DIALECTS.stream()
                .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(p -> url.startsWith(normalize(p))))
                .findFirst();
    }

    /**
     * Resolves the dialect for a JDBC URL.
     *
     * @throws IllegalArgumentException if the URL is empty or no prefix matches
     */
    public static Dialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
                "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + DIALECTS.stream()
                        .flatMap(d -> d.jdbcUrlPrefixes().stream())
                        .toList()));
    }

    /**
     * Resolves the dialect of the database behind a DataSource, borrowing one connection.
     *
     * @throws StoreException           if the connection or its metadata cannot be obtained
     * @throws IllegalArgumentException if neither URL nor product name match a dialect
     */
    public static Dialect detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        String product;
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            url = meta.getURL();
            product = meta.getDatabaseProductName();
        } catch (SQLException e) {
            throw new StoreException("Failed to read database metadata for dialect detection", e);
        }
        return find(url)
                .or(() -> byProductName(product))
                .orElseThrow(() -> new IllegalArgumentException("No dialect found for database "
                        + product + " at " + url + ". Available: " + BY_NAME.keySet()));
    }

    private static Optional<Dialect> byProductName(String product) {
        if (product == null) {
            return Optional.empty();
        }
        String normalized = normalize(product);
        return DIALECTS.stream()
                .filter(d -> normalized.contains(normalize(d.name())))
                .findFirst();
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
