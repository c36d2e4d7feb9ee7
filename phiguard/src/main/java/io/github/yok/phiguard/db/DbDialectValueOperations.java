package io.github.yok.phiguard.db;

import java.io.IOException;
import java.io.Reader;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Value conversion operations for each database dialect.
 *
 * <p>
 * Bind values are normalized before {@link java.sql.PreparedStatement#setObject(int, Object)} and
 * fetched values are normalized into the scalar set carried by {@link QueryResult}.
 * </p>
 */
public interface DbDialectValueOperations {

    /**
     * Converts a caller value into a JDBC-bindable object.
     *
     * @param value caller value; may be {@code null}
     * @return JDBC-bindable object
     */
    default Object toBindValue(Object value) {
        if (value instanceof Instant) {
            return Timestamp.from((Instant) value);
        }
        if (value instanceof OffsetDateTime) {
            return Timestamp.from(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof ZonedDateTime) {
            return Timestamp.from(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof Date && !(value instanceof java.sql.Date)
                && !(value instanceof Timestamp) && !(value instanceof Time)) {
            return new Timestamp(((Date) value).getTime());
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    /**
     * Converts a fetched JDBC value into a portable scalar.
     *
     * <ul>
     * <li>{@link Timestamp} → {@link java.time.LocalDateTime}</li>
     * <li>{@link java.sql.Date} → {@link java.time.LocalDate}</li>
     * <li>{@link Time} → {@link java.time.LocalTime}</li>
     * <li>{@link Clob} → {@link String}</li>
     * <li>Vendor objects outside the portable set → {@link Object#toString()}</li>
     * </ul>
     *
     * @param value raw JDBC value; may be {@code null}
     * @param sqlType JDBC SQL type
     * @param sqlTypeName dialect SQL type name
     * @param precision column precision reported by the driver
     * @return portable value
     * @throws SQLException if reading a LOB fails
     */
    default Object fromJdbcValue(Object value, int sqlType, String sqlTypeName, int precision)
            throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }
        if (value instanceof Clob) {
            return readClob((Clob) value);
        }
        if (isPortable(value)) {
            return value;
        }
        return value.toString();
    }

    /**
     * Returns whether the value already belongs to the portable scalar set.
     *
     * @param value non-null value
     * @return {@code true} when no conversion is needed
     */
    private static boolean isPortable(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof java.time.temporal.Temporal || value instanceof byte[];
    }

    /**
     * Reads a CLOB fully into a string.
     *
     * @param clob CLOB value
     * @return text content
     * @throws SQLException if reading fails
     */
    private static String readClob(Clob clob) throws SQLException {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[4096];
        try (Reader reader = clob.getCharacterStream()) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
        return sb.toString();
    }
}
