package io.github.yok.phiguard.util;

import com.google.common.collect.ImmutableList;
import io.github.yok.phiguard.config.ConnectionConfig;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility for masking sensitive values before they reach a log sink.
 *
 * <p>
 * SQL text, connection descriptors and fixture rows may carry PHI or credentials. This helper
 * replaces quoted assignments of well-known sensitive columns, embedded credentials in JDBC URLs
 * and password or token query parameters, while keeping enough detail for troubleshooting.
 * </p>
 *
 * <p>
 * Every substitution produces text that the same substitution matches again with the same result,
 * so masking an already masked string returns it unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Replacement used for fully hidden values.
     */
    public static final String MASK = "***";

    /**
     * Fields masked by {@link #maskFields(Map, Collection)} when the caller passes none.
     */
    public static final List<String> DEFAULT_PII_FIELDS = ImmutableList.of(
            "social_security_number", "ssn", "phone_number", "email", "address_line1",
            "address_line2");

    /**
     * Quoted assignments of sensitive columns, applied in order.
     */
    private static final List<Pattern> SENSITIVE_ASSIGNMENTS = ImmutableList.of(
            Pattern.compile("(ssn)\\s*=\\s*'[^']+'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(social_security_number)\\s*=\\s*'[^']+'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(password)\\s*=\\s*'[^']+'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(token)\\s*=\\s*'[^']+'", Pattern.CASE_INSENSITIVE));
    /**
     * Pattern that matches embedded credentials in authority-style JDBC URLs.
     */
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:\\s]+://[^:/?#@\\s]+:)([^@/\\s]+)(@)",
                    Pattern.CASE_INSENSITIVE);
    /**
     * Pattern that matches password and token query parameters in URLs.
     */
    private static final Pattern SECRET_QUERY_PATTERN =
            Pattern.compile("(?i)([?&;](?:password|token)=)([^;&\\s]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return value;
        }
        return MASK;
    }

    /**
     * Masks sensitive fragments of free text such as SQL statements and connection strings.
     *
     * <ol>
     * <li>{@code ssn}, {@code social_security_number}, {@code password} and {@code token} quoted
     * assignments become {@code name = '***'}.</li>
     * <li>Password and token URL parameters become {@code password=***}.</li>
     * <li>Credentials embedded in a JDBC URL authority become {@code user:***@}.</li>
     * </ol>
     *
     * @param text raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskSensitive(String text) {
        if (text == null) {
            return null;
        }
        String masked = text;
        for (Pattern pattern : SENSITIVE_ASSIGNMENTS) {
            masked = pattern.matcher(masked).replaceAll("$1 = '" + MASK + "'");
        }
        return maskJdbcUrl(masked);
    }

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = SECRET_QUERY_PATTERN.matcher(url).replaceAll("$1" + MASK);
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceAll("$1" + Matcher.quoteReplacement(MASK) + "$3");
        }
        return masked;
    }

    /**
     * Formats a connection entry for logging with masked sensitive values.
     *
     * @param entry connection entry
     * @return formatted log string
     */
    public static String maskConnection(ConnectionConfig.Entry entry) {
        if (entry == null) {
            return "<null>";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("id=").append(entry.getId());
        builder.append(", kind=").append(entry.getKind());
        builder.append(", target=").append(maskJdbcUrl(entry.describeTarget()));
        builder.append(", user=").append(entry.getUser());
        builder.append(", password=").append(maskText(entry.getPassword()));
        return builder.toString();
    }

    /**
     * Hides all but the last four characters of a value.
     *
     * <p>
     * Values of four characters or fewer are hidden entirely.
     * </p>
     *
     * @param value raw value
     * @return masked value, or {@code null} when input is {@code null}
     */
    public static String maskKeepingTail(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= 4) {
            return StringUtils.repeat('*', value.length());
        }
        return StringUtils.repeat('*', value.length() - 4) + value.substring(value.length() - 4);
    }

    /**
     * Returns a copy of the row with the named PII fields masked by {@link #maskKeepingTail}.
     *
     * @param row source row; not modified
     * @param fields field names to mask; {@code null} or empty uses {@link #DEFAULT_PII_FIELDS}
     * @return masked copy preserving iteration order
     */
    public static Map<String, Object> maskFields(Map<String, ?> row, Collection<String> fields) {
        Map<String, Object> masked = new LinkedHashMap<>();
        if (row == null) {
            return masked;
        }
        masked.putAll(row);
        Collection<String> targets =
                fields == null || fields.isEmpty() ? DEFAULT_PII_FIELDS : fields;
        for (String field : targets) {
            Object value = masked.get(field);
            if (value != null) {
                masked.put(field, maskKeepingTail(String.valueOf(value)));
            }
        }
        return masked;
    }
}
