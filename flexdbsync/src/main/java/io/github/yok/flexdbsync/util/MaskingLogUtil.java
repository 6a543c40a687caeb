package io.github.yok.flexdbsync.util;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking credentials before connection settings reach the log.
 *
 * <p>
 * Masks embedded credentials in authority-style JDBC URLs ({@code user:secret@host}) and
 * {@code password=} parameters in query strings or SQL Server style property lists.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    // user:secret@ in authority-style JDBC URLs
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#@]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);

    // password=... up to the next ; or &
    private static final Pattern PASSWORD_PARAM_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

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
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_PARAM_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats a connection entry for logging. The password is never included.
     *
     * @param entry connection entry
     * @return formatted log string
     */
    public static String describe(ConnectionConfig.Entry entry) {
        if (entry == null) {
            return "<null>";
        }
        return "id=" + entry.getId() + ", url=" + maskJdbcUrl(entry.getUrl()) + ", user="
                + entry.getUser();
    }
}
