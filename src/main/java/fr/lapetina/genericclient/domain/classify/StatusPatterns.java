package fr.lapetina.genericclient.domain.classify;

import fr.lapetina.genericclient.domain.exception.ConfigurationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalization and matching of retry status patterns.
 *
 * A pattern is an exact code ({@code "503"}), a two-digit family
 * ({@code "50x"}) or a one-digit family ({@code "5xx"}).
 */
public final class StatusPatterns {

    private static final Pattern VALID = Pattern.compile("^[1-5](\\d{2}|\\dx|xx)$");

    private StatusPatterns() {
        // Utility class
    }

    /**
     * Converts raw patterns (strings or numbers) to their canonical string form.
     *
     * @throws ConfigurationException if a pattern is not recognized
     */
    public static Set<String> normalize(Collection<?> patterns) {
        Set<String> normalized = new LinkedHashSet<>();
        if (patterns == null) {
            return normalized;
        }
        for (Object pattern : patterns) {
            if (pattern == null) {
                throw new ConfigurationException("Retry status pattern must not be null");
            }
            String value = String.valueOf(pattern).trim().toLowerCase(Locale.ROOT);
            if (!VALID.matcher(value).matches()) {
                throw new ConfigurationException("Unrecognized retry status pattern: '" + pattern
                        + "' (expected e.g. 503, 50x or 5xx)");
            }
            normalized.add(value);
        }
        return normalized;
    }

    /**
     * Returns true if the status, its {@code NNx} family or its {@code Nxx} family is listed.
     */
    public static boolean matches(Set<String> patterns, int status) {
        String code = Integer.toString(status);
        if (patterns.contains(code)) {
            return true;
        }
        if (code.length() != 3) {
            return false;
        }
        return patterns.contains(code.substring(0, 2) + "x")
                || patterns.contains(code.substring(0, 1) + "xx");
    }
}
