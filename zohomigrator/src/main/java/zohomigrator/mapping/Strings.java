package zohomigrator.mapping;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class Strings {

    private Strings() {}

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Trimmed value, or null when blank. */
    static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    /** Joins the non-blank parts with newlines; null when all are blank. */
    static String lines(String... parts) {
        String joined = Stream.of(parts)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining("\n"));
        return joined.isEmpty() ? null : joined;
    }

    static Optional<BigDecimal> decimal(String s) {
        if (isBlank(s)) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(s.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
