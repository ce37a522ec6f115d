package zohomigrator.mapping;

import zohomigrator.config.BusinessTagSettings;
import zohomigrator.model.destination.Tag;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns expenses to the primary or the secondary business line.
 *
 * <p>Expenses dated before the secondary start date, or without a parsable
 * date, are primary. From the start date on, an expense is secondary when
 * its description contains one of the configured keywords.
 */
public final class BusinessLineClassifier {

    public enum BusinessLine { PRIMARY, SECONDARY }

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BusinessTagSettings settings;

    public BusinessLineClassifier(BusinessTagSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public BusinessLine classify(String date, String description) {
        LocalDate cutoff = settings.secondaryStartDate();
        Optional<LocalDate> expenseDate = parseDate(date);
        if (cutoff == null || expenseDate.isEmpty() || expenseDate.get().isBefore(cutoff)) {
            return BusinessLine.PRIMARY;
        }
        if (description != null) {
            String desc = description.toLowerCase(Locale.ROOT);
            for (String keyword : settings.secondaryKeywords()) {
                if (!keyword.isBlank() && desc.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return BusinessLine.SECONDARY;
                }
            }
        }
        return BusinessLine.PRIMARY;
    }

    /** Display name configured for a business line. */
    public String tagName(BusinessLine line) {
        return line == BusinessLine.SECONDARY ? settings.secondaryTag() : settings.primaryTag();
    }

    /**
     * Returns the Zoho reporting tag for a business line, or an empty list
     * when the tag ids are not configured.
     */
    public List<Tag> tags(BusinessLine line) {
        if (!settings.hasTagIds()) return List.of();
        String option = line == BusinessLine.SECONDARY ? settings.secondaryOptionId() : settings.primaryOptionId();
        return List.of(new Tag(settings.tagId(), option));
    }

    static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        try {
            return Optional.of(LocalDate.parse(v));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(v, DATE_TIME).toLocalDate());
            } catch (DateTimeParseException e2) {
                return Optional.empty();
            }
        }
    }
}
