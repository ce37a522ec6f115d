package zohomigrator.config;

import java.time.LocalDate;
import java.util.List;

/**
 * Settings for tagging expenses with the business line they belong to.
 *
 * <p>Expenses dated on or after {@code secondaryStartDate} whose description
 * contains one of {@code secondaryKeywords} belong to the secondary line;
 * everything else belongs to the primary line. The Zoho reporting tag is
 * only attached when all three tag ids are present.
 *
 * @param primaryTag display name of the primary business line
 * @param secondaryTag display name of the secondary business line
 * @param secondaryStartDate first day the secondary line existed, may be null
 * @param secondaryKeywords description keywords that mark a secondary expense
 * @param tagId Zoho reporting tag id, may be null
 * @param primaryOptionId tag option id for the primary line, may be null
 * @param secondaryOptionId tag option id for the secondary line, may be null
 */
public record BusinessTagSettings(
        String primaryTag,
        String secondaryTag,
        LocalDate secondaryStartDate,
        List<String> secondaryKeywords,
        String tagId,
        String primaryOptionId,
        String secondaryOptionId
) {
    public BusinessTagSettings {
        secondaryKeywords = List.copyOf(secondaryKeywords != null ? secondaryKeywords : List.of());
    }

    /** Returns true if expenses can carry the Zoho reporting tag. */
    public boolean hasTagIds() {
        return tagId != null && primaryOptionId != null && secondaryOptionId != null;
    }
}
