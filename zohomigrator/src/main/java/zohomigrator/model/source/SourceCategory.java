package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * FreshBooks expense category ({@code expenses/categories}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceCategory(
        @JsonProperty("id") int id,
        @JsonProperty("categoryid") Integer categoryId,
        @JsonProperty("category") String category,
        @JsonProperty("parentid") Integer parentId,
        @JsonProperty("is_cogs") Boolean cogs,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    public String name() {
        return category != null && !category.isBlank() ? category.trim() : "Unknown Category";
    }

    /** Categories with the same name under the same parent are the same account. */
    public String deduplicationKey() {
        return name().toLowerCase(Locale.ROOT) + "|" + (parentId != null ? parentId : "");
    }

    public boolean isCogs() {
        return Boolean.TRUE.equals(cogs);
    }

    @Override
    public String label() {
        return name();
    }
}
