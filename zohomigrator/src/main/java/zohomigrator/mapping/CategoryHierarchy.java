package zohomigrator.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configured two-level chart of expense accounts and the translation of
 * FreshBooks category names onto it.
 *
 * <p>Parents keep their declaration order. Source names without an explicit
 * translation keep their own name; names that are not part of the hierarchy
 * resolve to the {@linkplain #defaultCategory() default category}.
 */
public final class CategoryHierarchy {

    public static final String FALLBACK_CATEGORY = "Other Expenses";

    private final Map<String, List<String>> parents;
    private final Map<String, String> nameMapping;

    public CategoryHierarchy(Map<String, List<String>> hierarchy, Map<String, String> nameMapping) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        hierarchy.forEach((parent, children) -> copy.put(parent, List.copyOf(children)));
        this.parents = Collections.unmodifiableMap(copy);
        Map<String, String> mapping = new LinkedHashMap<>();
        nameMapping.forEach((from, to) -> mapping.put(from.trim().toLowerCase(Locale.ROOT), to));
        this.nameMapping = Collections.unmodifiableMap(mapping);
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }

    public List<String> parents() {
        return List.copyOf(parents.keySet());
    }

    public List<String> children(String parent) {
        return parents.getOrDefault(parent, List.of());
    }

    /** Parents followed by their children, in declaration order. */
    public List<String> allNames() {
        List<String> all = new ArrayList<>();
        parents.forEach((parent, children) -> {
            all.add(parent);
            all.addAll(children);
        });
        return all;
    }

    /** Returns the parent of a child account; empty for parents and unknown names. */
    public Optional<String> parentOf(String name) {
        for (Map.Entry<String, List<String>> e : parents.entrySet()) {
            for (String child : e.getValue()) {
                if (child.equalsIgnoreCase(name)) return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return allNames().stream().anyMatch(n -> n.equalsIgnoreCase(name));
    }

    /**
     * Account for unmapped categories: the first name containing "other",
     * else the first parent, else {@value #FALLBACK_CATEGORY}.
     */
    public String defaultCategory() {
        for (String name : allNames()) {
            if (name.toLowerCase(Locale.ROOT).contains("other")) return name;
        }
        return parents.isEmpty() ? FALLBACK_CATEGORY : parents.keySet().iterator().next();
    }

    /** Translated destination name for a FreshBooks category name. */
    public String translate(String sourceName) {
        if (sourceName == null) return defaultCategory();
        String mapped = nameMapping.get(sourceName.trim().toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : sourceName.trim();
    }

    /**
     * Destination account for a FreshBooks category: its translation when the
     * hierarchy contains it, else the default category.
     */
    public String resolve(String sourceName) {
        String translated = translate(sourceName);
        return contains(translated) ? translated : defaultCategory();
    }
}
