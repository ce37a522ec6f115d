package zohomigrator.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CategoryHierarchy")
class CategoryHierarchyTest {

    private static CategoryHierarchy hierarchy() {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        tree.put("Operating Expenses", List.of("Office Supplies", "Software"));
        tree.put("Cost of Goods Sold", List.of("Materials"));
        tree.put("Miscellaneous", List.of("Other Charges", "Bank Fees"));
        return new CategoryHierarchy(tree, Map.of("Office Expenses", "Office Supplies"));
    }

    @Test
    @DisplayName("should list parents before their children in declaration order")
    void shouldListInDeclarationOrder() {
        assertThat(hierarchy().parents())
                .containsExactly("Operating Expenses", "Cost of Goods Sold", "Miscellaneous");
        assertThat(hierarchy().allNames()).startsWith("Operating Expenses", "Office Supplies", "Software");
    }

    @Test
    @DisplayName("should find the parent of a child")
    void shouldFindParent() {
        assertThat(hierarchy().parentOf("software")).contains("Operating Expenses");
        assertThat(hierarchy().parentOf("Operating Expenses")).isEmpty();
    }

    @Test
    @DisplayName("should pick the first name mentioning other as default")
    void shouldPickOtherAsDefault() {
        assertThat(hierarchy().defaultCategory()).isEqualTo("Other Charges");
    }

    @Test
    @DisplayName("should fall back to the first parent, then to a fixed name")
    void shouldFallBackForDefault() {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        tree.put("Travel", List.of("Flights"));

        assertThat(new CategoryHierarchy(tree, Map.of()).defaultCategory()).isEqualTo("Travel");
        assertThat(new CategoryHierarchy(Map.of(), Map.of()).defaultCategory())
                .isEqualTo(CategoryHierarchy.FALLBACK_CATEGORY);
    }

    @Test
    @DisplayName("should translate, keep, or default a source name")
    void shouldResolveSourceNames() {
        CategoryHierarchy h = hierarchy();

        assertThat(h.resolve("office expenses")).isEqualTo("Office Supplies");
        assertThat(h.resolve("Software")).isEqualTo("Software");
        assertThat(h.resolve("Entertainment")).isEqualTo("Other Charges");
        assertThat(h.translate("Entertainment")).isEqualTo("Entertainment");
    }
}
