package zohomigrator.mapping;

import zohomigrator.model.destination.AccountRequest;
import zohomigrator.model.destination.ItemRequest;
import zohomigrator.model.source.SourceCategory;
import zohomigrator.model.source.SourceItem;
import zohomigrator.model.source.SourceTax;
import zohomigrator.support.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Catalog mappers")
class CatalogMappersTest {

    @Nested
    @DisplayName("TaxMapper")
    class Taxes {

        @Test
        @DisplayName("should map name and percentage")
        void shouldMapTax() {
            SourceTax tax = Json.read("{\"id\":1,\"name\":\"GST\",\"amount\":\"5.000\"}", SourceTax.class);

            assertThat(TaxMapper.map(tax)).hasValueSatisfying(r -> {
                assertThat(r.taxName()).isEqualTo("GST");
                assertThat(r.taxPercentage()).isEqualByComparingTo("5");
                assertThat(r.taxType()).isEqualTo("tax");
            });
        }

        @Test
        @DisplayName("should default the percentage and skip unnamed taxes")
        void shouldHandleMissingFields() {
            SourceTax noAmount = Json.read("{\"id\":2,\"name\":\"Zero\"}", SourceTax.class);
            SourceTax noName = Json.read("{\"id\":3,\"amount\":\"7\"}", SourceTax.class);

            assertThat(TaxMapper.map(noAmount)).hasValueSatisfying(r ->
                    assertThat(r.taxPercentage()).isEqualByComparingTo(BigDecimal.ZERO));
            assertThat(TaxMapper.map(noName)).isEmpty();
        }
    }

    @Nested
    @DisplayName("ItemMapper")
    class Items {

        @Test
        @DisplayName("should map items as goods with their unit cost")
        void shouldMapItem() {
            SourceItem item = Json.read("""
                    {"id":5,"name":"Widget","sku":"W-1","unit_cost":{"amount":"12.50","code":"USD"}}""",
                    SourceItem.class);

            ItemRequest request = ItemMapper.map(item);

            assertThat(request.name()).isEqualTo("Widget");
            assertThat(request.rate()).isEqualByComparingTo("12.5");
            assertThat(request.sku()).isEqualTo("W-1");
            assertThat(request.productType()).isEqualTo("goods");
        }

        @Test
        @DisplayName("should name unnamed items after their id")
        void shouldNameUnnamedItem() {
            SourceItem item = Json.read("{\"id\":6}", SourceItem.class);

            assertThat(ItemMapper.map(item).name()).isEqualTo("Item 6");
            assertThat(ItemMapper.map(item).rate()).isNull();
        }
    }

    @Nested
    @DisplayName("AccountMapper")
    class Accounts {

        @Test
        @DisplayName("should map COGS categories to cost of goods sold")
        void shouldMapCogs() {
            SourceCategory cogs = Json.read("{\"id\":1,\"category\":\"Materials\",\"is_cogs\":true}",
                    SourceCategory.class);
            SourceCategory plain = Json.read("{\"id\":2,\"category\":\"Travel\"}", SourceCategory.class);

            assertThat(AccountMapper.map(cogs).accountType()).isEqualTo(AccountRequest.TYPE_COST_OF_GOODS_SOLD);
            assertThat(AccountMapper.map(plain).accountType()).isEqualTo(AccountRequest.TYPE_EXPENSE);
            assertThat(AccountMapper.map(plain).description()).isEqualTo(AccountMapper.DESCRIPTION);
        }

        @Test
        @DisplayName("should type hierarchy accounts by name and keep the parent")
        void shouldMapHierarchical() {
            AccountRequest cogs = AccountMapper.hierarchical("Cost of Goods Sold", null);
            AccountRequest child = AccountMapper.hierarchical("Software", "parent-1");

            assertThat(cogs.accountType()).isEqualTo(AccountRequest.TYPE_COST_OF_GOODS_SOLD);
            assertThat(child.accountType()).isEqualTo(AccountRequest.TYPE_EXPENSE);
            assertThat(child.parentAccountId()).isEqualTo("parent-1");
        }
    }
}
