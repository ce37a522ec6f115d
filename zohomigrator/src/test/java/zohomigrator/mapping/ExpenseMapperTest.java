package zohomigrator.mapping;

import zohomigrator.config.BusinessTagSettings;
import zohomigrator.mapping.BusinessLineClassifier.BusinessLine;
import zohomigrator.mapping.ExpenseMapper.MappedExpense;
import zohomigrator.model.destination.ExpenseRequest;
import zohomigrator.model.destination.Tag;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.IdMappingRegistry;
import zohomigrator.support.Json;
import zohomigrator.support.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExpenseMapper")
class ExpenseMapperTest {

    private IdMappingRegistry registry;
    private ExpenseMapper mapper;

    @BeforeEach
    void setUp() {
        registry = new IdMappingRegistry();
        registry.register(EntityType.ACCOUNT, 31, "acc-travel");
        registry.nameAccount("acc-travel", "Travel");
        registry.register(EntityType.CUSTOMER, 5, "cust-5");
        registry.dedup(EntityType.TAX).add("HST", "tax-hst");
        mapper = new ExpenseMapper(registry, Map.of("business checking", "bank-1"), null, TestContexts.CLOCK);
    }

    private static SourceExpense expense(String json) {
        return Json.read(json, SourceExpense.class);
    }

    @Nested
    @DisplayName("accounts")
    class Accounts {

        @Test
        @DisplayName("should use the migrated account of the category")
        void shouldUseCategoryAccount() {
            MappedExpense mapped = mapper.map(expense("""
                    {"id":1,"categoryid":31,"amount":{"amount":"42.10"},"date":"2024-03-04",
                     "account_name":"Business Checking","taxName1":"hst","clientid":5,"transactionid":"tx-9",
                     "notes":"Train to Ottawa","billable":true}"""), "vend-1").orElseThrow();

            ExpenseRequest r = mapped.request();
            assertThat(r.accountId()).isEqualTo("acc-travel");
            assertThat(r.paidThroughAccountId()).isEqualTo("bank-1");
            assertThat(r.vendorId()).isEqualTo("vend-1");
            assertThat(r.taxId()).isEqualTo("tax-hst");
            assertThat(r.customerId()).isEqualTo("cust-5");
            assertThat(r.referenceNumber()).isEqualTo("tx-9");
            assertThat(r.billable()).isTrue();
            assertThat(mapped.categoryName()).isEqualTo("Travel");
            assertThat(mapped.unmappedPaidThrough()).isNull();
            assertThat(mapped.fingerprint()).isEqualTo("2024-03-04|42.1|tx-9|Train to Ottawa");
        }

        @Test
        @DisplayName("should fall back to the default expense account")
        void shouldFallBackToDefault() {
            registry.offerDefaultExpenseAccount("acc-general");

            MappedExpense mapped = mapper.map(expense("""
                    {"id":2,"categoryid":99,"amount":{"amount":"5"},"date":"2024-03-04"}"""), null).orElseThrow();

            assertThat(mapped.request().accountId()).isEqualTo("acc-general");
            assertThat(mapped.categoryName()).isEqualTo("Uncategorized");
        }

        @Test
        @DisplayName("should produce nothing without any account")
        void shouldSkipWithoutAccount() {
            assertThat(mapper.map(expense("{\"id\":3,\"categoryid\":99,\"amount\":{\"amount\":\"5\"}}"), null))
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("fields")
    class Fields {

        @Test
        @DisplayName("should report an unmapped paid-through account")
        void shouldReportUnmappedPaidThrough() {
            MappedExpense mapped = mapper.map(expense("""
                    {"id":4,"categoryid":31,"amount":{"amount":"5"},"account_name":"Amex"}"""), null).orElseThrow();

            assertThat(mapped.request().paidThroughAccountId()).isNull();
            assertThat(mapped.unmappedPaidThrough()).isEqualTo("Amex");
        }

        @Test
        @DisplayName("should date undated expenses today")
        void shouldDateUndatedExpenses() {
            MappedExpense mapped = mapper.map(expense("""
                    {"id":5,"categoryid":31,"amount":{"amount":"5"}}"""), null).orElseThrow();

            assertThat(mapped.request().date()).isEqualTo(LocalDate.now(TestContexts.CLOCK).toString());
        }

        @Test
        @DisplayName("should skip an unparsable amount")
        void shouldSkipBadAmount() {
            assertThat(mapper.map(expense("{\"id\":6,\"categoryid\":31,\"amount\":{\"amount\":\"n/a\"}}"), null))
                    .isEmpty();
        }
    }

    @Test
    @DisplayName("should tag the business line when configured")
    void shouldTagBusinessLine() {
        BusinessLineClassifier classifier = new BusinessLineClassifier(new BusinessTagSettings(
                "Consulting", "Training", LocalDate.of(2024, 1, 1), List.of("course"),
                "tag-1", "opt-1", "opt-2"));
        ExpenseMapper tagging = new ExpenseMapper(registry, Map.of(), classifier, TestContexts.CLOCK);

        MappedExpense mapped = tagging.map(expense("""
                {"id":7,"categoryid":31,"amount":{"amount":"80"},"date":"2024-04-01","notes":"Course platform"}"""),
                null).orElseThrow();

        assertThat(mapped.businessLine()).isEqualTo(BusinessLine.SECONDARY);
        assertThat(mapped.request().tags()).containsExactly(new Tag("tag-1", "opt-2"));
    }
}
