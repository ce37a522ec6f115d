package zohomigrator.registry;

import zohomigrator.exceptions.MappingConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdMappingRegistry")
class IdMappingRegistryTest {

    private final IdMappingRegistry registry = new IdMappingRegistry();

    @Nested
    @DisplayName("register and lookup")
    class RegisterAndLookup {

        @Test
        @DisplayName("should return the registered destination id")
        void shouldReturnRegisteredId() {
            registry.register(EntityType.CUSTOMER, 5, "zb-5");

            assertThat(registry.lookup(EntityType.CUSTOMER, 5)).contains("zb-5");
            assertThat(registry.isMapped(EntityType.CUSTOMER, 5)).isTrue();
            assertThat(registry.size(EntityType.CUSTOMER)).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep types apart")
        void shouldKeepTypesApart() {
            registry.register(EntityType.CUSTOMER, 5, "zb-5");

            assertThat(registry.lookup(EntityType.VENDOR, 5)).isEmpty();
            assertThat(registry.size(EntityType.VENDOR)).isZero();
        }

        @Test
        @DisplayName("should return empty for a null source id")
        void shouldHandleNullSourceId() {
            assertThat(registry.lookup(EntityType.INVOICE, null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("write-once")
    class WriteOnce {

        @Test
        @DisplayName("should accept the same pair twice")
        void shouldAcceptSamePairTwice() {
            registry.register(EntityType.ITEM, 1, "a");
            registry.register(EntityType.ITEM, 1, "a");

            assertThat(registry.size(EntityType.ITEM)).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject a different destination id")
        void shouldRejectConflict() {
            registry.register(EntityType.ITEM, 1, "a");

            assertThatThrownBy(() -> registry.register(EntityType.ITEM, 1, "b"))
                    .isInstanceOf(MappingConflictException.class)
                    .hasMessageContaining("already a");
            assertThat(registry.lookup(EntityType.ITEM, 1)).contains("a");
        }
    }

    @Nested
    @DisplayName("accounts")
    class Accounts {

        @Test
        @DisplayName("should keep the first default expense account")
        void shouldKeepFirstDefault() {
            registry.offerDefaultExpenseAccount("first");
            registry.offerDefaultExpenseAccount("second");

            assertThat(registry.defaultExpenseAccount()).contains("first");
        }

        @Test
        @DisplayName("should remember account names")
        void shouldRememberNames() {
            registry.nameAccount("7", "Travel");

            assertThat(registry.accountName("7")).contains("Travel");
            assertThat(registry.accountName("8")).isEmpty();
        }
    }

    @Test
    @DisplayName("should hand out one dedup index per type")
    void shouldShareDedupIndex() {
        registry.dedup(EntityType.TAX).add("GST", "t1");

        assertThat(registry.dedup(EntityType.TAX).find("gst")).contains("t1");
        assertThat(registry.dedup(EntityType.ITEM).size()).isZero();
    }
}
