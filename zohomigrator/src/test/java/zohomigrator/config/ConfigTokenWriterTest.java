package zohomigrator.config;

import zohomigrator.auth.Backend;
import zohomigrator.auth.TokenPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfigTokenWriter")
class ConfigTokenWriterTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("YAML files")
    class Yaml {

        @Test
        @DisplayName("should replace nested tokens and keep other keys")
        void shouldReplaceNestedTokens() throws IOException {
            Path f = tempDir.resolve("config.yml");
            Files.writeString(f, """
                    migration:
                      source:
                        client-id: fb-id
                        client-secret: fb-secret
                        access-token: old-access
                        refresh-token: old-refresh
                        account-id: abc123
                      destination:
                        client-id: zb-id
                        client-secret: zb-secret
                        refresh-token: zb-refresh
                        organization-id: "60001"
                    """);

            new ConfigTokenWriter(f).tokensRefreshed(Backend.SOURCE, new TokenPair("new-access", "new-refresh"));

            MigrationConfig reloaded = MigrationConfigLoader.loadFromFile(f);
            assertThat(reloaded.sourceCredentials().accessToken()).isEqualTo("new-access");
            assertThat(reloaded.sourceCredentials().refreshToken()).isEqualTo("new-refresh");
            assertThat(reloaded.sourceAccountId()).isEqualTo("abc123");
            assertThat(reloaded.destinationCredentials().refreshToken()).isEqualTo("zb-refresh");
        }

        @Test
        @DisplayName("should create missing sections")
        void shouldCreateMissingSections() throws IOException {
            Path f = tempDir.resolve("config.yaml");
            Files.writeString(f, "other: 1\n");

            new ConfigTokenWriter(f).tokensRefreshed(Backend.DESTINATION, new TokenPair("a", "r"));

            assertThat(Files.readString(f))
                    .contains("destination:")
                    .contains("access-token: a")
                    .contains("other: 1");
        }
    }

    @Nested
    @DisplayName("properties files")
    class Properties {

        @Test
        @DisplayName("should store tokens under dotted keys")
        void shouldStoreDottedKeys() throws IOException {
            Path f = tempDir.resolve("config.properties");
            Files.writeString(f, "migration.destination.access-token=old\nmigration.rate.max-requests=50\n");

            new ConfigTokenWriter(f).tokensRefreshed(Backend.DESTINATION, new TokenPair("new", "refresh"));

            java.util.Properties props = new java.util.Properties();
            try (var in = Files.newInputStream(f)) {
                props.load(in);
            }
            assertThat(props.getProperty("migration.destination.access-token")).isEqualTo("new");
            assertThat(props.getProperty("migration.destination.refresh-token")).isEqualTo("refresh");
            assertThat(props.getProperty("migration.rate.max-requests")).isEqualTo("50");
        }
    }

    @Nested
    @DisplayName("put")
    class Put {

        @Test
        @DisplayName("should prefer an existing literal dotted key")
        void shouldPreferLiteralKey() {
            Map<String, Object> root = new LinkedHashMap<>();
            root.put("migration.source.access-token", "old");

            ConfigTokenWriter.put(root, "migration.source.access-token", "new");

            assertThat(root).containsEntry("migration.source.access-token", "new").hasSize(1);
        }

        @Test
        @DisplayName("should descend into partially dotted keys")
        void shouldDescendIntoPartiallyDottedKeys() {
            Map<String, Object> source = new LinkedHashMap<>();
            Map<String, Object> root = new LinkedHashMap<>();
            root.put("migration", new LinkedHashMap<>(Map.of("source", source)));

            ConfigTokenWriter.put(root, "migration.source.refresh-token", "r");

            assertThat(source).containsEntry("refresh-token", "r");
        }
    }

    @Test
    @DisplayName("should leave neither a temporary file nor a changed target when writing fails")
    void shouldCleanUpAfterFailedWrite() throws IOException {
        Path f = tempDir.resolve("config.properties");
        Files.writeString(f, "migration.source.access-token=old\n");
        ConfigTokenWriter writer = new ConfigTokenWriter(f);

        assertThatThrownBy(() -> writer.writeAtomically(tmp -> {
            Files.writeString(tmp, "partial");
            throw new IOException("disk full");
        })).isInstanceOf(IOException.class).hasMessage("disk full");

        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(f);
        }
        assertThat(Files.readString(f)).isEqualTo("migration.source.access-token=old\n");
    }
}
