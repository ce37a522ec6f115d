package zohomigrator.config;

import zohomigrator.auth.Backend;
import zohomigrator.auth.TokenPair;
import zohomigrator.auth.TokenRefreshListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Writes refreshed tokens back into the configuration file they came from,
 * so the next run starts with a valid pair.
 *
 * <p>YAML files are re-dumped in block style; nested and dotted key spellings
 * are both honoured. Properties files are re-stored. Writes go through a
 * temporary file and an atomic move.
 */
public final class ConfigTokenWriter implements TokenRefreshListener {

    private static final Logger log = LoggerFactory.getLogger(ConfigTokenWriter.class);

    private final Path file;

    public ConfigTokenWriter(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void tokensRefreshed(Backend backend, TokenPair tokens) {
        String prefix = "migration." + backend.configKey() + ".";
        try {
            if (MigrationConfigLoader.isYaml(file.getFileName().toString())) {
                writeYaml(prefix, tokens);
            } else {
                writeProperties(prefix, tokens);
            }
            log.info("Saved refreshed {} tokens to {}", backend.displayName(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save tokens to " + file, e);
        }
    }

    private void writeProperties(String prefix, TokenPair tokens) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        props.setProperty(prefix + "access-token", tokens.accessToken());
        props.setProperty(prefix + "refresh-token", tokens.refreshToken());

        writeAtomically(tmp -> {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, null);
            }
        });
    }

    private void writeYaml(String prefix, TokenPair tokens) throws IOException {
        Map<String, Object> root;
        try (InputStream in = Files.newInputStream(file)) {
            root = new Yaml().load(in);
        }
        if (root == null) {
            root = new LinkedHashMap<>();
        }
        put(root, prefix + "access-token", tokens.accessToken());
        put(root, prefix + "refresh-token", tokens.refreshToken());

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);

        Map<String, Object> updated = root;
        writeAtomically(tmp -> {
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                new Yaml(options).dump(updated, out);
            }
        });
    }

    @FunctionalInterface
    interface Content {
        void writeTo(Path tmp) throws IOException;
    }

    /**
     * Writes into a temporary file next to the target, then moves it over
     * the target. The temporary file is removed if anything fails.
     */
    void writeAtomically(Content content) throws IOException {
        Path tmp = Files.createTempFile(file.toAbsolutePath().getParent(), ".tokens", ".tmp");
        boolean moved = false;
        try {
            content.writeTo(tmp);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(tmp);
            }
        }
    }

    /**
     * Sets a dotted key, preferring an existing literal key at any nesting
     * level and otherwise creating nested maps.
     */
    @SuppressWarnings("unchecked")
    static void put(Map<String, Object> root, String dottedKey, String value) {
        Map<String, Object> current = root;
        String remaining = dottedKey;
        while (true) {
            if (current.containsKey(remaining)) {
                current.put(remaining, value);
                return;
            }
            int dot = remaining.indexOf('.');
            if (dot < 0) {
                current.put(remaining, value);
                return;
            }
            String head = remaining.substring(0, dot);
            Object child = current.get(head);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                current.put(head, child);
            }
            current = (Map<String, Object>) child;
            remaining = remaining.substring(dot + 1);
        }
    }
}
