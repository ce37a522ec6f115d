package zohomigrator.cli;

import zohomigrator.registry.EntityType;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed command line.
 *
 * <pre>
 * zoho-migration [migrate] &lt;all|categories|taxes|items|customers|vendors|invoices|expenses|payments&gt;
 *                [-c|--config &lt;path&gt;] [--dry-run] [-v|--verbose] [--hierarchical-categories]
 *                [-h|--help] [--version]
 * </pre>
 *
 * @param stage the stage to run, empty for {@code all}
 * @param configPath configuration file
 * @param dryRun no writes to Zoho Books
 * @param verbose per-record logging
 * @param hierarchicalCategories use the configured account hierarchy
 * @param help print usage and exit
 * @param version print the version and exit
 */
public record CliArguments(
        Optional<EntityType> stage,
        Path configPath,
        boolean dryRun,
        boolean verbose,
        boolean hierarchicalCategories,
        boolean help,
        boolean version
) {
    public static final Path DEFAULT_CONFIG = Path.of("config.yml");

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: zoho-migration [migrate] <stage> [options]",
            "",
            "Stages: all, categories, taxes, items, customers, vendors, invoices, expenses, payments",
            "",
            "Options:",
            "  -c, --config <path>        configuration file (default: ./config.yml)",
            "      --dry-run              show what would be migrated without writing",
            "  -v, --verbose              log every record",
            "      --hierarchical-categories",
            "                             build accounts from migration.categories.hierarchy",
            "  -h, --help                 show this help",
            "      --version              show the version");

    /**
     * Thrown for a malformed command line.
     */
    public static final class UsageException extends Exception {
        public UsageException(String message) {
            super(message);
        }
    }

    public boolean runsAll() {
        return stage.isEmpty();
    }

    public static CliArguments parse(String... args) throws UsageException {
        String stageName = null;
        Path config = DEFAULT_CONFIG;
        boolean dryRun = false;
        boolean verbose = false;
        boolean hierarchical = false;
        boolean help = false;
        boolean version = false;
        boolean sawCommand = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-c", "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new UsageException("Missing value for " + arg);
                    }
                    config = Path.of(args[++i]);
                }
                case "--dry-run" -> dryRun = true;
                case "-v", "--verbose" -> verbose = true;
                case "--hierarchical-categories" -> hierarchical = true;
                case "-h", "--help" -> help = true;
                case "--version" -> version = true;
                default -> {
                    if (arg.startsWith("--config=")) {
                        config = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("-")) {
                        throw new UsageException("Unknown option: " + arg);
                    } else if (!sawCommand && stageName == null && arg.equals("migrate")) {
                        sawCommand = true;
                    } else if (stageName == null) {
                        stageName = arg.toLowerCase(Locale.ROOT);
                    } else {
                        throw new UsageException("Unexpected argument: " + arg);
                    }
                }
            }
        }

        if (help || version) {
            return new CliArguments(Optional.empty(), config, dryRun, verbose, hierarchical, help, version);
        }
        if (stageName == null) {
            throw new UsageException("Missing stage");
        }
        Optional<EntityType> stage = Optional.empty();
        if (!stageName.equals("all")) {
            String name = stageName;
            stage = Optional.of(EntityType.fromStageName(name)
                    .orElseThrow(() -> new UsageException("Unknown stage: " + name)));
        }
        return new CliArguments(stage, config, dryRun, verbose, hierarchical, false, false);
    }
}
