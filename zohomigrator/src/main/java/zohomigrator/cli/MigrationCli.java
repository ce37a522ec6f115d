package zohomigrator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.auth.TokenManager;
import zohomigrator.config.AlertLevel;
import zohomigrator.config.ConfigTokenWriter;
import zohomigrator.config.MigrationConfig;
import zohomigrator.config.MigrationConfigException;
import zohomigrator.config.MigrationConfigLoader;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationClient;
import zohomigrator.gateway.DestinationGateway;
import zohomigrator.gateway.RateWindow;
import zohomigrator.gateway.Sleeper;
import zohomigrator.http.ApacheHttpTransport;
import zohomigrator.http.HttpTransport;
import zohomigrator.metrics.RunMetricsCollector;
import zohomigrator.pipeline.MigrationPipeline;
import zohomigrator.pipeline.PipelineOptions;
import zohomigrator.pipeline.StageContext;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.IdMappingRegistry;
import zohomigrator.result.ResultReporter;
import zohomigrator.source.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.util.UUID;

/**
 * Command-line entry point.
 *
 * <p>Exit codes: {@code 0} every requested stage completed, {@code 1} a
 * stage was aborted or skipped, {@code 2} bad usage or configuration.
 *
 * @see CliArguments
 */
public final class MigrationCli {

    private static final Logger log = LoggerFactory.getLogger(MigrationCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STAGE_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    MigrationCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new MigrationCli(System.out, System.err).run(args));
    }

    int run(String... argv) {
        CliArguments args;
        try {
            args = CliArguments.parse(argv);
        } catch (CliArguments.UsageException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (args.help()) {
            out.println(CliArguments.USAGE);
            return EXIT_OK;
        }
        if (args.version()) {
            out.println("zoho-migration " + version());
            return EXIT_OK;
        }

        MigrationConfig config;
        try {
            config = MigrationConfigLoader.loadFromFile(args.configPath());
        } catch (IOException e) {
            err.println("Cannot read configuration " + args.configPath() + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (MigrationConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (args.verbose()) {
            config = config.withAlertLevel(AlertLevel.DEBUG);
        }
        MigrationEventLogger.setAlertLevel(config.alertLevel());

        ApacheHttpTransport transport = new ApacheHttpTransport(config.httpTimeout());
        try {
            return migrate(config, args, transport, Clock.systemUTC(), Sleeper.system());
        } finally {
            try {
                transport.close();
            } catch (IOException e) {
                log.warn("Failed to close HTTP client: {}", e.getMessage());
            }
        }
    }

    /**
     * Wires the migration over a transport and runs the requested stages.
     *
     * @return the exit code
     */
    int migrate(MigrationConfig config, CliArguments args, HttpTransport transport, Clock clock, Sleeper sleeper) {
        ObjectMapper mapper = new ObjectMapper();

        TokenManager tokens = new TokenManager(config, transport, mapper);
        config.sourceFile().ifPresent(file -> tokens.addListener(new ConfigTokenWriter(file)));

        RateWindow window = new RateWindow(config.maxRequestsPerWindow(), config.rateWindow(), clock, sleeper);
        DestinationGateway gateway = new DestinationGateway(transport, tokens, window,
                config.organizationId(), config.throttleBackoff(), sleeper);
        DestinationClient client = new DestinationClient(gateway, mapper, config.destinationBaseUrl(),
                config.duplicateCodes(), args.dryRun());
        SourceReader reader = new SourceReader(transport, tokens, mapper, config.sourceBaseUrl(),
                config.sourceAccountId(), config.sourcePageSize());

        PipelineOptions options = new PipelineOptions(args.dryRun(), args.verbose(), args.hierarchicalCategories());
        StageContext context = new StageContext(reader, client, new IdMappingRegistry(), config, options, clock);
        MigrationPipeline pipeline = MigrationPipeline.create(context, new ResultReporter(out),
                new RunMetricsCollector(clock));

        String runId = UUID.randomUUID().toString().substring(0, 8);
        log.info("Starting migration run {} ({})", runId, args.runsAll() ? "all" : args.stage().get().stageName());
        pipeline.start(runId);

        boolean ok;
        if (args.runsAll()) {
            ok = pipeline.runAll();
        } else {
            EntityType stage = args.stage().get();
            try {
                pipeline.run(stage);
                ok = true;
            } catch (MigrateException e) {
                err.println("Migration of " + stage.stageName() + " aborted: " + e.getMessage());
                ok = false;
            } catch (RuntimeException e) {
                log.error("Migration of {} aborted by an unexpected error", stage.stageName(), e);
                err.println("Migration of " + stage.stageName() + " aborted: " + e);
                ok = false;
            }
        }

        pipeline.finish(new RunMetricsCollector.TrafficSource() {
            @Override
            public long requestsSent() {
                return gateway.requestsSent();
            }

            @Override
            public long throttleCount() {
                return gateway.throttleCount();
            }

            @Override
            public long rateLimitWaits() {
                return window.waitCount();
            }

            @Override
            public long rateLimitWaitMs() {
                return window.totalWait().toMillis();
            }

            @Override
            public int tokenRefreshes() {
                return tokens.refreshCount();
            }
        });
        return ok ? EXIT_OK : EXIT_STAGE_FAILED;
    }

    static String version() {
        String v = MigrationCli.class.getPackage().getImplementationVersion();
        return v != null ? v : "development";
    }
}
