package io.github.yok.flexetl;

import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.config.SinkConfig;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.config.StagingConfig;
import io.github.yok.flexetl.core.BatchExtractor;
import io.github.yok.flexetl.core.EtlOrchestrator;
import io.github.yok.flexetl.core.RawDataStager;
import io.github.yok.flexetl.core.SinkLoader;
import io.github.yok.flexetl.core.TransformPipeline;
import io.github.yok.flexetl.db.ConnectionProvider;
import io.github.yok.flexetl.util.ErrorHandler;
import io.github.yok.flexetl.util.RetryPolicy;
import java.nio.file.Path;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Supported arguments:
 * </p>
 * <ul>
 * <li>no argument, {@code --run} or {@code -r}: runs the ETL process over every source
 * table.</li>
 * <li>{@code --check} or {@code -c}: opens and closes the source and sink connections.</li>
 * <li>{@code --stage <csvFile> <table>} or {@code -s <csvFile> <table>}: stages a raw CSV file
 * into the source schema.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link SourceConfig}, {@link SinkConfig}, {@link PipelineConfig} and
 * {@link StagingConfig} from {@code application.yml}; their values usually come from environment
 * variables.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see EtlOrchestrator
 * @see RawDataStager
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({SourceConfig.class, SinkConfig.class, PipelineConfig.class,
        StagingConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final SourceConfig sourceConfig;
    private final SinkConfig sinkConfig;
    private final PipelineConfig pipelineConfig;
    private final StagingConfig stagingConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = "run";
        String csvFile = null;
        String table = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--run":
                case "-r":
                    mode = "run";
                    break;
                case "--check":
                case "-c":
                    mode = "check";
                    break;
                case "--stage":
                case "-s":
                    mode = "stage";
                    csvFile = (i + 1 < args.length ? args[++i] : null);
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if ("stage".equals(mode) && (csvFile == null || table == null)) {
            ErrorHandler.errorAndExit("CSV file and table name are required in stage mode.");
            return;
        }
        log.info("Mode: {}", mode);

        ConnectionProvider connectionProvider =
                new ConnectionProvider(sourceConfig, sinkConfig, RetryPolicy.from(pipelineConfig));
        try {
            if ("check".equals(mode)) {
                connectionProvider.checkSource();
                connectionProvider.checkSink();
                log.info("Connection check completed.");

            } else if ("stage".equals(mode)) {
                int rows = new RawDataStager(connectionProvider, sourceConfig, stagingConfig)
                        .stage(Path.of(csvFile), table);
                log.info("Staging completed. Table [{}], rows={}", table, rows);

            } else {
                new EtlOrchestrator(connectionProvider,
                        new BatchExtractor(sourceConfig, pipelineConfig),
                        new TransformPipeline(pipelineConfig), new SinkLoader(sinkConfig))
                                .runEtl();
                log.info("ETL process completed successfully.");
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
