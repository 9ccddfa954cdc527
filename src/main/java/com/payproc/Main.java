package com.payproc;

import com.payproc.adapter.in.csv.CsvActivityReader;
import com.payproc.adapter.out.csv.CsvAccountWriter;
import com.payproc.adapter.out.logging.LoggingProcessingListener;
import com.payproc.application.port.in.LedgerProcessingUseCase;
import com.payproc.application.port.out.AccountSnapshotSink;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.application.service.PartitionedLedgerService;
import com.payproc.application.service.ProcessingReport;
import com.payproc.config.ConfigLoader;
import com.payproc.config.LedgerConfig;
import com.payproc.domain.model.AccountSnapshot;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code payment-processor <path> [--silent]}. Account balances are written to stdout as
 * CSV, logs go to stderr. Skipped records never change the exit code.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: payment-processor <path> [--silent]\n"
            + "  <path>     file that holds account activity records (CSV)\n"
            + "  --silent   process the file without printing the results";

    public static void main(String[] args) {
        System.exit(run(args, new ConfigLoader().load(), System.out, System.err));
    }

    static int run(String[] args, LedgerConfig config, OutputStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help()) {
            err.println(USAGE);
            return EXIT_OK;
        }

        boolean silent = arguments.silent() || config.isSilent();
        Vertx vertx = Vertx.vertx(new VertxOptions().setWorkerPoolSize(config.getPartitions() + 1));
        try (InputStream input = Files.newInputStream(arguments.path())) {
            log.info("Processing {}", arguments.path());

            ProcessingReport report = new ProcessingReport();
            LedgerProcessingUseCase ledger = new PartitionedLedgerService(vertx, config.getPartitions());
            List<AccountSnapshot> snapshots = ledger
                    .process(new CsvActivityReader(input),
                            ProcessingListener.composite(new LoggingProcessingListener(), report))
                    .toCompletionStage()
                    .toCompletableFuture()
                    .join();

            AccountSnapshotSink sink = new CsvAccountWriter(silent ? OutputStream.nullOutputStream() : out);
            sink.write(snapshots);

            log.info("Finished: {} accounts, {} unparseable records, {} rejected activities",
                    snapshots.size(), report.parseFailures().size(), report.rejections().size());
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Unable to process input file {}: {}", arguments.path(), e.getMessage());
            return EXIT_FAILURE;
        } catch (CompletionException e) {
            log.error("Processing input file {} failed", arguments.path(), e.getCause());
            return EXIT_FAILURE;
        } finally {
            vertx.close().toCompletionStage().toCompletableFuture().join();
        }
    }

    /**
     * Parsed command line arguments
     */
    record Arguments(Path path, boolean silent, boolean help) {

        static Arguments parse(String[] args) {
            Path path = null;
            boolean silent = false;
            for (String arg : args) {
                switch (arg) {
                    case "--silent" -> silent = true;
                    case "-h", "--help" -> {
                        return new Arguments(null, false, true);
                    }
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (path != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        path = Path.of(arg);
                    }
                }
            }
            if (path == null) {
                throw new IllegalArgumentException("Missing input file path");
            }
            return new Arguments(path, silent, false);
        }
    }
}
