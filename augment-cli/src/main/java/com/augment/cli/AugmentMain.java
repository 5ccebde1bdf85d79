package com.augment.cli;

import com.augment.config.AugmentConfig;
import com.augment.config.AugmentConfigLoader;
import com.augment.core.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 * augment --config run.json [--dry-run] [--verbose]
 * </pre>
 *
 * Exit codes: 0 done (individual task failures included), 1 fatal configuration or pipeline error
 * ({@link com.augment.config.ConfigurationException}, {@link com.augment.core.OperationBuildException}),
 * 2 bad usage.
 */
public final class AugmentMain {
    private static final Logger log = LoggerFactory.getLogger(AugmentMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: augment --config <file.json> [--dry-run] [--verbose] [--help]";

    private AugmentMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    record Options(Path config, boolean dryRun, boolean verbose, boolean help) {}

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static Options parse(String[] args) throws UsageException {
        Path config = null;
        boolean dryRun = false;
        boolean verbose = false;
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config", "-c" -> {
                    if (i + 1 >= args.length) throw new UsageException(a + " needs a file argument");
                    config = Path.of(args[++i]);
                }
                case "--dry-run" -> dryRun = true;
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> help = true;
                default -> throw new UsageException("Unknown argument: " + a);
            }
        }
        if (!help && config == null) throw new UsageException("--config is required");
        return new Options(config, dryRun, verbose, help);
    }

    static int run(String[] args, PrintStream err) {
        Options opts;
        try {
            opts = parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (opts.help()) {
            err.println(USAGE);
            return EXIT_OK;
        }

        try {
            AugmentConfig config = AugmentConfigLoader.load(opts.config());
            if (opts.verbose()) config = config.withVerbose(true);
            AugmentSession session = new AugmentSession(config, OperationRegistry.defaults());
            if (opts.dryRun()) {
                session.dryRun();
            } else {
                session.run();
            }
            return EXIT_OK;
        } catch (IOException | IllegalArgumentException e) {
            log.error("[FATAL] {}", e.getMessage());
            return EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[FATAL] interrupted");
            return EXIT_FATAL;
        }
    }
}
