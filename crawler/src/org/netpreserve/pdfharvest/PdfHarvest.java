package org.netpreserve.pdfharvest;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.netpreserve.pdfharvest.browser.ChromeBrowser;
import org.netpreserve.pdfharvest.config.ConfigException;
import org.netpreserve.pdfharvest.config.ConfigLoader;
import org.netpreserve.pdfharvest.config.JobConfig;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class PdfHarvest {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(PdfHarvest.class);
    private static final String LOGGER_NAME = "org.netpreserve.pdfharvest";

    public static void main(String[] args) throws Exception {
        var jobFiles = new ArrayList<Path>();
        boolean dumpConfig = false;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> {
                    System.out.println("Usage: pdfharvest [options] JOB.yaml...");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --dump-config        Print the effective config of each job and exit");
                    System.out.println("  -v, --verbose            Debug logging for every job");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    jobFiles.add(Path.of(args[i]));
                }
            }
        }
        if (jobFiles.isEmpty()) {
            System.err.println("Usage: pdfharvest [options] JOB.yaml...");
            System.exit(1);
        }

        var loader = new ConfigLoader();
        if (dumpConfig) {
            for (Path jobFile : jobFiles) {
                try {
                    System.out.println("# " + jobFile);
                    System.out.println(loader.dump(loader.load(jobFile)));
                } catch (ConfigException e) {
                    System.err.println(e.getMessage());
                }
            }
            System.exit(0);
        }

        int failures = runJobs(loader, jobFiles, verbose);
        log.info("Finished {} job(s), {} failed", jobFiles.size(), failures);
    }

    /**
     * Runs each job in turn. A job that can't be configured or fails while running doesn't stop the others.
     *
     * @return the number of jobs that failed
     */
    static int runJobs(ConfigLoader loader, List<Path> jobFiles, boolean verbose) {
        int failures = 0;
        for (Path jobFile : jobFiles) {
            JobConfig config;
            try {
                config = loader.load(jobFile);
            } catch (ConfigException e) {
                log.atError().addKeyValue("job", jobFile).log("Skipping job: {}", e.getMessage());
                failures++;
                continue;
            }

            var logger = (Logger) LoggerFactory.getLogger(LOGGER_NAME);
            Level previousLevel = logger.getLevel();
            if (verbose || config.verbose()) logger.setLevel(Level.DEBUG);
            try (var browser = new ChromeBrowser(config.browser().executable(), config.browser().options(),
                    config.userAgent());
                 var job = new Job(config, browser)) {
                log.atInfo().addKeyValue("job", jobFile).log("Starting job for {}", config.startUrl());
                job.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted, abandoning remaining jobs");
                return failures + 1;
            } catch (Exception e) {
                log.atError().addKeyValue("job", jobFile).setCause(e).log("Job failed");
                failures++;
            } finally {
                logger.setLevel(previousLevel);
            }
        }
        return failures;
    }
}
