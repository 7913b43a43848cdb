package mycompany.heightchange;

import mycompany.heightchange.config.CompareConfig;
import mycompany.heightchange.config.ConfigException;
import mycompany.heightchange.config.ConfigLoader;
import mycompany.heightchange.pipeline.ChangeDetectionRun;
import mycompany.heightchange.pipeline.ParallelDispatcher;
import mycompany.heightchange.pipeline.RunSummary;
import mycompany.heightchange.raster.GeoTiffRasterAccessor;
import mycompany.heightchange.raster.RasterMismatchException;
import mycompany.heightchange.tools.NodataMaskExporter;
import mycompany.heightchange.tools.PlaceholderCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  height-change compare <config.yml>",
            "  height-change mask <input_dir> <output_dir> [threads]",
            "  height-change clean <input_dir> [threads]");

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    /**
     * Run one command and return the process exit status.
     */
    static int run(String[] args, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }
        try {
            switch (args[0]) {
                case "compare":
                    return compare(args, err);
                case "mask":
                    return mask(args, err);
                case "clean":
                    return clean(args, err);
                default:
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_FAILURE;
            }
        } catch (ConfigException ex) {
            for (String problem : ex.getProblems()) {
                err.println("Configuration error: " + problem);
            }
            return EXIT_FAILURE;
        } catch (RasterMismatchException ex) {
            LOGGER.error("Run aborted: {}", ex.getMessage());
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Run failed", ex);
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int compare(String[] args, PrintStream err) throws ConfigException, IOException {
        if (args.length != 2) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }
        CompareConfig config = new ConfigLoader().load(Paths.get(args[1]));
        RunSummary summary = new ChangeDetectionRun(config).execute();
        LOGGER.info("Change list written to {}: {}", config.getChangeList(), summary);
        return EXIT_OK;
    }

    private static int mask(String[] args, PrintStream err) throws IOException {
        if (args.length < 3 || args.length > 4) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }
        Path inputDir = requireDirectory(args[1]);
        Integer threads = parseThreads(args, 3, err);
        if (threads == null) {
            return EXIT_FAILURE;
        }
        new NodataMaskExporter(new GeoTiffRasterAccessor(), new ParallelDispatcher(threads))
                .export(inputDir, Paths.get(args[2]));
        return EXIT_OK;
    }

    private static int clean(String[] args, PrintStream err) throws IOException {
        if (args.length < 2 || args.length > 3) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }
        Path inputDir = requireDirectory(args[1]);
        Integer threads = parseThreads(args, 2, err);
        if (threads == null) {
            return EXIT_FAILURE;
        }
        new PlaceholderCleaner(new GeoTiffRasterAccessor(), new ParallelDispatcher(threads)).clean(inputDir);
        return EXIT_OK;
    }

    private static Path requireDirectory(String value) throws IOException {
        Path dir = Paths.get(value);
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + value);
        }
        return dir;
    }

    private static Integer parseThreads(String[] args, int index, PrintStream err) {
        if (args.length <= index) {
            return 0;
        }
        int threads;
        try {
            threads = Integer.parseInt(args[index]);
        } catch (NumberFormatException ex) {
            threads = -1;
        }
        if (threads < 0) {
            err.println("threads must be a non-negative integer, got " + args[index]);
            return null;
        }
        return threads;
    }
}
