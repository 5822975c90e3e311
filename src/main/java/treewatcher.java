//usr/bin/env jbang "$0" "$@" ; exit $?
//DEPS info.picocli:picocli:4.7.7
//DEPS org.slf4j:slf4j-api:2.0.13
//DEPS ch.qos.logback:logback-classic:1.4.14
//DEPS org.fusesource.jansi:jansi:2.4.0
//DEPS one.util:streamex:0.8.2
//DEPS com.fasterxml.jackson.core:jackson-databind:2.17.1
//DEPS com.fasterxml.jackson.core:jackson-annotations:2.17.1
//SOURCES com/namekis/utils/RichLogback.java
//SOURCES com/namekis/treewatcher/*.java
//SOURCES com/namekis/treewatcher/cli/*.java

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.treewatcher.BuildStrategy;
import com.namekis.treewatcher.LoadResult;
import com.namekis.treewatcher.PrimaryExecutor;
import com.namekis.treewatcher.ProgressListener;
import com.namekis.treewatcher.TreeLoader;
import com.namekis.treewatcher.cli.ListingDecodeException;
import com.namekis.treewatcher.cli.ListingFiles;
import com.namekis.treewatcher.cli.TreePrinter;
import com.namekis.treewatcher.cli.TreeWatcherConfig;
import com.namekis.utils.RichLogback;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Visibility;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "treewatcher", mixinStandardHelpOptions = true, version = "treewatcher 0.1", description = treewatcher.description, sortOptions = false)
public class treewatcher implements Callable<Integer> {
    static final String description = """
            treewatcher - rebuilds the folder hierarchy saved from the `tree` command and prints it back.

            EXAMPLES:
              tree /F > "D:\\tree_output.txt"                 # save a listing on Windows
              treewatcher D:\\tree_output.txt                  # print it with icons
              treewatcher --expand=1 --ascii tree_output.txt   # roots and their children only, ASCII connectors

            EXIT CODES:
              0 loaded, 1 empty file, 2 no tree structure found, 3 file unreadable or undecodable
            """;

    static final int EXIT_EMPTY = 1;
    static final int EXIT_NO_ROOT = 2;
    static final int EXIT_UNREADABLE = 3;

    private static final Logger log = LoggerFactory.getLogger(treewatcher.class);

    @Parameters(index = "0", arity = "0..1", defaultValue = "tree_output.txt", description = "Saved `tree` output.", showDefaultValue = Visibility.ALWAYS)
    Path file;

    @Option(names = "--strategy", defaultValue = "RECURSIVE", description = "Forest builder: ${COMPLETION-CANDIDATES}.", showDefaultValue = Visibility.ALWAYS)
    BuildStrategy strategy;

    @Option(names = "--expand", defaultValue = "-1", description = "Levels to expand below the root, -1 for all.", showDefaultValue = Visibility.ALWAYS)
    int expand;

    @Option(names = "--ascii", description = "Print +--- style connectors instead of box drawing.")
    boolean ascii;

    @Option(names = "--config", description = "Icon configuration (default: config.json next to the listing).")
    Path config;

    @Option(names = "--no-icons", description = "Print names only.")
    boolean noIcons;

    @Option(names = "--progress", description = "Log progress of each phase.")
    boolean progress;

    @Option(names = { "-v", "--verbose" }, description = "Increase verbosity. Specify multiple times to increase (-vvv).")
    boolean[] verbosity;

    @Option(names = { "-q", "--quiet" }, description = "Suppress all output except errors.")
    boolean quiet;

    @Option(names = { "-c", "--color" }, description = "Colored log output.", defaultValue = "false", showDefaultValue = Visibility.ALWAYS)
    boolean color;

    @Option(names = { "-d", "--debug" }, description = "Log time, thread and caller.", defaultValue = "false", showDefaultValue = Visibility.ALWAYS)
    boolean debug;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new treewatcher()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        RichLogback.configureLogbackByVerbosity(null, verbosity != null ? verbosity.length : 0, quiet, color, debug);

        List<String> lines;
        try {
            lines = ListingFiles.readLines(file);
        } catch (NoSuchFileException e) {
            log.error("Listing {} not found. Save one with: tree /F > \"{}\"", file, file);
            return EXIT_UNREADABLE;
        } catch (IOException | ListingDecodeException e) {
            log.error("Error loading file: {}", e.getMessage());
            return EXIT_UNREADABLE;
        }
        log.debug("Loading {} ({} lines)", file, lines.size());

        ProgressListener listener = progress ? event -> log.info("{}", event) : ProgressListener.NOOP;
        PrimaryExecutor primary = new PrimaryExecutor();
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "treewatcher-worker");
            thread.setDaemon(true);
            return thread;
        });
        LoadResult result;
        try {
            result = primary.runUntil(new TreeLoader(worker, primary, strategy, listener).load(lines));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to load " + file, e.getCause());
        } finally {
            worker.shutdownNow();
        }

        switch (result.status()) {
        case EMPTY_INPUT:
            log.warn(result.message());
            return EXIT_EMPTY;
        case NO_ROOT_FOUND:
            log.warn(result.message());
            return EXIT_NO_ROOT;
        case SUPERSEDED:
            throw new IllegalStateException("Only load of " + file + " was superseded");
        default:
            break;
        }

        TreeWatcherConfig icons = noIcons ? null : TreeWatcherConfig.loadOrCreate(configPath());
        TreePrinter printer = new TreePrinter(ascii ? TreePrinter.Glyphs.ASCII : TreePrinter.Glyphs.UNICODE, icons,
                expand);
        int printed = printer.print(result.model(), System.out);
        log.info("{} {} of {} entries shown.", result.message(), printed, result.forest().nodeCount());
        return 0;
    }

    Path configPath() {
        if (config != null)
            return config;
        Path dir = file.toAbsolutePath().getParent();
        return dir == null ? Path.of("config.json") : dir.resolve("config.json");
    }
}
