package cal.snapfind;

import cal.prim.MalformedDataException;
import cal.prim.QuietAutoCloseable;
import cal.prim.time.UnreliableWallClock;
import cal.snapfind.impls.Finder;
import cal.snapfind.impls.JsonOutput;
import cal.snapfind.impls.NodeFormatter;
import cal.snapfind.impls.TextOutput;
import cal.snapfind.repo.CachingTreeStore;
import cal.snapfind.repo.Repository;
import cal.snapfind.repo.RepositoryLock;
import cal.snapfind.repo.RepositoryLockedException;
import cal.snapfind.repo.SnapshotFilter;
import cal.snapfind.repo.SnapshotSelection;
import cal.snapfind.types.FindPattern;
import cal.snapfind.types.MatchSink;
import cal.snapfind.types.SnapshotSource;
import cal.snapfind.types.UsageException;
import com.google.common.cache.CacheStats;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class Main {

  public static final String REPOSITORY_ENV = "SNAPFIND_REPOSITORY";

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_INTERRUPTED = 130;

  private static final String USAGE = "snapfind [options] PATTERN";

  private static Options options() {
    Options options = new Options();

    options.addOption("h", "help", false, "Show help and quit");
    options.addOption(Option.builder("r").longOpt("repo").hasArg().argName("dir").desc("Repository to search (default: $" + REPOSITORY_ENV + ")").build());
    options.addOption(Option.builder().longOpt("no-lock").desc("Do not lock the repository").build());
    options.addOption("q", "quiet", false, "Do not print snapshot headers");
    options.addOption("v", "verbose", false, "Print search statistics to stderr");
    options.addOption(Option.builder().longOpt("json").desc("Print results as JSON").build());

    options.addOption(Option.builder("O").longOpt("oldest").hasArg().argName("time").desc("Oldest modification date/time").build());
    options.addOption(Option.builder("N").longOpt("newest").hasArg().argName("time").desc("Newest modification date/time").build());
    options.addOption("i", "ignore-case", false, "Ignore case for pattern");
    options.addOption("l", "long", false, "Use a long listing format showing size and mode");

    options.addOption(Option.builder("s").longOpt("snapshot").hasArg().argName("id").desc("Snapshot id to search in (can be given multiple times)").build());
    options.addOption(Option.builder("H").longOpt("host").hasArg().argName("host").desc("Only consider snapshots for this host, when no snapshot id is given").build());
    options.addOption(Option.builder().longOpt("tag").hasArg().argName("tag").desc("Only consider snapshots which include this tag, when no snapshot id is given").build());
    options.addOption(Option.builder().longOpt("path").hasArg().argName("path").desc("Only consider snapshots which include this (absolute) path, when no snapshot id is given").build());

    return options;
  }

  private static void showHelp(Options options, PrintStream out) {
    PrintWriter w = new PrintWriter(out);
    HelpFormatter f = new HelpFormatter();
    f.printHelp(w, f.getWidth(), USAGE, null, options, f.getLeftPadding(), f.getDescPadding(), null);
    w.flush();
  }

  public static void main(String[] args) {
    int code;
    Thread searchThread = Thread.currentThread();
    try (QuietAutoCloseable ignored = Util.catchShutdown(searchThread::interrupt)) {
      code = run(args, System.out, System.err, System.getenv(), ZoneId.systemDefault());
    }

    // After Ctrl+C the JVM is already shutting down, and System.exit() would
    // wait forever for the hook that is waiting for this thread.
    if (code == EXIT_INTERRUPTED || Thread.currentThread().isInterrupted()) {
      return;
    }
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  /**
   * Run a search as described by command-line arguments.
   *
   * @param out where results go
   * @param err where warnings and errors go
   * @param env the environment, for the default repository
   * @param zone the time zone for parsing and printing times
   * @return the exit code
   */
  public static int run(String[] args, PrintStream out, PrintStream err, Map<String, String> env, ZoneId zone) {
    Options options = options();

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      err.println("Failed to parse options: " + e.getMessage());
      showHelp(options, err);
      return EXIT_FAILURE;
    }

    if (cli.hasOption('h')) {
      showHelp(options, out);
      return EXIT_OK;
    }

    final boolean json = cli.hasOption("json");
    final boolean quiet = cli.hasOption('q');
    final boolean verbose = cli.hasOption('v');
    final boolean noLock = cli.hasOption("no-lock");
    final boolean longListing = cli.hasOption('l');

    if (cli.getArgList().size() != 1) {
      err.println("wrong number of arguments");
      showHelp(options, err);
      return EXIT_FAILURE;
    }

    // ------------------------------------------------------------------------------
    // Validate the search before touching the repository

    final FindPattern pattern;
    try {
      Instant oldest = cli.hasOption('O') ? TimeFormats.parse(cli.getOptionValue('O'), zone) : null;
      Instant newest = cli.hasOption('N') ? TimeFormats.parse(cli.getOptionValue('N'), zone) : null;
      pattern = FindPattern.of(cli.getArgList().get(0), cli.hasOption('i'), oldest, newest);
    } catch (UsageException e) {
      err.println(e.getMessage());
      return EXIT_FAILURE;
    }

    String location = cli.hasOption('r') ? cli.getOptionValue('r') : env.get(REPOSITORY_ENV);
    if (location == null || location.isEmpty()) {
      err.println("No repository given; use --repo or set " + REPOSITORY_ENV);
      return EXIT_FAILURE;
    }
    Path repoPath = Paths.get(location);

    SnapshotSelection selection = new SnapshotSelection(
        cli.getOptionValue('H'),
        listOption(cli, "tag"),
        listOption(cli, "path"),
        listOption(cli, "snapshot"));

    // ------------------------------------------------------------------------------
    // Do the work

    final Repository repo;
    try {
      repo = Repository.open(repoPath);
    } catch (NoSuchFileException e) {
      err.println("No repository at " + repoPath + " (missing " + e.getFile() + ')');
      return EXIT_FAILURE;
    } catch (IOException e) {
      err.println("Failed to open repository at " + repoPath + ": " + e);
      return EXIT_FAILURE;
    }

    RepositoryLock lock = null;
    try {
      if (!noLock) {
        lock = repo.lockShared(UnreliableWallClock.SYSTEM_CLOCK);
        lock.keepFresh(RepositoryLock.REFRESH_INTERVAL, err);
      }
      SnapshotSource snapshots = SnapshotFilter.select(repo, selection, err);
      MatchSink sink = json
          ? new JsonOutput(out, err, zone)
          : new TextOutput(out, quiet ? null : out, new NodeFormatter(longListing, zone));
      CachingTreeStore trees = new CachingTreeStore(repo);
      Finder finder = new Finder(trees, pattern, sink);
      finder.findAll(snapshots);
      if (verbose) {
        printStatistics(finder, trees.stats(), err);
      }
    } catch (RepositoryLockedException e) {
      err.println("Unable to lock the repository: " + e.getMessage());
      err.println("Wait for the other process to finish, or pass --no-lock.");
      return EXIT_FAILURE;
    } catch (InterruptedIOException | ClosedByInterruptException e) {
      err.println("Interrupted; stopping.");
      return EXIT_INTERRUPTED;
    } catch (IOException e) {
      err.println("Search failed: " + e);
      return EXIT_FAILURE;
    } catch (MalformedDataException e) {
      err.println("The repository appears to be corrupt: " + e.getMessage());
      return EXIT_FAILURE;
    } finally {
      if (lock != null) {
        release(lock, err);
      }
    }

    return EXIT_OK;
  }

  /**
   * Release a lock taken for a search.  The search's results are already written, so a
   * lock that cannot be removed is only worth a warning; it will go stale eventually.
   */
  static void release(RepositoryLock lock, PrintStream err) {
    try {
      lock.close();
    } catch (IOException e) {
      err.println("WARNING: unable to release the repository lock: " + e);
    }
  }

  private static void printStatistics(Finder finder, CacheStats cacheStats, PrintStream err) {
    err.println("Searched for " + finder.pattern());
    err.println("  matches:                  " + finder.matches());
    err.println("  trees searched:           " + finder.treesSearched());
    err.println("  trees skipped (no match): " + finder.treesSkipped());
    err.println("  trees read from storage:  " + cacheStats.missCount());
  }

  /**
   * All values of a repeatable option; each value may also be a comma-separated list.
   */
  private static List<String> listOption(CommandLine cli, String name) {
    String[] values = cli.getOptionValues(name);
    if (values == null) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<>();
    for (String value : values) {
      for (String part : value.split(",")) {
        if (!part.isEmpty()) {
          result.add(part);
        }
      }
    }
    return result;
  }

}
