package com.onthegomap.trailcover;

import static java.util.Map.entry;

import com.onthegomap.trailcover.config.Arguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry-point for the executable jar, which delegates to a task named by the first argument.
 * <p>
 * {@code coverage} (the default) computes coverage and logs a summary, {@code export} also writes the JSON export.
 */
public class Main {

  private static final Path DEFAULT_NETWORK = Path.of("data", "osm_trails.json");
  private static final Path DEFAULT_ACTIVITIES = Path.of("activities");
  private static final Path DEFAULT_OUTPUT = Path.of("web", "data.json");

  private static final EntryPoint DEFAULT_TASK = Main::coverage;
  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("coverage", Main::coverage),
    entry("match", Main::coverage),

    entry("export", Main::export)
  );

  public static void main(String[] args) throws Exception {
    EntryPoint task = DEFAULT_TASK;

    if (args.length > 0) {
      String maybeTask = args[0].trim().toLowerCase(Locale.ROOT);
      EntryPoint taskFromArg0 = ENTRY_POINTS.get(maybeTask);
      if (taskFromArg0 != null) {
        args = Arrays.copyOfRange(args, 1, args.length);
        task = taskFromArg0;
      } else if (!maybeTask.contains("=") && !maybeTask.startsWith("-")) {
        System.err.println("Unrecognized task: " + maybeTask);
        System.err.println("possibilities: " + ENTRY_POINTS.keySet());
        System.exit(1);
      }
    }

    task.main(args);
  }

  private static void coverage(String[] args) throws Exception {
    TrailCoverage.create(Arguments.fromArgsOrConfigFile(args))
      .setNetwork(DEFAULT_NETWORK)
      .setActivities(DEFAULT_ACTIVITIES)
      .run();
  }

  private static void export(String[] args) throws Exception {
    TrailCoverage.create(Arguments.fromArgsOrConfigFile(args))
      .setNetwork(DEFAULT_NETWORK)
      .setActivities(DEFAULT_ACTIVITIES)
      .setOutput(DEFAULT_OUTPUT)
      .run();
  }

  @FunctionalInterface
  private interface EntryPoint {

    void main(String[] args) throws Exception;
  }
}
