package com.excsn.treepath.example;

import com.excsn.treepath.core.TreePathBuilder;
import com.excsn.treepath.core.TreePaths;
import com.excsn.treepath.core.telemetry.Logger;
import com.excsn.treepath.core.telemetry.StatsRecorder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

public class Main {
  public static void main(String[] args) throws Exception {

    var configDir = Paths.get("src", "main", "resources", "config").toAbsolutePath();
    var catalog = TreePathBuilder.builder()
      .setTelemetry(new ConsoleLogger(), StatsRecorder.NOOP)
      .setCacheMaxSize(16)
      .yamlFile(configDir.resolve("catalog.yaml"));

    var partName = catalog.join("parts/part2/name").readValue();
    System.out.println("Output of path 'parts/part2/name': " + partName);

    var firstTag = catalog.join("parts", "part2", "tags", 0).readValue();
    System.out.println("Output of path 'parts/part2/tags/0': " + firstTag);

    var missing = catalog.join("parts").get("missing", "<none>");
    System.out.println("Output of path 'parts/missing': " + missing);

    for (var part : catalog.strictJoin("parts")) {
      System.out.println("Child '" + part + "' has " + part.size() + " keys");
    }

    TreePaths.lookupAccessor(catalog).clearCache();

    var files = TreePaths.fromPath(configDir);
    var todo = files.join("notes", "todo.txt");

    if (todo.exists()) {
      System.out.println("Output of file 'notes/todo.txt': " + new String(todo.readValue(), StandardCharsets.UTF_8).trim());
    }
    System.out.println("Config directory entries: " + files.keys());

    System.out.println("Example program ran successfully");
  }

  /**
   * Prints debug lines only when -Dtreepath.verbose is set.
   */
  private static class ConsoleLogger implements Logger {

    private final boolean _verbose = Boolean.getBoolean("treepath.verbose");

    @Override
    public void debug(String message) {

      if (_verbose) {
        System.out.println("[debug] " + message);
      }
    }

    @Override
    public void info(String message) {
      System.out.println("[info] " + message);
    }

    @Override
    public void warn(String message) {
      System.out.println("[warn] " + message);
    }

    @Override
    public void error(String message, Throwable throwable) {
      System.err.println("[error] " + message + ": " + throwable);
    }
  }
}
