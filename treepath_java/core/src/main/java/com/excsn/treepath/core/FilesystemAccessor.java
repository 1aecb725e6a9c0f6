package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.IsDirectoryException;
import com.excsn.treepath.core.exceptions.KeyMissingException;
import com.excsn.treepath.core.exceptions.NotIndexableException;
import com.excsn.treepath.core.exceptions.ResolutionException;
import com.excsn.treepath.core.telemetry.Logger;
import com.excsn.treepath.core.telemetry.StatsRecorder;
import se.sawano.java.text.AlphanumericComparator;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accessor over entries below a base directory. Directories are the containers, files are the leaves and
 * resolve to their raw bytes.
 *
 * Nothing is cached, every call reflects the filesystem at call time.
 */
public class FilesystemAccessor implements NodeAccessor<byte[], Closeable> {

  private static final AlphanumericComparator ENTRY_ORDER = new AlphanumericComparator();

  private final Path _root;
  private final Logger _logger;
  private final StatsRecorder _statsRecorder;

  public FilesystemAccessor(Path root) {
    this(root, Logger.NOOP, StatsRecorder.NOOP);
  }

  public FilesystemAccessor(Path root, Logger logger, StatsRecorder statsRecorder) {
    _root = root.toAbsolutePath();
    _logger = logger;
    _statsRecorder = statsRecorder;
  }

  public Path root() {
    return _root;
  }

  /**
   * @return the filesystem location the parts point at, whether or not it exists yet
   */
  public Path toFilePath(List<?> parts) {

    var target = _root;

    for (var part : parts) {
      target = target.resolve(_entryName(part, List.of()));
    }

    return target;
  }

  @Override
  public boolean exists(List<?> parts) {

    try {
      return Files.exists(_target(parts));
    } catch (ResolutionException e) {
      return false;
    }
  }

  @Override
  public byte[] resolve(List<?> parts) {

    _statsRecorder.recordCounterIncrement(StatsRecorder.GROUP_TAGS, "resolve_attempts");

    var target = _target(parts);

    if (Files.isDirectory(target)) {
      throw new IsDirectoryException(_last(parts), parts);
    }

    var startNanos = System.nanoTime();

    try {
      var contents = Files.readAllBytes(target);

      _statsRecorder.recordTimer(StatsRecorder.GROUP_TAGS, "read_time", Duration.ofNanos(System.nanoTime() - startNanos));
      _statsRecorder.recordGauge(StatsRecorder.GROUP_TAGS, "read_bytes", contents.length);

      return contents;
    } catch (NoSuchFileException e) {
      throw new KeyMissingException(_last(parts), _allButLast(parts));
    } catch (IOException e) {
      _logger.error("Could not read from file '" + target + "'", e);
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public List<Object> keys(List<?> parts) {

    var target = _target(parts);

    if (!Files.isDirectory(target)) {

      if (!Files.exists(target)) {
        throw new KeyMissingException(_last(parts), _allButLast(parts));
      }
      throw new NotIndexableException(parts, "file");
    }

    try (var entries = Files.list(target)) {

      List<String> names = entries
        .map(entry -> entry.getFileName().toString())
        .sorted(ENTRY_ORDER)
        .collect(Collectors.toList());

      return Collections.unmodifiableList(new ArrayList<Object>(names));
    } catch (NoSuchFileException e) {
      throw new KeyMissingException(_last(parts), _allButLast(parts));
    } catch (IOException e) {
      _logger.error("Could not list directory '" + target + "'", e);
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public NodeStat stat(List<?> parts) {

    BasicFileAttributes attributes;

    try {
      attributes = Files.readAttributes(_target(parts), BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    } catch (ResolutionException | IOException e) {
      return NodeStat.MISSING;
    }

    if (attributes.isSymbolicLink()) {
      return NodeStat.of(NodeKind.SYMLINK, attributes.size());
    }

    if (attributes.isDirectory()) {
      return NodeStat.of(NodeKind.DIRECTORY, null);
    }

    if (attributes.isRegularFile()) {
      return NodeStat.of(NodeKind.FILE, attributes.size());
    }

    return NodeStat.of(NodeKind.OTHER, attributes.size());
  }

  /**
   * Files open as an {@link java.io.InputStream}, directories as a {@link java.nio.file.DirectoryStream}.
   */
  @Override
  public NodeHandle<Closeable> open(List<?> parts) {

    var target = _target(parts);

    try {

      if (Files.isDirectory(target)) {
        return NodeHandle.<Closeable>closing(Files.newDirectoryStream(target));
      }

      return NodeHandle.<Closeable>closing(Files.newInputStream(target));
    } catch (NoSuchFileException e) {
      throw new KeyMissingException(_last(parts), _allButLast(parts));
    } catch (IOException e) {
      _logger.error("Could not open '" + target + "'", e);
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public boolean isTraversable(List<?> parts) {

    try {
      return Files.isDirectory(_target(parts), LinkOption.NOFOLLOW_LINKS);
    } catch (ResolutionException e) {
      return false;
    }
  }

  @Override
  public void validate(List<?> parts) {

    var target = _target(parts);

    if (!Files.exists(target)) {
      throw new KeyMissingException(_last(parts), _allButLast(parts));
    }
  }

  /**
   * Walks the parts one entry at a time so the first missing or non-directory segment is reported. The final
   * entry itself is not required to exist.
   */
  private Path _target(List<?> parts) {

    var current = _root;

    for (var index = 0; index < parts.size(); index++) {

      var part = parts.get(index);
      var resolvedParts = parts.subList(0, index);

      if (!Files.isDirectory(current)) {

        // Only the base directory itself can be missing here.
        if (!Files.exists(current)) {
          throw new KeyMissingException(part, resolvedParts);
        }
        throw new NotIndexableException(part, resolvedParts, "file");
      }

      try {
        current = current.resolve(_entryName(part, resolvedParts));
      } catch (InvalidPathException e) {
        throw new KeyMissingException(part, resolvedParts);
      }

      if (index < parts.size() - 1 && !Files.exists(current)) {
        throw new KeyMissingException(part, resolvedParts);
      }
    }

    return current;
  }

  private static String _entryName(Object part, List<?> resolvedParts) {

    var name = String.valueOf(part);

    if ("..".equals(name) || name.indexOf('/') >= 0 || name.indexOf(File.separatorChar) >= 0) {
      throw new KeyMissingException("Entry name `" + name + "` escapes its directory", part, resolvedParts);
    }

    return name;
  }

  private static Object _last(List<?> parts) {
    return parts.isEmpty() ? null : parts.get(parts.size() - 1);
  }

  private static List<?> _allButLast(List<?> parts) {
    return parts.isEmpty() ? parts : parts.subList(0, parts.size() - 1);
  }
}
