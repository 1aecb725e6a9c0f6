package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.IsDirectoryException;
import com.excsn.treepath.core.exceptions.KeyMissingException;
import com.excsn.treepath.core.exceptions.NotIndexableException;
import com.excsn.treepath.core.telemetry.Logger;
import com.excsn.treepath.core.telemetry.StatsRecorder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class FilesystemAccessorTest {

  @TempDir
  Path _root;

  private FilesystemAccessor _accessor;

  @BeforeEach
  public void setup() throws Exception {

    Files.createDirectories(_root.resolve("docs/nested"));
    Files.writeString(_root.resolve("docs/readme.txt"), "hello");
    Files.writeString(_root.resolve("docs/file2"), "two");
    Files.writeString(_root.resolve("docs/file10"), "ten");
    Files.write(_root.resolve("blob.bin"), new byte[] {(byte) 0xff, 0x00, 0x7f});
    Files.writeString(_root.resolve("0"), "zero");

    _accessor = new FilesystemAccessor(_root);
  }

  @Test
  public void resolvesFileBytesWithoutDecoding() {

    Assertions.assertArrayEquals(new byte[] {(byte) 0xff, 0x00, 0x7f}, _accessor.resolve(List.of("blob.bin")));
    Assertions.assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), _accessor.resolve(List.of("docs", "readme.txt")));
  }

  @Test
  public void integerPartsNameEntries() {

    Assertions.assertArrayEquals("zero".getBytes(StandardCharsets.UTF_8), _accessor.resolve(List.of(0)));
  }

  @Test
  public void resolvingDirectoryFails() {

    var exception = Assertions.assertThrows(IsDirectoryException.class, () -> _accessor.resolve(List.of("docs")));

    Assertions.assertEquals("docs", exception.getSegment());
  }

  @Test
  public void missingEntryFails() {

    var exception = Assertions.assertThrows(KeyMissingException.class,
      () -> _accessor.resolve(List.of("docs", "missing.txt")));

    Assertions.assertEquals("missing.txt", exception.getSegment());
    Assertions.assertEquals(List.of("docs"), exception.getParts());
  }

  @Test
  public void missingIntermediateReportsFirstFailingSegment() {

    var exception = Assertions.assertThrows(KeyMissingException.class,
      () -> _accessor.resolve(List.of("nope", "deeper", "file")));

    Assertions.assertEquals("nope", exception.getSegment());
    Assertions.assertEquals(List.of(), exception.getParts());
  }

  @Test
  public void descendingIntoFileFails() {

    Assertions.assertThrows(NotIndexableException.class, () -> _accessor.resolve(List.of("blob.bin", "inside")));
    Assertions.assertFalse(_accessor.exists(List.of("blob.bin", "inside")));
  }

  @Test
  public void keysAreSortedNaturally() {

    Assertions.assertEquals(List.of("file2", "file10", "nested", "readme.txt"), _accessor.keys(List.of("docs")));
    Assertions.assertEquals(List.of(), _accessor.keys(List.of("docs", "nested")));
  }

  @Test
  public void keysFailOnFilesAndMissingEntries() {

    Assertions.assertThrows(NotIndexableException.class, () -> _accessor.keys(List.of("blob.bin")));
    Assertions.assertThrows(KeyMissingException.class, () -> _accessor.keys(List.of("missing")));
  }

  @Test
  public void itemsAndValuesReadChildren() throws Exception {

    Files.createDirectories(_root.resolve("flat"));
    Files.writeString(_root.resolve("flat/b.txt"), "B");
    Files.writeString(_root.resolve("flat/a.txt"), "A");

    var items = _accessor.items(List.of("flat"));

    Assertions.assertEquals(2, items.size());
    Assertions.assertEquals("a.txt", items.get(0).getKey());
    Assertions.assertArrayEquals("A".getBytes(StandardCharsets.UTF_8), items.get(0).getValue());
    Assertions.assertEquals(2, _accessor.values(List.of("flat")).size());
    Assertions.assertTrue(_accessor.values(List.of("docs", "nested")).isEmpty());
    Assertions.assertThrows(IsDirectoryException.class, () -> _accessor.values(List.of("docs")));
  }

  @Test
  public void existsReflectsLiveState() throws Exception {

    var parts = List.<Object>of("docs", "later.txt");

    Assertions.assertFalse(_accessor.exists(parts));

    Files.writeString(_root.resolve("docs/later.txt"), "now");

    Assertions.assertTrue(_accessor.exists(List.of("docs", "later.txt")));

    Files.delete(_root.resolve("docs/later.txt"));

    Assertions.assertFalse(_accessor.exists(parts));
  }

  @Test
  public void validateChecksExistenceWithoutReading() {

    _accessor.validate(List.of("docs"));

    Assertions.assertThrows(KeyMissingException.class, () -> _accessor.validate(List.of("docs", "missing")));
    Assertions.assertEquals(_root.toAbsolutePath().resolve("docs").resolve("x"), _accessor.toFilePath(List.of("docs", "x")));
  }

  @Test
  public void parentSegmentsCannotEscapeRoot() {

    Assertions.assertFalse(_accessor.exists(List.of("docs", "..", "blob.bin")));
    Assertions.assertThrows(KeyMissingException.class, () -> _accessor.resolve(List.of("..")));
  }

  @Test
  public void statDescribesEntries() {

    Assertions.assertEquals(NodeStat.of(NodeKind.FILE, 5L), _accessor.stat(List.of("docs", "readme.txt")));
    Assertions.assertEquals(NodeStat.of(NodeKind.DIRECTORY, null), _accessor.stat(List.of("docs")));
    Assertions.assertEquals(NodeStat.MISSING, _accessor.stat(List.of("docs", "missing")));
    Assertions.assertTrue(_accessor.isTraversable(List.of("docs")));
    Assertions.assertFalse(_accessor.isTraversable(List.of("blob.bin")));
  }

  @Test
  public void openFileReleasesStream() throws Exception {

    NodeHandle<?> escaped;

    try (var handle = _accessor.open(List.of("docs", "readme.txt"))) {

      var stream = (InputStream) handle.get();
      Assertions.assertEquals("hello", new String(stream.readAllBytes(), StandardCharsets.UTF_8));
      escaped = handle;
    }

    Assertions.assertTrue(escaped.isClosed());
  }

  @Test
  @SuppressWarnings("unchecked")
  public void openDirectoryListsEntries() {

    var names = new ArrayList<String>();

    try (var handle = _accessor.open(List.of("docs", "nested"))) {
      for (var entry : (DirectoryStream<Path>) handle.get()) {
        names.add(entry.getFileName().toString());
      }
    }

    Assertions.assertEquals(List.of(), names);
  }

  @Test
  public void handleIsReleasedWhenBodyThrows() {

    var handles = new ArrayList<NodeHandle<?>>();

    Assertions.assertThrows(IllegalStateException.class, () -> {
      try (var handle = _accessor.open(List.of("blob.bin"))) {
        handles.add(handle);
        throw new IllegalStateException("boom");
      }
    });

    Assertions.assertTrue(handles.get(0).isClosed());
  }

  @Test
  public void missingRootDoesNotExist() {

    var accessor = new FilesystemAccessor(_root.resolve("absent"));

    Assertions.assertFalse(accessor.exists(List.of()));
    Assertions.assertFalse(accessor.exists(List.of("x")));
    Assertions.assertThrows(KeyMissingException.class, () -> accessor.resolve(List.of("x")));
  }

  @Test
  public void recordsReadTelemetry() {

    var statsRecorder = Mockito.mock(StatsRecorder.class);
    var accessor = new FilesystemAccessor(_root, Mockito.mock(Logger.class), statsRecorder);

    accessor.resolve(List.of("docs", "readme.txt"));

    Mockito.verify(statsRecorder).recordCounterIncrement(StatsRecorder.GROUP_TAGS, "resolve_attempts");
    Mockito.verify(statsRecorder).recordGauge(StatsRecorder.GROUP_TAGS, "read_bytes", 5);
  }
}
