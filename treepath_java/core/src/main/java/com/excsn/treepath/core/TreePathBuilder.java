package com.excsn.treepath.core;

import com.excsn.treepath.core.serializers.JsonTreeDeserializer;
import com.excsn.treepath.core.serializers.TreeDeserializer;
import com.excsn.treepath.core.serializers.YamlTreeDeserializer;
import com.excsn.treepath.core.telemetry.Logger;
import com.excsn.treepath.core.telemetry.StatsRecorder;
import com.google.common.base.Preconditions;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class TreePathBuilder {

  private char _separator = PathParser.DEFAULT_SEPARATOR;
  private Logger _logger = Logger.NOOP;
  private StatsRecorder _statsRecorder = StatsRecorder.NOOP;
  private boolean _cacheEnabled = true;
  private int _cacheMaxSize = LookupAccessor.DEFAULT_CACHE_MAX_SIZE;

  private TreePathBuilder() {}

  public static TreePathBuilder builder() {
    return new TreePathBuilder();
  }

  public TreePathBuilder setSeparator(char separator) {

    PathParser.checkSeparator(separator);

    _separator = separator;
    return this;
  }

  public TreePathBuilder setTelemetry(Logger logger, StatsRecorder statsRecorder) {

    if (logger == null || statsRecorder == null) {
      throw new IllegalArgumentException("logger and statsRecorder are required");
    }

    _logger = logger;
    _statsRecorder = statsRecorder;
    return this;
  }

  /**
   * @param cacheEnabled whether lookup accessors start with their cache on
   */
  public TreePathBuilder setCacheEnabled(boolean cacheEnabled) {
    _cacheEnabled = cacheEnabled;
    return this;
  }

  public TreePathBuilder setCacheMaxSize(int cacheMaxSize) {

    Preconditions.checkArgument(cacheMaxSize > 0, "cacheMaxSize must be positive, got %s", cacheMaxSize);

    _cacheMaxSize = cacheMaxSize;
    return this;
  }

  /**
   * @param tree nested maps and lists; treated as immutable from here on
   */
  public BoundPath<Object, Object> lookup(Object tree) {

    var accessor = new LookupAccessor(tree, _logger, _statsRecorder);

    if (!_cacheEnabled) {
      accessor.disableCache();
    } else if (_cacheMaxSize != LookupAccessor.DEFAULT_CACHE_MAX_SIZE) {
      accessor.enableCache(_cacheMaxSize);
    }

    return BoundPath.of(accessor, _separator);
  }

  public BoundPath<byte[], Closeable> filesystem(Path baseDirectory) {

    Preconditions.checkNotNull(baseDirectory, "baseDirectory is null");

    return BoundPath.of(new FilesystemAccessor(baseDirectory, _logger, _statsRecorder), _separator);
  }

  public BoundPath<Object, Object> yaml(String document) {
    return _load(new YamlTreeDeserializer(), document);
  }

  public BoundPath<Object, Object> json(String document) {
    return _load(JsonTreeDeserializer.create(), document);
  }

  public BoundPath<Object, Object> yamlFile(Path documentPath) {
    return yaml(_readDocument(documentPath));
  }

  public BoundPath<Object, Object> jsonFile(Path documentPath) {
    return json(_readDocument(documentPath));
  }

  private BoundPath<Object, Object> _load(TreeDeserializer<String> deserializer, String document) {

    Preconditions.checkNotNull(document, "document is null");

    return lookup(deserializer.deserialize(document));
  }

  private String _readDocument(Path documentPath) {

    try {
      return Files.readString(documentPath);
    } catch (IOException e) {
      _logger.error("Error while loading tree from `" + documentPath + "`", e);
      throw new UncheckedIOException(e);
    }
  }
}
