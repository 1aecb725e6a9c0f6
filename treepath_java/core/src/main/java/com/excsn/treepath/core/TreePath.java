package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.EmptyPathException;
import com.excsn.treepath.core.exceptions.PathMismatchException;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable location inside a nested tree: an ordered list of segments plus the separator used to render and
 * parse it.
 *
 * A segment is either text or an integer index. Equality is type sensitive, so {@code TreePath.of(0)} and
 * {@code TreePath.of("0")} are different paths. Paths order by separator first and then lexicographically by
 * segment, integers sorting before text.
 *
 * Every operation that looks like a mutation returns a new instance.
 */
public final class TreePath implements Comparable<TreePath> {

  static final Comparator<Object> SEGMENT_ORDER = (left, right) -> {

    var rankOrder = Integer.compare(_rank(left), _rank(right));

    if (rankOrder != 0) {
      return rankOrder;
    }

    if (left instanceof Integer) {
      return ((Integer) left).compareTo((Integer) right);
    }

    return ((String) left).compareTo((String) right);
  };

  private static final Ordering<Iterable<Object>> PARTS_ORDER = Ordering.from(SEGMENT_ORDER).lexicographical();

  private final char _separator;
  private final ImmutableList<Object> _parts;
  private final String _rendered;

  private TreePath(char separator, ImmutableList<Object> parts) {
    _separator = separator;
    _parts = parts;
    _rendered = Joiner.on(separator).join(parts);
  }

  public static TreePath of(Object... segments) {
    return withSeparator(PathParser.DEFAULT_SEPARATOR, segments);
  }

  public static TreePath withSeparator(char separator, Object... segments) {
    return new TreePath(separator, PathParser.parseArgs(segments, separator));
  }

  public static TreePath parse(String input) {
    return parse(input, PathParser.DEFAULT_SEPARATOR);
  }

  public static TreePath parse(String input, char separator) {

    Preconditions.checkNotNull(input, "input is null");

    return new TreePath(separator, PathParser.parseArgs(List.of(input), separator));
  }

  public char separator() {
    return _separator;
  }

  public ImmutableList<Object> parts() {
    return _parts;
  }

  public int size() {
    return _parts.size();
  }

  public boolean isEmpty() {
    return _parts.isEmpty();
  }

  public TreePath join(Object... segments) {

    var joined = PathParser.parseArgs(segments, _separator);

    if (joined.isEmpty()) {
      return this;
    }

    return new TreePath(_separator, ImmutableList.builder().addAll(_parts).addAll(joined).build());
  }

  /**
   * Appends one already canonical part, used when walking children reported by an accessor.
   */
  TreePath child(Object part) {
    return new TreePath(_separator, ImmutableList.builder().addAll(_parts).add(part).build());
  }

  /**
   * @throws EmptyPathException if there is nothing left to drop
   */
  public TreePath parent() {

    if (_parts.isEmpty()) {
      throw new EmptyPathException("parent()");
    }

    return new TreePath(_separator, _parts.subList(0, _parts.size() - 1));
  }

  /**
   * @return every ancestor, nearest first, ending with the empty path
   */
  public List<TreePath> parents() {

    var parents = new ArrayList<TreePath>(_parts.size());

    for (var end = _parts.size() - 1; end >= 0; end--) {
      parents.add(new TreePath(_separator, _parts.subList(0, end)));
    }

    return parents;
  }

  public boolean isRelativeTo(TreePath base) {

    if (base == null || base._separator != _separator || base._parts.size() > _parts.size()) {
      return false;
    }

    return _parts.subList(0, base._parts.size()).equals(base._parts);
  }

  public TreePath relativeTo(TreePath base) {

    Preconditions.checkNotNull(base, "base is null");

    if (!isRelativeTo(base)) {
      throw new PathMismatchException(toString(), base.toString());
    }

    return new TreePath(_separator, _parts.subList(base._parts.size(), _parts.size()));
  }

  /**
   * @return last segment as text, or an empty string for the empty path
   */
  public String name() {
    return _parts.isEmpty() ? "" : String.valueOf(_parts.get(_parts.size() - 1));
  }

  public String suffix() {
    return _splitSuffix(name())[1];
  }

  public String stem() {
    return _splitSuffix(name())[0];
  }

  public List<String> suffixes() {

    var name = name();

    if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
      return List.of();
    }

    if (name.startsWith(".")) {
      var rest = name.substring(1);

      if (!rest.contains(".")) {
        return List.of();
      }
      name = rest;
    }

    var tokens = Splitter.on('.').splitToList(name);
    var suffixes = new ArrayList<String>(tokens.size());

    for (var token : tokens.subList(1, tokens.size())) {
      suffixes.add("." + token);
    }

    return suffixes;
  }

  public TreePath withName(String name) {

    if (_parts.isEmpty()) {
      throw new EmptyPathException("withName()");
    }

    Preconditions.checkArgument(name != null && !name.isEmpty(), "name must be non-empty");
    Preconditions.checkArgument(name.indexOf(_separator) < 0, "name must not contain path separator");

    return new TreePath(_separator, ImmutableList.builder()
      .addAll(_parts.subList(0, _parts.size() - 1))
      .add(name)
      .build());
  }

  public TreePath withSuffix(String suffix) {

    if (_parts.isEmpty()) {
      throw new EmptyPathException("withSuffix()");
    }

    Preconditions.checkArgument(suffix != null, "suffix is null");
    Preconditions.checkArgument(suffix.isEmpty() || suffix.startsWith("."),
      "Invalid suffix `%s`; must start with '.'", suffix);

    var name = name();
    Preconditions.checkArgument(!".".equals(name) && !"..".equals(name), "Invalid name `%s` for withSuffix()", name);

    return withName(stem() + suffix);
  }

  /**
   * @return the parts joined with {@code /} regardless of this path's separator
   */
  public String asPosix() {
    return Joiner.on('/').join(_parts);
  }

  @Override
  public String toString() {
    return _rendered;
  }

  @Override
  public boolean equals(Object other) {

    if (this == other) {
      return true;
    }

    if (!(other instanceof TreePath)) {
      return false;
    }

    var otherPath = (TreePath) other;

    return _separator == otherPath._separator && _parts.equals(otherPath._parts);
  }

  @Override
  public int hashCode() {
    return 31 * Character.hashCode(_separator) + _parts.hashCode();
  }

  @Override
  public int compareTo(TreePath other) {

    return ComparisonChain.start()
      .compare(_separator, other._separator)
      .compare(_parts, other._parts, PARTS_ORDER)
      .result();
  }

  private static int _rank(Object segment) {
    return segment instanceof Integer ? 0 : 1;
  }

  private static String[] _splitSuffix(String name) {

    var dot = name.lastIndexOf('.');

    if (dot <= 0) {
      return new String[] {name, ""};
    }

    return new String[] {name.substring(0, dot), name.substring(dot)};
  }
}
