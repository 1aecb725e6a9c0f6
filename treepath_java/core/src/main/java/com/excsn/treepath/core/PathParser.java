package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.MalformedSegmentException;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Turns loosely typed constructor arguments into canonical path parts.
 *
 * Accepted arguments are text, integers, ASCII bytes, {@link Path} and {@link TreePath}. Text is split on the
 * separator; empty tokens, {@code "."} and {@code null} are dropped. Integers are kept as integers and text is
 * never coerced into one.
 */
public final class PathParser {

  public static final char DEFAULT_SEPARATOR = '/';
  static final String CURRENT = ".";

  private PathParser() {}

  public static ImmutableList<Object> parseArgs(List<?> args, char separator) {

    checkSeparator(separator);

    var splitter = Splitter.on(separator).omitEmptyStrings();
    var parts = ImmutableList.<Object>builder();

    for (var arg : args) {
      _appendArg(arg, splitter, parts);
    }

    return parts.build();
  }

  public static ImmutableList<Object> parseArgs(Object[] args, char separator) {
    return parseArgs(Arrays.asList(args), separator);
  }

  public static void checkSeparator(char separator) {

    if (Character.isWhitespace(separator) || Character.isISOControl(separator)) {
      throw new MalformedSegmentException("Separator must be a visible character");
    }
  }

  /**
   * @return true if the value can be stored as a part as-is
   */
  public static boolean isSegment(Object value) {
    return value instanceof String || value instanceof Integer;
  }

  private static void _appendArg(Object arg, Splitter splitter, ImmutableList.Builder<Object> parts) {

    if (arg == null) {
      return;
    }

    if (arg instanceof TreePath) {

      // Re-split text parts so a path built with another separator still honours ours.
      for (var part : ((TreePath) arg).parts()) {
        _appendArg(part, splitter, parts);
      }
      return;
    }

    if (arg instanceof Path) {

      for (var name : (Path) arg) {
        _appendText(name.toString(), splitter, parts);
      }
      return;
    }

    if (arg instanceof byte[]) {
      _appendText(new String((byte[]) arg, StandardCharsets.US_ASCII), splitter, parts);
      return;
    }

    if (arg instanceof Integer) {
      parts.add(arg);
      return;
    }

    if (arg instanceof String) {
      _appendText((String) arg, splitter, parts);
      return;
    }

    throw new MalformedSegmentException(
      "Segment must be text, integer, bytes, java.nio.file.Path or TreePath; got " + arg.getClass().getName());
  }

  private static void _appendText(String text, Splitter splitter, ImmutableList.Builder<Object> parts) {

    for (var token : splitter.split(text)) {
      if (!CURRENT.equals(token)) {
        parts.add(token);
      }
    }
  }
}
