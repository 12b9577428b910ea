package io.httpscript.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Script source split into lines, with offset to {@link Position} lookup.
 */
final class SourceText {

  private final String filename;
  private final String text;
  private final int[] lineStarts;
  private final List<Line> lines;

  SourceText(String filename, String text) {
    this.filename = filename;
    this.text = text;
    List<Line> collected = new ArrayList<>();
    int start = 0;
    int number = 1;
    while (true) {
      int newline = text.indexOf('\n', start);
      int end = newline < 0 ? text.length() : newline;
      collected.add(new Line(number++, start, end, text.substring(start, end)));
      if (newline < 0) {
        break;
      }
      start = newline + 1;
    }
    this.lines = List.copyOf(collected);
    this.lineStarts = collected.stream().mapToInt(Line::start).toArray();
  }

  String filename() {
    return filename;
  }

  String text() {
    return text;
  }

  List<Line> lines() {
    return lines;
  }

  String slice(int start, int end) {
    return text.substring(start, end);
  }

  Position position(int offset) {
    int index = Arrays.binarySearch(lineStarts, offset);
    if (index < 0) {
      index = -index - 2;
    }
    return new Position(index + 1, offset - lineStarts[index] + 1);
  }

  Selection selection(int start, int end) {
    return new Selection(filename, position(start), position(end));
  }

  Selection selection(Line line) {
    return selection(line.start(), line.end());
  }

  record Line(int number, int start, int end, String text) {

    boolean isBlank() {
      return text.isBlank();
    }

    boolean isComment() {
      String stripped = text.stripLeading();
      return stripped.startsWith("#") && !stripped.startsWith("###");
    }

    boolean isBlankOrComment() {
      return isBlank() || isComment();
    }

    /**
     * Offset of the first non-whitespace character, or the line end for blank lines.
     */
    int contentStart() {
      int i = 0;
      while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
        i++;
      }
      return start + i;
    }

    /**
     * Offset just after the last non-whitespace character.
     */
    int contentEnd() {
      int i = text.length();
      while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
        i--;
      }
      return start + i;
    }
  }
}
