package io.httpscript.parser;

import io.httpscript.parser.SourceText.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code .http} request scripts.
 *
 * <p>A file is a sequence of sections separated by lines starting with {@code ###}; text after
 * the separator names the section. Each section has the shape:
 * <pre>
 * ### optional name
 * &#64;variable = value
 * &lt; {% pre-request script %}
 * POST https://host/path HTTP/1.1
 * Header-Name: value
 *
 * body
 *
 * &gt; {% response script %}
 * </pre>
 * Everything but the request line is optional, the method defaults to {@code GET}. Lines whose
 * first non-blank character is {@code #} are comments outside of bodies and handlers.
 * Placeholders {@code {{ ... }}} are recognised in targets, header values, bodies and variable
 * values.
 *
 * <p>Instances are stateless and can be shared.
 */
public final class HttpScriptParser {

  private static final String SEPARATOR = "###";
  private static final String PLACEHOLDER_OPEN = "{{";
  private static final String PLACEHOLDER_CLOSE = "}}";
  private static final String HANDLER_OPEN = "{%";
  private static final String HANDLER_CLOSE = "%}";

  private static final Pattern DECLARATION = Pattern.compile("@([A-Za-z_$][\\w.\\-]*)\\s*=\\s*(.*)");
  private static final Pattern METHOD_TOKEN = Pattern.compile("([A-Z]+)(\\s+|$)");
  private static final Pattern VERSION_SUFFIX = Pattern.compile("\\s+HTTP/\\d+(\\.\\d+)?\\s*$");
  private static final Pattern HEADER = Pattern.compile("([\\w!#$%&'*+.^`|~-]+)\\s*:(.*)");

  public ScriptFile parse(String filename, String source) {
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(source, "source");
    SourceText text = new SourceText(filename, source.replace("\r\n", "\n"));
    List<RequestScript> scripts = new ArrayList<>();
    for (Section section : sections(text)) {
      if (section.isEmpty()) {
        continue;
      }
      scripts.add(new SectionParser(text, section).parse());
    }
    return new ScriptFile(filename, scripts);
  }

  private static List<Section> sections(SourceText text) {
    List<Section> sections = new ArrayList<>();
    Line separator = null;
    List<Line> lines = new ArrayList<>();
    for (Line line : text.lines()) {
      if (line.text().startsWith(SEPARATOR)) {
        sections.add(new Section(separator, lines));
        separator = line;
        lines = new ArrayList<>();
      } else {
        lines.add(line);
      }
    }
    sections.add(new Section(separator, lines));
    return sections;
  }

  private record Section(Line separator, List<Line> lines) {

    boolean isEmpty() {
      return lines.stream().allMatch(Line::isBlankOrComment);
    }

    String name() {
      if (separator == null) {
        return null;
      }
      String name = separator.text().substring(SEPARATOR.length()).trim();
      return name.isEmpty() ? null : name;
    }
  }

  private static final class SectionParser {

    private final SourceText text;
    private final Section section;
    private final List<Line> lines;
    private int index;

    SectionParser(SourceText text, Section section) {
      this.text = text;
      this.section = section;
      this.lines = section.lines();
    }

    RequestScript parse() {
      List<VariableDeclaration> variables = declarations();
      skipBlankAndComments();
      Handler preRequestHandler = null;
      if (hasMore() && isHandlerStart(current(), '<')) {
        preRequestHandler = handler('<');
        skipBlankAndComments();
      }
      if (!hasMore()) {
        throw new ScriptParseException("Expected request line", endOfSection());
      }
      Line requestLine = current();
      RequestLine parsed = requestLine();
      List<Header> headers = headers();
      int requestEnd = lastConsumedEnd(requestLine);

      skipBlank();
      Value body = null;
      Handler handler = null;
      if (hasBodyContent()) {
        body = body();
        requestEnd = lastConsumedEnd(requestLine);
      }
      skipBlankAndComments();
      if (hasMore() && isHandlerStart(current(), '>')) {
        handler = handler('>');
        skipBlankAndComments();
      }
      if (hasMore()) {
        throw new ScriptParseException(
            handler == null ? "Unexpected content after request body" : "Unexpected content after response handler",
            text.selection(current()));
      }

      Request request = new Request(
          parsed.method(),
          parsed.target(),
          headers,
          body,
          text.selection(requestLine.contentStart(), requestEnd));
      return new RequestScript(section.name(), request, variables, preRequestHandler, handler, scriptSelection());
    }

    private List<VariableDeclaration> declarations() {
      List<VariableDeclaration> declarations = new ArrayList<>();
      while (true) {
        skipBlankAndComments();
        if (!hasMore() || !current().text().stripLeading().startsWith("@")) {
          return declarations;
        }
        Line line = current();
        int offset = line.contentStart();
        String content = text.slice(offset, line.contentEnd());
        Matcher matcher = DECLARATION.matcher(content);
        if (!matcher.matches()) {
          throw new ScriptParseException("Invalid variable declaration, expected '@name = value'", text.selection(line));
        }
        int valueStart = offset + matcher.start(2);
        Value value = value(valueStart, line.contentEnd());
        declarations.add(new VariableDeclaration(matcher.group(1), value, text.selection(offset, line.contentEnd())));
        index++;
      }
    }

    private RequestLine requestLine() {
      Line first = current();
      int lineStart = first.contentStart();
      int start = lineStart;
      Method method = Method.GET;
      Matcher token = METHOD_TOKEN.matcher(text.slice(lineStart, first.contentEnd()));
      if (token.lookingAt()) {
        String candidate = token.group(1);
        method = Method.fromToken(candidate).orElseThrow(() -> new ScriptParseException(
            "Unsupported HTTP method '" + candidate + "'", text.selection(lineStart, lineStart + candidate.length())));
        start += token.end();
        if (start >= first.contentEnd()) {
          throw new ScriptParseException("Expected request target after " + method, text.selection(first));
        }
      }
      index++;
      int end = first.contentEnd();
      while (hasMore() && isContinuation(current())) {
        end = current().contentEnd();
        index++;
      }
      Matcher version = VERSION_SUFFIX.matcher(text.slice(start, end));
      if (version.find()) {
        end = start + version.start();
      }
      if (end <= start) {
        throw new ScriptParseException("Expected request target", text.selection(first));
      }
      return new RequestLine(method, value(start, end));
    }

    private static boolean isContinuation(Line line) {
      return !line.isBlank() && Character.isWhitespace(line.text().charAt(0)) && !line.isComment();
    }

    private List<Header> headers() {
      List<Header> headers = new ArrayList<>();
      while (hasMore()) {
        Line line = current();
        if (line.isBlank() || isHandlerStart(line, '>')) {
          break;
        }
        if (line.isComment()) {
          index++;
          continue;
        }
        int offset = line.contentStart();
        Matcher matcher = HEADER.matcher(text.slice(offset, line.contentEnd()));
        if (!matcher.matches()) {
          throw new ScriptParseException(
              "Invalid header, expected 'Name: value' (a body must be preceded by an empty line)",
              text.selection(line));
        }
        int valueStart = offset + matcher.start(2);
        while (valueStart < line.contentEnd() && Character.isWhitespace(text.text().charAt(valueStart))) {
          valueStart++;
        }
        Value value = value(valueStart, line.contentEnd());
        headers.add(new Header(matcher.group(1), value, text.selection(offset, line.contentEnd())));
        index++;
      }
      return headers;
    }

    private Value body() {
      int first = index;
      int last = first;
      while (hasMore() && !isHandlerStart(current(), '>')) {
        if (!current().isBlankOrComment()) {
          last = index;
        }
        index++;
      }
      index = last + 1;
      return value(lines.get(first).start(), lines.get(last).contentEnd());
    }

    private Handler handler(char marker) {
      Line line = current();
      int markerOffset = line.contentStart();
      int open = text.text().indexOf(HANDLER_OPEN, markerOffset);
      int close = text.text().indexOf(HANDLER_CLOSE, open + HANDLER_OPEN.length());
      int sectionEnd = lines.get(lines.size() - 1).end();
      if (close < 0 || close >= sectionEnd) {
        String kind = marker == '<' ? "pre-request" : "response";
        throw new ScriptParseException("Unterminated " + kind + " handler, expected '" + HANDLER_CLOSE + "'",
            text.selection(markerOffset, sectionEnd));
      }
      int end = close + HANDLER_CLOSE.length();
      while (hasMore() && current().end() < end) {
        index++;
      }
      Line closing = current();
      if (!text.slice(end, closing.end()).isBlank()) {
        throw new ScriptParseException("Unexpected content after '" + HANDLER_CLOSE + "'",
            text.selection(end, closing.end()));
      }
      index++;
      String script = text.slice(open + HANDLER_OPEN.length(), close).trim();
      return new Handler(script, text.selection(markerOffset, end));
    }

    private static boolean isHandlerStart(Line line, char marker) {
      String content = line.text().stripLeading();
      return content.length() > 1
          && content.charAt(0) == marker
          && content.substring(1).stripLeading().startsWith(HANDLER_OPEN);
    }

    private Value value(int start, int end) {
      String raw = text.slice(start, end);
      List<InlineScript> scripts = new ArrayList<>();
      int from = 0;
      while (true) {
        int open = raw.indexOf(PLACEHOLDER_OPEN, from);
        if (open < 0) {
          break;
        }
        int close = raw.indexOf(PLACEHOLDER_CLOSE, open + PLACEHOLDER_OPEN.length());
        if (close < 0) {
          break;
        }
        int after = close + PLACEHOLDER_CLOSE.length();
        scripts.add(new InlineScript(
            raw.substring(open + PLACEHOLDER_OPEN.length(), close).trim(),
            raw.substring(open, after),
            text.selection(start + open, start + after)));
        from = after;
      }
      return Value.of(raw, scripts, text.selection(start, end));
    }

    private void skipBlank() {
      while (hasMore() && current().isBlank()) {
        index++;
      }
    }

    private boolean hasBodyContent() {
      for (int i = index; i < lines.size() && !isHandlerStart(lines.get(i), '>'); i++) {
        if (!lines.get(i).isBlankOrComment()) {
          return true;
        }
      }
      return false;
    }

    private void skipBlankAndComments() {
      while (hasMore() && current().isBlankOrComment()) {
        index++;
      }
    }

    private int lastConsumedEnd(Line fallback) {
      for (int i = index - 1; i >= 0; i--) {
        Line line = lines.get(i);
        if (!line.isBlankOrComment()) {
          return line.contentEnd();
        }
      }
      return fallback.contentEnd();
    }

    private boolean hasMore() {
      return index < lines.size();
    }

    private Line current() {
      return lines.get(index);
    }

    private Selection endOfSection() {
      Line last = lines.isEmpty() ? section.separator() : lines.get(lines.size() - 1);
      return text.selection(last.end(), last.end());
    }

    private Selection scriptSelection() {
      Line first = section.separator();
      if (first == null) {
        first = lines.stream().filter(line -> !line.isBlankOrComment()).findFirst().orElseThrow();
      }
      Line last = first;
      for (Line line : lines) {
        if (!line.isBlankOrComment()) {
          last = line;
        }
      }
      return text.selection(first.start(), last.contentEnd());
    }
  }

  private record RequestLine(Method method, Value target) {
  }
}
