package io.httpscript.runtime.source;

import io.httpscript.parser.HttpScriptParser;
import io.httpscript.parser.ScriptFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request scripts of one {@code .http} file, optionally narrowed to a single 1-based request.
 */
public final class FileSourceProvider implements SourceProvider {

  private final ScriptFile file;
  private final Integer requestIndex;

  /**
   * Reads and parses the file immediately.
   *
   * @param requestIndex 1-based request to keep, or {@code null} for all requests
   * @throws io.httpscript.parser.ScriptParseException when the file does not parse
   * @throws UncheckedIOException                      when the file cannot be read
   */
  public FileSourceProvider(HttpScriptParser parser, Path path, Integer requestIndex) {
    Objects.requireNonNull(parser, "parser");
    Objects.requireNonNull(path, "path");
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read " + path, ex);
    }
    this.file = parser.parse(path.toString(), source);
    this.requestIndex = requestIndex;
    if (requestIndex != null) {
      file.requestScript(requestIndex);
    }
  }

  @Override
  public List<SourceItem> requestScripts() {
    if (requestIndex != null) {
      return List.of(new SourceItem(file.filename(), requestIndex - 1, file.requestScript(requestIndex)));
    }
    List<SourceItem> items = new ArrayList<>();
    for (int i = 0; i < file.requestScripts().size(); i++) {
      items.add(new SourceItem(file.filename(), i, file.requestScripts().get(i)));
    }
    return items;
  }
}
