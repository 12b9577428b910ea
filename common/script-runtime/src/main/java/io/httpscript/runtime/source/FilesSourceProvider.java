package io.httpscript.runtime.source;

import io.httpscript.parser.HttpScriptParser;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Concatenation of several files, in the order given.
 */
public final class FilesSourceProvider implements SourceProvider {

  private final List<SourceProvider> providers;

  public FilesSourceProvider(List<? extends SourceProvider> providers) {
    this.providers = List.copyOf(providers);
  }

  /**
   * Parses every entry of the form {@code path} or {@code path#n}, where {@code n} selects one
   * 1-based request of the file.
   *
   * @throws IllegalArgumentException when a request selector is not a positive number
   */
  public static FilesSourceProvider fromList(HttpScriptParser parser, List<String> entries) {
    List<SourceProvider> providers = new ArrayList<>();
    for (String entry : entries) {
      int hash = entry.lastIndexOf('#');
      if (hash < 0) {
        providers.add(new FileSourceProvider(parser, Path.of(entry), null));
        continue;
      }
      String selector = entry.substring(hash + 1);
      int index;
      try {
        index = Integer.parseInt(selector);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid request selector '" + selector + "' in " + entry, ex);
      }
      if (index < 1) {
        throw new IllegalArgumentException("Request selector must be 1 or greater in " + entry);
      }
      providers.add(new FileSourceProvider(parser, Path.of(entry.substring(0, hash)), index));
    }
    return new FilesSourceProvider(providers);
  }

  @Override
  public List<SourceItem> requestScripts() {
    List<SourceItem> items = new ArrayList<>();
    providers.forEach(provider -> items.addAll(provider.requestScripts()));
    return items;
  }
}
