package io.httpscript.parser;

import java.util.List;
import java.util.Objects;

public record ScriptFile(String filename, List<RequestScript> requestScripts) {

  public ScriptFile {
    Objects.requireNonNull(filename, "filename");
    requestScripts = List.copyOf(requestScripts);
  }

  /**
   * Returns the request script at the given 1-based position.
   *
   * @throws IllegalArgumentException when the file has no request at that position
   */
  public RequestScript requestScript(int index) {
    if (index < 1 || index > requestScripts.size()) {
      throw new IllegalArgumentException(
          "Request #" + index + " not found in " + filename + " (" + requestScripts.size() + " requests)");
    }
    return requestScripts.get(index - 1);
  }
}
