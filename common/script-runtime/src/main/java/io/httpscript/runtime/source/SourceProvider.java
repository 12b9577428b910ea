package io.httpscript.runtime.source;

import java.util.List;

/**
 * Ordered request scripts of a run. Sources are parsed before the first item is handed out.
 */
public interface SourceProvider {

  List<SourceItem> requestScripts();
}
