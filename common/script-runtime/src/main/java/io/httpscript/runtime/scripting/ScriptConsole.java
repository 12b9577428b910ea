package io.httpscript.runtime.scripting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives {@code client.log} output.
 */
@FunctionalInterface
public interface ScriptConsole {

  String LOGGER_NAME = "httpscript.console";

  void log(String message);

  /**
   * Console writing through the {@value #LOGGER_NAME} logger at INFO.
   */
  static ScriptConsole logging() {
    Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
    return message -> logger.info("{}", message);
  }
}
