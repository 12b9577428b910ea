package io.httpscript.runtime.http;

/**
 * The HTTP exchange could not be completed (connection, TLS or protocol failure).
 */
public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
