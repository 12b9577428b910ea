package io.httpscript.runtime;

/**
 * Fatal failure while executing a request; the message names the request and the phase.
 */
public class RequestExecutionException extends RuntimeException {

  private final String request;

  public RequestExecutionException(String request, String message, Throwable cause) {
    super(message + " for request [" + request + "]: " + cause.getMessage(), cause);
    this.request = request;
  }

  public String request() {
    return request;
  }
}
