package io.httpscript.runtime.http;

/**
 * Performs one fully resolved HTTP exchange. Calls are blocking and never issued concurrently.
 */
public interface HttpClient {

  HttpResponse execute(ResolvedRequest request) throws TransportException;
}
