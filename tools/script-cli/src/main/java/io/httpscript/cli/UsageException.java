package io.httpscript.cli;

/**
 * Exception thrown when command-line input cannot be used.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
