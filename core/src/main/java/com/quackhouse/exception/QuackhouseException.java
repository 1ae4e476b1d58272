package com.quackhouse.exception;

/**
 * Base class for all errors raised by the catalog and query subsystem.
 *
 * <p>All subclasses are unchecked. Service methods throw them; the query
 * executor maps them onto a failed {@link com.quackhouse.exec.QueryResult}
 * and the HTTP layer maps them onto status codes.
 */
public class QuackhouseException extends RuntimeException {

    public QuackhouseException(String message) {
        super(message);
    }

    public QuackhouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
