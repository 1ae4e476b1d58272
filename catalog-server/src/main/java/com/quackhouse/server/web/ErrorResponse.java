package com.quackhouse.server.web;

/**
 * Body of every non-2xx response that is not a query result.
 */
public record ErrorResponse(String error) {
}
