package com.quackhouse.server.web;

import com.quackhouse.auth.Principal;
import com.quackhouse.exec.QueryErrorKind;
import com.quackhouse.exec.QueryExecutor;
import com.quackhouse.exec.QueryResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private final QueryExecutor executor;

    public QueryController(QueryExecutor executor) {
        this.executor = executor;
    }

    public record QueryRequest(String query) {}

    @PostMapping
    public ResponseEntity<QueryResult> execute(
            @RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
            @RequestBody(required = false) QueryRequest request) {
        QueryResult result = executor.execute(principal, request != null ? request.query() : null);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    static HttpStatus statusOf(QueryResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        QueryErrorKind kind = result.errorKind();
        return switch (kind) {
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case ENGINE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case EXECUTION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
