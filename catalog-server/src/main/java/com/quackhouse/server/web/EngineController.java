package com.quackhouse.server.web;

import com.quackhouse.auth.Principal;
import com.quackhouse.catalog.SchemaField;
import com.quackhouse.exec.EngineIntrospector;
import com.quackhouse.exec.EngineTable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * What the engine currently has bound.
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    private final EngineIntrospector introspector;

    public EngineController(EngineIntrospector introspector) {
        this.introspector = introspector;
    }

    public record TablesResponse(List<EngineTable> tables) {}

    public record SchemaResponse(String table, List<SchemaField> schema) {}

    @GetMapping("/tables")
    public TablesResponse tables(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal) {
        return new TablesResponse(introspector.listTables(principal));
    }

    @GetMapping("/schema/{table}")
    public SchemaResponse schema(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
                                 @PathVariable("table") String table) {
        return new SchemaResponse(table, introspector.describe(principal, table));
    }
}
