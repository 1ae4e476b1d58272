package com.quackhouse.server.web;

import com.quackhouse.auth.Principal;
import com.quackhouse.catalog.CatalogService;
import com.quackhouse.catalog.NewTable;
import com.quackhouse.catalog.TableEntry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Registry CRUD. Registered tables become queryable after the next synchronization.
 */
@RestController
@RequestMapping("/api/tables")
public class TableController {

    private final CatalogService catalog;

    public TableController(CatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<TableEntry> list(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
                                 @RequestParam(name = "database", required = false) String database) {
        return catalog.list(principal, database);
    }

    @GetMapping("/{id}")
    public TableEntry get(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
                          @PathVariable("id") long id) {
        return catalog.get(principal, id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TableEntry create(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
                             @RequestBody NewTable table) {
        return catalog.create(principal, table);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal,
                                      @PathVariable("id") long id,
                                      @RequestParam(name = "drop_data", defaultValue = "false") boolean dropData) {
        catalog.delete(principal, id, dropData);
        return Map.of("message", "Table deleted");
    }
}
