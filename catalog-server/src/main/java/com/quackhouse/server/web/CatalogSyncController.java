package com.quackhouse.server.web;

import com.quackhouse.auth.Action;
import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.auth.Decision;
import com.quackhouse.auth.Principal;
import com.quackhouse.exception.AuthorizationDeniedException;
import com.quackhouse.runtime.EngineSession;
import com.quackhouse.sync.SyncReport;
import com.quackhouse.sync.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin trigger for a catalog synchronization pass.
 */
@RestController
@RequestMapping("/api/catalog")
public class CatalogSyncController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSyncController.class);

    private final EngineSession session;
    private final AuthorizationPolicy policy;

    public CatalogSyncController(EngineSession session, AuthorizationPolicy policy) {
        this.session = session;
        this.policy = policy;
    }

    public record SyncResponse(String status, long bound, long failed, long pruned) {}

    @PostMapping("/sync")
    public SyncResponse sync(@RequestAttribute(IdentityFilter.PRINCIPAL_ATTRIBUTE) Principal principal) {
        Decision decision = policy.authorize(principal, Action.SYNC_CATALOG, null);
        if (decision.denied()) {
            throw AuthorizationDeniedException.from(decision);
        }

        SyncReport report = session.synchronize();
        logger.info("Synchronization requested by {}: {}", principal, report.summary());
        for (SyncStatus status : report.statuses()) {
            logger.info("  {} -> {}", status.name(), status.describe());
        }
        return new SyncResponse("success", report.bound(), report.failed(), report.pruned());
    }
}
