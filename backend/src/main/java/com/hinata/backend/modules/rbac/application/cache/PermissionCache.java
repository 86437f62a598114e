package com.hinata.backend.modules.rbac.application.cache;

import java.util.concurrent.atomic.AtomicReference;

import com.hinata.backend.global.error.InternalServerException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Process-wide cache of role grants.
 *
 * <p>Readers take the current {@link PermissionSnapshot} without locking. A refresh builds a complete new
 * snapshot and publishes it with a single reference swap, so a reader sees either the old or the new state.
 * A failed build leaves the previous snapshot in place.
 *
 * <p>Each process keeps its own copy. Running several instances needs an external invalidation signal.
 */
@Component
public class PermissionCache {

    private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

    private final PermissionCacheLoader loader;
    private final AtomicReference<PermissionSnapshot> current = new AtomicReference<>(PermissionSnapshot.empty());

    public PermissionCache(PermissionCacheLoader loader) {
        this.loader = loader;
    }

    /**
     * Builds a snapshot from the database without publishing it.
     */
    public PermissionSnapshot build() {
        return loader.load();
    }

    public PermissionSnapshot snapshot() {
        return current.get();
    }

    public RoleEntry get(String scopeKey, String roleName) {
        return current.get().get(scopeKey, roleName);
    }

    public PermissionSnapshot refresh() {
        PermissionSnapshot next;
        try {
            next = build();
        } catch (RuntimeException ex) {
            log.error("Permission cache rebuild failed, keeping previous snapshot", ex);
            throw new InternalServerException("PERMISSION_CACHE_REFRESH_FAILED", "Permission cache could not be rebuilt", ex);
        }
        current.set(next);
        log.info("Permission cache refreshed: roles={}, fallback={}", next.roleCount(), next.isFallback());
        return next;
    }

    /**
     * Refreshes once the surrounding transaction commits, or right away when there is none.
     * The hook runs on the committing thread, so the caller's mutation returns only after the new snapshot is live.
     */
    public void refreshAfterCommit() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            refresh();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                refresh();
            }
        });
    }

    public void clear() {
        current.set(PermissionSnapshot.empty());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            refresh();
        } catch (InternalServerException ex) {
            log.warn("Permission cache warm-up failed; requests needing RBAC are denied until the next refresh");
        }
    }
}
