package com.drinkjoy.catalog.infrastructure.web;

import com.drinkjoy.catalog.application.CatalogMonitoring;
import com.drinkjoy.catalog.application.CatalogSyncControl;
import com.drinkjoy.catalog.application.SyncResult;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.infrastructure.cache.ExpiringCache;
import com.drinkjoy.catalog.infrastructure.cache.VenueMenuCache;
import com.drinkjoy.catalog.infrastructure.web.dto.AdminStatusResponse;
import com.drinkjoy.catalog.infrastructure.web.dto.OperationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin/catalog")
public class CatalogAdminController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogAdminController.class);

    private final CatalogSyncControl syncControl;
    private final CatalogMonitoring monitoring;
    private final ExpiringCache<String, List<CatalogItem>> catalogCache;
    private final VenueMenuCache venueMenuCache;

    public CatalogAdminController(CatalogSyncControl syncControl,
                                  CatalogMonitoring monitoring,
                                  ExpiringCache<String, List<CatalogItem>> catalogCache,
                                  VenueMenuCache venueMenuCache) {
        this.syncControl = syncControl;
        this.monitoring = monitoring;
        this.catalogCache = catalogCache;
        this.venueMenuCache = venueMenuCache;
    }

    @GetMapping("/status")
    public ResponseEntity<AdminStatusResponse> status() {
        try {
            var report = monitoring.report();
            return ResponseEntity.ok(AdminStatusResponse.from(report, catalogCache.getStats(), venueMenuCache.stats()));
        } catch (Exception e) {
            logger.error("Error building catalog status", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResult> sync() {
        logger.info("Manual catalog sync triggered");
        try {
            SyncResult result = syncControl.performManualSync();
            return result.success()
                    ? ResponseEntity.ok(result)
                    : ResponseEntity.badRequest().body(result);
        } catch (Exception e) {
            logger.error("Error running manual sync", e);
            return ResponseEntity.internalServerError().body(SyncResult.failed(e.getMessage()));
        }
    }

    @DeleteMapping("/cache")
    public ResponseEntity<OperationResponse> clearCache(@RequestParam(value = "venueId", required = false) String venueId) {
        try {
            if (venueId != null && !venueId.isBlank()) {
                venueMenuCache.invalidate(venueId);
                return ResponseEntity.ok(OperationResponse.ok("Cleared menu cache for venue " + venueId));
            }
            catalogCache.clear();
            logger.info("Catalog cache cleared by operator");
            return ResponseEntity.ok(OperationResponse.ok("Cleared catalog cache"));
        } catch (Exception e) {
            logger.error("Error clearing cache", e);
            return ResponseEntity.internalServerError().body(OperationResponse.failure("Failed to clear cache"));
        }
    }

    @PostMapping("/polling/start")
    public ResponseEntity<OperationResponse> startPolling() {
        syncControl.start();
        if (!syncControl.isRunning()) {
            return ResponseEntity.badRequest()
                    .body(OperationResponse.failure("Catalog sync could not be started, check configuration"));
        }
        return ResponseEntity.ok(OperationResponse.ok("Catalog sync started", syncControl.getStatus()));
    }

    @PostMapping("/polling/stop")
    public ResponseEntity<OperationResponse> stopPolling() {
        syncControl.stop();
        return ResponseEntity.ok(OperationResponse.ok("Catalog sync stopped", syncControl.getStatus()));
    }
}
