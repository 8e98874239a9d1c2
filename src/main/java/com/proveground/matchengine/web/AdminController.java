package com.proveground.matchengine.web;

import com.proveground.matchengine.service.EngineStatsService;
import com.proveground.matchengine.service.StalenessTracker;
import com.proveground.matchengine.service.TenantConfigService;
import com.proveground.matchengine.web.dto.EngineConfigResponse;
import com.proveground.matchengine.web.dto.EngineStatsResponse;
import com.proveground.matchengine.web.dto.RecomputeResponse;
import com.proveground.matchengine.web.dto.TenantConfigRequest;
import com.proveground.matchengine.web.dto.TenantConfigResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/match-engine/admin")
@Slf4j
@RequiredArgsConstructor
public class AdminController {

    private final EngineStatsService statsService;
    private final StalenessTracker stalenessTracker;
    private final TenantConfigService tenantConfigService;

    @GetMapping("/stats")
    public ResponseEntity<EngineStatsResponse> stats(@RequestParam(required = false) String tenantId) {
        return ResponseEntity.ok(statsService.getStats(tenantId));
    }

    /**
     * Queue every stale or expired pair at the lowest priority.
     */
    @PostMapping("/recompute")
    public ResponseEntity<RecomputeResponse> recompute(@RequestParam(required = false) String tenantId) {
        int queued = stalenessTracker.recomputeAll(tenantId);
        return ResponseEntity.ok(new RecomputeResponse(queued));
    }

    @GetMapping("/config")
    public ResponseEntity<EngineConfigResponse> config() {
        return ResponseEntity.ok(statsService.getConfig());
    }

    @GetMapping("/tenants/{tenantId}/config")
    public ResponseEntity<TenantConfigResponse> tenantConfig(@PathVariable String tenantId) {
        return ResponseEntity.ok(tenantConfigService.get(tenantId));
    }

    @PutMapping("/tenants/{tenantId}/config")
    public ResponseEntity<TenantConfigResponse> updateTenantConfig(@PathVariable String tenantId,
                                                                   @Valid @RequestBody TenantConfigRequest request) {
        log.info("Updating match settings of tenant {}", tenantId);
        return ResponseEntity.ok(tenantConfigService.update(tenantId, request));
    }
}
