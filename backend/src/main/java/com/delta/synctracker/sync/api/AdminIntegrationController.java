package com.delta.synctracker.sync.api;

import com.delta.synctracker.sync.model.DataAvailability;
import com.delta.synctracker.sync.model.IntegrationStatus;
import com.delta.synctracker.sync.model.SyncCycleResult;
import com.delta.synctracker.sync.service.IntegrationHealthService;
import com.delta.synctracker.sync.service.SyncWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/admin/integrations")
public class AdminIntegrationController {
    private final IntegrationHealthService healthService;
    private final SyncWorkerService syncWorkerService;

    public AdminIntegrationController(IntegrationHealthService healthService, SyncWorkerService syncWorkerService) {
        this.healthService = healthService;
        this.syncWorkerService = syncWorkerService;
    }

    @GetMapping
    public List<IntegrationStatus> listIntegrations() {
        return healthService.getAllStatuses();
    }

    @GetMapping("/availability")
    public DataAvailability availability() {
        return healthService.getDataAvailability();
    }

    @GetMapping("/{type}")
    public IntegrationStatus getIntegration(@PathVariable("type") String type) {
        return healthService.getStatus(type);
    }

    @PostMapping("/{type}/disable")
    public IntegrationStatus disable(
        @PathVariable("type") String type,
        @RequestBody(required = false) DisableIntegrationRequest request,
        Principal principal
    ) {
        String reason = request == null ? null : request.reason();
        String actor = request == null ? null : request.actor();
        if ((actor == null || actor.isBlank()) && principal != null) {
            actor = principal.getName();
        }
        return healthService.disable(type, reason, actor);
    }

    @PostMapping("/{type}/enable")
    public IntegrationStatus enable(@PathVariable("type") String type) {
        return healthService.enable(type);
    }

    @PostMapping("/{type}/sync")
    public SyncCycleResult sync(@PathVariable("type") String type) {
        return syncWorkerService.triggerSync(type);
    }
}
