package com.delta.synctracker.sync.api;

import com.delta.synctracker.sync.jobs.JobWorkerService;
import com.delta.synctracker.sync.model.JobWorkerStatus;
import com.delta.synctracker.sync.model.QuotaUsage;
import com.delta.synctracker.sync.model.SyncWorkerStatus;
import com.delta.synctracker.sync.service.QuotaGuard;
import com.delta.synctracker.sync.service.SyncWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminWorkerController {
    private final SyncWorkerService syncWorkerService;
    private final JobWorkerService jobWorkerService;
    private final QuotaGuard quotaGuard;

    public AdminWorkerController(
        SyncWorkerService syncWorkerService,
        JobWorkerService jobWorkerService,
        QuotaGuard quotaGuard
    ) {
        this.syncWorkerService = syncWorkerService;
        this.jobWorkerService = jobWorkerService;
        this.quotaGuard = quotaGuard;
    }

    @GetMapping("/workers")
    public List<SyncWorkerStatus> workers() {
        return syncWorkerService.getWorkerStatuses();
    }

    @GetMapping("/quotas")
    public List<QuotaUsage> quotas() {
        return quotaGuard.getAllUsage();
    }

    @PostMapping("/job-worker/start")
    public JobWorkerStatus startJobWorker() {
        jobWorkerService.start();
        return jobWorkerService.getStatus();
    }

    @PostMapping("/job-worker/stop")
    public JobWorkerStatus stopJobWorker() {
        jobWorkerService.stop();
        return jobWorkerService.getStatus();
    }

    @GetMapping("/job-worker/status")
    public JobWorkerStatus jobWorkerStatus() {
        return jobWorkerService.getStatus();
    }
}
