package com.delta.synctracker.sync.api;

import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.JobPage;
import com.delta.synctracker.sync.model.JobStats;
import com.delta.synctracker.sync.model.JobStatus;
import com.delta.synctracker.sync.service.AdminJobService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/admin/jobs")
public class AdminJobController {
    private final AdminJobService jobService;

    public AdminJobController(AdminJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    public JobPage listJobs(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "jobType", required = false) String jobType,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "pageSize", required = false) Integer pageSize
    ) {
        return jobService.list(parseStatus(status), jobType, page, pageSize);
    }

    @GetMapping("/stats")
    public JobStats stats() {
        return jobService.getStats();
    }

    @GetMapping("/{id}")
    public BackgroundJob getJob(@PathVariable("id") UUID id) {
        return jobService.getById(id);
    }

    @PostMapping("/{id}/retry")
    public BackgroundJob retry(@PathVariable("id") UUID id) {
        return jobService.retry(id);
    }

    @PostMapping("/{id}/cancel")
    public BackgroundJob cancel(@PathVariable("id") UUID id) {
        return jobService.cancel(id);
    }

    private JobStatus parseStatus(String raw) {
        try {
            return JobStatus.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unknown job status: " + raw);
        }
    }
}
