package com.delta.synctracker.sync.model;

import java.util.List;

public record JobPage(
    List<JobSummary> items,
    long totalCount,
    int page,
    int pageSize,
    int totalPages
) {
    public static JobPage of(List<JobSummary> items, long totalCount, int page, int pageSize) {
        int totalPages = (int) Math.ceil(totalCount / (double) Math.max(1, pageSize));
        return new JobPage(items, totalCount, page, pageSize, totalPages);
    }
}
