package com.delta.synctracker.sync.persistence;

import com.delta.synctracker.support.SyncTestConfig;
import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.EnqueueOptions;
import com.delta.synctracker.sync.model.JobStatus;
import com.delta.synctracker.sync.model.JobSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(SyncTestConfig.class)
@Transactional
class BackgroundJobRepositoryTest {
    private static final Instant BASE = Instant.parse("2030-01-01T00:00:00Z");

    @Autowired
    private BackgroundJobRepository repository;

    private UUID insert(String jobType, Instant createdAt, Instant scheduledAt) {
        BackgroundJob job = BackgroundJob.pending(
            UUID.randomUUID(),
            jobType,
            null,
            createdAt,
            new EnqueueOptions(scheduledAt, null, null)
        );
        repository.insert(job);
        return job.id();
    }

    @Test
    void pageIsNewestFirstAndFiltered() {
        UUID oldest = insert("paging-test", BASE, null);
        UUID middle = insert("paging-test", BASE.plusSeconds(60), null);
        UUID newest = insert("paging-test", BASE.plusSeconds(120), null);
        insert("other-type", BASE.plusSeconds(180), null);
        repository.markProcessing(middle, BASE.plusSeconds(200));

        List<JobSummary> firstPage = repository.findPage(null, "paging-test", 2, 0);
        assertThat(firstPage).extracting(JobSummary::id).containsExactly(newest, middle);
        List<JobSummary> secondPage = repository.findPage(null, "paging-test", 2, 2);
        assertThat(secondPage).extracting(JobSummary::id).containsExactly(oldest);

        assertEquals(3, repository.countJobs(null, "paging-test"));
        assertEquals(1, repository.countJobs(JobStatus.PROCESSING, "paging-test"));
        assertThat(repository.findPage(JobStatus.PENDING, "paging-test", 10, 0))
            .extracting(JobSummary::id)
            .containsExactly(newest, oldest);
    }

    @Test
    void compareAndSetTransitionsOnlyApplyFromExpectedState() {
        UUID id = insert("cas-test", BASE, null);

        assertFalse(repository.markCompleted(id, "done", BASE));
        assertFalse(repository.retry(id, BASE));
        assertTrue(repository.markProcessing(id, BASE));
        assertFalse(repository.markProcessing(id, BASE));
        assertTrue(repository.markCompleted(id, "done", BASE.plusSeconds(5)));
        assertFalse(repository.cancel(id, BASE));

        BackgroundJob job = repository.findById(id);
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("done", job.result());
        assertEquals(BASE, job.startedAt());
        assertEquals(BASE.plusSeconds(5), job.completedAt());
    }

    @Test
    void duePendingJobsRespectScheduledAt() {
        UUID due = insert("due-test", BASE, null);
        UUID later = insert("due-test", BASE.plusSeconds(1), BASE.plusSeconds(3600));

        List<UUID> dueIds = repository.findDuePendingIds(BASE.plusSeconds(10), 100);
        assertThat(dueIds).contains(due).doesNotContain(later);
        assertThat(repository.findDuePendingIds(BASE.plusSeconds(7200), 100)).contains(due, later);
    }

    @Test
    void missingJobIsNull() {
        assertNull(repository.findById(UUID.randomUUID()));
    }
}
