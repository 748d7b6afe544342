package com.delta.synctracker.sync.jobs;

import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.EnqueueOptions;
import com.delta.synctracker.sync.persistence.BackgroundJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Dispatcher backed by the {@code background_jobs} table. Pending rows are the queue; workers
 * find them by scanning, and {@link #dispatch} only nudges an idle worker.
 */
@Service
public class TableJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TableJobDispatcher.class);

    private final BackgroundJobRepository repository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TableJobDispatcher(
        BackgroundJobRepository repository,
        ObjectMapper objectMapper,
        ApplicationEventPublisher eventPublisher,
        Clock clock
    ) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public UUID enqueue(String jobType, Object payload, EnqueueOptions options) {
        BackgroundJob job = BackgroundJob.pending(
            UUID.randomUUID(),
            jobType,
            serializePayload(payload),
            clock.instant(),
            options
        );
        repository.insert(job);
        log.info("Enqueued job {} of type {}", job.id(), job.jobType());
        dispatch(job);
        return job.id();
    }

    @Override
    public void dispatch(BackgroundJob job) {
        eventPublisher.publishEvent(new JobDispatchedEvent(job.id(), job.jobType()));
    }

    private String serializePayload(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof String raw) {
            return raw;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload could not be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
