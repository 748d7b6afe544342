package com.delta.synctracker.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SyncAlreadyRunningException extends RuntimeException {
    public SyncAlreadyRunningException(String provider) {
        super("A sync cycle is already running for " + provider);
    }
}
