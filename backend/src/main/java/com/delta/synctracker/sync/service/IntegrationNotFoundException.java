package com.delta.synctracker.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class IntegrationNotFoundException extends RuntimeException {
    public IntegrationNotFoundException(String integrationName) {
        super("Unknown integration: " + integrationName);
    }
}
