package com.delta.synctracker.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class QuotaExhaustedException extends RuntimeException {
    private final String category;

    public QuotaExhaustedException(String category, String message) {
        super(message);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
