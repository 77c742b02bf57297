package com.harvest.coordinator.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveJobException extends RuntimeException {
    public ActiveJobException(String message) {
        super(message);
    }
}
