package com.picfactory.orchestrator.service;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
