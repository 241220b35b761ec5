package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class NodeNotFoundException extends NotFoundException {

    private final String slug;

    public NodeNotFoundException(String slug) {
        super("Node not found: " + slug);
        this.slug = slug;
    }
}
