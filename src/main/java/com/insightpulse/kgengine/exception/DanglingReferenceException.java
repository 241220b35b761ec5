package com.insightpulse.kgengine.exception;

import lombok.Getter;

/**
 * An edge endpoint names a slug with no node while soft references are disabled.
 */
@Getter
public class DanglingReferenceException extends KnowledgeGraphException {

    private final String missingSlug;

    public DanglingReferenceException(String missingSlug) {
        super("Edge endpoint does not exist: " + missingSlug);
        this.missingSlug = missingSlug;
    }
}
