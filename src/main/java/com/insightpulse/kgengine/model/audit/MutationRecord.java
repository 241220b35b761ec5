package com.insightpulse.kgengine.model.audit;

import lombok.Builder;
import lombok.Value;

/**
 * A mutation outcome about to be appended to the log.
 */
@Value
@Builder
public class MutationRecord {

    MutationOperation operation;
    String target;
    String source;
    MutationStatus status;
    String errorMessage;
    Object payload; // serialized to JSON, may be null

    public static MutationRecord success(MutationOperation operation, String target, String source, Object payload) {
        return MutationRecord.builder()
                .operation(operation)
                .target(target)
                .source(source)
                .status(MutationStatus.SUCCESS)
                .payload(payload)
                .build();
    }

    public static MutationRecord failure(MutationOperation operation, String target, String source,
                                         Throwable error, Object payload) {
        return MutationRecord.builder()
                .operation(operation)
                .target(target)
                .source(source)
                .status(MutationStatus.FAILURE)
                .errorMessage(error.getClass().getSimpleName() + ": " + error.getMessage())
                .payload(payload)
                .build();
    }
}
