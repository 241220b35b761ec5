package com.insightpulse.kgengine.model.audit;

public enum MutationStatus {
    SUCCESS,
    FAILURE
}
