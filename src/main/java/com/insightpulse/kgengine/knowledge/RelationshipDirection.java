package com.insightpulse.kgengine.knowledge;

/**
 * Relationship traversal direction relative to the node being expanded.
 * OUTGOING follows src to dst, INCOMING follows dst to src, BOTH follows either.
 */
public enum RelationshipDirection {
    INCOMING,
    OUTGOING,
    BOTH
}
