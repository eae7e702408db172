package com.familyledger.model;

/** A stored {@code parent} relationship: {@code parentId} is the parent of {@code childId}. */
public record ParentEdge(long relationshipId, long parentId, long childId) {}
