package com.familyledger.model;

/**
 * The authenticated caller on whose behalf an engine operation runs. Every query and mutation
 * is scoped to {@code accountId}; {@code author} is recorded on revisions.
 */
public record AccountContext(long accountId, String author) {}
