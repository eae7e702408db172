package com.familyledger.model;

import java.time.Instant;

public record Account(
    Long id,
    String username,
    String passwordHash,
    String displayName,
    Instant createdAt
) {}
