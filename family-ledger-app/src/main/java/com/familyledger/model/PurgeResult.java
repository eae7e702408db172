package com.familyledger.model;

import java.util.List;

/** Everything physically removed by one hard purge, dependents first and the target last. */
public record PurgeResult(EntityRef target, List<EntityRef> removed) {}
