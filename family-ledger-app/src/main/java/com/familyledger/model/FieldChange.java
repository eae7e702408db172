package com.familyledger.model;

/** Before and after values of one field in a revision diff, in their JSON form. */
public record FieldChange(Object before, Object after) {}
