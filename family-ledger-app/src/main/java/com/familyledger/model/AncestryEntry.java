package com.familyledger.model;

/** A person reached by an ancestor or descendant walk; generation 1 is parents or children. */
public record AncestryEntry(Person person, int generation) {}
