package com.familyledger.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

public enum Privacy {
    PUBLIC,
    PRIVATE,
    RESTRICTED;

    public String value() {
        return name().toLowerCase();
    }

    public static Set<String> allValues() {
        return Arrays.stream(values()).map(Privacy::value).collect(Collectors.toSet());
    }
}
