package com.streamengine.dpa.catalog;

import java.util.List;
import java.util.Objects;

/** A named stream and the ordered ids of the parameters it carries. */
public record Stream(String name, List<Integer> parameterIds) {

    public Stream {
        Objects.requireNonNull(name, "name");
        parameterIds = parameterIds != null ? List.copyOf(parameterIds) : List.of();
    }
}
