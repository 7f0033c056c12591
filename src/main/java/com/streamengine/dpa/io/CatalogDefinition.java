package com.streamengine.dpa.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a parameter catalog document.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogDefinition {
    private CatalogInfo catalog;

    /** Meta-information plus the parameter and stream tables. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CatalogInfo {
        private String name, version;
        private List<ParameterDef> parameters;
        private List<StreamDef> streams;
    }

    /** One parameter row. {@code type} is "quantity" or "function". */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ParameterDef {
        private int id;
        private String name, type, encoding, function, description;
        private List<Integer> inputs;
        private List<String> coefficients;
    }

    /** A stream and its parameter ids, in order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StreamDef {
        private String name;
        private List<Integer> parameters;
    }
}
