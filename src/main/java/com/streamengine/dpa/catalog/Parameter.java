package com.streamengine.dpa.catalog;

import com.streamengine.dpa.api.FunctionArguments;

import java.util.List;
import java.util.Objects;

/**
 * A catalog parameter: one observed or derived quantity.
 *
 * Parameters form an arena addressed by integer id. Edges to direct inputs
 * are stored as ids, never as references, so the catalog holds no object
 * cycles even when the metadata itself is corrupt.
 *
 * @param id           catalog id, unique within a catalog
 * @param name         column name in the raw store for DATA parameters
 * @param kind         DATA or FUNCTION
 * @param encoding     nominal element encoding
 * @param inputs       ordered direct input ids; position i feeds argument
 *                     {@code p<i>} of the function
 * @param coefficients ordered direct calibration coefficient names
 * @param function     transformation function name, FUNCTION parameters only
 */
public record Parameter(int id, String name, ParameterKind kind, ValueEncoding encoding,
        List<Integer> inputs, List<String> coefficients, String function) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        encoding = encoding != null ? encoding : ValueEncoding.OPAQUE;
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        coefficients = coefficients != null ? List.copyOf(coefficients) : List.of();
        if (kind == ParameterKind.DATA && !inputs.isEmpty())
            throw new IllegalArgumentException("Data parameter " + id + " cannot declare inputs");
        for (String cc : coefficients) {
            if (FunctionArguments.isPositionalName(cc))
                throw new IllegalArgumentException("Parameter " + id + " declares reserved coefficient name " + cc);
        }
        if (kind == ParameterKind.FUNCTION && (function == null || function.isBlank()))
            throw new IllegalArgumentException("Function parameter " + id + " has no function name");
    }

    public static Parameter data(int id, String name, ValueEncoding encoding) {
        return new Parameter(id, name, ParameterKind.DATA, encoding, List.of(), List.of(), null);
    }

    public static Parameter function(int id, String name, ValueEncoding encoding, String function,
            List<Integer> inputs, List<String> coefficients) {
        return new Parameter(id, name, ParameterKind.FUNCTION, encoding, inputs, coefficients, function);
    }

    public boolean isData() {
        return kind == ParameterKind.DATA;
    }

    public boolean isFunction() {
        return kind == ParameterKind.FUNCTION;
    }

    @Override
    public String toString() {
        return "Parameter[" + id + " " + name + " " + kind + "]";
    }
}
