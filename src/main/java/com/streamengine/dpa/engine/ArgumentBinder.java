package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.FunctionArguments;
import com.streamengine.dpa.api.MissingCoefficientException;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.instance.CalibrationCoefficient;
import com.streamengine.dpa.instance.FunctionParameterInstance;
import com.streamengine.dpa.instance.ParameterInstance;

import java.util.Map;
import java.util.Optional;

/**
 * Maps the resolved inputs of a function instance onto the argument names its
 * transformation function expects.
 *
 * The i-th declared input becomes {@code p<i>}, whether it is a data instance
 * or an already computed function instance. Declared coefficients are passed
 * through under their own names. Nothing is defaulted.
 */
public final class ArgumentBinder {

    /**
     * @param fp           the function instance to bind
     * @param instances    instances by id; iteration order is irrelevant
     * @param coefficients coefficients by name
     * @return the complete argument set, or empty if some input has no data
     *         yet
     * @throws MissingCoefficientException if a declared coefficient is not
     *                                     bound
     */
    public Optional<FunctionArguments> buildFuncMap(FunctionParameterInstance fp,
            Map<Integer, ? extends ParameterInstance> instances,
            Map<String, CalibrationCoefficient> coefficients) {
        Parameter p = fp.parameter();
        FunctionArguments.Builder args = FunctionArguments.builder();

        for (int inputId : p.inputs()) {
            ParameterInstance input = instances.get(inputId);
            if (input == null || !input.hasData())
                return Optional.empty();
            args.positional(input.data());
        }

        for (String name : p.coefficients()) {
            CalibrationCoefficient cc = coefficients.get(name);
            if (cc == null)
                throw new MissingCoefficientException(p.id(), name);
            args.coefficient(name, cc.value());
        }
        return Optional.of(args.build());
    }

    /** Binds against a request's working set. */
    public Optional<FunctionArguments> buildFuncMap(FunctionParameterInstance fp, StreamRequest request) {
        return buildFuncMap(fp, request.dataMap(), request.coefficients());
    }
}
