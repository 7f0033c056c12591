package com.streamengine.dpa.catalog;

import com.streamengine.dpa.api.ParameterCatalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog held entirely in memory, immutable once built.
 *
 * The builder checks referential integrity (every input id and every stream
 * member exists) but deliberately does not reject cycles: cycle detection is
 * the resolver's job and surfaces as a fatal request error.
 */
public final class InMemoryParameterCatalog implements ParameterCatalog {
    private final Map<Integer, Parameter> parameters;
    private final Map<String, Stream> streams;

    private InMemoryParameterCatalog(Map<Integer, Parameter> parameters, Map<String, Stream> streams) {
        this.parameters = Collections.unmodifiableMap(parameters);
        this.streams = Collections.unmodifiableMap(streams);
    }

    @Override
    public Parameter lookup(int id) {
        Parameter p = parameters.get(id);
        if (p == null)
            throw new IllegalArgumentException("Unknown parameter id: " + id);
        return p;
    }

    @Override
    public Stream lookupStream(String name) {
        Stream s = streams.get(name);
        if (s == null)
            throw new IllegalArgumentException("Unknown stream: " + name);
        return s;
    }

    @Override
    public boolean contains(int id) {
        return parameters.containsKey(id);
    }

    public Collection<Parameter> parameters() {
        return parameters.values();
    }

    public Collection<Stream> streams() {
        return streams.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, Parameter> parameters = new LinkedHashMap<>();
        private final Map<String, Stream> streams = new LinkedHashMap<>();

        public Builder addParameter(Parameter parameter) {
            if (parameters.containsKey(parameter.id()))
                throw new IllegalArgumentException("Duplicate parameter id: " + parameter.id());
            parameters.put(parameter.id(), parameter);
            return this;
        }

        public Builder addStream(Stream stream) {
            if (streams.containsKey(stream.name()))
                throw new IllegalArgumentException("Duplicate stream name: " + stream.name());
            streams.put(stream.name(), stream);
            return this;
        }

        public InMemoryParameterCatalog build() {
            for (Parameter p : parameters.values()) {
                for (int input : p.inputs()) {
                    if (!parameters.containsKey(input))
                        throw new IllegalArgumentException(
                                "Parameter " + p.id() + " declares unknown input " + input);
                }
            }
            for (Stream s : streams.values()) {
                for (int id : s.parameterIds()) {
                    if (!parameters.containsKey(id))
                        throw new IllegalArgumentException("Stream " + s.name() + " lists unknown parameter " + id);
                }
            }
            return new InMemoryParameterCatalog(new LinkedHashMap<>(parameters), new LinkedHashMap<>(streams));
        }
    }
}
