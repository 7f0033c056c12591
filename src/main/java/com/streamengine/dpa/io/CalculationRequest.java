package com.streamengine.dpa.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.streamengine.dpa.api.StreamKey;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A client's calculation request. An empty {@code parameters} list asks for
 * every parameter of the stream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CalculationRequest {
    private String subsite, node, sensor, method, stream;
    private List<Integer> parameters = new ArrayList<>();

    public StreamKey streamKey() {
        return new StreamKey(subsite, node, sensor, method, stream);
    }
}
