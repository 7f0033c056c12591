package com.streamengine.dpa.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of one output array.
 *
 * {@code data} is Base64 text of the MessagePack encoding of the flattened,
 * row-major element list; {@code shape} restores the dimensions and
 * {@code dtype} the numpy element type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "dtype", "shape", "data" })
public final class EncodedArray {
    private String dtype;
    private List<Integer> shape;
    private String data;
}
