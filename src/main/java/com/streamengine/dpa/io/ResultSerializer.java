package com.streamengine.dpa.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.engine.StreamRequest;
import com.streamengine.dpa.instance.ParameterInstance;

import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Encodes computed arrays for transport.
 *
 * The payload is the flat element list packed with MessagePack and wrapped
 * in Base64 so it can sit inside a JSON document; dtype tag and shape travel
 * next to it so a client can rebuild the exact array.
 *
 * Thread Safety:
 * Stateless apart from two thread-safe Jackson mappers; may be shared.
 */
@Log4j2
public final class ResultSerializer {
    private static final TypeReference<LinkedHashMap<String, EncodedArray>> RESULT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper msgpack = new ObjectMapper(new MessagePackFactory());
    private final ObjectMapper json = new ObjectMapper();

    public EncodedArray encode(NdArray array) {
        Object flat = switch (array.dtype().storage()) {
            case LONG -> array.toLongArray();
            case DOUBLE -> array.toDoubleArray();
            case TEXT -> array.toStringArray();
        };
        byte[] packed;
        try {
            packed = msgpack.writeValueAsBytes(flat);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot pack array " + array, e);
        }
        List<Integer> shape = new ArrayList<>(array.ndim());
        for (int d : array.shape())
            shape.add(d);
        return new EncodedArray(array.dtypeTag(), shape, Base64.getEncoder().encodeToString(packed));
    }

    public NdArray decode(EncodedArray encoded) {
        DType dtype = DType.fromTag(encoded.getDtype());
        int[] shape = encoded.getShape().stream().mapToInt(Integer::intValue).toArray();
        byte[] packed = Base64.getDecoder().decode(encoded.getData());
        try {
            return switch (dtype.storage()) {
                case LONG -> NdArray.ofLongs(dtype, msgpack.readValue(packed, long[].class), shape);
                case DOUBLE -> NdArray.ofDoubles(dtype, msgpack.readValue(packed, double[].class), shape);
                case TEXT -> NdArray.ofText(dtype, msgpack.readValue(packed, String[].class), shape);
            };
        } catch (IOException e) {
            throw new IllegalArgumentException("Corrupt payload for dtype " + encoded.getDtype(), e);
        }
    }

    /**
     * Encodes the requested outputs that carry data, keyed by parameter id as
     * text, in request order. Failed or empty outputs are left out.
     */
    public Map<String, EncodedArray> serialize(StreamRequest request) {
        Map<String, EncodedArray> out = new LinkedHashMap<>();
        for (ParameterInstance pi : request.requestedInstances()) {
            if (!pi.hasData()) {
                log.debug("Omitting {} from result: {}", pi, pi.failureReason());
                continue;
            }
            out.put(Integer.toString(pi.id()), encode(pi.data()));
        }
        return out;
    }

    public String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write result as JSON", e);
        }
    }

    /** Parses a document written by {@link #toJson(Object)} from a result map. */
    public Map<String, EncodedArray> fromJson(String text) {
        try {
            return json.readValue(text, RESULT_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a result document", e);
        }
    }
}
