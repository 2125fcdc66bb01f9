package com.railplan.common;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * A library containing static methods for working with JSON.
 */
public abstract class JsonUtilities {

    /**
     * Mapper for the optimization oracle wire format. Field names are snake_case on the wire and camelCase in Java.
     * The oracle is a separately deployed service that may add fields to its responses, so unknown properties are
     * ignored rather than failing the whole exchange.
     */
    public static final ObjectMapper oracleObjectMapper = createBaseObjectMapper();

    static {
        oracleObjectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        oracleObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        oracleObjectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    private static ObjectMapper createBaseObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        return objectMapper;
    }

    /** Represent the supplied object as JSON in a byte array. */
    public static byte[] objectToJsonBytes (Object object) {
        try {
            return oracleObjectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /** Parse a JSON body, throwing IOException for any malformed or mismatched content. */
    public static <T> T objectFromJsonBytes (byte[] bytes, Class<T> classe) throws IOException {
        return oracleObjectMapper.readValue(bytes, classe);
    }

}
