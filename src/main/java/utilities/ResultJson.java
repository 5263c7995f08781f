package utilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON rendering of run and comparison results for tool callers. Field names come from the
 * {@code @JsonProperty} annotations on the result records.
 */
public final class ResultJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ResultJson() {}

    public static String toJson(Object result) {
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + result.getClass().getSimpleName(), e);
        }
    }

    public static String toPrettyJson(Object result) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + result.getClass().getSimpleName(), e);
        }
    }

    // Plain map view of the JSON form, for callers that relay results as generic objects.
    public static Map<String, Object> toMap(Object result) {
        try {
            return MAPPER.readValue(toJson(result), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read back " + result.getClass().getSimpleName(), e);
        }
    }
}
