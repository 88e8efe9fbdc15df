package win.ixuni.buckets.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON 工具类
 */
public class JsonUtils {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Decode one JSON document from a byte range, reporting malformed input to the caller
     */
    public static <T> T read(byte[] bytes, int offset, int length, Class<T> clazz) throws IOException {
        // the whole range must be one document
        return MAPPER.readerFor(clazz)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readValue(bytes, offset, length);
    }

    /**
     * Parse a JSON object, returning null when the text is not one
     */
    public static JsonNode readTreeOrNull(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            return null;
        }
    }
}
