package win.ixuni.buckets.core.codec;

import win.ixuni.buckets.core.exception.InvalidArgumentException;
import win.ixuni.buckets.core.model.ResponseHeaders;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps user metadata to and from {@code m-*} headers
 * <p>
 * {@code decode(encode(m))} returns {@code m} for any map whose keys stay distinct after
 * prefixing (header names compare case-insensitively).
 */
public final class MetadataCodec {

    public static final String PREFIX = "m-";

    private MetadataCodec() {
    }

    /**
     * Prefix every key with {@value #PREFIX}
     *
     * @param metadata user metadata, may be null
     * @return header map in the key order of the input
     */
    public static Map<String, String> encode(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isEmpty()) {
                throw new InvalidArgumentException("Metadata key must not be empty");
            }
            headers.put(PREFIX + key, entry.getValue());
        }
        return headers;
    }

    /**
     * Collect {@code m-*} headers with the prefix stripped; everything else is dropped
     */
    public static Map<String, String> decode(ResponseHeaders headers) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (String name : headers.names()) {
            if (isMetadataHeader(name)) {
                metadata.put(name.substring(PREFIX.length()), headers.getFirst(name));
            }
        }
        return metadata;
    }

    public static Map<String, String> decode(Map<String, String> headers) {
        return decode(ResponseHeaders.ofSingle(headers));
    }

    public static boolean isMetadataHeader(String name) {
        return name != null
                && name.length() > PREFIX.length()
                && name.regionMatches(true, 0, PREFIX, 0, PREFIX.length());
    }
}
