package win.ixuni.buckets.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-request options for object uploads and metadata updates
 */
@Value
@Builder
public class ObjectRequestOptions {

    private static final ObjectRequestOptions NONE = ObjectRequestOptions.builder().build();

    /**
     * Content type of the payload; defaults to application/octet-stream on upload
     */
    String contentType;

    /**
     * Declared payload size in bytes, or null when unknown (chunked upload)
     */
    Long contentLength;

    /**
     * User metadata, keys without the {@code m-} prefix
     */
    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * Raw request headers sent verbatim (e.g. {@code m-foo}, {@code durability-level}, {@code if-match})
     */
    @Singular
    Map<String, String> headers;

    public static ObjectRequestOptions none() {
        return NONE;
    }
}
