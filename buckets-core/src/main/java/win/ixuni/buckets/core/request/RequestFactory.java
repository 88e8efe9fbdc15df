package win.ixuni.buckets.core.request;

import reactor.core.publisher.Flux;
import win.ixuni.buckets.core.codec.MetadataCodec;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.exception.InvalidArgumentException;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.model.ObjectRequestOptions;
import win.ixuni.buckets.core.transport.HttpMethod;
import win.ixuni.buckets.core.transport.TransportRequest;
import win.ixuni.buckets.core.util.HeaderValidation;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the transport request for every buckets operation
 * <p>
 * Pure: nothing here touches the network. Invalid input fails with
 * {@link InvalidArgumentException}.
 */
public class RequestFactory {

    public static final String ACCEPT_JSON = "application/json, */*";
    public static final String ACCEPT_JSON_STREAM = "application/x-json-stream";
    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final BucketsPaths paths;
    private final Map<String, String> defaultHeaders;

    public RequestFactory(ClientConfig config) {
        this.paths = new BucketsPaths(config.getAccount());
        this.defaultHeaders = config.getDefaultHeaders() == null ? Map.of() : Map.copyOf(config.getDefaultHeaders());
        HeaderValidation.validate(defaultHeaders);
    }

    public BucketsPaths getPaths() {
        return paths;
    }

    // ==================== Buckets ====================

    public TransportRequest bucketsSupportRequest() {
        return exchange(HttpMethod.HEAD, paths.bucketsRoot(), Map.of());
    }

    public TransportRequest createBucket(String bucketName) {
        return exchange(HttpMethod.PUT, paths.bucket(bucketName), Map.of());
    }

    public TransportRequest headBucket(String bucketName) {
        return exchange(HttpMethod.HEAD, paths.bucket(bucketName), Map.of());
    }

    public TransportRequest deleteBucket(String bucketName) {
        return exchange(HttpMethod.DELETE, paths.bucket(bucketName), Map.of());
    }

    public TransportRequest listBuckets(ListOptions options) {
        return listing(paths.bucketsRoot(), options);
    }

    // ==================== Objects ====================

    public TransportRequest listObjects(String bucketName, ListOptions options) {
        return listing(paths.objects(bucketName), options);
    }

    /**
     * Upload request; the payload becomes the request body unchanged
     */
    public TransportRequest putObject(String bucketName, String objectName,
                                      Flux<ByteBuffer> payload, ObjectRequestOptions options) {
        String path = paths.object(bucketName, objectName);
        if (payload == null) {
            throw new InvalidArgumentException("payload must not be null");
        }
        ObjectRequestOptions opts = options == null ? ObjectRequestOptions.none() : options;

        Map<String, String> headers = newHeaders();
        headers.put("accept", ACCEPT_JSON);
        headers.put("content-type", opts.getContentType() != null ? opts.getContentType() : DEFAULT_CONTENT_TYPE);
        if (opts.getContentLength() != null) {
            if (opts.getContentLength() < 0) {
                throw new InvalidArgumentException("contentLength must be >= 0: " + opts.getContentLength());
            }
            headers.put("content-length", Long.toString(opts.getContentLength()));
        }
        headers.putAll(MetadataCodec.encode(opts.getMetadata()));
        headers.putAll(opts.getHeaders());

        return build(HttpMethod.PUT, path, Map.of(), headers, payload);
    }

    public TransportRequest headObject(String bucketName, String objectName) {
        return exchange(HttpMethod.HEAD, paths.object(bucketName, objectName), Map.of());
    }

    public TransportRequest getObject(String bucketName, String objectName) {
        return exchange(HttpMethod.GET, paths.object(bucketName, objectName), Map.of());
    }

    public TransportRequest deleteObject(String bucketName, String objectName) {
        return exchange(HttpMethod.DELETE, paths.object(bucketName, objectName), Map.of());
    }

    /**
     * Metadata-only update: carries the new metadata headers and explicit overrides, no body
     */
    public TransportRequest putObjectMetadata(String bucketName, String objectName, ObjectRequestOptions options) {
        String path = paths.objectMetadata(bucketName, objectName);
        ObjectRequestOptions opts = options == null ? ObjectRequestOptions.none() : options;

        Map<String, String> headers = newHeaders();
        headers.put("accept", ACCEPT_JSON);
        if (opts.getContentType() != null) {
            headers.put("content-type", opts.getContentType());
        }
        headers.putAll(MetadataCodec.encode(opts.getMetadata()));
        headers.putAll(opts.getHeaders());

        return build(HttpMethod.PUT, path, Map.of(), headers, null);
    }

    // ==================== Helpers ====================

    private TransportRequest exchange(HttpMethod method, String path, Map<String, String> extra) {
        Map<String, String> headers = newHeaders();
        headers.put("accept", ACCEPT_JSON);
        headers.putAll(extra);
        return build(method, path, Map.of(), headers, null);
    }

    private TransportRequest listing(String path, ListOptions options) {
        ListOptions opts = options == null ? ListOptions.defaults() : options;
        Map<String, String> query = new TreeMap<>();
        if (opts.getLimit() != null) {
            int limit = opts.getLimit();
            if (limit < 1 || limit > ListOptions.MAX_LIMIT) {
                throw new InvalidArgumentException("limit must be between 1 and " + ListOptions.MAX_LIMIT + ": " + limit);
            }
            query.put("limit", Integer.toString(limit));
        }
        putIfPresent(query, "marker", opts.getMarker());
        putIfPresent(query, "prefix", opts.getPrefix());
        putIfPresent(query, "delimiter", opts.getDelimiter());

        Map<String, String> headers = newHeaders();
        headers.put("accept", ACCEPT_JSON_STREAM);
        return build(HttpMethod.GET, path, query, headers, null);
    }

    private Map<String, String> newHeaders() {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(defaultHeaders);
        return headers;
    }

    private static TransportRequest build(HttpMethod method, String path, Map<String, String> query,
                                          Map<String, String> headers, Flux<ByteBuffer> body) {
        HeaderValidation.validate(headers);
        return TransportRequest.builder()
                .method(method)
                .path(path)
                .query(query)
                .headers(headers)
                .body(body)
                .build();
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isEmpty()) {
            map.put(key, value);
        }
    }
}
