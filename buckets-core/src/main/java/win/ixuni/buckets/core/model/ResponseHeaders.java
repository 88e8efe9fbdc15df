package win.ixuni.buckets.core.model;

import win.ixuni.buckets.core.codec.MetadataCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive view of HTTP response headers
 * <p>
 * Values are exposed exactly as the service sent them; integrity headers such as
 * {@code content-md5} and {@code content-length} are never rewritten.
 */
public final class ResponseHeaders {

    public static final String CONTENT_MD5 = "content-md5";
    public static final String CONTENT_LENGTH = "content-length";
    public static final String CONTENT_TYPE = "content-type";
    public static final String ETAG = "etag";
    public static final String NEXT_MARKER = "next-marker";

    private static final ResponseHeaders EMPTY = new ResponseHeaders(Collections.emptyMap());

    private final Map<String, List<String>> headers;

    private ResponseHeaders(Map<String, List<String>> source) {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            List<String> values = copy.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
            values.addAll(entry.getValue());
        }
        copy.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.headers = Collections.unmodifiableMap(copy);
    }

    public static ResponseHeaders of(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return EMPTY;
        }
        return new ResponseHeaders(headers);
    }

    public static ResponseHeaders ofSingle(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> multi = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((k, v) -> multi.computeIfAbsent(k, key -> new ArrayList<>()).add(v));
        return new ResponseHeaders(multi);
    }

    public static ResponseHeaders empty() {
        return EMPTY;
    }

    /**
     * First value of a header, or null when absent
     */
    public String getFirst(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public List<String> get(String name) {
        List<String> values = headers.get(name);
        return values == null ? Collections.emptyList() : values;
    }

    public boolean contains(String name) {
        return headers.containsKey(name);
    }

    public Set<String> names() {
        return headers.keySet();
    }

    public Map<String, List<String>> asMap() {
        return headers;
    }

    public String getContentMd5() {
        return getFirst(CONTENT_MD5);
    }

    public String getContentType() {
        return getFirst(CONTENT_TYPE);
    }

    public String getEtag() {
        return getFirst(ETAG);
    }

    /**
     * Declared content length, or -1 when the header is absent or not a number
     */
    public long getContentLength() {
        String value = getFirst(CONTENT_LENGTH);
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * User metadata carried in {@code m-*} headers, with the prefix stripped
     */
    public Map<String, String> getUserMetadata() {
        return MetadataCodec.decode(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResponseHeaders other)) {
            return false;
        }
        return headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        return headers.hashCode();
    }

    @Override
    public String toString() {
        return headers.toString();
    }
}
