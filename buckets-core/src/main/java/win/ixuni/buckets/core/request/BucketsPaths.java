package win.ixuni.buckets.core.request;

import win.ixuni.buckets.core.exception.InvalidArgumentException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Resource paths of the buckets API
 * <p>
 * <pre>
 * /{account}/buckets
 * /{account}/buckets/{bucket}
 * /{account}/buckets/{bucket}/objects
 * /{account}/buckets/{bucket}/objects/{object}
 * /{account}/buckets/{bucket}/objects/{object}/metadata
 * </pre>
 * Every name is encoded as a single path segment, so a {@code /} inside an object name becomes
 * {@code %2F}. Service naming rules are not checked here; only empty names are rejected.
 */
public class BucketsPaths {

    private final String accountRoot;

    public BucketsPaths(String account) {
        this.accountRoot = "/" + encodeComponent(requireName(account, "account"));
    }

    public String bucketsRoot() {
        return accountRoot + "/buckets";
    }

    public String bucket(String bucketName) {
        return bucketsRoot() + "/" + encodeComponent(requireName(bucketName, "bucket name"));
    }

    public String objects(String bucketName) {
        return bucket(bucketName) + "/objects";
    }

    public String object(String bucketName, String objectName) {
        return objects(bucketName) + "/" + encodeComponent(requireName(objectName, "object name"));
    }

    public String objectMetadata(String bucketName, String objectName) {
        return object(bucketName, objectName) + "/metadata";
    }

    /**
     * Percent-encode one path segment (UTF-8), keeping unreserved characters and {@code !'()*~}
     */
    public static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }

    /**
     * Reject null or empty identifiers before anything is sent
     */
    public static String requireName(String value, String what) {
        if (value == null || value.isEmpty()) {
            throw new InvalidArgumentException(what + " must be a non-empty string");
        }
        return value;
    }
}
