package win.ixuni.buckets.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Object listing record
 * <p>
 * A record of type {@value #TYPE_OBJECT} carries all seven fields. When a listing is issued with a
 * delimiter, common prefixes come back as {@value #TYPE_GROUP} records that only carry a name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketObjectEntry {

    public static final String TYPE_OBJECT = "bucketobject";
    public static final String TYPE_GROUP = "group";

    /**
     * Object name, or the common prefix for a group record
     */
    private String name;

    private String type;

    /**
     * Last modified time (ISO-8601 with milliseconds on the wire)
     */
    private Instant mtime;

    private String etag;

    /**
     * Object size in bytes
     */
    private Long size;

    private String contentType;

    /**
     * Base64 MD5 of the stored payload
     */
    @JsonProperty("contentMD5")
    private String contentMd5;

    @JsonIgnore
    public boolean isObject() {
        return TYPE_OBJECT.equals(type);
    }

    @JsonIgnore
    public boolean isGroup() {
        return TYPE_GROUP.equals(type);
    }
}
