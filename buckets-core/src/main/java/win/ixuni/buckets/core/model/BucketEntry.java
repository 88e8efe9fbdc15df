package win.ixuni.buckets.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket listing record
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketEntry {

    public static final String TYPE = "bucket";

    /**
     * Bucket 名称
     */
    private String name;

    /**
     * Record type, always "bucket"
     */
    private String type;

    /**
     * Creation / last modified time
     */
    private Instant mtime;
}
