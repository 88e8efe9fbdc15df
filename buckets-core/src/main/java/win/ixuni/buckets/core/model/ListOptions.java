package win.ixuni.buckets.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Listing request parameters
 */
@Value
@Builder
public class ListOptions {

    public static final int MAX_LIMIT = 1024;

    private static final ListOptions DEFAULTS = ListOptions.builder().build();

    /**
     * Only return names starting with this prefix
     */
    String prefix;

    /**
     * Roll names up to the first occurrence of this delimiter after the prefix
     */
    String delimiter;

    /**
     * Start listing after this name
     */
    @With
    String marker;

    /**
     * Page size, 1..1024; server default when null
     */
    Integer limit;

    /**
     * Follow {@code next-marker} across pages
     */
    @Builder.Default
    boolean paginate = true;

    public static ListOptions defaults() {
        return DEFAULTS;
    }
}
