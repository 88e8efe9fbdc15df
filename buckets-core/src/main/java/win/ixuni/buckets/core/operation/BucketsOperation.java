package win.ixuni.buckets.core.operation;

/**
 * Common root of single-result and streaming operations
 */
public interface BucketsOperation {

    /**
     * Get the operation name (for logging)
     *
     * @return 操作名称，如 "CreateBucket", "PutObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        // Remove "Operation" suffix
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
