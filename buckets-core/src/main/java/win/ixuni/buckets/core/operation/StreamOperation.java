package win.ixuni.buckets.core.operation;

/**
 * Operation producing a stream of records (listings)
 *
 * @param <T> record type
 */
public interface StreamOperation<T> extends BucketsOperation {
}
