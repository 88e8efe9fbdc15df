package win.ixuni.buckets.core.operation;

/**
 * Buckets operation base interface
 * <p>
 * Every single-result call (CreateBucket, PutObject, etc.) is a command object implementing this
 * interface and executed by its registered {@link OperationHandler}.
 *
 * @param <R> 操作返回类型
 */
public interface Operation<R> extends BucketsOperation {
}
