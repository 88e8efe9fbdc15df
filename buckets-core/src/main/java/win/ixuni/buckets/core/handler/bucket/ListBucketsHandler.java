package win.ixuni.buckets.core.handler.bucket;

import win.ixuni.buckets.core.handler.AbstractListHandler;
import win.ixuni.buckets.core.model.BucketEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.bucket.ListBucketsOperation;
import win.ixuni.buckets.core.transport.TransportRequest;

/**
 * 列出 bucket 处理器
 */
public class ListBucketsHandler extends AbstractListHandler<ListBucketsOperation, BucketEntry> {

    @Override
    protected ListOptions optionsOf(ListBucketsOperation operation) {
        return operation.getOptions() != null ? operation.getOptions() : ListOptions.defaults();
    }

    @Override
    protected TransportRequest buildRequest(ListBucketsOperation operation, ClientContext context, ListOptions options) {
        return context.getRequestFactory().listBuckets(options);
    }

    @Override
    protected Class<BucketEntry> getRecordType() {
        return BucketEntry.class;
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }
}
