package win.ixuni.buckets.core.handler.object;

import win.ixuni.buckets.core.handler.AbstractListHandler;
import win.ixuni.buckets.core.model.BucketObjectEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.ListObjectsOperation;
import win.ixuni.buckets.core.transport.TransportRequest;

/**
 * 列出对象处理器
 * <p>
 * With a delimiter the stream mixes object records and {@code group} records for common prefixes.
 */
public class ListObjectsHandler extends AbstractListHandler<ListObjectsOperation, BucketObjectEntry> {

    @Override
    protected ListOptions optionsOf(ListObjectsOperation operation) {
        return operation.getOptions() != null ? operation.getOptions() : ListOptions.defaults();
    }

    @Override
    protected TransportRequest buildRequest(ListObjectsOperation operation, ClientContext context, ListOptions options) {
        return context.getRequestFactory().listObjects(operation.getBucketName(), options);
    }

    @Override
    protected Class<BucketObjectEntry> getRecordType() {
        return BucketObjectEntry.class;
    }

    /**
     * Object records must carry all seven fields; group records only a name
     */
    @Override
    protected String checkRecord(BucketObjectEntry entry) {
        if (entry.getName() == null || entry.getName().isEmpty()) {
            return "missing name";
        }
        if (!entry.isObject()) {
            return null;
        }
        if (entry.getMtime() == null) {
            return "object " + entry.getName() + " has no mtime";
        }
        if (entry.getEtag() == null) {
            return "object " + entry.getName() + " has no etag";
        }
        if (entry.getSize() == null || entry.getSize() < 0) {
            return "object " + entry.getName() + " has invalid size " + entry.getSize();
        }
        if (entry.getContentType() == null) {
            return "object " + entry.getName() + " has no contentType";
        }
        if (entry.getContentMd5() == null) {
            return "object " + entry.getName() + " has no contentMD5";
        }
        return null;
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
