package win.ixuni.buckets.core.operation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import win.ixuni.buckets.core.operation.bucket.*;
import win.ixuni.buckets.core.operation.object.*;

/**
 * Every public network operation of {@code BucketsClient}
 * <p>
 * Adding a client method means adding a constant here; the registry and the test suite check
 * that each constant has a handler and a test.
 */
@Getter
@RequiredArgsConstructor
public enum BucketsOperationKind {

    IS_BUCKETS_SUPPORTED("isBucketsSupported", CheckBucketsSupportOperation.class),
    CREATE_BUCKET("createBucket", CreateBucketOperation.class),
    HEAD_BUCKET("headBucket", HeadBucketOperation.class),
    DELETE_BUCKET("deleteBucket", DeleteBucketOperation.class),
    LIST_BUCKETS("listBuckets", ListBucketsOperation.class),
    CREATE_BUCKET_OBJECT("createBucketObject", PutObjectOperation.class),
    HEAD_BUCKET_OBJECT("headBucketObject", HeadObjectOperation.class),
    GET_BUCKET_OBJECT("getBucketObject", GetObjectOperation.class),
    PUT_BUCKET_OBJECT_METADATA("putBucketObjectMetadata", PutObjectMetadataOperation.class),
    DELETE_BUCKET_OBJECT("deleteBucketObject", DeleteObjectOperation.class),
    LIST_BUCKET_OBJECTS("listBucketObjects", ListObjectsOperation.class);

    /**
     * Name of the client method
     */
    private final String methodName;

    private final Class<? extends BucketsOperation> operationType;
}
