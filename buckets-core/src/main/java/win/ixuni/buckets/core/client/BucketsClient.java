package win.ixuni.buckets.core.client;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.exception.ClientClosedException;
import win.ixuni.buckets.core.exception.InvalidArgumentException;
import win.ixuni.buckets.core.handler.bucket.*;
import win.ixuni.buckets.core.handler.object.*;
import win.ixuni.buckets.core.model.BucketEntry;
import win.ixuni.buckets.core.model.BucketObjectEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.model.ObjectDownload;
import win.ixuni.buckets.core.model.ObjectRequestOptions;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.HandlerInterceptor;
import win.ixuni.buckets.core.operation.Operation;
import win.ixuni.buckets.core.operation.OperationHandlerRegistry;
import win.ixuni.buckets.core.operation.StreamOperation;
import win.ixuni.buckets.core.operation.bucket.*;
import win.ixuni.buckets.core.operation.interceptor.ErrorTranslationInterceptor;
import win.ixuni.buckets.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.buckets.core.operation.object.*;
import win.ixuni.buckets.core.request.RequestFactory;
import win.ixuni.buckets.core.transport.BucketsTransport;
import win.ixuni.buckets.core.transport.TransportFactoryLoader;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buckets API 客户端
 * <p>
 * Every method returns a cold publisher: nothing is sent until subscription, and each
 * subscription issues a new request. Errors, including invalid arguments, are delivered through
 * the error signal and never thrown from the method call itself.
 * <p>
 * Operations are command objects executed by registered handlers through an interceptor chain.
 * Instances are independent; several clients may share a JVM.
 */
@Slf4j
public class BucketsClient implements AutoCloseable {

    @Getter
    private final ClientConfig config;

    @Getter
    private final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    private final DefaultClientContext clientContext;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a client with the transport named by {@link ClientConfig#getTransport()}, found through SPI
     */
    public static BucketsClient create(ClientConfig config) {
        requireConfig(config);
        BucketsTransport transport = TransportFactoryLoader.find(config.getTransport()).createTransport(config);
        return new BucketsClient(config, transport);
    }

    public BucketsClient(ClientConfig config, BucketsTransport transport) {
        this(config, transport, List.of());
    }

    /**
     * @param interceptors extra interceptors, ordered with the built-in ones by {@link HandlerInterceptor#getOrder()}
     */
    public BucketsClient(ClientConfig config, BucketsTransport transport, List<? extends HandlerInterceptor> interceptors) {
        requireConfig(config);
        if (transport == null) {
            throw new InvalidArgumentException("transport must not be null");
        }
        this.config = config;
        this.clientContext = DefaultClientContext.builder()
                .config(config)
                .transport(transport)
                .requestFactory(new RequestFactory(config))
                .build();

        registerHandlers();
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new ErrorTranslationInterceptor());
        interceptors.forEach(handlerRegistry::addInterceptor);
        clientContext.setHandlerRegistry(handlerRegistry);

        log.info("Buckets client [{}] created: {} account={} transport={}",
                config.getName(), config.getUrl(), config.getAccount(), transport.getTransportType());
    }

    private static void requireConfig(ClientConfig config) {
        if (config == null) {
            throw new InvalidArgumentException("config must not be null");
        }
        if (config.getAccount() == null || config.getAccount().isEmpty()) {
            throw new InvalidArgumentException("account must not be empty");
        }
        if (config.getMaxLineLength() <= 0) {
            throw new InvalidArgumentException("maxLineLength must be positive: " + config.getMaxLineLength());
        }
    }

    private void registerHandlers() {
        // Bucket handlers (5)
        handlerRegistry.register(new CheckBucketsSupportHandler());
        handlerRegistry.register(new CreateBucketHandler());
        handlerRegistry.register(new HeadBucketHandler());
        handlerRegistry.register(new DeleteBucketHandler());
        handlerRegistry.register(new ListBucketsHandler());

        // Object handlers (6)
        handlerRegistry.register(new PutObjectHandler());
        handlerRegistry.register(new HeadObjectHandler());
        handlerRegistry.register(new GetObjectHandler());
        handlerRegistry.register(new PutObjectMetadataHandler());
        handlerRegistry.register(new DeleteObjectHandler());
        handlerRegistry.register(new ListObjectsHandler());

        log.debug("Registered {} operation handlers", handlerRegistry.size());
    }

    // ==================== Buckets ====================

    /**
     * Whether the server exposes the buckets API for this account
     */
    public Mono<Boolean> isBucketsSupported() {
        return execute(new CheckBucketsSupportOperation());
    }

    public Mono<ObjectResponse> createBucket(String bucketName) {
        return execute(new CreateBucketOperation(bucketName));
    }

    /**
     * @return the response headers; fails with {@code NotFoundException} when the bucket does not exist
     */
    public Mono<ObjectResponse> headBucket(String bucketName) {
        return execute(new HeadBucketOperation(bucketName));
    }

    public Mono<ObjectResponse> deleteBucket(String bucketName) {
        return execute(new DeleteBucketOperation(bucketName));
    }

    public Flux<BucketEntry> listBuckets() {
        return listBuckets(ListOptions.defaults());
    }

    public Flux<BucketEntry> listBuckets(ListOptions options) {
        return executeStream(new ListBucketsOperation(options));
    }

    // ==================== Objects ====================

    public Mono<ObjectResponse> createBucketObject(Flux<ByteBuffer> payload, String bucketName, String objectName) {
        return createBucketObject(payload, bucketName, objectName, ObjectRequestOptions.none());
    }

    /**
     * Upload an object, streaming the payload as the request body
     *
     * @param payload    object content, consumed once and on demand
     * @param bucketName 目标 bucket
     * @param objectName 对象名称
     * @param options    content type, declared length, metadata, raw header overrides
     */
    public Mono<ObjectResponse> createBucketObject(Flux<ByteBuffer> payload, String bucketName, String objectName,
                                                   ObjectRequestOptions options) {
        return execute(PutObjectOperation.builder()
                .bucketName(bucketName)
                .objectName(objectName)
                .content(payload)
                .options(options)
                .build());
    }

    public Mono<ObjectResponse> headBucketObject(String bucketName, String objectName) {
        return execute(new HeadObjectOperation(bucketName, objectName));
    }

    /**
     * Download an object; resolves when the headers arrive, the content is read lazily
     */
    public Mono<ObjectDownload> getBucketObject(String bucketName, String objectName) {
        return execute(new GetObjectOperation(bucketName, objectName));
    }

    /**
     * Replace the user metadata of an object
     */
    public Mono<ObjectResponse> putBucketObjectMetadata(String bucketName, String objectName,
                                                        ObjectRequestOptions options) {
        return execute(new PutObjectMetadataOperation(bucketName, objectName, options));
    }

    public Mono<ObjectResponse> deleteBucketObject(String bucketName, String objectName) {
        return execute(new DeleteObjectOperation(bucketName, objectName));
    }

    public Flux<BucketObjectEntry> listBucketObjects(String bucketName) {
        return listBucketObjects(bucketName, ListOptions.defaults());
    }

    public Flux<BucketObjectEntry> listBucketObjects(String bucketName, ListOptions options) {
        return executeStream(new ListObjectsOperation(bucketName, options));
    }

    // ==================== Execution ====================

    /**
     * Execute an operation through the interceptor chain
     */
    public <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return Mono.defer(() -> closed.get()
                ? Mono.error(new ClientClosedException(config.getName()))
                : handlerRegistry.execute(operation, clientContext));
    }

    public <O extends StreamOperation<T>, T> Flux<T> executeStream(O operation) {
        return Flux.defer(() -> closed.get()
                ? Flux.error(new ClientClosedException(config.getName()))
                : handlerRegistry.executeStream(operation, clientContext));
    }

    // ==================== Lifecycle ====================

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Close the client and release the transport
     * <p>
     * Idempotent. Requests already in flight are not interrupted by the client itself, but the
     * transport may abort them while shutting down.
     */
    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!closed.compareAndSet(false, true)) {
                return Mono.empty();
            }
            log.info("Shutting down buckets client: {}", config.getName());
            return clientContext.getTransport().shutdown();
        });
    }

    @Override
    public void close() {
        shutdown().subscribe(null, error -> log.warn("Error shutting down transport for client {}",
                config.getName(), error));
    }
}
