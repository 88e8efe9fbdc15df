package win.ixuni.buckets.core.operation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.buckets.core.model.BucketEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.operation.bucket.CheckBucketsSupportOperation;
import win.ixuni.buckets.core.operation.bucket.ListBucketsOperation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 处理器注册表测试
 */
public class OperationHandlerRegistryTest {

    private static class RecordingInterceptor implements HandlerInterceptor {
        private final String name;
        private final int order;
        private final List<String> calls;

        RecordingInterceptor(String name, int order, List<String> calls) {
            this.name = name;
            this.order = order;
            this.calls = calls;
        }

        @Override
        public <O extends Operation<R>, R> Mono<R> intercept(O operation, ClientContext context,
                                                            InterceptorChain<O, R> chain) {
            calls.add(name);
            return chain.proceed(operation, context);
        }

        @Override
        public <O extends StreamOperation<T>, T> Flux<T> interceptStream(O operation, ClientContext context,
                                                                        StreamInterceptorChain<O, T> chain) {
            calls.add(name + "-stream");
            return chain.proceed(operation, context);
        }

        @Override
        public int getOrder() {
            return order;
        }
    }

    @Test
    @DisplayName("拦截器按 order 顺序执行")
    void testInterceptorOrder() {
        List<String> calls = new ArrayList<>();
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        registry.register(new OperationHandler<CheckBucketsSupportOperation, Boolean>() {
            @Override
            public Mono<Boolean> handle(CheckBucketsSupportOperation operation, ClientContext context) {
                calls.add("handler");
                return Mono.just(true);
            }

            @Override
            public Class<CheckBucketsSupportOperation> getOperationType() {
                return CheckBucketsSupportOperation.class;
            }
        });
        registry.addInterceptor(new RecordingInterceptor("late", 10, calls));
        registry.addInterceptor(new RecordingInterceptor("early", -10, calls));

        StepVerifier.create(registry.execute(new CheckBucketsSupportOperation(), null))
                .expectNext(true)
                .verifyComplete();
        assertEquals(List.of("early", "late", "handler"), calls);
        assertEquals(2, registry.interceptorCount());
    }

    @Test
    @DisplayName("流式操作经过拦截器")
    void testStreamHandler() {
        List<String> calls = new ArrayList<>();
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        registry.register(new StreamOperationHandler<ListBucketsOperation, BucketEntry>() {
            @Override
            public Flux<BucketEntry> handle(ListBucketsOperation operation, ClientContext context) {
                return Flux.just(BucketEntry.builder().name("b1").build());
            }

            @Override
            public Class<ListBucketsOperation> getOperationType() {
                return ListBucketsOperation.class;
            }
        });
        registry.addInterceptor(new RecordingInterceptor("log", 0, calls));

        StepVerifier.create(registry.executeStream(new ListBucketsOperation(ListOptions.defaults()), null))
                .expectNextMatches(entry -> entry.getName().equals("b1"))
                .verifyComplete();
        assertEquals(List.of("log-stream"), calls);
        assertTrue(registry.supports(ListBucketsOperation.class));
        assertEquals(EnumSet.of(BucketsOperationKind.LIST_BUCKETS), registry.getSupportedKinds());
    }

    @Test
    @DisplayName("未注册的操作返回错误信号")
    void testMissingHandler() {
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        StepVerifier.create(registry.execute(new CheckBucketsSupportOperation(), null))
                .expectError(UnsupportedOperationException.class)
                .verify();
        StepVerifier.create(registry.executeStream(new ListBucketsOperation(null), null))
                .expectError(UnsupportedOperationException.class)
                .verify();
        assertEquals(0, registry.size());
    }

    @Test
    void testOperationName() {
        assertEquals("CheckBucketsSupport", new CheckBucketsSupportOperation().getOperationName());
    }
}
