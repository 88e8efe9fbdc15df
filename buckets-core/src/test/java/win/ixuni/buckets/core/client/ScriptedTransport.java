package win.ixuni.buckets.core.client;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.model.ResponseHeaders;
import win.ixuni.buckets.core.transport.BucketsTransport;
import win.ixuni.buckets.core.transport.TransportRequest;
import win.ixuni.buckets.core.transport.TransportResponse;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory transport answering from a script of canned responses
 * <p>
 * Request bodies are drained before answering, the way a real connection would send them; a
 * failing body surfaces wrapped in another exception, as HTTP clients do.
 */
class ScriptedTransport implements BucketsTransport {

    private final Deque<Function<TransportRequest, Mono<TransportResponse>>> script = new ConcurrentLinkedDeque<>();
    private final List<TransportRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final List<byte[]> bodies = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger shutdowns = new AtomicInteger();

    ScriptedTransport enqueue(Function<TransportRequest, Mono<TransportResponse>> step) {
        script.add(step);
        return this;
    }

    ScriptedTransport respond(int status, Map<String, String> headers, String... chunks) {
        return enqueue(request -> Mono.just(response(status, headers, chunks)));
    }

    static TransportResponse response(int status, Map<String, String> headers, String... chunks) {
        List<ByteBuffer> buffers = new ArrayList<>();
        for (String chunk : chunks) {
            buffers.add(ByteBuffer.wrap(chunk.getBytes(StandardCharsets.UTF_8)));
        }
        return TransportResponse.builder()
                .status(status)
                .headers(ResponseHeaders.ofSingle(headers))
                .body(Flux.fromIterable(buffers))
                .build();
    }

    @Override
    public Mono<TransportResponse> exchange(TransportRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            Function<TransportRequest, Mono<TransportResponse>> step = script.poll();
            if (step == null) {
                return Mono.error(new IllegalStateException("No scripted response for " + request.describe()));
            }
            if (!request.hasBody()) {
                return step.apply(request);
            }
            return request.getBody()
                    .reduce(new ByteArrayOutputStream(), (baos, buffer) -> {
                        byte[] bytes = new byte[buffer.remaining()];
                        buffer.duplicate().get(bytes);
                        baos.write(bytes, 0, bytes.length);
                        return baos;
                    })
                    .defaultIfEmpty(new ByteArrayOutputStream())
                    .onErrorMap(e -> new IllegalStateException("Request body failed", e))
                    .flatMap(baos -> {
                        bodies.add(baos.toByteArray());
                        return step.apply(request);
                    });
        });
    }

    List<TransportRequest> getRequests() {
        return requests;
    }

    TransportRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    String lastBody() {
        return new String(bodies.get(bodies.size() - 1), StandardCharsets.UTF_8);
    }

    int getShutdowns() {
        return shutdowns.get();
    }

    @Override
    public String getTransportType() {
        return "scripted";
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(shutdowns::incrementAndGet);
    }
}
