package win.ixuni.buckets.transport.webclient;

import io.netty.channel.ChannelOption;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.exception.BucketsException;
import win.ixuni.buckets.core.exception.InvalidArgumentException;
import win.ixuni.buckets.core.exception.TransportErrors;
import win.ixuni.buckets.core.model.ResponseHeaders;
import win.ixuni.buckets.core.request.BucketsPaths;
import win.ixuni.buckets.core.transport.BucketsTransport;
import win.ixuni.buckets.core.transport.TransportRequest;
import win.ixuni.buckets.core.transport.TransportResponse;

import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;

/**
 * WebClient 传输实现
 * <p>
 * Every response, whatever its status, is handed back with its headers and an unread body;
 * status interpretation belongs to the handlers. Connection, timeout and I/O failures become
 * {@code TransportException}; buckets exceptions raised by a request body pass through unwrapped.
 * <p>
 * Supported extra properties:
 * <ul>
 *     <li>{@code wiretap} - log raw traffic through Reactor Netty (default false)</li>
 *     <li>{@code pendingAcquireTimeout} - wait for a pooled connection (default 45s)</li>
 * </ul>
 */
@Slf4j
public class WebClientTransport implements BucketsTransport {

    @Getter
    private final String baseUrl;

    private final String clientName;

    private final ConnectionProvider connectionProvider;

    private final WebClient webClient;

    public WebClientTransport(ClientConfig config) {
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            throw new InvalidArgumentException("url must not be empty");
        }
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.clientName = config.getName();

        this.connectionProvider = ConnectionProvider.builder("buckets-" + config.getName())
                .maxConnections(config.getMaxConnections())
                .pendingAcquireTimeout(config.getDuration("pendingAcquireTimeout", Duration.ofSeconds(45)))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getResponseTimeout())
                .wiretap(config.getBoolean("wiretap", false));

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        log.info("WebClient transport [{}] -> {} (maxConnections={}, connectTimeout={}, responseTimeout={})",
                clientName, baseUrl, config.getMaxConnections(),
                config.getConnectTimeout(), config.getResponseTimeout());
    }

    @Override
    public Mono<TransportResponse> exchange(TransportRequest request) {
        return Mono.defer(() -> {
                    URI uri = toUri(request);
                    WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod().name()))
                            .uri(uri)
                            .headers(headers -> request.getHeaders().forEach(headers::set));

                    WebClient.RequestHeadersSpec<?> ready = request.hasBody()
                            ? spec.body(BodyInserters.fromDataBuffers(request.getBody().map(WebClientTransport::toDataBuffer)))
                            : spec;

                    log.trace("[{}] {} {}", clientName, request.getMethod(), uri);
                    return ready.retrieve()
                            // every status is a response; handlers decide what it means
                            .onStatus(status -> true, response -> Mono.empty())
                            .toEntityFlux(DataBuffer.class)
                            .map(entity -> toResponse(request, entity));
                })
                .onErrorMap(e -> !(e instanceof BucketsException), e -> TransportErrors.translate(request.describe(), e));
    }

    private TransportResponse toResponse(TransportRequest request, ResponseEntity<Flux<DataBuffer>> entity) {
        Flux<DataBuffer> body = entity.getBody() != null ? entity.getBody() : Flux.empty();
        return TransportResponse.builder()
                .status(entity.getStatusCode().value())
                .headers(ResponseHeaders.of(entity.getHeaders()))
                .body(body
                        .map(WebClientTransport::toByteBuffer)
                        .onErrorMap(e -> !(e instanceof BucketsException),
                                e -> TransportErrors.translate(request.describe(), e)))
                .build();
    }

    URI toUri(TransportRequest request) {
        StringBuilder sb = new StringBuilder(baseUrl).append(request.getPath());
        char separator = '?';
        for (Map.Entry<String, String> param : request.getQuery().entrySet()) {
            sb.append(separator)
                    .append(BucketsPaths.encodeComponent(param.getKey()))
                    .append('=')
                    .append(BucketsPaths.encodeComponent(param.getValue()));
            separator = '&';
        }
        return URI.create(sb.toString());
    }

    private static DataBuffer toDataBuffer(ByteBuffer buffer) {
        return DefaultDataBufferFactory.sharedInstance.wrap(buffer);
    }

    /**
     * Copy out of the pooled buffer and release it
     */
    private static ByteBuffer toByteBuffer(DataBuffer dataBuffer) {
        try {
            byte[] bytes = new byte[dataBuffer.readableByteCount()];
            dataBuffer.read(bytes);
            return ByteBuffer.wrap(bytes);
        } finally {
            DataBufferUtils.release(dataBuffer);
        }
    }

    @Override
    public String getTransportType() {
        return WebClientTransportFactory.TRANSPORT_TYPE;
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down WebClient transport: {}", clientName);
        return connectionProvider.disposeLater();
    }
}
