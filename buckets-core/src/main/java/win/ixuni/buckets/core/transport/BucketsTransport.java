package win.ixuni.buckets.core.transport;

import reactor.core.publisher.Mono;

/**
 * Authenticated HTTP exchange used by the client
 * <p>
 * Implementations own connection pooling, request signing, timeouts and any retry policy. They
 * report every status code as a {@link TransportResponse} and only fail the returned {@code Mono}
 * for network level problems, which must surface as
 * {@link win.ixuni.buckets.core.exception.TransportException}. Errors raised by the request body
 * publisher are propagated unchanged.
 */
public interface BucketsTransport {

    /**
     * Perform one HTTP exchange
     *
     * @param request request to send
     * @return response with status, headers and a lazy body
     */
    Mono<TransportResponse> exchange(TransportRequest request);

    /**
     * Get the transport type
     *
     * @return type identifier, e.g. "webclient"
     */
    String getTransportType();

    /**
     * Release pooled connections
     *
     * @return completion signal
     */
    Mono<Void> shutdown();
}
