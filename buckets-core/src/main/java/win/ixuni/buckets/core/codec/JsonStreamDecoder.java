package win.ixuni.buckets.core.codec;

import reactor.core.publisher.Flux;
import win.ixuni.buckets.core.exception.DecodeException;
import win.ixuni.buckets.core.util.JsonUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Decodes an {@code application/x-json-stream} body: one JSON object per LF-terminated line
 * <p>
 * Records are emitted in body order as soon as their line is complete. Upstream chunks are
 * requested one at a time, so the network is not read while decoded records wait for demand.
 * A malformed line ends the stream with {@link DecodeException}; records already emitted stay
 * valid and the upstream body is cancelled. An optional record check runs on every decoded
 * record; a non-null result from it is reported the same way as malformed JSON.
 *
 * @param <T> record type
 */
public class JsonStreamDecoder<T> {

    private static final int UPSTREAM_PREFETCH = 1;
    private static final int SNIPPET_LENGTH = 80;

    private final Class<T> recordType;
    private final int maxLineLength;
    private final Function<? super T, String> recordCheck;

    public JsonStreamDecoder(Class<T> recordType, int maxLineLength) {
        this(recordType, maxLineLength, record -> null);
    }

    /**
     * @param recordCheck returns a description of what is wrong with a record, or null when it is valid
     */
    public JsonStreamDecoder(Class<T> recordType, int maxLineLength, Function<? super T, String> recordCheck) {
        this.recordType = recordType;
        this.maxLineLength = maxLineLength;
        this.recordCheck = recordCheck;
    }

    /**
     * Decode a body; splitter state is created per subscription
     *
     * @param body raw response body
     * @return decoded records
     */
    public Flux<T> decode(Flux<ByteBuffer> body) {
        return Flux.defer(() -> {
            LineSplitter splitter = new LineSplitter(maxLineLength);
            return body
                    .concatMapIterable(splitter::feed, UPSTREAM_PREFETCH)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(splitter.finish())))
                    .<T>handle((line, sink) -> {
                        try {
                            sink.next(decodeLine(line));
                        } catch (DecodeException e) {
                            sink.error(e);
                        }
                    });
        });
    }

    /**
     * Decode a single line
     *
     * @throws DecodeException when the line is not a JSON object of the record type
     */
    public T decodeLine(LineSplitter.Line line) {
        byte[] bytes = line.getBytes();
        T value;
        try {
            value = JsonUtils.read(bytes, 0, bytes.length, recordType);
        } catch (IOException e) {
            throw new DecodeException("Malformed " + recordType.getSimpleName() + " record '"
                    + snippet(bytes) + "'", line.getNumber(), e);
        }
        if (value == null) {
            throw new DecodeException("Listing record is JSON null", line.getNumber());
        }
        String problem = recordCheck.apply(value);
        if (problem != null) {
            throw new DecodeException("Invalid " + recordType.getSimpleName() + " record: " + problem,
                    line.getNumber());
        }
        return value;
    }

    private static String snippet(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }
}
