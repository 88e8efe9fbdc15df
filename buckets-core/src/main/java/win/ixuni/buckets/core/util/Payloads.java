package win.ixuni.buckets.core.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Upload payload sources
 * <p>
 * All sources are cold and read lazily in bounded chunks, so a payload is never held in memory
 * as a whole unless it already was.
 */
@Slf4j
public final class Payloads {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private Payloads() {
    }

    public static Flux<ByteBuffer> fromBytes(byte[] data) {
        return fromBytes(data, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Slice an in-memory payload into read-only chunks
     */
    public static Flux<ByteBuffer> fromBytes(byte[] data, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        return Flux.defer(() -> {
            if (data.length == 0) {
                return Flux.empty();
            }
            int chunks = (data.length + chunkSize - 1) / chunkSize;
            return Flux.range(0, chunks).map(i -> {
                int offset = i * chunkSize;
                int length = Math.min(chunkSize, data.length - offset);
                return ByteBuffer.wrap(data, offset, length).slice().asReadOnlyBuffer();
            });
        });
    }

    public static Flux<ByteBuffer> fromString(String text) {
        return fromBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    public static Flux<ByteBuffer> fromPath(Path path) {
        return fromInputStream(() -> Files.newInputStream(path));
    }

    public static Flux<ByteBuffer> fromInputStream(Callable<? extends InputStream> supplier) {
        return fromInputStream(supplier, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Read a stream opened per subscription; blocking reads run on the bounded elastic scheduler
     * and the stream is closed on completion, error or cancel.
     */
    public static Flux<ByteBuffer> fromInputStream(Callable<? extends InputStream> supplier, int chunkSize) {
        return Flux.<ByteBuffer, InputStream>using(
                        supplier,
                        in -> Flux.<ByteBuffer>generate(sink -> {
                            byte[] buffer = new byte[chunkSize];
                            try {
                                int read = in.read(buffer);
                                if (read < 0) {
                                    sink.complete();
                                } else {
                                    sink.next(ByteBuffer.wrap(buffer, 0, read));
                                }
                            } catch (IOException e) {
                                sink.error(e);
                            }
                        }),
                        Payloads::closeQuietly)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close payload stream: {}", e.getMessage());
        }
    }
}
