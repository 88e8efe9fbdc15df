package win.ixuni.buckets.core.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Content digest helpers for verifying downloads against {@code content-md5}
 */
public final class Digests {

    private Digests() {
    }

    /**
     * Base64 MD5 of a byte array, the encoding used by the {@code content-md5} header
     */
    public static String md5Base64(byte[] data) {
        MessageDigest md = newMd5();
        md.update(data);
        return Base64.getEncoder().encodeToString(md.digest());
    }

    /**
     * Base64 MD5 of a stream; buffers are read through duplicates and left untouched
     */
    public static Mono<String> md5Base64(Flux<ByteBuffer> content) {
        return Mono.defer(() -> {
            MessageDigest md = newMd5();
            return content
                    .doOnNext(buffer -> md.update(buffer.duplicate()))
                    .then(Mono.fromCallable(() -> Base64.getEncoder().encodeToString(md.digest())));
        });
    }

    private static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
