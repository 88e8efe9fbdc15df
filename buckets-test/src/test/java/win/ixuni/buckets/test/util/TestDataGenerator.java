package win.ixuni.buckets.test.util;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.UUID;

import win.ixuni.buckets.core.util.Digests;

/**
 * 测试数据生成器
 * <p>
 * Random payloads, unique resource names and object names that exercise path encoding.
 */
public final class TestDataGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final String ASCII_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789 -_.";

    private TestDataGenerator() {
        // 工具类不允许实例化
    }

    /**
     * 生成指定大小的随机二进制数据
     */
    public static byte[] generateRandomBytes(int sizeBytes) {
        byte[] data = new byte[sizeBytes];
        RANDOM.nextBytes(data);
        return data;
    }

    public static String generateRandomAsciiText(int sizeBytes) {
        StringBuilder sb = new StringBuilder(sizeBytes);
        for (int i = 0; i < sizeBytes; i++) {
            sb.append(ASCII_CHARS.charAt(RANDOM.nextInt(ASCII_CHARS.length())));
        }
        return sb.toString();
    }

    /**
     * Unique name for a bucket or object, e.g. {@code java-buckets-test-basic-1a2b3c4d-bucket}
     */
    public static String uniqueName(String suite, String suffix) {
        return "java-buckets-test-" + suite + "-" + UUID.randomUUID().toString().substring(0, 8) + "-" + suffix;
    }

    /**
     * Object names with characters that need percent-encoding in a path segment
     */
    public static String generateSpecialObjectName(ObjectNameType type) {
        String uuid = UUID.randomUUID().toString().substring(0, 8);
        return switch (type) {
            case CHINESE -> "测试文件-" + uuid + ".txt";
            case EMOJI -> "🎉test-" + uuid + "-🚀.txt";
            case SPECIAL_CHARS -> "test!@#$%^&()+=?-" + uuid + ".txt";
            case SPACES -> "test file with spaces " + uuid + ".txt";
            case SLASHES -> "level1/level2/file-" + uuid + ".txt";
        };
    }

    public enum ObjectNameType {
        CHINESE, EMOJI, SPECIAL_CHARS, SPACES, SLASHES
    }

    public static TestFile generateTestFile(String prefix, int sizeBytes) {
        byte[] content = generateRandomBytes(sizeBytes);
        String name = prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + ".bin";
        return new TestFile(name, content, Digests.md5Base64(content));
    }

    /**
     * 测试文件封装类
     */
    public record TestFile(String name, byte[] content, String md5Base64) {

        public int size() {
            return content.length;
        }

        public String contentAsString() {
            return new String(content, StandardCharsets.UTF_8);
        }
    }
}
