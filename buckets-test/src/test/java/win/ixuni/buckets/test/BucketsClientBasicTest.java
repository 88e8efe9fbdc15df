package win.ixuni.buckets.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;
import win.ixuni.buckets.core.client.BucketsClient;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.exception.ClientClosedException;
import win.ixuni.buckets.core.exception.NotFoundException;
import win.ixuni.buckets.core.model.*;
import win.ixuni.buckets.core.operation.BucketsOperationKind;
import win.ixuni.buckets.core.request.RequestFactory;
import win.ixuni.buckets.core.transport.TransportResponse;
import win.ixuni.buckets.core.util.Digests;
import win.ixuni.buckets.core.util.Payloads;
import win.ixuni.buckets.test.support.FakeBucketsServer;
import win.ixuni.buckets.test.util.DataIntegrityAssert;
import win.ixuni.buckets.test.util.TestDataGenerator;
import win.ixuni.buckets.transport.webclient.WebClientTransport;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Buckets 客户端基础流程测试
 * <p>
 * A quick run through every client method against an in-process server, in the order a real
 * caller would use them. The last ordered step checks that each public operation was covered
 * here at least once.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class BucketsClientBasicTest {

    private static final String ACCOUNT = "test-account";
    private static final String SMALL_FILE = "/corpus/small.file";
    private static final Pattern MTIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{3}Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String bucketName = TestDataGenerator.uniqueName("basic", "bucket");
    private final String objectName = TestDataGenerator.uniqueName("basic", "object");

    private FakeBucketsServer server;
    private ClientConfig config;
    private BucketsClient client;

    private byte[] smallFileContent;
    private String smallFileMd5;

    private final Set<BucketsOperationKind> kindsToTest = EnumSet.allOf(BucketsOperationKind.class);

    @BeforeAll
    void setup() throws Exception {
        server = new FakeBucketsServer(ACCOUNT);

        config = new ClientConfig();
        config.setName("basic-test");
        config.setUrl(server.getUrl());
        config.setAccount(ACCOUNT);
        client = BucketsClient.create(config);

        try (InputStream in = getClass().getResourceAsStream(SMALL_FILE)) {
            assertNotNull(in, SMALL_FILE + " missing from the test classpath");
            smallFileContent = in.readAllBytes();
        }
        smallFileMd5 = Digests.md5Base64(smallFileContent);
    }

    @AfterAll
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }

    @Test
    @Order(1)
    @DisplayName("isBucketsSupported：服务支持 buckets")
    void testIsBucketsSupported() {
        kindsToTest.remove(BucketsOperationKind.IS_BUCKETS_SUPPORTED);

        StepVerifier.create(client.isBucketsSupported())
                .expectNext(true)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    @Order(2)
    @DisplayName("createBucket")
    void testCreateBucket() {
        kindsToTest.remove(BucketsOperationKind.CREATE_BUCKET);

        ObjectResponse response = client.createBucket(bucketName).block(TIMEOUT);
        assertNotNull(response);
        assertEquals(204, response.getStatus());
    }

    @Test
    @Order(3)
    @DisplayName("headBucket")
    void testHeadBucket() {
        kindsToTest.remove(BucketsOperationKind.HEAD_BUCKET);

        ObjectResponse response = client.headBucket(bucketName).block(TIMEOUT);
        assertNotNull(response);
        assertEquals(200, response.getStatus());
    }

    @Test
    @Order(4)
    @DisplayName("listBuckets：至少包含刚创建的 bucket")
    void testListBuckets() {
        kindsToTest.remove(BucketsOperationKind.LIST_BUCKETS);

        List<BucketEntry> buckets = client.listBuckets().collectList().block(TIMEOUT);
        assertNotNull(buckets);
        assertTrue(buckets.size() >= 1, "got at least one bucket in listing");
        assertTrue(buckets.stream().anyMatch(b -> b.getName().equals(bucketName)),
                "listing contains " + bucketName);
        buckets.forEach(b -> assertEquals(BucketEntry.TYPE, b.getType()));
    }

    @Test
    @Order(5)
    @DisplayName("createBucketObject：从文件流上传，带 m-foo 元数据")
    void testCreateBucketObject() {
        kindsToTest.remove(BucketsOperationKind.CREATE_BUCKET_OBJECT);

        ObjectRequestOptions options = ObjectRequestOptions.builder()
                .header("m-foo", "bar")
                .build();
        ObjectResponse response = client.createBucketObject(
                        Payloads.fromInputStream(() -> getClass().getResourceAsStream(SMALL_FILE)),
                        bucketName, objectName, options)
                .block(TIMEOUT);

        assertNotNull(response);
        assertEquals(204, response.getStatus());
        assertEquals(smallFileMd5, response.getHeaders().getFirst("computed-md5"));
        assertTrue(server.hasObject(bucketName, objectName));
    }

    @Test
    @Order(6)
    @DisplayName("headBucketObject：校验 content-md5 与元数据")
    void testHeadBucketObject() {
        kindsToTest.remove(BucketsOperationKind.HEAD_BUCKET_OBJECT);

        ObjectResponse response = client.headBucketObject(bucketName, objectName).block(TIMEOUT);
        assertNotNull(response);
        assertEquals(200, response.getStatus());
        assertEquals(smallFileMd5, response.getHeaders().getContentMd5());
        assertEquals("bar", response.getHeaders().getFirst("m-foo"));
        assertEquals(Map.of("foo", "bar"), response.getHeaders().getUserMetadata());
    }

    @Test
    @Order(7)
    @DisplayName("getBucketObject：headers 先于内容，内容与源文件一致")
    void testGetBucketObject() {
        kindsToTest.remove(BucketsOperationKind.GET_BUCKET_OBJECT);

        ObjectDownload download = client.getBucketObject(bucketName, objectName).block(TIMEOUT);
        assertNotNull(download);
        assertEquals(200, download.getStatus());
        assertEquals(smallFileMd5, download.getHeaders().getContentMd5());
        assertEquals(smallFileContent.length, download.getHeaders().getContentLength());
        assertEquals("bar", download.getHeaders().getFirst("m-foo"));

        byte[] downloaded = DataIntegrityAssert.readAll(download);
        DataIntegrityAssert.assertContentEquals(smallFileContent, downloaded);
    }

    @Test
    @Order(8)
    @DisplayName("putBucketObjectMetadata：替换 m-foo")
    void testPutBucketObjectMetadata() {
        kindsToTest.remove(BucketsOperationKind.PUT_BUCKET_OBJECT_METADATA);

        ObjectRequestOptions options = ObjectRequestOptions.builder()
                .header("m-foo", "baz")
                .build();
        ObjectResponse response = client.putBucketObjectMetadata(bucketName, objectName, options).block(TIMEOUT);

        assertNotNull(response);
        assertEquals("baz", response.getHeaders().getFirst("m-foo"));

        ObjectResponse head = client.headBucketObject(bucketName, objectName).block(TIMEOUT);
        assertNotNull(head);
        DataIntegrityAssert.assertMetadataEquals(Map.of("foo", "baz"), head.getHeaders().getUserMetadata());
        assertEquals(smallFileMd5, head.getHeaders().getContentMd5(), "metadata update keeps the payload");
    }

    @Test
    @Order(9)
    @DisplayName("listBucketObjects：一个对象，七个字段齐全")
    void testListBucketObjects() {
        kindsToTest.remove(BucketsOperationKind.LIST_BUCKET_OBJECTS);

        List<BucketObjectEntry> objects = client.listBucketObjects(bucketName).collectList().block(TIMEOUT);
        assertNotNull(objects);
        assertEquals(1, objects.size(), "got one object in bucket " + bucketName + ": " + objects);

        BucketObjectEntry entry = objects.get(0);
        assertEquals(objectName, entry.getName());
        assertEquals(BucketObjectEntry.TYPE_OBJECT, entry.getType());
        assertTrue(entry.isObject());
        assertNotNull(entry.getMtime());
        assertNotNull(entry.getEtag());
        assertEquals(Long.valueOf(smallFileContent.length), entry.getSize());
        assertEquals(RequestFactory.DEFAULT_CONTENT_TYPE, entry.getContentType());
        assertEquals(smallFileMd5, entry.getContentMd5());
    }

    @Test
    @Order(10)
    @DisplayName("listing 原始记录的 mtime 为毫秒精度 ISO-8601")
    void testRawListingMtimeFormat() throws Exception {
        WebClientTransport transport = new WebClientTransport(config);
        try {
            TransportResponse response = transport
                    .exchange(new RequestFactory(config).listObjects(bucketName, ListOptions.defaults()))
                    .block(TIMEOUT);
            assertNotNull(response);
            assertEquals(200, response.getStatus());

            byte[] body = DataIntegrityAssert.readAll(response.getBody());
            String firstLine = new String(body, StandardCharsets.UTF_8).split("\n")[0];
            JsonNode record = new ObjectMapper().readTree(firstLine);

            assertTrue(MTIME.matcher(record.get("mtime").asText()).matches(), "mtime: " + record.get("mtime"));
            assertTrue(record.get("etag").isTextual());
            assertTrue(record.get("size").isNumber());
            assertTrue(record.get("contentType").isTextual());
            assertTrue(record.get("contentMD5").isTextual());
        } finally {
            transport.shutdown().block(TIMEOUT);
        }
    }

    @Test
    @Order(11)
    @DisplayName("deleteBucketObject")
    void testDeleteBucketObject() {
        kindsToTest.remove(BucketsOperationKind.DELETE_BUCKET_OBJECT);

        ObjectResponse response = client.deleteBucketObject(bucketName, objectName).block(TIMEOUT);
        assertNotNull(response);
        assertFalse(server.hasObject(bucketName, objectName));

        StepVerifier.create(client.headBucketObject(bucketName, objectName))
                .expectError(NotFoundException.class)
                .verify(TIMEOUT);
    }

    @Test
    @Order(12)
    @DisplayName("deleteBucket")
    void testDeleteBucket() {
        kindsToTest.remove(BucketsOperationKind.DELETE_BUCKET);

        ObjectResponse response = client.deleteBucket(bucketName).block(TIMEOUT);
        assertNotNull(response);

        StepVerifier.create(client.headBucket(bucketName))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(NotFoundException.class, e);
                    assertEquals(404, ((NotFoundException) e).getHttpStatus());
                })
                .verify(TIMEOUT);
    }

    @Test
    @Order(13)
    @DisplayName("每个客户端方法都至少测试过一次")
    void testAllClientMethodsCovered() {
        assertTrue(kindsToTest.isEmpty(), "client methods remaining to test: " + kindsToTest);
    }

    @Test
    @Order(14)
    @DisplayName("close 之后的调用以 ClientClosedException 失败")
    void testClose() {
        client.close();
        assertTrue(client.isClosed());

        StepVerifier.create(client.isBucketsSupported())
                .expectError(ClientClosedException.class)
                .verify(TIMEOUT);
    }
}
