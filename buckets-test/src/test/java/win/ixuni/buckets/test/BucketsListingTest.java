package win.ixuni.buckets.test;

import org.junit.jupiter.api.*;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import win.ixuni.buckets.core.client.BucketsClient;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.exception.NotFoundException;
import win.ixuni.buckets.core.model.BucketEntry;
import win.ixuni.buckets.core.model.BucketObjectEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.util.Payloads;
import win.ixuni.buckets.test.support.FakeBucketsServer;
import win.ixuni.buckets.test.util.TestDataGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 列表测试
 * <p>
 * Pagination across small pages, listing bodies split into small chunks, prefix and delimiter
 * handling, and early cancellation.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class BucketsListingTest {

    private static final String ACCOUNT = "listing-account";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int OBJECT_COUNT = 25;

    private final String bucketName = TestDataGenerator.uniqueName("listing", "bucket");

    private FakeBucketsServer server;
    private BucketsClient client;

    private final List<String> objectNames = new ArrayList<>();

    @BeforeAll
    void setup() {
        server = new FakeBucketsServer(ACCOUNT);

        ClientConfig config = new ClientConfig();
        config.setName("listing-test");
        config.setUrl(server.getUrl());
        config.setAccount(ACCOUNT);
        client = BucketsClient.create(config);

        client.createBucket(bucketName).block(TIMEOUT);

        // 平铺对象
        for (int i = 0; i < OBJECT_COUNT; i++) {
            objectNames.add(String.format("flat-%03d.txt", i));
        }
        // 目录结构
        objectNames.add("dir/a/one.txt");
        objectNames.add("dir/a/two.txt");
        objectNames.add("dir/b/three.txt");
        objectNames.add("dir/four.txt");
        objectNames.add("文档/报告.txt");

        Flux.fromIterable(objectNames)
                .flatMap(name -> client.createBucketObject(Payloads.fromString(name), bucketName, name), 4)
                .blockLast(TIMEOUT);
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

    @BeforeEach
    void resetServer() {
        server.setPageSize(1024);
        server.setChunkSize(7);
    }

    @Test
    @Order(1)
    @DisplayName("分页：每页 4 条，自动跟随 next-marker")
    void testPaginationAcrossPages() {
        server.setPageSize(4);
        int before = server.getRequestCount().get();

        List<String> names = client.listBucketObjects(bucketName)
                .map(BucketObjectEntry::getName)
                .collectList()
                .block(TIMEOUT);

        assertNotNull(names);
        assertEquals(objectNames.stream().sorted().collect(Collectors.toList()), names);
        int pages = server.getRequestCount().get() - before;
        assertEquals((objectNames.size() + 3) / 4, pages, "one request per page");
    }

    @Test
    @Order(2)
    @DisplayName("关闭分页时只返回第一页")
    void testSinglePageWhenPaginationDisabled() {
        server.setPageSize(4);

        List<BucketObjectEntry> entries = client.listBucketObjects(bucketName,
                        ListOptions.builder().paginate(false).build())
                .collectList()
                .block(TIMEOUT);

        assertNotNull(entries);
        assertEquals(4, entries.size());
    }

    @Test
    @Order(3)
    @DisplayName("记录被切成 1 字节的块也能完整解码")
    void testOneByteChunks() {
        server.setChunkSize(1);

        List<BucketObjectEntry> entries = client.listBucketObjects(bucketName).collectList().block(TIMEOUT);

        assertNotNull(entries);
        assertEquals(objectNames.size(), entries.size());
        assertTrue(entries.stream().anyMatch(e -> e.getName().equals("文档/报告.txt")), "unicode names survive");
    }

    @Test
    @Order(4)
    @DisplayName("prefix 过滤")
    void testPrefix() {
        List<String> names = client.listBucketObjects(bucketName, ListOptions.builder().prefix("dir/a/").build())
                .map(BucketObjectEntry::getName)
                .collectList()
                .block(TIMEOUT);

        assertEquals(List.of("dir/a/one.txt", "dir/a/two.txt"), names);
    }

    @Test
    @Order(5)
    @DisplayName("delimiter 将公共前缀汇总为 group 记录")
    void testDelimiterGroups() {
        List<BucketObjectEntry> entries = client.listBucketObjects(bucketName,
                        ListOptions.builder().prefix("dir/").delimiter("/").build())
                .collectList()
                .block(TIMEOUT);

        assertNotNull(entries);
        List<String> groups = entries.stream().filter(BucketObjectEntry::isGroup)
                .map(BucketObjectEntry::getName).collect(Collectors.toList());
        List<String> objects = entries.stream().filter(BucketObjectEntry::isObject)
                .map(BucketObjectEntry::getName).collect(Collectors.toList());

        assertEquals(List.of("dir/a/", "dir/b/"), groups);
        assertEquals(List.of("dir/four.txt"), objects);
        entries.stream().filter(BucketObjectEntry::isGroup).forEach(g -> {
            assertNull(g.getSize());
            assertNull(g.getEtag());
        });
    }

    @Test
    @Order(6)
    @DisplayName("limit 控制每页大小")
    void testLimit() {
        int before = server.getRequestCount().get();

        List<BucketObjectEntry> entries = client.listBucketObjects(bucketName,
                        ListOptions.builder().limit(10).build())
                .collectList()
                .block(TIMEOUT);

        assertNotNull(entries);
        assertEquals(objectNames.size(), entries.size());
        assertEquals((objectNames.size() + 9) / 10, server.getRequestCount().get() - before);
    }

    @Test
    @Order(7)
    @DisplayName("marker 从指定名称之后开始")
    void testMarker() {
        List<String> names = client.listBucketObjects(bucketName, ListOptions.builder().marker("flat-020.txt").build())
                .map(BucketObjectEntry::getName)
                .filter(n -> n.startsWith("flat-"))
                .collectList()
                .block(TIMEOUT);

        assertEquals(List.of("flat-021.txt", "flat-022.txt", "flat-023.txt", "flat-024.txt"), names);
    }

    @Test
    @Order(8)
    @DisplayName("提前取消：take(3) 不会请求后续页")
    void testEarlyCancel() {
        server.setPageSize(2);
        int before = server.getRequestCount().get();

        StepVerifier.create(client.listBucketObjects(bucketName).take(3))
                .expectNextCount(3)
                .expectComplete()
                .verify(TIMEOUT);

        assertTrue(server.getRequestCount().get() - before <= 2, "at most two pages fetched");
    }

    @Test
    @Order(9)
    @DisplayName("listBuckets 分页")
    void testListBucketsPaged() {
        List<String> extra = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            extra.add(bucketName + "-extra-" + i);
        }
        Flux.fromIterable(extra).concatMap(client::createBucket).blockLast(TIMEOUT);
        server.setPageSize(2);

        try {
            List<String> names = client.listBuckets()
                    .map(BucketEntry::getName)
                    .collectList()
                    .block(TIMEOUT);

            assertNotNull(names);
            assertEquals(6, names.size());
            assertTrue(names.containsAll(extra));
            assertTrue(names.contains(bucketName));
        } finally {
            Flux.fromIterable(extra).concatMap(client::deleteBucket).blockLast(TIMEOUT);
        }
    }

    @Test
    @Order(10)
    @DisplayName("列出不存在的 bucket 返回 NotFoundException")
    void testListMissingBucket() {
        StepVerifier.create(client.listBucketObjects(bucketName + "-missing"))
                .expectError(NotFoundException.class)
                .verify(TIMEOUT);
    }
}
