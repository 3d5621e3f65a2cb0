package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveHttpClient;
import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.DuplicateAction;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.SortOrder;
import com.delta.archivescraper.archive.model.SortType;
import com.delta.archivescraper.archive.model.SubmissionParams;
import com.delta.archivescraper.archive.pacing.Pacer;
import com.delta.archivescraper.archive.query.ArchiveQueryBuilder;
import com.delta.archivescraper.archive.query.InvalidFetchRequestException;
import com.delta.archivescraper.archive.retry.RetryPolicy;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;
import com.delta.archivescraper.config.ScraperProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveFetchServiceTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path saveDir;

    private MockWebServer server;
    private FakeArchive archive;
    private ExecutorService fetchExecutor;
    private ExecutorService httpExecutor;
    private ArchiveFetchService service;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        archive = new FakeArchive();
        server = new MockWebServer();
        server.setDispatcher(archive);
        server.start();

        properties = new ScraperProperties();
        properties.setBaseUrl(server.url("/reddit/search").toString());
        properties.setSleepSec(0);
        properties.setBackoffSec(0);
        properties.setMaxRetries(2);
        properties.setTimeoutSeconds(5);
        properties.setPaceMode("manual");
        properties.setTaskNum(2);
        properties.setPageSize(2);
        properties.setSaveDir(saveDir.toString());

        fetchExecutor = Executors.newFixedThreadPool(4);
        httpExecutor = Executors.newFixedThreadPool(4);
        ArchiveQueryBuilder queryBuilder = new ArchiveQueryBuilder(properties);
        ArchiveHttpClient httpClient = new ArchiveHttpClient(properties, MAPPER, httpExecutor);
        PageFetcher pageFetcher = new PageFetcher(httpClient, new Pacer(properties), new RetryPolicy(properties), properties);
        PaginationTaskPool taskPool = new PaginationTaskPool(pageFetcher, fetchExecutor);
        service = new ArchiveFetchService(
            queryBuilder,
            taskPool,
            new CommentAttachmentService(queryBuilder, taskPool),
            new ResultWriter(MAPPER, properties),
            properties
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        fetchExecutor.shutdownNow();
        httpExecutor.shutdownNow();
    }

    @Test
    void handOffStopsAtTheLimit() {
        seedSubmissions(20);

        FetchResult result = service.fetch(request(null, null, 5, null, List.of()));

        assertThat(result.records().keySet()).containsExactly("s20", "s19", "s18", "s17", "s16");
        assertThat(result.streams()).isEqualTo(1);
        assertThat(archive.requests()).hasSize(3);
        assertThat(archive.requests().get(2).queryParameter("size")).isEqualTo("1");
        assertThat(archive.requests().get(1).queryParameter("before")).isEqualTo("190");
    }

    @Test
    void handOffWithoutLimitFetchesOnePage() {
        seedSubmissions(5);

        FetchResult result = service.fetch(request(null, null, null, null, List.of()));

        assertThat(result.records().keySet()).containsExactly("s5", "s4");
        assertThat(archive.requests()).hasSize(1);
    }

    @Test
    void timeSliceSweepCoversTheRangeAndCountsDuplicates() {
        seedSubmissions(20);
        archive.submissions.add(submission("dup", 55, 100, "original"));
        archive.submissions.add(submission("dup", 155, 200, "edited"));

        FetchResult result = service.fetch(request(1L, 201L, null, null, List.of()));

        assertThat(result.streams()).isEqualTo(2);
        assertThat(result.size()).isEqualTo(21);
        assertThat(result.records().keySet()).startsWith("s20", "s19", "s18");
        assertThat(result.duplicates()).containsEntry("dup", 2).hasSize(1);
        assertThat(result.records().get("dup").node().get("selftext").asText()).isEqualTo("edited");
        assertThat(archive.requests())
            .allSatisfy(url -> assertThat(url.queryParameter("after")).isNotNull());
    }

    @Test
    void timeSliceSweepStaysStrictlyInsideTheRequestedBounds() {
        seedSubmissions(20);

        FetchResult result = service.fetch(request(100L, 200L, null, null, List.of()));

        assertThat(result.records().keySet())
            .containsExactly("s19", "s18", "s17", "s16", "s15", "s14", "s13", "s12", "s11")
            .doesNotContain("s10", "s20");
        assertThat(archive.requests())
            .extracting(url -> url.queryParameter("after"))
            .contains("100")
            .allSatisfy(after -> assertThat(Long.parseLong(after)).isGreaterThanOrEqualTo(100L));
    }

    @Test
    void adjacentBoundsLeaveNothingToFetch() {
        seedSubmissions(3);

        assertThatThrownBy(() -> service.fetch(request(100L, 101L, null, null, List.of())))
            .isInstanceOf(InvalidFetchRequestException.class);
        assertThat(archive.requests()).isEmpty();
    }

    @Test
    void unsavableResultIsReportedWithTheFetchedRecords() throws IOException {
        seedSubmissions(3);
        Path blocker = Files.writeString(saveDir.resolve("not-a-dir"), "x");
        properties.setSaveDir(blocker.toString());

        assertThatThrownBy(() -> service.fetch(request(null, null, 3, null, List.of(), "java-posts")))
            .isInstanceOfSatisfying(PartialFetchException.class, e -> {
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.WRITE_FAILED);
                assertThat(e.isTotalFailure()).isFalse();
                assertThat(e.getCause()).isInstanceOf(ResultWriteException.class);
                assertThat(e.partialResult().records().keySet()).containsExactly("s3", "s2", "s1");
            });
    }

    @Test
    void timeSliceLimitIsAppliedAfterSorting() {
        seedSubmissions(20);

        FetchResult result = service.fetch(request(1L, 201L, 3, null, List.of()));

        assertThat(result.records().keySet()).containsExactly("s20", "s19", "s18");
    }

    @Test
    void ascendingSweepReturnsOldestFirst() {
        seedSubmissions(6);

        FetchRequest ascending = new FetchRequest(
            SubmissionParams.forSubreddit("java", 1L, 61L),
            SortType.CREATED_UTC,
            SortOrder.ASC,
            null,
            null,
            false,
            null,
            null,
            null
        );
        FetchResult result = service.fetch(ascending);

        assertThat(result.records().keySet()).containsExactly("s1", "s2", "s3", "s4", "s5", "s6");
    }

    @Test
    void failureMidStreamKeepsEarlierPagesAndWritesThemAside() {
        seedSubmissions(20);
        archive.failWith(404, call -> call >= 3);

        assertThatThrownBy(() -> service.fetch(request(null, null, 10, 1, List.of(), "java-posts")))
            .isInstanceOfSatisfying(PartialFetchException.class, e -> {
                assertThat(e.isTotalFailure()).isFalse();
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_4XX);
                assertThat(e.boundary().streamId()).isEqualTo("stream-1");
                assertThat(e.boundary().pagesFetched()).isEqualTo(2);
                assertThat(e.partialResult().records().keySet()).containsExactly("s20", "s19", "s18", "s17");
                assertThat(e.partialResult().file()).isEqualTo(saveDir.resolve("java-posts_partial.json"));
            });
        assertThat(saveDir.resolve("java-posts_partial.json")).exists();
        assertThat(saveDir.resolve("java-posts.json")).doesNotExist();
    }

    @Test
    void failureBeforeAnyRecordIsTotalAndWritesNothing() throws IOException {
        seedSubmissions(4);
        archive.failWith(404, call -> true);

        assertThatThrownBy(() -> service.fetch(request(null, null, 4, null, List.of(), "java-posts")))
            .isInstanceOfSatisfying(PartialFetchException.class, e -> {
                assertThat(e.isTotalFailure()).isTrue();
                assertThat(e.partialResult().file()).isNull();
            });
        try (Stream<Path> files = Files.list(saveDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void serverErrorsAreRetriedUntilAttemptsRunOut() {
        seedSubmissions(4);
        archive.failWith(500, call -> true);

        assertThatThrownBy(() -> service.fetch(request(null, null, 4, null, List.of())))
            .isInstanceOfSatisfying(PartialFetchException.class, e ->
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.RETRY_EXHAUSTED)
            );
        assertThat(archive.requests()).hasSize(2);
    }

    @Test
    void commentsAreNestedUnderTheirSubmissions() {
        seedSubmissions(3);
        archive.comments.add(comment("c1", "s1", 11));
        archive.comments.add(comment("c2", "s1", 12));
        archive.comments.add(comment("c3", "s2", 21));
        archive.comments.add(comment("c4", "s2", 22));
        archive.comments.add(comment("c5", "s2", 23));

        FetchRequest withComments = new FetchRequest(
            SubmissionParams.forSubreddit("java", null, null),
            null,
            null,
            3,
            DuplicateAction.KEEP_NEWEST,
            true,
            null,
            null,
            null
        );
        FetchResult result = service.fetch(withComments);

        assertThat(result.records().keySet()).containsExactly("s3", "s2", "s1");
        assertThat(commentIds(result.records().get("s1"))).containsExactly("c2", "c1");
        assertThat(commentIds(result.records().get("s2"))).containsExactly("c5", "c4", "c3");
        assertThat(commentIds(result.records().get("s3"))).isEmpty();
        assertThat(archive.requests())
            .filteredOn(url -> url.encodedPath().contains("/comment/"))
            .allSatisfy(url -> assertThat(url.queryParameter("sort_type")).isEqualTo("created_utc"));
    }

    @Test
    void resultIsWrittenToTheSaveDirectory() throws IOException {
        seedSubmissions(3);

        FetchResult result = service.fetch(request(null, null, 3, null, List.of(), "java-posts.json"));

        Path written = saveDir.resolve("java-posts.json");
        assertThat(result.file()).isEqualTo(written);
        JsonNode saved = MAPPER.readTree(written.toFile());
        List<String> keys = new ArrayList<>();
        saved.fieldNames().forEachRemaining(keys::add);
        assertThat(keys).containsExactly("s3", "s2", "s1");
        assertThat(saved.get("s2").get("title").asText()).isEqualTo("Post s2");
    }

    @Test
    void fieldSelectionTrimsEveryRecord() {
        seedSubmissions(2);

        FetchResult result = service.fetch(request(null, null, 2, null, List.of("title", "created_utc")));

        assertThat(result.records().values())
            .allSatisfy(record -> {
                List<String> names = new ArrayList<>();
                record.node().fieldNames().forEachRemaining(names::add);
                assertThat(names).containsExactlyInAnyOrder("title", "created_utc");
            });
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyCall() {
        seedSubmissions(3);

        assertThatThrownBy(() -> service.fetch(request(null, null, 0, null, List.of())))
            .isInstanceOf(InvalidFetchRequestException.class);
        assertThat(archive.requests()).isEmpty();
    }

    private FetchRequest request(Long after, Long before, Integer limit, Integer concurrency, List<String> fields) {
        return request(after, before, limit, concurrency, fields, null);
    }

    private FetchRequest request(
        Long after,
        Long before,
        Integer limit,
        Integer concurrency,
        List<String> fields,
        String fileName
    ) {
        return new FetchRequest(
            SubmissionParams.forSubreddit("java", after, before),
            SortType.CREATED_UTC,
            SortOrder.DESC,
            limit,
            null,
            false,
            concurrency,
            fileName,
            fields
        );
    }

    /** Submissions s1..sN created at 10, 20, ... seconds. */
    private void seedSubmissions(int count) {
        for (int i = 1; i <= count; i++) {
            archive.submissions.add(submission("s" + i, i * 10L, 0, "text of s" + i));
        }
    }

    private static ObjectNode submission(String id, long createdUtc, long retrievedOn, String selftext) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", id);
        node.put("created_utc", createdUtc);
        node.put("retrieved_on", retrievedOn);
        node.put("subreddit", "java");
        node.put("title", "Post " + id);
        node.put("selftext", selftext);
        return node;
    }

    private static ObjectNode comment(String id, String parentId, long createdUtc) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", id);
        node.put("created_utc", createdUtc);
        node.put("link_id", "t3_" + parentId);
        node.put("body", "reply " + id);
        return node;
    }

    private static List<String> commentIds(ArchiveRecord record) {
        List<String> ids = new ArrayList<>();
        record.node().get("comments").forEach(node -> ids.add(node.get("id").asText()));
        return ids;
    }

    /** In-memory archive honouring the exclusive time bounds, sort direction and page size. */
    private static final class FakeArchive extends Dispatcher {
        final List<ObjectNode> submissions = new CopyOnWriteArrayList<>();
        final List<ObjectNode> comments = new CopyOnWriteArrayList<>();
        private final List<HttpUrl> requests = new CopyOnWriteArrayList<>();
        private final AtomicInteger calls = new AtomicInteger();
        private volatile int failureStatus;
        private volatile IntPredicate failOn = call -> false;

        void failWith(int status, IntPredicate onCall) {
            this.failureStatus = status;
            this.failOn = onCall;
        }

        List<HttpUrl> requests() {
            return requests;
        }

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            HttpUrl url = request.getRequestUrl();
            requests.add(url);
            if (failOn.test(calls.incrementAndGet())) {
                return new MockResponse().setResponseCode(failureStatus).setBody("{\"detail\":\"nope\"}");
            }
            boolean commentEndpoint = url.encodedPath().contains("/comment/");
            List<ObjectNode> source = commentEndpoint ? comments : submissions;
            Long after = longParam(url, "after");
            Long before = longParam(url, "before");
            String linkId = url.queryParameter("link_id");
            int size = Integer.parseInt(url.queryParameter("size"));
            Comparator<ObjectNode> byCreated = Comparator.comparingLong(node -> node.get("created_utc").asLong());
            if (!"asc".equals(url.queryParameter("sort"))) {
                byCreated = byCreated.reversed();
            }

            ObjectNode body = MAPPER.createObjectNode();
            ArrayNode data = body.putArray("data");
            source.stream()
                .filter(node -> after == null || node.get("created_utc").asLong() > after)
                .filter(node -> before == null || node.get("created_utc").asLong() < before)
                .filter(node -> linkId == null || node.get("link_id").asText().equals("t3_" + linkId))
                .sorted(byCreated)
                .limit(size)
                .forEach(data::add);
            return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body.toString());
        }

        private static Long longParam(HttpUrl url, String name) {
            String value = url.queryParameter(name);
            return value == null ? null : Long.parseLong(value);
        }
    }
}
