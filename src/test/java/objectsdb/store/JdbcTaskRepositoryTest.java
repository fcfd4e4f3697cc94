package objectsdb.store;

import objectsdb.H2Databases;
import objectsdb.model.Task;
import objectsdb.model.TaskReportResult;
import objectsdb.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(H2Databases.config("test-tasks"));
        QueryBuilder queries = new QueryBuilder(db);
        repo = new JdbcTaskRepository(queries, new TaskClaimCoordinator(db, queries, 8, null));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task");
            conn.commit();
        }
    }

    @Test
    void insertAndFindById() {
        int id = repo.insert(Task.builder()
                .taskType("GRASP_PLANNING")
                .scaledModelId(3)
                .handName("WILLOW_GRIPPER_2010")
                .config("{\"planner\":\"eigen\"}")
                .build());

        Optional<Task> found = repo.findById(id);
        assertTrue(found.isPresent());
        assertEquals(id, found.get().taskId());
        assertEquals("GRASP_PLANNING", found.get().taskType());
        assertEquals(3, found.get().scaledModelId());
        assertEquals("{\"planner\":\"eigen\"}", found.get().config());
        assertEquals(TaskStatus.PENDING, found.get().status());
        assertNull(found.get().claimedBy());
    }

    @Test
    void findByIdMissing() {
        assertTrue(repo.findById(12345).isEmpty());
    }

    @Test
    void findAndCountByStatus() {
        repo.insert(task(1));
        repo.insert(task(2));
        repo.insert(task(3).toBuilder().status(TaskStatus.COMPLETE).build());

        List<Task> pending = repo.findByStatus(TaskStatus.PENDING);
        assertEquals(List.of(1, 2), pending.stream().map(Task::taskId).toList());
        assertEquals(2, repo.countByStatus(TaskStatus.PENDING));
        assertEquals(1, repo.countByStatus(TaskStatus.COMPLETE));
        assertEquals(0, repo.countByStatus(TaskStatus.ERROR));
    }

    @Test
    void completeTask() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");

        assertEquals(TaskReportResult.ACCEPTED, repo.complete(1, "worker-1", "42 grasps"));

        Task found = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.COMPLETE, found.status());
        assertEquals("42 grasps", found.outcome());
        assertNotNull(found.finishedAt());
        assertEquals("worker-1", found.claimedBy());
    }

    @Test
    void completeTaskIdempotent() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");

        assertEquals(TaskReportResult.ACCEPTED, repo.complete(1, "worker-1", "first"));
        assertEquals(TaskReportResult.ALREADY_FINISHED, repo.complete(1, "worker-1", "second"));

        assertEquals("first", repo.findById(1).orElseThrow().outcome());
    }

    @Test
    void completeWrongWorker() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");

        assertEquals(TaskReportResult.WRONG_WORKER, repo.complete(1, "worker-2", null));
        assertEquals(TaskStatus.RUNNING, repo.findById(1).orElseThrow().status());
    }

    @Test
    void completeUnclaimedTask() {
        repo.insert(task(1));

        assertEquals(TaskReportResult.NOT_RUNNING, repo.complete(1, "worker-1", null));
        assertEquals(TaskStatus.PENDING, repo.findById(1).orElseThrow().status());
    }

    @Test
    void completeMissingTask() {
        assertEquals(TaskReportResult.NOT_FOUND, repo.complete(99, "worker-1", null));
    }

    @Test
    void markError() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");

        assertEquals(TaskReportResult.ACCEPTED, repo.markError(1, "worker-1", "planner crashed"));

        Task found = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.ERROR, found.status());
        assertEquals("planner crashed", found.outcome());
        // errors are not retried on their own
        assertTrue(repo.acquireNextTask("worker-2").isEmpty());
        assertEquals(TaskReportResult.ALREADY_FINISHED, repo.complete(1, "worker-1", null));
    }

    @Test
    void requeueRunningTask() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");

        assertTrue(repo.requeue(1));

        Task found = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.PENDING, found.status());
        assertNull(found.claimedBy());
        assertNull(found.claimedAt());

        Task reclaimed = repo.acquireNextTask("worker-2").orElseThrow();
        assertEquals(1, reclaimed.taskId());
        assertEquals("worker-2", reclaimed.claimedBy());

        // the original worker lost the task
        assertEquals(TaskReportResult.WRONG_WORKER, repo.complete(1, "worker-1", null));
    }

    @Test
    void requeueErrorTask() {
        repo.insert(task(1));
        repo.acquireNextTask("worker-1");
        repo.markError(1, "worker-1", "boom");

        assertTrue(repo.requeue(1));
        Task found = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.PENDING, found.status());
        assertNull(found.outcome());
        assertNull(found.finishedAt());
    }

    @Test
    void requeueIgnoresPendingAndCompleteTasks() {
        repo.insert(task(1));
        repo.insert(task(2).toBuilder().status(TaskStatus.COMPLETE).build());

        assertFalse(repo.requeue(1));
        assertFalse(repo.requeue(2));
        assertFalse(repo.requeue(3));
        assertEquals(TaskStatus.COMPLETE, repo.findById(2).orElseThrow().status());
    }

    @Test
    void findStaleRunning() throws InterruptedException {
        repo.insert(task(1));
        repo.insert(task(2));
        repo.acquireNextTask("worker-1");

        Thread.sleep(20);

        List<Task> stale = repo.findStaleRunning(Instant.now());
        assertEquals(1, stale.size());
        assertEquals(1, stale.get(0).taskId());

        assertTrue(repo.findStaleRunning(Instant.now().minusSeconds(3600)).isEmpty());
    }

    @Test
    void requeueStaleResetsOnlyOldClaims() throws InterruptedException {
        repo.insert(task(1));
        repo.insert(task(2));
        repo.insert(task(3));
        repo.acquireNextTask("worker-1");
        repo.acquireNextTask("worker-2");
        repo.markError(2, "worker-2", "boom");

        Thread.sleep(20);
        Instant cutoff = Instant.now();
        Thread.sleep(20);
        repo.acquireNextTask("worker-3");

        assertEquals(1, repo.requeueStale(cutoff));

        Task first = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.PENDING, first.status());
        assertNull(first.claimedBy());
        assertNull(first.claimedAt());
        assertEquals(TaskStatus.ERROR, repo.findById(2).orElseThrow().status());
        assertEquals("worker-3", repo.findById(3).orElseThrow().claimedBy());
    }

    @Test
    void requeueStaleKeepsAClaimMadeAfterTheCutoff() throws InterruptedException {
        repo.insert(task(1));
        repo.acquireNextTask("crashed-worker");

        Thread.sleep(20);
        Instant cutoff = Instant.now();
        assertEquals(List.of(1), repo.findStaleRunning(cutoff).stream().map(Task::taskId).toList());

        // recovered and claimed again before the stale sweep writes anything
        assertTrue(repo.requeue(1));
        Thread.sleep(20);
        assertEquals(1, repo.acquireNextTask("fresh-worker").orElseThrow().taskId());

        assertEquals(0, repo.requeueStale(cutoff));

        Task task = repo.findById(1).orElseThrow();
        assertEquals(TaskStatus.RUNNING, task.status());
        assertEquals("fresh-worker", task.claimedBy());
        assertTrue(repo.acquireNextTask("other-worker").isEmpty());
        assertEquals(TaskReportResult.ACCEPTED, repo.complete(1, "fresh-worker", "done"));
    }

    @Test
    void claimInstantIsIndependentOfTheJvmTimeZone() {
        Instant claimedAt = Instant.parse("2026-03-01T12:34:56.123456Z");
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("America/Los_Angeles"));
            repo.insert(task(1).toBuilder()
                    .status(TaskStatus.RUNNING)
                    .claimedBy("worker-1")
                    .claimedAt(claimedAt)
                    .build());

            TimeZone.setDefault(TimeZone.getTimeZone("Asia/Tokyo"));
            assertEquals(claimedAt, repo.findById(1).orElseThrow().claimedAt());
            assertTrue(repo.findStaleRunning(claimedAt).isEmpty());
            assertEquals(1, repo.findStaleRunning(claimedAt.plusSeconds(1)).size());
        } finally {
            TimeZone.setDefault(original);
        }
    }

    private static Task task(int taskId) {
        return Task.builder()
                .taskId(taskId)
                .taskType("GRASP_PLANNING")
                .scaledModelId(3)
                .handName("WILLOW_GRIPPER_2010")
                .config("{}")
                .build();
    }
}
