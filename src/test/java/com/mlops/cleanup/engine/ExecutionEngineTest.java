package com.mlops.cleanup.engine;

import com.mlops.cleanup.config.CleanupConfig;
import com.mlops.cleanup.kubernetes.DeleteOutcome;
import com.mlops.cleanup.kubernetes.FinalizerPatcher;
import com.mlops.cleanup.kubernetes.ResourceDeleter;
import com.mlops.cleanup.kubernetes.ResourceLister;
import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.ExecutionResult;
import com.mlops.cleanup.model.ItemOutcome;
import com.mlops.cleanup.model.ItemResult;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import com.mlops.cleanup.model.RunOutcome;
import com.mlops.cleanup.model.SequenceGroup;
import com.mlops.cleanup.planner.CleanupPlanner;
import com.mlops.cleanup.support.InMemoryCluster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.mlops.cleanup.support.Resources.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExecutionEngineTest {

    private InMemoryCluster cluster;
    private CleanupConfig.Execution settings;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryCluster();
        settings = new CleanupConfig.Execution();
        engine = new ExecutionEngine(cluster, cluster, cluster, settings, Clock.systemUTC());
    }

    private static CleanupPlan planOf(Classification... orphaned) {
        return new CleanupPlanner().plan(List.of(orphaned));
    }

    @Test
    @DisplayName("Dry run issues no mutating calls and reports every item")
    void testDryRun() {
        ResourceDescriptor ns = namespace("leftover-test", 0);
        ResourceDescriptor done = pod("mlops-demo", "done", ResourcePhase.SUCCEEDED);
        cluster.add(ns, done);
        CleanupPlan plan = planOf(
                Classification.orphaned(ns, "unmanaged-and-empty"),
                Classification.orphaned(done, "terminal-pod"));

        ExecutionResult result = engine.execute(plan, ExecutionMode.DRY_RUN);

        assertEquals(RunOutcome.COMPLETED, result.getOutcome());
        assertEquals(2, result.getItems().size());
        for (ItemResult item : result.getItems()) {
            assertFalse(item.isAttempted());
            assertTrue(item.isSucceeded());
            assertEquals(ItemOutcome.DRY_RUN, item.getOutcome());
        }
        assertTrue(cluster.getDeleteLog().isEmpty());
        assertTrue(cluster.contains(ns));
        assertTrue(cluster.contains(done));
    }

    @Test
    @DisplayName("Live run deletes every item and keeps plan order in the result")
    void testLiveRun() {
        ResourceDescriptor done = pod("mlops-demo", "done", ResourcePhase.SUCCEEDED);
        ResourceDescriptor failed = pod("mlops-demo", "crashed", ResourcePhase.FAILED);
        ResourceDescriptor temp = configMap("data-plane", "temp-cache-config");
        cluster.add(done, failed, temp);
        CleanupPlan plan = planOf(
                Classification.orphaned(temp, "disposable-name-pattern"),
                Classification.orphaned(done, "terminal-pod"),
                Classification.orphaned(failed, "terminal-pod"));

        ExecutionResult result = engine.execute(plan, ExecutionMode.LIVE);

        assertEquals(RunOutcome.COMPLETED, result.getOutcome());
        assertFalse(result.hasFailures());
        for (int i = 0; i < plan.size(); i++) {
            assertSame(plan.getDeletions().get(i), result.getItems().get(i).getDeletion());
            assertEquals(ItemOutcome.DELETED, result.getItems().get(i).getOutcome());
        }
        assertFalse(cluster.contains(done));
        assertFalse(cluster.contains(failed));
        assertFalse(cluster.contains(temp));
        assertEquals(3, result.getCountsByOutcome().get(ItemOutcome.DELETED));
    }

    @Test
    @DisplayName("A group starts only after the previous group finished")
    void testGroupOrdering() {
        List<Classification> orphaned = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ResourceDescriptor p = pod("batch-" + i, "pod-" + i, ResourcePhase.SUCCEEDED);
            ResourceDescriptor ns = namespace("empty-" + i, 0);
            cluster.add(p, ns);
            orphaned.add(Classification.orphaned(p, "terminal-pod"));
            orphaned.add(Classification.orphaned(ns, "unmanaged-and-empty"));
        }
        ResourceDescriptor crd = crd("widgets.example.com");
        cluster.add(crd);
        orphaned.add(Classification.orphaned(crd, "unrecognized-crd"));
        CleanupPlan plan = new CleanupPlanner().plan(orphaned);

        ExecutionResult result = engine.execute(plan, ExecutionMode.LIVE);

        Instant lastOfPreviousGroup = null;
        SequenceGroup previous = null;
        Instant lastFinished = Instant.MIN;
        for (ItemResult item : result.getItems()) {
            SequenceGroup group = item.getDeletion().getSequenceGroup();
            if (group != previous) {
                lastOfPreviousGroup = lastFinished;
                previous = group;
            }
            assertFalse(item.getStartedAt().isBefore(lastOfPreviousGroup),
                    item.getDeletion().getDescriptor().getDisplayId() + " started before the previous group ended");
            if (item.getFinishedAt().isAfter(lastFinished)) {
                lastFinished = item.getFinishedAt();
            }
        }

        List<String> log = cluster.getDeleteLog();
        int lastPod = -1;
        int firstNamespace = Integer.MAX_VALUE;
        for (int i = 0; i < log.size(); i++) {
            if (log.get(i).startsWith(ResourceKind.POD.getDisplayName())) {
                lastPod = Math.max(lastPod, i);
            }
            if (log.get(i).startsWith(ResourceKind.NAMESPACE.getDisplayName())) {
                firstNamespace = Math.min(firstNamespace, i);
            }
        }
        assertTrue(lastPod < firstNamespace);
        assertEquals("CustomResourceDefinition widgets.example.com", log.get(log.size() - 1));
    }

    @Test
    @DisplayName("Already absent resource counts as success")
    void testAlreadyAbsent() {
        ResourceDescriptor gone = pod("mlops-demo", "gone", ResourcePhase.SUCCEEDED);
        CleanupPlan plan = planOf(Classification.orphaned(gone, "terminal-pod"));

        ExecutionResult result = engine.execute(plan, ExecutionMode.LIVE);

        ItemResult item = result.getItems().get(0);
        assertTrue(item.isAttempted());
        assertTrue(item.isSucceeded());
        assertTrue(item.isAlreadyAbsent());
        assertEquals(ItemOutcome.ALREADY_ABSENT, item.getOutcome());
        assertFalse(result.hasFailures());
    }

    @Test
    @DisplayName("One failing item does not stop the others")
    void testFailureIsolation() {
        ResourceDescriptor broken = pod("mlops-demo", "broken", ResourcePhase.FAILED);
        ResourceDescriptor fine = pod("mlops-demo", "fine", ResourcePhase.SUCCEEDED);
        ResourceDescriptor ns = namespace("leftover-test", 0);
        cluster.add(broken, fine, ns).failDeletion(broken, "pods \"broken\" is forbidden");
        CleanupPlan plan = planOf(
                Classification.orphaned(broken, "terminal-pod"),
                Classification.orphaned(fine, "terminal-pod"),
                Classification.orphaned(ns, "unmanaged-and-empty"));

        ExecutionResult result = engine.execute(plan, ExecutionMode.LIVE);

        assertEquals(RunOutcome.COMPLETED, result.getOutcome());
        assertEquals(1, result.getFailureCount());
        ItemResult failedItem = result.getItems().get(0);
        assertEquals(ItemOutcome.FAILED, failedItem.getOutcome());
        assertTrue(failedItem.getErrorMessage().contains("forbidden"));
        assertFalse(cluster.contains(fine));
        assertFalse(cluster.contains(ns));
    }

    @Test
    @DisplayName("Stuck namespace is recovered with a single finalizer clear")
    void testStuckNamespaceRecovered() {
        ResourceDescriptor ns = namespace("leftover-test", 0);
        cluster.add(ns).stuckNamespace("leftover-test");

        ExecutionResult result = engine.execute(
                planOf(Classification.orphaned(ns, "unmanaged-and-empty")), ExecutionMode.LIVE);

        ItemResult item = result.getItems().get(0);
        assertTrue(item.isSucceeded());
        assertTrue(item.isRecoveryApplied());
        assertEquals(ItemOutcome.RECOVERED, item.getOutcome());
        assertEquals(List.of("Namespace leftover-test"), cluster.getFinalizerClears());
        assertFalse(cluster.contains(ns));
    }

    @Test
    @DisplayName("Namespace still terminating after recovery is reported for manual intervention")
    void testStuckNamespaceNotRecovered() {
        ResourceDescriptor ns = namespace("leftover-test", 0);
        cluster.add(ns).permanentlyStuckNamespace("leftover-test");

        ExecutionResult result = engine.execute(
                planOf(Classification.orphaned(ns, "unmanaged-and-empty")), ExecutionMode.LIVE);

        ItemResult item = result.getItems().get(0);
        assertFalse(item.isSucceeded());
        assertTrue(item.isRecoveryApplied());
        assertEquals(ItemResult.STUCK_TERMINATING, item.getErrorMessage());
        assertEquals(1, cluster.getFinalizerClears().size());
        assertTrue(result.hasFailures());
    }

    @Test
    @DisplayName("Timed out namespace that is not terminating gets no finalizer clear")
    void testTimeoutWithoutTerminating() {
        ResourceLister lister = mock(ResourceLister.class);
        ResourceDeleter deleter = mock(ResourceDeleter.class);
        FinalizerPatcher patcher = mock(FinalizerPatcher.class);
        ResourceDescriptor ns = namespace("leftover-test", 0);
        when(deleter.delete(eq(ns), any(Duration.class))).thenReturn(DeleteOutcome.TIMED_OUT);
        when(lister.currentPhase(ns)).thenReturn(Optional.of(ResourcePhase.ACTIVE));
        ExecutionEngine mocked = new ExecutionEngine(lister, deleter, patcher, settings, Clock.systemUTC());

        ExecutionResult result = mocked.execute(
                planOf(Classification.orphaned(ns, "unmanaged-and-empty")), ExecutionMode.LIVE);

        assertEquals(ItemOutcome.FAILED, result.getItems().get(0).getOutcome());
        assertTrue(result.getItems().get(0).getErrorMessage().contains("timed out"));
        verify(patcher, never()).clearFinalizers(any());
        verify(deleter).delete(ns, Duration.ofSeconds(300));
    }

    @Test
    @DisplayName("Per-kind timeouts come from configuration")
    void testTimeouts() {
        settings.setPodTimeoutSeconds(30);
        settings.setNamespaceTimeoutSeconds(600);

        assertEquals(Duration.ofSeconds(30), engine.timeoutFor(ResourceKind.POD));
        assertEquals(Duration.ofSeconds(60), engine.timeoutFor(ResourceKind.JOB));
        assertEquals(Duration.ofSeconds(600), engine.timeoutFor(ResourceKind.NAMESPACE));
        assertEquals(Duration.ofSeconds(60), engine.timeoutFor(ResourceKind.PACKAGE_RELEASE));
    }

    @Test
    @DisplayName("Stop request skips groups that have not started")
    void testStopRequested() {
        ResourceDescriptor done = pod("mlops-demo", "done", ResourcePhase.SUCCEEDED);
        ResourceDescriptor ns = namespace("leftover-test", 0);
        cluster.add(done, ns);
        engine.requestStop();

        ExecutionResult result = engine.execute(planOf(
                Classification.orphaned(done, "terminal-pod"),
                Classification.orphaned(ns, "unmanaged-and-empty")), ExecutionMode.LIVE);

        assertEquals(RunOutcome.ABORTED_PARTIAL, result.getOutcome());
        for (ItemResult item : result.getItems()) {
            assertEquals(ItemOutcome.SKIPPED, item.getOutcome());
            assertEquals(ItemResult.SKIPPED_INTERRUPTED, item.getErrorMessage());
        }
        assertTrue(cluster.contains(done));
        assertTrue(cluster.contains(ns));
    }

    @Test
    @DisplayName("Stop request during a group lets it finish and skips the rest")
    void testStopDuringGroup() {
        ResourceDescriptor done = pod("mlops-demo", "done", ResourcePhase.SUCCEEDED);
        ResourceDescriptor ns = namespace("leftover-test", 0);
        ResourceDeleter stoppingDeleter = new ResourceDeleter() {
            @Override
            public DeleteOutcome delete(ResourceDescriptor descriptor, Duration timeout) {
                engine.requestStop();
                return cluster.delete(descriptor, timeout);
            }

            @Override
            public boolean awaitRemoval(ResourceDescriptor descriptor, Duration timeout) {
                return cluster.awaitRemoval(descriptor, timeout);
            }
        };
        cluster.add(done, ns);
        engine = new ExecutionEngine(cluster, stoppingDeleter, cluster, settings, Clock.systemUTC());

        ExecutionResult result = engine.execute(planOf(
                Classification.orphaned(done, "terminal-pod"),
                Classification.orphaned(ns, "unmanaged-and-empty")), ExecutionMode.LIVE);

        assertEquals(RunOutcome.ABORTED_PARTIAL, result.getOutcome());
        assertEquals(ItemOutcome.DELETED, result.getItems().get(0).getOutcome());
        assertEquals(ItemOutcome.SKIPPED, result.getItems().get(1).getOutcome());
        assertTrue(cluster.contains(ns));
    }

    @Test
    @DisplayName("Interrupt waits for the running deletion and skips only items that never started")
    void testInterruptDuringGroup() throws Exception {
        ResourceDescriptor slow = pod("mlops-demo", "a-slow", ResourcePhase.SUCCEEDED);
        ResourceDescriptor queued = pod("mlops-demo", "b-queued", ResourcePhase.SUCCEEDED);
        CountDownLatch deleting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ResourceDeleter slowDeleter = new ResourceDeleter() {
            @Override
            public DeleteOutcome delete(ResourceDescriptor descriptor, Duration timeout) {
                deleting.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return cluster.delete(descriptor, timeout);
            }

            @Override
            public boolean awaitRemoval(ResourceDescriptor descriptor, Duration timeout) {
                return cluster.awaitRemoval(descriptor, timeout);
            }
        };
        cluster.add(slow, queued);
        settings.setWorkers(1);
        engine = new ExecutionEngine(cluster, slowDeleter, cluster, settings, Clock.systemUTC());
        CleanupPlan plan = planOf(
                Classification.orphaned(slow, "terminal-pod"),
                Classification.orphaned(queued, "terminal-pod"));

        AtomicReference<ExecutionResult> result = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean(false);
        Thread runner = new Thread(() -> {
            result.set(engine.execute(plan, ExecutionMode.LIVE));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });
        runner.start();

        assertTrue(deleting.await(5, TimeUnit.SECONDS));
        runner.interrupt();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (runner.getState() != Thread.State.TIMED_WAITING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        release.countDown();
        runner.join(10_000);

        assertFalse(runner.isAlive());
        assertTrue(interruptRestored.get());
        assertEquals(RunOutcome.ABORTED_PARTIAL, result.get().getOutcome());
        assertEquals(ItemOutcome.DELETED, result.get().getItems().get(0).getOutcome());
        assertEquals(ItemOutcome.SKIPPED, result.get().getItems().get(1).getOutcome());
        assertFalse(cluster.contains(slow));
        assertTrue(cluster.contains(queued));
    }
}
