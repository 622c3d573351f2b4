package com.mlops.cleanup.engine;

import com.mlops.cleanup.config.CleanupConfig;
import com.mlops.cleanup.kubernetes.DeleteOutcome;
import com.mlops.cleanup.kubernetes.FinalizerPatcher;
import com.mlops.cleanup.kubernetes.ResourceDeleter;
import com.mlops.cleanup.kubernetes.ResourceLister;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.ExecutionResult;
import com.mlops.cleanup.model.ItemResult;
import com.mlops.cleanup.model.PlannedDeletion;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import com.mlops.cleanup.model.RunOutcome;
import com.mlops.cleanup.model.SequenceGroup;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Applies a cleanup plan group by group.
 * <p>
 * Items of one sequence group run on a bounded worker pool; the next group starts only
 * after every item of the current one has finished. Item failures are recorded and
 * never stop the run. A stop request lets running items finish and skips every group
 * that has not started yet.
 */
@Slf4j
public class ExecutionEngine {

    private final ResourceLister lister;
    private final ResourceDeleter deleter;
    private final FinalizerPatcher finalizerPatcher;
    private final CleanupConfig.Execution settings;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private boolean liveExecutionStarted;

    public ExecutionEngine(ResourceLister lister, ResourceDeleter deleter, FinalizerPatcher finalizerPatcher,
                           CleanupConfig.Execution settings, Clock clock) {
        this.lister = lister;
        this.deleter = deleter;
        this.finalizerPatcher = finalizerPatcher;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Ask a running {@link #execute} to stop after the current group. A live execution
     * started after this call deletes nothing.
     *
     * @return true if a live execution had already started, so its result is still to be reported
     */
    public synchronized boolean requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("Stop requested; in-flight deletions will finish, remaining groups are skipped");
        }
        return liveExecutionStarted;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public ExecutionResult execute(CleanupPlan plan, ExecutionMode mode) {
        List<PlannedDeletion> deletions = plan.getDeletions();

        if (mode == ExecutionMode.DRY_RUN) {
            List<ItemResult> items = new ArrayList<>(deletions.size());
            for (PlannedDeletion deletion : deletions) {
                items.add(ItemResult.dryRun(deletion));
            }
            log.info("Dry run: {} deletions reported, nothing changed", items.size());
            return new ExecutionResult(mode, RunOutcome.COMPLETED, items);
        }

        synchronized (this) {
            liveExecutionStarted = true;
        }
        return executeLive(deletions);
    }

    private ExecutionResult executeLive(List<PlannedDeletion> deletions) {
        Map<SequenceGroup, List<Integer>> indexesByGroup = new EnumMap<>(SequenceGroup.class);
        for (int i = 0; i < deletions.size(); i++) {
            indexesByGroup.computeIfAbsent(deletions.get(i).getSequenceGroup(), g -> new ArrayList<>()).add(i);
        }

        Map<Integer, ItemResult> results = new ConcurrentHashMap<>();
        boolean stopped = false;

        for (Map.Entry<SequenceGroup, List<Integer>> entry : indexesByGroup.entrySet()) {
            SequenceGroup group = entry.getKey();
            List<Integer> indexes = entry.getValue();

            if (stopped || stopRequested.get()) {
                stopped = true;
                for (Integer index : indexes) {
                    results.put(index, ItemResult.skipped(deletions.get(index)));
                }
                continue;
            }

            log.info("Group {} ({}): deleting {} resources", group.getOrder(), group.getDescription(), indexes.size());
            if (!runGroup(deletions, indexes, results)) {
                stopped = true;
                requestStop();
            }
        }

        List<ItemResult> ordered = new ArrayList<>(deletions.size());
        for (int i = 0; i < deletions.size(); i++) {
            ordered.add(results.get(i));
        }
        RunOutcome outcome = stopped ? RunOutcome.ABORTED_PARTIAL : RunOutcome.COMPLETED;
        ExecutionResult result = new ExecutionResult(ExecutionMode.LIVE, outcome, ordered);
        log.info("Execution finished with outcome {}: {} failures out of {} deletions",
                outcome, result.getFailureCount(), ordered.size());
        return result;
    }

    /**
     * @return false when the calling thread was interrupted while waiting for the group
     */
    private boolean runGroup(List<PlannedDeletion> deletions, List<Integer> indexes,
                             Map<Integer, ItemResult> results) {
        int workers = Math.max(1, Math.min(settings.getWorkers(), indexes.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        AtomicBoolean draining = new AtomicBoolean(false);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (Integer index : indexes) {
                PlannedDeletion deletion = deletions.get(index);
                futures.add(executor.submit(() -> {
                    if (draining.get()) {
                        return;
                    }
                    results.put(index, apply(deletion));
                }));
            }

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Deletion worker failed unexpectedly", e.getCause());
                }
            }
            return true;
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for deletions to finish");
            draining.set(true);
            boolean interruptedAgain = !awaitInFlight(executor);
            for (Integer index : indexes) {
                results.putIfAbsent(index, ItemResult.skipped(deletions.get(index)));
            }
            Thread.currentThread().interrupt();
            if (interruptedAgain) {
                log.warn("Interrupted again while draining; unfinished deletions are reported as skipped");
            }
            return false;
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Waits for running items; items still queued see the drain flag and return at once.
     *
     * @return false if the wait itself was interrupted
     */
    private boolean awaitInFlight(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(settings.getNamespaceTimeoutSeconds() * 2, TimeUnit.SECONDS)) {
                log.warn("Some deletions were still running when the engine gave up waiting");
            }
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }

    ItemResult apply(PlannedDeletion deletion) {
        ResourceDescriptor descriptor = deletion.getDescriptor();
        Duration timeout = timeoutFor(descriptor.getKind());
        Instant startedAt = clock.instant();
        ItemResult.ItemResultBuilder result = ItemResult.builder()
                .deletion(deletion)
                .attempted(true)
                .startedAt(startedAt);

        try {
            DeleteOutcome outcome = deleter.delete(descriptor, timeout);
            switch (outcome) {
                case REMOVED:
                    log.info("Deleted {}", descriptor.getDisplayId());
                    result.succeeded(true);
                    break;
                case NOT_FOUND:
                    log.info("{} already absent", descriptor.getDisplayId());
                    result.succeeded(true).alreadyAbsent(true);
                    break;
                case TIMED_OUT:
                    handleTimeout(descriptor, timeout, result);
                    break;
                default:
                    throw new IllegalStateException("Unexpected delete outcome " + outcome);
            }
        } catch (RuntimeException e) {
            log.error("Failed to delete {}: {}", descriptor.getDisplayId(), e.getMessage());
            result.succeeded(false).errorMessage(e.getMessage() != null ? e.getMessage() : e.toString());
        }

        return result.finishedAt(clock.instant()).build();
    }

    private void handleTimeout(ResourceDescriptor descriptor, Duration timeout, ItemResult.ItemResultBuilder result) {
        if (descriptor.getKind() != ResourceKind.NAMESPACE) {
            result.succeeded(false).errorMessage("timed out after " + timeout.getSeconds() + "s");
            return;
        }

        Optional<ResourcePhase> phase = lister.currentPhase(descriptor);
        if (phase.isEmpty()) {
            log.info("{} disappeared right after the wait expired", descriptor.getDisplayId());
            result.succeeded(true);
            return;
        }
        if (phase.get() != ResourcePhase.TERMINATING) {
            result.succeeded(false).errorMessage("timed out after " + timeout.getSeconds()
                    + "s in phase " + phase.get());
            return;
        }

        log.warn("{} stuck in Terminating, clearing finalizers", descriptor.getDisplayId());
        finalizerPatcher.clearFinalizers(descriptor);
        result.recoveryApplied(true);
        if (deleter.awaitRemoval(descriptor, timeout)) {
            log.info("Deleted {} after finalizer recovery", descriptor.getDisplayId());
            result.succeeded(true);
        } else {
            log.error("{} is still terminating after finalizer recovery", descriptor.getDisplayId());
            result.succeeded(false).errorMessage(ItemResult.STUCK_TERMINATING);
        }
    }

    Duration timeoutFor(ResourceKind kind) {
        switch (kind) {
            case POD:
                return Duration.ofSeconds(settings.getPodTimeoutSeconds());
            case JOB:
                return Duration.ofSeconds(settings.getJobTimeoutSeconds());
            case NAMESPACE:
                return Duration.ofSeconds(settings.getNamespaceTimeoutSeconds());
            default:
                return Duration.ofSeconds(settings.getDefaultTimeoutSeconds());
        }
    }
}
