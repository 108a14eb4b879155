package com.xpt.worker;

import com.xpt.config.XptConfig;
import com.xpt.exploration.RunInfo;
import com.xpt.storage.StorageCoordinator;
import com.xpt.storage.StoreOptions;
import com.xpt.trajectory.RunTemplate;
import com.xpt.trajectory.Trajectory;
import com.xpt.tree.Branch;
import com.xpt.tree.GroupNode;
import com.xpt.tree.Node;
import com.xpt.tree.snapshot.NodeSnapshots;
import com.xpt.worker.pool.ExecutorWorkerPool;
import com.xpt.worker.pool.WorkerPool;
import com.xpt.worker.queue.StoreRequest;
import com.xpt.worker.queue.WriteQueueService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Executes every run of a trajectory on a worker pool.
 * <p>
 * The trajectory is stored once up front and serialized once into a {@link RunTemplate}; each worker
 * builds its own copy from it, bound to its run. Whatever the run adds under {@code results.runs.<run>}
 * and {@code derived_parameters.runs.<run>} is captured and sent to the single writer. A failing run only fails its own {@link RunOutcome}. When all runs are
 * done and the queue is drained, runs are marked completed and the descriptor is stored.
 * Run results are not merged back into the in-memory trajectory; load them from storage.
 */
public final class ExperimentRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

    private static final Branch[] RUN_BRANCHES = { Branch.RESULTS, Branch.DERIVED_PARAMETERS };

    private final int workerCount;
    private final int queueCapacity;
    private final MeterRegistry registry;

    public ExperimentRunner(XptConfig config) {
        this(config.getWorkerCount(), config.getQueueCapacity(), new SimpleMeterRegistry());
    }

    public ExperimentRunner(int workerCount, int queueCapacity, MeterRegistry registry) {
        this.workerCount = workerCount;
        this.queueCapacity = queueCapacity;
        this.registry = registry;
    }

    /**
     * Runs {@code function} once per run.
     *
     * @return one outcome per run, in run order
     * @throws IllegalStateException if the trajectory has no storage
     */
    public List<RunOutcome> run(Trajectory trajectory, RunFunction function) {
        StorageCoordinator coordinator = trajectory.getStorage()
                .orElseThrow(() -> new IllegalStateException("Trajectory `" + trajectory.getName() + "` has no storage"));
        trajectory.getExploration().ensureRuns();
        trajectory.store();

        int runCount = trajectory.runs().size();
        RunTemplate template = trajectory.runTemplate();
        log.info("Experiment start | trajectory={} | runs={} | workers={}", trajectory.getName(), runCount, workerCount);

        List<RunOutcome> outcomes = new ArrayList<>(runCount);
        WriteQueueService queue = new WriteQueueService(coordinator, queueCapacity, registry);
        try (WorkerPool pool = new ExecutorWorkerPool(workerCount)) {
            List<Future<RunOutcome>> futures = new ArrayList<>(runCount);
            for (int i = 0; i < runCount; i++) {
                int index = i;
                futures.add(pool.submit(() -> executeRun(template, index, function, queue)));
            }
            for (Future<RunOutcome> future : futures) {
                outcomes.add(await(future));
            }
        } finally {
            queue.close();
        }

        long succeeded = 0;
        for (RunOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) continue;
            RunInfo info = trajectory.runs().get(outcome.index());
            info.markStarted(outcome.startedAt());
            info.markCompleted(outcome.finishedAt());
            succeeded++;
        }
        trajectory.storeDescriptor();
        log.info("Experiment done | trajectory={} | runs={} | succeeded={} | failed={}",
                trajectory.getName(), runCount, succeeded, runCount - succeeded);
        return outcomes;
    }

    private RunOutcome executeRun(RunTemplate template, int index, RunFunction function, WriteQueueService queue) {
        String runName = template.runs().get(index).name();
        long startedAt = System.currentTimeMillis();
        try (WriteQueueService.Submitter submitter = queue.openSubmitter()) {
            Trajectory copy = template.instantiate(index);
            function.run(new RunScope(copy, index));
            List<CompletableFuture<Integer>> writes = new ArrayList<>();
            for (Branch branch : RUN_BRANCHES) {
                Node runGroup = runGroup(copy, branch, runName);
                if (runGroup != null) {
                    writes.add(submitter.submit(StoreRequest.node(
                            NodeSnapshots.capture(copy.getTree(), runGroup, NodeSnapshots.UNLIMITED),
                            StoreOptions.defaults())));
                }
            }
            int written = 0;
            for (CompletableFuture<Integer> write : writes) {
                written += write.join();
            }
            long finishedAt = System.currentTimeMillis();
            if (log.isDebugEnabled()) {
                log.debug("Run done | run={} | written={} | tookMs={}", runName, written, finishedAt - startedAt);
            }
            return RunOutcome.success(index, runName, startedAt, finishedAt, written);
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("Run failed | run={} | error={}", runName, cause.toString());
            return RunOutcome.failure(index, runName, startedAt, System.currentTimeMillis(), cause);
        }
    }

    private static Node runGroup(Trajectory copy, Branch branch, String runName) {
        Node branchGroup = copy.getRoot().getChild(branch.getGroupName());
        if (!(branchGroup instanceof GroupNode g)) return null;
        Node runs = g.getChild(RunScope.RUN_GROUP);
        if (!(runs instanceof GroupNode r)) return null;
        return r.getChild(runName);
    }

    private static RunOutcome await(Future<RunOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for runs", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException(cause);
        }
    }
}
