package io.foreman.support;

import io.foreman.worker.TerminationMode;
import io.foreman.worker.WorkerHandle;
import io.foreman.worker.WorkerLaunchException;
import io.foreman.worker.WorkerLauncher;
import io.foreman.worker.WorkerOutputException;
import io.foreman.worker.WorkerRequest;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory workers. A launched worker stays alive until the test finishes or kills it; its output is keyed by
 * the primary task id and replaced on every launch.
 */
public final class FakeWorkerLauncher implements WorkerLauncher {
    private final Map<String, FakeHandle> handles = new LinkedHashMap<>();
    private final Map<Long, FakeHandle> latestByTask = new HashMap<>();
    private final Map<Long, String> outputs = new HashMap<>();
    private final Map<Long, Deque<String>> exitOnLaunch = new HashMap<>();
    private final List<WorkerRequest> requests = new ArrayList<>();
    private final Set<Long> unreadable = new HashSet<>();
    private boolean failLaunches;
    private int sequence;

    @Override
    public WorkerHandle launch(WorkerRequest request) throws WorkerLaunchException {
        if (failLaunches) {
            throw new WorkerLaunchException("spawn refused for task " + request.primaryTaskId());
        }
        requests.add(request);
        FakeHandle handle = new FakeHandle("w-" + (++sequence), true);
        handles.put(handle.id(), handle);
        latestByTask.put(request.primaryTaskId(), handle);
        outputs.put(request.primaryTaskId(), "");
        Deque<String> queued = exitOnLaunch.get(request.primaryTaskId());
        String scripted = queued == null ? null : queued.poll();
        if (scripted != null) {
            outputs.put(request.primaryTaskId(), scripted);
            handle.alive = false;
        }
        return handle;
    }

    @Override
    public WorkerHandle attach(String handleId) {
        if (handleId == null || handleId.isBlank()) {
            return new FakeHandle("", false);
        }
        FakeHandle known = handles.get(handleId);
        return known == null ? new FakeHandle(handleId, false) : known;
    }

    @Override
    public String readOutput(long primaryTaskId) {
        if (unreadable.contains(primaryTaskId)) {
            throw new WorkerOutputException("log of task " + primaryTaskId + " unreadable", new IOException("bad sector"));
        }
        return outputs.getOrDefault(primaryTaskId, "");
    }

    /**
     * Worker for {@code taskId} writes {@code output} and exits.
     */
    public void finish(long taskId, String output) {
        outputs.put(taskId, output);
        handleFor(taskId).alive = false;
    }

    public void setUnreadable(long taskId) {
        unreadable.add(taskId);
    }

    public void kill(long taskId) {
        handleFor(taskId).alive = false;
    }

    /**
     * Queues a scripted run: the next unscripted launch for {@code taskId} exits immediately having written
     * {@code output}.
     */
    public void exitOnLaunch(long taskId, String output) {
        exitOnLaunch.computeIfAbsent(taskId, k -> new ArrayDeque<>()).add(output);
    }

    public void setFailLaunches(boolean failLaunches) {
        this.failLaunches = failLaunches;
    }

    public FakeHandle handleFor(long taskId) {
        FakeHandle handle = latestByTask.get(taskId);
        if (handle == null) {
            throw new IllegalStateException("no worker launched for task " + taskId);
        }
        return handle;
    }

    public List<WorkerRequest> requests() {
        return List.copyOf(requests);
    }

    public static final class FakeHandle implements WorkerHandle {
        private final String id;
        private final List<TerminationMode> terminations = new ArrayList<>();
        private boolean alive;
        private boolean ignoreGraceful;

        FakeHandle(String id, boolean alive) {
            this.id = id;
            this.alive = alive;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public boolean awaitExit(Duration timeout) {
            return !alive;
        }

        @Override
        public void terminate(TerminationMode mode) {
            terminations.add(mode);
            if (mode == TerminationMode.FORCEFUL || !ignoreGraceful) {
                alive = false;
            }
        }

        public void setIgnoreGraceful(boolean ignoreGraceful) {
            this.ignoreGraceful = ignoreGraceful;
        }

        public List<TerminationMode> terminations() {
            return List.copyOf(terminations);
        }
    }
}
