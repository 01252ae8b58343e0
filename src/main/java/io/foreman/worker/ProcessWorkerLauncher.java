package io.foreman.worker;

import io.foreman.config.DispatcherSettings;
import io.foreman.config.ForemanConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs workers as OS processes. The payload is fed on stdin from {@code task-<id>.prompt.txt} and the combined
 * output goes to {@code task-<id>.log}, which is replaced on every launch so only the latest attempt is parsed.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessWorkerLauncher.class);
    private static final long START_TOLERANCE_MS = 1_000L;

    private final ForemanConfig config;
    private final DispatcherSettings settings;

    public ProcessWorkerLauncher(ForemanConfig config, DispatcherSettings settings) {
        this.config = config;
        this.settings = settings;
    }

    @Override
    public WorkerHandle launch(WorkerRequest request) throws WorkerLaunchException {
        List<String> command = expand(settings.command(request.role()), request);
        if (command.isEmpty()) {
            throw new WorkerLaunchException("no command configured for role " + request.role());
        }
        Path prompt = config.taskPromptFile(request.primaryTaskId());
        Path log = config.taskLogFile(request.primaryTaskId());
        try {
            Files.createDirectories(config.logsDir());
            Files.writeString(prompt, request.payload() == null ? "" : request.payload(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkerLaunchException("failed to write prompt file " + prompt, e);
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(config.rootDir().toFile());
        pb.redirectErrorStream(true);
        pb.redirectInput(prompt.toFile());
        pb.redirectOutput(ProcessBuilder.Redirect.to(log.toFile()));
        Map<String, String> env = pb.environment();
        env.put("FOREMAN_TASK_ID", Long.toString(request.primaryTaskId()));
        env.put("FOREMAN_ROLE", request.role().name());
        env.put("FOREMAN_TIMEOUT_SECONDS", Long.toString(request.timeoutSeconds()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new WorkerLaunchException("worker spawn failed: " + command.get(0), e);
        }
        LOG.info("worker started pid={} role={} task={}", process.pid(), request.role(), request.primaryTaskId());
        return new ProcessWorker(process.toHandle());
    }

    /**
     * Handles are {@code <pid>:<startMillis>}; a bare pid from older rows is still accepted. A live process whose
     * start time does not match the recorded one has reused the pid and is reported dead.
     */
    @Override
    public WorkerHandle attach(String handleId) {
        if (handleId == null || handleId.isBlank()) {
            return new DeadWorkerHandle("");
        }
        String[] parts = handleId.trim().split(":", 2);
        long pid;
        Long startMillis = null;
        try {
            pid = Long.parseLong(parts[0]);
            if (parts.length == 2) {
                startMillis = Long.parseLong(parts[1]);
            }
        } catch (NumberFormatException e) {
            LOG.warn("unparseable worker handle '{}', treating as dead", handleId);
            return new DeadWorkerHandle(handleId);
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return new DeadWorkerHandle(handleId);
        }
        if (startMillis != null) {
            Optional<Long> actual = startMillis(handle.get());
            if (actual.isPresent() && Math.abs(actual.get() - startMillis) > START_TOLERANCE_MS) {
                LOG.warn("pid {} was reused by another process (started {}, expected {}), treating worker as dead",
                        pid, actual.get(), startMillis);
                return new DeadWorkerHandle(handleId);
            }
        }
        return new ProcessWorker(handle.get());
    }

    /**
     * Output is decoded leniently; bytes that are not valid UTF-8 become replacement characters.
     */
    @Override
    public String readOutput(long primaryTaskId) {
        Path log = config.taskLogFile(primaryTaskId);
        if (!Files.isRegularFile(log)) {
            return "";
        }
        try {
            return new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkerOutputException("Failed to read worker output: " + log, e);
        }
    }

    static String handleId(ProcessHandle handle) {
        return startMillis(handle)
                .map(start -> handle.pid() + ":" + start)
                .orElse(Long.toString(handle.pid()));
    }

    private static Optional<Long> startMillis(ProcessHandle handle) {
        return handle.info().startInstant().map(Instant::toEpochMilli);
    }

    static List<String> expand(List<String> template, WorkerRequest request) {
        List<String> out = new ArrayList<>(template.size());
        for (String part : template) {
            out.add(part
                    .replace("{agent}", request.role().agentId())
                    .replace("{role}", request.role().name().toLowerCase(Locale.ROOT))
                    .replace("{taskId}", Long.toString(request.primaryTaskId()))
                    .replace("{timeoutSeconds}", Long.toString(request.timeoutSeconds())));
        }
        return out;
    }

    private static final class ProcessWorker implements WorkerHandle {
        private final ProcessHandle handle;
        private final String id;

        private ProcessWorker(ProcessHandle handle) {
            this.handle = handle;
            this.id = handleId(handle);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isAlive() {
            return handle.isAlive();
        }

        @Override
        public boolean awaitExit(Duration timeout) throws InterruptedException {
            if (!handle.isAlive()) {
                return true;
            }
            try {
                handle.onExit().get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException e) {
                return !handle.isAlive();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Failed waiting for worker pid=" + handle.pid(), e);
            }
        }

        @Override
        public void terminate(TerminationMode mode) {
            boolean requested = mode == TerminationMode.GRACEFUL ? handle.destroy() : handle.destroyForcibly();
            if (!requested && handle.isAlive()) {
                LOG.warn("termination request {} refused for pid={}", mode, handle.pid());
            }
        }
    }
}
