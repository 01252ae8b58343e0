package io.foreman.cli;

import io.foreman.config.ForemanConfig;
import io.foreman.dispatch.DispatchReport;
import io.foreman.model.PendingQuestion;
import io.foreman.model.TaskIntake;
import io.foreman.model.TaskStatus;
import io.foreman.runtime.ForemanRuntime;
import io.foreman.storage.StoreException;
import io.foreman.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "foreman",
        mixinStandardHelpOptions = true,
        description = "Foreman task orchestrator CLI",
        subcommands = {
                ForemanCommand.InitCommand.class,
                ForemanCommand.AddTasksCommand.class,
                ForemanCommand.DispatchCommand.class,
                ForemanCommand.TasksCommand.class,
                ForemanCommand.TaskCommand.class,
                ForemanCommand.HistoryCommand.class,
                ForemanCommand.BlockedReasonsCommand.class,
                ForemanCommand.UnblockCommand.class,
                ForemanCommand.UnblockAllCommand.class,
                ForemanCommand.AskCommand.class,
                ForemanCommand.QuestionsCommand.class,
                ForemanCommand.AnswerCommand.class,
                ForemanCommand.StatsCommand.class,
                ForemanCommand.DigestCommand.class,
                ForemanCommand.PurgeCommand.class,
                ForemanCommand.AuditTailCommand.class,
                ForemanCommand.AuditVerifyCommand.class
        }
)
public final class ForemanCommand implements Runnable {
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_FAILED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = ForemanConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | add-tasks | dispatch | tasks | task | history | blocked-reasons | unblock | unblock-all | ask | questions | answer | stats | digest | purge | audit-tail | audit-verify");
    }

    ForemanRuntime runtime() {
        ForemanRuntime runtime = new ForemanRuntime(ForemanConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    /**
     * Command line with the store and input failures mapped to exit code 2 and a JSON error line.
     */
    public static CommandLine commandLine() {
        CommandLine cl = new CommandLine(new ForemanCommand());
        cl.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof StoreException || ex instanceof IllegalArgumentException) {
                printError(ex.getMessage());
                return EXIT_FAILED;
            }
            throw ex;
        });
        return cl;
    }

    static void printError(String message) {
        System.out.println(Jsons.toCompactJson(Map.of("error", message == null ? "unknown error" : message)));
    }

    private static TaskStatus statusOrNull(String raw) {
        return raw == null ? null : TaskStatus.fromString(raw);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Override
        public Integer call() {
            ForemanRuntime runtime = parent.runtime();
            System.out.println("Initialized Foreman at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "add-tasks", description = "Add a batch of tasks from a JSON file or stdin")
    static final class AddTasksCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--file"}, description = "Intake JSON file; reads stdin when omitted")
        String file;

        @Override
        public Integer call() throws Exception {
            TaskIntake intake;
            if (file == null) {
                InputStream in = System.in;
                intake = Jsons.mapper().readValue(in, TaskIntake.class);
            } else {
                intake = Jsons.mapper().readValue(Files.readString(Path.of(file)), TaskIntake.class);
            }
            ForemanRuntime runtime = parent.runtime();
            List<Long> ids = runtime.addTasks(intake);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("added", ids.size());
            out.put("task_ids", ids);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Run one dispatch pass, or repeat passes with --loop")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--loop"}, defaultValue = "false", description = "Repeat passes until interrupted")
        boolean loop;

        @Option(names = {"--interval-ms"}, defaultValue = "60000", description = "Pause between passes in loop mode")
        long intervalMs;

        @Override
        public Integer call() throws Exception {
            ForemanRuntime runtime = parent.runtime();
            if (!loop) {
                DispatchReport report = runtime.runPass();
                System.out.println(Jsons.toJson(report));
                return report.aborted() ? EXIT_FAILED : 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "foreman-shutdown-hook"));
            while (running.get()) {
                try {
                    System.out.println(Jsons.toCompactJson(runtime.runPass()));
                } catch (StoreException e) {
                    printError(e.getMessage());
                }
                Thread.sleep(Math.max(1L, intervalMs));
            }
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks by priority")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--status"}, description = "Filter by task status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            TaskStatus filter = statusOrNull(status);
            System.out.println(Jsons.toJson(parent.runtime().tasks(filter, limit)));
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task with its context")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            Optional<ForemanRuntime.TaskDetail> task = parent.runtime().task(taskId);
            if (task.isEmpty()) {
                System.out.println("{\"error\":\"task not found\"}");
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "history", description = "Show status history of a task")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().history(taskId, limit)));
            return 0;
        }
    }

    @Command(name = "blocked-reasons", description = "Show recorded failure reasons of a task")
    static final class BlockedReasonsCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().blockedReasons(taskId)));
            return 0;
        }
    }

    @Command(name = "unblock", description = "Requeue one BLOCKED task")
    static final class UnblockCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--status"}, defaultValue = "TODO", description = "Target status: TODO|READY_FOR_TESTING")
        String status;

        @Option(names = {"--solution"}, description = "Operator guidance appended to the task solution")
        String solution;

        @Override
        public Integer call() {
            TaskStatus target = TaskStatus.fromString(status);
            boolean updated = parent.runtime().unblock(taskId, target, solution);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("task_id", taskId);
            out.put("unblocked", updated);
            out.put("status", target.name());
            System.out.println(Jsons.toJson(out));
            return updated ? 0 : EXIT_NOT_FOUND;
        }
    }

    @Command(name = "unblock-all", description = "Requeue every BLOCKED task")
    static final class UnblockAllCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--status"}, defaultValue = "TODO", description = "Target status: TODO|READY_FOR_TESTING")
        String status;

        @Option(names = {"--note"}, description = "Note appended to every requeued task's solution")
        String note;

        @Override
        public Integer call() {
            List<Long> ids = parent.runtime().unblockAll(TaskStatus.fromString(status), note);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("unblocked", ids.size());
            out.put("task_ids", ids);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "ask", description = "Record a clarification question for the operator")
    static final class AskCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Asking agent id")
        String agent;

        @Option(names = {"--task"}, description = "Related task id")
        Long taskId;

        @Option(names = {"--question"}, required = true, description = "Question text")
        String question;

        @Override
        public Integer call() {
            long id = parent.runtime().ask(agent, taskId, question);
            System.out.println(Jsons.toJson(Map.of("question_id", id)));
            return 0;
        }
    }

    @Command(name = "questions", description = "List pending questions, oldest first")
    static final class QuestionsCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().questions()));
            return 0;
        }
    }

    @Command(name = "answer", description = "Answer a pending question (oldest when --id is omitted)")
    static final class AnswerCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--id"}, description = "Question id")
        Long questionId;

        @Option(names = {"--text"}, required = true, description = "Answer text")
        String text;

        @Override
        public Integer call() {
            Optional<PendingQuestion> answered = parent.runtime().answer(questionId, text);
            if (answered.isEmpty()) {
                System.out.println("{\"error\":\"no pending question\"}");
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(answered.get()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show task counts per status and running workers per role")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats()));
            return 0;
        }
    }

    @Command(name = "digest", description = "Send the blocked-task digest")
    static final class DigestCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--now"}, required = true, description = "Send regardless of the digest interval")
        boolean now;

        @Override
        public Integer call() {
            boolean delivered = parent.runtime().digestNow();
            System.out.println(Jsons.toJson(Map.of("sent", delivered)));
            return delivered ? 0 : EXIT_NOT_FOUND;
        }
    }

    @Command(name = "purge", description = "Delete COMPLETE tasks older than the retention window")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--retention-days"}, description = "Keep completed tasks newer than this value")
        Integer retentionDays;

        @Override
        public Integer call() {
            ForemanRuntime runtime = parent.runtime();
            int days = retentionDays == null ? runtime.settings().completedRetentionDays() : retentionDays;
            if (days < 1) {
                throw new IllegalArgumentException("--retention-days must be >= 1");
            }
            List<Long> ids = runtime.purge(days);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("retention_days", days);
            out.put("purged", ids.size());
            out.put("task_ids", ids);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (String row : parent.runtime().auditTail(lines)) {
                System.out.println(row);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ForemanCommand parent;

        @Override
        public Integer call() {
            var result = parent.runtime().auditVerify();
            System.out.println(Jsons.toJson(result));
            return result.valid() ? 0 : EXIT_FAILED;
        }
    }
}
