package io.foreman.notify;

import io.foreman.model.NotificationKind;
import io.foreman.observability.AuditLogger;
import io.foreman.support.MutableClock;
import io.foreman.support.RecordingNotifier;
import io.foreman.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class GuardedNotifierTest {
    @Test
    void failureIsAuditedNotThrown() throws Exception {
        Path root = Files.createTempDirectory("foreman-test-notify-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), new MutableClock(0L));
            RecordingNotifier sink = new RecordingNotifier();
            GuardedNotifier guarded = new GuardedNotifier(sink, audit);

            Assertions.assertTrue(guarded.send(NotificationEvent.of(NotificationKind.STARTED, 4L, "t", null)));
            sink.setFailing(true);
            Assertions.assertFalse(guarded.send(NotificationEvent.of(NotificationKind.BLOCKER, 4L, "t", "boom")));

            Assertions.assertEquals(2, sink.events().size());
            String row = audit.tail(1).get(0);
            Assertions.assertTrue(row.contains("\"action\":\"notify.failed\""));
            Assertions.assertTrue(row.contains("\"kind\":\"blocker\""));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void emptyCommandFallsBackToLogging() {
        Assertions.assertTrue(GuardedNotifier.fromCommand(List.of()) instanceof LoggingNotifier);
        Assertions.assertTrue(GuardedNotifier.fromCommand(null) instanceof LoggingNotifier);
        Assertions.assertTrue(GuardedNotifier.fromCommand(List.of("notify-send")) instanceof ScriptNotifier);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptNotifier(List.of(), 1_000L));
    }

    @Test
    void scriptReceivesKindTaskNameAndDetails() throws Exception {
        Path sh = Path.of("/bin/sh");
        Assumptions.assumeTrue(Files.isExecutable(sh));
        Path root = Files.createTempDirectory("foreman-test-notify-");
        try {
            Path out = root.resolve("args.txt");
            ScriptNotifier notifier = new ScriptNotifier(
                    List.of(sh.toString(), "-c", "printf '%s|%s|%s|%s' \"$1\" \"$2\" \"$3\" \"$4\" > \"$0\"", out.toString()),
                    5_000L);

            notifier.notify(NotificationEvent.of(NotificationKind.READY, 12L, "checkout page", "awaiting validation"));

            Assertions.assertEquals("ready|12|checkout page|awaiting validation",
                    Files.readString(out, StandardCharsets.UTF_8));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void nonZeroExitIsANotificationException() {
        Path sh = Path.of("/bin/sh");
        Assumptions.assumeTrue(Files.isExecutable(sh));
        ScriptNotifier notifier = new ScriptNotifier(List.of(sh.toString(), "-c", "echo nope; exit 3"), 5_000L);

        NotificationException e = Assertions.assertThrows(NotificationException.class,
                () -> notifier.notify(NotificationEvent.of(NotificationKind.RESET, 1L, "t", "d")));
        Assertions.assertTrue(e.getMessage().contains("exit=3"));
        Assertions.assertTrue(e.getMessage().contains("nope"));
    }
}
