package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.config.ForemanConfig;
import io.foreman.model.NewTask;
import io.foreman.model.NotificationKind;
import io.foreman.model.WorkerRole;
import io.foreman.notify.NotificationEvent;
import io.foreman.storage.Database;
import io.foreman.storage.TaskStore;
import io.foreman.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

final class BlockedDigestTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void digestHonoursIntervalUnlessForced() throws Exception {
        Path root = Files.createTempDirectory("foreman-test-digest-");
        try {
            Database db = new Database(ForemanConfig.fromRoot(root.toString()));
            db.init();
            TaskStore store = new TaskStore(db);
            DispatcherSettings settings = DispatcherSettings.defaults();
            BlockedDigest digest = new BlockedDigest(store, settings);

            Assertions.assertTrue(digest.due(NOW, true).isEmpty());

            long id = store.insertTasks(List.of(new NewTask("deploy", "shop", "P", 3, null, null)), NOW).get(0);
            store.markDispatched(id, WorkerRole.BUILD, "w-1", NOW);
            store.applyTransition(TaskStore.Transition.buildBlocked(id, "w-1", "missing credentials"), NOW);

            Optional<NotificationEvent> first = digest.due(NOW, false);
            Assertions.assertTrue(first.isPresent());
            Assertions.assertEquals(NotificationKind.BLOCKED_SUMMARY, first.get().kind());
            Assertions.assertEquals(0L, first.get().taskId());
            Assertions.assertTrue(first.get().details().startsWith("Blocked tasks: 1"));
            Assertions.assertTrue(first.get().details().contains("#" + id + " deploy"));
            Assertions.assertTrue(first.get().details().contains("missing credentials"));
            digest.markSent(NOW);

            long later = NOW + settings.blockedDigestIntervalMs() - 1;
            Assertions.assertTrue(digest.due(later, false).isEmpty());
            Assertions.assertTrue(digest.due(later, true).isPresent());
            Assertions.assertTrue(digest.due(NOW + settings.blockedDigestIntervalMs(), false).isPresent());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
