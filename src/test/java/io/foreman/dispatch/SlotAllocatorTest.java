package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.support.FakeWorkerLauncher;
import io.foreman.support.MutableClock;
import io.foreman.worker.WorkerRequest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SlotAllocatorTest {
    private static final long START = 1_700_000_000_000L;

    @Test
    void availableSlotsNeverGoNegative() {
        Assertions.assertEquals(2, SlotAllocator.availableSlots(3, 1));
        Assertions.assertEquals(0, SlotAllocator.availableSlots(3, 3));
        Assertions.assertEquals(0, SlotAllocator.availableSlots(1, 4));
    }

    @Test
    void countsDistinctLiveWorkersPerRole() throws Exception {
        FakeWorkerLauncher launcher = new FakeWorkerLauncher();
        String build1 = launcher.launch(LivenessCheckerTest.request(1)).id();
        String build2 = launcher.launch(LivenessCheckerTest.request(2)).id();
        String phase = launcher.launch(new WorkerRequest(WorkerRole.VALIDATE, 3, List.of(3L, 4L), 60_000L, "p")).id();
        launcher.kill(2);

        DispatcherSettings settings = DispatcherSettings.defaults().withCaps(3, 1);
        SlotAllocator slots = new SlotAllocator(settings,
                new LivenessChecker(launcher, settings, new MutableClock(START)));
        List<TaskRecord> inProgress = List.of(
                task(1, WorkerRole.BUILD, build1),
                task(2, WorkerRole.BUILD, build2),
                task(3, WorkerRole.VALIDATE, phase),
                task(4, WorkerRole.VALIDATE, phase),
                task(5, WorkerRole.BUILD, null)
        );

        Assertions.assertEquals(1, slots.liveWorkers(WorkerRole.BUILD, inProgress));
        Assertions.assertEquals(2, slots.availableSlots(WorkerRole.BUILD, inProgress));
        Assertions.assertEquals(1, slots.liveWorkers(WorkerRole.VALIDATE, inProgress));
        Assertions.assertEquals(0, slots.availableSlots(WorkerRole.VALIDATE, inProgress));
    }

    private static TaskRecord task(long id, WorkerRole role, String handle) {
        return new TaskRecord(id, "t" + id, "shop", "P", 3, null, null, null, TaskStatus.IN_PROGRESS, role, handle, 1,
                null, null, START, START, null, START);
    }
}
