package io.foreman.model;

import io.foreman.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TaskIntakeTest {

    @Test
    void readsIntakeDocumentWithDefaultPriority() throws Exception {
        TaskIntake intake = Jsons.mapper().readValue("""
                {"project": "shop", "tasks": [
                  {"name": "cart api", "phase": "P1", "priority": 5, "plan": "add endpoints"},
                  {"name": "cart ui", "phase": "P1", "notes": "after api"}
                ]}
                """, TaskIntake.class);

        List<NewTask> tasks = intake.toNewTasks();
        Assertions.assertEquals(2, tasks.size());
        Assertions.assertEquals(new NewTask("cart api", "shop", "P1", 5, "add endpoints", null), tasks.get(0));
        Assertions.assertEquals(NewTask.DEFAULT_PRIORITY, tasks.get(1).priority());
        Assertions.assertEquals("after api", tasks.get(1).notes());
    }

    @Test
    void rejectsIncompleteDocuments() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new TaskIntake(null, List.of(new TaskIntake.Item("a", null, null, null, null))).toNewTasks());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TaskIntake("shop", List.of()).toNewTasks());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new TaskIntake("shop", List.of(new TaskIntake.Item(" ", null, null, null, null))).toNewTasks());
    }
}
