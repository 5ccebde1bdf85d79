package com.augment.core;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TaskTest {

    @Test
    void enumeratesIdentifierMajor() {
        List<Task> tasks = Task.enumerate(List.of("a", "b"), 3, 42);
        assertEquals(6, tasks.size());
        assertEquals("a#0", tasks.get(0).name());
        assertEquals("a#2", tasks.get(2).name());
        assertEquals("b#0", tasks.get(3).name());
    }

    @Test
    void seedDependsOnBaseSeedAndNameOnly() {
        assertEquals(Task.of("a", 1, 42).seed(), Task.of("a", 1, 42).seed());
        assertNotEquals(Task.of("a", 1, 42).seed(), Task.of("a", 2, 42).seed());
        assertNotEquals(Task.of("a", 1, 42).seed(), Task.of("a", 1, 43).seed());
        assertEquals(Seeds.derive(42, "a#1"), Task.of("a", 1, 42).seed());
    }

    @Test
    void iterationsBelowOneAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Task.enumerate(List.of("a"), 0, 1));
        assertTrue(Task.enumerate(List.of(), 2, 1).isEmpty());
    }

    @Test
    void imageIdsAreUniqueAndHistoryIsACopy() {
        Image a = new Image(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB), "a");
        Image b = new Image(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB), "b");
        assertNotEquals(a.id(), b.id());
        a.logOperation("first");
        List<String> snapshot = a.history();
        a.logOperation("second");
        assertEquals(List.of("first"), snapshot);
        assertEquals(List.of("first", "second"), a.history());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("x"));
    }
}
