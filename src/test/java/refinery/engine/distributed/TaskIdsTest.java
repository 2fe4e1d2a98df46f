package refinery.engine.distributed;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskIdsTest {

    @Test
    void sameInputSameId() {
        assertEquals(TaskIds.of(3, "payload"), TaskIds.of(3, "payload"));
        assertEquals(16, TaskIds.of(0, 1).length());
        assertTrue(TaskIds.of(0, 1).matches("[0-9a-f]{16}"));
    }

    @Test
    void indexDistinguishesEqualPayloads() {
        assertNotEquals(TaskIds.of(0, "x"), TaskIds.of(1, "x"));
    }

    @Test
    void onlyBoundedPrefixOfPayloadCounts() {
        String base = "a".repeat(TaskIds.PAYLOAD_PREFIX);
        assertEquals(TaskIds.of(0, base + "tail-1"), TaskIds.of(0, base + "tail-2"));
        assertNotEquals(TaskIds.of(0, base.substring(1) + "b"), TaskIds.of(0, base));
    }

    @Test
    void noCollisionsAcrossBatch() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(TaskIds.of(i, i % 10));
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void nullPayloadIsHashed() {
        assertEquals(TaskIds.of(0, null), TaskIds.of(0, null));
    }
}
