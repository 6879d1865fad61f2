package org.netpreserve.trawler.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.trawler.util.Url;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class WorkQueueTest {

    private final Database database;
    private WorkQueue queue;

    WorkQueueTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        database.useHandle(handle -> {
            handle.execute("DELETE FROM work_items");
            handle.execute("UPDATE progress SET discovered = 0, handled = 0, failed = 0, retried = 0");
        });
        queue = new WorkQueue(database);
    }

    @Test
    void addDeduplicatesByUniqueKey() {
        assertTrue(queue.add(WorkItem.of("http://example.com/a")));
        assertFalse(queue.add(WorkItem.of("HTTP://EXAMPLE.com/a/#section")));
        assertEquals(1, queue.pendingCount());
        assertEquals(1, queue.progress().discovered());
    }

    @Test
    void addUrlsSkipsNonHttpAndKnownUrls() {
        queue.add(WorkItem.of("http://example.com/"));
        int added = queue.addUrls(List.of(new Url("http://example.com/"), new Url("mailto:a@example.com"),
                new Url("https://example.org/x#frag")), 1);
        assertEquals(1, added);

        WorkItem item = queue.find(new Url("https://example.org/x"));
        assertNotNull(item);
        assertEquals(new Url("https://example.org/x"), item.url());
        assertEquals(1, item.depth());
        assertEquals(WorkItem.State.AVAILABLE, item.state());
    }

    @Test
    void fetchesShallowestFirst() {
        queue.add(WorkItem.of(new Url("http://example.com/deep"), 2));
        queue.add(WorkItem.of(new Url("http://example.com/seed"), 0));
        queue.add(WorkItem.of(new Url("http://example.com/link"), 1));

        assertEquals("http://example.com/seed", queue.fetchNext().url().toString());
        assertEquals("http://example.com/link", queue.fetchNext().url().toString());
        assertEquals("http://example.com/deep", queue.fetchNext().url().toString());
        assertNull(queue.fetchNext());
    }

    @Test
    void lifecycle() {
        queue.add(WorkItem.of("http://example.com/"));
        assertFalse(queue.isEmpty());
        assertFalse(queue.isFinished());

        WorkItem item = queue.fetchNext();
        assertNotNull(item);
        assertEquals(WorkItem.State.IN_FLIGHT, item.state());
        assertTrue(queue.isEmpty());
        assertFalse(queue.isFinished(), "an item is still in flight");

        queue.markHandled(item);
        assertTrue(queue.isFinished());
        assertEquals(1, queue.handledCount());
        assertEquals(0, queue.pendingCount());
        assertEquals(1, queue.progress().handled());
    }

    @Test
    void reclaimIncrementsRetryCount() {
        queue.add(WorkItem.of("http://example.com/"));
        WorkItem item = queue.fetchNext();
        queue.reclaim(item, "connection reset");

        WorkItem again = queue.fetchNext();
        assertNotNull(again);
        assertEquals(1, again.retryCount());
        assertEquals("connection reset", again.lastError());

        queue.markFailed(again, "gave up");
        WorkItem failed = queue.find(new Url("http://example.com/"));
        assertEquals(WorkItem.State.FAILED, failed.state());
        assertEquals(1, queue.handledCount());
        assertEquals(new QueueProgress(1, 0, 1, 1), queue.progress());
    }

    @Test
    void perItemRetrySettingsArePersisted() {
        queue.add(WorkItem.of("http://example.com/").withMaxRetries(7).withNoRetry(true));
        WorkItem item = queue.fetchNext();
        assertEquals(7, item.maxRetries());
        assertTrue(item.noRetry());
    }

    @Test
    void transitionOfItemNotInFlightFails() {
        queue.add(WorkItem.of("http://example.com/"));
        WorkItem item = queue.fetchNext();
        queue.markHandled(item);
        assertThrows(WorkSourceException.class, () -> queue.markHandled(item));
        assertThrows(WorkSourceException.class, () -> queue.reclaim(item, null));
    }

    @Test
    void reopeningMakesInFlightItemsAvailable() {
        queue.add(WorkItem.of("http://example.com/"));
        assertNotNull(queue.fetchNext());
        assertNull(queue.fetchNext());

        var reopened = new WorkQueue(database);
        assertFalse(reopened.isEmpty());
        assertNotNull(reopened.fetchNext());
    }
}
