package org.netpreserve.trawler.storage;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.function.Supplier;

/**
 * A growable, persistent work source backed by SQLite. Items are deduplicated by unique key and fetched
 * shallowest first. Items left in flight by a previous process are made available again on open.
 */
public class WorkQueue implements WorkSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);
    private final Database db;
    private final boolean ownsDatabase;

    public WorkQueue(Database db) {
        this(db, false);
    }

    private WorkQueue(Database db, boolean ownsDatabase) {
        this.db = db;
        this.ownsDatabase = ownsDatabase;
        int recovered = call("reset in-flight items", () -> db.workItems().resetAllInFlight());
        if (recovered > 0) {
            log.atInfo().addKeyValue("items", recovered).log("Returned in-flight items from a previous run to the queue");
        }
    }

    public static WorkQueue open(Path path) {
        return new WorkQueue(Database.open(path), true);
    }

    public static WorkQueue inMemory() {
        return new WorkQueue(Database.newDatabaseInMemory(), true);
    }

    /**
     * Adds an item unless one with the same unique key is already known.
     *
     * @return true if the item was new
     */
    public boolean add(WorkItem item) {
        return call("add " + item.uniqueKey(), () -> db.inTransaction(dao -> {
            boolean added = dao.workItems().insert(item);
            if (added) dao.progress().incrementDiscovered();
            return added;
        }));
    }

    /**
     * Adds URLs at the given depth, skipping non-HTTP URLs and ones already known.
     *
     * @return how many were new
     */
    public int addUrls(Collection<Url> urls, int depth) {
        int novel = 0;
        for (var url : urls) {
            if (!url.isHttp() || url.host() == null || url.host().isEmpty()) continue;
            if (add(WorkItem.of(url.withoutFragment(), depth))) novel++;
        }
        log.debug("Added {} new URLs of {}", novel, urls.size());
        return novel;
    }

    @Override
    public synchronized @Nullable WorkItem fetchNext() {
        return call("fetch next item", () -> db.workItems().takeNext());
    }

    @Override
    public synchronized void markHandled(WorkItem item) {
        run("mark " + item.uniqueKey() + " handled", () -> db.useTransaction(dao -> {
            dao.workItems().markHandled(item.uniqueKey());
            dao.progress().incrementHandled();
        }));
    }

    @Override
    public synchronized void markFailed(WorkItem item, @Nullable String error) {
        run("mark " + item.uniqueKey() + " failed", () -> db.useTransaction(dao -> {
            dao.workItems().markFailed(item.uniqueKey(), error);
            dao.progress().incrementFailed();
        }));
    }

    @Override
    public synchronized void reclaim(WorkItem item, @Nullable String error) {
        run("reclaim " + item.uniqueKey(), () -> db.useTransaction(dao -> {
            dao.workItems().reclaim(item.uniqueKey(), error);
            dao.progress().incrementRetried();
        }));
    }

    @Override
    public boolean isEmpty() {
        return !call("check for available items", () -> db.workItems().hasAvailable());
    }

    @Override
    public boolean isFinished() {
        return pendingCount() == 0;
    }

    @Override
    public long handledCount() {
        return call("count handled items", () -> db.workItems().countHandled());
    }

    @Override
    public long pendingCount() {
        return call("count pending items", () -> db.workItems().countPending());
    }

    public @Nullable WorkItem find(Url url) {
        return call("find " + url, () -> db.workItems().findByUniqueKey(url.uniqueKey()));
    }

    public QueueProgress progress() {
        return call("read progress", () -> db.progress().current());
    }

    @Override
    public void close() {
        if (ownsDatabase) db.close();
    }

    private static <T> T call(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (JdbiException e) {
            throw new WorkSourceException("Failed to " + action, e);
        }
    }

    private static void run(String action, Runnable runnable) {
        call(action, () -> {
            runnable.run();
            return null;
        });
    }
}
