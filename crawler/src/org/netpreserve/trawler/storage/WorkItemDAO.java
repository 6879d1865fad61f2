package org.netpreserve.trawler.storage;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;


@RegisterConstructorMapper(WorkItem.class)
public interface WorkItemDAO {
    @SqlUpdate("""
            INSERT INTO work_items (unique_key, url, depth, retry_count, max_retries, no_retry, state, last_error)
            VALUES (:uniqueKey, :url, :depth, :retryCount, :maxRetries, :noRetry, 'AVAILABLE', :lastError)
            ON CONFLICT(unique_key) DO NOTHING""")
    boolean insert(@BindMethods WorkItem item);

    @SqlQuery("SELECT * FROM work_items WHERE unique_key = ?")
    @Nullable
    WorkItem findByUniqueKey(String uniqueKey);

    @SqlQuery("""
            UPDATE work_items SET state = 'IN_FLIGHT'
            WHERE id = (
                SELECT id FROM work_items
                WHERE state = 'AVAILABLE'
                ORDER BY depth, id
                LIMIT 1)
            RETURNING *""")
    @Nullable
    WorkItem takeNext();

    @SqlUpdate("UPDATE work_items SET state = 'HANDLED' WHERE unique_key = ? AND state = 'IN_FLIGHT'")
    @MustUpdate
    void markHandled(String uniqueKey);

    @SqlUpdate("""
            UPDATE work_items SET state = 'FAILED', last_error = :error
            WHERE unique_key = :uniqueKey AND state = 'IN_FLIGHT'""")
    @MustUpdate
    void markFailed(String uniqueKey, @Nullable String error);

    @SqlUpdate("""
            UPDATE work_items SET state = 'AVAILABLE', retry_count = retry_count + 1, last_error = :error
            WHERE unique_key = :uniqueKey AND state = 'IN_FLIGHT'""")
    @MustUpdate
    void reclaim(String uniqueKey, @Nullable String error);

    @SqlUpdate("UPDATE work_items SET state = 'AVAILABLE' WHERE state = 'IN_FLIGHT'")
    int resetAllInFlight();

    @SqlQuery("SELECT COUNT(*) FROM work_items WHERE state IN ('AVAILABLE', 'IN_FLIGHT')")
    long countPending();

    @SqlQuery("SELECT COUNT(*) FROM work_items WHERE state IN ('HANDLED', 'FAILED')")
    long countHandled();

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM work_items WHERE state = 'AVAILABLE')")
    boolean hasAvailable();
}
