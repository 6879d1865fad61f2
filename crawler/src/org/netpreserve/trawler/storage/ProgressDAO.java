package org.netpreserve.trawler.storage;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

@RegisterConstructorMapper(QueueProgress.class)
public interface ProgressDAO {
    @SqlUpdate("UPDATE progress SET discovered = discovered + 1 WHERE id = 0")
    @MustUpdate
    void incrementDiscovered();

    @SqlUpdate("UPDATE progress SET handled = handled + 1 WHERE id = 0")
    @MustUpdate
    void incrementHandled();

    @SqlUpdate("UPDATE progress SET failed = failed + 1 WHERE id = 0")
    @MustUpdate
    void incrementFailed();

    @SqlUpdate("UPDATE progress SET retried = retried + 1 WHERE id = 0")
    @MustUpdate
    void incrementRetried();

    @SqlQuery("SELECT discovered, handled, failed, retried FROM progress WHERE id = 0")
    QueueProgress current();
}
