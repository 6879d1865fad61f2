package org.netpreserve.trawler.storage;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Throws a {@link WorkSourceException} if an SQL statement didn't update any rows. Used on state transitions so
 * that moving an item that is not in the expected state fails loudly.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(value = MustUpdate.Handler.class)
public @interface MustUpdate {

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
                    if (stmt.getUpdateCount() == 0) {
                        throw new WorkSourceException(method.getDeclaringClass().getSimpleName() + "." +
                                                      method.getName() + "() didn't update any rows");
                    }
                }
            });
        }
    }
}
