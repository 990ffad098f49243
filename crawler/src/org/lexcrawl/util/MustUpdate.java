package org.lexcrawl.util;

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
 * Fails a state transition that matched no rows, e.g. a frontier entry whose lease has been taken over by
 * another worker or which is already terminal.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Exact number of rows expected (-1 means at least one).
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expected = ((MustUpdate) annotation).value();
            String name = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
                    long updateCount = stmt.getUpdateCount();
                    if (expected == -1 && updateCount == 0) {
                        throw new NoRowsUpdatedException(name + " didn't update any rows");
                    } else if (expected != -1 && expected != updateCount) {
                        throw new NoRowsUpdatedException(name + " expected to update " + expected
                                                         + " rows but updated " + updateCount);
                    }
                }
            });
        }
    }

    class NoRowsUpdatedException extends RuntimeException {
        public NoRowsUpdatedException(String message) {
            super(message);
        }
    }
}
