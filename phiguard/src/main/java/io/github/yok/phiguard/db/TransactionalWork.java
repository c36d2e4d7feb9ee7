package io.github.yok.phiguard.db;

/**
 * Multi-statement unit of work run by {@link QueryExecutor#inTransaction(TransactionalWork)}.
 *
 * @param <T> result type
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    /**
     * Runs the statements of the unit of work.
     *
     * @param executor executor bound to the open transaction
     * @return result handed back to the caller after commit
     */
    T run(QueryExecutor executor);
}
