package de.bsommerfeld.dbkeeper.db;

/**
 * Unit of work executed inside {@link DatabaseService#inTransaction}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface TransactionWork<T, E extends Exception> {

    T execute(DatabaseService db) throws E;
}
