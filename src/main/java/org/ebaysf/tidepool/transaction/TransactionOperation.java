package org.ebaysf.tidepool.transaction;

/**
 * Work run inside a transaction.
 */
public interface TransactionOperation<T> {

    T execute(final MemoryTransaction txn) throws Exception;
}
