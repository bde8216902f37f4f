package org.ebaysf.tidepool.transaction;

/**
 * Access mode a caller asks for. Memory persistence has no locking, the mode is only informational.
 */
public enum TransactionMode {

    READ_ONLY,

    READ_WRITE,

    READ_WRITE_PRIMARY
}
