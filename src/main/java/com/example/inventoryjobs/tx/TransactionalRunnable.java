package com.example.inventoryjobs.tx;

/**
 * Unit of work executed inside a transaction, without a result.
 */
@FunctionalInterface
public interface TransactionalRunnable {

    void run(AmbientTransaction tx) throws Exception;
}
