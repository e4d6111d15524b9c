package com.example.inventoryjobs.tx;

/**
 * Unit of work executed inside a transaction, producing a result.
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    T execute(AmbientTransaction tx) throws Exception;
}
