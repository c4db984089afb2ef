package com.phillippitts.uptimemonitor.store;

import java.util.function.Supplier;

/**
 * Runs a unit of work against the stores so that its writes become visible to readers together,
 * and are rolled back together when the work throws.
 */
@FunctionalInterface
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);
}
