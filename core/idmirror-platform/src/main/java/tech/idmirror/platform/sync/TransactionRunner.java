package tech.idmirror.platform.sync;

import java.util.function.Supplier;

/**
 * Runs work in a fresh transaction that commits on return and rolls back on exception.
 *
 * <p>Any transaction active on the calling thread is suspended meanwhile, which gives each
 * sync attempt savepoint semantics: a failed attempt rolls back without affecting the caller.
 */
public interface TransactionRunner {

    <T> T inNewTransaction(Supplier<T> work);
}
