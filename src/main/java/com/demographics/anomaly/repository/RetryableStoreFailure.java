package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.demographics.anomaly.exception.PersistenceException;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Retry only transient store failures: timeouts, lost connections and busy or
 * overloaded nodes. A {@link PersistenceException} is retried only when its cause
 * is one of those, since its unit has already been rolled back. Validation
 * failures and every other result code are not retried.
 */
public class RetryableStoreFailure implements Predicate<Throwable> {

    private static final Set<Integer> TRANSIENT_CODES = Set.of(
            ResultCode.TIMEOUT,
            ResultCode.SERVER_NOT_AVAILABLE,
            ResultCode.KEY_BUSY,
            ResultCode.DEVICE_OVERLOAD);

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof PersistenceException) {
            return isTransient(throwable.getCause());
        }
        return isTransient(throwable);
    }

    private static boolean isTransient(Throwable throwable) {
        if (throwable instanceof AerospikeException.Timeout
                || throwable instanceof AerospikeException.Connection) {
            return true;
        }
        return throwable instanceof AerospikeException e && TRANSIENT_CODES.contains(e.getResultCode());
    }
}
