package com.example.litigationhold.client;

import com.example.litigationhold.exception.ExternalServiceException;

import java.util.function.Predicate;

/**
 * Retry predicate for the external service clients.
 * Only transient {@link ExternalServiceException}s are retried.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ExternalServiceException
                && ((ExternalServiceException) throwable).isTransient();
    }
}
