package com.registry.core.exception;

/**
 * Thrown when a conditional write loses against a concurrent writer.
 * This is the one error kind callers are expected to retry after re-reading.
 */
public class OptimisticLockException extends RegistryException {
    
    public static final String ERROR_CODE = "CONCURRENT_MODIFICATION";
    
    public OptimisticLockException(String subjectType, String subjectId, long expectedSequence) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of %s[%s]: expected sequence %d is no longer current",
            subjectType, subjectId, expectedSequence
        ));
    }

    public OptimisticLockException(String message) {
        super(ERROR_CODE, message);
    }
}
