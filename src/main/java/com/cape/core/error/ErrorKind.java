package com.cape.core.error;

/**
 * Failure categories reported in a {@link com.cape.core.model.CapabilityError}.
 */
public enum ErrorKind {
    /** Inputs do not satisfy the capability's input schema. */
    VALIDATION_ERROR,
    UNKNOWN_CAPABILITY,
    UNSUPPORTED_ISOLATION,
    SETUP_FAILED,
    /** Soft failure: logged, execution is still attempted. */
    DEPENDENCY_INSTALL_FAILED,
    TIMEOUT,
    NON_ZERO_EXIT,
    SESSION_BUSY,
    SESSION_CLOSED,
    ADAPTER_FAILURE,
    /** The calling thread was interrupted while the work was running. */
    CANCELLED,
    EXECUTION_FAILED
}
