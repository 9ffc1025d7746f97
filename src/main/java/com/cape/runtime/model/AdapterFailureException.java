package com.cape.runtime.model;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

public class AdapterFailureException extends CapeException {

    public AdapterFailureException(String message) {
        super(ErrorKind.ADAPTER_FAILURE, message);
    }

    public AdapterFailureException(String message, Throwable cause) {
        super(ErrorKind.ADAPTER_FAILURE, message, cause);
    }
}
