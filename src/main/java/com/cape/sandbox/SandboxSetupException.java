package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

public class SandboxSetupException extends CapeException {

    public SandboxSetupException(String message, Throwable cause) {
        super(ErrorKind.SETUP_FAILED, message, cause);
    }
}
