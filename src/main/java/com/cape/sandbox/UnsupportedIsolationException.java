package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

public class UnsupportedIsolationException extends CapeException {

    public UnsupportedIsolationException(String backend) {
        super(ErrorKind.UNSUPPORTED_ISOLATION, "Unsupported isolation backend: " + backend);
    }

    public UnsupportedIsolationException(String backend, String reason) {
        super(ErrorKind.UNSUPPORTED_ISOLATION, "Isolation backend '" + backend + "' refused: " + reason);
    }
}
