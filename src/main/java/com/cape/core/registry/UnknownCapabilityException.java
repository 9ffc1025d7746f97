package com.cape.core.registry;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

public class UnknownCapabilityException extends CapeException {

    public UnknownCapabilityException(String capabilityId) {
        super(ErrorKind.UNKNOWN_CAPABILITY, "Unknown capability: " + capabilityId);
    }
}
