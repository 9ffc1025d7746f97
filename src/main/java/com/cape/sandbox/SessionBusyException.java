package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

/**
 * Thrown when an execution arrives while another one is running in the same session.
 * Executions are never queued.
 */
public class SessionBusyException extends CapeException {

    public SessionBusyException(String sessionId) {
        super(ErrorKind.SESSION_BUSY, "Session '" + sessionId + "' is already executing");
    }
}
