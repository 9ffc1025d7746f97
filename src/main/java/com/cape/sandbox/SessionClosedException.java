package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

public class SessionClosedException extends CapeException {

    public SessionClosedException(String sessionId, SessionState state) {
        super(ErrorKind.SESSION_CLOSED, "Session '" + sessionId + "' cannot execute in state " + state);
    }
}
