package com.cape.core.error;

/**
 * Base unchecked exception for engine failures. The message is prefixed with
 * the {@link ErrorKind} so log lines are self-describing.
 */
public class CapeException extends RuntimeException {

    private final ErrorKind kind;

    public CapeException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CapeException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The message without the kind prefix.
     */
    public String getDetail() {
        String message = getMessage();
        String prefix = "[" + kind + "] ";
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }
}
