package com.nassikit.exporter;

/**
 * Thrown when a control-tree document does not have the expected shape.
 */
public class ControlTreeException extends RuntimeException {

    public ControlTreeException(String message) {
        super(message);
    }

    public ControlTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ControlTreeException notAnObject(String where) {
        return new ControlTreeException("Expected a JSON object at " + where);
    }

    public static ControlTreeException notAnArray(String field) {
        return new ControlTreeException("Field '" + field + "' must be an array");
    }

    public static ControlTreeException unreadable(Throwable cause) {
        return new ControlTreeException("Malformed control-tree JSON: " + cause.getMessage(), cause);
    }
}
