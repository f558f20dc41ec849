package de.t14d3.spindle.exceptions;

/**
 * A lifecycle hook rejected the operation.
 */
public class HookException extends SpindleException {
    private final String hook;

    public HookException(String hook, String message) {
        super(hook + " failed: " + message);
        this.hook = hook;
    }

    public HookException(String hook, Throwable cause) {
        super(hook + " failed: " + cause.getMessage(), cause);
        this.hook = hook;
    }

    /**
     * Name of the hook that failed, e.g. {@code beforeInsert}.
     */
    public String getHook() {
        return hook;
    }
}
