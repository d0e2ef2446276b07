package com.testbatch.core.check;

/**
 * Ends the running process after a fatal assertion.
 */
@FunctionalInterface
public interface ProcessTerminator {

    /**
     * Exit status used by {@link #abort()}, matching a process killed by SIGABRT.
     */
    int ABORT_STATUS = 134;

    /**
     * Terminates the process. Implementations are not expected to return.
     *
     * @param status exit status
     */
    void terminate(int status);

    /**
     * Returns a terminator that halts the JVM immediately.
     *
     * <p>{@link Runtime#halt(int)} runs no shutdown hooks, so pending tests of the default
     * registry are not flushed.
     *
     * @return halting terminator
     */
    static ProcessTerminator abort() {
        return status -> Runtime.getRuntime().halt(status);
    }
}
