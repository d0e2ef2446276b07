package com.testbatch.example;

/**
 * Tiny stateful class used by the example suite.
 *
 * <p>{@link #increment()} succeeds only once until {@link #reset()} is called.
 */
public class ExampleCounter {

    private int state = 0;

    /**
     * Increments the counter if it is still at zero.
     *
     * @return true if the counter moved from 0 to 1
     */
    public boolean increment() {
        if (state == 0) {
            state++;
            return true;
        }
        return false;
    }

    /**
     * Resets the counter to zero.
     */
    public void reset() {
        state = 0;
    }

    int state() {
        return state;
    }
}
