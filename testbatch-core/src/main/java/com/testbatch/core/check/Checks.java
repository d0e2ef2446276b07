package com.testbatch.core.check;

/**
 * Condition checks for use inside test bodies.
 *
 * <p>A failed check raises a {@link ConditionFailure}, which ends the current test as failed
 * and reports the condition text and the caller's file and line.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * static boolean counterStartsAtOne() {
 *     ExampleCounter counter = new ExampleCounter();
 *     Checks.failTestIf(!counter.increment(), "!counter.increment()");
 *     Checks.successRequires(counter.value() == 1, "counter.value() == 1");
 *     return true;
 * }
 * }</pre>
 */
public final class Checks {

    private Checks() {
    }

    /**
     * Fails the current test if the condition is true.
     *
     * @param condition condition that must not hold
     * @param conditionText source text of the condition, shown in the diagnostic
     * @throws ConditionFailure if {@code condition} is true
     */
    public static void failTestIf(boolean condition, String conditionText) {
        if (condition) {
            throw new ConditionFailure(conditionText, SourceLocation.ofCaller(Checks.class), false);
        }
    }

    /**
     * Fails the current test if the condition is true, without condition text.
     *
     * @param condition condition that must not hold
     * @throws ConditionFailure if {@code condition} is true
     */
    public static void failTestIf(boolean condition) {
        if (condition) {
            throw new ConditionFailure(null, SourceLocation.ofCaller(Checks.class), false);
        }
    }

    /**
     * Fails the current test unless the condition is true.
     *
     * @param condition condition that must hold
     * @param conditionText source text of the condition, shown in the diagnostic
     * @throws ConditionFailure if {@code condition} is false
     */
    public static void successRequires(boolean condition, String conditionText) {
        if (!condition) {
            throw new ConditionFailure(conditionText, SourceLocation.ofCaller(Checks.class), true);
        }
    }

    /**
     * Fails the current test unless the condition is true, without condition text.
     *
     * @param condition condition that must hold
     * @throws ConditionFailure if {@code condition} is false
     */
    public static void successRequires(boolean condition) {
        if (!condition) {
            throw new ConditionFailure(null, SourceLocation.ofCaller(Checks.class), true);
        }
    }
}
