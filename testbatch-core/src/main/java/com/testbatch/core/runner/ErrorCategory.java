package com.testbatch.core.runner;

import java.util.Optional;

/**
 * Known categories of errors raised by code under test.
 *
 * <p>Categories are matched in declaration order, so the most specific type wins. A
 * throwable that matches no category is reported as an unknown error.
 */
public enum ErrorCategory {
    INVALID_ARGUMENT(IllegalArgumentException.class),
    ILLEGAL_STATE(IllegalStateException.class),
    RUNTIME_ERROR(RuntimeException.class),
    EXCEPTION(Exception.class);

    private final Class<? extends Exception> type;

    ErrorCategory(Class<? extends Exception> type) {
        this.type = type;
    }

    /**
     * Returns the exception type this category matches, including subclasses.
     *
     * @return matched type
     */
    public Class<? extends Exception> type() {
        return type;
    }

    /**
     * Returns the name shown in diagnostics.
     *
     * @return simple name of the matched type
     */
    public String label() {
        return type.getSimpleName();
    }

    /**
     * Resolves the category of a throwable.
     *
     * @param error the raised throwable
     * @return first matching category, or empty if the throwable is not a known error
     */
    public static Optional<ErrorCategory> of(Throwable error) {
        for (ErrorCategory category : values()) {
            if (category.type.isInstance(error)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
