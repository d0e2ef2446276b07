package com.testbatch.core.check;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Source position of a check.
 *
 * <p>Both parts are independently optional. Absent values are resolved to placeholder text
 * only when a diagnostic is printed.
 *
 * @param file source file name, or null if unknown
 * @param line line number, or null if unknown
 */
public record SourceLocation(
    String file,
    Integer line
) {
    /**
     * Location with neither file nor line.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation(null, null);

    /**
     * Compact constructor normalizing blank files and non-positive lines to absent.
     */
    public SourceLocation {
        if (file != null && file.isBlank()) {
            file = null;
        }
        if (line != null && line <= 0) {
            line = null;
        }
    }

    /**
     * Returns the file name if known.
     *
     * @return optional file name
     */
    public Optional<String> fileName() {
        return Optional.ofNullable(file);
    }

    /**
     * Returns the line number if known.
     *
     * @return optional line number
     */
    public OptionalInt lineNumber() {
        return line == null ? OptionalInt.empty() : OptionalInt.of(line);
    }

    /**
     * Locates the first stack frame outside the given classes.
     *
     * <p>Used by the check helpers to record where a check was written, the way a
     * caller would otherwise pass file and line by hand.
     *
     * @param skipped classes whose frames are ignored
     * @return location of the calling frame, or {@link #UNKNOWN}
     */
    public static SourceLocation ofCaller(Class<?>... skipped) {
        return StackWalker.getInstance().walk(frames -> frames
            .filter(frame -> !isSkipped(frame.getClassName(), skipped))
            .findFirst()
            .map(frame -> new SourceLocation(frame.getFileName(), frame.getLineNumber()))
            .orElse(UNKNOWN));
    }

    private static boolean isSkipped(String className, Class<?>[] skipped) {
        if (className.equals(SourceLocation.class.getName())) {
            return true;
        }
        for (Class<?> type : skipped) {
            if (className.equals(type.getName())) {
                return true;
            }
        }
        return false;
    }
}
