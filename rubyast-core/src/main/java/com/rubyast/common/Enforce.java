package com.rubyast.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Fail-fast invariant checks.
 *
 * <p>A failed check logs {@code file:line enforced condition <cond> has failed: <details>}
 * to the {@code rubyast.fatal} logger and throws {@link InvariantViolationException}.</p>
 */
public final class Enforce {

    private static final Logger FATAL_LOGGER = LoggerFactory.getLogger("rubyast.fatal");

    private static final StackWalker WALKER = StackWalker.getInstance();

    private Enforce() {
        // Utility class
    }

    public static void check(boolean condition, String conditionText, Object... details) {
        if (!condition) {
            throw fail(conditionText, details);
        }
    }

    public static <T> T notNull(T value, String what) {
        if (value == null) {
            throw fail(what + " != null", "required child is missing");
        }
        return value;
    }

    /**
     * Checks that {@code values} and each of its elements are non-null.
     */
    public static <T extends Collection<?>> T elementsNotNull(T values, String what) {
        if (values == null) {
            throw fail(what + " != null", "required list is missing");
        }
        int i = 0;
        for (Object value : values) {
            if (value == null) {
                throw fail(what + "[" + i + "] != null", "list element is missing");
            }
            i++;
        }
        return values;
    }

    /**
     * Unconditionally fails. Declared to return the exception so call sites can write
     * {@code throw Enforce.raise(...)} and keep flow analysis happy.
     */
    public static InvariantViolationException raise(Object... details) {
        String message = join(details);
        if (message.isEmpty()) {
            FATAL_LOGGER.error("Enforce.raise() (sadly without a message)");
        } else {
            FATAL_LOGGER.error("Enforce.raise(): {}", message);
        }
        throw new InvariantViolationException(message);
    }

    private static InvariantViolationException fail(String conditionText, Object... details) {
        return raise(callerPosition(), " enforced condition ", conditionText, " has failed: ", join(details));
    }

    private static String callerPosition() {
        return WALKER.walk(frames -> frames
            .filter(f -> !f.getClassName().equals(Enforce.class.getName()))
            .findFirst()
            .map(f -> f.getFileName() + ":" + f.getLineNumber())
            .orElse("<unknown>"));
    }

    private static String join(Object... details) {
        StringBuilder sb = new StringBuilder();
        for (Object detail : details) {
            sb.append(detail);
        }
        return sb.toString();
    }
}
