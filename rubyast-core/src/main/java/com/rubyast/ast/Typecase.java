package com.rubyast.ast;

import java.util.function.Function;

/**
 * Ad hoc type-directed match over a node:
 *
 * <pre>{@code
 * List<Expression> nodes = Typecase.<List<Expression>>of(stat)
 *     .when(Assign.class, assign -> ...)
 *     .when(Send.class, send -> ...)
 *     .orElse(other -> List.of());
 * }</pre>
 *
 * The first matching {@code when} wins. The result can only be obtained through
 * {@link #orElse(Function)}, so every match site names its fallback.
 */
public final class Typecase<R> {

    private final Expression subject;
    private boolean matched;
    private R result;

    private Typecase(Expression subject) {
        this.subject = subject;
    }

    public static <R> Typecase<R> of(Expression subject) {
        return new Typecase<>(subject);
    }

    public <T extends Expression> Typecase<R> when(Class<T> type, Function<? super T, ? extends R> handler) {
        if (!matched && type.isInstance(subject)) {
            matched = true;
            result = handler.apply(type.cast(subject));
        }
        return this;
    }

    public R orElse(Function<? super Expression, ? extends R> fallback) {
        if (matched) {
            return result;
        }
        return fallback.apply(subject);
    }

    /**
     * Returns {@code expr} as a {@code T}, or null when it is some other variant.
     */
    public static <T extends Expression> T cast(Class<T> type, Expression expr) {
        if (type.isInstance(expr)) {
            return type.cast(expr);
        }
        return null;
    }

    public static boolean isa(Class<? extends Expression> type, Expression expr) {
        return type.isInstance(expr);
    }
}
