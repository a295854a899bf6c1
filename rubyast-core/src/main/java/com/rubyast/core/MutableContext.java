package com.rubyast.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-file context threaded through a rewrite pass: the global state, the file being
 * processed and the diagnostics reported so far.
 *
 * Not thread-safe; each compilation unit gets its own context.
 */
public final class MutableContext {

    private final GlobalState state;
    private final FileRef file;
    private final List<Diagnostic> errors = new ArrayList<>();

    public MutableContext(GlobalState state, FileRef file) {
        this.state = state;
        this.file = file;
    }

    public GlobalState state() {
        return state;
    }

    public FileRef file() {
        return file;
    }

    /**
     * Convenience for {@code state().enterName(text)}.
     */
    public NameRef name(String text) {
        return state.enterName(text);
    }

    public void reportError(Loc loc, ErrorClass errorClass, String message) {
        errors.add(new Diagnostic(loc, errorClass, message));
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
