package com.rubyast.core;

/**
 * A user-facing problem found while rewriting, e.g. a malformed DSL call.
 */
public record Diagnostic(Loc loc, ErrorClass errorClass, String message) {
}
