package com.rubyast.dsl;

import com.rubyast.core.ErrorClass;

/**
 * Diagnostics reported by the DSL rules.
 */
public final class DslErrors {

    public static final ErrorClass BAD_ATTR_ARG = new ErrorClass(3501, "BadAttrArg");
    public static final ErrorClass BAD_WRAP_INSTANCE = new ErrorClass(3502, "BadWrapInstance");
    public static final ErrorClass BAD_STRUCT_MEMBER = new ErrorClass(3503, "BadStructMember");

    private DslErrors() {
    }
}
