package com.rubyast.ast;

/**
 * Variants that name a storage location: assignable targets and method/block arguments.
 */
public sealed interface Reference extends Expression permits
    Field,
    Local,
    UnresolvedIdent,
    RestArg,
    KeywordArg,
    OptionalArg,
    BlockArg,
    ShadowArg {
}
