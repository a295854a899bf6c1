package com.rubyast.ast;

public enum ClassDefKind {
    CLASS,
    MODULE
}
