package com.gemflow.ast.scope;

/**
 * 变量种类
 */
public enum VariableKind {
    LOCAL,      // x
    INSTANCE,   // @x
    CLASS,      // @@x
    GLOBAL,     // $x
    SELF        // self
}
