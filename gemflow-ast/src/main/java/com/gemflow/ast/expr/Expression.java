package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
