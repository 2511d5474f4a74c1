package com.lslpy.compiler.ast.stmt;

import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
