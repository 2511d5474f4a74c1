package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * 全局声明基类（全局变量或全局函数）
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
