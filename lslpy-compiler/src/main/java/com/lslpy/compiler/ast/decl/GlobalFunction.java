package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.stmt.CompoundStmt;

import java.util.List;

/**
 * 用户自定义全局函数
 */
public class GlobalFunction extends Declaration {
    private final LslType returnType;
    private final List<Symbol> params;
    private final CompoundStmt body;

    public GlobalFunction(SourceLocation location, String name, LslType returnType,
                          List<Symbol> params, CompoundStmt body) {
        super(location, name);
        this.returnType = returnType;
        this.params = params;
        this.body = body;
    }

    public LslType getReturnType() {
        return returnType;
    }

    public List<Symbol> getParams() {
        return params;
    }

    public CompoundStmt getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalFunction(this, context);
    }
}
