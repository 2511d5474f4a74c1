package com.lslpy.compiler.ast.decl;

import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.expr.Expression;

/**
 * 全局变量声明
 */
public class GlobalVariable extends Declaration {
    private final Symbol symbol;
    private final Expression initializer;  // 可选

    public GlobalVariable(SourceLocation location, Symbol symbol, Expression initializer) {
        super(location, symbol.getName());
        this.symbol = symbol;
        this.initializer = initializer;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalVariable(this, context);
    }
}
