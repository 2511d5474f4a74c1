package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用（内置函数或脚本自定义函数）
 */
public class FunctionCallExpr extends Expression {
    private final Symbol function;
    private final List<Expression> arguments;

    public FunctionCallExpr(SourceLocation location, Symbol function, List<Expression> arguments) {
        super(location, function.getType());
        this.function = function;
        this.arguments = arguments;
    }

    public Symbol getFunction() {
        return function;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallExpr(this, context);
    }
}
