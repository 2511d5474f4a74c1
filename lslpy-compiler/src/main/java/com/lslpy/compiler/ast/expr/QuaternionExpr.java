package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 由子表达式构造的 rotation {@code <a, b, c, d>}
 */
public class QuaternionExpr extends Expression {
    private final List<Expression> components;

    public QuaternionExpr(SourceLocation location, List<Expression> components) {
        super(location, LslType.QUATERNION);
        this.components = components;
    }

    public List<Expression> getComponents() {
        return components;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitQuaternionExpr(this, context);
    }
}
