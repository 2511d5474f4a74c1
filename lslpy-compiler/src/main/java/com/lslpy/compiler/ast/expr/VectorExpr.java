package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 由子表达式构造的 vector {@code <a, b, c>}
 */
public class VectorExpr extends Expression {
    private final List<Expression> components;

    public VectorExpr(SourceLocation location, List<Expression> components) {
        super(location, LslType.VECTOR);
        this.components = components;
    }

    public List<Expression> getComponents() {
        return components;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVectorExpr(this, context);
    }
}
