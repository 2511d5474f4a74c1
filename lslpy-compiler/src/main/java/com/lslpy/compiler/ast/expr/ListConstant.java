package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

import java.util.List;

/**
 * list 常量（元素均为常量）
 */
public class ListConstant extends Expression {
    private final List<Expression> elements;

    public ListConstant(SourceLocation location, List<Expression> elements) {
        super(location, LslType.LIST);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListConstant(this, context);
    }
}
