package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * key 常量
 */
public class KeyConstant extends Expression {
    private final String value;

    public KeyConstant(SourceLocation location, String value) {
        super(location, LslType.KEY);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitKeyConstant(this, context);
    }
}
