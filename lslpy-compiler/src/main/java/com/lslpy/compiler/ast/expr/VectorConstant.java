package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * vector 常量 {@code <x, y, z>}
 */
public class VectorConstant extends Expression {
    private final float x;
    private final float y;
    private final float z;

    public VectorConstant(SourceLocation location, float x, float y, float z) {
        super(location, LslType.VECTOR);
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public float getX() { return x; }
    public float getY() { return y; }
    public float getZ() { return z; }

    /** 按偏移顺序返回各分量 */
    public float[] getComponents() {
        return new float[]{x, y, z};
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVectorConstant(this, context);
    }
}
