package com.lslpy.compiler.ast.expr;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.AstVisitor;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * rotation 常量 {@code <x, y, z, s>}
 */
public class QuaternionConstant extends Expression {
    private final float x;
    private final float y;
    private final float z;
    private final float s;

    public QuaternionConstant(SourceLocation location, float x, float y, float z, float s) {
        super(location, LslType.QUATERNION);
        this.x = x;
        this.y = y;
        this.z = z;
        this.s = s;
    }

    public float getX() { return x; }
    public float getY() { return y; }
    public float getZ() { return z; }
    public float getS() { return s; }

    public float[] getComponents() {
        return new float[]{x, y, z, s};
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitQuaternionConstant(this, context);
    }
}
