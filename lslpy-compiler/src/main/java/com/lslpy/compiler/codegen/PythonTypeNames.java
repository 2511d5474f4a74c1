package com.lslpy.compiler.codegen;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.ast.SourceLocation;

/**
 * LSL 类型 → Python 类型名（类型注解与 typecast 目标共用）
 */
public final class PythonTypeNames {

    private PythonTypeNames() {}

    public static String of(LslType type, SourceLocation location) {
        switch (type) {
            case NONE:       return "None";
            case INTEGER:    return "int";
            case FLOAT:      return "float";
            case STRING:     return "str";
            case KEY:        return "Key";
            case VECTOR:     return "Vector";
            case QUATERNION: return "Quaternion";
            case LIST:       return "list";
            default:
                throw new GenerationException("类型 " + type.getSourceName() + " 不应出现在已通过检查的树中", location);
        }
    }
}
