package com.lslpy.compiler.analysis;

import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.expr.*;

import java.util.Collections;

/**
 * LSL 语义类型标签（封闭集合）
 */
public enum LslType {
    NONE("none"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    KEY("key"),
    VECTOR("vector"),
    QUATERNION("quaternion"),
    LIST("list"),
    ERROR("error");

    private final String sourceName;

    LslType(String sourceName) {
        this.sourceName = sourceName;
    }

    /** 返回 LSL 源码中的类型名 */
    public String getSourceName() {
        return sourceName;
    }

    /** 是否为坐标类型（按偏移访问分量，不可原地修改） */
    public boolean isCoordinate() {
        return this == VECTOR || this == QUATERNION;
    }

    /**
     * 未显式初始化时的零值常量（全局变量与局部声明共用）
     *
     * @return 新构造的常量节点；NONE / ERROR 没有零值，返回 null
     */
    public Expression defaultValue(SourceLocation location) {
        switch (this) {
            case INTEGER:    return new IntegerConstant(location, 0);
            case FLOAT:      return new FloatConstant(location, 0.0f);
            case STRING:     return new StringConstant(location, "");
            case KEY:        return new KeyConstant(location, "");
            case VECTOR:     return new VectorConstant(location, 0.0f, 0.0f, 0.0f);
            case QUATERNION: return new QuaternionConstant(location, 0.0f, 0.0f, 0.0f, 0.0f);
            case LIST:       return new ListConstant(location, Collections.<Expression>emptyList());
            default:         return null;
        }
    }

    /**
     * 自增/自减的步长常量
     *
     * @return 整数返回 1，浮点返回 1.0，其余类型返回 null
     */
    public Expression oneValue(SourceLocation location) {
        switch (this) {
            case INTEGER: return new IntegerConstant(location, 1);
            case FLOAT:   return new FloatConstant(location, 1.0f);
            default:      return null;
        }
    }

    /**
     * 按源码类型名查找（接受 rotation 作为 quaternion 的别名）
     *
     * @return 对应类型，未识别返回 null
     */
    public static LslType fromSourceName(String name) {
        if ("rotation".equals(name)) {
            return QUATERNION;
        }
        for (LslType type : values()) {
            if (type.sourceName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
