package com.lslpy.compiler.ast;

/**
 * 坐标类型（vector / rotation）的成员访问后缀，偏移量固定
 */
public enum CoordinateMember {
    X("x", 0),
    Y("y", 1),
    Z("z", 2),
    S("s", 3);

    private final String name;
    private final int offset;

    CoordinateMember(String name, int offset) {
        this.name = name;
        this.offset = offset;
    }

    public String getName() {
        return name;
    }

    /** 成员在坐标元组中的下标 */
    public int getOffset() {
        return offset;
    }

    /**
     * 按源码成员名查找
     *
     * @return 对应成员，未识别的名字返回 null
     */
    public static CoordinateMember fromName(String name) {
        for (CoordinateMember member : values()) {
            if (member.name.equals(name)) {
                return member;
            }
        }
        return null;
    }
}
