package com.lslpy.compiler.tree;

/**
 * 前端交付的树文档格式错误（JSON 无法解析、缺少字段、未知节点/运算符/类型）
 */
public class TreeFormatException extends RuntimeException {
    private final String path;

    public TreeFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public TreeFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错节点在文档中的路径，如 {@code script.globals[0].init} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (path != null && !path.isEmpty()) {
            sb.append(" (at ").append(path).append(")");
        }
        return sb.toString();
    }
}
