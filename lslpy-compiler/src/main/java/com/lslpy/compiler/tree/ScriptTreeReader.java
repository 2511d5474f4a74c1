package com.lslpy.compiler.tree;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.analysis.SymbolScope;
import com.lslpy.compiler.ast.CoordinateMember;
import com.lslpy.compiler.ast.SourceLocation;
import com.lslpy.compiler.ast.decl.*;
import com.lslpy.compiler.ast.expr.*;
import com.lslpy.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lslpy.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.lslpy.compiler.ast.stmt.*;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取前端以 JSON 交付的类型化 AST
 *
 * <p>文档结构：</p>
 * <pre>{@code
 * {
 *   "errors": 0,
 *   "diagnostics": [{"severity": "WARNING", "message": "...", "line": 1, "column": 1}],
 *   "script": {"globals": [...], "states": [...]}
 * }
 * }</pre>
 *
 * <p>每个节点用 {@code "node"} 字段区分种类，可选携带 {@code line}/{@code column}。
 * 读取器只做结构检查，不重新验证语义。</p>
 */
public class ScriptTreeReader {

    private final Gson gson = new Gson();
    private final String fileName;

    public ScriptTreeReader(String fileName) {
        this.fileName = fileName;
    }

    public FrontEndResult read(String json) {
        return read(new StringReader(json));
    }

    public FrontEndResult read(Reader reader) {
        JsonObject root;
        try {
            root = gson.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new TreeFormatException("无法解析树文档: " + e.getMessage(), "", e);
        } catch (ClassCastException e) {
            // 顶层不是对象（数组或标量）
            throw new TreeFormatException("树文档顶层必须是 JSON 对象", "", e);
        }
        if (root == null) {
            throw new TreeFormatException("树文档为空", "");
        }

        List<FrontEndDiagnostic> diagnostics = new ArrayList<FrontEndDiagnostic>();
        JsonArray diagArray = optArray(root, "diagnostics", "");
        for (int i = 0; i < diagArray.size(); i++) {
            diagnostics.add(readDiagnostic(diagArray.get(i), "diagnostics[" + i + "]"));
        }

        int errorCount;
        if (root.has("errors")) {
            errorCount = intValue(root, "errors", "");
        } else {
            errorCount = 0;
            for (FrontEndDiagnostic diagnostic : diagnostics) {
                if (diagnostic.isError()) errorCount++;
            }
        }

        if (errorCount > 0) {
            // 有错误时不生成，前端交付的残缺树不解码
            return new FrontEndResult(errorCount, diagnostics, null);
        }
        if (!root.has("script") || root.get("script").isJsonNull()) {
            throw new TreeFormatException("缺少字段 'script'", "");
        }
        Script script = readScript(object(root.get("script"), "script"), "script");
        return new FrontEndResult(errorCount, diagnostics, script);
    }

    // ============ 诊断 ============

    private FrontEndDiagnostic readDiagnostic(JsonElement element, String path) {
        JsonObject o = object(element, path);
        String severityName = string(o, "severity", path);
        FrontEndDiagnostic.Severity severity;
        try {
            severity = FrontEndDiagnostic.Severity.valueOf(severityName.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new TreeFormatException("未知的诊断级别 '" + severityName + "'", path, e);
        }
        return new FrontEndDiagnostic(severity, string(o, "message", path), location(o, path));
    }

    // ============ 声明 ============

    private Script readScript(JsonObject o, String path) {
        List<Declaration> globals = new ArrayList<Declaration>();
        JsonArray globalArray = array(o, "globals", path);
        for (int i = 0; i < globalArray.size(); i++) {
            globals.add(readGlobal(globalArray.get(i), path + ".globals[" + i + "]"));
        }

        List<StateDecl> states = new ArrayList<StateDecl>();
        JsonArray stateArray = array(o, "states", path);
        for (int i = 0; i < stateArray.size(); i++) {
            states.add(readState(stateArray.get(i), path + ".states[" + i + "]"));
        }
        return new Script(location(o, path), globals, states);
    }

    private Declaration readGlobal(JsonElement element, String path) {
        JsonObject o = object(element, path);
        String kind = string(o, "node", path);
        SourceLocation loc = location(o, path);
        String name = string(o, "name", path);
        LslType type = type(o, "type", path);

        switch (kind) {
            case "globalVariable": {
                Symbol symbol = new Symbol(name, SymbolScope.GLOBAL, type, loc);
                return new GlobalVariable(loc, symbol, optExpression(o, "init", path));
            }
            case "globalFunction":
                return new GlobalFunction(loc, name, type, readParams(o, path),
                        readBody(o, path));
            default:
                throw new TreeFormatException("未知的全局声明节点 '" + kind + "'", path);
        }
    }

    private StateDecl readState(JsonElement element, String path) {
        JsonObject o = object(element, path);
        String stateName = string(o, "name", path);
        List<EventHandler> handlers = new ArrayList<EventHandler>();
        JsonArray handlerArray = array(o, "handlers", path);
        for (int i = 0; i < handlerArray.size(); i++) {
            String handlerPath = path + ".handlers[" + i + "]";
            JsonObject h = object(handlerArray.get(i), handlerPath);
            handlers.add(new EventHandler(location(h, handlerPath), stateName, string(h, "name", handlerPath),
                    readParams(h, handlerPath), readBody(h, handlerPath)));
        }
        return new StateDecl(location(o, path), stateName, handlers);
    }

    private List<Symbol> readParams(JsonObject o, String path) {
        List<Symbol> params = new ArrayList<Symbol>();
        JsonArray paramArray = optArray(o, "params", path);
        for (int i = 0; i < paramArray.size(); i++) {
            String paramPath = path + ".params[" + i + "]";
            JsonObject p = object(paramArray.get(i), paramPath);
            params.add(new Symbol(string(p, "name", paramPath), SymbolScope.LOCAL,
                    type(p, "type", paramPath), location(p, paramPath)));
        }
        return params;
    }

    private CompoundStmt readBody(JsonObject o, String path) {
        Statement body = readStatement(required(o, "body", path), path + ".body");
        if (!(body instanceof CompoundStmt)) {
            throw new TreeFormatException("函数体必须是 compound 节点", path + ".body");
        }
        return (CompoundStmt) body;
    }

    // ============ 语句 ============

    private Statement readStatement(JsonElement element, String path) {
        JsonObject o = object(element, path);
        String kind = string(o, "node", path);
        SourceLocation loc = location(o, path);

        switch (kind) {
            case "nop":
                return new NopStmt(loc);
            case "compound": {
                List<Statement> statements = new ArrayList<Statement>();
                JsonArray stmtArray = array(o, "statements", path);
                for (int i = 0; i < stmtArray.size(); i++) {
                    statements.add(readStatement(stmtArray.get(i), path + ".statements[" + i + "]"));
                }
                return new CompoundStmt(loc, statements);
            }
            case "expr":
                return new ExpressionStmt(loc, expression(o, "expr", path));
            case "decl": {
                Symbol symbol = new Symbol(string(o, "name", path), SymbolScope.LOCAL, type(o, "type", path), loc);
                return new DeclarationStmt(loc, symbol, optExpression(o, "init", path));
            }
            case "if": {
                Statement elseBranch = null;
                if (o.has("else") && !o.get("else").isJsonNull()) {
                    elseBranch = readStatement(o.get("else"), path + ".else");
                }
                return new IfStmt(loc, expression(o, "cond", path),
                        readStatement(required(o, "then", path), path + ".then"), elseBranch);
            }
            case "for":
                return new ForStmt(loc, expressionList(o, "init", path), expression(o, "cond", path),
                        expressionList(o, "incr", path), readStatement(required(o, "body", path), path + ".body"));
            case "while":
                return new WhileStmt(loc, expression(o, "cond", path),
                        readStatement(required(o, "body", path), path + ".body"));
            case "do":
                return new DoStmt(loc, readStatement(required(o, "body", path), path + ".body"),
                        expression(o, "cond", path));
            case "jump":
                return new JumpStmt(loc, string(o, "label", path));
            case "label":
                return new LabelStmt(loc, string(o, "name", path));
            case "return":
                return new ReturnStmt(loc, optExpression(o, "expr", path));
            case "state":
                return new StateChangeStmt(loc, string(o, "name", path));
            default:
                throw new TreeFormatException("未知的语句节点 '" + kind + "'", path);
        }
    }

    // ============ 表达式 ============

    private Expression readExpression(JsonElement element, String path) {
        JsonObject o = object(element, path);
        String kind = string(o, "node", path);
        SourceLocation loc = location(o, path);

        Expression expr;
        switch (kind) {
            case "integer":
                expr = new IntegerConstant(loc, intValue(o, "value", path));
                break;
            case "float":
                expr = new FloatConstant(loc, floatConstant(o, path));
                break;
            case "string":
                expr = new StringConstant(loc, string(o, "value", path));
                break;
            case "key":
                expr = new KeyConstant(loc, string(o, "value", path));
                break;
            case "vector": {
                float[] v = floatArray(o, "value", 3, path);
                expr = new VectorConstant(loc, v[0], v[1], v[2]);
                break;
            }
            case "quaternion": {
                float[] q = floatArray(o, "value", 4, path);
                expr = new QuaternionConstant(loc, q[0], q[1], q[2], q[3]);
                break;
            }
            case "list":
                expr = new ListConstant(loc, expressionList(o, "elements", path));
                break;
            case "vectorExpr":
                expr = new VectorExpr(loc, sizedExpressionList(o, "components", 3, path));
                break;
            case "quaternionExpr":
                expr = new QuaternionExpr(loc, sizedExpressionList(o, "components", 4, path));
                break;
            case "listExpr":
                expr = new ListExpr(loc, expressionList(o, "elements", path));
                break;
            case "cast":
                expr = new TypecastExpr(loc, type(o, "type", path), expression(o, "expr", path));
                break;
            case "call": {
                Symbol function = new Symbol(string(o, "name", path), scope(o, path), type(o, "type", path), loc);
                expr = new FunctionCallExpr(loc, function, expressionList(o, "args", path));
                break;
            }
            case "lvalue":
                expr = readLValue(o, loc, path);
                break;
            case "binary": {
                String opSource = string(o, "op", path);
                BinaryOp op = BinaryOp.fromSource(opSource);
                if (op == null) {
                    throw new TreeFormatException("未知的二元运算符 '" + opSource + "'", path);
                }
                expr = new BinaryExpr(loc, type(o, "type", path), expression(o, "left", path), op,
                        expression(o, "right", path));
                break;
            }
            case "unary": {
                String opSource = string(o, "op", path);
                UnaryOp op = UnaryOp.fromSource(opSource);
                if (op == null) {
                    throw new TreeFormatException("未知的一元运算符 '" + opSource + "'", path);
                }
                Expression operand = expression(o, "expr", path);
                LslType type = o.has("type") ? type(o, "type", path) : operand.getType();
                expr = new UnaryExpr(loc, type, op, operand);
                break;
            }
            case "print":
                expr = new PrintExpr(loc, expression(o, "expr", path));
                break;
            case "paren":
                expr = new ParenthesisExpr(loc, expression(o, "expr", path));
                break;
            case "bool":
                expr = new BoolConversionExpr(loc, expression(o, "expr", path));
                break;
            default:
                throw new TreeFormatException("未知的表达式节点 '" + kind + "'", path);
        }

        if (o.has("resultNeeded")) {
            expr.setResultNeeded(booleanValue(o, "resultNeeded", path));
        }
        return expr;
    }

    private LValueExpr readLValue(JsonObject o, SourceLocation loc, String path) {
        Symbol symbol = new Symbol(string(o, "name", path), scope(o, path), type(o, "type", path), loc);
        CoordinateMember member = null;
        if (o.has("member") && !o.get("member").isJsonNull()) {
            if (!symbol.getType().isCoordinate()) {
                throw new TreeFormatException("类型 " + symbol.getType().getSourceName() + " 没有坐标成员", path);
            }
            String memberName = string(o, "member", path);
            member = CoordinateMember.fromName(memberName);
            if (member == null) {
                throw new TreeFormatException("未知的坐标成员 '" + memberName + "'", path);
            }
        }
        return new LValueExpr(loc, symbol, member);
    }

    /**
     * 浮点常量：优先使用精确的 {@code bits}（IEEE-754 位模式），否则按十进制解析并舍入到 float
     */
    private float floatConstant(JsonObject o, String path) {
        if (o.has("bits")) {
            return Float.intBitsToFloat((int) longValue(o, "bits", path));
        }
        return floatValue(required(o, "value", path), path + ".value");
    }

    // ============ JSON 访问辅助 ============

    private Expression expression(JsonObject o, String field, String path) {
        return readExpression(required(o, field, path), path + "." + field);
    }

    private Expression optExpression(JsonObject o, String field, String path) {
        if (!o.has(field) || o.get(field).isJsonNull()) {
            return null;
        }
        return readExpression(o.get(field), path + "." + field);
    }

    private List<Expression> expressionList(JsonObject o, String field, String path) {
        JsonArray elements = array(o, field, path);
        List<Expression> result = new ArrayList<Expression>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            result.add(readExpression(elements.get(i), path + "." + field + "[" + i + "]"));
        }
        return result;
    }

    private List<Expression> sizedExpressionList(JsonObject o, String field, int size, String path) {
        List<Expression> result = expressionList(o, field, path);
        if (result.size() != size) {
            throw new TreeFormatException("'" + field + "' 需要 " + size + " 个分量，实际为 " + result.size(), path);
        }
        return result;
    }

    private float[] floatArray(JsonObject o, String field, int size, String path) {
        JsonArray values = array(o, field, path);
        if (values.size() != size) {
            throw new TreeFormatException("'" + field + "' 需要 " + size + " 个分量，实际为 " + values.size(), path);
        }
        float[] result = new float[size];
        for (int i = 0; i < size; i++) {
            result[i] = floatValue(values.get(i), path + "." + field + "[" + i + "]");
        }
        return result;
    }

    private LslType type(JsonObject o, String field, String path) {
        String name = string(o, field, path);
        LslType type = LslType.fromSourceName(name);
        if (type == null) {
            throw new TreeFormatException("未知的类型 '" + name + "'", path);
        }
        return type;
    }

    private SymbolScope scope(JsonObject o, String path) {
        String name = string(o, "scope", path);
        try {
            return SymbolScope.valueOf(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new TreeFormatException("未知的作用域 '" + name + "'", path, e);
        }
    }

    private SourceLocation location(JsonObject o, String path) {
        if (!o.has("line")) {
            return SourceLocation.UNKNOWN;
        }
        int column = o.has("column") ? intValue(o, "column", path) : 0;
        return new SourceLocation(fileName, intValue(o, "line", path), column);
    }

    private static JsonElement required(JsonObject o, String field, String path) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            throw new TreeFormatException("缺少字段 '" + field + "'", path);
        }
        return element;
    }

    private static JsonObject object(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new TreeFormatException("需要 JSON 对象", path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject o, String field, String path) {
        JsonElement element = required(o, field, path);
        if (!element.isJsonArray()) {
            throw new TreeFormatException("字段 '" + field + "' 需要数组", path);
        }
        return element.getAsJsonArray();
    }

    private static JsonArray optArray(JsonObject o, String field, String path) {
        if (!o.has(field) || o.get(field).isJsonNull()) {
            return new JsonArray();
        }
        return array(o, field, path);
    }

    private static JsonPrimitive primitive(JsonElement element, String path) {
        if (element == null || !element.isJsonPrimitive()) {
            throw new TreeFormatException("需要标量值", path);
        }
        return element.getAsJsonPrimitive();
    }

    private static String string(JsonObject o, String field, String path) {
        JsonPrimitive value = primitive(required(o, field, path), path + "." + field);
        if (!value.isString()) {
            throw new TreeFormatException("字段 '" + field + "' 需要字符串", path);
        }
        return value.getAsString();
    }

    private static int intValue(JsonObject o, String field, String path) {
        long value = longValue(o, field, path);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new TreeFormatException("字段 '" + field + "' 超出 32 位整数范围: " + value, path);
        }
        return (int) value;
    }

    private static long longValue(JsonObject o, String field, String path) {
        JsonPrimitive value = primitive(required(o, field, path), path + "." + field);
        try {
            return value.getAsLong();
        } catch (NumberFormatException e) {
            throw new TreeFormatException("字段 '" + field + "' 需要整数: " + value, path, e);
        }
    }

    private static float floatValue(JsonElement element, String path) {
        JsonPrimitive value = primitive(element, path);
        try {
            return value.getAsFloat();
        } catch (NumberFormatException e) {
            throw new TreeFormatException("需要数值: " + value, path, e);
        }
    }

    private static boolean booleanValue(JsonObject o, String field, String path) {
        JsonPrimitive value = primitive(required(o, field, path), path + "." + field);
        if (!value.isBoolean()) {
            throw new TreeFormatException("字段 '" + field + "' 需要布尔值", path);
        }
        return value.getAsBoolean();
    }
}
