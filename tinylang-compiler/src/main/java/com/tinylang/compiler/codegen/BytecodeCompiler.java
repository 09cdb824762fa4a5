package com.tinylang.compiler.codegen;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.ChunkLimitException;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Operators;
import com.tinylang.bytecode.Value;
import com.tinylang.compiler.ast.AstNode;
import com.tinylang.compiler.ast.Program;
import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.*;
import com.tinylang.compiler.ast.stmt.*;
import com.tinylang.compiler.diagnostic.CompileError;
import com.tinylang.compiler.diagnostic.ErrorReporter;

import java.util.List;

/**
 * AST → 字节码编译器
 *
 * 单遍树遍历，边生成边解析名称：每个引用解析为局部槽位、upvalue 或全局名之一。
 * 每个函数一个 {@link FunctionState}，嵌套函数编译完成后分配到堆上，
 * 并在外层字节块中生成 CLOSURE。
 */
public class BytecodeCompiler {

    private final Heap heap;
    private final ErrorReporter reporter;
    private final CompilerOptions options;

    private FunctionState current;
    private int line = 1;
    private SourceLocation location = SourceLocation.UNKNOWN;

    public BytecodeCompiler(Heap heap, ErrorReporter reporter, CompilerOptions options) {
        this.heap = heap;
        this.reporter = reporter;
        this.options = options;
    }

    /**
     * 编译整个程序为顶层脚本函数并分配到堆上。
     * 错误记入 reporter；调用方应在 reporter 无错误时才执行结果。
     */
    public ObjFunction compile(Program program) {
        current = new FunctionState(null, ObjFunction.SCRIPT_NAME, 0);
        for (Statement stmt : program.getStatements()) {
            statement(stmt);
        }
        emit(OpCode.NIL);
        emit(OpCode.RETURN);
        ObjFunction script = finish(current);
        current = null;
        return script;
    }

    // ============ 语句 ============

    private void statement(Statement stmt) {
        mark(stmt);
        switch (stmt.getKind()) {
            case EXPRESSION:
                expression(((ExpressionStmt) stmt).getExpression());
                emit(OpCode.POP);
                break;
            case PRINT:
                printStatement((PrintStmt) stmt);
                break;
            case VAR:
                varStatement((VarStmt) stmt);
                break;
            case FUNCTION:
                functionStatement((FunctionStmt) stmt);
                break;
            case BLOCK:
                beginScope();
                for (Statement inner : ((BlockStmt) stmt).getStatements()) {
                    statement(inner);
                }
                endScope();
                break;
            case IF:
                ifStatement((IfStmt) stmt);
                break;
            case WHILE:
                whileStatement((WhileStmt) stmt);
                break;
            case FOR:
                forStatement((ForStmt) stmt);
                break;
            case BREAK:
                breakStatement();
                break;
            case CONTINUE:
                continueStatement();
                break;
            case RETURN:
                Expression value = ((ReturnStmt) stmt).getValue();
                if (value != null) {
                    expression(value);
                } else {
                    emit(OpCode.NIL);
                }
                emit(OpCode.RETURN);
                break;
            default:
                throw new IllegalStateException("Unknown statement kind: " + stmt.getKind());
        }
    }

    /** print a, b  →  GET_GLOBAL print; a; b; CALL 2; POP */
    private void printStatement(PrintStmt stmt) {
        emit(OpCode.GET_GLOBAL, nameConstant("print"));
        for (Expression arg : stmt.getArguments()) {
            expression(arg);
        }
        emitCall(stmt.getArguments().size());
        emit(OpCode.POP);
    }

    private void varStatement(VarStmt stmt) {
        if (current.scopeDepth == 0) {
            initializer(stmt.getInitializer());
            emit(OpCode.DEFINE_GLOBAL, nameConstant(stmt.getName()));
            return;
        }
        checkDuplicate(stmt.getName());
        // 初始化表达式先编译，因此 let x = x; 中右侧的 x 指向外层变量
        initializer(stmt.getInitializer());
        mark(stmt);
        addLocal(stmt.getName());
    }

    private void initializer(Expression init) {
        if (init != null) {
            expression(init);
        } else {
            emit(OpCode.NIL);
        }
    }

    private void functionStatement(FunctionStmt stmt) {
        if (current.scopeDepth == 0) {
            function(stmt.getName(), stmt.getParams(), stmt.getBody());
            mark(stmt);
            emit(OpCode.DEFINE_GLOBAL, nameConstant(stmt.getName()));
            return;
        }
        checkDuplicate(stmt.getName());
        // 先登记局部变量，函数体内的递归调用才能解析到它
        addLocal(stmt.getName());
        function(stmt.getName(), stmt.getParams(), stmt.getBody());
    }

    private void ifStatement(IfStmt stmt) {
        expression(stmt.getCondition());
        int thenJump = emitJump(OpCode.JUMP_IF_FALSE);
        emit(OpCode.POP);
        statement(stmt.getThenBranch());

        mark(stmt);
        int elseJump = emitJump(OpCode.JUMP);
        patchJump(thenJump);
        emit(OpCode.POP);
        if (stmt.getElseBranch() != null) {
            statement(stmt.getElseBranch());
        }
        patchJump(elseJump);
    }

    private void whileStatement(WhileStmt stmt) {
        int loopStart = current.chunk.count();
        expression(stmt.getCondition());
        int exitJump = emitJump(OpCode.JUMP_IF_FALSE);
        emit(OpCode.POP);

        LoopContext loop = new LoopContext(current.loop, current.scopeDepth, loopStart);
        current.loop = loop;
        statement(stmt.getBody());
        current.loop = loop.enclosing;

        mark(stmt);
        emitLoop(loopStart);
        patchJump(exitJump);
        emit(OpCode.POP);
        for (int jump : loop.breakJumps) {
            patchJump(jump);
        }
    }

    /**
     * for 等价于外包一层作用域的 while：初始化只执行一次，
     * 递增部分位于 continue 的落点。
     */
    private void forStatement(ForStmt stmt) {
        beginScope();
        if (stmt.getInitializer() != null) {
            statement(stmt.getInitializer());
        }

        mark(stmt);
        int loopStart = current.chunk.count();
        int exitJump = -1;
        if (stmt.getCondition() != null) {
            expression(stmt.getCondition());
            exitJump = emitJump(OpCode.JUMP_IF_FALSE);
            emit(OpCode.POP);
        }

        LoopContext loop = new LoopContext(current.loop, current.scopeDepth, -1);
        current.loop = loop;
        statement(stmt.getBody());
        current.loop = loop.enclosing;

        for (int jump : loop.continueJumps) {
            patchJump(jump);
        }
        mark(stmt);
        if (stmt.getIncrement() != null) {
            expression(stmt.getIncrement());
            emit(OpCode.POP);
        }
        emitLoop(loopStart);

        if (exitJump >= 0) {
            patchJump(exitJump);
            emit(OpCode.POP);
        }
        for (int jump : loop.breakJumps) {
            patchJump(jump);
        }
        endScope();
    }

    private void breakStatement() {
        LoopContext loop = current.loop;
        if (loop == null) {
            error("Can't use 'break' outside of a loop.");
            return;
        }
        discardLocalsAbove(loop.scopeDepth);
        loop.breakJumps.add(emitJump(OpCode.JUMP));
    }

    private void continueStatement() {
        LoopContext loop = current.loop;
        if (loop == null) {
            error("Can't use 'continue' outside of a loop.");
            return;
        }
        discardLocalsAbove(loop.scopeDepth);
        if (loop.continueTarget >= 0) {
            emitLoop(loop.continueTarget);
        } else {
            loop.continueJumps.add(emitJump(OpCode.JUMP));
        }
    }

    // ============ 函数 ============

    /**
     * 在新的函数上下文中编译函数体，然后在外层生成 CLOSURE。
     */
    private void function(String name, List<String> params, List<Statement> body) {
        FunctionState state = new FunctionState(current, name, params.size());
        current = state;
        beginScope();
        for (String param : params) {
            if (state.declaredInCurrentScope(param)) {
                error("Duplicate parameter name '" + param + "'.");
            }
            addLocal(param);
        }
        for (Statement stmt : body) {
            statement(stmt);
        }
        emit(OpCode.NIL);
        emit(OpCode.RETURN);

        current = state.enclosing;
        ObjFunction function = finish(state);
        emit(OpCode.CLOSURE, constant(Value.function(function.getHandle())));
    }

    private ObjFunction finish(FunctionState state) {
        ObjFunction function = new ObjFunction(state.name, state.arity, state.chunk, state.upvalues);
        heap.allocate(function);
        return function;
    }

    // ============ 表达式 ============

    private void expression(Expression expr) {
        mark(expr);
        if (options.isFoldConstants() && expr.getKind() != Expression.Kind.LITERAL) {
            Value folded = evaluateConstant(expr);
            if (folded != null) {
                emitConstant(folded);
                return;
            }
        }

        switch (expr.getKind()) {
            case LITERAL:
                emitConstant(((Literal) expr).getValue());
                break;
            case VARIABLE:
                namedVariable(((Variable) expr).getName(), false);
                break;
            case ASSIGN:
                Assign assign = (Assign) expr;
                expression(assign.getValue());
                mark(assign);
                namedVariable(assign.getName(), true);
                break;
            case UNARY:
                Unary unary = (Unary) expr;
                expression(unary.getOperand());
                mark(unary);
                emit(unary.getOperator() == Unary.UnaryOp.NEG ? OpCode.NEGATE : OpCode.NOT);
                break;
            case BINARY:
                Binary binary = (Binary) expr;
                expression(binary.getLeft());
                expression(binary.getRight());
                mark(binary);
                emit(opcodeOf(binary.getOperator()));
                break;
            case LOGICAL:
                logical((Logical) expr);
                break;
            case CALL:
                Call call = (Call) expr;
                expression(call.getCallee());
                for (Expression arg : call.getArguments()) {
                    expression(arg);
                }
                mark(call);
                emitCall(call.getArguments().size());
                break;
            case FUNCTION:
                FunctionExpr fn = (FunctionExpr) expr;
                function("anonymous", fn.getParams(), fn.getBody());
                break;
            default:
                throw new IllegalStateException("Unknown expression kind: " + expr.getKind());
        }
    }

    /**
     * a && b:  a; JUMP_IF_FALSE end; POP; b; end:
     * a || b:  a; JUMP_IF_FALSE else; JUMP end; else: POP; b; end:
     */
    private void logical(Logical expr) {
        expression(expr.getLeft());
        mark(expr);
        if (expr.isAnd()) {
            int endJump = emitJump(OpCode.JUMP_IF_FALSE);
            emit(OpCode.POP);
            expression(expr.getRight());
            patchJump(endJump);
        } else {
            int elseJump = emitJump(OpCode.JUMP_IF_FALSE);
            int endJump = emitJump(OpCode.JUMP);
            patchJump(elseJump);
            emit(OpCode.POP);
            expression(expr.getRight());
            patchJump(endJump);
        }
    }

    /**
     * 常量表达式求值：字面量，或操作数均可求值的一元 / 二元 / 逻辑运算。
     * 除数或模数为常量零时返回 null，错误留到运行时报告。
     */
    private Value evaluateConstant(Expression expr) {
        switch (expr.getKind()) {
            case LITERAL:
                return ((Literal) expr).getValue();
            case UNARY: {
                Unary unary = (Unary) expr;
                Value operand = evaluateConstant(unary.getOperand());
                if (operand == null) return null;
                OpCode op = unary.getOperator() == Unary.UnaryOp.NEG ? OpCode.NEGATE : OpCode.NOT;
                return Operators.tryFoldUnary(op, operand);
            }
            case BINARY: {
                Binary binary = (Binary) expr;
                Value left = evaluateConstant(binary.getLeft());
                if (left == null) return null;
                Value right = evaluateConstant(binary.getRight());
                if (right == null) return null;
                return Operators.tryFold(opcodeOf(binary.getOperator()), left, right);
            }
            case LOGICAL: {
                Logical logical = (Logical) expr;
                Value left = evaluateConstant(logical.getLeft());
                if (left == null) return null;
                Value right = evaluateConstant(logical.getRight());
                if (right == null) return null;
                if (logical.isAnd()) {
                    return left.isTruthy() ? right : left;
                }
                return left.isTruthy() ? left : right;
            }
            default:
                return null;
        }
    }

    private static OpCode opcodeOf(Binary.BinaryOp op) {
        switch (op) {
            case ADD: return OpCode.ADD;
            case SUB: return OpCode.SUBTRACT;
            case MUL: return OpCode.MULTIPLY;
            case DIV: return OpCode.DIVIDE;
            case MOD: return OpCode.MODULO;
            case EQ: return OpCode.EQUAL;
            case NE: return OpCode.NOT_EQUAL;
            case LT: return OpCode.LESS;
            case LE: return OpCode.LESS_EQUAL;
            case GT: return OpCode.GREATER;
            case GE: return OpCode.GREATER_EQUAL;
            default:
                throw new IllegalArgumentException("Unknown operator: " + op);
        }
    }

    // ============ 名称解析 ============

    /**
     * 解析顺序：当前函数的局部变量 → 外层函数链上的 upvalue → 全局名。
     */
    private void namedVariable(String name, boolean assign) {
        int slot = current.resolveLocal(name);
        if (slot >= 0) {
            emit(assign ? OpCode.SET_LOCAL : OpCode.GET_LOCAL, slot);
            return;
        }
        int upvalue = resolveUpvalue(current, name);
        if (upvalue >= 0) {
            emit(assign ? OpCode.SET_UPVALUE : OpCode.GET_UPVALUE, upvalue);
            return;
        }
        emit(assign ? OpCode.SET_GLOBAL : OpCode.GET_GLOBAL, nameConstant(name));
    }

    /**
     * 沿外层函数链解析 upvalue。找到的外层局部变量标记为已捕获。
     *
     * @return upvalue 下标，不是外层变量时返回 -1
     */
    private int resolveUpvalue(FunctionState state, String name) {
        if (state.enclosing == null) return -1;

        int local = state.enclosing.resolveLocal(name);
        if (local >= 0) {
            state.enclosing.locals.get(local).captured = true;
            return addUpvalue(state, true, local);
        }

        int upvalue = resolveUpvalue(state.enclosing, name);
        if (upvalue >= 0) {
            return addUpvalue(state, false, upvalue);
        }
        return -1;
    }

    private int addUpvalue(FunctionState state, boolean isLocal, int index) {
        int result = state.addUpvalue(isLocal, index);
        if (result < 0) {
            error("Too many closure variables in function.");
            return 0;
        }
        return result;
    }

    // ============ 作用域 ============

    private void beginScope() {
        current.scopeDepth++;
    }

    /** 按声明的逆序丢弃本层局部变量；被捕获的变量改为关闭 upvalue */
    private void endScope() {
        current.scopeDepth--;
        List<Local> locals = current.locals;
        while (!locals.isEmpty() && locals.get(locals.size() - 1).depth > current.scopeDepth) {
            Local local = locals.remove(locals.size() - 1);
            emit(local.captured ? OpCode.CLOSE_UPVALUE : OpCode.POP);
        }
    }

    /** break / continue 跳出前丢弃循环体内的局部变量（不修改编译期列表） */
    private void discardLocalsAbove(int depth) {
        List<Local> locals = current.locals;
        for (int i = locals.size() - 1; i >= 0 && locals.get(i).depth > depth; i--) {
            emit(locals.get(i).captured ? OpCode.CLOSE_UPVALUE : OpCode.POP);
        }
    }

    private void checkDuplicate(String name) {
        if (current.declaredInCurrentScope(name)) {
            error("Already a variable with this name in this scope.");
        }
    }

    private void addLocal(String name) {
        if (current.locals.size() >= FunctionState.MAX_LOCALS) {
            error("Too many local variables in function.");
            return;
        }
        current.locals.add(new Local(name, current.scopeDepth));
    }

    // ============ 生成 ============

    private void mark(AstNode node) {
        location = node.getLocation();
        line = location.getLine();
    }

    private void emit(OpCode op) {
        current.chunk.writeOp(op, line);
    }

    private void emit(OpCode op, int operand) {
        current.chunk.writeOp(op, operand, line);
    }

    private void emitConstant(Value value) {
        emit(OpCode.CONSTANT, constant(value));
    }

    private int constant(Value value) {
        try {
            return current.chunk.addConstant(value);
        } catch (ChunkLimitException e) {
            error(e.getMessage());
            return 0;
        }
    }

    /** 名称常量在同一字节块内复用 */
    private int nameConstant(String name) {
        try {
            return current.chunk.internConstant(Value.string(name));
        } catch (ChunkLimitException e) {
            error(e.getMessage());
            return 0;
        }
    }

    private int emitJump(OpCode op) {
        return current.chunk.writeJump(op, line);
    }

    private void patchJump(int operandOffset) {
        try {
            current.chunk.patchJump(operandOffset);
        } catch (ChunkLimitException e) {
            error(e.getMessage());
        }
    }

    private void emitLoop(int loopStart) {
        Chunk chunk = current.chunk;
        try {
            chunk.writeLoop(loopStart, line);
        } catch (ChunkLimitException e) {
            error("Loop body too large.");
            chunk.writeShortOp(OpCode.LOOP, 0, line);
        }
    }

    /** CALL 的操作数只有一个字节，超出时报错而不是截断 */
    private void emitCall(int argCount) {
        if (argCount > 0xFF) {
            error("Can't have more than 255 arguments.");
            return;
        }
        emit(OpCode.CALL, argCount);
    }

    private void error(String message) {
        reporter.report(CompileError.ErrorType.SEMANTIC, message, location);
    }
}
