package com.tinylang.compiler.parser;

import com.tinylang.bytecode.Value;
import com.tinylang.compiler.ast.Program;
import com.tinylang.compiler.ast.expr.*;
import com.tinylang.compiler.ast.stmt.*;
import com.tinylang.compiler.diagnostic.CompileError;
import com.tinylang.compiler.diagnostic.ErrorReporter;
import com.tinylang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private ErrorReporter reporter;

    private Program parse(String source) {
        reporter = new ErrorReporter("<test>", source);
        return new Parser(new Lexer(source, reporter).scanTokens(), reporter).parse();
    }

    private Statement single(String source) {
        Program program = parse(source);
        assertFalse(reporter.hasErrors(), () -> reporter.getErrors().toString());
        assertEquals(1, program.getStatements().size());
        return program.getStatements().get(0);
    }

    private Expression expr(String source) {
        Statement stmt = single(source);
        assertTrue(stmt instanceof ExpressionStmt);
        return ((ExpressionStmt) stmt).getExpression();
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("let 与 var 声明")
        void testVarDeclarations() {
            VarStmt let = (VarStmt) single("let x = 1;");
            assertEquals("x", let.getName());
            assertFalse(let.isMutable());
            assertTrue(let.getInitializer() instanceof Literal);

            VarStmt var = (VarStmt) single("var y;");
            assertTrue(var.isMutable());
            assertNull(var.getInitializer());
        }

        @Test
        @DisplayName("函数声明")
        void testFunctionDeclaration() {
            FunctionStmt fn = (FunctionStmt) single("fn add(a, b) { return a + b; }");
            assertEquals("add", fn.getName());
            assertEquals(List.of("a", "b"), fn.getParams());
            assertEquals(1, fn.getBody().size());
            assertTrue(fn.getBody().get(0) instanceof ReturnStmt);
        }

        @Test
        @DisplayName("匿名函数表达式")
        void testAnonymousFunction() {
            VarStmt let = (VarStmt) single("let f = fn(x) { return x; };");
            assertTrue(let.getInitializer() instanceof FunctionExpr);
            assertEquals(List.of("x"), ((FunctionExpr) let.getInitializer()).getParams());
        }

        @Test
        @DisplayName("输入末尾的分号可省略")
        void testTrailingSemicolonOptional() {
            VarStmt let = (VarStmt) single("let x = 1");
            assertEquals("x", let.getName());
        }

        @Test
        @DisplayName("'}' 之前的分号可省略")
        void testSemicolonOptionalBeforeBrace() {
            FunctionStmt fn = (FunctionStmt) single("fn make() { let n = 0; return fn() { n = n + 1; return n } }");
            ReturnStmt ret = (ReturnStmt) fn.getBody().get(1);
            assertTrue(ret.getValue() instanceof FunctionExpr);
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testFactorOverTerm() {
            Binary add = (Binary) expr("1 + 2 * 3;");
            assertEquals(Binary.BinaryOp.ADD, add.getOperator());
            Binary mul = (Binary) add.getRight();
            assertEquals(Binary.BinaryOp.MUL, mul.getOperator());
        }

        @Test
        @DisplayName("二元运算左结合")
        void testLeftAssociative() {
            Binary sub = (Binary) expr("10 - 4 - 3;");
            assertTrue(sub.getLeft() instanceof Binary);
            assertEquals(Value.number(3), ((Literal) sub.getRight()).getValue());
        }

        @Test
        @DisplayName("赋值右结合")
        void testAssignmentRightAssociative() {
            Assign a = (Assign) expr("a = b = 2;");
            assertEquals("a", a.getName());
            assertTrue(a.getValue() instanceof Assign);
        }

        @Test
        @DisplayName("&& 绑定比 || 更紧")
        void testLogicalPrecedence() {
            Logical or = (Logical) expr("a || b && c;");
            assertFalse(or.isAnd());
            assertTrue(((Logical) or.getRight()).isAnd());
        }

        @Test
        @DisplayName("调用链与一元运算")
        void testCallAndUnary() {
            Unary neg = (Unary) expr("-f(1)(2);");
            assertEquals(Unary.UnaryOp.NEG, neg.getOperator());
            Call outer = (Call) neg.getOperand();
            assertTrue(outer.getCallee() instanceof Call);
            assertEquals(1, outer.getArguments().size());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("print 的两种写法")
        void testPrintForms() {
            PrintStmt bare = (PrintStmt) single("print 1, 2;");
            assertEquals(2, bare.getArguments().size());

            PrintStmt parens = (PrintStmt) single("print(1, 2);");
            assertEquals(2, parens.getArguments().size());
        }

        @Test
        @DisplayName("括号开头的 print 表达式回退为普通表达式")
        void testPrintParenthesizedExpression() {
            PrintStmt stmt = (PrintStmt) single("print (1 + 2) * 3;");
            assertEquals(1, stmt.getArguments().size());
            Binary mul = (Binary) stmt.getArguments().get(0);
            assertEquals(Binary.BinaryOp.MUL, mul.getOperator());
        }

        @Test
        @DisplayName("for 语句各部分均可省略")
        void testForClauses() {
            ForStmt full = (ForStmt) single("for (let i = 0; i < 3; i = i + 1) print i;");
            assertTrue(full.getInitializer() instanceof VarStmt);
            assertNotNull(full.getCondition());
            assertNotNull(full.getIncrement());

            ForStmt empty = (ForStmt) single("for (;;) break;");
            assertNull(empty.getInitializer());
            assertNull(empty.getCondition());
            assertNull(empty.getIncrement());
            assertTrue(empty.getBody() instanceof BreakStmt);
        }

        @Test
        @DisplayName("if / else 与块")
        void testIfElse() {
            IfStmt stmt = (IfStmt) single("if (x) { print 1; } else print 2;");
            assertTrue(stmt.getThenBranch() instanceof BlockStmt);
            assertTrue(stmt.getElseBranch() instanceof PrintStmt);
        }
    }

    // ============ 错误恢复 ============

    @Nested
    @DisplayName("错误恢复")
    class ErrorRecoveryTests {

        @Test
        @DisplayName("一次解析报告多个独立的语法错误")
        void testMultipleErrors() {
            Program program = parse("let = 1;\nprint 1 +;\nlet ok = 2;");
            assertEquals(2, reporter.getErrorCount());
            assertEquals(1, reporter.getErrors().get(0).getLine());
            assertEquals(2, reporter.getErrors().get(1).getLine());
            assertEquals("Expect variable name.", reporter.getErrors().get(0).getMessage());
            assertEquals("Expect expression.", reporter.getErrors().get(1).getMessage());

            // 错误之后的语句仍被解析
            assertEquals(1, program.getStatements().size());
            assertEquals("ok", ((VarStmt) program.getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("非法赋值目标报告语义错误但不中断")
        void testInvalidAssignmentTarget() {
            parse("1 + 2 = 3;");
            assertEquals(1, reporter.getErrorCount());
            CompileError error = reporter.getErrors().get(0);
            assertEquals(CompileError.ErrorType.SEMANTIC, error.getType());
            assertEquals("Invalid assignment target.", error.getMessage());
        }

        @Test
        @DisplayName("不带括号的 print 同样限制实参个数")
        void testBarePrintArgumentLimit() {
            parse("print " + numberList(300) + ";");
            assertTrue(reporter.hasErrors());
            CompileError error = reporter.getErrors().get(0);
            assertEquals(CompileError.ErrorType.SEMANTIC, error.getType());
            assertEquals("Can't have more than 255 arguments.", error.getMessage());
        }

        @Test
        @DisplayName("恰好 255 个实参不报错")
        void testBarePrintArgumentLimitBoundary() {
            PrintStmt print = (PrintStmt) single("print " + numberList(255) + ";");
            assertEquals(255, print.getArguments().size());
        }

        @Test
        @DisplayName("调用与 print 报告相同的实参上限错误")
        void testCallArgumentLimit() {
            parse("f(" + numberList(300) + ");");
            assertTrue(reporter.hasErrors());
            assertEquals("Can't have more than 255 arguments.", reporter.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("缺少右括号")
        void testMissingParen() {
            parse("print (1 + 2;");
            assertTrue(reporter.hasErrors());
            assertEquals(CompileError.ErrorType.SYNTAX, reporter.getErrors().get(0).getType());
        }
    }

    private static String numberList(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append(", ");
            sb.append(i);
        }
        return sb.toString();
    }
}
