package com.tinylang.compiler.parser;

import com.tinylang.bytecode.Value;
import com.tinylang.compiler.ast.Program;
import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.*;
import com.tinylang.compiler.ast.stmt.*;
import com.tinylang.compiler.diagnostic.CompileError;
import com.tinylang.compiler.diagnostic.ErrorReporter;
import com.tinylang.compiler.lexer.Token;
import com.tinylang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.tinylang.compiler.lexer.TokenType.*;

/**
 * TinyLang 语法分析器（递归下降）
 *
 * 语法错误在语句边界处恢复：记录错误后跳到下一个 ';' 或语句起始关键词继续解析，
 * 一次运行尽可能报告多个独立错误。
 */
public class Parser {

    /** 参数与实参个数上限（CALL 的 1 字节操作数） */
    public static final int MAX_ARGUMENTS = 255;

    private final List<Token> tokens;
    private final ErrorReporter reporter;
    private final String fileName;
    private int pos = 0;

    public Parser(List<Token> tokens, ErrorReporter reporter) {
        // ERROR token 已由词法分析器报告，这里直接丢弃
        this.tokens = new ArrayList<>();
        for (Token t : tokens) {
            if (t.getType() != ERROR) {
                this.tokens.add(t);
            }
        }
        this.reporter = reporter;
        this.fileName = reporter.getFileName();
    }

    /**
     * 解析整个程序。出错时返回已成功解析的语句，错误记入 reporter。
     */
    public Program parse() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            Statement stmt = declaration();
            if (stmt != null) {
                statements.add(stmt);
            }
        }
        return new Program(fileName, statements);
    }

    // ============ 基础方法 ============

    private Token current() {
        return tokens.get(pos);
    }

    private Token previous() {
        return tokens.get(pos - 1);
    }

    private Token advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private boolean check(TokenType type) {
        return current().getType() == type;
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current());
    }

    /** 语句结尾的 ';'，在 '}' 之前或输入末尾处可省略 */
    private void expectTerminator(String message) {
        if (match(SEMICOLON) || atImplicitTerminator()) return;
        throw new ParseException(message, current());
    }

    private boolean isAtEnd() {
        return check(EOF);
    }

    private boolean atImplicitTerminator() {
        return check(RBRACE) || isAtEnd();
    }

    private SourceLocation location(Token token) {
        return token.getLocation(fileName);
    }

    private void semanticError(String message, Token token) {
        reporter.report(CompileError.ErrorType.SEMANTIC, message, location(token));
    }

    /**
     * 错误恢复：跳过触发错误的 token，停在语句边界。
     */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            if (previous().getType() == SEMICOLON) return;
            switch (current().getType()) {
                case KW_LET:
                case KW_VAR:
                case KW_FN:
                case KW_IF:
                case KW_WHILE:
                case KW_FOR:
                case KW_RETURN:
                case KW_PRINT:
                case KW_BREAK:
                case KW_CONTINUE:
                case RBRACE:
                    return;
                default:
                    advance();
            }
        }
    }

    // ============ 声明 ============

    private Statement declaration() {
        try {
            if (check(KW_FN) && checkNext(IDENTIFIER)) {
                advance();
                return functionDeclaration();
            }
            if (matchAny(KW_LET, KW_VAR)) {
                return varDeclaration();
            }
            return statement();
        } catch (ParseException e) {
            reporter.report(CompileError.ErrorType.SYNTAX, e.getRawMessage(), location(e.getToken()));
            synchronize();
            return null;
        }
    }

    private Statement functionDeclaration() {
        Token keyword = previous();
        String name = expect(IDENTIFIER, "Expect function name.").getLexeme();
        expect(LPAREN, "Expect '(' after function name.");
        List<String> params = parameters();
        expect(LBRACE, "Expect '{' before function body.");
        List<Statement> body = blockBody();
        return new FunctionStmt(location(keyword), name, params, body);
    }

    /** '(' 之后的形参列表，消费结尾的 ')' */
    private List<String> parameters() {
        List<String> params = new ArrayList<>();
        if (!check(RPAREN)) {
            do {
                if (params.size() >= MAX_ARGUMENTS) {
                    semanticError("Can't have more than " + MAX_ARGUMENTS + " parameters.", current());
                }
                params.add(expect(IDENTIFIER, "Expect parameter name.").getLexeme());
            } while (match(COMMA));
        }
        expect(RPAREN, "Expect ')' after parameters.");
        return params;
    }

    private Statement varDeclaration() {
        Token keyword = previous();
        boolean mutable = keyword.getType() == KW_VAR;
        Token name = expect(IDENTIFIER, "Expect variable name.");
        Expression initializer = null;
        if (match(ASSIGN)) {
            initializer = expression();
        }
        expectTerminator("Expect ';' after variable declaration.");
        return new VarStmt(location(name), name.getLexeme(), mutable, initializer);
    }

    // ============ 语句 ============

    private Statement statement() {
        if (match(KW_PRINT)) return printStatement();
        if (match(KW_IF)) return ifStatement();
        if (match(KW_WHILE)) return whileStatement();
        if (match(KW_FOR)) return forStatement();
        if (match(KW_RETURN)) return returnStatement();
        if (match(KW_BREAK)) {
            Token keyword = previous();
            expectTerminator("Expect ';' after 'break'.");
            return new BreakStmt(location(keyword));
        }
        if (match(KW_CONTINUE)) {
            Token keyword = previous();
            expectTerminator("Expect ';' after 'continue'.");
            return new ContinueStmt(location(keyword));
        }
        if (match(LBRACE)) {
            Token brace = previous();
            return new BlockStmt(location(brace), blockBody());
        }
        return expressionStatement();
    }

    /**
     * print a, b;  print(a, b);  print (a + b) * c;
     * 括号形式先按实参列表尝试，后面不是语句结尾时回退为普通表达式。
     */
    private Statement printStatement() {
        Token keyword = previous();
        if (check(LPAREN)) {
            List<Expression> args = tryArgumentList();
            if (args != null) {
                expectTerminator("Expect ';' after value.");
                return new PrintStmt(location(keyword), args);
            }
        }
        List<Expression> args = new ArrayList<>();
        if (!check(SEMICOLON) && !atImplicitTerminator()) {
            do {
                if (args.size() >= MAX_ARGUMENTS) {
                    semanticError("Can't have more than " + MAX_ARGUMENTS + " arguments.", current());
                }
                args.add(expression());
            } while (match(COMMA));
        }
        expectTerminator("Expect ';' after value.");
        return new PrintStmt(location(keyword), args);
    }

    /**
     * 把 '(' 开始的部分当作实参列表解析；其后不是语句结尾或解析失败时回退。
     *
     * @return 实参列表，回退时返回 null
     */
    private List<Expression> tryArgumentList() {
        int mark = pos;
        try {
            advance();
            List<Expression> args = arguments();
            if (check(SEMICOLON) || atImplicitTerminator()) {
                return args;
            }
        } catch (ParseException e) {
            pos = mark;
            return null;
        }
        pos = mark;
        return null;
    }

    private Statement ifStatement() {
        Token keyword = previous();
        expect(LPAREN, "Expect '(' after 'if'.");
        Expression condition = expression();
        expect(RPAREN, "Expect ')' after if condition.");
        Statement thenBranch = statement();
        Statement elseBranch = null;
        if (match(KW_ELSE)) {
            elseBranch = statement();
        }
        return new IfStmt(location(keyword), condition, thenBranch, elseBranch);
    }

    private Statement whileStatement() {
        Token keyword = previous();
        expect(LPAREN, "Expect '(' after 'while'.");
        Expression condition = expression();
        expect(RPAREN, "Expect ')' after condition.");
        Statement body = statement();
        return new WhileStmt(location(keyword), condition, body);
    }

    private Statement forStatement() {
        Token keyword = previous();
        expect(LPAREN, "Expect '(' after 'for'.");

        Statement initializer;
        if (match(SEMICOLON)) {
            initializer = null;
        } else if (matchAny(KW_LET, KW_VAR)) {
            initializer = varDeclaration();
        } else {
            initializer = expressionStatement();
        }

        Expression condition = null;
        if (!check(SEMICOLON)) {
            condition = expression();
        }
        expect(SEMICOLON, "Expect ';' after loop condition.");

        Expression increment = null;
        if (!check(RPAREN)) {
            increment = expression();
        }
        expect(RPAREN, "Expect ')' after for clauses.");

        Statement body = statement();
        return new ForStmt(location(keyword), initializer, condition, increment, body);
    }

    private Statement returnStatement() {
        Token keyword = previous();
        Expression value = null;
        if (!check(SEMICOLON) && !atImplicitTerminator()) {
            value = expression();
        }
        expectTerminator("Expect ';' after return value.");
        return new ReturnStmt(location(keyword), value);
    }

    /** '{' 之后的语句序列，消费结尾的 '}' */
    private List<Statement> blockBody() {
        List<Statement> statements = new ArrayList<>();
        while (!check(RBRACE) && !isAtEnd()) {
            Statement stmt = declaration();
            if (stmt != null) {
                statements.add(stmt);
            }
        }
        expect(RBRACE, "Expect '}' after block.");
        return statements;
    }

    private Statement expressionStatement() {
        Expression expr = expression();
        expectTerminator("Expect ';' after expression.");
        return new ExpressionStmt(expr.getLocation(), expr);
    }

    // ============ 表达式 ============

    private Expression expression() {
        return assignment();
    }

    private Expression assignment() {
        Expression expr = or();

        if (match(ASSIGN)) {
            Token equals = previous();
            Expression value = assignment();
            if (expr.getKind() == Expression.Kind.VARIABLE) {
                return new Assign(expr.getLocation(), ((Variable) expr).getName(), value);
            }
            // 不抛出：右侧已完整解析，语句可以继续
            semanticError("Invalid assignment target.", equals);
        }
        return expr;
    }

    private Expression or() {
        Expression expr = and();
        while (match(OR)) {
            Token op = previous();
            Expression right = and();
            expr = new Logical(location(op), expr, false, right);
        }
        return expr;
    }

    private Expression and() {
        Expression expr = equality();
        while (match(AND)) {
            Token op = previous();
            Expression right = equality();
            expr = new Logical(location(op), expr, true, right);
        }
        return expr;
    }

    private Expression equality() {
        Expression expr = comparison();
        while (matchAny(EQ, NE)) {
            Token op = previous();
            Expression right = comparison();
            expr = new Binary(location(op), expr, binaryOp(op), right);
        }
        return expr;
    }

    private Expression comparison() {
        Expression expr = term();
        while (matchAny(LT, LE, GT, GE)) {
            Token op = previous();
            Expression right = term();
            expr = new Binary(location(op), expr, binaryOp(op), right);
        }
        return expr;
    }

    private Expression term() {
        Expression expr = factor();
        while (matchAny(PLUS, MINUS)) {
            Token op = previous();
            Expression right = factor();
            expr = new Binary(location(op), expr, binaryOp(op), right);
        }
        return expr;
    }

    private Expression factor() {
        Expression expr = unary();
        while (matchAny(MUL, DIV, MOD)) {
            Token op = previous();
            Expression right = unary();
            expr = new Binary(location(op), expr, binaryOp(op), right);
        }
        return expr;
    }

    private Expression unary() {
        if (matchAny(NOT, MINUS)) {
            Token op = previous();
            Expression operand = unary();
            Unary.UnaryOp unaryOp = op.getType() == NOT ? Unary.UnaryOp.NOT : Unary.UnaryOp.NEG;
            return new Unary(location(op), unaryOp, operand);
        }
        return call();
    }

    private Expression call() {
        Expression expr = primary();
        while (match(LPAREN)) {
            Token paren = previous();
            List<Expression> args = arguments();
            expr = new Call(location(paren), expr, args);
        }
        return expr;
    }

    /** '(' 之后的实参列表，消费结尾的 ')' */
    private List<Expression> arguments() {
        List<Expression> args = new ArrayList<>();
        if (!check(RPAREN)) {
            do {
                if (args.size() >= MAX_ARGUMENTS) {
                    semanticError("Can't have more than " + MAX_ARGUMENTS + " arguments.", current());
                }
                args.add(expression());
            } while (match(COMMA));
        }
        expect(RPAREN, "Expect ')' after arguments.");
        return args;
    }

    private Expression primary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER_LITERAL:
                advance();
                return new Literal(location(token), Value.number((Double) token.getLiteral()));
            case STRING_LITERAL:
                advance();
                return new Literal(location(token), Value.string((String) token.getLiteral()));
            case KW_TRUE:
                advance();
                return new Literal(location(token), Value.TRUE);
            case KW_FALSE:
                advance();
                return new Literal(location(token), Value.FALSE);
            case KW_NIL:
                advance();
                return new Literal(location(token), Value.NIL);
            case IDENTIFIER:
                advance();
                return new Variable(location(token), token.getLexeme());
            case KW_PRINT:
                // 表达式位置的 print(...) 是对内置函数的普通调用
                if (checkNext(LPAREN)) {
                    advance();
                    return new Variable(location(token), "print");
                }
                break;
            case KW_FN: {
                advance();
                expect(LPAREN, "Expect '(' after 'fn'.");
                List<String> params = parameters();
                expect(LBRACE, "Expect '{' before function body.");
                List<Statement> body = blockBody();
                return new FunctionExpr(location(token), params, body);
            }
            case LPAREN: {
                advance();
                Expression expr = expression();
                expect(RPAREN, "Expect ')' after expression.");
                return expr;
            }
            default:
                break;
        }
        throw new ParseException("Expect expression.", token);
    }

    private static Binary.BinaryOp binaryOp(Token op) {
        switch (op.getType()) {
            case PLUS: return Binary.BinaryOp.ADD;
            case MINUS: return Binary.BinaryOp.SUB;
            case MUL: return Binary.BinaryOp.MUL;
            case DIV: return Binary.BinaryOp.DIV;
            case MOD: return Binary.BinaryOp.MOD;
            case EQ: return Binary.BinaryOp.EQ;
            case NE: return Binary.BinaryOp.NE;
            case LT: return Binary.BinaryOp.LT;
            case LE: return Binary.BinaryOp.LE;
            case GT: return Binary.BinaryOp.GT;
            case GE: return Binary.BinaryOp.GE;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + op.getType());
        }
    }
}
