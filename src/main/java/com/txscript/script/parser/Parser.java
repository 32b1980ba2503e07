package com.txscript.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.txscript.script.error.ScriptError;
import com.txscript.script.parser.Expr.Binary;
import com.txscript.script.parser.Expr.ByteArray;
import com.txscript.script.parser.Expr.Call;
import com.txscript.script.parser.Expr.Identifier;
import com.txscript.script.parser.Expr.Index;
import com.txscript.script.parser.Expr.Literal;
import com.txscript.script.parser.Expr.Logical;
import com.txscript.script.parser.Expr.Member;
import com.txscript.script.parser.Expr.RandomBytesCall;
import com.txscript.script.parser.Expr.RandomCall;
import com.txscript.script.parser.Expr.Ternary;
import com.txscript.script.parser.Expr.Unary;
import com.txscript.script.parser.Statement.Block;
import com.txscript.script.parser.Statement.FunctionDecl;
import com.txscript.script.parser.Statement.OnInterval;
import com.txscript.script.parser.Statement.OnReceive;
import com.txscript.script.parser.Statement.Stmt;

/**
 * Recursive descent parser with one token of lookahead.
 *
 * Errors never abort the pass: each one is recorded as a PARSE diagnostic and the parser
 * resynchronizes at the next newline, ';', '}' or statement keyword. ERROR tokens coming
 * from the lexer already carry a LEX diagnostic and are skipped silently.
 *
 * Newlines separate statements, except inside parentheses and brackets where they are ignored.
 */
public class Parser {

    private static final Set<TokenType> STATEMENT_KEYWORDS = EnumSet.of(
            TokenType.VAR, TokenType.SEND, TokenType.DELAY, TokenType.REPEAT,
            TokenType.LOOP, TokenType.IF, TokenType.WAIT_FOR, TokenType.FUNCTION,
            TokenType.RETURN, TokenType.ON_RECEIVE, TokenType.ON_INTERVAL,
            TokenType.BREAK, TokenType.CONTINUE, TokenType.PRINT);

    private final List<Token> tokens;
    private final Set<String> builtinNames;
    private final List<ScriptError> errors = new ArrayList<>();

    private final Map<String, FunctionDecl> functions = new LinkedHashMap<>();
    private final List<OnReceive> receiveHandlers = new ArrayList<>();
    private final List<OnInterval> intervalHandlers = new ArrayList<>();

    private int current = 0;
    private int nesting = 0;   // open '(' and '['
    private int loopDepth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, Collections.emptySet());
    }

    /**
     * @param builtinNames names user functions may not take
     */
    public Parser(List<Token> tokens, Set<String> builtinNames) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
        this.tokens = tokens;
        this.builtinNames = Set.copyOf(builtinNames);
    }

    public ParseResult parse() {
        List<Stmt> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd()) {
            int before = current;
            try {
                Stmt stmt = topLevel();
                if (stmt != null) statements.add(stmt);
            } catch (ParseException e) {
                synchronize(before);
            }
            skipSeparators();
        }
        int totalLines = tokens.get(tokens.size() - 1).line;
        Program program = new Program(functions, receiveHandlers, intervalHandlers, statements, totalLines);
        return new ParseResult(program, errors);
    }

    // -------------------------
    // Declarations
    // -------------------------

    /** Returns null for declarations, which are collected into the program instead of the main sequence. */
    private Stmt topLevel() {
        nesting = 0;
        if (match(TokenType.FUNCTION)) {
            FunctionDecl fn = functionDeclaration();
            register(fn);
            return null;
        }
        if (match(TokenType.ON_RECEIVE)) {
            receiveHandlers.add(onReceive());
            return null;
        }
        if (match(TokenType.ON_INTERVAL)) {
            intervalHandlers.add(onInterval());
            return null;
        }
        return statement();
    }

    private void register(FunctionDecl fn) {
        String name = fn.name.text;
        if (builtinNames.contains(name)) {
            report(fn.name, "Function '" + name + "' shadows a builtin.");
        } else if (functions.containsKey(name)) {
            report(fn.name, "Function '" + name + "' is already declared.");
        } else {
            functions.put(name, fn);
        }
    }

    private FunctionDecl functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        open(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token param = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                if (!seen.add(param.text)) {
                    report(param, "Duplicate parameter '" + param.text + "'.");
                }
                params.add(param);
            } while (match(TokenType.COMMA));
        }
        close(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        return new FunctionDecl(name, params, bodyOutsideLoop());
    }

    private OnReceive onReceive() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'on_receive'.");
        Expr.ExprInterface predicate = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after receive predicate.");
        return new OnReceive(keyword, predicate, bodyOutsideLoop());
    }

    private OnInterval onInterval() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'on_interval'.");
        Expr.ExprInterface period = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after interval period.");
        return new OnInterval(keyword, period, bodyOutsideLoop());
    }

    /** break/continue inside a function or handler body never reach an enclosing loop. */
    private Block bodyOutsideLoop() {
        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        try {
            skipNewlines();
            return block();
        } finally {
            loopDepth = savedLoopDepth;
        }
    }

    /** A declaration found below top level: reported, parsed for recovery, never registered. */
    private Stmt nestedDeclaration(Token keyword) {
        report(keyword, "'" + keyword.text + "' is only allowed at top level.");
        switch (keyword.type) {
            case FUNCTION: return functionDeclaration();
            case ON_RECEIVE: return onReceive();
            default: return onInterval();
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        nesting = 0;
        if (check(TokenType.ERROR)) throw error(peek(), "");

        if (match(TokenType.VAR)) return varDeclaration();
        if (match(TokenType.SEND)) return sendStatement();
        if (match(TokenType.DELAY)) return delayStatement();
        if (match(TokenType.REPEAT)) return repeatStatement();
        if (match(TokenType.LOOP)) return loopStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WAIT_FOR)) return waitForStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.CONTINUE)) return continueStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.FUNCTION, TokenType.ON_RECEIVE, TokenType.ON_INTERVAL)) {
            return nestedDeclaration(previous());
        }
        if (check(TokenType.LEFT_BRACE)) return block();
        if (check(TokenType.RIGHT_BRACE)) throw error(peek(), "Unexpected '}'.");
        return expressionStatement();
    }

    private Block block() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' to start a block.");
        List<Stmt> statements = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            int before = current;
            try {
                statements.add(statement());
            } catch (ParseException e) {
                synchronize(before);
            }
            skipSeparators();
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return new Block(brace, statements);
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'var'.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        endStatement();
        return new Statement.VarDecl(name, initializer);
    }

    private Stmt sendStatement() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'send'.");
        Expr.ExprInterface id = expression();
        consume(TokenType.COMMA, "Expect ',' after frame id.");
        Expr.ExprInterface data = expression();
        Expr.ExprInterface extended = null;
        if (match(TokenType.COMMA)) {
            if (check(TokenType.EXT) && checkNext(TokenType.RIGHT_PAREN)) {
                extended = new Literal(advance(), Boolean.TRUE);
            } else {
                extended = expression();
            }
        }
        close(TokenType.RIGHT_PAREN, "Expect ')' after send arguments.");
        endStatement();
        return new Statement.Send(keyword, id, data, extended);
    }

    private Stmt delayStatement() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'delay'.");
        Expr.ExprInterface duration = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after delay duration.");
        endStatement();
        return new Statement.Delay(keyword, duration);
    }

    private Stmt repeatStatement() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'repeat'.");
        Expr.ExprInterface count = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after repeat count.");
        return new Statement.Repeat(keyword, count, loopBody());
    }

    private Stmt loopStatement() {
        Token keyword = previous();
        return new Statement.Loop(keyword, loopBody());
    }

    private Block loopBody() {
        loopDepth++;
        try {
            skipNewlines();
            return block();
        } finally {
            loopDepth--;
        }
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Stmt thenBranch = branch();

        Stmt elseBranch = null;
        if (checkAfterNewlines(TokenType.ELSE)) {
            skipNewlines();
            advance(); // else
            skipNewlines();
            if (match(TokenType.IF)) {
                elseBranch = ifStatement();
            } else {
                elseBranch = branch();
            }
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt branch() {
        skipNewlines();
        if (check(TokenType.LEFT_BRACE)) return block();
        return statement();
    }

    private Stmt waitForStatement() {
        Token keyword = previous();
        open(TokenType.LEFT_PAREN, "Expect '(' after 'wait_for'.");
        Expr.ExprInterface predicate = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after wait_for predicate.");

        consume(TokenType.TIMEOUT, "Expect 'timeout(ms)' after wait_for predicate.");
        open(TokenType.LEFT_PAREN, "Expect '(' after 'timeout'.");
        Expr.ExprInterface timeout = expression();
        close(TokenType.RIGHT_PAREN, "Expect ')' after timeout.");

        Block fallback = null;
        if (check(TokenType.LEFT_BRACE)) {
            fallback = block();
        } else {
            endStatement();
        }
        return new Statement.WaitFor(keyword, predicate, timeout, fallback);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!atStatementEnd()) {
            value = expression();
        }
        endStatement();
        return new Statement.Return(keyword, value);
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        endStatement();
        return new Statement.Break(keyword);
    }

    private Stmt continueStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'continue' used outside of a loop.");
        }
        endStatement();
        return new Statement.Continue(keyword);
    }

    private Stmt printStatement() {
        Token keyword = previous();
        List<Expr.ExprInterface> values = new ArrayList<>();
        if (check(TokenType.LEFT_PAREN)) {
            open(TokenType.LEFT_PAREN, "Expect '(' after 'print'.");
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    values.add(expression());
                } while (match(TokenType.COMMA));
            }
            close(TokenType.RIGHT_PAREN, "Expect ')' after print arguments.");
        } else {
            values.add(expression());
        }
        endStatement();
        return new Statement.Print(keyword, values);
    }

    private Stmt expressionStatement() {
        Expr.ExprInterface expr = expression();

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = expression();
            Stmt stmt;
            if (expr instanceof Identifier) {
                stmt = new Statement.Assign(((Identifier) expr).name, value);
            } else if (expr instanceof Index && ((Index) expr).target instanceof Identifier) {
                Index target = (Index) expr;
                stmt = new Statement.IndexAssign(((Identifier) target.target).name, target.index, value);
            } else {
                throw error(equals, "Invalid assignment target.");
            }
            endStatement();
            return stmt;
        }

        endStatement();
        return new Statement.ExprStmt(expr);
    }

    private boolean atStatementEnd() {
        if (isAtEnd()) return true;
        TokenType t = peek().type;
        return t == TokenType.NEWLINE || t == TokenType.SEMICOLON || t == TokenType.RIGHT_BRACE;
    }

    /** Simple statements end at a newline, ';', '}' or EOF. 'else' is allowed for single-statement if branches. */
    private void endStatement() {
        if (atStatementEnd() || check(TokenType.ELSE)) return;
        throw error(peek(), "Expect newline or ';' after statement.");
    }

    // -------------------------
    // Expressions, lowest precedence first
    // -------------------------

    private Expr.ExprInterface expression() {
        return ternary();
    }

    private Expr.ExprInterface ternary() {
        Expr.ExprInterface condition = or();
        if (match(TokenType.QUESTION)) {
            Token question = previous();
            Expr.ExprInterface thenExpr = expression();
            consume(TokenType.COLON, "Expect ':' in conditional expression.");
            Expr.ExprInterface elseExpr = ternary();
            return new Ternary(condition, question, thenExpr, elseExpr);
        }
        return condition;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token operator = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = bitOr();
        while (match(TokenType.AND_AND)) {
            Token operator = previous();
            Expr.ExprInterface right = bitOr();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface bitOr() {
        Expr.ExprInterface expr = bitXor();
        while (match(TokenType.PIPE)) {
            Token operator = previous();
            expr = new Binary(expr, operator, bitXor());
        }
        return expr;
    }

    private Expr.ExprInterface bitXor() {
        Expr.ExprInterface expr = bitAnd();
        while (match(TokenType.CARET)) {
            Token operator = previous();
            expr = new Binary(expr, operator, bitAnd());
        }
        return expr;
    }

    private Expr.ExprInterface bitAnd() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AMPERSAND)) {
            Token operator = previous();
            expr = new Binary(expr, operator, equality());
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token operator = previous();
            expr = new Binary(expr, operator, comparison());
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = shift();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = previous();
            expr = new Binary(expr, operator, shift());
        }
        return expr;
    }

    private Expr.ExprInterface shift() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.SHL, TokenType.SHR)) {
            Token operator = previous();
            expr = new Binary(expr, operator, term());
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            expr = new Binary(expr, operator, factor());
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token operator = previous();
            expr = new Binary(expr, operator, unary());
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.TILDE)) {
            Token operator = previous();
            return new Unary(operator, unary());
        }
        return postfix();
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = primary();
        while (true) {
            if (check(TokenType.LEFT_PAREN)) {
                Token paren = open(TokenType.LEFT_PAREN, "Expect '('.");
                List<Expr.ExprInterface> args = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        args.add(expression());
                    } while (match(TokenType.COMMA));
                }
                close(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
                expr = new Call(expr, paren, args);
            } else if (check(TokenType.LEFT_BRACKET)) {
                Token bracket = open(TokenType.LEFT_BRACKET, "Expect '['.");
                Expr.ExprInterface index = expression();
                close(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new Index(expr, bracket, index);
            } else if (match(TokenType.DOT)) {
                if (!match(TokenType.IDENTIFIER, TokenType.DATA, TokenType.EXT)) {
                    throw error(peek(), "Expect member name after '.'.");
                }
                expr = new Member(expr, previous());
            } else {
                return expr;
            }
        }
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.NUMBER, TokenType.HEX_NUMBER, TokenType.FLOAT_NUMBER, TokenType.STRING)) {
            Token token = previous();
            return new Literal(token, token.literal);
        }
        if (match(TokenType.TRUE)) return new Literal(previous(), Boolean.TRUE);
        if (match(TokenType.FALSE)) return new Literal(previous(), Boolean.FALSE);

        // 'data' and 'ext' are keywords only inside send(...); elsewhere they name frame fields.
        if (match(TokenType.IDENTIFIER, TokenType.DATA, TokenType.EXT)) {
            return new Identifier(previous());
        }

        if (check(TokenType.LEFT_PAREN)) {
            open(TokenType.LEFT_PAREN, "Expect '('.");
            Expr.ExprInterface expr = expression();
            close(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (check(TokenType.LEFT_BRACKET)) {
            Token bracket = open(TokenType.LEFT_BRACKET, "Expect '['.");
            List<Expr.ExprInterface> elements = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
                elements.add(expression());
                if (!match(TokenType.COMMA)) break;
            }
            close(TokenType.RIGHT_BRACKET, "Expect ']' after byte array elements.");
            return new ByteArray(bracket, elements);
        }

        if (match(TokenType.RANDOM)) {
            Token keyword = previous();
            open(TokenType.LEFT_PAREN, "Expect '(' after 'random'.");
            Expr.ExprInterface min = expression();
            consume(TokenType.COMMA, "Expect ',' between random bounds.");
            Expr.ExprInterface max = expression();
            close(TokenType.RIGHT_PAREN, "Expect ')' after random bounds.");
            return new RandomCall(keyword, min, max);
        }

        if (match(TokenType.RANDOM_BYTES)) {
            Token keyword = previous();
            open(TokenType.LEFT_PAREN, "Expect '(' after 'random_bytes'.");
            Expr.ExprInterface length = expression();
            close(TokenType.RIGHT_PAREN, "Expect ')' after random_bytes length.");
            return new RandomBytesCall(keyword, length);
        }

        throw error(peek(), "Expect expression.");
    }

    // -------------------------
    // Token plumbing
    // -------------------------

    private Token open(TokenType type, String message) {
        Token token = consume(type, message);
        nesting++;
        return token;
    }

    private void close(TokenType type, String message) {
        consume(type, message);
        nesting--;
    }

    private void skipNewlines() {
        while (tokens.get(current).type == TokenType.NEWLINE) current++;
    }

    private void skipSeparators() {
        while (tokens.get(current).type == TokenType.NEWLINE || tokens.get(current).type == TokenType.SEMICOLON) {
            current++;
        }
    }

    private void synchronize(int before) {
        nesting = 0;
        if (current == before && !isAtEnd()) advance();
        while (!isAtEnd()) {
            TokenType t = tokens.get(current).type;
            if (t == TokenType.NEWLINE || t == TokenType.SEMICOLON || t == TokenType.RIGHT_BRACE) return;
            if (STATEMENT_KEYWORDS.contains(t)) return;
            current++;
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        int i = current + 1;
        while (nesting > 0 && i < tokens.size() && tokens.get(i).type == TokenType.NEWLINE) i++;
        return i < tokens.size() && tokens.get(i).type == type;
    }

    private boolean checkAfterNewlines(TokenType type) {
        int i = current;
        while (tokens.get(i).type == TokenType.NEWLINE) i++;
        return tokens.get(i).type == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }

    private Token peek() {
        if (nesting > 0) {
            while (tokens.get(current).type == TokenType.NEWLINE) current++;
        }
        return tokens.get(current);
    }

    private Token previous() { return tokens.get(current - 1); }

    private void report(Token token, String message) {
        errors.add(ScriptError.parse(token.line, token.column, message));
    }

    private ParseException error(Token token, String message) {
        if (token.type != TokenType.ERROR) {
            String where = (token.type == TokenType.EOF) ? " at end of input" : "";
            report(token, message + where);
        }
        return new ParseException(message);
    }

    private static final class ParseException extends RuntimeException {
        ParseException(String message) {
            super(message, null, false, false);
        }
    }
}
