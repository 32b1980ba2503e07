package com.txscript.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** First token of the statement; RUNTIME errors are reported here unless a sub-expression is more precise. */
        Token position();
    }

    public interface StmtVisitor {
        void visitVarDecl(VarDecl stmt);
        void visitAssign(Assign stmt);
        void visitIndexAssign(IndexAssign stmt);
        void visitSend(Send stmt);
        void visitDelay(Delay stmt);
        void visitRepeat(Repeat stmt);
        void visitLoop(Loop stmt);
        void visitIf(If stmt);
        void visitWaitFor(WaitFor stmt);
        void visitFunctionDecl(FunctionDecl stmt);
        void visitReturn(Return stmt);
        void visitBreak(Break stmt);
        void visitContinue(Continue stmt);
        void visitPrint(Print stmt);
        void visitExprStmt(ExprStmt stmt);
        void visitBlock(Block stmt);
        void visitOnReceive(OnReceive stmt);
        void visitOnInterval(OnInterval stmt);
    }

    public static final class VarDecl implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;

        VarDecl(Token name, Expr.ExprInterface initializer) {
            this.name = name;
            this.initializer = initializer;
        }

        public void accept(StmtVisitor visitor) { visitor.visitVarDecl(this); }
        public Token position() { return name; }
    }

    public static final class Assign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;

        Assign(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssign(this); }
        public Token position() { return name; }
    }

    /** name[index] = value; replaces the binding with a modified copy of the byte array. */
    public static final class IndexAssign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface index;
        public final Expr.ExprInterface value;

        IndexAssign(Token name, Expr.ExprInterface index, Expr.ExprInterface value) {
            this.name = name;
            this.index = index;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitIndexAssign(this); }
        public Token position() { return name; }
    }

    /** send(id, data [, ext | , flag]); {@code extended} is null when no third argument was given. */
    public static final class Send implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface id;
        public final Expr.ExprInterface data;
        public final Expr.ExprInterface extended;

        Send(Token keyword, Expr.ExprInterface id, Expr.ExprInterface data, Expr.ExprInterface extended) {
            this.keyword = keyword;
            this.id = id;
            this.data = data;
            this.extended = extended;
        }

        public void accept(StmtVisitor visitor) { visitor.visitSend(this); }
        public Token position() { return keyword; }
    }

    public static final class Delay implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface duration;

        Delay(Token keyword, Expr.ExprInterface duration) {
            this.keyword = keyword;
            this.duration = duration;
        }

        public void accept(StmtVisitor visitor) { visitor.visitDelay(this); }
        public Token position() { return keyword; }
    }

    public static final class Repeat implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface count;
        public final Block body;

        Repeat(Token keyword, Expr.ExprInterface count, Block body) {
            this.keyword = keyword;
            this.count = count;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitRepeat(this); }
        public Token position() { return keyword; }
    }

    public static final class Loop implements Stmt {
        public final Token keyword;
        public final Block body;

        Loop(Token keyword, Block body) {
            this.keyword = keyword;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitLoop(this); }
        public Token position() { return keyword; }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;

        If(Token keyword, Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public void accept(StmtVisitor visitor) { visitor.visitIf(this); }
        public Token position() { return keyword; }
    }

    /** wait_for(predicate) timeout(ms) { fallback }; {@code fallback} may be null. */
    public static final class WaitFor implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface predicate;
        public final Expr.ExprInterface timeout;
        public final Block fallback;

        WaitFor(Token keyword, Expr.ExprInterface predicate, Expr.ExprInterface timeout, Block fallback) {
            this.keyword = keyword;
            this.predicate = predicate;
            this.timeout = timeout;
            this.fallback = fallback;
        }

        public void accept(StmtVisitor visitor) { visitor.visitWaitFor(this); }
        public Token position() { return keyword; }
    }

    public static final class FunctionDecl implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Block body;

        FunctionDecl(Token name, List<Token> params, Block body) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
        }

        public int arity() { return params.size(); }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionDecl(this); }
        public Token position() { return name; }
    }

    public static final class Return implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;

        Return(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturn(this); }
        public Token position() { return keyword; }
    }

    public static final class Break implements Stmt {
        public final Token keyword;

        Break(Token keyword) { this.keyword = keyword; }

        public void accept(StmtVisitor visitor) { visitor.visitBreak(this); }
        public Token position() { return keyword; }
    }

    public static final class Continue implements Stmt {
        public final Token keyword;

        Continue(Token keyword) { this.keyword = keyword; }

        public void accept(StmtVisitor visitor) { visitor.visitContinue(this); }
        public Token position() { return keyword; }
    }

    /** print expr, or print(a, b, ...) with the values concatenated. */
    public static final class Print implements Stmt {
        public final Token keyword;
        public final List<Expr.ExprInterface> values;

        Print(Token keyword, List<Expr.ExprInterface> values) {
            this.keyword = keyword;
            this.values = List.copyOf(values);
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrint(this); }
        public Token position() { return keyword; }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
        public Token position() { return expression.position(); }
    }

    public static final class Block implements Stmt {
        public final Token brace;
        public final List<Stmt> statements;

        Block(Token brace, List<Stmt> statements) {
            this.brace = brace;
            this.statements = List.copyOf(statements);
        }

        public void accept(StmtVisitor visitor) { visitor.visitBlock(this); }
        public Token position() { return brace; }
    }

    // -------------------------
    // Event handlers (top level only)
    // -------------------------

    public static final class OnReceive implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface predicate;
        public final Block body;

        OnReceive(Token keyword, Expr.ExprInterface predicate, Block body) {
            this.keyword = keyword;
            this.predicate = predicate;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitOnReceive(this); }
        public Token position() { return keyword; }
    }

    public static final class OnInterval implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface period;
        public final Block body;

        OnInterval(Token keyword, Expr.ExprInterface period, Block body) {
            this.keyword = keyword;
            this.period = period;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitOnInterval(this); }
        public Token position() { return keyword; }
    }
}
