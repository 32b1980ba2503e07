package com.txscript.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Token used to position diagnostics raised while evaluating this node. */
        Token position();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitByteArrayExpr(ByteArray expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitTernaryExpr(Ternary expr);
        R visitCallExpr(Call expr);
        R visitRandomExpr(RandomCall expr);
        R visitRandomBytesExpr(RandomBytesCall expr);
        R visitMemberExpr(Member expr);
        R visitIndexExpr(Index expr);
    }

    // -------------------------
    // Leaves
    // -------------------------

    /** int, hex, float, string or bool literal; value is a Long, Double, String or Boolean. */
    public static final class Literal implements ExprInterface {
        public final Token token;
        public final Object value;

        public Literal(Token token, Object value) {
            this.token = token;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public Token position() { return token; }
    }

    /** [0x02, 0x01, 0x0C] */
    public static final class ByteArray implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> elements;

        public ByteArray(Token bracket, List<ExprInterface> elements) {
            this.bracket = bracket;
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitByteArrayExpr(this);
        }

        @Override
        public Token position() { return bracket; }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        public String name() { return name.text; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public Token position() { return name; }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public Token position() { return operator; }
    }

    /** Short-circuit && and ||. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }

        @Override
        public Token position() { return operator; }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public Token position() { return operator; }
    }

    public static final class Ternary implements ExprInterface {
        public final ExprInterface condition;
        public final Token question;
        public final ExprInterface thenExpr;
        public final ExprInterface elseExpr;

        public Ternary(ExprInterface condition, Token question, ExprInterface thenExpr, ExprInterface elseExpr) {
            this.condition = condition;
            this.question = question;
            this.thenExpr = thenExpr;
            this.elseExpr = elseExpr;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTernaryExpr(this);
        }

        @Override
        public Token position() { return question; }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public Token position() { return callee.position(); }
    }

    /** random(min, max), both bounds inclusive. */
    public static final class RandomCall implements ExprInterface {
        public final Token keyword;
        public final ExprInterface min;
        public final ExprInterface max;

        public RandomCall(Token keyword, ExprInterface min, ExprInterface max) {
            this.keyword = keyword;
            this.min = min;
            this.max = max;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRandomExpr(this);
        }

        @Override
        public Token position() { return keyword; }
    }

    public static final class RandomBytesCall implements ExprInterface {
        public final Token keyword;
        public final ExprInterface length;

        public RandomBytesCall(Token keyword, ExprInterface length) {
            this.keyword = keyword;
            this.length = length;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRandomBytesExpr(this);
        }

        @Override
        public Token position() { return keyword; }
    }

    // -------------------------
    // Access
    // -------------------------

    /** response.id, frame.data, ... */
    public static final class Member implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public Member(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }

        @Override
        public Token position() { return name; }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final Token bracket;
        public final ExprInterface index;

        public Index(ExprInterface target, Token bracket, ExprInterface index) {
            this.target = target;
            this.bracket = bracket;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }

        @Override
        public Token position() { return bracket; }
    }
}
