import com.txscript.script.TxScript;
import com.txscript.script.error.ErrorPhase;
import com.txscript.script.error.ScriptError;
import com.txscript.script.parser.Expr;
import com.txscript.script.parser.ParseResult;
import com.txscript.script.parser.Program;
import com.txscript.script.parser.Statement;
import com.txscript.script.parser.Token;
import com.txscript.script.runtime.Builtins;
import com.txscript.script.runtime.Environment;
import com.txscript.script.runtime.Interpreter;
import com.txscript.script.runtime.Value;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class TxScriptParserTest {

    private final TxScript engine = new TxScript();

    private ParseResult parse(String... lines) {
        return engine.parse(String.join("\n", lines));
    }

    private static Value evalDetached(Program program, Expr.ExprInterface expr) {
        Interpreter.Host host = new Interpreter.Host() {
            @Override
            public Value callFunction(Statement.FunctionDecl fn, List<Value> args, Token at) {
                throw new AssertionError("no calls expected");
            }

            @Override
            public Random random() {
                return new Random(1);
            }
        };
        Interpreter interpreter = new Interpreter(new Environment(), program, Builtins.standard(), host, 64);
        return interpreter.evaluate(expr, Environment.GLOBAL);
    }

    @Test
    void var_and_send_parse_cleanly_and_id_evaluates() {
        ParseResult r = parse("var x = 5; send(0x100, x)");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        List<Statement.Stmt> stmts = r.program().statements();
        assertEquals(2, stmts.size());
        assertTrue(stmts.get(0) instanceof Statement.VarDecl);
        Statement.Send send = (Statement.Send) stmts.get(1);
        assertNull(send.extended);
        assertEquals(256L, evalDetached(r.program(), send.id).asInt());
    }

    @Test
    void precedence_follows_c_rules() {
        ParseResult r = parse("var a = 1 + 2 * 3 << 1 | 1");

        assertFalse(r.hasErrors());
        Statement.VarDecl decl = (Statement.VarDecl) r.program().statements().get(0);
        // ((1 + (2 * 3)) << 1) | 1 = 15
        assertEquals(15L, evalDetached(r.program(), decl.initializer).asInt());
    }

    @Test
    void ternary_and_logical_operators() {
        ParseResult r = parse("var a = 1 < 2 && !(3 == 4) ? 0x10 : 0x20");

        Statement.VarDecl decl = (Statement.VarDecl) r.program().statements().get(0);
        assertTrue(decl.initializer instanceof Expr.Ternary);
        assertEquals(0x10L, evalDetached(r.program(), decl.initializer).asInt());
    }

    @Test
    void compound_statements_need_no_terminator() {
        ParseResult r = parse("var x = 0", "loop { if (x > 10) { break } x = x + 1 }");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        Statement.Loop loop = (Statement.Loop) r.program().statements().get(1);
        assertEquals(2, loop.body.statements.size());
    }

    @Test
    void simple_statements_need_a_terminator() {
        ParseResult r = parse("var x = 1 var y = 2");

        assertTrue(r.hasErrors());
        assertEquals(ErrorPhase.PARSE, r.errors().get(0).getPhase());
        assertEquals("Expect newline or ';' after statement.", r.errors().get(0).getMessage());
    }

    @Test
    void else_binds_to_nearest_if_and_chains() {
        ParseResult r = parse(
                "if (a) {",
                "  print 1",
                "} else if (b) {",
                "  print 2",
                "}",
                "else {",
                "  print 3",
                "}");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        assertEquals(1, r.program().statements().size());
        Statement.If outer = (Statement.If) r.program().statements().get(0);
        Statement.If inner = (Statement.If) outer.elseBranch;
        assertNotNull(inner.elseBranch);
    }

    @Test
    void single_statement_if_branch_with_else_on_same_line() {
        ParseResult r = parse("if (x > 1) print \"big\" else print \"small\"");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        Statement.If stmt = (Statement.If) r.program().statements().get(0);
        assertTrue(stmt.thenBranch instanceof Statement.Print);
        assertTrue(stmt.elseBranch instanceof Statement.Print);
    }

    @Test
    void wait_for_requires_timeout_clause() {
        ParseResult missing = parse("wait_for(id == 0x7E8)");
        assertTrue(missing.hasErrors());
        assertTrue(missing.errors().get(0).getMessage().contains("timeout"));

        ParseResult ok = parse("wait_for(id == 0x7E8) timeout(500) { print \"none\" }");
        assertFalse(ok.hasErrors(), () -> ok.errors().toString());
        Statement.WaitFor w = (Statement.WaitFor) ok.program().statements().get(0);
        assertNotNull(w.fallback);
    }

    @Test
    void send_accepts_bare_ext_or_flag_expression() {
        ParseResult r = parse("send(0x18DAF110, [0x02, 0x10, 0x03], ext)", "send(0x100, 1, false)");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        Statement.Send first = (Statement.Send) r.program().statements().get(0);
        assertEquals(Boolean.TRUE, ((Expr.Literal) first.extended).value);
        Statement.Send second = (Statement.Send) r.program().statements().get(1);
        assertNotNull(second.extended);
    }

    @Test
    void newlines_inside_parens_and_brackets_are_ignored() {
        ParseResult r = parse(
                "send(0x7DF,",
                "     [0x02,",
                "      0x01, 0x0C])");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        assertEquals(1, r.program().statements().size());
    }

    @Test
    void declarations_are_hoisted_out_of_the_main_sequence() {
        ParseResult r = parse(
                "function add(a, b) { return a + b }",
                "on_receive(id == 0x7E8) { print id }",
                "on_interval(100) { send(0x100, 1) }",
                "print add(1, 2)");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        Program p = r.program();
        assertEquals(1, p.statements().size());
        assertEquals(2, p.function("add").arity());
        assertEquals(1, p.receiveHandlers().size());
        assertEquals(1, p.intervalHandlers().size());
        assertTrue(p.hasHandlers());
    }

    @Test
    void handlers_and_functions_are_top_level_only() {
        ParseResult r = parse(
                "repeat(2) {",
                "  on_receive(id == 1) { print 1 }",
                "}",
                "function outer() {",
                "  function inner() { return 1 }",
                "}");

        assertEquals(2, r.errors().size(), () -> r.errors().toString());
        for (ScriptError e : r.errors()) {
            assertTrue(e.getMessage().contains("only allowed at top level"));
        }
        assertNull(r.program().function("inner"));
        assertNotNull(r.program().function("outer"));
    }

    @Test
    void break_outside_loop_is_rejected_including_in_function_bodies() {
        ParseResult r = parse(
                "break",
                "loop { function f() { continue } }");

        List<ScriptError> errors = r.errors();
        assertTrue(errors.stream().anyMatch(e -> e.getMessage().contains("'break' used outside of a loop")));
        assertTrue(errors.stream().anyMatch(e -> e.getMessage().contains("'continue' used outside of a loop")));
    }

    @Test
    void duplicate_function_and_builtin_shadowing() {
        ParseResult r = parse(
                "function f() { return 1 }",
                "function f() { return 2 }",
                "function hex(v) { return v }",
                "function now() { return 0 }");

        assertEquals(3, r.errors().size(), () -> r.errors().toString());
        assertEquals(2, r.errors().get(0).getLine());
        assertTrue(r.errors().get(0).getMessage().contains("already declared"));
        assertTrue(r.errors().get(1).getMessage().contains("shadows a builtin"));
        assertTrue(r.errors().get(2).getMessage().contains("shadows a builtin"));
    }

    @Test
    void recovers_after_errors_and_reports_every_one() {
        ParseResult r = parse(
                "send(0x100 [1])",
                "var = 3",
                "delay(100)",
                "x + = 2");

        assertEquals(3, r.errors().size(), () -> r.errors().toString());
        assertEquals(1, r.errors().get(0).getLine());
        assertEquals(2, r.errors().get(1).getLine());
        assertEquals(4, r.errors().get(2).getLine());
        assertTrue(r.program().statements().stream().anyMatch(s -> s instanceof Statement.Delay));
    }

    @Test
    void lex_errors_are_merged_without_duplicate_parse_errors() {
        ParseResult r = parse("print \"abc");

        assertEquals(1, r.errors().size(), () -> r.errors().toString());
        assertEquals(ErrorPhase.LEX, r.errors().get(0).getPhase());
    }

    @Test
    void invalid_assignment_target() {
        ParseResult r = parse("1 + 2 = 3", "b[0] = 1");

        assertEquals(1, r.errors().size(), () -> r.errors().toString());
        assertEquals("Invalid assignment target.", r.errors().get(0).getMessage());
        assertTrue(r.program().statements().get(0) instanceof Statement.IndexAssign);
    }

    @Test
    void member_access_accepts_keyword_field_names() {
        ParseResult r = parse("var d = response.data", "var e = response.ext", "var l = d.length");

        assertFalse(r.hasErrors(), () -> r.errors().toString());
        Statement.VarDecl decl = (Statement.VarDecl) r.program().statements().get(0);
        assertEquals("data", ((Expr.Member) decl.initializer).name.text);
    }

    @Test
    void unclosed_block_reports_end_of_input() {
        ParseResult r = parse("repeat(3) {", "  send(0x1, 1)");

        assertTrue(r.hasErrors());
        ScriptError last = r.errors().get(r.errors().size() - 1);
        assertTrue(last.getMessage().endsWith("at end of input"), last::getMessage);
    }
}
