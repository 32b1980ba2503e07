import com.txscript.script.error.ErrorPhase;
import com.txscript.script.parser.LexResult;
import com.txscript.script.parser.Lexer;
import com.txscript.script.parser.Token;
import com.txscript.script.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TxScriptLexerTest {

    private static LexResult lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> types(LexResult r) {
        return r.tokens().stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void hex_literal_is_one_token_with_source_text() {
        LexResult r = lex("0x7DF");

        assertFalse(r.hasErrors());
        assertEquals(List.of(TokenType.HEX_NUMBER, TokenType.EOF), types(r));
        Token hex = r.tokens().get(0);
        assertEquals("0x7DF", hex.text);
        assertEquals(0x7DFL, hex.literal);
    }

    @Test
    void unterminated_string_reports_lex_error_and_still_ends_in_eof() {
        LexResult r = lex("print \"abc");

        assertTrue(r.hasErrors());
        assertEquals(ErrorPhase.LEX, r.errors().get(0).getPhase());
        assertEquals(1, r.errors().get(0).getLine());
        assertEquals(7, r.errors().get(0).getColumn());
        assertEquals(TokenType.EOF, r.tokens().get(r.tokens().size() - 1).type);
    }

    @Test
    void tokenize_terminates_on_arbitrary_input() {
        Random rnd = new Random(42);
        String alphabet = "abc019xX_\"\\/*(){}[];,.+-=<>!&|^~?: \t\n#@$s";
        for (int i = 0; i < 500; i++) {
            StringBuilder sb = new StringBuilder();
            int len = rnd.nextInt(60);
            for (int j = 0; j < len; j++) sb.append(alphabet.charAt(rnd.nextInt(alphabet.length())));

            LexResult r = lex(sb.toString());
            List<Token> tokens = r.tokens();
            assertFalse(tokens.isEmpty());
            assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type, () -> "input: " + sb);
        }
    }

    @Test
    void keywords_and_identifiers() {
        LexResult r = lex("var wait_for on_receive data ext timeout rpm_1");

        assertEquals(List.of(TokenType.VAR, TokenType.WAIT_FOR, TokenType.ON_RECEIVE, TokenType.DATA,
                TokenType.EXT, TokenType.TIMEOUT, TokenType.IDENTIFIER, TokenType.EOF), types(r));
        assertEquals("rpm_1", r.tokens().get(6).text);
    }

    @Test
    void seconds_suffix_only_when_not_followed_by_identifier_chars() {
        LexResult r = lex("500s 2 3sec");

        Token first = r.tokens().get(0);
        assertEquals(TokenType.NUMBER, first.type);
        assertEquals(500_000L, first.literal);

        assertEquals(2L, r.tokens().get(1).literal);

        // 3sec lexes as 3 followed by identifier 'sec'
        assertEquals(TokenType.NUMBER, r.tokens().get(2).type);
        assertEquals(3L, r.tokens().get(2).literal);
        assertEquals(TokenType.IDENTIFIER, r.tokens().get(3).type);
        assertEquals("sec", r.tokens().get(3).text);
    }

    @Test
    void float_needs_digit_on_both_sides_of_the_dot() {
        LexResult r = lex("1.5 2.x");

        assertEquals(TokenType.FLOAT_NUMBER, r.tokens().get(0).type);
        assertEquals(1.5, r.tokens().get(0).literal);
        assertEquals(TokenType.NUMBER, r.tokens().get(1).type);
        assertEquals(TokenType.DOT, r.tokens().get(2).type);
    }

    @Test
    void hex_prefix_without_digits_is_an_error() {
        LexResult r = lex("0x");

        assertEquals(1, r.errors().size());
        assertEquals(TokenType.ERROR, r.tokens().get(0).type);
    }

    @Test
    void string_escapes() {
        LexResult r = lex("\"a\\n\\t\\\"b\\\\\"");

        assertFalse(r.hasErrors());
        assertEquals("a\n\t\"b\\", r.tokens().get(0).literal);
    }

    @Test
    void columns_advance_through_comments_and_reset_after_newline() {
        LexResult r = lex("/* ab */ x\n  y // z\n\tw");

        Token x = r.tokens().get(0);
        assertEquals("x", x.text);
        assertEquals(1, x.line);
        assertEquals(10, x.column);

        Token y = r.tokens().get(2);
        assertEquals("y", y.text);
        assertEquals(2, y.line);
        assertEquals(3, y.column);

        Token w = r.tokens().get(4);
        assertEquals("w", w.text);
        assertEquals(3, w.line);
        assertEquals(2, w.column);
    }

    @Test
    void multi_line_block_comment_counts_lines() {
        LexResult r = lex("/* one\ntwo\n*/ send");

        Token send = r.tokens().get(0);
        assertEquals(TokenType.SEND, send.type);
        assertEquals(3, send.line);
        assertEquals(4, send.column);
    }

    @Test
    void unexpected_character_is_reported_and_scanning_continues() {
        LexResult r = lex("x = 1 # 2\ny = 3");

        assertEquals(1, r.errors().size());
        assertTrue(r.errors().get(0).getMessage().contains("#"));
        assertTrue(types(r).contains(TokenType.ERROR));
        assertTrue(r.tokens().stream().anyMatch(t -> t.text.equals("y")));
    }

    @Test
    void unterminated_block_comment_is_an_error() {
        LexResult r = lex("send /* never closed");

        assertEquals(1, r.errors().size());
        assertEquals(TokenType.EOF, r.tokens().get(r.tokens().size() - 1).type);
    }

    @Test
    void operators_use_maximal_munch() {
        LexResult r = lex("<< <= < >> >= > == = != ! && & || |");

        assertEquals(List.of(TokenType.SHL, TokenType.LESS_EQUAL, TokenType.LESS, TokenType.SHR,
                TokenType.GREATER_EQUAL, TokenType.GREATER, TokenType.EQUAL_EQUAL, TokenType.EQUAL,
                TokenType.BANG_EQUAL, TokenType.BANG, TokenType.AND_AND, TokenType.AMPERSAND,
                TokenType.OR_OR, TokenType.PIPE, TokenType.EOF), types(r));
    }
}
