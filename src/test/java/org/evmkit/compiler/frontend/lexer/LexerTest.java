package org.evmkit.compiler.frontend.lexer;

import java.math.BigInteger;
import java.util.List;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LexerTest {

    @Test
    void testSimpleForm() {
        List<Token> tokens = new Lexer("(mstore 0 0x11223344)").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LEFT_PAREN, TokenType.SYMBOL, TokenType.NUMBER, TokenType.NUMBER,
                TokenType.RIGHT_PAREN, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).text()).isEqualTo("mstore");
        assertThat(tokens.get(2).value()).isEqualTo(BigInteger.ZERO);
        assertThat(tokens.get(3).value()).isEqualTo(BigInteger.valueOf(0x11223344L));
    }

    @Test
    void testByteString() {
        List<Token> tokens = new Lexer("\"0x00ff\"").scanTokens();

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat((byte[]) tokens.get(0).value()).containsExactly(0x00, 0xff);
    }

    @Test
    void testCommentsAndPositions() {
        List<Token> tokens = new Lexer("; header\n  (add 1 2) ; trailing\n(stop)").scanTokens();

        Token add = tokens.get(1);
        assertThat(add.text()).isEqualTo("add");
        assertThat(add.line()).isEqualTo(2);
        assertThat(add.column()).isEqualTo(4);
        Token stop = tokens.get(6);
        assertThat(stop.text()).isEqualTo("stop");
        assertThat(stop.line()).isEqualTo(3);
        assertThat(stop.column()).isEqualTo(2);
    }

    @Test
    void testHyphenatedSymbol() {
        List<Token> tokens = new Lexer("self-code-size").scanTokens();
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.SYMBOL);
        assertThat(tokens.get(0).text()).isEqualTo("self-code-size");
    }

    @Test
    void testNegativeNumberIsScanned() {
        List<Token> tokens = new Lexer("-5").scanTokens();
        assertThat(tokens.get(0).value()).isEqualTo(BigInteger.valueOf(-5));
    }

    @Test
    void testMalformedNumber() {
        assertThatThrownBy(() -> new Lexer("12ab").scanTokens())
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("Invalid number format: 12ab at line 1, column 1");
    }

    @Test
    void testOddByteString() {
        assertThatThrownBy(() -> new Lexer("(push \"0xabc\")").scanTokens())
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessageContaining("even number of hex digits");
    }

    @Test
    void testByteStringWithoutPrefix() {
        assertThatThrownBy(() -> new Lexer("\"abcd\"").scanTokens())
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessageStartingWith("Byte string must start with 0x");
    }

    @Test
    void testUnterminatedString() {
        assertThatThrownBy(() -> new Lexer("\"0x12").scanTokens())
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessageStartingWith("Unterminated string");
    }

    @Test
    void testUnexpectedCharacter() {
        assertThatThrownBy(() -> new Lexer("(add 1 #)").scanTokens())
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("Unexpected character: # at line 1, column 8");
    }
}
