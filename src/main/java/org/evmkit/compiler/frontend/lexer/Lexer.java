package org.evmkit.compiler.frontend.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.evmkit.compiler.api.InvalidAssemblyException;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Comments start with {@code ;} and run to the end of the line.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     * @throws InvalidAssemblyException on an unexpected character or a malformed literal.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN, null); break;
            case ')': addToken(TokenType.RIGHT_PAREN, null); break;
            case '"': string(); break;
            case ';':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case ' ', '\r', '\t', ',':
                break;
            case '\n':
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c) || (c == '-' && isDigit(peek()))) {
                    number();
                } else if (isSymbolChar(c)) {
                    symbol();
                } else {
                    throw error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void symbol() {
        while (isSymbolChar(peek()) || isDigit(peek())) advance();
        addToken(TokenType.SYMBOL, null);
    }

    private void number() {
        while (isSymbolChar(peek()) || isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            BigInteger value;
            if (text.startsWith("0x") || text.startsWith("0X")) {
                String digits = text.substring(2);
                if (digits.isEmpty()) throw new NumberFormatException("Empty numeric literal");
                value = new BigInteger(digits, 16);
            } else {
                value = new BigInteger(text, 10);
            }
            addToken(TokenType.NUMBER, value);
        } catch (NumberFormatException e) {
            throw error("Invalid number format: " + text);
        }
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') throw error("Unterminated string");
            advance();
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance(); // closing quote

        String content = source.substring(start + 1, current - 1);
        if (!content.startsWith("0x") && !content.startsWith("0X")) {
            throw error("Byte string must start with 0x: \"" + content + "\"");
        }
        String digits = content.substring(2);
        if (digits.length() % 2 != 0) {
            throw error("Byte string must have an even number of hex digits: \"" + content + "\"");
        }
        try {
            addToken(TokenType.STRING, Hex.decode(digits));
        } catch (DecoderException e) {
            throw error("Invalid hex in byte string: \"" + content + "\"");
        }
    }

    private InvalidAssemblyException error(String message) {
        return new InvalidAssemblyException(message, line, startColumn);
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, startColumn));
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isSymbolChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '-';
    }
}
