package org.evmkit.compiler.frontend.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.compiler.frontend.lexer.Lexer;
import org.evmkit.compiler.frontend.lexer.Token;
import org.evmkit.compiler.frontend.lexer.TokenType;
import org.evmkit.compiler.frontend.parser.ast.AstNode;
import org.evmkit.compiler.frontend.parser.ast.BytesNode;
import org.evmkit.compiler.frontend.parser.ast.IfNode;
import org.evmkit.compiler.frontend.parser.ast.NumberNode;
import org.evmkit.compiler.frontend.parser.ast.OpNode;
import org.evmkit.compiler.frontend.parser.ast.SelfCodeSizeNode;
import org.evmkit.compiler.frontend.parser.ast.SequenceNode;
import org.evmkit.runtime.isa.Opcode;

/**
 * Parses the s-expression form of operation trees.
 * <p>
 * Grammar:
 * <pre>
 * program  := form*
 * form     := NUMBER | STRING | SYMBOL | '(' form* ')'
 * </pre>
 * A list headed by the symbol {@code if} is the conditional macro. A list headed by any other
 * symbol applies that mnemonic to the remaining forms; an unknown mnemonic is a parse error. A
 * list whose head is not a symbol, or is {@code self-code-size}, is a nested sequence. The
 * symbol {@code self-code-size} stands for the total program length.
 */
public class Parser {

    static final String IF = "if";
    static final String SELF_CODE_SIZE = "self-code-size";

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Creates a parser over the given source text.
     * @param source The source text.
     * @throws InvalidAssemblyException if the text cannot be tokenized.
     */
    public Parser(String source) {
        this(new Lexer(source).scanTokens());
    }

    /**
     * Creates a parser over already scanned tokens.
     * @param tokens The tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses all top-level forms.
     * @return The parsed forms, in source order.
     * @throws InvalidAssemblyException on malformed syntax, an unknown mnemonic or a wrong
     *                                  operand count.
     */
    public List<AstNode> parse() {
        List<AstNode> forms = new ArrayList<>();
        while (!check(TokenType.END_OF_FILE)) {
            forms.add(form());
        }
        return forms;
    }

    private AstNode form() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new NumberNode((BigInteger) token.value());
            case STRING:
                return new BytesNode((byte[]) token.value());
            case SYMBOL:
                return symbol(token);
            case LEFT_PAREN:
                return list(token);
            case RIGHT_PAREN:
                throw error(token, "Unexpected ')'");
            default:
                throw error(token, "Unexpected end of input");
        }
    }

    private AstNode symbol(Token token) {
        String text = token.text();
        if (SELF_CODE_SIZE.equalsIgnoreCase(text)) {
            return new SelfCodeSizeNode();
        }
        if (IF.equalsIgnoreCase(text)) {
            throw error(token, "'if' must be applied as (if cond non-zero zero)");
        }
        Opcode opcode = opcode(token);
        return checkedOp(token, opcode, List.of());
    }

    private AstNode list(Token open) {
        if (check(TokenType.SYMBOL)) {
            Token head = peek();
            if (IF.equalsIgnoreCase(head.text())) {
                advance();
                List<AstNode> args = rest(open);
                if (args.size() != 3) {
                    throw error(head, "'if' takes 3 operands, got " + args.size());
                }
                return new IfNode(args.get(0), args.get(1), args.get(2));
            }
            if (!SELF_CODE_SIZE.equalsIgnoreCase(head.text())) {
                advance();
                Opcode opcode = opcode(head);
                return checkedOp(head, opcode, rest(open));
            }
        }
        return new SequenceNode(rest(open));
    }

    private List<AstNode> rest(Token open) {
        List<AstNode> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (check(TokenType.END_OF_FILE)) {
                throw error(open, "Unclosed '('");
            }
            items.add(form());
        }
        advance();
        return items;
    }

    private Opcode opcode(Token token) {
        Optional<Opcode> opcode = Opcode.fromMnemonic(token.text());
        if (opcode.isEmpty()) {
            throw error(token, "Unknown mnemonic: " + token.text());
        }
        return opcode.get();
    }

    private OpNode checkedOp(Token token, Opcode opcode, List<AstNode> args) {
        if (args.size() != opcode.inputs()) {
            throw error(token, String.format("%s takes %d operand(s), got %d",
                    opcode.mnemonic(), opcode.inputs(), args.size()));
        }
        return new OpNode(opcode, args);
    }

    private static InvalidAssemblyException error(Token token, String message) {
        return new InvalidAssemblyException(message, token.line(), token.column());
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END_OF_FILE) current++;
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }
}
