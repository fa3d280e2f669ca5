package org.evmkit.compiler.frontend.parser.ast;

/**
 * Stands for the total length of the assembled program.
 */
public record SelfCodeSizeNode() implements AstNode {
}
