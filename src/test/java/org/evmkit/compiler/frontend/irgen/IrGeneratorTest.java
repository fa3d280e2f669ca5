package org.evmkit.compiler.frontend.irgen;

import java.math.BigInteger;
import java.util.List;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.compiler.frontend.parser.ast.AstNode;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Word;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.evmkit.compiler.frontend.parser.ast.Ops.ifThen;
import static org.evmkit.compiler.frontend.parser.ast.Ops.op;
import static org.evmkit.compiler.frontend.parser.ast.Ops.selfCodeSize;
import static org.evmkit.compiler.frontend.parser.ast.Ops.seq;

@Tag("unit")
class IrGeneratorTest {

    private final IrGenerator generator = new IrGenerator();

    private static IrToken push(int... bytes) {
        byte[] value = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            value[i] = (byte) bytes[i];
        }
        return IrToken.Push.of(value);
    }

    private static IrToken plain(Opcode opcode) {
        return new IrToken.Plain(opcode);
    }

    @Test
    void testOperandsAreEmittedInReverse() {
        Program program = generator.generate(op(Opcode.MSTORE, 0, 0x11223344));

        assertThat(program.tokens()).containsExactly(
                push(0x11, 0x22, 0x33, 0x44),
                push(0x00),
                plain(Opcode.MSTORE));
    }

    @Test
    void testNestedOperands() {
        Program program = generator.generate(op(Opcode.ADD, op(Opcode.MUL, 2, 3), Opcode.CALLVALUE));

        assertThat(program.tokens()).containsExactly(
                plain(Opcode.CALLVALUE),
                push(3),
                push(2),
                plain(Opcode.MUL),
                plain(Opcode.ADD));
    }

    @Test
    void testIfLayout() {
        Program program = generator.generate(ifThen(Opcode.CALLVALUE, Opcode.STOP, Opcode.ADDRESS));

        assertThat(program.tokens()).containsExactly(
                plain(Opcode.CALLVALUE),
                new IrToken.JumpPointer("jump_0"),
                plain(Opcode.JUMPI),
                plain(Opcode.ADDRESS),
                new IrToken.JumpDest("jump_0"),
                plain(Opcode.STOP));
    }

    @Test
    void testNestedIfGetsFreshLabels() {
        Program program = generator.generate(
                ifThen(Opcode.CALLVALUE, ifThen(Opcode.ORIGIN, Opcode.STOP, Opcode.STOP), Opcode.STOP));

        assertThat(program.tokens())
                .filteredOn(t -> t instanceof IrToken.JumpDest)
                .containsExactly(new IrToken.JumpDest("jump_0"), new IrToken.JumpDest("jump_1"));
    }

    @Test
    void testLabelsAreDeterministicAcrossRuns() {
        AstNode tree = seq(ifThen(1, Opcode.STOP, Opcode.STOP), ifThen(0, Opcode.STOP, Opcode.STOP));

        assertThat(generator.generate(tree)).isEqualTo(generator.generate(tree));
    }

    @Test
    void testSequencesAndListsFlatten() {
        Program fromSeq = generator.generate(seq(seq(1, 2), 3));
        Program fromList = generator.generate(AstNode.of(List.of(List.of(1, 2), 3)));

        assertThat(fromSeq.tokens()).containsExactly(push(1), push(2), push(3));
        assertThat(fromList).isEqualTo(fromSeq);
    }

    @Test
    void testBytesLiteralKeepsItsWidth() {
        Program program = generator.generate(seq(new byte[] {0, 0, 1}, new byte[0]));

        assertThat(program.tokens()).containsExactly(push(0, 0, 1), push());
        assertThat(program.tokens().get(1).size()).isEqualTo(1);
    }

    @Test
    void testSelfCodeSizePlaceholder() {
        Program program = generator.generate(selfCodeSize());
        assertThat(program.tokens()).containsExactly(new IrToken.SelfCodeSize());
        assertThat(program.isResolved()).isFalse();
    }

    @Test
    void testWrongOperandCount() {
        assertThatThrownBy(() -> generator.generate(op(Opcode.ADD, 1)))
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("ADD takes 2 operand(s), got 1");
    }

    @Test
    void testNegativeLiteral() {
        assertThatThrownBy(() -> generator.generate(op(Opcode.MSTORE, 0, -1)))
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("negative integer literal: -1");
    }

    @Test
    void testOversizedLiterals() {
        assertThatThrownBy(() -> generator.generate(AstNode.of(new byte[33])))
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("binary value larger than 32 bytes (33 bytes)");
        assertThatThrownBy(() -> generator.generate(AstNode.of(Word.TWO_POW_256)))
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("binary value larger than 32 bytes (33 bytes)");
    }

    @Test
    void testUnknownValue() {
        assertThatThrownBy(() -> AstNode.of("mstore"))
                .isInstanceOf(InvalidAssemblyException.class)
                .hasMessage("invalid or unknown assembly: mstore");
    }

    @Test
    void testEncodeUnsignedIsMinimal() {
        assertThat(IrGenerator.encodeUnsigned(BigInteger.ZERO)).containsExactly(0);
        assertThat(IrGenerator.encodeUnsigned(BigInteger.valueOf(255))).containsExactly(0xff);
        assertThat(IrGenerator.encodeUnsigned(BigInteger.valueOf(256))).containsExactly(0x01, 0x00);
        assertThat(IrGenerator.encodeUnsigned(Word.MAX_UNSIGNED)).hasSize(32).containsOnly(0xff);
    }
}
