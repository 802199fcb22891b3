package org.stagecraft.compiler.syntax;

import org.stagecraft.compiler.api.SourceInfo;

/**
 * A single instruction of a method body as delivered by the parser.
 * Opcode and operand are plain text; they are validated during method compilation.
 *
 * @param opcode The opcode mnemonic, e.g. {@code CALL}.
 * @param operand The operand text, or {@code null} if the instruction has none.
 * @param source The location of the instruction.
 */
public record BodyInstruction(String opcode, String operand, SourceInfo source) {

    /**
     * Convenience constructor for instructions without an operand.
     * @param opcode The opcode mnemonic.
     * @param source The location.
     */
    public BodyInstruction(String opcode, SourceInfo source) {
        this(opcode, null, source);
    }
}
