package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.api.SourceInfo;

/**
 * A decoded body instruction. This is the unit lowering rules rewrite.
 *
 * @param opcode The opcode.
 * @param operand The operand text, or {@code null}.
 * @param source The source location.
 */
public record LoweredInstruction(Opcode opcode, String operand, SourceInfo source) {
}
