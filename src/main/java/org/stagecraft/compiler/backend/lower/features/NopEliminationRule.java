package org.stagecraft.compiler.backend.lower.features;

import org.stagecraft.compiler.backend.lower.ILoweringRule;
import org.stagecraft.compiler.backend.lower.LoweredInstruction;
import org.stagecraft.compiler.backend.lower.Opcode;
import org.stagecraft.compiler.syntax.MethodDeclaration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes {@code NOP} instructions.
 */
public class NopEliminationRule implements ILoweringRule {

    @Override
    public List<LoweredInstruction> apply(List<LoweredInstruction> instructions, MethodDeclaration method) {
        return instructions.stream()
                .filter(i -> i.opcode() != Opcode.NOP)
                .collect(Collectors.toList());
    }
}
