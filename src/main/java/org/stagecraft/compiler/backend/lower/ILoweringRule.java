package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.syntax.MethodDeclaration;

import java.util.List;

/**
 * Rewriter rule that can expand or modify a decoded method body before it is encoded.
 */
public interface ILoweringRule {

    /**
     * Applies this rule to the given instruction stream.
     *
     * @param instructions The decoded instructions.
     * @param method The method being lowered.
     * @return The rewritten instructions.
     */
    List<LoweredInstruction> apply(List<LoweredInstruction> instructions, MethodDeclaration method);
}
