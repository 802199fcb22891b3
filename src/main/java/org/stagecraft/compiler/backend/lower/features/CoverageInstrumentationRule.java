package org.stagecraft.compiler.backend.lower.features;

import org.stagecraft.compiler.backend.lower.ILoweringRule;
import org.stagecraft.compiler.backend.lower.LoweredInstruction;
import org.stagecraft.compiler.backend.lower.Opcode;
import org.stagecraft.compiler.syntax.MethodDeclaration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Inserts a {@code PROBE} before the first instruction of every source line.
 * Probes are numbered from zero within each method.
 */
public class CoverageInstrumentationRule implements ILoweringRule {

    @Override
    public List<LoweredInstruction> apply(List<LoweredInstruction> instructions, MethodDeclaration method) {
        List<LoweredInstruction> out = new ArrayList<>(instructions.size() * 2);
        Set<String> seenLines = new HashSet<>();
        int probe = 0;
        for (LoweredInstruction instruction : instructions) {
            String line = instruction.source().fileName() + ":" + instruction.source().lineNumber();
            if (seenLines.add(line)) {
                out.add(new LoweredInstruction(Opcode.PROBE, Integer.toString(probe++), instruction.source()));
            }
            out.add(instruction);
        }
        return out;
    }
}
