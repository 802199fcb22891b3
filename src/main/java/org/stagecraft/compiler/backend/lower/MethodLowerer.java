package org.stagecraft.compiler.backend.lower;

import com.google.protobuf.CodedOutputStream;
import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.diagnostics.DiagnosticBag;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.frontend.binding.Symbol;
import org.stagecraft.compiler.frontend.binding.SymbolTable;
import org.stagecraft.compiler.syntax.BodyInstruction;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers the body of a single method into encoded instructions.
 * <p>
 * Lowering decodes the body, runs the rules of a {@link LoweringRegistry}, validates operands
 * against the bound declarations and encodes the result. It only reads the bound state and owns
 * all of its output, so any number of methods can be lowered in parallel.
 */
public class MethodLowerer {

    private final LoweringRegistry registry;

    /**
     * @param registry The rules applied to every decoded body.
     */
    public MethodLowerer(LoweringRegistry registry) {
        this.registry = registry;
    }

    /**
     * Lowers one method.
     *
     * @param unit The unit declaring the method.
     * @param type The declaring type.
     * @param method The method. Must have a body.
     * @param bound The bound declarations of the source set.
     * @return The compiled method, or the diagnostics explaining why it could not be compiled.
     */
    public MethodLoweringResult lower(SourceUnit unit, TypeDeclaration type, MethodDeclaration method, BoundDeclarationState bound) {
        String declaringType = SymbolTable.qualify(unit.namespace(), type.name());
        String displayName = declaringType + "." + method.name() + method.signature();
        DiagnosticBag bag = new DiagnosticBag();
        Set<ImportDirective> usedImports = new HashSet<>();

        // Phase 1: decode
        List<LoweredInstruction> decoded = new ArrayList<>(method.body().size());
        for (BodyInstruction instruction : method.body()) {
            Optional<Opcode> opcode = Opcode.fromMnemonic(instruction.opcode());
            if (opcode.isEmpty()) {
                bag.report(CompilerErrorCode.UNKNOWN_OPCODE, instruction.source(), instruction.opcode());
                continue;
            }
            decoded.add(new LoweredInstruction(opcode.get(), instruction.operand(), instruction.source()));
        }

        // Phase 2: rewrite
        List<LoweredInstruction> rewritten = decoded;
        for (ILoweringRule rule : registry.rules()) {
            rewritten = rule.apply(rewritten, method);
        }

        if (rewritten.isEmpty() || rewritten.get(rewritten.size() - 1).opcode() != Opcode.RET) {
            bag.report(CompilerErrorCode.MISSING_RETURN, method.source(), displayName);
        }

        // Phase 3: validate and encode
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        List<SequencePoint> sequencePoints = new ArrayList<>();
        List<SourceInfo> probes = new ArrayList<>();
        try {
            for (LoweredInstruction instruction : rewritten) {
                int offset = out.getTotalBytesWritten();
                if (instruction.opcode() == Opcode.PROBE) {
                    probes.add(instruction.source());
                } else {
                    sequencePoints.add(new SequencePoint(offset, instruction.source()));
                }
                out.writeRawByte((byte) instruction.opcode().code());
                encodeOperand(instruction, unit, declaringType, method, displayName, bound, bag, usedImports, out);
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory encoding failed for " + displayName, e);
        }

        List<Diagnostic> diagnostics = new ArrayList<>(bag.getDiagnostics());
        diagnostics.sort(Comparator.comparing(Diagnostic::location, SourceInfo.BY_POSITION));
        if (bag.hasErrors()) {
            return new MethodLoweringResult(null, DiagnosticSet.of(diagnostics), usedImports);
        }
        CompiledMethod compiled = new CompiledMethod(declaringType, method.name(), method.signature(),
                method.visibility(), buffer.toByteArray(), sequencePoints, probes);
        return new MethodLoweringResult(compiled, DiagnosticSet.of(diagnostics), usedImports);
    }

    private void encodeOperand(LoweredInstruction instruction, SourceUnit unit, String declaringType,
                               MethodDeclaration method, String displayName, BoundDeclarationState bound,
                               DiagnosticBag bag, Set<ImportDirective> usedImports, CodedOutputStream out) throws IOException {
        Opcode opcode = instruction.opcode();
        String operand = instruction.operand();
        SourceInfo source = instruction.source();
        switch (opcode.operandKind()) {
            case NONE -> {
                if (operand != null && !operand.isBlank()) {
                    bag.report(CompilerErrorCode.INVALID_OPERAND, source, operand, opcode);
                }
            }
            case ARGUMENT_INDEX -> {
                Integer index = parseInt(operand);
                if (index == null || index < 0) {
                    bag.report(CompilerErrorCode.INVALID_OPERAND, source, describe(operand), opcode);
                } else if (index >= method.parameters().size()) {
                    bag.report(CompilerErrorCode.ARGUMENT_INDEX_OUT_OF_RANGE, source, index, displayName);
                } else {
                    out.writeUInt32NoTag(index);
                }
            }
            case INT -> {
                Integer value = parseInt(operand);
                if (value == null) {
                    bag.report(CompilerErrorCode.INVALID_OPERAND, source, describe(operand), opcode);
                } else {
                    out.writeSInt32NoTag(value);
                }
            }
            case STRING -> {
                if (operand == null) {
                    bag.report(CompilerErrorCode.INVALID_OPERAND, source, describe(null), opcode);
                } else {
                    out.writeStringNoTag(operand);
                }
            }
            case TYPE -> {
                if (operand == null || operand.isBlank()) {
                    bag.report(CompilerErrorCode.INVALID_OPERAND, source, describe(operand), opcode);
                    return;
                }
                bound.resolver().resolveOrReport(unit, operand.trim(), source, bag, usedImports)
                        .ifPresent(type -> writeString(out, type.qualifiedName()));
            }
            case MEMBER -> encodeMember(instruction, unit, declaringType, bound, bag, usedImports, out);
            case PROBE_INDEX -> out.writeUInt32NoTag(Integer.parseInt(operand));
        }
    }

    private void encodeMember(LoweredInstruction instruction, SourceUnit unit, String declaringType,
                              BoundDeclarationState bound, DiagnosticBag bag, Set<ImportDirective> usedImports,
                              CodedOutputStream out) throws IOException {
        String operand = instruction.operand();
        SourceInfo source = instruction.source();
        int dot = operand == null ? -1 : operand.trim().lastIndexOf('.');
        if (dot <= 0 || dot == operand.trim().length() - 1) {
            bag.report(CompilerErrorCode.INVALID_OPERAND, source, describe(operand), instruction.opcode());
            return;
        }
        String typeName = operand.trim().substring(0, dot);
        String memberName = operand.trim().substring(dot + 1);
        Optional<Symbol> type = bound.resolver().resolveOrReport(unit, typeName, source, bag, usedImports);
        if (type.isEmpty()) {
            return;
        }
        Symbol target = type.get();
        if (target.isExternal() && !Symbol.BUILTIN_ORIGIN.equals(target.origin())) {
            // Referenced types carry no member table.
            out.writeStringNoTag(target.qualifiedName() + "." + memberName);
            return;
        }
        Optional<Symbol> member = bound.symbolTable().lookupMember(target.qualifiedName(), memberName)
                .filter(m -> m.kind() == Symbol.Kind.METHOD);
        if (member.isEmpty()) {
            bag.report(CompilerErrorCode.MEMBER_NOT_FOUND, source, target.qualifiedName(), memberName);
            return;
        }
        if (member.get().visibility() == Visibility.PRIVATE && !target.qualifiedName().equals(declaringType)) {
            bag.report(CompilerErrorCode.INACCESSIBLE_MEMBER, source, target.qualifiedName(), memberName);
            return;
        }
        out.writeStringNoTag(member.get().qualifiedName());
    }

    private static void writeString(CodedOutputStream out, String value) {
        try {
            out.writeStringNoTag(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Integer parseInt(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String describe(String operand) {
        return operand == null ? "<none>" : operand;
    }
}
