package org.stagecraft.compiler.backend.emit;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import org.stagecraft.compiler.api.DebugInfoMode;
import org.stagecraft.compiler.api.ManifestResource;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.backend.lower.CompiledMethod;
import org.stagecraft.compiler.backend.lower.SequencePoint;
import org.stagecraft.compiler.frontend.binding.Symbol;
import org.stagecraft.compiler.frontend.binding.SymbolTable;
import org.stagecraft.compiler.syntax.FieldDeclaration;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.CRC32;

/**
 * Encodes a finalized module in the protobuf wire format.
 * <p>
 * An image starts with a fixed32 magic and a varint format version, followed by tagged fields:
 * <pre>
 *  1 module name        5 method body (repeated)   9 debug id (fixed32)
 *  2 output kind        6 resource (repeated)
 *  3 flags              7 coverage (repeated)
 *  4 type (repeated)    8 embedded debug section
 * </pre>
 * Nested entries are length-delimited messages. Types are written in qualified name order and
 * methods in compilation order, so equal modules produce equal bytes.
 */
class ModuleImageWriter {

    static final int MAGIC = 0x43475453; // "STGC" little-endian
    static final int FORMAT_VERSION = 1;

    static final int FLAG_METADATA_ONLY = 1;
    static final int FLAG_DEBUG_EMBEDDED = 1 << 1;
    static final int FLAG_DEBUG_SEPARATE = 1 << 2;
    static final int FLAG_COVERAGE = 1 << 3;
    static final int FLAG_DOCUMENTATION = 1 << 4;

    private final ModuleBuildState module;

    ModuleImageWriter(ModuleBuildState module) {
        this.module = module;
    }

    /**
     * Writes an image to the stream from its current position. The stream is flushed, not closed.
     *
     * @param target The sink.
     * @param metadataOnly Whether to write declarations only.
     * @param debugId The id of the separate debug stream, or {@code null}.
     * @throws IOException if the sink fails.
     */
    void writeImage(OutputStream target, boolean metadataOnly, Integer debugId) throws IOException {
        CodedOutputStream out = CodedOutputStream.newInstance(target);
        DebugInfoMode debugMode = module.options().debugInfoMode();
        boolean coverage = !metadataOnly && module.options().emitTestCoverageData();

        out.writeFixed32NoTag(MAGIC);
        out.writeUInt32NoTag(FORMAT_VERSION);
        out.writeString(1, module.moduleName());
        out.writeEnum(2, module.sourceSet().options().outputKind().ordinal());
        out.writeUInt32(3, flags(metadataOnly, coverage));

        boolean omitPrivate = metadataOnly && !module.options().includePrivateMembers();
        SymbolTable table = module.sourceSet().boundState().symbolTable();
        for (Symbol type : table.types()) {
            TypeDeclaration declaration = table.declarationOf(type.qualifiedName()).orElse(null);
            if (declaration == null || (omitPrivate && declaration.visibility() == Visibility.PRIVATE)) {
                continue;
            }
            out.writeBytes(4, typeEntry(type, declaration, omitPrivate));
        }

        if (!metadataOnly) {
            for (CompiledMethod method : module.methods()) {
                out.writeBytes(5, message(m -> {
                    m.writeString(1, method.key());
                    m.writeEnum(2, method.visibility().ordinal());
                    m.writeByteArray(3, method.code());
                }));
            }
        }

        for (ManifestResource resource : module.resources()) {
            out.writeBytes(6, message(m -> {
                m.writeString(1, resource.name());
                m.writeBool(2, resource.isPublic());
                m.writeByteArray(3, resource.data());
            }));
        }

        if (coverage) {
            for (CompiledMethod method : module.methods()) {
                out.writeBytes(7, message(m -> {
                    m.writeString(1, method.key());
                    for (SourceInfo probe : method.probes()) {
                        m.writeUInt32(2, probe.lineNumber());
                    }
                }));
            }
        }

        if (!metadataOnly && debugMode == DebugInfoMode.EMBEDDED) {
            out.writeByteArray(8, debugSection());
        }
        if (!metadataOnly && debugId != null) {
            out.writeFixed32(9, debugId);
        }
        out.flush();
        target.flush();
    }

    /**
     * @return The sequence points of all compiled methods.
     */
    byte[] debugSection() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        out.writeFixed32NoTag(MAGIC);
        out.writeString(1, module.moduleName());
        for (CompiledMethod method : module.methods()) {
            out.writeBytes(2, message(m -> {
                m.writeString(1, method.key());
                for (SequencePoint point : method.sequencePoints()) {
                    m.writeBytes(2, message(p -> {
                        p.writeUInt32(1, point.offset());
                        p.writeString(2, point.source().fileName());
                        p.writeUInt32(3, point.source().lineNumber());
                        p.writeUInt32(4, point.source().columnNumber());
                    }));
                }
            }));
        }
        out.flush();
        return buffer.toByteArray();
    }

    /**
     * @param debugSection A separate debug section.
     * @return The id that links the primary image to it.
     */
    static int debugId(byte[] debugSection) {
        CRC32 crc = new CRC32();
        crc.update(debugSection);
        return (int) crc.getValue();
    }

    private int flags(boolean metadataOnly, boolean coverage) {
        int flags = 0;
        if (metadataOnly) {
            flags |= FLAG_METADATA_ONLY;
        } else if (module.options().debugInfoMode() == DebugInfoMode.EMBEDDED) {
            flags |= FLAG_DEBUG_EMBEDDED;
        } else if (module.options().debugInfoMode() == DebugInfoMode.SEPARATE) {
            flags |= FLAG_DEBUG_SEPARATE;
        }
        if (coverage) {
            flags |= FLAG_COVERAGE;
        }
        if (module.documentation().isPresent()) {
            flags |= FLAG_DOCUMENTATION;
        }
        return flags;
    }

    private static ByteString typeEntry(Symbol type, TypeDeclaration declaration, boolean omitPrivate) throws IOException {
        return message(t -> {
            t.writeString(1, type.qualifiedName());
            t.writeEnum(2, declaration.visibility().ordinal());
            if (declaration.baseType() != null) {
                t.writeString(3, declaration.baseType());
            }
            for (FieldDeclaration field : declaration.fields()) {
                if (omitPrivate && field.visibility() == Visibility.PRIVATE) continue;
                t.writeBytes(4, message(f -> {
                    f.writeString(1, field.name());
                    f.writeEnum(2, Symbol.Kind.FIELD.ordinal());
                    f.writeEnum(3, field.visibility().ordinal());
                    f.writeString(4, field.typeName());
                }));
            }
            for (MethodDeclaration method : declaration.methods()) {
                if (omitPrivate && method.visibility() == Visibility.PRIVATE) continue;
                t.writeBytes(4, message(f -> {
                    f.writeString(1, method.name());
                    f.writeEnum(2, Symbol.Kind.METHOD.ordinal());
                    f.writeEnum(3, method.visibility().ordinal());
                    f.writeString(4, method.returnType() + method.signature());
                }));
            }
        });
    }

    private static ByteString message(MessageBody body) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(buffer);
        body.writeTo(out);
        out.flush();
        return ByteString.copyFrom(buffer.toByteArray());
    }

    @FunctionalInterface
    private interface MessageBody {
        void writeTo(CodedOutputStream out) throws IOException;
    }
}
