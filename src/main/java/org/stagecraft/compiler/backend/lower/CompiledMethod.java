package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.syntax.Visibility;

import java.util.Arrays;
import java.util.List;

/**
 * The lowered body of one method.
 *
 * @param declaringType The qualified name of the declaring type.
 * @param name The method name.
 * @param signature The parameter type list, e.g. {@code (int,string)}.
 * @param visibility The method visibility.
 * @param code The encoded instructions.
 * @param sequencePoints Code offsets mapped to source locations, in offset order.
 * @param probes The source location of every coverage probe, by probe index.
 */
public record CompiledMethod(
        String declaringType,
        String name,
        String signature,
        Visibility visibility,
        byte[] code,
        List<SequencePoint> sequencePoints,
        List<SourceInfo> probes
) {
    public CompiledMethod {
        code = code.clone();
        sequencePoints = List.copyOf(sequencePoints);
        probes = List.copyOf(probes);
    }

    /**
     * @return The unique key of the method within its module, e.g. {@code app.Main.run(int)}.
     */
    public String key() {
        return declaringType + "." + name + signature;
    }

    @Override
    public byte[] code() {
        return code.clone();
    }

    public int probeCount() {
        return probes.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompiledMethod other
                && declaringType.equals(other.declaringType)
                && name.equals(other.name)
                && signature.equals(other.signature)
                && visibility == other.visibility
                && Arrays.equals(code, other.code)
                && sequencePoints.equals(other.sequencePoints)
                && probes.equals(other.probes);
    }

    @Override
    public int hashCode() {
        return 31 * key().hashCode() + Arrays.hashCode(code);
    }

    @Override
    public String toString() {
        return "CompiledMethod[" + key() + ", " + code.length + " bytes, " + probes.size() + " probes]";
    }
}
