package org.stagecraft.compiler.backend.lower;

import java.util.Locale;
import java.util.Optional;

/**
 * The instruction set of lowered method bodies.
 */
public enum Opcode {
    NOP(0x00, OperandKind.NONE),
    LOAD_ARG(0x01, OperandKind.ARGUMENT_INDEX),
    LOAD_CONST(0x02, OperandKind.INT),
    LOAD_STR(0x03, OperandKind.STRING),
    NEW(0x04, OperandKind.TYPE),
    CALL(0x05, OperandKind.MEMBER),
    ADD(0x06, OperandKind.NONE),
    POP(0x07, OperandKind.NONE),
    RET(0x08, OperandKind.NONE),
    /** Coverage probe. Inserted by instrumentation, never written in source. */
    PROBE(0x7F, OperandKind.PROBE_INDEX);

    /**
     * The kind of operand an opcode takes.
     */
    public enum OperandKind {
        NONE, ARGUMENT_INDEX, INT, STRING, TYPE, MEMBER, PROBE_INDEX
    }

    private final int code;
    private final OperandKind operandKind;

    Opcode(int code, OperandKind operandKind) {
        this.code = code;
        this.operandKind = operandKind;
    }

    public int code() {
        return code;
    }

    public OperandKind operandKind() {
        return operandKind;
    }

    /**
     * Looks up an opcode by the mnemonic used in source. Case-insensitive.
     * @param mnemonic The mnemonic.
     * @return The opcode, empty for unknown mnemonics and for {@link #PROBE}.
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        try {
            Opcode opcode = valueOf(mnemonic.trim().toUpperCase(Locale.ROOT));
            return opcode == PROBE ? Optional.empty() : Optional.of(opcode);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
