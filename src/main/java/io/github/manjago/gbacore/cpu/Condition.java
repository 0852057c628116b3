package io.github.manjago.gbacore.cpu;

import static io.github.manjago.gbacore.cpu.CpuState.*;

/**
 * ARM condition field (bits 28-31).
 * <p>
 * Evaluated against whatever flags the status register holds. Only N and Z
 * are ever computed by the ALU; conditions reading C or V see the stored bits.
 */
public enum Condition {

    EQ("EQ"),
    NE("NE"),
    CS("CS"),
    CC("CC"),
    MI("MI"),
    PL("PL"),
    VS("VS"),
    VC("VC"),
    HI("HI"),
    LS("LS"),
    GE("GE"),
    LT("LT"),
    GT("GT"),
    LE("LE"),
    AL(""),
    NV("NV");

    private static final Condition[] BY_CODE = values();

    private final String suffix;

    Condition(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Mnemonic suffix; empty for AL.
     */
    public String getSuffix() {
        return suffix;
    }

    public static Condition of(int instruction) {
        return BY_CODE[instruction >>> 28];
    }

    /**
     * Whether an instruction with this condition executes under {@code cpsr}.
     */
    public boolean test(int cpsr) {
        boolean n = (cpsr & FLAG_N) != 0;
        boolean z = (cpsr & FLAG_Z) != 0;
        boolean c = (cpsr & FLAG_C) != 0;
        boolean v = (cpsr & FLAG_V) != 0;
        return switch (this) {
            case EQ -> z;
            case NE -> !z;
            case CS -> c;
            case CC -> !c;
            case MI -> n;
            case PL -> !n;
            case VS -> v;
            case VC -> !v;
            case HI -> c && !z;
            case LS -> !c || z;
            case GE -> n == v;
            case LT -> n != v;
            case GT -> !z && n == v;
            case LE -> z || n != v;
            case AL -> true;
            case NV -> false;
        };
    }
}
