package MiddleEnd.IR;

public enum OpCode {
    RET("ret"),
    BR("br"),

    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("sdiv"),
    REM("srem"),

    SHL("shl"),
    LSHR("lshr"),
    ASHR("ashr"),
    AND("and"),
    OR("or"),
    XOR("xor"),

    ICMP("icmp"),

    EQ("eq"),
    NE("ne"),
    SGT("sgt"),
    SGE("sge"),
    SLT("slt"),
    SLE("sle"),
    UGT("ugt"),
    UGE("uge"),
    ULT("ult"),
    ULE("ule"),

    LOAD("load"),
    GETELEMENTPTR("getelementptr"),

    PHI("phi"),
    SELECT("select");

    private final String name;

    OpCode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isBinaryOp() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == REM ||
               this == SHL || this == LSHR || this == ASHR || this == AND || this == OR || this == XOR;
    }

    public boolean isPredicate() {
        return this == EQ || this == NE ||
               this == SGT || this == SGE || this == SLT || this == SLE ||
               this == UGT || this == UGE || this == ULT || this == ULE;
    }

    /**
     * 取反后的谓词：a pred b 为假 当且仅当 a inverse(pred) b 为真
     */
    public OpCode getInversePredicate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case SGT -> SLE;
            case SGE -> SLT;
            case SLT -> SGE;
            case SLE -> SGT;
            case UGT -> ULE;
            case UGE -> ULT;
            case ULT -> UGE;
            case ULE -> UGT;
            default -> throw new IllegalArgumentException("不是比较谓词: " + name);
        };
    }

    /**
     * 交换操作数后的谓词：a pred b 等价于 b swapped(pred) a
     */
    public OpCode getSwappedPredicate() {
        return switch (this) {
            case EQ -> EQ;
            case NE -> NE;
            case SGT -> SLT;
            case SGE -> SLE;
            case SLT -> SGT;
            case SLE -> SGE;
            case UGT -> ULT;
            case UGE -> ULE;
            case ULT -> UGT;
            case ULE -> UGE;
            default -> throw new IllegalArgumentException("不是比较谓词: " + name);
        };
    }
}
