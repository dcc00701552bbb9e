package MiddleEnd.IR.Type;

public class IntegerType extends Type {
    private final int bitWidth; 
    
    public static final IntegerType I1 = new IntegerType(1);
    public static final IntegerType I32 = new IntegerType(32);
    public static final IntegerType I64 = new IntegerType(64);
    
    public IntegerType(int bitWidth) {
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("整数位宽必须为正: " + bitWidth);
        }
        this.bitWidth = bitWidth;
    }
    
    public int getBitWidth() {
        return bitWidth;
    }
    
    @Override
    public String toString() {
        return "i" + bitWidth;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntegerType)) return false;
        IntegerType that = (IntegerType) obj;
        return bitWidth == that.bitWidth;
    }
    
    @Override
    public int hashCode() {
        return Integer.hashCode(bitWidth);
    }
}
