package MiddleEnd.IR.Value;

import MiddleEnd.IR.Type.IntegerType;

/**
 * 整数常量。常量不做唯一化，比较数值请使用{@link #getValue()}
 */
public class ConstantInt extends Constant {
    private final long value;
    
    public ConstantInt(long value) {
        this(value, IntegerType.I32);
    }
    
    public ConstantInt(long value, IntegerType type) {
        super(String.valueOf(value), type);
        this.value = value;
    }
    
    public long getValue() {
        return value;
    }
    
    public boolean isZero() {
        return value == 0;
    }
    
    public boolean isStrictlyPositive() {
        return value > 0;
    }
    
    public static ConstantInt getZero(IntegerType type) {
        return new ConstantInt(0, type);
    }
    
    public static ConstantInt getOne(IntegerType type) {
        return new ConstantInt(1, type);
    }
    
    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }
    
    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
