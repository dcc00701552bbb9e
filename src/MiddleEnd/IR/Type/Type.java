package MiddleEnd.IR.Type;

/**
 * IR类型系统的基类
 */
public abstract class Type {
    public boolean isPointerType() {
        return this instanceof PointerType;
    }
    
    @Override
    public abstract String toString();
}
