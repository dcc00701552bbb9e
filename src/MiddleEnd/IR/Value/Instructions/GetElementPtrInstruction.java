package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.PointerType;
import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Value.Value;

/**
 * 地址计算指令，只做指针运算，不访问内存
 */
public class GetElementPtrInstruction extends Instruction {
    public GetElementPtrInstruction(Value pointer, Value offset, String name) {
        super(name, pointer.getType());
        
        if (!pointer.getType().isPointerType()) {
            throw new IllegalArgumentException("GetElementPtr的第一个参数必须是指针类型");
        }
        
        addOperand(pointer);
        addOperand(offset);
    }
    
    public Value getPointer() {
        return getOperand(0);
    }
    
    public Value getOffset() {
        return getOperand(1);
    }
    
    public Type getElementType() {
        return ((PointerType) getPointer().getType()).getElementType();
    }
    
    @Override
    public String getOpcodeName() {
        return OpCode.GETELEMENTPTR.getName();
    }
    
    @Override
    public String toString() {
        return getName() + " = " + getOpcodeName() + " " + getElementType() + ", " +
               getPointer().getType() + " " + getPointer().getName() + ", " +
               getOffset().getType() + " " + getOffset().getName();
    }
}
