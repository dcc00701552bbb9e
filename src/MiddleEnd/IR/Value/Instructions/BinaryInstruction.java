package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Value.Value;

/**
 * 二元整数运算指令，如加、减、乘、除等
 */
public class BinaryInstruction extends Instruction {
    private final OpCode opCode;
    
    /**
     * 创建一个二元操作指令
     */
    public BinaryInstruction(OpCode opCode, Value left, Value right, Type resultType, String name) {
        super(name, resultType);
        if (!opCode.isBinaryOp()) {
            throw new IllegalArgumentException("不是二元运算操作码: " + opCode.getName());
        }
        this.opCode = opCode;
        
        addOperand(left);
        addOperand(right);
    }
    
    public OpCode getOpCode() {
        return opCode;
    }
    
    public Value getLeft() {
        return getOperand(0);
    }
    
    public Value getRight() {
        return getOperand(1);
    }
    
    @Override
    public String getOpcodeName() {
        return opCode.getName();
    }
    
    @Override
    public String toString() {
        return getName() + " = " + getOpcodeName() + " " + 
               getType() + " " + getLeft().getName() + ", " + getRight().getName();
    }
}
