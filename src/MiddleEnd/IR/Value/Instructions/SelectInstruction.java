package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Value.Value;

/**
 * select指令：condition ? trueValue : falseValue
 */
public class SelectInstruction extends Instruction {
    
    public SelectInstruction(Value condition, Value trueValue, Value falseValue, String name) {
        super(name, trueValue.getType());
        if (!trueValue.getType().equals(falseValue.getType())) {
            throw new IllegalArgumentException("select两个分支的类型不一致: " +
                    trueValue.getType() + " / " + falseValue.getType());
        }
        addOperand(condition);
        addOperand(trueValue);
        addOperand(falseValue);
    }
    
    public Value getCondition() {
        return getOperand(0);
    }
    
    public Value getTrueValue() {
        return getOperand(1);
    }
    
    public Value getFalseValue() {
        return getOperand(2);
    }
    
    @Override
    public String getOpcodeName() {
        return OpCode.SELECT.getName();
    }
    
    @Override
    public String toString() {
        return getName() + " = " + getOpcodeName() + " i1 " + getCondition().getName() + ", " +
               getType() + " " + getTrueValue().getName() + ", " + getType() + " " + getFalseValue().getName();
    }
}
