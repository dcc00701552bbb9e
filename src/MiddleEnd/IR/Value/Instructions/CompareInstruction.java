package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Value.Value;

/**
 * 整数比较指令(icmp)，结果类型为i1
 * 谓词与操作数顺序都可以原地修改
 */
public class CompareInstruction extends Instruction {
    private OpCode predicate;
    
    public CompareInstruction(OpCode predicate, Value left, Value right, String name) {
        super(name, IntegerType.I1);
        checkPredicate(predicate);
        this.predicate = predicate;
        
        addOperand(left);
        addOperand(right);
    }
    
    public OpCode getPredicate() {
        return predicate;
    }
    
    public void setPredicate(OpCode predicate) {
        checkPredicate(predicate);
        this.predicate = predicate;
    }
    
    public OpCode getInversePredicate() {
        return predicate.getInversePredicate();
    }
    
    public Value getLeft() {
        return getOperand(0);
    }
    
    public Value getRight() {
        return getOperand(1);
    }
    
    public void swapOperands() {
        swapOperands(0, 1);
    }
    
    private static void checkPredicate(OpCode predicate) {
        if (!predicate.isPredicate()) {
            throw new IllegalArgumentException("不是比较谓词: " + predicate.getName());
        }
    }
    
    @Override
    public String getOpcodeName() {
        return OpCode.ICMP.getName();
    }
    
    @Override
    public String toString() {
        return getName() + " = " + getOpcodeName() + " " + predicate.getName() + " " + 
               getLeft().getType() + " " + getLeft().getName() + ", " + getRight().getName();
    }
}
