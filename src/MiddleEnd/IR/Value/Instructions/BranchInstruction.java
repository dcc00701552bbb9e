package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.VoidType;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Value;

import java.util.Arrays;

public class BranchInstruction extends Instruction implements TerminatorInstruction {
    
    public BranchInstruction(BasicBlock target) {
        super("br", VoidType.VOID);
        addOperand(target);
    }
    
    public BranchInstruction(Value condition, BasicBlock trueBlock, BasicBlock falseBlock) {
        super("br", VoidType.VOID);
        addOperand(condition);
        addOperand(trueBlock);
        addOperand(falseBlock);
    }
    
    public boolean isUnconditional() {
        return getOperandCount() == 1;
    }
    
    public Value getCondition() {
        return isUnconditional() ? null : getOperand(0);
    }
    
    public int getNumSuccessors() {
        return isUnconditional() ? 1 : 2;
    }
    
    /**
     * 第index个后继，条件跳转时0为真分支、1为假分支
     */
    public BasicBlock getSuccessor(int index) {
        return (BasicBlock) getOperand(successorOperandIndex(index));
    }
    
    /**
     * 修改第index个后继，同时维护所在基本块的CFG边
     */
    public void setSuccessor(int index, BasicBlock block) {
        BasicBlock old = getSuccessor(index);
        setOperand(successorOperandIndex(index), block);
        
        BasicBlock parent = getParent();
        if (parent == null || old == block) {
            return;
        }
        if (!Arrays.asList(getSuccessors()).contains(old)) {
            parent.removeSuccessor(old);
        }
        parent.addSuccessor(block);
    }
    
    public BasicBlock getTrueBlock() {
        return getSuccessor(0);
    }
    
    public BasicBlock getFalseBlock() {
        return isUnconditional() ? null : getSuccessor(1);
    }
    
    private int successorOperandIndex(int index) {
        if (index < 0 || index >= getNumSuccessors()) {
            throw new IndexOutOfBoundsException("后继编号越界: " + index);
        }
        return isUnconditional() ? 0 : index + 1;
    }
    
    @Override
    public String getOpcodeName() {
        return OpCode.BR.getName();
    }
    
    @Override
    public String toString() {
        if (isUnconditional()) {
            return "br label %" + getTrueBlock().getName();
        } else {
            return "br i1 " + getCondition().getName() + ", label %" + getTrueBlock().getName() +
                   ", label %" + getFalseBlock().getName();
        }
    }
    
    @Override
    public BasicBlock[] getSuccessors() {
        if (isUnconditional()) {
            return new BasicBlock[] { getTrueBlock() };
        } else {
            return new BasicBlock[] { getTrueBlock(), getFalseBlock() };
        }
    }
}
