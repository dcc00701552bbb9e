package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.User;

public abstract class Instruction extends User {
    private BasicBlock parent;
    
    public Instruction(String name, Type type) {
        super(name, type);
    }
    
    public BasicBlock getParent() {
        return parent;
    }
    
    public void setParent(BasicBlock parent) {
        this.parent = parent;
    }
    
    public void insertBefore(Instruction before) {
        if (before.getParent() == null) {
            throw new IllegalArgumentException("插入位置 " + before.getName() + " 不属于任何基本块");
        }
        before.getParent().addInstructionBefore(this, before);
    }
    
    public abstract String getOpcodeName();
    
    @Override
    public abstract String toString();
}
