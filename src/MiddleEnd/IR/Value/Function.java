package MiddleEnd.IR.Value;

import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Value.Instructions.Instruction;

import java.util.ArrayList;
import java.util.List;

public class Function extends Value {
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final List<Argument> arguments = new ArrayList<>();
    private final Type returnType;
    private boolean isExternal;
    
    public Function(String name, Type returnType) {
        super(name, returnType);
        this.returnType = returnType;
        this.isExternal = false;
    }
    
    public Type getReturnType() {
        return returnType;
    }
    
    public void addArgument(Argument argument) {
        arguments.add(argument);
    }
    
    public List<Argument> getArguments() {
        return arguments;
    }
    
    public Argument getArgument(int index) {
        return arguments.get(index);
    }
    
    public void addBasicBlock(BasicBlock block) {
        blocks.add(block);
    }

    public List<BasicBlock> getBasicBlocks() {
        return blocks;
    }
    
    public BasicBlock getEntryBlock() {
        if (blocks.isEmpty()) {
            return null;
        }
        return blocks.get(0);
    }
    
    public void setExternal(boolean external) {
        isExternal = external;
    }
    
    public boolean isExternal() {
        return isExternal;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("define ").append(returnType).append(" @")
            .append(getName()).append("(");
        
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        
        sb.append(")");
        
        if (isExternal) {
            return sb.toString();
        }
        
        sb.append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append("  ").append(block).append("\n");
            for (Instruction inst : block.getInstructions()) {
                sb.append("    ").append(inst).append("\n");
            }
        }
        sb.append("}");
        
        return sb.toString();
    }
}
