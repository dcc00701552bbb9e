package MiddleEnd.IR.Value.Instructions;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Phi指令，用于SSA形式的变量汇合
 * 第i个操作数对应第i个输入基本块
 */
public class PhiInstruction extends Instruction {
    private final List<BasicBlock> incomingBlocks = new ArrayList<>();
    
    /**
     * 创建一个Phi指令
     */
    public PhiInstruction(Type type, String name) {
        super(name, type);
    }
    
    /**
     * 添加一个输入值，同一个前驱块只能出现一次
     */
    public void addIncoming(Value value, BasicBlock block) {
        if (incomingBlocks.contains(block)) {
            throw new IllegalArgumentException("Phi " + getName() + " 已有来自 " + block.getName() + " 的输入");
        }
        incomingBlocks.add(block);
        addOperand(value);
    }
    
    /**
     * 输入值的个数
     */
    public int getNumIncomingValues() {
        return incomingBlocks.size();
    }
    
    /**
     * 获取第i个输入值
     */
    public Value getIncomingValue(int index) {
        return getOperand(index);
    }
    
    /**
     * 替换第i个输入值，输入块不变
     */
    public void setIncomingValue(int index, Value value) {
        setOperand(index, value);
    }
    
    /**
     * 获取第i个输入块
     */
    public BasicBlock getIncomingBlock(int index) {
        return incomingBlocks.get(index);
    }
    
    public List<BasicBlock> getIncomingBlocks() {
        return new ArrayList<>(incomingBlocks);
    }
    
    /**
     * 输入块的编号，不存在时返回-1
     */
    public int getBasicBlockIndex(BasicBlock block) {
        return incomingBlocks.indexOf(block);
    }
    
    /**
     * 获取指定基本块的输入值，不存在时返回null
     */
    public Value getIncomingValueForBlock(BasicBlock block) {
        int index = getBasicBlockIndex(block);
        return index == -1 ? null : getIncomingValue(index);
    }
    
    @Override
    public String getOpcodeName() {
        return OpCode.PHI.getName();
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(" = ").append(getOpcodeName()).append(" ");
        sb.append(getType()).append(" ");
        
        for (int i = 0; i < incomingBlocks.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append("[ ").append(getIncomingValue(i).getName())
              .append(", %").append(incomingBlocks.get(i).getName()).append(" ]");
        }
        
        return sb.toString();
    }
}
