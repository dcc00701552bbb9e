package MiddleEnd.IR.Value;

import MiddleEnd.IR.Type.Type;
import MiddleEnd.IR.Use;

import java.util.ArrayList;
import java.util.List;

public class User extends Value {
    private final List<Use> operands = new ArrayList<>();
    
    public User(String name, Type type) {
        super(name, type);
    }
    
    public int getOperandCount() {
        return operands.size();
    }
    
    public Value getOperand(int index) {
        return operands.get(index).getValue();
    }
    
    public List<Value> getOperands() {
        List<Value> values = new ArrayList<>();
        for (Use use : operands) {
            values.add(use.getValue());
        }
        return values;
    }
    
    public void setOperand(int index, Value value) {
        if (index == operands.size()) {
            operands.add(new Use(value, this));
            if (value != null) {
                value.addUser(this);
            }
            return;
        }
        
        Use use = operands.get(index);
        Value oldValue = use.getValue();
        use.setValue(value);
        if (value != null) {
            value.addUser(this);
        }
        // 同一个值可能占据多个操作数位置，只有全部移除后才解除使用关系
        if (oldValue != null && oldValue != value && !getOperands().contains(oldValue)) {
            oldValue.removeUser(this);
        }
    }
    
    public void addOperand(Value value) {
        setOperand(operands.size(), value);
    }
    
    /**
     * 交换两个操作数的位置
     */
    public void swapOperands(int first, int second) {
        Use a = operands.get(first);
        Use b = operands.get(second);
        Value tmp = a.getValue();
        a.setValue(b.getValue());
        b.setValue(tmp);
    }
}
