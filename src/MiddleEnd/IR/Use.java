package MiddleEnd.IR;

import MiddleEnd.IR.Value.User;
import MiddleEnd.IR.Value.Value;

/**
 * 一条use-def边：user的某个操作数位置引用了value
 */
public class Use {
    private Value value;
    private final User user;
    
    public Use(Value value, User user) {
        this.value = value;
        this.user = user;
    }
    
    public Value getValue() {
        return value;
    }
    
    public void setValue(Value value) {
        this.value = value;
    }
    
    public User getUser() {
        return user;
    }
}
