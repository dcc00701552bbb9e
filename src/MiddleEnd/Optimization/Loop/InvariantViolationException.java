package MiddleEnd.Optimization.Loop;

/**
 * 循环控制变量分析的内部不变式被破坏
 * 说明上游分析接受了不该接受的循环，不可恢复
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
