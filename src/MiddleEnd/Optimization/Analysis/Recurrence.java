package MiddleEnd.Optimization.Analysis;

import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Value;

/**
 * 循环头phi上的递推描述：起始值 + 每次迭代的步长项
 */
public class Recurrence {

    public enum Kind {
        ADDITIVE,       // phi' = phi + step
        MULTIPLICATIVE  // phi' = phi * step
    }

    /**
     * 步长项的分类
     */
    public enum StepKind {
        CONSTANT,  // 整数常量
        ADD,       // 循环不变的加减表达式，或多个项的和
        MUL,       // 循环不变的乘法表达式
        ADD_REC,   // 同一循环中另一个递推（嵌套递推）
        UNKNOWN    // 其他循环不变值
    }

    private final PhiInstruction phi;
    private final Kind kind;
    private final Value start;
    private final StepKind stepKind;
    private final Value step;

    public Recurrence(PhiInstruction phi, Kind kind, Value start, StepKind stepKind, Value step) {
        this.phi = phi;
        this.kind = kind;
        this.start = start;
        this.stepKind = stepKind;
        this.step = step;
    }

    public PhiInstruction getPhi() {
        return phi;
    }

    public Kind getKind() {
        return kind;
    }

    public Value getStart() {
        return start;
    }

    public StepKind getStepKind() {
        return stepKind;
    }

    /**
     * 步长值。CONSTANT时为ConstantInt，单项时为该项本身，多项之和时为null
     */
    public Value getStep() {
        return step;
    }

    public boolean isConstantStep() {
        return stepKind == StepKind.CONSTANT;
    }

    @Override
    public String toString() {
        return "{" + start.getName() + ", " + (kind == Kind.ADDITIVE ? "+" : "*") + ", "
                + (step == null ? stepKind.name() : step.getName()) + "}<" + phi.getName() + ">";
    }
}
