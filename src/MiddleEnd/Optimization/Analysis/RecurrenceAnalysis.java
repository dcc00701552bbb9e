package MiddleEnd.Optimization.Analysis;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.ConstantInt;
import MiddleEnd.IR.Value.Instructions.BinaryInstruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 递推分析
 * 对循环头的phi，沿回边的输入值向上追溯加减链，求出 {start, +, step} 形式的递推；
 * 也识别 phi' = phi * c 形式的乘法递推
 */
public class RecurrenceAnalysis {

    private static final Logger logger = LogManager.getLogger(RecurrenceAnalysis.class);

    /**
     * 求phi在loop上的递推，不是递推时返回null
     */
    public static Recurrence getRecurrence(Loop loop, PhiInstruction phi) {
        if (phi.getParent() != loop.getHeader()) {
            return null;
        }
        if (!(phi.getType() instanceof IntegerType intType)) {
            return null;
        }

        Value start = null;
        List<Value> backedgeValues = new ArrayList<>();
        for (int i = 0; i < phi.getNumIncomingValues(); i++) {
            BasicBlock incomingBlock = phi.getIncomingBlock(i);
            if (loop.contains(incomingBlock)) {
                backedgeValues.add(phi.getIncomingValue(i));
            } else if (start == null) {
                start = phi.getIncomingValue(i);
            }
        }
        if (start == null || backedgeValues.isEmpty()) {
            return null;
        }

        Recurrence multiplicative = getMultiplicativeRecurrence(loop, phi, start, backedgeValues);
        if (multiplicative != null) {
            return multiplicative;
        }

        StepSum step = null;
        for (Value value : backedgeValues) {
            StepSum current = resolve(loop, phi, value, new HashSet<>());
            if (current == null) {
                logger.debug("{} 的回边输入 {} 不能归结为加法递推", phi.getName(), value.getName());
                return null;
            }
            if (step != null && !step.equals(current)) {
                logger.debug("{} 的各条回边步长不一致", phi.getName());
                return null;
            }
            step = current;
        }

        Recurrence recurrence = step.toRecurrence(phi, start, intType);
        if (recurrence == null) {
            logger.debug("{} 的净步长为0，不是递推", phi.getName());
        }
        return recurrence;
    }

    private static Recurrence getMultiplicativeRecurrence(Loop loop, PhiInstruction phi, Value start,
                                                          List<Value> backedgeValues) {
        Value factor = null;
        for (Value value : backedgeValues) {
            if (!(value instanceof BinaryInstruction mul) || mul.getOpCode() != OpCode.MUL) {
                return null;
            }
            Value current;
            if (mul.getLeft() == phi) {
                current = mul.getRight();
            } else if (mul.getRight() == phi) {
                current = mul.getLeft();
            } else {
                return null;
            }
            if (loop.isDefinedInside(current) || (factor != null && !sameTerm(factor, current))) {
                return null;
            }
            factor = current;
        }

        Recurrence.StepKind stepKind = factor instanceof ConstantInt
                ? Recurrence.StepKind.CONSTANT : Recurrence.StepKind.UNKNOWN;
        return new Recurrence(phi, Recurrence.Kind.MULTIPLICATIVE, start, stepKind, factor);
    }

    /**
     * 把value表示成 phi + 若干不变项 的形式
     */
    private static StepSum resolve(Loop loop, PhiInstruction phi, Value value, Set<Value> visiting) {
        if (value == phi) {
            return new StepSum();
        }
        if (!loop.isDefinedInside(value) || !visiting.add(value)) {
            return null;
        }

        try {
            if (value instanceof BinaryInstruction binary) {
                if (binary.getOpCode() == OpCode.ADD) {
                    StepSum sum = resolve(loop, phi, binary.getLeft(), visiting);
                    if (sum != null) {
                        return sum.plus(loop, binary.getRight(), false);
                    }
                    sum = resolve(loop, phi, binary.getRight(), visiting);
                    return sum == null ? null : sum.plus(loop, binary.getLeft(), false);
                }
                if (binary.getOpCode() == OpCode.SUB) {
                    StepSum sum = resolve(loop, phi, binary.getLeft(), visiting);
                    return sum == null ? null : sum.plus(loop, binary.getRight(), true);
                }
                return null;
            }

            // 循环内部的汇合点：各输入必须归结为同一个步长
            if (value instanceof PhiInstruction merge && merge.getParent() != loop.getHeader()) {
                StepSum result = null;
                for (int i = 0; i < merge.getNumIncomingValues(); i++) {
                    StepSum current = resolve(loop, phi, merge.getIncomingValue(i), visiting);
                    if (current == null || (result != null && !result.equals(current))) {
                        return null;
                    }
                    result = current;
                }
                return result;
            }

            return null;
        } finally {
            visiting.remove(value);
        }
    }

    private static boolean sameTerm(Value a, Value b) {
        if (a instanceof ConstantInt ca && b instanceof ConstantInt cb) {
            return ca.getValue() == cb.getValue();
        }
        return a == b;
    }

    private static Recurrence.StepKind classifyTerm(Loop loop, Value term) {
        if (loop.isDefinedInside(term)) {
            if (term instanceof PhiInstruction termPhi && termPhi.getParent() == loop.getHeader()) {
                return Recurrence.StepKind.ADD_REC;
            }
            return null;
        }
        if (term instanceof BinaryInstruction binary) {
            switch (binary.getOpCode()) {
                case MUL:
                    return Recurrence.StepKind.MUL;
                case ADD:
                case SUB:
                    return Recurrence.StepKind.ADD;
                default:
                    break;
            }
        }
        return Recurrence.StepKind.UNKNOWN;
    }

    /**
     * 步长的累加形式：常量部分 + 符号项列表
     */
    private static final class StepSum {
        private long constant;
        private final List<Value> terms = new ArrayList<>();
        private final List<Boolean> negated = new ArrayList<>();
        private final List<Recurrence.StepKind> kinds = new ArrayList<>();

        StepSum plus(Loop loop, Value term, boolean negate) {
            if (term instanceof ConstantInt constantInt) {
                constant += negate ? -constantInt.getValue() : constantInt.getValue();
                return this;
            }
            Recurrence.StepKind kind = classifyTerm(loop, term);
            if (kind == null) {
                return null;
            }
            terms.add(term);
            negated.add(negate);
            kinds.add(kind);
            return this;
        }

        Recurrence toRecurrence(PhiInstruction phi, Value start, IntegerType type) {
            if (terms.isEmpty()) {
                // 净步长为0时phi是循环不变量
                if (constant == 0) {
                    return null;
                }
                return new Recurrence(phi, Recurrence.Kind.ADDITIVE, start,
                        Recurrence.StepKind.CONSTANT, new ConstantInt(constant, type));
            }
            if (terms.size() == 1 && constant == 0 && !negated.get(0)) {
                return new Recurrence(phi, Recurrence.Kind.ADDITIVE, start, kinds.get(0), terms.get(0));
            }
            return new Recurrence(phi, Recurrence.Kind.ADDITIVE, start, Recurrence.StepKind.ADD, null);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StepSum other)) return false;
            return constant == other.constant && terms.equals(other.terms) && negated.equals(other.negated);
        }

        @Override
        public int hashCode() {
            return Objects.hash(constant, terms, negated);
        }
    }
}
