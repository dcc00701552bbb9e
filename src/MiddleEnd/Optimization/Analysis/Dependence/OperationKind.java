package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.Instructions.BranchInstruction;
import MiddleEnd.IR.Value.Instructions.CompareInstruction;
import MiddleEnd.IR.Value.Instructions.GetElementPtrInstruction;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;

/**
 * 依赖图节点的操作分类，建图时计算一次
 */
public enum OperationKind {
    MERGE,
    COMPARISON,
    CONDITIONAL_BRANCH,
    UNCONDITIONAL_BRANCH,
    POINTER_COMPUTATION,
    OTHER;

    public static OperationKind of(Instruction inst) {
        if (inst instanceof PhiInstruction) {
            return MERGE;
        }
        if (inst instanceof CompareInstruction) {
            return COMPARISON;
        }
        if (inst instanceof BranchInstruction br) {
            return br.isUnconditional() ? UNCONDITIONAL_BRANCH : CONDITIONAL_BRANCH;
        }
        if (inst instanceof GetElementPtrInstruction) {
            return POINTER_COMPUTATION;
        }
        return OTHER;
    }
}
