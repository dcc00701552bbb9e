package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.ConstantInt;
import MiddleEnd.IR.Value.Instructions.*;
import MiddleEnd.IR.Value.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 循环控制变量的改写工具
 *
 * 由合法的归因结果构造，计算退出条件的非严格谓词（归纳变量放在比较左侧，
 * 条件为真时退出），并提供分块执行所需的几个IR编辑操作
 */
public class LoopGoverningIVUtility {

    private static final Logger logger = LogManager.getLogger(LoopGoverningIVUtility.class);

    private final LoopGoverningIVAttribution attribution;
    private final OpCode nonStrictPredicate;
    private final boolean flipOperandsToUseNonStrictPredicate;
    private final List<Instruction> conditionValueOrderedDerivation = new ArrayList<>();

    public LoopGoverningIVUtility(InductionVariable iv, LoopGoverningIVAttribution attribution) {
        if (!attribution.isSCCContainingIVWellFormed()) {
            throw new InvariantViolationException("不能从不合法的归因结果构造: " + iv);
        }
        if (attribution.getInductionVariable() != iv) {
            throw new InvariantViolationException("归因结果不属于 " + iv);
        }
        if (iv.getStepValue() == null) {
            throw new InvariantViolationException("归纳变量步长不是常量: " + iv);
        }
        this.attribution = attribution;

        CompareInstruction condition = attribution.getHeaderCmpInst();
        boolean ivIsLeftOperand = condition.getLeft() == iv.getHeaderPhi();

        // 按块在函数中的顺序、块内指令顺序排列条件值的推导
        Set<Instruction> derivation = attribution.getConditionValueDerivation();
        for (BasicBlock block : iv.getLoop().getBlocksInLayoutOrder()) {
            for (Instruction inst : block.getInstructions()) {
                if (derivation.contains(inst)) {
                    conditionValueOrderedDerivation.add(inst);
                }
            }
        }

        boolean isStepPositive = iv.getStepValue().isStrictlyPositive();
        boolean exitsOnTrue = attribution.getHeaderBrInst().getSuccessor(0) == attribution.getExitBlockFromHeader();
        OpCode exitPredicate = exitsOnTrue ? condition.getPredicate() : condition.getInversePredicate();
        if (!ivIsLeftOperand) {
            exitPredicate = exitPredicate.getSwappedPredicate();
        }
        this.flipOperandsToUseNonStrictPredicate = !ivIsLeftOperand;
        this.nonStrictPredicate = toNonStrictPredicate(exitPredicate, isStepPositive);

        logger.debug("{}: 退出谓词 {} -> {}, 交换操作数: {}", iv, exitPredicate.getName(),
                nonStrictPredicate.getName(), flipOperandsToUseNonStrictPredicate);
    }

    /**
     * 把退出谓词转换为非严格形式；步长方向与谓词矛盾时抛出异常
     */
    static OpCode toNonStrictPredicate(OpCode exitPredicate, boolean isStepPositive) {
        switch (exitPredicate) {
            case NE:
                // 本身是非严格的，最多多出一次迭代
                return exitPredicate;
            case EQ:
                // 分块后一次前进多步，可能跳过相等的那一点
                return isStepPositive ? OpCode.UGE : OpCode.ULE;
            case SLT:
            case SLE:
            case ULT:
            case ULE:
                if (isStepPositive) {
                    throw new InvariantViolationException("步长为正，与退出谓词 " + exitPredicate.getName() + " 不兼容");
                }
                return exitPredicate;
            case SGT:
            case SGE:
            case UGT:
            case UGE:
                if (!isStepPositive) {
                    throw new InvariantViolationException("步长不为正，与退出谓词 " + exitPredicate.getName() + " 不兼容");
                }
                return exitPredicate;
            default:
                throw new InvariantViolationException("不是整数比较谓词: " + exitPredicate.getName());
        }
    }

    /**
     * 在循环头创建分块计数phi：来自preheader时为0，
     * 其余每条入边上计算 (prev + 1) == chunkSize ? 0 : prev + 1
     */
    public static PhiInstruction createChunkPHI(BasicBlock preheader, BasicBlock header,
                                                IntegerType counterType, Value chunkSize) {
        List<BasicBlock> headerPreds = new ArrayList<>(header.getPredecessors());
        PhiInstruction chunkPhi = IRBuilder.createPhi(counterType, header);
        ConstantInt zero = ConstantInt.getZero(counterType);
        ConstantInt one = ConstantInt.getOne(counterType);

        for (BasicBlock pred : headerPreds) {
            if (pred == preheader) {
                chunkPhi.addIncoming(zero, pred);
                continue;
            }

            Instruction terminator = pred.getTerminator();
            BinaryInstruction chunkIncrement = IRBuilder.createBinaryInstBefore(OpCode.ADD, chunkPhi, one, terminator);
            CompareInstruction isChunkCompleted = IRBuilder.createICmpBefore(OpCode.EQ, chunkIncrement, chunkSize, terminator);
            SelectInstruction chunkWrap = IRBuilder.createSelectBefore(isChunkCompleted, zero, chunkIncrement,
                    "chunkWrap", terminator);
            chunkPhi.addIncoming(chunkWrap, pred);
        }

        return chunkPhi;
    }

    /**
     * 让循环控制phi每完成一个分块才前进chunkStep：
     * 非preheader入边的值改为 chunkCompleted ? value + chunkStep : value
     */
    public static void chunkLoopGoverningPHI(BasicBlock preheader, PhiInstruction governingPhi,
                                             PhiInstruction chunkPhi, Value chunkStep) {
        for (int i = 0; i < governingPhi.getNumIncomingValues(); i++) {
            BasicBlock pred = governingPhi.getIncomingBlock(i);
            if (pred == preheader) {
                continue;
            }

            Value chunkIncoming = chunkPhi.getIncomingValueForBlock(pred);
            if (!(chunkIncoming instanceof SelectInstruction chunkWrap)) {
                throw new InvariantViolationException("分块phi在 " + pred.getName() + " 上的输入不是select");
            }
            Value isChunkCompleted = chunkWrap.getCondition();

            Instruction terminator = pred.getTerminator();
            Value incoming = governingPhi.getIncomingValue(i);
            BinaryInstruction nextChunk = IRBuilder.createBinaryInstBefore(OpCode.ADD, incoming, chunkStep, terminator);
            SelectInstruction nextValue = IRBuilder.createSelectBefore(isChunkCompleted, nextChunk, incoming,
                    "nextStepOrNextChunk", terminator);
            governingPhi.setIncomingValue(i, nextValue);
        }
    }

    /**
     * 改写退出比较为非严格谓词，并让跳转的第0个后继为出口块
     */
    public void updateConditionAndBranchToCatchIteratingPastExitValue(CompareInstruction cmpToUpdate,
                                                                      BranchInstruction branch,
                                                                      BasicBlock exitBlock) {
        if (flipOperandsToUseNonStrictPredicate) {
            cmpToUpdate.swapOperands();
        }
        cmpToUpdate.setPredicate(nonStrictPredicate);

        if (branch.getSuccessor(0) != exitBlock) {
            branch.setSuccessor(1, branch.getSuccessor(0));
            branch.setSuccessor(0, exitBlock);
        }
    }

    /**
     * 在cloneBlock末尾生成等价的退出检查：
     * icmp nonStrictPredicate recurrenceValue, clonedCompareValue; br cmp, exitBlock, continueBlock
     */
    public void cloneConditionalCheckFor(Value recurrenceValue, Value clonedCompareValue,
                                         BasicBlock continueBlock, BasicBlock exitBlock, BasicBlock cloneBlock) {
        CompareInstruction cmp = IRBuilder.createICmp(nonStrictPredicate, recurrenceValue, clonedCompareValue, cloneBlock);
        IRBuilder.createCondBr(cmp, exitBlock, continueBlock, cloneBlock);
    }

    public LoopGoverningIVAttribution getAttribution() {
        return attribution;
    }

    public OpCode getNonStrictPredicate() {
        return nonStrictPredicate;
    }

    public boolean shouldFlipOperands() {
        return flipOperandsToUseNonStrictPredicate;
    }

    public List<Instruction> getConditionValueOrderedDerivation() {
        return Collections.unmodifiableList(conditionValueOrderedDerivation);
    }
}
