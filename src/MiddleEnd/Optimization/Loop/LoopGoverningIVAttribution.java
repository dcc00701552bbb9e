package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Instructions.BranchInstruction;
import MiddleEnd.IR.Value.Instructions.CompareInstruction;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Value;
import MiddleEnd.Optimization.Analysis.Dependence.DGEdge;
import MiddleEnd.Optimization.Analysis.Dependence.DGNode;
import MiddleEnd.Optimization.Analysis.Dependence.SCC;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 判断一个归纳变量是否控制循环的退出
 *
 * 要求循环头以条件跳转结束，条件是归纳变量与另一个值（条件值）的比较，
 * 且跳转的恰好一个后继是循环嵌套的出口块。条件值若在同一SCC内，其推导不能依赖归纳变量；
 * SCC内其余节点只能是比较、跳转、无条件跳转、地址计算或phi
 */
public class LoopGoverningIVAttribution {

    private static final Logger logger = LogManager.getLogger(LoopGoverningIVAttribution.class);

    private final InductionVariable iv;
    private final SCC scc;

    private CompareInstruction headerCmp;
    private BranchInstruction headerBr;
    private Value conditionValue;
    private BasicBlock exitBlock;
    private final Set<Instruction> conditionValueDerivation = new LinkedHashSet<>();

    private boolean isWellFormed = false;

    public LoopGoverningIVAttribution(InductionVariable iv, SCC scc, List<BasicBlock> exitBlocks) {
        this.iv = iv;
        this.scc = scc;

        String reason = attribute(exitBlocks);
        if (reason == null) {
            isWellFormed = true;
            logger.debug("{} 控制循环退出，条件值 {}", iv, conditionValue.getName());
        } else {
            logger.debug("{} 不是循环控制变量: {}", iv, reason);
        }
    }

    /**
     * 依次检查各个条件，返回第一个不满足的原因，全部满足时返回null
     */
    private String attribute(List<BasicBlock> exitBlocks) {
        BasicBlock header = iv.getHeaderPhi().getParent();

        if (!(header.getTerminator() instanceof BranchInstruction br) || br.isUnconditional()) {
            return "循环头不以条件跳转结束";
        }
        headerBr = br;

        if (!(br.getCondition() instanceof CompareInstruction cmp)) {
            return "跳转条件不是比较指令";
        }
        headerCmp = cmp;

        Value headerPhi = iv.getHeaderPhi();
        boolean leftIsIV = cmp.getLeft() == headerPhi;
        boolean rightIsIV = cmp.getRight() == headerPhi;
        if (leftIsIV == rightIsIV) {
            return "比较的操作数中不是恰好有一个是归纳变量";
        }
        conditionValue = leftIsIV ? cmp.getRight() : cmp.getLeft();

        boolean firstExits = exitBlocks.contains(br.getSuccessor(0));
        boolean secondExits = exitBlocks.contains(br.getSuccessor(1));
        if (firstExits == secondExits) {
            return "跳转的后继中不是恰好有一个是出口块";
        }
        exitBlock = firstExits ? br.getSuccessor(0) : br.getSuccessor(1);

        if (scc.isInternal(conditionValue) && !collectConditionValueDerivation()) {
            return "条件值由归纳变量推导而来";
        }

        for (DGNode node : scc.getInternalNodes()) {
            Instruction inst = node.getValue();
            if (iv.isMember(inst) || conditionValueDerivation.contains(inst)) {
                continue;
            }
            if (!isAccountedFor(node, headerCmp, headerBr)) {
                return "SCC中存在无法解释的指令 " + inst.getName();
            }
        }

        return null;
    }

    /**
     * 从条件值出发沿SCC内部的数据依赖反向遍历；遇到归纳变量的成员时返回false
     */
    private boolean collectConditionValueDerivation() {
        Deque<DGNode> workList = new ArrayDeque<>();
        workList.add(scc.fetchNode(conditionValue));

        while (!workList.isEmpty()) {
            DGNode node = workList.poll();
            if (iv.isMember(node.getValue())) {
                return false;
            }
            if (!conditionValueDerivation.add(node.getValue())) {
                continue;
            }

            for (DGEdge edge : node.getIncomingEdges()) {
                if (edge.isDataDependence() && scc.isInternal(edge.getSourceValue())) {
                    workList.add(edge.getSource());
                }
            }
        }
        return true;
    }

    /**
     * SCC中既不属于归纳变量也不属于条件值推导的节点，只允许是
     * 循环头的比较和跳转、无条件跳转、地址计算或汇合点
     */
    static boolean isAccountedFor(DGNode node, CompareInstruction headerCmp, BranchInstruction headerBr) {
        return switch (node.getKind()) {
            case COMPARISON -> node.getValue() == headerCmp;
            case CONDITIONAL_BRANCH -> node.getValue() == headerBr;
            case UNCONDITIONAL_BRANCH, POINTER_COMPUTATION, MERGE -> true;
            case OTHER -> false;
        };
    }

    public InductionVariable getInductionVariable() {
        return iv;
    }

    public SCC getSCC() {
        return scc;
    }

    public CompareInstruction getHeaderCmpInst() {
        return headerCmp;
    }

    public BranchInstruction getHeaderBrInst() {
        return headerBr;
    }

    public Value getConditionValue() {
        return conditionValue;
    }

    public BasicBlock getExitBlockFromHeader() {
        return exitBlock;
    }

    public Set<Instruction> getConditionValueDerivation() {
        return Collections.unmodifiableSet(conditionValueDerivation);
    }

    public boolean isSCCContainingIVWellFormed() {
        return isWellFormed;
    }
}
