package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.Optimization.Analysis.Dependence.SCC;
import MiddleEnd.Optimization.Analysis.Dependence.SCCDAG;
import MiddleEnd.Optimization.Analysis.Loop;
import MiddleEnd.Optimization.Analysis.LoopAnalysis;
import MiddleEnd.Optimization.Analysis.Recurrence;
import MiddleEnd.Optimization.Analysis.RecurrenceAnalysis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 循环嵌套中每个循环的归纳变量，以及控制循环退出的那一个
 * 每个循环的归纳变量列表持有该循环全部InductionVariable实例
 */
public class InductionVariables {

    private static final Logger logger = LogManager.getLogger(InductionVariables.class);

    private final Loop nestRoot;
    private final Map<Loop, List<InductionVariable>> loopToIVs = new LinkedHashMap<>();
    private final Map<Loop, InductionVariable> loopToGoverningIV = new HashMap<>();
    private final Map<Loop, LoopGoverningIVAttribution> loopToGoverningAttribution = new HashMap<>();

    public InductionVariables(Loop nestRoot, SCCDAG sccdag) {
        this.nestRoot = nestRoot;

        List<Loop> loops = InductionVariableConfig.ANALYZE_NESTED_LOOPS
                ? LoopAnalysis.getLoopsInPreOrder(nestRoot)
                : Collections.singletonList(nestRoot);

        List<BasicBlock> exitBlocks = nestRoot.getExitBlocks();
        for (Loop loop : loops) {
            List<InductionVariable> ivs = detect(loop, sccdag);
            loopToIVs.put(loop, ivs);
            selectGoverningIV(loop, ivs, exitBlocks);
        }
    }

    private List<InductionVariable> detect(Loop loop, SCCDAG sccdag) {
        List<InductionVariable> ivs = new ArrayList<>();

        for (PhiInstruction phi : loop.getHeader().getPhiInstructions()) {
            Recurrence recurrence = RecurrenceAnalysis.getRecurrence(loop, phi);
            if (recurrence == null || recurrence.getKind() != Recurrence.Kind.ADDITIVE) {
                continue;
            }

            SCC scc = sccdag.sccOfValue(phi);
            if (scc == null) {
                throw new IllegalArgumentException("SCCDAG中没有 " + phi.getName() + "，它不覆盖 " + loop);
            }

            InductionVariable iv = InductionVariable.create(loop, recurrence, phi, scc);
            if (iv == null) {
                logger.debug("{} 的步长不是常量({})，跳过", phi.getName(), recurrence.getStepKind());
                continue;
            }

            ivs.add(iv);
            logger.debug("{} 中发现归纳变量 {}", loop, iv);
            if (InductionVariableConfig.VERBOSE_LOGGING) {
                for (Instruction inst : iv.getAllInstructions()) {
                    logger.debug("    {}", inst);
                }
            }
        }

        return ivs;
    }

    /**
     * 按声明顺序归因，第一个合法的归因结果胜出
     */
    private void selectGoverningIV(Loop loop, List<InductionVariable> ivs, List<BasicBlock> exitBlocks) {
        for (InductionVariable iv : ivs) {
            LoopGoverningIVAttribution attribution = new LoopGoverningIVAttribution(iv, iv.getSCC(), exitBlocks);
            if (!attribution.isSCCContainingIVWellFormed()) {
                continue;
            }
            if (loopToGoverningIV.containsKey(loop)) {
                logger.debug("{} 也能控制 {} 的退出，保留先前的 {}", iv, loop, loopToGoverningIV.get(loop));
                continue;
            }
            loopToGoverningIV.put(loop, iv);
            loopToGoverningAttribution.put(loop, attribution);
        }
    }

    public Loop getNestRoot() {
        return nestRoot;
    }

    public Set<Loop> getLoops() {
        return Collections.unmodifiableSet(loopToIVs.keySet());
    }

    public List<InductionVariable> getInductionVariables(Loop loop) {
        List<InductionVariable> ivs = loopToIVs.get(loop);
        if (ivs == null) {
            throw new IllegalArgumentException(loop + " 不在循环嵌套 " + nestRoot + " 中");
        }
        return Collections.unmodifiableList(ivs);
    }

    /**
     * 控制loop退出的归纳变量，没有时返回null
     */
    public InductionVariable getLoopGoverningInductionVariable(Loop loop) {
        return loopToGoverningIV.get(loop);
    }

    public LoopGoverningIVAttribution getLoopGoverningAttribution(Loop loop) {
        return loopToGoverningAttribution.get(loop);
    }
}
