package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.Module;
import MiddleEnd.IR.Value.Function;
import MiddleEnd.Optimization.Analysis.Dependence.LoopDependenceGraph;
import MiddleEnd.Optimization.Analysis.Dependence.SCCDAG;
import MiddleEnd.Optimization.Analysis.Loop;
import MiddleEnd.Optimization.Analysis.LoopAnalysis;
import MiddleEnd.Optimization.Core.Optimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 归纳变量分析器
 * 对模块中每个函数的每个顶层循环嵌套构建依赖图与SCC分解，再检测归纳变量
 */
public class InductionVariableAnalysis implements Optimizer.Analyzer {

    private static final Logger logger = LogManager.getLogger(InductionVariableAnalysis.class);

    private final Map<Loop, InductionVariables> nestResults = new LinkedHashMap<>();

    @Override
    public String getName() {
        return "InductionVariableAnalysis";
    }

    @Override
    public void run(Module module) {
        nestResults.clear();

        int governed = 0;
        for (Function function : module.functions()) {
            if (function.isExternal()) {
                continue;
            }
            if (function.getBasicBlocks().size() > InductionVariableConfig.MAX_BLOCK_THRESHOLD) {
                logger.debug("函数 {} 基本块过多，跳过", function.getName());
                continue;
            }

            for (Loop nestRoot : LoopAnalysis.analyzeLoops(function)) {
                SCCDAG sccdag = SCCDAG.build(new LoopDependenceGraph(nestRoot));
                InductionVariables ivs = new InductionVariables(nestRoot, sccdag);
                nestResults.put(nestRoot, ivs);

                for (Loop loop : ivs.getLoops()) {
                    if (ivs.getLoopGoverningInductionVariable(loop) != null) {
                        governed++;
                    }
                }
            }
        }

        logger.info("{}: 分析了 {} 个循环嵌套，{} 个循环有循环控制变量",
                module.getName(), nestResults.size(), governed);
    }

    /**
     * 顶层循环 -> 该循环嵌套的归纳变量
     */
    @Override
    public Map<Loop, InductionVariables> getResult() {
        return nestResults;
    }

    /**
     * 包含loop的循环嵌套的分析结果，loop未被分析时返回null
     */
    public InductionVariables getInductionVariables(Loop loop) {
        for (InductionVariables ivs : nestResults.values()) {
            if (ivs.getLoops().contains(loop)) {
                return ivs;
            }
        }
        return null;
    }
}
