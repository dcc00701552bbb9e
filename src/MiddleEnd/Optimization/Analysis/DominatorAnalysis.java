package MiddleEnd.Optimization.Analysis;

import MiddleEnd.IR.Value.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 支配关系分析工具
 * 计算支配/后支配集合以及对应的直接支配者，结果写回基本块
 */
public class DominatorAnalysis {

    private static final Logger logger = LogManager.getLogger(DominatorAnalysis.class);

    private static final int MAX_ITERATIONS = 1000;

    public static Map<BasicBlock, Set<BasicBlock>> computeDominators(Function function) {
        List<BasicBlock> blocks = function.getBasicBlocks();
        BasicBlock entry = function.getEntryBlock();
        if (entry == null) {
            return new LinkedHashMap<>();
        }
        return solve(blocks, Collections.singletonList(entry), BasicBlock::getPredecessors);
    }

    /**
     * 后支配集合。没有后继的块都视为出口，相当于连接到一个虚拟出口
     */
    public static Map<BasicBlock, Set<BasicBlock>> computePostDominators(Function function) {
        List<BasicBlock> blocks = function.getBasicBlocks();
        List<BasicBlock> exits = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (block.getSuccessors().isEmpty()) {
                exits.add(block);
            }
        }
        return solve(blocks, exits, BasicBlock::getSuccessors);
    }

    /**
     * 迭代数据流求解：roots的集合只含自身，其余块初始为全集，
     * 每轮取所有边源集合的交集再并上自身，直到不再变化
     */
    private static Map<BasicBlock, Set<BasicBlock>> solve(List<BasicBlock> blocks, List<BasicBlock> roots,
                                                         java.util.function.Function<BasicBlock, List<BasicBlock>> edges) {
        Map<BasicBlock, Set<BasicBlock>> dominatorMap = new LinkedHashMap<>();
        for (BasicBlock block : blocks) {
            if (roots.contains(block)) {
                dominatorMap.put(block, new LinkedHashSet<>(Collections.singleton(block)));
            } else {
                dominatorMap.put(block, new LinkedHashSet<>(blocks));
            }
        }

        boolean changed;
        int iterationCount = 0;
        do {
            changed = false;
            iterationCount++;

            if (iterationCount > MAX_ITERATIONS) {
                logger.warn("支配关系迭代次数过多({})，提前结束", iterationCount);
                break;
            }

            for (BasicBlock block : blocks) {
                if (roots.contains(block)) {
                    continue;
                }

                List<BasicBlock> sources = edges.apply(block);
                if (sources.isEmpty()) {
                    continue;
                }

                Set<BasicBlock> newDomSet = new LinkedHashSet<>(blocks);
                for (BasicBlock source : sources) {
                    Set<BasicBlock> sourceSet = dominatorMap.get(source);
                    if (sourceSet != null) {
                        newDomSet.retainAll(sourceSet);
                    }
                }
                newDomSet.add(block);

                if (!newDomSet.equals(dominatorMap.get(block))) {
                    dominatorMap.put(block, newDomSet);
                    changed = true;
                }
            }
        } while (changed);

        return dominatorMap;
    }

    public static Map<BasicBlock, BasicBlock> computeImmediateDominators(
            Map<BasicBlock, Set<BasicBlock>> dominators) {
        Map<BasicBlock, BasicBlock> idoms = new LinkedHashMap<>();

        for (BasicBlock block : dominators.keySet()) {
            Set<BasicBlock> domSet = new LinkedHashSet<>(dominators.get(block));
            domSet.remove(block);

            // 直接支配者是严格支配者中不支配其他严格支配者的那一个
            for (BasicBlock dominator : domSet) {
                boolean isIdom = true;
                for (BasicBlock other : domSet) {
                    if (other != dominator && dominators.get(other).contains(dominator)) {
                        isIdom = false;
                        break;
                    }
                }
                if (isIdom) {
                    idoms.put(block, dominator);
                    break;
                }
            }
        }

        return idoms;
    }

    public static void computeDominatorTree(Function function) {
        Map<BasicBlock, BasicBlock> idoms = computeImmediateDominators(computeDominators(function));
        for (BasicBlock block : function.getBasicBlocks()) {
            block.setIdominator(idoms.get(block));
        }
    }

    public static void computePostDominatorTree(Function function) {
        computePostDominatorTree(function, computePostDominators(function));
    }

    /**
     * 用已经算好的后支配集合写回直接后支配者
     */
    public static void computePostDominatorTree(Function function,
                                                Map<BasicBlock, Set<BasicBlock>> postDominators) {
        Map<BasicBlock, BasicBlock> ipdoms = computeImmediateDominators(postDominators);
        for (BasicBlock block : function.getBasicBlocks()) {
            block.setIpostdominator(ipdoms.get(block));
        }
    }

    /**
     * a是否支配b，依赖已经计算好的支配树
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        BasicBlock runner = b;
        while (runner != null) {
            if (runner == a) {
                return true;
            }
            runner = runner.getIdominator();
        }
        return false;
    }
}
