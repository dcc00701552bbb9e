package MiddleEnd.Optimization.Analysis;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 循环分析工具类
 * 用于识别IR中的自然循环并建立循环嵌套树
 */
public class LoopAnalysis {

    private static final Logger logger = LogManager.getLogger(LoopAnalysis.class);

    /**
     * 分析函数中的循环，返回顶层循环（按循环头在函数中的顺序）
     */
    public static List<Loop> analyzeLoops(Function function) {
        DominatorAnalysis.computeDominatorTree(function);

        List<Loop> allLoops = identifyLoops(function);
        List<Loop> topLevelLoops = buildLoopTree(allLoops);

        logger.debug("函数 {} 中找到 {} 个循环，其中 {} 个顶层循环",
                function.getName(), allLoops.size(), topLevelLoops.size());
        return topLevelLoops;
    }

    private static List<Loop> identifyLoops(Function function) {
        List<Loop> loops = new ArrayList<>();

        for (BasicBlock header : function.getBasicBlocks()) {
            for (BasicBlock latch : header.getPredecessors()) {
                // 回边：latch -> header 且 header 支配 latch
                if (DominatorAnalysis.dominates(header, latch)) {
                    Loop loop = findOrCreateLoop(header, loops);
                    loop.addLatchBlock(latch);
                    collectLoopBlocks(loop, header, latch);
                }
            }
        }

        for (Loop loop : loops) {
            loop.computeExitBlocks();
        }

        return loops;
    }

    private static Loop findOrCreateLoop(BasicBlock header, List<Loop> loops) {
        for (Loop loop : loops) {
            if (loop.getHeader() == header) {
                return loop;
            }
        }

        Loop newLoop = new Loop(header);
        loops.add(newLoop);
        return newLoop;
    }

    private static void collectLoopBlocks(Loop loop, BasicBlock header, BasicBlock latch) {
        Deque<BasicBlock> workList = new ArrayDeque<>();

        loop.addBlock(header);
        if (!loop.contains(latch)) {
            loop.addBlock(latch);
            workList.push(latch);
        }

        while (!workList.isEmpty()) {
            BasicBlock current = workList.pop();
            for (BasicBlock pred : current.getPredecessors()) {
                if (!loop.contains(pred)) {
                    loop.addBlock(pred);
                    workList.push(pred);
                }
            }
        }
    }

    /**
     * 建立嵌套关系：每个循环挂到包含它的最小循环下
     */
    private static List<Loop> buildLoopTree(List<Loop> allLoops) {
        Map<Loop, Loop> parents = new HashMap<>();
        List<Loop> topLevelLoops = new ArrayList<>();

        for (Loop inner : allLoops) {
            Loop parent = null;
            for (Loop outer : allLoops) {
                if (outer != inner && isNestedLoop(inner, outer)
                        && (parent == null || outer.getBlocks().size() < parent.getBlocks().size())) {
                    parent = outer;
                }
            }
            if (parent == null) {
                topLevelLoops.add(inner);
            } else {
                parents.put(inner, parent);
            }
        }

        // 子循环按循环头顺序挂到父循环上
        for (Loop inner : allLoops) {
            Loop parent = parents.get(inner);
            if (parent != null) {
                parent.addSubLoop(inner);
            }
        }

        return topLevelLoops;
    }

    private static boolean isNestedLoop(Loop inner, Loop outer) {
        if (inner.getHeader() == outer.getHeader()) {
            return false;
        }
        for (BasicBlock block : inner.getBlocks()) {
            if (!outer.contains(block)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 先序遍历循环嵌套树：外层循环在前，子循环按发现顺序在后
     */
    public static List<Loop> getLoopsInPreOrder(Loop root) {
        List<Loop> result = new ArrayList<>();
        preOrderTraverseLoops(root, result);
        return result;
    }

    private static void preOrderTraverseLoops(Loop loop, List<Loop> result) {
        result.add(loop);
        for (Loop subLoop : loop.getSubLoops()) {
            preOrderTraverseLoops(subLoop, result);
        }
    }
}
