package MiddleEnd.Optimization.Analysis;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Value;

import java.util.*;

/**
 * 表示一个自然循环的数据结构
 */
public class Loop {
    private final BasicBlock header;

    private final Set<BasicBlock> blocks;

    private final List<Loop> subLoops;

    private Loop parentLoop;

    private final List<BasicBlock> latchBlocks;

    private final List<BasicBlock> exitBlocks;

    private int depth;

    public Loop(BasicBlock header) {
        this.header = header;
        this.blocks = new LinkedHashSet<>();
        this.subLoops = new ArrayList<>();
        this.latchBlocks = new ArrayList<>();
        this.exitBlocks = new ArrayList<>();
        this.parentLoop = null;
        this.depth = 0;
    }

    public void addBlock(BasicBlock block) {
        blocks.add(block);
    }

    public void addSubLoop(Loop subLoop) {
        subLoops.add(subLoop);
        subLoop.parentLoop = this;
        subLoop.updateDepth();
    }

    public void addLatchBlock(BasicBlock latch) {
        if (!latchBlocks.contains(latch)) {
            latchBlocks.add(latch);
        }
    }

    /**
     * 计算循环出口块：循环外、且是某个循环块的后继，按函数中的块顺序排列
     */
    public void computeExitBlocks() {
        exitBlocks.clear();
        for (BasicBlock candidate : header.getParentFunction().getBasicBlocks()) {
            if (blocks.contains(candidate)) {
                continue;
            }
            for (BasicBlock pred : candidate.getPredecessors()) {
                if (blocks.contains(pred)) {
                    exitBlocks.add(candidate);
                    break;
                }
            }
        }
    }

    private void updateDepth() {
        if (parentLoop != null) {
            depth = parentLoop.depth + 1;
        }
        for (Loop subLoop : subLoops) {
            subLoop.updateDepth();
        }
    }

    public boolean contains(BasicBlock block) {
        return blocks.contains(block);
    }

    public boolean contains(Instruction inst) {
        return inst.getParent() != null && contains(inst.getParent());
    }

    /**
     * 值是否在循环内定义；常量、参数以及循环外的指令都不在循环内
     */
    public boolean isDefinedInside(Value value) {
        return value instanceof Instruction inst && contains(inst);
    }

    public BasicBlock getHeader() {
        return header;
    }

    /**
     * 循环包含的基本块，按函数中的块顺序排列
     */
    public List<BasicBlock> getBlocksInLayoutOrder() {
        List<BasicBlock> ordered = new ArrayList<>();
        for (BasicBlock block : header.getParentFunction().getBasicBlocks()) {
            if (blocks.contains(block)) {
                ordered.add(block);
            }
        }
        return ordered;
    }

    public Set<BasicBlock> getBlocks() {
        return blocks;
    }

    public List<Loop> getSubLoops() {
        return subLoops;
    }

    public Loop getParentLoop() {
        return parentLoop;
    }

    public List<BasicBlock> getLatchBlocks() {
        return latchBlocks;
    }

    public List<BasicBlock> getExitBlocks() {
        return exitBlocks;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * 获取循环的前置头块（如果存在）
     * 前置头块是循环头的唯一前驱（不包括回边）
     */
    public BasicBlock getPreheader() {
        List<BasicBlock> nonLatchPreds = new ArrayList<>();

        for (BasicBlock pred : header.getPredecessors()) {
            if (!latchBlocks.contains(pred)) {
                nonLatchPreds.add(pred);
            }
        }

        // 如果只有一个非回边前驱，它就是前置头
        if (nonLatchPreds.size() == 1) {
            return nonLatchPreds.get(0);
        }

        return null;
    }

    @Override
    public String toString() {
        return "Loop[header=" + header.getName() + ", blocks=" + blocks.size() + ", depth=" + depth + "]";
    }
}
