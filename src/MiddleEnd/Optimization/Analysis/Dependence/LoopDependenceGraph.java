package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Function;
import MiddleEnd.IR.Value.Instructions.BranchInstruction;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Value;
import MiddleEnd.Optimization.Analysis.DominatorAnalysis;
import MiddleEnd.Optimization.Analysis.Loop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 循环依赖图
 * 节点是循环内的全部指令（按函数中的块顺序、块内指令顺序），
 * 边包括循环内的数据依赖和控制依赖
 */
public class LoopDependenceGraph {

    private static final Logger logger = LogManager.getLogger(LoopDependenceGraph.class);

    private final Loop loop;
    private final Map<Value, DGNode> nodes = new LinkedHashMap<>();
    private final List<DGEdge> edges = new ArrayList<>();

    public LoopDependenceGraph(Loop loop) {
        this.loop = loop;

        for (BasicBlock block : loop.getBlocksInLayoutOrder()) {
            for (Instruction inst : block.getInstructions()) {
                nodes.put(inst, new DGNode(inst));
            }
        }

        addDataDependences();
        addControlDependences();

        logger.debug("{} 的依赖图: {} 个节点, {} 条边", loop, nodes.size(), edges.size());
    }

    private void addDataDependences() {
        for (DGNode node : nodes.values()) {
            Set<Value> seen = new HashSet<>();
            for (Value operand : node.getValue().getOperands()) {
                DGNode source = nodes.get(operand);
                if (source != null && seen.add(operand)) {
                    addEdge(source, node, DependenceKind.DATA);
                }
            }
        }
    }

    /**
     * 控制依赖：对CFG边 A->S，若S不后支配A，则从S沿后支配树向上直到ipdom(A)，
     * 途经的块都控制依赖于A的条件跳转
     */
    private void addControlDependences() {
        Function function = loop.getHeader().getParentFunction();
        Map<BasicBlock, Set<BasicBlock>> postDominators = DominatorAnalysis.computePostDominators(function);
        DominatorAnalysis.computePostDominatorTree(function, postDominators);

        for (BasicBlock block : loop.getBlocksInLayoutOrder()) {
            if (!(block.getTerminator() instanceof BranchInstruction br) || br.isUnconditional()) {
                continue;
            }
            DGNode branchNode = nodes.get(br);

            Set<BasicBlock> dependents = new LinkedHashSet<>();
            for (BasicBlock successor : block.getSuccessors()) {
                if (postDominators.get(block).contains(successor)) {
                    continue;
                }
                BasicBlock runner = successor;
                while (runner != null && runner != block.getIpostdominator()) {
                    dependents.add(runner);
                    runner = runner.getIpostdominator();
                }
            }

            for (BasicBlock dependent : dependents) {
                if (!loop.contains(dependent)) {
                    continue;
                }
                for (Instruction inst : dependent.getInstructions()) {
                    addEdge(branchNode, nodes.get(inst), DependenceKind.CONTROL);
                }
            }
        }
    }

    private void addEdge(DGNode source, DGNode target, DependenceKind kind) {
        DGEdge edge = new DGEdge(source, target, kind);
        source.addOutgoingEdge(edge);
        target.addIncomingEdge(edge);
        edges.add(edge);
    }

    public Loop getLoop() {
        return loop;
    }

    public DGNode fetchNode(Value value) {
        return nodes.get(value);
    }

    public Collection<DGNode> getNodes() {
        return nodes.values();
    }

    public List<DGEdge> getEdges() {
        return edges;
    }
}
