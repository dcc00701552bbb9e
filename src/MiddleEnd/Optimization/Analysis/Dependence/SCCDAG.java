package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * 强连通分量分解（Tarjan算法）
 * 将依赖图收缩为由SCC组成的有向无环图
 */
public class SCCDAG {

    private static final Logger logger = LogManager.getLogger(SCCDAG.class);

    private final LoopDependenceGraph graph;
    private final List<SCC> sccs = new ArrayList<>();
    private final Map<Value, SCC> valueToSCC = new HashMap<>();

    // Tarjan状态
    private final Map<DGNode, Integer> positions = new HashMap<>();
    private final Map<DGNode, Integer> indices = new HashMap<>();
    private final Map<DGNode, Integer> lowLinks = new HashMap<>();
    private final Deque<DGNode> stack = new ArrayDeque<>();
    private final Set<DGNode> onStack = new HashSet<>();
    private int nextIndex = 0;

    private SCCDAG(LoopDependenceGraph graph) {
        this.graph = graph;
    }

    public static SCCDAG build(LoopDependenceGraph graph) {
        SCCDAG sccdag = new SCCDAG(graph);
        for (DGNode node : graph.getNodes()) {
            sccdag.positions.put(node, sccdag.positions.size());
        }
        for (DGNode node : graph.getNodes()) {
            if (!sccdag.indices.containsKey(node)) {
                sccdag.strongConnect(node);
            }
        }
        sccdag.positions.clear();
        sccdag.indices.clear();
        sccdag.lowLinks.clear();

        logger.debug("{} 分解为 {} 个强连通分量", graph.getLoop(), sccdag.sccs.size());
        return sccdag;
    }

    /**
     * 非递归的Tarjan：用显式栈保存每个节点尚未遍历的出边
     */
    private void strongConnect(DGNode root) {
        Deque<DGNode> callStack = new ArrayDeque<>();
        Deque<Iterator<DGEdge>> edgeIterators = new ArrayDeque<>();
        visit(root, callStack, edgeIterators);

        while (!callStack.isEmpty()) {
            DGNode node = callStack.peek();
            Iterator<DGEdge> iterator = edgeIterators.peek();

            if (iterator.hasNext()) {
                DGNode target = iterator.next().getTarget();
                if (!indices.containsKey(target)) {
                    visit(target, callStack, edgeIterators);
                } else if (onStack.contains(target)) {
                    lowLinks.put(node, Math.min(lowLinks.get(node), indices.get(target)));
                }
                continue;
            }

            callStack.pop();
            edgeIterators.pop();
            if (lowLinks.get(node).equals(indices.get(node))) {
                popComponent(node);
            }
            if (!callStack.isEmpty()) {
                DGNode parent = callStack.peek();
                lowLinks.put(parent, Math.min(lowLinks.get(parent), lowLinks.get(node)));
            }
        }
    }

    private void visit(DGNode node, Deque<DGNode> callStack, Deque<Iterator<DGEdge>> edgeIterators) {
        indices.put(node, nextIndex);
        lowLinks.put(node, nextIndex);
        nextIndex++;
        stack.push(node);
        onStack.add(node);
        callStack.push(node);
        edgeIterators.push(node.getOutgoingEdges().iterator());
    }

    private void popComponent(DGNode root) {
        List<DGNode> members = new ArrayList<>();
        DGNode member;
        do {
            member = stack.pop();
            onStack.remove(member);
            members.add(member);
        } while (member != root);

        // 分量内节点保持依赖图中的顺序
        members.sort(Comparator.comparingInt(positions::get));
        SCC scc = new SCC();
        for (DGNode node : members) {
            scc.addNode(node);
            valueToSCC.put(node.getValue(), scc);
        }
        sccs.add(scc);
    }

    /**
     * value所在的强连通分量，不在图中时返回null
     */
    public SCC sccOfValue(Value value) {
        return valueToSCC.get(value);
    }

    public List<SCC> getSCCs() {
        return sccs;
    }

    public LoopDependenceGraph getGraph() {
        return graph;
    }
}
