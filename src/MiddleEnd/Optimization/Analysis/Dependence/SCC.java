package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.Value;

import java.util.*;

/**
 * 依赖图中的一个强连通分量
 */
public class SCC {
    private final Map<Value, DGNode> internalNodes = new LinkedHashMap<>();

    void addNode(DGNode node) {
        internalNodes.put(node.getValue(), node);
    }

    public boolean isInternal(Value value) {
        return internalNodes.containsKey(value);
    }

    /**
     * 分量内value对应的节点，不在分量内时返回null
     */
    public DGNode fetchNode(Value value) {
        return internalNodes.get(value);
    }

    /**
     * 分量内的节点，按依赖图中的节点顺序
     */
    public Collection<DGNode> getInternalNodes() {
        return internalNodes.values();
    }

    public int size() {
        return internalNodes.size();
    }

    /**
     * 是否构成依赖环：多于一个节点，或单个节点依赖自身
     */
    public boolean hasCycle() {
        if (internalNodes.size() > 1) {
            return true;
        }
        for (DGNode node : internalNodes.values()) {
            for (DGEdge edge : node.getIncomingEdges()) {
                if (edge.getSource() == node) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SCC{");
        boolean first = true;
        for (Value value : internalNodes.keySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(value.getName());
            first = false;
        }
        return sb.append("}").toString();
    }
}
