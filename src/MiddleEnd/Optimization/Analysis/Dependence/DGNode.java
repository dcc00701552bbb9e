package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.Instructions.Instruction;

import java.util.ArrayList;
import java.util.List;

/**
 * 依赖图节点，对应循环中的一条指令
 */
public class DGNode {
    private final Instruction value;
    private final OperationKind kind;
    private final List<DGEdge> incomingEdges = new ArrayList<>();
    private final List<DGEdge> outgoingEdges = new ArrayList<>();

    public DGNode(Instruction value) {
        this.value = value;
        this.kind = OperationKind.of(value);
    }

    public Instruction getValue() {
        return value;
    }

    public OperationKind getKind() {
        return kind;
    }

    public List<DGEdge> getIncomingEdges() {
        return incomingEdges;
    }

    public List<DGEdge> getOutgoingEdges() {
        return outgoingEdges;
    }

    void addIncomingEdge(DGEdge edge) {
        incomingEdges.add(edge);
    }

    void addOutgoingEdge(DGEdge edge) {
        outgoingEdges.add(edge);
    }

    @Override
    public String toString() {
        return value.getName() + "(" + kind + ")";
    }
}
