package MiddleEnd.Optimization.Analysis.Dependence;

import MiddleEnd.IR.Value.Value;

/**
 * 依赖边 source -> target，target依赖source
 */
public class DGEdge {
    private final DGNode source;
    private final DGNode target;
    private final DependenceKind kind;

    public DGEdge(DGNode source, DGNode target, DependenceKind kind) {
        this.source = source;
        this.target = target;
        this.kind = kind;
    }

    public DGNode getSource() {
        return source;
    }

    public DGNode getTarget() {
        return target;
    }

    public DependenceKind getKind() {
        return kind;
    }

    public boolean isDataDependence() {
        return kind == DependenceKind.DATA;
    }

    public boolean isControlDependence() {
        return kind == DependenceKind.CONTROL;
    }

    public Value getSourceValue() {
        return source.getValue();
    }

    @Override
    public String toString() {
        return source.getValue().getName() + " -" + kind + "-> " + target.getValue().getName();
    }
}
