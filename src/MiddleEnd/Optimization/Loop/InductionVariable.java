package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.ConstantInt;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Value;
import MiddleEnd.Optimization.Analysis.Dependence.DGEdge;
import MiddleEnd.Optimization.Analysis.Dependence.DGNode;
import MiddleEnd.Optimization.Analysis.Dependence.SCC;
import MiddleEnd.Optimization.Analysis.Loop;
import MiddleEnd.Optimization.Analysis.Recurrence;

import java.util.*;

/**
 * 归纳变量：循环头phi + 其所在SCC中参与递推计算的全部指令
 * 只支持常量步长的加法递推
 */
public class InductionVariable {
    private final Loop loop;
    private final SCC scc;
    private final PhiInstruction headerPhi;

    private final Set<PhiInstruction> phis = new LinkedHashSet<>();
    private final Set<Instruction> accumulators = new LinkedHashSet<>();
    private final Set<Instruction> allInstructions = new LinkedHashSet<>();

    private Value startValue;
    private final ConstantInt stepValue;

    private InductionVariable(Loop loop, SCC scc, PhiInstruction headerPhi, ConstantInt stepValue) {
        this.loop = loop;
        this.scc = scc;
        this.headerPhi = headerPhi;
        this.stepValue = stepValue;
    }

    /**
     * 根据递推结果创建归纳变量，步长不是常量时返回null
     */
    public static InductionVariable create(Loop loop, Recurrence recurrence, PhiInstruction headerPhi, SCC scc) {
        if (!recurrence.isConstantStep() || !(recurrence.getStep() instanceof ConstantInt step)) {
            return null;
        }

        InductionVariable iv = new InductionVariable(loop, scc, headerPhi, step);
        iv.collectMembers();
        iv.findStartValue();
        return iv;
    }

    /**
     * 从phi出发，沿SCC内部的数据依赖边反向广度优先遍历
     */
    private void collectMembers() {
        Deque<DGNode> workList = new ArrayDeque<>();
        Set<Value> visited = new HashSet<>();
        workList.add(scc.fetchNode(headerPhi));

        while (!workList.isEmpty()) {
            DGNode node = workList.poll();
            Instruction value = node.getValue();
            if (!visited.add(value)) {
                continue;
            }

            if (value instanceof PhiInstruction phi) {
                phis.add(phi);
            } else {
                accumulators.add(value);
            }
            allInstructions.add(value);

            for (DGEdge edge : node.getIncomingEdges()) {
                if (!edge.isDataDependence() || !scc.isInternal(edge.getSourceValue())) {
                    continue;
                }
                workList.add(edge.getSource());
            }
        }
    }

    private void findStartValue() {
        for (int i = 0; i < headerPhi.getNumIncomingValues(); i++) {
            BasicBlock incomingBlock = headerPhi.getIncomingBlock(i);
            if (!loop.contains(incomingBlock)) {
                startValue = headerPhi.getIncomingValue(i);
                break;
            }
        }
    }

    public Loop getLoop() {
        return loop;
    }

    public SCC getSCC() {
        return scc;
    }

    public PhiInstruction getHeaderPhi() {
        return headerPhi;
    }

    public Set<PhiInstruction> getPhis() {
        return Collections.unmodifiableSet(phis);
    }

    public Set<Instruction> getAccumulators() {
        return Collections.unmodifiableSet(accumulators);
    }

    public Set<Instruction> getAllInstructions() {
        return Collections.unmodifiableSet(allInstructions);
    }

    public boolean isMember(Value value) {
        return allInstructions.contains(value);
    }

    public Value getStartValue() {
        return startValue;
    }

    public ConstantInt getStepValue() {
        return stepValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InductionVariable other)) return false;
        return headerPhi == other.headerPhi
                && allInstructions.equals(other.allInstructions)
                && startValue == other.startValue
                && stepValue.getValue() == other.stepValue.getValue();
    }

    @Override
    public int hashCode() {
        return Objects.hash(headerPhi, allInstructions, stepValue.getValue());
    }

    @Override
    public String toString() {
        return "IV[" + headerPhi.getName() + ", start=" + (startValue == null ? "?" : startValue.getName())
                + ", step=" + stepValue.getValue() + ", members=" + allInstructions.size() + "]";
    }
}
