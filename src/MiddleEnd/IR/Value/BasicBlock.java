package MiddleEnd.IR.Value;

import MiddleEnd.IR.Type.LabelType;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Instructions.TerminatorInstruction;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

public class BasicBlock extends Value {
    private final LinkedList<Instruction> instructions = new LinkedList<>();
    private final List<BasicBlock> predecessors = new ArrayList<>();
    private final List<BasicBlock> successors = new ArrayList<>();
    private final Function parentFunction;

    private BasicBlock idominator = null;   // 直接支配者
    private BasicBlock ipostdominator = null; // 直接后支配者

    public BasicBlock(String name, Function function) {
        super(name, LabelType.LABEL);
        this.parentFunction = function;
        function.addBasicBlock(this);
    }

    public Function getParentFunction() {
        return parentFunction;
    }

    public void addInstruction(Instruction instruction) {
        instructions.add(instruction);
        instruction.setParent(this);
    }

    public void addInstructionBefore(Instruction newInst, Instruction before) {
        int index = instructions.indexOf(before);
        if (index != -1) {
            instructions.add(index, newInst);
            newInst.setParent(this);
        } else {
            addInstruction(newInst);
        }
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<PhiInstruction> getPhiInstructions() {
        List<PhiInstruction> phiInsts = new ArrayList<>();
        for (Instruction inst : instructions) {
            if (inst instanceof PhiInstruction) {
                phiInsts.add((PhiInstruction) inst);
            } else {
                break;
            }
        }
        return phiInsts;
    }

    /**
     * 第一条非phi指令，块内只有phi时返回null
     */
    public Instruction getFirstNonPhi() {
        for (Instruction inst : instructions) {
            if (!(inst instanceof PhiInstruction)) {
                return inst;
            }
        }
        return null;
    }

    public Instruction getLastInstruction() {
        if (instructions.isEmpty()) {
            return null;
        }
        return instructions.getLast();
    }

    public Instruction getTerminator() {
        Instruction last = getLastInstruction();
        if (last instanceof TerminatorInstruction) {
            return last;
        }
        return null;
    }

    public void addSuccessor(BasicBlock block) {
        if (!successors.contains(block)) {
            successors.add(block);
        }
        if (!block.predecessors.contains(this)) {
            block.predecessors.add(this);
        }
    }

    public void removeSuccessor(BasicBlock block) {
        successors.remove(block);
        block.predecessors.remove(this);
    }

    public List<BasicBlock> getSuccessors() {
        return successors;
    }

    public List<BasicBlock> getPredecessors() {
        return predecessors;
    }

    public BasicBlock getIdominator() {
        return idominator;
    }

    public void setIdominator(BasicBlock idom) {
        this.idominator = idom;
    }

    public BasicBlock getIpostdominator() {
        return ipostdominator;
    }

    public void setIpostdominator(BasicBlock ipdom) {
        this.ipostdominator = ipdom;
    }

    @Override
    public String toString() {
        return getName() + ":";
    }
}
