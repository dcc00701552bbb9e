package MiddleEnd.IR;

import MiddleEnd.IR.Type.*;
import MiddleEnd.IR.Value.*;
import MiddleEnd.IR.Value.Instructions.*;

/**
 * IR构建工具，所有create*方法要么追加到基本块末尾，要么插入到指定指令之前
 */
public class IRBuilder {
    private static int tmpCounter = 0;

    public static Module createModule(String name) {
        return new Module(name);
    }

    public static Function createFunction(String name, Type returnType, Module module) {
        Function function = new Function(name, returnType);
        module.addFunction(function);
        return function;
    }

    public static Function createExternalFunction(String name, Type returnType, Module module) {
        Function function = new Function(name, returnType);
        function.setExternal(true);
        module.addFunction(function);
        return function;
    }

    public static Argument createArgument(String name, Type type, Function function) {
        Argument arg = new Argument(name, type, function, function.getArguments().size());
        function.addArgument(arg);
        return arg;
    }

    public static BasicBlock createBasicBlock(String name, Function function) {
        return new BasicBlock(name, function);
    }

    public static ConstantInt createConstantInt(long value) {
        return new ConstantInt(value);
    }

    public static LoadInstruction createLoad(Value pointer, BasicBlock block) {
        LoadInstruction inst = new LoadInstruction(pointer, "load_" + tmpCounter++);
        block.addInstruction(inst);
        return inst;
    }

    public static GetElementPtrInstruction createGetElementPtr(Value pointer, Value offset, BasicBlock block) {
        GetElementPtrInstruction inst = new GetElementPtrInstruction(pointer, offset, "gep_" + tmpCounter++);
        block.addInstruction(inst);
        return inst;
    }

    public static BinaryInstruction createBinaryInstOnly(OpCode opCode, Value left, Value right) {
        if (!left.getType().equals(right.getType())) {
            throw new IllegalArgumentException("二元运算操作数类型不一致: " + left.getType() + " / " + right.getType());
        }
        String name = opCode.getName() + "_result_" + tmpCounter++;
        return new BinaryInstruction(opCode, left, right, left.getType(), name);
    }

    public static BinaryInstruction createBinaryInst(OpCode opCode, Value left, Value right, BasicBlock block) {
        BinaryInstruction inst = createBinaryInstOnly(opCode, left, right);
        block.addInstruction(inst);
        return inst;
    }

    public static BinaryInstruction createBinaryInstBefore(OpCode opCode, Value left, Value right, Instruction before) {
        BinaryInstruction inst = createBinaryInstOnly(opCode, left, right);
        inst.insertBefore(before);
        return inst;
    }

    public static CompareInstruction createICmpOnly(OpCode predicate, Value left, Value right) {
        if (!left.getType().equals(right.getType())) {
            throw new IllegalArgumentException("比较操作数类型不一致: " + left.getType() + " / " + right.getType());
        }
        return new CompareInstruction(predicate, left, right, "icmp_" + predicate.getName() + "_result_" + tmpCounter++);
    }

    public static CompareInstruction createICmp(OpCode predicate, Value left, Value right, BasicBlock block) {
        CompareInstruction inst = createICmpOnly(predicate, left, right);
        block.addInstruction(inst);
        return inst;
    }

    public static CompareInstruction createICmpBefore(OpCode predicate, Value left, Value right, Instruction before) {
        CompareInstruction inst = createICmpOnly(predicate, left, right);
        inst.insertBefore(before);
        return inst;
    }

    public static SelectInstruction createSelectBefore(Value condition, Value trueValue, Value falseValue,
                                                       String name, Instruction before) {
        SelectInstruction inst = new SelectInstruction(condition, trueValue, falseValue, name + "_" + tmpCounter++);
        inst.insertBefore(before);
        return inst;
    }

    /**
     * 在基本块已有的phi之后插入新的空phi，输入值由调用者添加
     */
    public static PhiInstruction createPhi(Type type, BasicBlock block) {
        PhiInstruction inst = new PhiInstruction(type, "phi_" + tmpCounter++);
        Instruction firstNonPhi = block.getFirstNonPhi();
        if (firstNonPhi != null) {
            block.addInstructionBefore(inst, firstNonPhi);
        } else {
            block.addInstruction(inst);
        }
        return inst;
    }

    public static ReturnInstruction createReturn(BasicBlock block) {
        ReturnInstruction inst = new ReturnInstruction();
        block.addInstruction(inst);
        return inst;
    }

    public static BranchInstruction createBr(BasicBlock target, BasicBlock block) {
        BranchInstruction inst = new BranchInstruction(target);
        block.addInstruction(inst);
        block.addSuccessor(target);
        return inst;
    }

    public static BranchInstruction createCondBr(Value condition, BasicBlock trueBlock, BasicBlock falseBlock, BasicBlock block) {
        if (!IntegerType.I1.equals(condition.getType())) {
            throw new IllegalArgumentException("条件跳转的条件必须是i1类型: " + condition.getType());
        }

        BranchInstruction inst = new BranchInstruction(condition, trueBlock, falseBlock);
        block.addInstruction(inst);
        block.addSuccessor(trueBlock);
        block.addSuccessor(falseBlock);
        return inst;
    }
}
