package MiddleEnd.Optimization.Loop;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Type.VoidType;
import MiddleEnd.IR.Value.*;
import MiddleEnd.IR.Value.Instructions.*;
import MiddleEnd.Optimization.Analysis.Dependence.LoopDependenceGraph;
import MiddleEnd.Optimization.Analysis.Dependence.SCCDAG;
import MiddleEnd.Optimization.Analysis.Loop;
import MiddleEnd.Optimization.Analysis.LoopAnalysis;

import java.util.Map;

/**
 * 测试用的单层计数循环
 *
 * <pre>
 * entry:  br header
 * header: i = phi [start, entry], [next, body]
 *         cmp = icmp pred i, n      (或 n, i)
 *         br cmp, exit, body        (或 body, exit)
 * body:   next = add i, step
 *         br header
 * exit:   ret
 * </pre>
 */
public class LoopFixtures {
    public final Module module;
    public final Function function;
    public final Argument n;
    public final BasicBlock entry;
    public final BasicBlock header;
    public final BasicBlock body;
    public final BasicBlock exit;
    public final PhiInstruction iv;
    public final BinaryInstruction next;
    public final CompareInstruction cmp;
    public final BranchInstruction br;

    private Loop loop;
    private SCCDAG sccdag;

    private LoopFixtures(OpCode predicate, boolean ivOnLeft, boolean exitsOnTrue, long step) {
        module = IRBuilder.createModule("test");
        function = IRBuilder.createFunction("loop", VoidType.VOID, module);
        n = IRBuilder.createArgument("n", IntegerType.I32, function);

        entry = IRBuilder.createBasicBlock("entry", function);
        header = IRBuilder.createBasicBlock("header", function);
        body = IRBuilder.createBasicBlock("body", function);
        exit = IRBuilder.createBasicBlock("exit", function);

        IRBuilder.createBr(header, entry);

        iv = IRBuilder.createPhi(IntegerType.I32, header);
        iv.setName("i");
        cmp = ivOnLeft
                ? IRBuilder.createICmp(predicate, iv, n, header)
                : IRBuilder.createICmp(predicate, n, iv, header);
        br = exitsOnTrue
                ? IRBuilder.createCondBr(cmp, exit, body, header)
                : IRBuilder.createCondBr(cmp, body, exit, header);

        next = IRBuilder.createBinaryInst(OpCode.ADD, iv, IRBuilder.createConstantInt(step), body);
        IRBuilder.createBr(header, body);

        iv.addIncoming(IRBuilder.createConstantInt(0), entry);
        iv.addIncoming(next, body);

        IRBuilder.createReturn(exit);
    }

    public static LoopFixtures countedLoop(OpCode predicate, boolean ivOnLeft, boolean exitsOnTrue, long step) {
        return new LoopFixtures(predicate, ivOnLeft, exitsOnTrue, step);
    }

    /**
     * i = 0; while (i < n) { i = i + 1; }
     */
    public static LoopFixtures lessThanLoop() {
        return countedLoop(OpCode.SLT, true, false, 1);
    }

    public Loop loop() {
        if (loop == null) {
            loop = LoopAnalysis.analyzeLoops(function).get(0);
        }
        return loop;
    }

    public SCCDAG sccdag() {
        if (sccdag == null) {
            sccdag = SCCDAG.build(new LoopDependenceGraph(loop()));
        }
        return sccdag;
    }

    public InductionVariables inductionVariables() {
        return new InductionVariables(loop(), sccdag());
    }

    /**
     * 两层嵌套循环
     *
     * <pre>
     * entry:      br outerH
     * outerH:     i = phi [0, entry], [i1, outerLatch]; br (i < n), innerPre, exit
     * innerPre:   br innerH
     * innerH:     j = phi [0, innerPre], [j1, innerBody]; br (j < n), innerBody, outerLatch
     * innerBody:  j1 = add j, 1; br innerH
     * outerLatch: i1 = add i, 1; br outerH
     * exit:       ret
     * </pre>
     */
    public static class NestedLoops {
        public final Module module;
        public final Function function;
        public final BasicBlock outerHeader;
        public final BasicBlock innerPreheader;
        public final BasicBlock innerHeader;
        public final BasicBlock innerBody;
        public final BasicBlock outerLatch;
        public final BasicBlock exit;
        public final PhiInstruction i;
        public final PhiInstruction j;

        public NestedLoops() {
            module = IRBuilder.createModule("nested");
            function = IRBuilder.createFunction("nested", VoidType.VOID, module);
            Argument n = IRBuilder.createArgument("n", IntegerType.I32, function);

            BasicBlock entry = IRBuilder.createBasicBlock("entry", function);
            outerHeader = IRBuilder.createBasicBlock("outerH", function);
            innerPreheader = IRBuilder.createBasicBlock("innerPre", function);
            innerHeader = IRBuilder.createBasicBlock("innerH", function);
            innerBody = IRBuilder.createBasicBlock("innerBody", function);
            outerLatch = IRBuilder.createBasicBlock("outerLatch", function);
            exit = IRBuilder.createBasicBlock("exit", function);

            IRBuilder.createBr(outerHeader, entry);

            i = IRBuilder.createPhi(IntegerType.I32, outerHeader);
            i.setName("i");
            CompareInstruction outerCmp = IRBuilder.createICmp(OpCode.SLT, i, n, outerHeader);
            IRBuilder.createCondBr(outerCmp, innerPreheader, exit, outerHeader);

            IRBuilder.createBr(innerHeader, innerPreheader);

            j = IRBuilder.createPhi(IntegerType.I32, innerHeader);
            j.setName("j");
            CompareInstruction innerCmp = IRBuilder.createICmp(OpCode.SLT, j, n, innerHeader);
            IRBuilder.createCondBr(innerCmp, innerBody, outerLatch, innerHeader);

            BinaryInstruction j1 = IRBuilder.createBinaryInst(OpCode.ADD, j, IRBuilder.createConstantInt(1), innerBody);
            IRBuilder.createBr(innerHeader, innerBody);

            BinaryInstruction i1 = IRBuilder.createBinaryInst(OpCode.ADD, i, IRBuilder.createConstantInt(1), outerLatch);
            IRBuilder.createBr(outerHeader, outerLatch);

            IRBuilder.createReturn(exit);

            i.addIncoming(IRBuilder.createConstantInt(0), entry);
            i.addIncoming(i1, outerLatch);
            j.addIncoming(IRBuilder.createConstantInt(0), innerPreheader);
            j.addIncoming(j1, innerBody);
        }
    }

    /**
     * 对测试中出现的少量指令求值
     */
    public static long evaluate(Value value, Map<Value, Long> env) {
        if (env.containsKey(value)) {
            return env.get(value);
        }
        if (value instanceof ConstantInt constant) {
            return constant.getValue();
        }
        if (value instanceof BinaryInstruction binary && binary.getOpCode() == OpCode.ADD) {
            return evaluate(binary.getLeft(), env) + evaluate(binary.getRight(), env);
        }
        if (value instanceof CompareInstruction compare && compare.getPredicate() == OpCode.EQ) {
            return evaluate(compare.getLeft(), env) == evaluate(compare.getRight(), env) ? 1 : 0;
        }
        if (value instanceof SelectInstruction select) {
            return evaluate(select.getCondition(), env) != 0
                    ? evaluate(select.getTrueValue(), env)
                    : evaluate(select.getFalseValue(), env);
        }
        throw new IllegalArgumentException("无法求值: " + value);
    }
}
