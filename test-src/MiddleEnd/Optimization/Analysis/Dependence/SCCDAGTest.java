package MiddleEnd.Optimization.Analysis.Dependence;

import static org.junit.Assert.*;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Type.PointerType;
import MiddleEnd.IR.Type.VoidType;
import MiddleEnd.IR.Value.Argument;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Function;
import MiddleEnd.IR.Value.Instructions.BinaryInstruction;
import MiddleEnd.IR.Value.Instructions.CompareInstruction;
import MiddleEnd.IR.Value.Instructions.GetElementPtrInstruction;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Value;
import MiddleEnd.Optimization.Analysis.Loop;
import MiddleEnd.Optimization.Analysis.LoopAnalysis;
import MiddleEnd.Optimization.Loop.LoopFixtures;
import org.junit.Test;

public class SCCDAGTest {

  @Test
  public void testOperationKinds() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    LoopDependenceGraph graph = new LoopDependenceGraph(f.loop());

    assertEquals(OperationKind.MERGE, graph.fetchNode(f.iv).getKind());
    assertEquals(OperationKind.COMPARISON, graph.fetchNode(f.cmp).getKind());
    assertEquals(OperationKind.CONDITIONAL_BRANCH, graph.fetchNode(f.br).getKind());
    assertEquals(OperationKind.OTHER, graph.fetchNode(f.next).getKind());
    assertEquals(OperationKind.UNCONDITIONAL_BRANCH, graph.fetchNode(f.body.getTerminator()).getKind());
    assertNull(graph.fetchNode(f.exit.getTerminator()));
  }

  @Test
  public void testAddressComputationKind() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    Argument base = IRBuilder.createArgument("a", PointerType.INT32_PTR, f.function);
    GetElementPtrInstruction address = new GetElementPtrInstruction(base, f.iv, "addr");
    address.insertBefore(f.body.getTerminator());

    LoopDependenceGraph graph = new LoopDependenceGraph(f.loop());
    assertEquals(OperationKind.POINTER_COMPUTATION, graph.fetchNode(address).getKind());
    assertNotSame(f.sccdag().sccOfValue(f.iv), f.sccdag().sccOfValue(address));
  }

  @Test
  public void testDataAndControlEdges() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    LoopDependenceGraph graph = new LoopDependenceGraph(f.loop());

    DGNode next = graph.fetchNode(f.next);
    boolean dataFromPhi = false;
    boolean controlFromHeaderBranch = false;
    for (DGEdge edge : next.getIncomingEdges()) {
      if (edge.isDataDependence() && edge.getSourceValue() == f.iv) {
        dataFromPhi = true;
      }
      if (edge.isControlDependence() && edge.getSourceValue() == f.br) {
        controlFromHeaderBranch = true;
      }
    }
    assertTrue(dataFromPhi);
    assertTrue(controlFromHeaderBranch);

    // 循环头自身也控制依赖于头部的条件跳转
    boolean headerControlled = false;
    for (DGEdge edge : graph.fetchNode(f.iv).getIncomingEdges()) {
      if (edge.isControlDependence() && edge.getSourceValue() == f.br) {
        headerControlled = true;
      }
    }
    assertTrue(headerControlled);
  }

  @Test
  public void testRecurrenceFormsOneComponent() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    SCCDAG sccdag = f.sccdag();

    SCC scc = sccdag.sccOfValue(f.iv);
    assertNotNull(scc);
    assertEquals(4, scc.size());
    assertTrue(scc.isInternal(f.next));
    assertTrue(scc.isInternal(f.cmp));
    assertTrue(scc.isInternal(f.br));
    assertFalse(scc.isInternal(f.n));
    assertTrue(scc.hasCycle());
    assertSame(scc, sccdag.sccOfValue(f.next));

    Instruction bodyBranch = f.body.getTerminator();
    SCC branchScc = sccdag.sccOfValue(bodyBranch);
    assertNotSame(scc, branchScc);
    assertEquals(1, branchScc.size());
    assertFalse(branchScc.hasCycle());
  }

  @Test
  public void testInternalNodesFollowGraphOrder() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    SCC scc = f.sccdag().sccOfValue(f.iv);

    Instruction[] expected = {f.iv, f.cmp, f.br, f.next};
    int index = 0;
    for (DGNode node : scc.getInternalNodes()) {
      assertSame(expected[index++], node.getValue());
    }
    assertNull(scc.fetchNode(f.n));
  }

  @Test
  public void testEveryInstructionHasAComponent() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    SCCDAG sccdag = f.sccdag();

    int total = 0;
    for (SCC scc : sccdag.getSCCs()) {
      total += scc.size();
    }
    assertEquals(sccdag.getGraph().getNodes().size(), total);
    assertEquals(5, total);
  }

  @Test
  public void testLongDependenceChain() {
    // while (i < n) { m = i * 3 * 3 * ... ; i = i + 1; }
    int length = 20000;
    Module module = IRBuilder.createModule("chain");
    Function function = IRBuilder.createFunction("chain", VoidType.VOID, module);
    Argument n = IRBuilder.createArgument("n", IntegerType.I32, function);
    BasicBlock entry = IRBuilder.createBasicBlock("entry", function);
    BasicBlock header = IRBuilder.createBasicBlock("header", function);
    BasicBlock body = IRBuilder.createBasicBlock("body", function);
    BasicBlock exit = IRBuilder.createBasicBlock("exit", function);

    IRBuilder.createBr(header, entry);
    PhiInstruction i = IRBuilder.createPhi(IntegerType.I32, header);
    CompareInstruction cmp = IRBuilder.createICmp(OpCode.SLT, i, n, header);
    IRBuilder.createCondBr(cmp, body, exit, header);
    Value product = i;
    for (int k = 0; k < length; k++) {
      product = IRBuilder.createBinaryInst(OpCode.MUL, product, IRBuilder.createConstantInt(3), body);
    }
    BinaryInstruction next = IRBuilder.createBinaryInst(OpCode.ADD, i, IRBuilder.createConstantInt(1), body);
    IRBuilder.createBr(header, body);
    IRBuilder.createReturn(exit);
    i.addIncoming(IRBuilder.createConstantInt(0), entry);
    i.addIncoming(next, body);

    Loop loop = LoopAnalysis.analyzeLoops(function).get(0);
    SCCDAG sccdag = SCCDAG.build(new LoopDependenceGraph(loop));

    // 归纳变量的环 + 每个乘法各自一个 + 循环体末尾的跳转
    assertEquals(length + 2, sccdag.getSCCs().size());
    SCC ivScc = sccdag.sccOfValue(i);
    assertEquals(4, ivScc.size());
    assertTrue(ivScc.isInternal(next));
    assertEquals(1, sccdag.sccOfValue(product).size());
    assertNotSame(ivScc, sccdag.sccOfValue(product));
  }
}
