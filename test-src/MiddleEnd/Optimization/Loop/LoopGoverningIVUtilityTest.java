package MiddleEnd.Optimization.Loop;

import static org.junit.Assert.*;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Type.PointerType;
import MiddleEnd.IR.Value.Argument;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.Instructions.BinaryInstruction;
import MiddleEnd.IR.Value.Instructions.BranchInstruction;
import MiddleEnd.IR.Value.Instructions.CompareInstruction;
import MiddleEnd.IR.Value.Instructions.Instruction;
import MiddleEnd.IR.Value.Instructions.LoadInstruction;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class LoopGoverningIVUtilityTest {

  private static LoopGoverningIVUtility utilityFor(LoopFixtures f) {
    InductionVariables ivs = f.inductionVariables();
    InductionVariable iv = ivs.getLoopGoverningInductionVariable(f.loop());
    assertNotNull(iv);
    return new LoopGoverningIVUtility(iv, ivs.getLoopGoverningAttribution(f.loop()));
  }

  private static LoopGoverningIVUtility utilityFor(OpCode predicate, boolean ivOnLeft, boolean exitsOnTrue, long step) {
    return utilityFor(LoopFixtures.countedLoop(predicate, ivOnLeft, exitsOnTrue, step));
  }

  @Test
  public void testWhileLessThan() {
    // while (i < n): 条件为假时退出，退出谓词为 i >= n
    LoopGoverningIVUtility utility = utilityFor(OpCode.SLT, true, false, 1);
    assertEquals(OpCode.SGE, utility.getNonStrictPredicate());
    assertFalse(utility.shouldFlipOperands());
  }

  @Test
  public void testWhileGreaterThanWithIVOnRight() {
    // while (n > i): 取反得 n <= i，交换操作数得 i >= n
    LoopGoverningIVUtility utility = utilityFor(OpCode.SGT, false, false, 1);
    assertEquals(OpCode.SGE, utility.getNonStrictPredicate());
    assertTrue(utility.shouldFlipOperands());
  }

  @Test
  public void testEqualityIsPromotedToRange() {
    assertEquals(OpCode.UGE, utilityFor(OpCode.EQ, true, true, 1).getNonStrictPredicate());
    assertEquals(OpCode.ULE, utilityFor(OpCode.EQ, true, true, -1).getNonStrictPredicate());
    // while (i != n) 退出条件为 i == n
    assertEquals(OpCode.UGE, utilityFor(OpCode.NE, true, false, 2).getNonStrictPredicate());
  }

  @Test
  public void testNotEqualIsKept() {
    LoopGoverningIVUtility utility = utilityFor(OpCode.NE, false, true, 1);
    assertEquals(OpCode.NE, utility.getNonStrictPredicate());
    assertTrue(utility.shouldFlipOperands());
  }

  @Test
  public void testDecreasingLoops() {
    // while (i > n) { i = i - 1; }
    assertEquals(OpCode.SLE, utilityFor(OpCode.SGT, true, false, -1).getNonStrictPredicate());
    // while (i >= n) 无符号
    assertEquals(OpCode.ULT, utilityFor(OpCode.UGE, true, false, -1).getNonStrictPredicate());
    // 条件为真时退出: if (i <= n) break;
    assertEquals(OpCode.SLE, utilityFor(OpCode.SLE, true, true, -3).getNonStrictPredicate());
  }

  @Test
  public void testIncreasingLoopsExitingOnTrue() {
    assertEquals(OpCode.UGT, utilityFor(OpCode.UGT, true, true, 1).getNonStrictPredicate());
    assertEquals(OpCode.SGE, utilityFor(OpCode.SLE, false, true, 4).getNonStrictPredicate());
  }

  @Test(expected = InvariantViolationException.class)
  public void testLessThanExitWithPositiveStep() {
    utilityFor(OpCode.SLT, true, true, 1);
  }

  @Test(expected = InvariantViolationException.class)
  public void testGreaterThanExitWithNegativeStep() {
    utilityFor(OpCode.SLT, true, false, -1);
  }

  @Test
  public void testToNonStrictPredicateTable() {
    OpCode[] lessThan = {OpCode.SLT, OpCode.SLE, OpCode.ULT, OpCode.ULE};
    OpCode[] greaterThan = {OpCode.SGT, OpCode.SGE, OpCode.UGT, OpCode.UGE};
    for (OpCode predicate : lessThan) {
      assertEquals(predicate, LoopGoverningIVUtility.toNonStrictPredicate(predicate, false));
      try {
        LoopGoverningIVUtility.toNonStrictPredicate(predicate, true);
        fail("expected failure for " + predicate);
      } catch (InvariantViolationException expected) {
        assertNotNull(expected.getMessage());
      }
    }
    for (OpCode predicate : greaterThan) {
      assertEquals(predicate, LoopGoverningIVUtility.toNonStrictPredicate(predicate, true));
      try {
        LoopGoverningIVUtility.toNonStrictPredicate(predicate, false);
        fail("expected failure for " + predicate);
      } catch (InvariantViolationException expected) {
        assertNotNull(expected.getMessage());
      }
    }
    assertEquals(OpCode.NE, LoopGoverningIVUtility.toNonStrictPredicate(OpCode.NE, true));
    assertEquals(OpCode.NE, LoopGoverningIVUtility.toNonStrictPredicate(OpCode.NE, false));
    assertEquals(OpCode.UGE, LoopGoverningIVUtility.toNonStrictPredicate(OpCode.EQ, true));
    assertEquals(OpCode.ULE, LoopGoverningIVUtility.toNonStrictPredicate(OpCode.EQ, false));
  }

  @Test(expected = InvariantViolationException.class)
  public void testRejectsIllFormedAttribution() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    InductionVariable iv = f.inductionVariables().getInductionVariables(f.loop()).get(0);
    LoopGoverningIVAttribution attribution = new LoopGoverningIVAttribution(iv, iv.getSCC(),
        Collections.<BasicBlock>emptyList());
    new LoopGoverningIVUtility(iv, attribution);
  }

  @Test
  public void testUpdateConditionAndBranch() {
    LoopFixtures f = LoopFixtures.countedLoop(OpCode.SGT, false, false, 1);
    LoopGoverningIVUtility utility = utilityFor(f);

    utility.updateConditionAndBranchToCatchIteratingPastExitValue(f.cmp, f.br, f.exit);

    assertSame(f.iv, f.cmp.getLeft());
    assertSame(f.n, f.cmp.getRight());
    assertEquals(OpCode.SGE, f.cmp.getPredicate());
    assertSame(f.exit, f.br.getSuccessor(0));
    assertSame(f.body, f.br.getSuccessor(1));
    assertTrue(f.header.getSuccessors().contains(f.exit));
    assertTrue(f.header.getSuccessors().contains(f.body));
  }

  @Test
  public void testUpdateLeavesExitFirstBranchAlone() {
    LoopFixtures f = LoopFixtures.countedLoop(OpCode.EQ, true, true, 1);
    LoopGoverningIVUtility utility = utilityFor(f);

    utility.updateConditionAndBranchToCatchIteratingPastExitValue(f.cmp, f.br, f.exit);

    assertSame(f.iv, f.cmp.getLeft());
    assertEquals(OpCode.UGE, f.cmp.getPredicate());
    assertSame(f.exit, f.br.getSuccessor(0));
    assertSame(f.body, f.br.getSuccessor(1));
  }

  @Test
  public void testCloneConditionalCheck() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    LoopGoverningIVUtility utility = utilityFor(f);

    BasicBlock cloneBlock = IRBuilder.createBasicBlock("clone", f.function);
    BasicBlock continueBlock = IRBuilder.createBasicBlock("continue", f.function);
    Argument clonedBound = IRBuilder.createArgument("n2", IntegerType.I32, f.function);

    utility.cloneConditionalCheckFor(f.next, clonedBound, continueBlock, f.exit, cloneBlock);

    assertEquals(2, cloneBlock.getInstructions().size());
    CompareInstruction cmp = (CompareInstruction) cloneBlock.getInstructions().get(0);
    assertEquals(OpCode.SGE, cmp.getPredicate());
    assertSame(f.next, cmp.getLeft());
    assertSame(clonedBound, cmp.getRight());
    BranchInstruction br = (BranchInstruction) cloneBlock.getTerminator();
    assertSame(cmp, br.getCondition());
    assertSame(f.exit, br.getSuccessor(0));
    assertSame(continueBlock, br.getSuccessor(1));
  }

  @Test
  public void testOrderedConditionDerivation() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    Argument p = IRBuilder.createArgument("p", PointerType.INT32_PTR, f.function);
    LoadInstruction first = new LoadInstruction(p, "first");
    first.insertBefore(f.cmp);
    LoadInstruction second = new LoadInstruction(p, "second");
    second.insertBefore(f.cmp);
    BinaryInstruction bound = IRBuilder.createBinaryInstBefore(OpCode.ADD, second, first, f.cmp);
    f.cmp.setOperand(1, bound);

    LoopGoverningIVUtility utility = utilityFor(f);

    assertEquals(Arrays.<Instruction>asList(first, second, bound),
        utility.getConditionValueOrderedDerivation());
    assertEquals(3, utility.getAttribution().getConditionValueDerivation().size());
  }
}
