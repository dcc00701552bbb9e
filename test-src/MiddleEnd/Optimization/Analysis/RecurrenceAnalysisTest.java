package MiddleEnd.Optimization.Analysis;

import static org.junit.Assert.*;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Type.IntegerType;
import MiddleEnd.IR.Type.VoidType;
import MiddleEnd.IR.Value.Argument;
import MiddleEnd.IR.Value.BasicBlock;
import MiddleEnd.IR.Value.ConstantInt;
import MiddleEnd.IR.Value.Function;
import MiddleEnd.IR.Value.Instructions.BinaryInstruction;
import MiddleEnd.IR.Value.Instructions.CompareInstruction;
import MiddleEnd.IR.Value.Instructions.PhiInstruction;
import MiddleEnd.IR.Value.Value;
import MiddleEnd.Optimization.Loop.LoopFixtures;
import org.junit.Test;

public class RecurrenceAnalysisTest {

  /**
   * header: i = phi [0, entry], [latchValue(i), body]; br (i < n), body, exit
   */
  private interface LatchValue {
    Value build(PhiInstruction i, Argument n, BasicBlock body);
  }

  private static final class Built {
    Function function;
    PhiInstruction phi;
    Loop loop;
  }

  private static Built build(LatchValue latchValue) {
    Module module = IRBuilder.createModule("rec");
    Function function = IRBuilder.createFunction("rec", VoidType.VOID, module);
    Argument n = IRBuilder.createArgument("n", IntegerType.I32, function);
    BasicBlock entry = IRBuilder.createBasicBlock("entry", function);
    BasicBlock header = IRBuilder.createBasicBlock("header", function);
    BasicBlock body = IRBuilder.createBasicBlock("body", function);
    BasicBlock exit = IRBuilder.createBasicBlock("exit", function);

    IRBuilder.createBr(header, entry);
    PhiInstruction i = IRBuilder.createPhi(IntegerType.I32, header);
    CompareInstruction cmp = IRBuilder.createICmp(OpCode.SLT, i, n, header);
    IRBuilder.createCondBr(cmp, body, exit, header);
    Value next = latchValue.build(i, n, body);
    IRBuilder.createBr(header, body);
    IRBuilder.createReturn(exit);
    i.addIncoming(IRBuilder.createConstantInt(3), entry);
    i.addIncoming(next, body);

    Built built = new Built();
    built.function = function;
    built.phi = i;
    built.loop = LoopAnalysis.analyzeLoops(function).get(0);
    return built;
  }

  @Test
  public void testConstantStep() {
    LoopFixtures f = LoopFixtures.countedLoop(OpCode.SLT, true, false, 4);
    Recurrence recurrence = RecurrenceAnalysis.getRecurrence(f.loop(), f.iv);

    assertNotNull(recurrence);
    assertEquals(Recurrence.Kind.ADDITIVE, recurrence.getKind());
    assertEquals(Recurrence.StepKind.CONSTANT, recurrence.getStepKind());
    assertEquals(4, ((ConstantInt) recurrence.getStep()).getValue());
    assertEquals(0, ((ConstantInt) recurrence.getStart()).getValue());
  }

  @Test
  public void testSubtractionChainIsFolded() {
    Built built = build((i, n, body) -> {
      BinaryInstruction a = IRBuilder.createBinaryInst(OpCode.ADD, i, IRBuilder.createConstantInt(5), body);
      return IRBuilder.createBinaryInst(OpCode.SUB, a, IRBuilder.createConstantInt(7), body);
    });
    Recurrence recurrence = RecurrenceAnalysis.getRecurrence(built.loop, built.phi);

    assertEquals(Recurrence.StepKind.CONSTANT, recurrence.getStepKind());
    assertEquals(-2, ((ConstantInt) recurrence.getStep()).getValue());
    assertEquals(3, ((ConstantInt) recurrence.getStart()).getValue());
  }

  @Test
  public void testZeroNetStepIsNotARecurrence() {
    Built plusZero = build((i, n, body) -> IRBuilder.createBinaryInst(OpCode.ADD, i, IRBuilder.createConstantInt(0), body));
    assertNull(RecurrenceAnalysis.getRecurrence(plusZero.loop, plusZero.phi));

    Built cancelled = build((i, n, body) -> {
      BinaryInstruction a = IRBuilder.createBinaryInst(OpCode.ADD, i, IRBuilder.createConstantInt(1), body);
      return IRBuilder.createBinaryInst(OpCode.SUB, a, IRBuilder.createConstantInt(1), body);
    });
    assertNull(RecurrenceAnalysis.getRecurrence(cancelled.loop, cancelled.phi));
  }

  @Test
  public void testInvariantArgumentStepIsUnknown() {
    Built built = build((i, n, body) -> IRBuilder.createBinaryInst(OpCode.ADD, n, i, body));
    Recurrence recurrence = RecurrenceAnalysis.getRecurrence(built.loop, built.phi);

    assertEquals(Recurrence.Kind.ADDITIVE, recurrence.getKind());
    assertEquals(Recurrence.StepKind.UNKNOWN, recurrence.getStepKind());
    assertFalse(recurrence.isConstantStep());
  }

  @Test
  public void testMultiplication() {
    Built built = build((i, n, body) -> IRBuilder.createBinaryInst(OpCode.MUL, i, IRBuilder.createConstantInt(2), body));
    Recurrence recurrence = RecurrenceAnalysis.getRecurrence(built.loop, built.phi);

    assertEquals(Recurrence.Kind.MULTIPLICATIVE, recurrence.getKind());
  }

  @Test
  public void testNotARecurrence() {
    Built built = build((i, n, body) -> IRBuilder.createBinaryInst(OpCode.SUB, n, i, body));
    assertNull(RecurrenceAnalysis.getRecurrence(built.loop, built.phi));

    Built square = build((i, n, body) -> IRBuilder.createBinaryInst(OpCode.ADD, i,
        IRBuilder.createBinaryInst(OpCode.MUL, i, i, body), body));
    assertNull(RecurrenceAnalysis.getRecurrence(square.loop, square.phi));
  }

  @Test
  public void testNestedRecurrenceTerm() {
    Module module = IRBuilder.createModule("rec");
    Function function = IRBuilder.createFunction("rec", VoidType.VOID, module);
    Argument n = IRBuilder.createArgument("n", IntegerType.I32, function);
    BasicBlock entry = IRBuilder.createBasicBlock("entry", function);
    BasicBlock header = IRBuilder.createBasicBlock("header", function);
    BasicBlock body = IRBuilder.createBasicBlock("body", function);
    BasicBlock exit = IRBuilder.createBasicBlock("exit", function);

    IRBuilder.createBr(header, entry);
    PhiInstruction i = IRBuilder.createPhi(IntegerType.I32, header);
    PhiInstruction j = IRBuilder.createPhi(IntegerType.I32, header);
    CompareInstruction cmp = IRBuilder.createICmp(OpCode.SLT, i, n, header);
    IRBuilder.createCondBr(cmp, body, exit, header);
    BinaryInstruction j1 = IRBuilder.createBinaryInst(OpCode.ADD, j, IRBuilder.createConstantInt(1), body);
    BinaryInstruction i1 = IRBuilder.createBinaryInst(OpCode.ADD, i, j, body);
    IRBuilder.createBr(header, body);
    IRBuilder.createReturn(exit);
    i.addIncoming(IRBuilder.createConstantInt(0), entry);
    i.addIncoming(i1, body);
    j.addIncoming(IRBuilder.createConstantInt(0), entry);
    j.addIncoming(j1, body);

    Loop loop = LoopAnalysis.analyzeLoops(function).get(0);
    Recurrence recurrence = RecurrenceAnalysis.getRecurrence(loop, i);

    assertEquals(Recurrence.StepKind.ADD_REC, recurrence.getStepKind());
    assertSame(j, recurrence.getStep());
    assertEquals(Recurrence.StepKind.CONSTANT, RecurrenceAnalysis.getRecurrence(loop, j).getStepKind());
  }

  @Test
  public void testPhiOutsideHeaderIsIgnored() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    PhiInstruction stray = IRBuilder.createPhi(IntegerType.I32, f.body);
    assertNull(RecurrenceAnalysis.getRecurrence(f.loop(), stray));
  }
}
