package MiddleEnd.Optimization.Loop;

import static org.junit.Assert.*;

import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.Type.VoidType;
import MiddleEnd.Optimization.Analysis.Loop;
import java.util.Map;
import org.junit.Test;

public class InductionVariableAnalysisTest {

  @Test
  public void testAnalyzesEveryLoopNest() {
    LoopFixtures f = LoopFixtures.lessThanLoop();
    IRBuilder.createExternalFunction("putint", VoidType.VOID, f.module);

    InductionVariableAnalysis analysis = new InductionVariableAnalysis();
    analysis.run(f.module);
    Map<Loop, InductionVariables> result = analysis.getResult();

    assertEquals("InductionVariableAnalysis", analysis.getName());
    assertEquals(1, result.size());
    Loop loop = result.keySet().iterator().next();
    assertSame(f.header, loop.getHeader());
    InductionVariables ivs = analysis.getInductionVariables(loop);
    assertSame(result.get(loop), ivs);
    assertSame(f.iv, ivs.getLoopGoverningInductionVariable(loop).getHeaderPhi());
  }

  @Test
  public void testFindsResultForInnerLoop() {
    LoopFixtures.NestedLoops f = new LoopFixtures.NestedLoops();
    InductionVariableAnalysis analysis = new InductionVariableAnalysis();
    analysis.run(f.module);

    Loop outer = analysis.getResult().keySet().iterator().next();
    Loop inner = outer.getSubLoops().get(0);
    InductionVariables ivs = analysis.getInductionVariables(inner);
    assertNotNull(ivs);
    assertSame(f.j, ivs.getInductionVariables(inner).get(0).getHeaderPhi());
  }

  @Test
  public void testRunResetsPreviousResults() {
    InductionVariableAnalysis analysis = new InductionVariableAnalysis();
    analysis.run(LoopFixtures.lessThanLoop().module);
    analysis.run(IRBuilder.createModule("empty"));

    assertTrue(analysis.getResult().isEmpty());
    assertNull(analysis.getInductionVariables(LoopFixtures.lessThanLoop().loop()));
  }
}
