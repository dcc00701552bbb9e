package MiddleEnd.Optimization.Core;

import MiddleEnd.IR.Module;

/**
 * 中端分析/优化接口
 */
public interface Optimizer {
    String getName();

    interface Analyzer extends Optimizer {
        void run(Module module);

        Object getResult();
    }
}
