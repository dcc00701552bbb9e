package MiddleEnd.Optimization.Analysis.Dependence;

/**
 * 依赖边的种类
 */
public enum DependenceKind {
    DATA,     // 定义 -> 使用
    CONTROL   // 条件跳转 -> 受其控制的指令
}
