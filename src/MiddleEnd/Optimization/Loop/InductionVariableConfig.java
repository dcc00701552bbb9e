package MiddleEnd.Optimization.Loop;

/**
 * 归纳变量分析配置
 */
public class InductionVariableConfig {

    // 超过该基本块数的函数不做分析
    public static final int MAX_BLOCK_THRESHOLD = 1000;

    // 是否分析循环嵌套中的内层循环
    public static final boolean ANALYZE_NESTED_LOOPS = true;

    // 调试输出：打印每个归纳变量的成员指令
    public static final boolean VERBOSE_LOGGING = false;

    private InductionVariableConfig() {
        // 工具类，不允许实例化
    }
}
