package pgs.runtime.vm;

/**
 * 执行步进回调
 *
 * <p>VM 每执行 {@link VmOptions#getCheckInterval()} 条指令调用一次，
 * 在 VM 所在线程上执行。返回 false 时以 {@code INTERRUPTED} 终止执行。</p>
 */
@FunctionalInterface
public interface StepHook {

    /**
     * @param executedInstructions 本次执行至今累计的指令数
     * @return 是否继续执行
     */
    boolean onStep(long executedInstructions);
}
