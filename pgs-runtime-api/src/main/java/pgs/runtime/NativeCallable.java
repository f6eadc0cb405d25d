package pgs.runtime;

/**
 * 宿主提供的原生函数体
 *
 * <p>VM 调用前已按签名检查参数个数与种类，实现无需再次校验。</p>
 */
@FunctionalInterface
public interface NativeCallable {

    PgsValue call(PgsValue[] args);
}
