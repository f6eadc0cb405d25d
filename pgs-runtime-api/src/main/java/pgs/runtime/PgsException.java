package pgs.runtime;

/**
 * PgsLang 基础运行时异常（无源位置信息）。
 *
 * <p>{@code pgs-runtime} 中的 {@code PgsRuntimeException} 继承此类，
 * 并添加函数名、行号和脚本调用栈等诊断信息。</p>
 */
public class PgsException extends RuntimeException {

    public PgsException(String message) {
        super(message);
    }

    public PgsException(String message, Throwable cause) {
        super(message, cause);
    }
}
