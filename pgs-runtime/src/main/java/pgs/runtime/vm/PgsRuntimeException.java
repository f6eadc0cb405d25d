package pgs.runtime.vm;

import pgs.runtime.PgsException;

/**
 * PgsLang 运行时错误
 *
 * <p>携带错误种类、出错函数名与源码行号，以及出错时的脚本调用栈。
 * VM 在抛出后已清空自身状态，可以继续执行下一次调用。</p>
 */
public class PgsRuntimeException extends PgsException {

    /** 运行时错误种类 */
    public enum Kind {
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        STACK_OVERFLOW,
        UNDEFINED_FIELD,
        NATIVE_ARITY_MISMATCH,
        UNDEFINED_NATIVE,
        UNKNOWN_FUNCTION,
        NATIVE_FAILURE,
        BUDGET_EXHAUSTED,
        INTERRUPTED
    }

    private final Kind kind;
    private String functionName;
    private int line;
    private String scriptStackTrace;

    public PgsRuntimeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PgsRuntimeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /** 出错时正在执行的函数，入口检查失败时为 null */
    public String getFunctionName() {
        return functionName;
    }

    /** 出错指令对应的源码行，未知时为 0 */
    public int getLine() {
        return line;
    }

    public String getScriptStackTrace() {
        return scriptStackTrace;
    }

    /** 由 VM 在展开调用栈时填入，只生效一次 */
    void attachFrame(String functionName, int line, String scriptStackTrace) {
        if (this.functionName == null) {
            this.functionName = functionName;
            this.line = line;
            this.scriptStackTrace = scriptStackTrace;
        }
    }

    /** 返回不含位置和调用栈的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (functionName != null) {
            sb.append(" (in ").append(functionName);
            if (line > 0) {
                sb.append(" at line ").append(line);
            }
            sb.append(')');
        }
        if (scriptStackTrace != null) {
            sb.append('\n').append(scriptStackTrace);
        }
        return sb.toString();
    }
}
