package pgs.runtime;

/**
 * 宿主对象的不透明句柄
 *
 * <p>脚本只能传递句柄，不能读取其内容；相等性按包装对象的引用判断。</p>
 */
public final class PgsNativeHandle extends PgsValue {

    private final Object target;

    public PgsNativeHandle(Object target) {
        if (target == null) {
            throw new IllegalArgumentException("Native handle target must not be null");
        }
        this.target = target;
    }

    public Object getTarget() {
        return target;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.HANDLE;
    }

    @Override
    public Object toJavaValue() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PgsNativeHandle && ((PgsNativeHandle) obj).target == target;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(target);
    }

    @Override
    public String toString() {
        return "handle(" + target.getClass().getSimpleName() + ")";
    }
}
