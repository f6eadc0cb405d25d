package pgs.runtime;

/**
 * Pgs unit 值（单例）
 */
public final class PgsUnit extends PgsValue {

    public static final PgsUnit UNIT = new PgsUnit();

    private PgsUnit() {
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.UNIT;
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public String toString() {
        return "()";
    }
}
