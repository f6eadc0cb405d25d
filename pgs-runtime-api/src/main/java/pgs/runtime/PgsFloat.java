package pgs.runtime;

/**
 * Pgs float 值（64 位 IEEE 754）
 */
public final class PgsFloat extends PgsValue {

    public static final PgsFloat ZERO = new PgsFloat(0.0);

    public static PgsFloat of(double value) {
        // 只缓存正零，-0.0 需保留符号
        if (Double.doubleToRawLongBits(value) == 0L) {
            return ZERO;
        }
        return new PgsFloat(value);
    }

    private final double value;

    private PgsFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.FLOAT;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    /** 按位比较，常量池去重需要区分 0.0 与 -0.0 */
    @Override
    public boolean equals(Object obj) {
        return obj instanceof PgsFloat
                && Double.doubleToLongBits(((PgsFloat) obj).value) == Double.doubleToLongBits(value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
