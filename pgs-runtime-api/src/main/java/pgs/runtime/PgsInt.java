package pgs.runtime;

/**
 * Pgs int 值（64 位有符号整数）
 */
public final class PgsInt extends PgsValue {

    // 小整数缓存，覆盖循环计数器等常见范围
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final PgsInt[] CACHE = new PgsInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new PgsInt(CACHE_LOW + i);
        }
    }

    /** 获取 PgsInt 实例，优先从缓存取 */
    public static PgsInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new PgsInt(value);
    }

    private final long value;

    private PgsInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.INT;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PgsInt && ((PgsInt) obj).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
