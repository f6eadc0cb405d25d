package pgs.runtime;

/**
 * PgsLang 运行时值的基类
 *
 * <p>除 {@link PgsStruct} 外所有值都是不可变的，按值语义复制。</p>
 */
public abstract class PgsValue {

    /**
     * 将 Java 值转换为 PgsValue
     *
     * @param javaValue Java 对象
     * @return 对应的 PgsValue
     */
    public static PgsValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return PgsUnit.UNIT;
        }
        if (javaValue instanceof PgsValue) {
            return (PgsValue) javaValue;
        }
        if (javaValue instanceof Long || javaValue instanceof Integer
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return PgsInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return PgsFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return PgsBool.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence || javaValue instanceof Character) {
            return PgsString.of(javaValue.toString());
        }
        return new PgsNativeHandle(javaValue);
    }

    public abstract ValueKind getKind();

    /**
     * 获取脚本可见的类型名
     */
    public String getTypeName() {
        return getKind().getTypeName();
    }

    /**
     * 转换为 Java 值
     */
    public abstract Object toJavaValue();

    public boolean is(ValueKind kind) {
        return getKind() == kind;
    }

    public long asLong() {
        throw mismatch(ValueKind.INT);
    }

    public double asDouble() {
        throw mismatch(ValueKind.FLOAT);
    }

    public String asString() {
        throw mismatch(ValueKind.STRING);
    }

    public boolean asBool() {
        throw mismatch(ValueKind.BOOL);
    }

    public PgsStruct asStruct() {
        throw mismatch(ValueKind.STRUCT);
    }

    private PgsException mismatch(ValueKind expected) {
        return new PgsException("Expected " + expected.getTypeName() + " but got " + getTypeName());
    }
}
