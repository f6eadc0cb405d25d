package pgs.runtime;

/**
 * Pgs bool 值
 */
public final class PgsBool extends PgsValue {

    public static final PgsBool TRUE = new PgsBool(true);
    public static final PgsBool FALSE = new PgsBool(false);

    public static PgsBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private PgsBool(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.BOOL;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean asBool() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
