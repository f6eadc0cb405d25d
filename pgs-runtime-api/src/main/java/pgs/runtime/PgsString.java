package pgs.runtime;

/**
 * Pgs string 值
 */
public final class PgsString extends PgsValue {

    public static final PgsString EMPTY = new PgsString("");

    public static PgsString of(String value) {
        if (value.isEmpty()) {
            return EMPTY;
        }
        return new PgsString(value);
    }

    private final String value;

    private PgsString(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.STRING;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PgsString && ((PgsString) obj).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
