package pgs.runtime;

/**
 * 运行时值的种类
 *
 * <p>原生函数签名与 VM 的类型检查都以此为准。</p>
 */
public enum ValueKind {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOL("bool"),
    UNIT("unit"),
    STRUCT("struct"),
    HANDLE("handle");

    private final String typeName;

    ValueKind(String typeName) {
        this.typeName = typeName;
    }

    /** 脚本源码中使用的类型名 */
    public String getTypeName() {
        return typeName;
    }

    /** 按脚本类型名查找，未知名称返回 null */
    public static ValueKind fromTypeName(String name) {
        for (ValueKind kind : values()) {
            if (kind.typeName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
