package pgs.runtime;

/**
 * 容器实例，唯一具有引用语义的值
 *
 * <p>实例在堆上共享，通过引用计数管理生命周期。计数由 VM 在每次写入栈槽、
 * 局部变量或字段时维护：先 retain 新值，再 release 旧值。
 * 计数降为 0 时由 VM 递归释放其字段。</p>
 *
 * <p>本类不是线程安全的，一个实例只属于一个 VM。</p>
 */
public final class PgsStruct extends PgsValue {

    private final StructLayout layout;
    private final PgsValue[] fields;
    private int refCount;
    private boolean released;

    public PgsStruct(StructLayout layout, PgsValue[] fields) {
        if (fields.length != layout.getFieldCount()) {
            throw new IllegalArgumentException("Expected " + layout.getFieldCount()
                    + " fields for " + layout.getName() + " but got " + fields.length);
        }
        this.layout = layout;
        this.fields = fields;
    }

    public StructLayout getLayout() {
        return layout;
    }

    public PgsValue getField(int index) {
        return fields[index];
    }

    /**
     * 按名称读取字段（供宿主使用）
     */
    public PgsValue getField(String name) {
        int index = layout.indexOf(name);
        if (index < 0) {
            throw new PgsException("Container " + layout.getName() + " has no field '" + name + "'");
        }
        return fields[index];
    }

    /**
     * 写入字段，返回旧值。引用计数由调用方负责。
     */
    public PgsValue setField(int index, PgsValue value) {
        PgsValue old = fields[index];
        fields[index] = value;
        return old;
    }

    public int getFieldCount() {
        return fields.length;
    }

    public int getRefCount() {
        return refCount;
    }

    /** 是否已被释放 */
    public boolean isReleased() {
        return released;
    }

    public void retain() {
        if (released) {
            throw new PgsException("Use of released instance of " + layout.getName());
        }
        refCount++;
    }

    /**
     * 减少一次引用
     *
     * @return 剩余引用数；为 0 时实例被标记为已释放
     */
    public int release() {
        if (refCount <= 0) {
            throw new PgsException("Reference count underflow on " + layout.getName());
        }
        if (--refCount == 0) {
            released = true;
        }
        return refCount;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.STRUCT;
    }

    @Override
    public String getTypeName() {
        return layout.getName();
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public PgsStruct asStruct() {
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(layout.getName()).append(" {");
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(' ').append(layout.getFieldNames().get(i)).append(": ").append(fields[i]);
        }
        return sb.append(" }").toString();
    }
}
