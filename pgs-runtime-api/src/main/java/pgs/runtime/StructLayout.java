package pgs.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 容器（cont）的字段布局描述
 *
 * <p>存放在常量池中，由 NewStruct 指令引用。字段按声明顺序编号。</p>
 */
public final class StructLayout {

    private final String name;
    private final List<String> fieldNames;
    private final List<ValueKind> fieldKinds;

    public StructLayout(String name, List<String> fieldNames, List<ValueKind> fieldKinds) {
        if (fieldNames.size() != fieldKinds.size()) {
            throw new IllegalArgumentException("Field name/kind count mismatch for " + name);
        }
        this.name = name;
        this.fieldNames = Collections.unmodifiableList(new ArrayList<>(fieldNames));
        this.fieldKinds = Collections.unmodifiableList(new ArrayList<>(fieldKinds));
    }

    /** 容器的全限定名，如 root::geo::Point */
    public String getName() {
        return name;
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    public List<ValueKind> getFieldKinds() {
        return fieldKinds;
    }

    public int getFieldCount() {
        return fieldNames.size();
    }

    /**
     * 查找字段下标
     *
     * @return 字段下标，不存在时返回 -1
     */
    public int indexOf(String fieldName) {
        return fieldNames.indexOf(fieldName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructLayout)) return false;
        StructLayout that = (StructLayout) o;
        return name.equals(that.name)
                && fieldNames.equals(that.fieldNames)
                && fieldKinds.equals(that.fieldKinds);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + fieldNames.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" {");
        for (int i = 0; i < fieldNames.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(' ').append(fieldNames.get(i)).append(": ").append(fieldKinds.get(i).getTypeName());
        }
        return sb.append(" }").toString();
    }
}
