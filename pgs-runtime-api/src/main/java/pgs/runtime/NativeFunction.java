package pgs.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 带固定签名的原生函数
 *
 * <p>名称为稳定的限定名（如 {@code std::sqrt}），相对于根模块。</p>
 */
public final class NativeFunction {

    private final String name;
    private final List<ValueKind> paramKinds;
    private final ValueKind returnKind;
    private final NativeCallable callable;

    public NativeFunction(String name, List<ValueKind> paramKinds, ValueKind returnKind, NativeCallable callable) {
        if (!NativeRegistry.isValidName(name)) {
            throw new IllegalArgumentException("Invalid native function name: '" + name + "'");
        }
        if (paramKinds.contains(ValueKind.UNIT)) {
            throw new IllegalArgumentException("Native parameter cannot be unit: " + name);
        }
        this.name = name;
        this.paramKinds = Collections.unmodifiableList(new ArrayList<>(paramKinds));
        this.returnKind = returnKind;
        this.callable = callable;
    }

    public String getName() {
        return name;
    }

    /** 名称最后一段 */
    public String getSimpleName() {
        int idx = name.lastIndexOf("::");
        return idx < 0 ? name : name.substring(idx + 2);
    }

    /** 所在模块路径，顶层函数返回空串 */
    public String getModulePath() {
        int idx = name.lastIndexOf("::");
        return idx < 0 ? "" : name.substring(0, idx);
    }

    public List<ValueKind> getParamKinds() {
        return paramKinds;
    }

    public int getArity() {
        return paramKinds.size();
    }

    public ValueKind getReturnKind() {
        return returnKind;
    }

    public NativeCallable getCallable() {
        return callable;
    }

    public PgsValue invoke(PgsValue[] args) {
        return callable.call(args);
    }

    /** 形如 {@code std::sqrt(float) ~ float} 的签名描述 */
    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < paramKinds.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramKinds.get(i).getTypeName());
        }
        return sb.append(") ~ ").append(returnKind.getTypeName()).toString();
    }

    @Override
    public String toString() {
        return "native " + signature();
    }
}
