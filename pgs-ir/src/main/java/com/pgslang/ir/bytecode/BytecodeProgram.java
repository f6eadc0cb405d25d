package com.pgslang.ir.bytecode;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 编译产物：所有函数的 chunk 和原生绑定表。编译完成后只读，可被多个虚拟机共享。
 */
public final class BytecodeProgram {

    private final List<Chunk> chunks;
    private final List<NativeBinding> natives;
    private final Map<String, Integer> chunkIndex = new HashMap<>();

    public BytecodeProgram(List<Chunk> chunks, List<NativeBinding> natives) {
        this.chunks = Collections.unmodifiableList(chunks);
        this.natives = Collections.unmodifiableList(natives);
        for (int i = 0; i < chunks.size(); i++) {
            chunkIndex.put(chunks.get(i).getName(), i);
        }
    }

    public List<Chunk> getChunks() {
        return chunks;
    }

    public Chunk getChunk(int index) {
        return chunks.get(index);
    }

    public List<NativeBinding> getNatives() {
        return natives;
    }

    public NativeBinding getNative(int index) {
        return natives.get(index);
    }

    /**
     * 按全限定名查找 chunk 下标
     *
     * @return 下标，不存在返回 -1
     */
    public int indexOf(String qualifiedName) {
        Integer index = chunkIndex.get(qualifiedName);
        return index != null ? index : -1;
    }

    /** 按全限定名查找，不存在返回 null */
    public Chunk findChunk(String qualifiedName) {
        int index = indexOf(qualifiedName);
        return index >= 0 ? chunks.get(index) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytecodeProgram)) return false;
        BytecodeProgram that = (BytecodeProgram) o;
        return chunks.equals(that.chunks) && natives.equals(that.natives);
    }

    @Override
    public int hashCode() {
        return chunks.hashCode() * 31 + natives.hashCode();
    }
}
