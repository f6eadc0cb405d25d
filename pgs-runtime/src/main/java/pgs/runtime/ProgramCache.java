package pgs.runtime;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Objects;

/**
 * 编译结果缓存
 *
 * <p>按（源码、文件名、原生注册表实例）缓存 {@link CompiledProgram}，
 * 相同脚本重复提交时跳过整条编译管线。基于 Caffeine，线程安全。
 * 编译失败不会被缓存，每次都重新抛出。</p>
 *
 * <pre>
 * ProgramCache cache = new ProgramCache(256);
 * CompiledProgram program = cache.compile(source, "rule.pgs", natives);
 * </pre>
 */
public final class ProgramCache {

    private final Cache<Key, CompiledProgram> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public ProgramCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public CompiledProgram compile(String source, String fileName) {
        return compile(source, fileName, null);
    }

    public CompiledProgram compile(String source, String fileName, NativeRegistry natives) {
        return cache.get(new Key(source, fileName, natives), k -> Pgs.compile(source, fileName, natives));
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public long size() {
        return cache.estimatedSize();
    }

    public long getHitCount() {
        return cache.stats().hitCount();
    }

    public long getMissCount() {
        return cache.stats().missCount();
    }

    public double getHitRate() {
        CacheStats stats = cache.stats();
        return stats.requestCount() > 0 ? stats.hitRate() : 0.0;
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /** 注册表按实例区分：同名不同实现的原生函数不能共用编译结果 */
    private static final class Key {
        private final String source;
        private final String fileName;
        private final NativeRegistry natives;

        Key(String source, String fileName, NativeRegistry natives) {
            this.source = source;
            this.fileName = fileName;
            this.natives = natives;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return source.equals(key.source)
                    && Objects.equals(fileName, key.fileName)
                    && natives == key.natives;
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, fileName, System.identityHashCode(natives));
        }
    }
}
