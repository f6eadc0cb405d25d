package pgs.runtime;

import com.pgslang.compiler.analysis.ResolveException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProgramCache 测试
 */
class ProgramCacheTest {

    private static final String SOURCE = "fn: main() ~ int { return 40 + 2; }";

    @Test
    void sameSourceHitsCache() {
        ProgramCache cache = new ProgramCache(16);
        CompiledProgram first = cache.compile(SOURCE, "a.pgs");
        CompiledProgram second = cache.compile(SOURCE, "a.pgs");

        assertSame(first, second);
        assertEquals(1, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
        assertEquals(PgsInt.of(42), second.run("main"));
    }

    @Test
    void keyIncludesFileNameAndRegistry() {
        ProgramCache cache = new ProgramCache(16);
        NativeRegistry natives = new NativeRegistry();
        CompiledProgram plain = cache.compile(SOURCE, "a.pgs");

        assertNotSame(plain, cache.compile(SOURCE, "b.pgs"));
        assertNotSame(plain, cache.compile(SOURCE, "a.pgs", natives));
        assertSame(cache.compile(SOURCE, "a.pgs", natives), cache.compile(SOURCE, "a.pgs", natives));
    }

    @Test
    void failuresAreNotCached() {
        ProgramCache cache = new ProgramCache(16);
        String bad = "fn: main() ~ int { return missing; }";

        assertThrows(ResolveException.class, () -> cache.compile(bad, "bad.pgs"));
        assertThrows(ResolveException.class, () -> cache.compile(bad, "bad.pgs"));
        assertEquals(0, cache.size());
    }

    @Test
    void clearEmptiesCache() {
        ProgramCache cache = new ProgramCache(16);
        cache.compile(SOURCE, "a.pgs");
        cache.clear();
        assertEquals(0, cache.size());
        assertThrows(IllegalArgumentException.class, () -> new ProgramCache(0));
    }
}
