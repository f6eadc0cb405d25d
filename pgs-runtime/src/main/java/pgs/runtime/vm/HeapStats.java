package pgs.runtime.vm;

/**
 * 容器实例的分配与释放计数
 */
public final class HeapStats {

    private long allocated;
    private long released;

    void recordAllocation() {
        allocated++;
    }

    void recordRelease() {
        released++;
    }

    public long getAllocated() {
        return allocated;
    }

    public long getReleased() {
        return released;
    }

    /** 仍被引用的实例数 */
    public long getLive() {
        return allocated - released;
    }

    public void reset() {
        allocated = 0;
        released = 0;
    }

    @Override
    public String toString() {
        return "HeapStats{allocated=" + allocated + ", released=" + released + ", live=" + getLive() + "}";
    }
}
