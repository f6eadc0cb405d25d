package pgs.runtime.vm;

import java.util.Properties;

/**
 * 虚拟机资源限制配置
 *
 * <p>使用示例：</p>
 * <pre>
 * // 默认限制
 * VirtualMachine vm = new VirtualMachine(program, natives, VmOptions.defaults());
 *
 * // 自定义限制
 * VmOptions options = VmOptions.custom()
 *     .maxFrames(256)
 *     .instructionBudget(1_000_000)
 *     .checkInterval(4096)
 *     .build();
 *
 * // 从配置文件读取（pgs.vm.maxFrames 等）
 * VmOptions options = VmOptions.fromProperties(props);
 * </pre>
 */
public final class VmOptions {

    public static final String MAX_FRAMES = "pgs.vm.maxFrames";
    public static final String MAX_STACK_SIZE = "pgs.vm.maxStackSize";
    public static final String INSTRUCTION_BUDGET = "pgs.vm.instructionBudget";
    public static final String CHECK_INTERVAL = "pgs.vm.checkInterval";

    private static final VmOptions DEFAULTS = new Builder().build();

    private final int maxFrames;
    private final int maxStackSize;
    private final long instructionBudget;   // 0=无限制
    private final int checkInterval;

    private VmOptions(Builder builder) {
        this.maxFrames = builder.maxFrames;
        this.maxStackSize = builder.maxStackSize;
        this.instructionBudget = builder.instructionBudget;
        this.checkInterval = builder.checkInterval;
    }

    public static VmOptions defaults() {
        return DEFAULTS;
    }

    public static Builder custom() {
        return new Builder();
    }

    /**
     * 从 Properties 读取，缺失的键使用默认值
     *
     * @throws IllegalArgumentException 值不是合法数字或超出范围
     */
    public static VmOptions fromProperties(Properties props) {
        Builder builder = new Builder();
        String value = props.getProperty(MAX_FRAMES);
        if (value != null) builder.maxFrames(parseInt(MAX_FRAMES, value));
        value = props.getProperty(MAX_STACK_SIZE);
        if (value != null) builder.maxStackSize(parseInt(MAX_STACK_SIZE, value));
        value = props.getProperty(INSTRUCTION_BUDGET);
        if (value != null) builder.instructionBudget(parseLong(INSTRUCTION_BUDGET, value));
        value = props.getProperty(CHECK_INTERVAL);
        if (value != null) builder.checkInterval(parseInt(CHECK_INTERVAL, value));
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    public int getMaxFrames() {
        return maxFrames;
    }

    public int getMaxStackSize() {
        return maxStackSize;
    }

    public long getInstructionBudget() {
        return instructionBudget;
    }

    public boolean hasInstructionBudget() {
        return instructionBudget > 0;
    }

    public int getCheckInterval() {
        return checkInterval;
    }

    @Override
    public String toString() {
        return "VmOptions{maxFrames=" + maxFrames + ", maxStackSize=" + maxStackSize
                + ", instructionBudget=" + instructionBudget + ", checkInterval=" + checkInterval + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private int maxFrames = 1024;
        private int maxStackSize = 65536;
        private long instructionBudget = 0;
        private int checkInterval = 1024;

        private Builder() {
        }

        public Builder maxFrames(int maxFrames) {
            if (maxFrames < 1) {
                throw new IllegalArgumentException("maxFrames must be positive: " + maxFrames);
            }
            this.maxFrames = maxFrames;
            return this;
        }

        public Builder maxStackSize(int maxStackSize) {
            if (maxStackSize < 16) {
                throw new IllegalArgumentException("maxStackSize must be at least 16: " + maxStackSize);
            }
            this.maxStackSize = maxStackSize;
            return this;
        }

        public Builder instructionBudget(long instructionBudget) {
            if (instructionBudget < 0) {
                throw new IllegalArgumentException("instructionBudget must not be negative: " + instructionBudget);
            }
            this.instructionBudget = instructionBudget;
            return this;
        }

        public Builder checkInterval(int checkInterval) {
            if (checkInterval < 1) {
                throw new IllegalArgumentException("checkInterval must be positive: " + checkInterval);
            }
            this.checkInterval = checkInterval;
            return this;
        }

        public VmOptions build() {
            return new VmOptions(this);
        }
    }
}
