package tinylang.runtime.vm;

/**
 * 虚拟机配置
 *
 * 所有选项都有默认值；{@link #fromSystemProperties()} 从 {@code tinylang.*} 系统属性读取覆盖值。
 */
public class VmConfig {

    public static final int DEFAULT_MAX_FRAMES = 64;
    public static final int DEFAULT_STACK_CAPACITY = 256;
    public static final long DEFAULT_GC_THRESHOLD = 1024 * 1024;
    public static final double DEFAULT_GC_GROW_FACTOR = 2.0;

    // ========== 执行 ==========

    /** 调用帧上限，超出报告栈溢出 */
    private int maxFrames = DEFAULT_MAX_FRAMES;

    /** 操作数栈初始容量（按需倍增） */
    private int initialStackCapacity = DEFAULT_STACK_CAPACITY;

    // ========== 回收 ==========

    /** 首次回收前允许分配的字节数 */
    private long gcInitialThreshold = DEFAULT_GC_THRESHOLD;

    /** 每次回收后阈值的增长倍数 */
    private double gcGrowFactor = DEFAULT_GC_GROW_FACTOR;

    /** 每次分配前都回收 */
    private boolean stressGc;

    // ========== 编译 ==========

    /** 执行前运行窥孔优化器 */
    private boolean optimize = true;

    /** 编译期常量折叠 */
    private boolean foldConstants = true;

    public static VmConfig defaults() {
        return new VmConfig();
    }

    /**
     * 读取系统属性：tinylang.maxFrames、tinylang.stackCapacity、tinylang.gc.threshold、
     * tinylang.gc.growFactor、tinylang.gc.stress、tinylang.optimize、tinylang.foldConstants。
     *
     * @throws IllegalArgumentException 属性值无法解析或超出范围
     */
    public static VmConfig fromSystemProperties() {
        VmConfig config = new VmConfig();
        String value;
        if ((value = System.getProperty("tinylang.maxFrames")) != null) {
            config.setMaxFrames(parseInt("tinylang.maxFrames", value));
        }
        if ((value = System.getProperty("tinylang.stackCapacity")) != null) {
            config.setInitialStackCapacity(parseInt("tinylang.stackCapacity", value));
        }
        if ((value = System.getProperty("tinylang.gc.threshold")) != null) {
            config.setGcInitialThreshold(parseInt("tinylang.gc.threshold", value));
        }
        if ((value = System.getProperty("tinylang.gc.growFactor")) != null) {
            try {
                config.setGcGrowFactor(Double.parseDouble(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for tinylang.gc.growFactor: " + value, e);
            }
        }
        if ((value = System.getProperty("tinylang.gc.stress")) != null) {
            config.setStressGc(Boolean.parseBoolean(value.trim()));
        }
        if ((value = System.getProperty("tinylang.optimize")) != null) {
            config.setOptimize(Boolean.parseBoolean(value.trim()));
        }
        if ((value = System.getProperty("tinylang.foldConstants")) != null) {
            config.setFoldConstants(Boolean.parseBoolean(value.trim()));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public int getMaxFrames() {
        return maxFrames;
    }

    public VmConfig setMaxFrames(int maxFrames) {
        if (maxFrames < 1) {
            throw new IllegalArgumentException("maxFrames must be positive: " + maxFrames);
        }
        this.maxFrames = maxFrames;
        return this;
    }

    public int getInitialStackCapacity() {
        return initialStackCapacity;
    }

    public VmConfig setInitialStackCapacity(int initialStackCapacity) {
        if (initialStackCapacity < 1) {
            throw new IllegalArgumentException("initialStackCapacity must be positive: " + initialStackCapacity);
        }
        this.initialStackCapacity = initialStackCapacity;
        return this;
    }

    public long getGcInitialThreshold() {
        return gcInitialThreshold;
    }

    public VmConfig setGcInitialThreshold(long gcInitialThreshold) {
        if (gcInitialThreshold < 1) {
            throw new IllegalArgumentException("gcInitialThreshold must be positive: " + gcInitialThreshold);
        }
        this.gcInitialThreshold = gcInitialThreshold;
        return this;
    }

    public double getGcGrowFactor() {
        return gcGrowFactor;
    }

    public VmConfig setGcGrowFactor(double gcGrowFactor) {
        if (!(gcGrowFactor >= 1.0)) {
            throw new IllegalArgumentException("gcGrowFactor must be at least 1.0: " + gcGrowFactor);
        }
        this.gcGrowFactor = gcGrowFactor;
        return this;
    }

    public boolean isStressGc() {
        return stressGc;
    }

    public VmConfig setStressGc(boolean stressGc) {
        this.stressGc = stressGc;
        return this;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public VmConfig setOptimize(boolean optimize) {
        this.optimize = optimize;
        return this;
    }

    public boolean isFoldConstants() {
        return foldConstants;
    }

    public VmConfig setFoldConstants(boolean foldConstants) {
        this.foldConstants = foldConstants;
        return this;
    }
}
