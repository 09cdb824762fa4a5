package tinylang.runtime.gc;

/**
 * 回收根的提供者。每次回收开始时调用，由实现方把所有根交给收集器标记。
 */
@FunctionalInterface
public interface RootSet {
    void markRoots(GarbageCollector collector);
}
