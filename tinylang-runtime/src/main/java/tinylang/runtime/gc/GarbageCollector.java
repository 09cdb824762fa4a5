package tinylang.runtime.gc;

import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.HeapObject;
import com.tinylang.bytecode.ObjClosure;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.UpvalueCell;
import com.tinylang.bytecode.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 标记-清除收集器
 *
 * 作为堆的分配钩子运行：自上次回收以来分配的字节数超过阈值时同步回收，
 * 回收后阈值按固定倍数增长。压力模式下每次分配前都回收。
 *
 * 对象图无环（函数只引用常量，闭包引用函数与捕获值），
 * 标记阶段用显式灰色栈代替递归，嵌套深度不受 Java 栈限制。
 */
public class GarbageCollector implements Heap.CollectionTrigger {

    private static final Logger LOG = Logger.getLogger(GarbageCollector.class.getName());

    private final Heap heap;
    private final RootSet roots;
    private final double growFactor;
    private final boolean stress;
    private final List<Value> extraRoots = new ArrayList<>();
    private final Deque<HeapObject> gray = new ArrayDeque<>();

    private long threshold;
    private long allocatedSinceLast;
    private int pauseDepth;

    // 统计
    private int collections;
    private long freedObjects;
    private long freedBytes;

    public GarbageCollector(Heap heap, RootSet roots, long initialThreshold, double growFactor, boolean stress) {
        this.heap = heap;
        this.roots = roots;
        this.threshold = initialThreshold;
        this.growFactor = growFactor;
        this.stress = stress;
        heap.setCollectionTrigger(this);
    }

    @Override
    public void beforeAllocate(Heap heap, long bytes) {
        allocatedSinceLast += bytes;
        if (pauseDepth > 0) return;
        if (stress || allocatedSinceLast > threshold) {
            collect();
            // 即将分配的对象计入下一周期
            allocatedSinceLast = bytes;
            if (!stress) {
                threshold = (long) Math.ceil(threshold * growFactor);
            }
        }
    }

    // ============ 暂停 ============

    /**
     * 暂停自动回收。编译期间新函数尚未挂到任何根上，必须暂停。
     * 可嵌套，与 {@link #resume()} 成对调用。
     */
    public void pause() {
        pauseDepth++;
    }

    public void resume() {
        if (pauseDepth == 0) {
            throw new IllegalStateException("resume() without matching pause()");
        }
        pauseDepth--;
    }

    public boolean isPaused() {
        return pauseDepth > 0;
    }

    // ============ 额外根 ============

    /** 登记宿主持有的值，使其在回收中存活 */
    public void registerRoot(Value value) {
        extraRoots.add(value);
    }

    /**
     * 注销一次登记（同一值登记多次需注销多次）
     *
     * @return 该值此前是否已登记
     */
    public boolean unregisterRoot(Value value) {
        return extraRoots.remove(value);
    }

    // ============ 回收 ============

    /**
     * 执行一次完整回收（忽略暂停状态）。
     *
     * @return 本次释放的对象数
     */
    public int collect() {
        long start = System.nanoTime();
        long bytesBefore = heap.getBytesInUse();

        roots.markRoots(this);
        for (Value root : extraRoots) {
            markValue(root);
        }
        traceReferences();
        int freed = sweep();

        collections++;
        allocatedSinceLast = 0;
        long reclaimed = bytesBefore - heap.getBytesInUse();
        freedObjects += freed;
        freedBytes += reclaimed;

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("gc #%d: freed %d objects (%d bytes), %d live (%d bytes), next at %d, %.3f ms",
                    collections, freed, reclaimed, heap.getLiveCount(), heap.getBytesInUse(),
                    threshold, (System.nanoTime() - start) / 1e6));
        }
        return freed;
    }

    /** 标记值引用的堆对象；非引用值忽略 */
    public void markValue(Value value) {
        if (value != null && value.isHeapRef()) {
            markHandle(value.getHandle());
        }
    }

    public void markHandle(int handle) {
        HeapObject obj = heap.get(handle);
        if (obj.isMarked()) return;
        obj.setMarked(true);
        gray.push(obj);
    }

    /** 闭合单元持有的值；打开单元指向栈槽位，栈本身已是根 */
    public void markCell(UpvalueCell cell) {
        if (cell != null && !cell.isOpen()) {
            markValue(cell.getClosed());
        }
    }

    private void traceReferences() {
        while (!gray.isEmpty()) {
            HeapObject obj = gray.pop();
            if (obj instanceof ObjFunction) {
                // 嵌套函数位于外层函数的常量池中
                for (Value constant : ((ObjFunction) obj).getChunk().getConstants()) {
                    markValue(constant);
                }
            } else if (obj instanceof ObjClosure) {
                ObjClosure closure = (ObjClosure) obj;
                markHandle(closure.getFunctionHandle());
                for (UpvalueCell cell : closure.getUpvalues()) {
                    markCell(cell);
                }
            }
        }
    }

    private int sweep() {
        List<Integer> unreached = new ArrayList<>();
        heap.forEachLive(obj -> {
            if (obj.isMarked()) {
                obj.setMarked(false);
            } else {
                unreached.add(obj.getHandle());
            }
        });
        for (int handle : unreached) {
            heap.free(handle);
        }
        return unreached.size();
    }

    // ============ 统计 ============

    public int getCollectionCount() {
        return collections;
    }

    public long getFreedObjectCount() {
        return freedObjects;
    }

    public long getFreedBytes() {
        return freedBytes;
    }

    public long getThreshold() {
        return threshold;
    }

    public long getAllocatedSinceLast() {
        return allocatedSinceLast;
    }
}
