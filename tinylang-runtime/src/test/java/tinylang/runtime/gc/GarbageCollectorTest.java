package tinylang.runtime.gc;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjClosure;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.UpvalueCell;
import com.tinylang.bytecode.UpvalueDescriptor;
import com.tinylang.bytecode.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tinylang.runtime.vm.InterpretResult;
import tinylang.runtime.vm.VirtualMachine;
import tinylang.runtime.vm.VmConfig;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 标记-清除收集器测试
 */
class GarbageCollectorTest {

    private static ObjFunction function(String name, Value... constants) {
        Chunk chunk = new Chunk();
        for (Value constant : constants) {
            chunk.addConstant(constant);
        }
        return new ObjFunction(name, 0, chunk, Collections.<UpvalueDescriptor>emptyList());
    }

    // ============ 直接驱动堆 ============

    @Nested
    @DisplayName("标记与清除")
    class MarkSweepTests {

        private Heap heap;
        private List<Value> roots;
        private GarbageCollector gc;

        @BeforeEach
        void setUp() {
            heap = new Heap();
            roots = new ArrayList<>();
            gc = new GarbageCollector(heap, collector -> {
                for (Value root : roots) {
                    collector.markValue(root);
                }
            }, 1 << 20, 2.0, false);
        }

        @Test
        @DisplayName("从闭包出发标记函数、嵌套函数与闭合单元中的值")
        void testTracing() {
            ObjFunction inner = function("inner");
            heap.allocate(inner);
            ObjFunction outer = function("outer", Value.number(1), Value.function(inner.getHandle()));
            heap.allocate(outer);

            ObjClosure captured = new ObjClosure(inner.getHandle(), 0);
            Value capturedValue = heap.allocateClosure(captured);
            ObjClosure closure = new ObjClosure(outer.getHandle(), 1);
            Value closureValue = heap.allocateClosure(closure);
            UpvalueCell cell = new UpvalueCell(0);
            cell.close(capturedValue);
            closure.getUpvalues()[0] = cell;

            ObjFunction garbage = function("garbage");
            heap.allocate(garbage);

            roots.add(closureValue);
            assertEquals(1, gc.collect());
            assertEquals(4, heap.getLiveCount());
            assertFalse(heap.isLive(garbage.getHandle()));
            assertTrue(heap.isLive(inner.getHandle()));
            assertTrue(heap.isLive(captured.getHandle()));

            // 标记位在清除后复位
            heap.forEachLive(obj -> assertFalse(obj.isMarked()));

            roots.clear();
            assertEquals(4, gc.collect());
            assertEquals(0, heap.getLiveCount());
            assertEquals(0, heap.getBytesInUse());
        }

        @Test
        @DisplayName("额外根使对象存活，注销后被回收")
        void testExtraRoots() {
            ObjFunction fn = function("held");
            Value value = heap.allocateFunction(fn);

            gc.registerRoot(value);
            assertEquals(0, gc.collect());
            assertTrue(gc.unregisterRoot(value));
            assertFalse(gc.unregisterRoot(value));
            assertEquals(1, gc.collect());
        }

        @Test
        @DisplayName("释放后的句柄不可再读取，句柄被复用")
        void testDanglingHandle() {
            ObjFunction fn = function("temp");
            int handle = heap.allocate(fn);
            gc.collect();

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> heap.get(handle));
            assertTrue(e.getMessage().contains("dangling heap handle"));
            assertEquals(handle, heap.allocate(function("reused")));
        }

        @Test
        @DisplayName("统计累计释放的对象和字节")
        void testStatistics() {
            heap.allocate(function("a"));
            heap.allocate(function("b"));
            long bytes = heap.getBytesInUse();
            gc.collect();
            assertEquals(1, gc.getCollectionCount());
            assertEquals(2, gc.getFreedObjectCount());
            assertEquals(bytes, gc.getFreedBytes());
        }
    }

    // ============ 触发策略 ============

    @Nested
    @DisplayName("触发策略")
    class TriggerTests {

        @Test
        @DisplayName("超过阈值时回收，阈值按倍数增长")
        void testThresholdGrowth() {
            Heap heap = new Heap();
            GarbageCollector gc = new GarbageCollector(heap, collector -> { }, 200, 2.0, false);
            for (int i = 0; i < 20; i++) {
                heap.allocate(function("f" + i));
            }
            assertTrue(gc.getCollectionCount() > 0);
            assertTrue(gc.getThreshold() >= 400);
        }

        @Test
        @DisplayName("压力模式每次分配前都回收")
        void testStressMode() {
            Heap heap = new Heap();
            GarbageCollector gc = new GarbageCollector(heap, collector -> { }, 1 << 20, 2.0, true);
            heap.allocate(function("a"));
            heap.allocate(function("b"));
            heap.allocate(function("c"));
            assertEquals(3, gc.getCollectionCount());
            // 每次回收都释放了上一个无根对象
            assertEquals(1, heap.getLiveCount());
        }

        @Test
        @DisplayName("暂停期间不回收")
        void testPause() {
            Heap heap = new Heap();
            GarbageCollector gc = new GarbageCollector(heap, collector -> { }, 1 << 20, 2.0, true);
            gc.pause();
            heap.allocate(function("a"));
            heap.allocate(function("b"));
            gc.resume();
            assertEquals(0, gc.getCollectionCount());
            assertEquals(2, heap.getLiveCount());
            assertThrows(IllegalStateException.class, gc::resume);
        }
    }

    // ============ 与虚拟机集成 ============

    @Nested
    @DisplayName("虚拟机集成")
    class VmIntegrationTests {

        private VirtualMachine newVm(VmConfig config, ByteArrayOutputStream out) {
            VirtualMachine vm = new VirtualMachine(config);
            vm.setStdout(new PrintStream(out, true, StandardCharsets.UTF_8));
            return vm;
        }

        @Test
        @DisplayName("压力模式下闭包程序结果正确")
        void testStressProgram() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            VirtualMachine vm = newVm(VmConfig.defaults().setStressGc(true), out);
            String source =
                    "fn adder(n) { return fn(x) { return x + n; }; }\n" +
                    "fn compose(f, g) { return fn(x) { return g(f(x)); }; }\n" +
                    "var total = 0;\n" +
                    "for (let i = 0; i < 20; i = i + 1) {\n" +
                    "  let h = compose(adder(i), adder(1));\n" +
                    "  total = total + h(0);\n" +
                    "}\n" +
                    "print total;";
            assertEquals(InterpretResult.OK, vm.interpret(source));
            assertEquals("210\n", out.toString(StandardCharsets.UTF_8));
            assertTrue(vm.getCollector().getCollectionCount() > 20);
        }

        @Test
        @DisplayName("脚本结束后只保留全局变量可达的对象")
        void testUnreachableAfterRun() {
            VirtualMachine vm = newVm(VmConfig.defaults(), new ByteArrayOutputStream());
            assertEquals(InterpretResult.OK, vm.interpret("let x = 1;"));
            vm.collectGarbage();
            assertEquals(0, vm.getLiveObjectCount());

            assertEquals(InterpretResult.OK, vm.interpret("fn keep() { return 1; }"));
            vm.collectGarbage();
            // keep 的函数与闭包
            assertEquals(2, vm.getLiveObjectCount());
        }

        @Test
        @DisplayName("宿主登记的值在清空全局表后仍存活")
        void testRegisteredRootSurvivesReset() {
            VirtualMachine vm = newVm(VmConfig.defaults(), new ByteArrayOutputStream());
            vm.interpret("fn keep() { return 1; }");
            Value keep = vm.globalsSnapshot().get("keep");
            vm.registerRoot(keep);

            vm.resetGlobals();
            vm.collectGarbage();
            assertEquals(2, vm.getLiveObjectCount());

            vm.unregisterRoot(keep);
            vm.collectGarbage();
            assertEquals(0, vm.getLiveObjectCount());
        }

        @Test
        @DisplayName("顶层 return 的闭包在回收后仍有效")
        void testReturnedClosureIsRoot() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            VirtualMachine vm = newVm(VmConfig.defaults(), out);
            assertEquals(InterpretResult.OK, vm.interpret("return fn() { return 5; };"));
            Value returned = vm.getLastValue();
            vm.collectGarbage();
            assertTrue(vm.getHeap().isLive(returned.getHandle()));
            assertEquals("<fn anonymous>", vm.display(returned));

            // 下一次执行后不再持有
            vm.interpret("let z = 1;");
            vm.collectGarbage();
            assertFalse(vm.getHeap().isLive(returned.getHandle()));
        }

        @Test
        @DisplayName("低阈值时在执行中自动回收")
        void testAutomaticCollection() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            VirtualMachine vm = newVm(VmConfig.defaults().setGcInitialThreshold(256), out);
            String source =
                    "fn make(n) { return fn() { return n; }; }\n" +
                    "var last;\n" +
                    "for (let i = 0; i < 200; i = i + 1) { last = make(i); }\n" +
                    "print last();";
            assertEquals(InterpretResult.OK, vm.interpret(source));
            assertEquals("199", out.toString(StandardCharsets.UTF_8).trim());
            assertTrue(vm.getCollector().getCollectionCount() > 0);
            assertTrue(vm.getCollector().getThreshold() > 256);
            assertTrue(vm.getLiveObjectCount() < 50);
        }
    }
}
