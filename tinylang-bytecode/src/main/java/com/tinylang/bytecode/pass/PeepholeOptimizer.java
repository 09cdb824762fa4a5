package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 不动点窥孔优化器。
 *
 * 依次运行各 pass，直到完整一轮没有任何改写。每个改写过的 pass 之后
 * 都会校验字节块结构。对自身输出再次运行不会产生变化。
 */
public class PeepholeOptimizer {

    private static final Logger LOG = Logger.getLogger(PeepholeOptimizer.class.getName());

    /** 轮数上限；每次改写都会缩短或简化指令流，正常情况下远达不到 */
    public static final int MAX_ROUNDS = 64;

    private final List<ChunkPass> passes = new ArrayList<>();

    public PeepholeOptimizer() {
    }

    /**
     * 创建默认优化器（四类改写）。
     */
    public static PeepholeOptimizer createDefault() {
        PeepholeOptimizer optimizer = new PeepholeOptimizer();
        optimizer.addPass(new RedundantStackOpElimination());
        optimizer.addPass(new ConstantPreFolding());
        optimizer.addPass(new JumpChainCollapsing());
        optimizer.addPass(new ConstantSpecialization());
        return optimizer;
    }

    public void addPass(ChunkPass pass) {
        passes.add(pass);
    }

    /**
     * 优化单个字节块。
     */
    public OptimizationStats optimize(Chunk chunk) {
        OptimizationStats stats = new OptimizationStats();
        optimizeInto(chunk, stats);
        return stats;
    }

    /**
     * 优化函数及其常量池中递归嵌套的所有函数。
     */
    public OptimizationStats optimizeAll(ObjFunction function, Heap heap) {
        OptimizationStats stats = new OptimizationStats();
        Set<ObjFunction> visited = new HashSet<>();
        optimizeRecursive(function, heap, stats, visited);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Optimized " + function.getName() + ": " + stats);
        }
        return stats;
    }

    private void optimizeRecursive(ObjFunction function, Heap heap, OptimizationStats stats,
                                   Set<ObjFunction> visited) {
        if (!visited.add(function)) return;
        optimizeInto(function.getChunk(), stats);
        for (Value constant : function.getChunk().getConstants()) {
            if (constant.is(Value.Kind.FUNCTION) && constant.isHeapRef()) {
                optimizeRecursive(heap.function(constant.getHandle()), heap, stats, visited);
            }
        }
    }

    private void optimizeInto(Chunk chunk, OptimizationStats stats) {
        int before = chunk.count();
        int rounds = 0;
        boolean changed = true;
        while (changed && rounds < MAX_ROUNDS) {
            changed = false;
            rounds++;
            for (ChunkPass pass : passes) {
                int rewrites = pass.run(chunk);
                if (rewrites > 0) {
                    changed = true;
                    stats.recordRewrites(pass.getName(), rewrites);
                    chunk.verify();
                }
            }
        }
        if (changed) {
            LOG.warning("Peephole optimizer stopped after " + MAX_ROUNDS + " rounds without reaching a fixed point");
        }
        stats.addRounds(rounds);
        stats.addChunk(before, chunk.count());
    }
}
