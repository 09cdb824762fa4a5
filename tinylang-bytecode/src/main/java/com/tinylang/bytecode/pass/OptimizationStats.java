package com.tinylang.bytecode.pass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次优化的统计：轮数、每个 pass 的改写次数、字节数变化。
 */
public final class OptimizationStats {

    private int rounds;
    private int chunks;
    private long bytesBefore;
    private long bytesAfter;
    private final Map<String, Integer> rewritesByPass = new LinkedHashMap<>();

    void recordRewrites(String pass, int count) {
        if (count > 0) {
            rewritesByPass.merge(pass, count, Integer::sum);
        }
    }

    void addRounds(int n) {
        rounds += n;
    }

    void addChunk(int before, int after) {
        chunks++;
        bytesBefore += before;
        bytesAfter += after;
    }

    public int getRounds() {
        return rounds;
    }

    public int getChunks() {
        return chunks;
    }

    public long getBytesBefore() {
        return bytesBefore;
    }

    public long getBytesAfter() {
        return bytesAfter;
    }

    public int getTotalRewrites() {
        int total = 0;
        for (int n : rewritesByPass.values()) {
            total += n;
        }
        return total;
    }

    public Map<String, Integer> getRewritesByPass() {
        return rewritesByPass;
    }

    @Override
    public String toString() {
        return "chunks=" + chunks + ", rounds=" + rounds + ", bytes " + bytesBefore + " -> " + bytesAfter
                + ", rewrites=" + rewritesByPass;
    }
}
