package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;

/**
 * 字节块优化 pass 接口。
 */
public interface ChunkPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对字节块执行改写。
     *
     * @return 本次应用的改写次数，0 表示无变化
     */
    int run(Chunk chunk);
}
