package com.tinylang.compiler.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * 正在编译的循环：continue 的回跳位置与待回填的 break / continue 跳转。
 */
final class LoopContext {
    final LoopContext enclosing;

    /** 进入循环时的作用域深度，break / continue 丢弃比它更深的局部变量 */
    final int scopeDepth;

    /** while 的循环头；for 的 continue 需要前跳到递增部分，此值为 -1 */
    final int continueTarget;

    final List<Integer> breakJumps = new ArrayList<>();
    final List<Integer> continueJumps = new ArrayList<>();

    LoopContext(LoopContext enclosing, int scopeDepth, int continueTarget) {
        this.enclosing = enclosing;
        this.scopeDepth = scopeDepth;
        this.continueTarget = continueTarget;
    }
}
