package com.tinylang.compiler.codegen;

/**
 * 编译期局部变量：名称、声明时的作用域深度、是否被闭包捕获。
 * 在 locals 列表中的下标即其栈槽位。
 */
final class Local {
    final String name;
    final int depth;
    boolean captured;

    Local(String name, int depth) {
        this.name = name;
        this.depth = depth;
    }
}
