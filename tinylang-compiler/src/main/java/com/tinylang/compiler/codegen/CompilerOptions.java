package com.tinylang.compiler.codegen;

/**
 * 编译选项
 */
public class CompilerOptions {

    /** 编译期常量折叠 */
    private boolean foldConstants = true;

    public static CompilerOptions defaults() {
        return new CompilerOptions();
    }

    public boolean isFoldConstants() {
        return foldConstants;
    }

    public CompilerOptions setFoldConstants(boolean foldConstants) {
        this.foldConstants = foldConstants;
        return this;
    }
}
