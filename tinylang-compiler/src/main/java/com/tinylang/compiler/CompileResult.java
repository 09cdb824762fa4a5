package com.tinylang.compiler;

import com.tinylang.bytecode.ObjFunction;
import com.tinylang.compiler.diagnostic.CompileError;
import com.tinylang.compiler.diagnostic.ErrorReporter;

import java.util.List;

/**
 * 一次编译的结果：顶层脚本函数（有错误时为 null）与收集到的诊断信息
 */
public final class CompileResult {
    private final ObjFunction function;
    private final ErrorReporter reporter;

    CompileResult(ObjFunction function, ErrorReporter reporter) {
        this.function = function;
        this.reporter = reporter;
    }

    public ObjFunction getFunction() {
        return function;
    }

    public boolean isSuccess() {
        return function != null;
    }

    public List<CompileError> getErrors() {
        return reporter.getErrors();
    }

    public ErrorReporter getReporter() {
        return reporter;
    }
}
