package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 窥孔优化器单元测试（手工构造的字节块）
 */
class PeepholeOptimizerTest {

    private final PeepholeOptimizer optimizer = PeepholeOptimizer.createDefault();

    private static List<OpCode> ops(Chunk chunk) {
        List<OpCode> result = new ArrayList<>();
        for (int offset : chunk.instructionOffsets()) {
            result.add(chunk.opAt(offset));
        }
        return result;
    }

    private static void constant(Chunk chunk, Value value) {
        chunk.writeOp(OpCode.CONSTANT, chunk.addConstant(value), 1);
    }

    @Nested
    @DisplayName("冗余栈操作消除")
    class StackOpTests {

        @Test
        @DisplayName("无副作用的压栈紧跟 POP 被删除")
        void testPushPopRemoved() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.number(1));
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.GET_LOCAL, 0, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.NIL, OpCode.RETURN);
        }

        @Test
        @DisplayName("GET_GLOBAL 可能失败，不参与删除；相邻 POP 合并为 POPN")
        void testPopsMerged() {
            Chunk chunk = new Chunk();
            int name = chunk.addConstant(Value.string("x"));
            chunk.writeOp(OpCode.GET_GLOBAL, name, 1);
            chunk.writeOp(OpCode.GET_GLOBAL, name, 1);
            chunk.writeOp(OpCode.GET_GLOBAL, name, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.GET_GLOBAL, OpCode.GET_GLOBAL, OpCode.GET_GLOBAL,
                    OpCode.POPN, OpCode.NIL, OpCode.RETURN);
            assertEquals(3, chunk.readByte(7));
        }

        @Test
        @DisplayName("SET_LOCAL; POP; GET_LOCAL 同一槽位只保留 SET_LOCAL")
        void testStoreReload() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.CALL, 0, 1);
            chunk.writeOp(OpCode.SET_LOCAL, 1, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.GET_LOCAL, 1, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.CALL, OpCode.SET_LOCAL, OpCode.RETURN);
        }

        @Test
        @DisplayName("不同槽位不合并")
        void testStoreReloadDifferentSlot() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.CALL, 0, 1);
            chunk.writeOp(OpCode.SET_LOCAL, 1, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.GET_LOCAL, 2, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.CALL, OpCode.SET_LOCAL, OpCode.POP,
                    OpCode.GET_LOCAL, OpCode.RETURN);
        }
    }

    @Nested
    @DisplayName("常量预折叠")
    class FoldingTests {

        @Test
        @DisplayName("两个常量加算术运算折叠为一个常量")
        void testFoldAdd() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.number(1));
            constant(chunk, Value.number(2));
            chunk.writeOp(OpCode.ADD, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.CONSTANT, OpCode.RETURN);
            assertEquals(Value.number(3), chunk.getConstant(chunk.readByte(1)));
        }

        @Test
        @DisplayName("嵌套表达式逐步折叠到底")
        void testFoldNested() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.number(2));
            constant(chunk, Value.number(3));
            chunk.writeOp(OpCode.MULTIPLY, 1);
            constant(chunk, Value.number(4));
            chunk.writeOp(OpCode.SUBTRACT, 1);
            chunk.writeOp(OpCode.NEGATE, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.CONSTANT, OpCode.RETURN);
            assertEquals(Value.number(-2), chunk.getConstant(chunk.readByte(1)));
        }

        @Test
        @DisplayName("字符串拼接同样折叠")
        void testFoldStrings() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.string("ab"));
            constant(chunk, Value.string("cd"));
            chunk.writeOp(OpCode.ADD, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertEquals(Value.string("abcd"), chunk.getConstant(chunk.readByte(1)));
        }

        @Test
        @DisplayName("除以常量零不折叠")
        void testNoFoldDivisionByZero() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.number(1));
            constant(chunk, Value.number(0));
            chunk.writeOp(OpCode.DIVIDE, 1);
            constant(chunk, Value.number(5));
            constant(chunk, Value.number(0));
            chunk.writeOp(OpCode.MODULO, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).contains(OpCode.DIVIDE, OpCode.MODULO);
        }

        @Test
        @DisplayName("窗口内部是跳转目标时不折叠")
        void testNoFoldAcrossJumpTarget() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.CALL, 0, 1);
            int jump = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1);
            constant(chunk, Value.number(1));
            chunk.patchJump(jump);
            constant(chunk, Value.number(2));
            chunk.writeOp(OpCode.ADD, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).contains(OpCode.ADD);
            chunk.verify();
        }
    }

    @Nested
    @DisplayName("跳转链折叠")
    class JumpChainTests {

        @Test
        @DisplayName("跳到跳转的跳转直接指向最终目标")
        void testCollapseChain() {
            Chunk chunk = new Chunk();
            int first = chunk.writeJump(OpCode.JUMP, 1);   // 0
            chunk.writeOp(OpCode.CALL, 0, 1);             // 3
            chunk.patchJump(first);
            int second = chunk.writeJump(OpCode.JUMP, 1);  // 5
            chunk.writeOp(OpCode.CALL, 0, 1);             // 8
            chunk.patchJump(second);
            chunk.writeOp(OpCode.NIL, 1);                 // 10
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertEquals(10, chunk.jumpTarget(0));
            assertEquals(OpCode.NIL, chunk.opAt(10));
        }

        @Test
        @DisplayName("条件跳转落在无条件跳转上时同样折叠")
        void testCollapseConditional() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.CALL, 0, 1);                 // 0
            int cond = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1); // 2
            chunk.writeOp(OpCode.CALL, 0, 1);                 // 5
            chunk.patchJump(cond);
            int jump = chunk.writeJump(OpCode.JUMP, 1);        // 7
            chunk.writeOp(OpCode.CALL, 0, 1);                 // 10
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.RETURN, 1);                  // 12

            optimizer.optimize(chunk);
            assertEquals(OpCode.RETURN, chunk.opAt(chunk.jumpTarget(2)));
        }

        @Test
        @DisplayName("距离为 0 的 JUMP 被删除")
        void testZeroDistanceJumpRemoved() {
            Chunk chunk = new Chunk();
            int jump = chunk.writeJump(OpCode.JUMP, 1);
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.NIL, OpCode.RETURN);
        }

        @Test
        @DisplayName("成环的跳转链保持原样且能终止")
        void testCycleLeftAlone() {
            Chunk chunk = new Chunk();
            int jump = chunk.writeJump(OpCode.JUMP, 1);  // 0 -> 3
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.CALL, 0, 1);           // 3
            chunk.writeLoop(3, 1);                      // 5 -> 3
            chunk.writeOp(OpCode.RETURN, 1);
            // 手工构造 0 -> 5, 5 -> 0 的环
            chunk.redirectJump(0, 5);
            chunk.redirectJump(5, 0);
            byte[] before = chunk.getCode();

            optimizer.optimize(chunk);
            assertArrayEquals(before, chunk.getCode());
        }
    }

    @Nested
    @DisplayName("常量特化与不动点")
    class SpecializationTests {

        @Test
        @DisplayName("nil/true/false 常量改为专用操作码，跳转仍然有效")
        void testSpecialize() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.TRUE);
            int jump = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1);
            chunk.writeOp(OpCode.CALL, 0, 1);
            chunk.patchJump(jump);
            constant(chunk, Value.NIL);
            constant(chunk, Value.FALSE);
            chunk.writeOp(OpCode.RETURN, 1);

            optimizer.optimize(chunk);
            assertThat(ops(chunk)).containsExactly(OpCode.TRUE, OpCode.JUMP_IF_FALSE, OpCode.CALL,
                    OpCode.NIL, OpCode.FALSE, OpCode.RETURN);
            assertEquals(OpCode.NIL, chunk.opAt(chunk.jumpTarget(1)));
            chunk.verify();
        }

        @Test
        @DisplayName("对自身输出再次优化没有变化")
        void testIdempotent() {
            Chunk chunk = new Chunk();
            constant(chunk, Value.number(1));
            constant(chunk, Value.number(2));
            chunk.writeOp(OpCode.ADD, 1);
            chunk.writeOp(OpCode.POP, 1);
            constant(chunk, Value.TRUE);
            int jump = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1);
            chunk.writeOp(OpCode.POP, 1);
            int skip = chunk.writeJump(OpCode.JUMP, 1);
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.POP, 1);
            chunk.patchJump(skip);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.writeOp(OpCode.RETURN, 1);

            OptimizationStats first = optimizer.optimize(chunk);
            assertTrue(first.getTotalRewrites() > 0);
            byte[] code = chunk.getCode();
            int[] lines = chunk.getLines();
            int constants = chunk.constantCount();

            OptimizationStats second = optimizer.optimize(chunk);
            assertEquals(0, second.getTotalRewrites());
            assertEquals(1, second.getRounds());
            assertArrayEquals(code, chunk.getCode());
            assertArrayEquals(lines, chunk.getLines());
            assertEquals(constants, chunk.constantCount());
        }
    }
}
