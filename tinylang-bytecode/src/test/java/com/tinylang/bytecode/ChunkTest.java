package com.tinylang.bytecode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chunk 单元测试
 */
class ChunkTest {

    @Nested
    @DisplayName("追加与读取")
    class WriteTests {

        @Test
        @DisplayName("2 字节操作数按小端写入")
        void testShortOperandLittleEndian() {
            Chunk chunk = new Chunk();
            chunk.writeShortOp(OpCode.JUMP, 0x1234, 1);
            byte[] code = chunk.getCode();
            assertEquals(OpCode.JUMP.getCode(), code[0]);
            assertEquals(0x34, code[1] & 0xFF);
            assertEquals(0x12, code[2] & 0xFF);
            assertEquals(0x1234, chunk.readShort(1));
        }

        @Test
        @DisplayName("行号表与指令字节一一对应")
        void testLineTableParallel() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.CONSTANT, chunk.addConstant(Value.number(1)), 3);
            chunk.writeOp(OpCode.RETURN, 4);
            assertArrayEquals(new int[]{3, 3, 4}, chunk.getLines());
        }

        @Test
        @DisplayName("常量池最多 256 项")
        void testConstantLimit() {
            Chunk chunk = new Chunk();
            for (int i = 0; i < Chunk.MAX_CONSTANTS; i++) {
                assertEquals(i, chunk.addConstant(Value.number(i)));
            }
            assertThrows(ChunkLimitException.class, () -> chunk.addConstant(Value.number(999)));
        }

        @Test
        @DisplayName("internConstant 区分 0 与 -0")
        void testInternDistinguishesNegativeZero() {
            Chunk chunk = new Chunk();
            int zero = chunk.internConstant(Value.number(0.0));
            int negZero = chunk.internConstant(Value.number(-0.0));
            assertNotEquals(zero, negZero);
            assertEquals(zero, chunk.internConstant(Value.number(0.0)));
        }

        @Test
        @DisplayName("前向跳转回填到当前末尾")
        void testPatchJump() {
            Chunk chunk = new Chunk();
            int jump = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.patchJump(jump);
            assertEquals(5, chunk.jumpTarget(0));
            assertEquals(chunk.count(), chunk.jumpTarget(0));
        }

        @Test
        @DisplayName("LOOP 回跳到循环头")
        void testWriteLoop() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.NIL, 1);
            chunk.writeOp(OpCode.POP, 1);
            chunk.writeLoop(0, 1);
            assertEquals(0, chunk.jumpTarget(2));
        }
    }

    @Nested
    @DisplayName("结构性编辑与跳转重定位")
    class SpliceTests {

        /**
         * 0: JUMP_IF_FALSE -> 6
         * 3: CONSTANT 0
         * 5: POP
         * 6: NIL
         * 7: RETURN
         */
        private Chunk forwardJumpChunk() {
            Chunk chunk = new Chunk();
            int jump = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1);
            chunk.writeOp(OpCode.CONSTANT, chunk.addConstant(Value.number(7)), 2);
            chunk.writeOp(OpCode.POP, 2);
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.NIL, 3);
            chunk.writeOp(OpCode.RETURN, 3);
            return chunk;
        }

        @Test
        @DisplayName("删除跳转区间内的指令后前向跳转跟着缩短")
        void testRemoveInsideForwardJump() {
            Chunk chunk = forwardJumpChunk();
            chunk.removeInstruction(3);
            assertEquals(4, chunk.jumpTarget(0));
            assertEquals(OpCode.NIL, chunk.opAt(4));
            assertArrayEquals(new int[]{1, 1, 1, 2, 3, 3}, chunk.getLines());
            chunk.verify();
        }

        @Test
        @DisplayName("删除的指令正是跳转目标时落到后继指令")
        void testRemoveJumpTarget() {
            Chunk chunk = forwardJumpChunk();
            chunk.removeInstruction(6);
            assertEquals(6, chunk.jumpTarget(0));
            assertEquals(OpCode.RETURN, chunk.opAt(6));
            chunk.verify();
        }

        @Test
        @DisplayName("删除回跳区间内的指令后 LOOP 距离跟着缩短")
        void testRemoveInsideLoop() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.NIL, 1);                                   // 0 循环头
            chunk.writeOp(OpCode.CONSTANT, chunk.addConstant(Value.NIL), 1); // 1
            chunk.writeOp(OpCode.POP, 1);                                   // 3
            chunk.writeLoop(0, 1);                                          // 4
            chunk.writeOp(OpCode.RETURN, 1);                                // 7

            chunk.removeInstruction(1);
            assertEquals(OpCode.LOOP, chunk.opAt(2));
            assertEquals(0, chunk.jumpTarget(2));
            assertEquals(5, chunk.readShort(3));
            chunk.verify();
        }

        @Test
        @DisplayName("编辑区之前的跳转与目标都不受影响")
        void testJumpBeforeEditUntouched() {
            Chunk chunk = new Chunk();
            int jump = chunk.writeJump(OpCode.JUMP, 1);
            chunk.writeOp(OpCode.NIL, 1);
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.POP, 1);       // 4
            chunk.writeOp(OpCode.NIL, 1);       // 5
            chunk.writeOp(OpCode.POP, 1);       // 6

            chunk.removeInstruction(6);
            assertEquals(4, chunk.jumpTarget(0));
            chunk.verify();
        }

        @Test
        @DisplayName("插入指令：指向插入点的跳转落在新指令上，其后的跳转平移")
        void testInsertRelocation() {
            Chunk chunk = forwardJumpChunk();
            chunk.insertInstruction(6, OpCode.TRUE, 0, 9);
            assertEquals(6, chunk.jumpTarget(0));
            assertEquals(OpCode.TRUE, chunk.opAt(6));
            assertEquals(9, chunk.lineAt(6));
            assertEquals(OpCode.NIL, chunk.opAt(7));

            chunk.insertInstruction(3, OpCode.FALSE, 0, 9);
            assertEquals(7, chunk.jumpTarget(0));
            chunk.verify();
        }

        @Test
        @DisplayName("替换为不同长度的指令")
        void testReplaceDifferentLength() {
            Chunk chunk = forwardJumpChunk();
            chunk.replaceInstruction(3, OpCode.NIL, 0);
            assertEquals(OpCode.NIL, chunk.opAt(3));
            assertEquals(OpCode.POP, chunk.opAt(4));
            assertEquals(5, chunk.jumpTarget(0));
            assertEquals(2, chunk.lineAt(3));
            assertEquals(7, chunk.count());
            chunk.verify();
        }

        @Test
        @DisplayName("跨越编辑区的多条跳转全部重定位")
        void testMultipleJumpsAcrossEdit() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.NIL, 1);                  // 0 循环头
            int exit = chunk.writeJump(OpCode.JUMP_IF_FALSE, 1); // 1
            chunk.writeOp(OpCode.CONSTANT, chunk.addConstant(Value.number(1)), 1); // 4
            chunk.writeOp(OpCode.POP, 1);                  // 6
            chunk.writeLoop(0, 1);                         // 7
            chunk.patchJump(exit);                         // -> 10
            chunk.writeOp(OpCode.RETURN, 1);               // 10

            chunk.removeInstruction(4);
            assertEquals(8, chunk.jumpTarget(1));
            assertEquals(0, chunk.jumpTarget(5));
            assertEquals(OpCode.RETURN, chunk.opAt(8));
            chunk.verify();
        }

        @Test
        @DisplayName("redirectJump 按方向在 JUMP 与 LOOP 之间切换")
        void testRedirectSwitchesDirection() {
            Chunk chunk = new Chunk();
            chunk.writeOp(OpCode.NIL, 1);
            int jump = chunk.writeJump(OpCode.JUMP, 1);
            chunk.patchJump(jump);
            chunk.writeOp(OpCode.RETURN, 1);

            chunk.redirectJump(1, 0);
            assertEquals(OpCode.LOOP, chunk.opAt(1));
            assertEquals(0, chunk.jumpTarget(1));

            chunk.redirectJump(1, 4);
            assertEquals(OpCode.JUMP, chunk.opAt(1));
            assertEquals(4, chunk.jumpTarget(1));
        }

        @Test
        @DisplayName("JUMP_IF_FALSE 不允许回跳")
        void testConditionalCannotJumpBackward() {
            Chunk chunk = forwardJumpChunk();
            assertThrows(IllegalArgumentException.class, () -> chunk.redirectJump(0, 0));
        }
    }

    @Nested
    @DisplayName("结构校验")
    class VerifyTests {

        @Test
        @DisplayName("跳转落在操作数中间")
        void testJumpIntoOperand() {
            byte[] code = {
                    OpCode.JUMP.getCode(), 1, 0,
                    OpCode.CONSTANT.getCode(), 0,
                    OpCode.RETURN.getCode()
            };
            int[] lines = new int[code.length];
            Chunk chunk = new Chunk(code, lines, Arrays.asList(Value.NIL));
            IllegalStateException e = assertThrows(IllegalStateException.class, chunk::verify);
            assertTrue(e.getMessage().contains("instruction boundary"));
        }

        @Test
        @DisplayName("常量索引越界")
        void testConstantOutOfRange() {
            byte[] code = {OpCode.CONSTANT.getCode(), 3};
            Chunk chunk = new Chunk(code, new int[2], Arrays.asList(Value.NIL));
            assertThrows(IllegalStateException.class, chunk::verify);
        }

        @Test
        @DisplayName("操作数截断")
        void testTruncatedOperand() {
            byte[] code = {OpCode.JUMP.getCode(), 0};
            Chunk chunk = new Chunk(code, new int[2], Arrays.asList());
            assertThrows(IllegalStateException.class, chunk::verify);
        }

        @Test
        @DisplayName("行号表长度必须与指令一致")
        void testLineTableMismatch() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Chunk(new byte[]{OpCode.NIL.getCode()}, new int[0], Arrays.asList()));
        }
    }
}
