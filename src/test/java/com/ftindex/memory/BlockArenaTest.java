package com.ftindex.memory;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ftindex.config.IndexConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlockArenaTest {

    @Test
    @DisplayName("释放的块被复用且清零")
    void releasedBlockIsReusedZeroFilled() {
        BlockArena arena = new BlockArena(8, 4);
        int first = arena.acquire(8);
        arena.block(first)[3] = 42;

        arena.release(first);
        assertEquals(1, arena.freeBlocks());
        int reused = arena.acquire(4);

        assertEquals(first, reused);
        assertEquals(0, arena.block(reused)[3]);
        assertEquals(8L, arena.bytesUsed());
        assertEquals(1, arena.liveBlocks());
    }

    @Test
    @DisplayName("块表写满后申请失败")
    void exhaustedArenaThrows() {
        BlockArena arena = new BlockArena(16, 2);
        arena.acquire(16);
        arena.acquire(1);

        ArenaExhaustedException exception = assertThrows(ArenaExhaustedException.class, () -> arena.acquire(1));
        assertEquals(16, exception.getBlockSize());
        assertEquals(2, exception.getMaxBlocks());
        assertNull(exception.getCause());
    }

    @Test
    void invalidRequestsAreRejected() {
        BlockArena arena = new BlockArena(16, 2);
        int handle = arena.acquire(1);

        assertThrows(IllegalArgumentException.class, () -> arena.acquire(17));
        assertThrows(IllegalArgumentException.class, () -> arena.acquire(0));
        arena.release(handle);
        assertThrows(IllegalStateException.class, () -> arena.release(handle));
        assertThrows(IllegalStateException.class, () -> arena.block(handle));
        assertThrows(IllegalStateException.class, () -> arena.release(99));
    }

    @Test
    void resetInvalidatesAllHandles() {
        BlockArena arena = new BlockArena(4, 8);
        int first = arena.acquire(4);
        arena.acquire(4);
        arena.acquire(4);

        arena.reset();

        assertEquals(0, arena.liveBlocks());
        assertEquals(3, arena.freeBlocks());
        assertThrows(IllegalStateException.class, () -> arena.block(first));
        arena.acquire(4);
        arena.acquire(4);
        arena.acquire(4);
        assertEquals(12L, arena.bytesUsed(), "reset 之后应复用已有块");
    }

    @Test
    @DisplayName("切片流跨块写入后按原样读回")
    void byteSliceStreamSpansBlocks() {
        BlockArena arena = new BlockArena(5, 16);
        ByteSliceOutput output = new ByteSliceOutput(arena);
        byte[] payload = new byte[23];
        for (int index = 0; index < payload.length; index++) {
            payload[index] = (byte) (index * 7);
        }

        output.write(payload, 0, 10);
        output.write(payload[10]);
        output.write(payload, 11, 12);

        assertEquals(23L, output.length());
        assertEquals(5, arena.liveBlocks());
        assertArrayEquals(payload, output.toByteArray());

        ByteSliceInput input = output.newInput();
        for (byte expected : payload) {
            assertEquals(expected & 0xFF, input.read());
        }
        assertTrue(input.eof());
        assertEquals(-1, input.read());
    }

    @Test
    void releasedSliceStreamReturnsBlocks() {
        BlockArena arena = new BlockArena(4, 16);
        ByteSliceOutput output = new ByteSliceOutput(arena);
        output.write(new byte[10], 0, 10);

        output.release();
        output.release();

        assertTrue(output.isReleased());
        assertEquals(0, arena.liveBlocks());
        assertEquals(3, arena.freeBlocks());
        assertThrows(IllegalStateException.class, () -> output.write(1));
    }

    @Test
    @DisplayName("多个切片流共用同一块，最后一个归还时块才回到空闲栈")
    void sliceStreamsShareBlocks() {
        BlockArena arena = new BlockArena(256, 4);
        ByteSliceOutput first = new ByteSliceOutput(arena);
        ByteSliceOutput second = new ByteSliceOutput(arena);
        for (int index = 0; index < 30; index++) {
            first.write(index);
            second.write(100 + index);
        }

        assertEquals(1, arena.liveBlocks());
        byte[] expected = new byte[30];
        for (int index = 0; index < expected.length; index++) {
            expected[index] = (byte) (100 + index);
        }
        assertArrayEquals(expected, second.toByteArray());
        ByteSliceInput input = first.newInput();
        for (int index = 0; index < 30; index++) {
            assertEquals(index, input.read());
        }

        first.release();
        assertEquals(1, arena.liveBlocks());
        second.release();
        assertEquals(0, arena.liveBlocks());
        assertEquals(1, arena.freeBlocks());
    }

    @Test
    void sliceAddressesAreValidated() {
        BlockArena arena = new BlockArena(16, 2);
        long address = arena.allocSlice(5);
        int handle = BlockArena.sliceBlock(address);

        assertEquals(0, BlockArena.sliceOffset(address));
        assertEquals(5, BlockArena.sliceOffset(arena.allocSlice(5)));
        assertThrows(IllegalArgumentException.class, () -> arena.allocSlice(17));
        assertThrows(IllegalStateException.class, () -> arena.release(handle));
        arena.releaseSlice(address);
        assertEquals(1, arena.liveBlocks());
    }

    @Test
    void postingArenasFollowConfig() {
        IndexConfig config = IndexConfig.defaults();
        config.setByteSliceBlockSize(32);
        config.setBufferBlockSize(64);

        PostingArenas arenas = PostingArenas.create(config);
        arenas.byteSlicePool().acquire(32);
        arenas.bufferPool().acquire(1);

        assertEquals(32, arenas.byteSlicePool().blockSize());
        assertEquals(64, arenas.bufferPool().blockSize());
        assertEquals(96L, arenas.bytesUsed());
    }
}
