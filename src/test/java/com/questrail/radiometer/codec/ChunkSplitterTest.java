package com.questrail.radiometer.codec;

import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static com.questrail.radiometer.codec.SpectrumChunkFixtures.concat;
import static com.questrail.radiometer.codec.SpectrumChunkFixtures.visChunk;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ChunkSplitter}.
 */
final class ChunkSplitterTest
{
    @Test
    void splitsChunksUsingLengthPrefixes()
    {
        byte[] file = concat(visChunk(1L), visChunk(2L, 100, 200), visChunk(3L, 7));

        List<Chunk> chunks = ChunkSplitter.splitAll(file);

        assertEquals(3, chunks.size());
        assertEquals(40, chunks.get(0).length());
        assertEquals(44, chunks.get(1).length());
        assertEquals(42, chunks.get(2).length());

        assertEquals(0, chunks.get(0).offset());
        assertEquals(40, chunks.get(1).offset());
        assertEquals(84, chunks.get(2).offset());

        assertEquals(2, chunks.get(2).index());
    }

    @Test
    void chunkLengthsSumToFileSize()
    {
        byte[] file = concat(visChunk(1L, 1, 2, 3), visChunk(2L), visChunk(3L, 9, 9));

        int total = 0;
        for (Chunk chunk : ChunkSplitter.split(file)) {
            total += chunk.length();
        }

        assertEquals(file.length, total);
    }

    @Test
    void chunksIncludeTheirLengthPrefix()
    {
        byte[] file = new byte[] { 0x03, 0x00, 0x7F, 0x02, 0x00 };

        List<Chunk> chunks = ChunkSplitter.splitAll(file);

        assertEquals(2, chunks.size());
        assertArrayEquals(new byte[] { 0x03, 0x00, 0x7F }, chunks.get(0).bytes());
        assertArrayEquals(new byte[] { 0x02, 0x00 }, chunks.get(1).bytes());
    }

    @Test
    void emptyBufferHasNoChunks()
    {
        assertTrue(ChunkSplitter.splitAll(new byte[0]).isEmpty());
    }

    @Test
    void iterationIsRestartable()
    {
        Iterable<Chunk> chunks = ChunkSplitter.split(concat(visChunk(1L), visChunk(2L)));

        assertEquals(2, count(chunks));
        assertEquals(2, count(chunks));
    }

    @Test
    void laterMutationOfCallerBufferIsNotObserved()
    {
        byte[] file = concat(visChunk(1L), visChunk(2L));
        Iterable<Chunk> chunks = ChunkSplitter.split(file);

        file[0] = 0x01;

        assertEquals(2, count(chunks));
    }

    @Test
    void truncatedLengthPrefix()
    {
        byte[] file = concat(visChunk(1L), new byte[] { 0x28 });

        TruncatedLengthPrefixException e = assertThrows(
                TruncatedLengthPrefixException.class, () -> ChunkSplitter.splitAll(file));

        assertEquals(40, e.offset());
        assertEquals(2, e.expected());
        assertEquals(1, e.actual());
    }

    @Test
    void chunkClaimingLengthOneIsMalformed()
    {
        byte[] file = new byte[] { 0x01, 0x00, 0x00 };

        MalformedChunkException e = assertThrows(
                MalformedChunkException.class, () -> ChunkSplitter.splitAll(file));

        assertEquals(0, e.offset());
        assertEquals(1, e.actual());
    }

    @Test
    void chunkClaimingLengthZeroIsMalformed()
    {
        assertThrows(MalformedChunkException.class,
                () -> ChunkSplitter.splitAll(new byte[] { 0x00, 0x00 }));
    }

    @Test
    void chunkRunningPastEndOfBufferIsMalformed()
    {
        byte[] valid = visChunk(1L, 5, 6);
        byte[] file = concat(valid, new byte[] { 0x10, 0x00, 0x01, 0x02 });

        MalformedChunkException e = assertThrows(
                MalformedChunkException.class, () -> ChunkSplitter.splitAll(file));

        assertEquals(valid.length, e.offset());
        assertEquals(16, e.expected());
        assertEquals(4, e.actual());
        assertTrue(e.getMessage().contains("offset " + valid.length));
    }

    @Test
    void chunksBeforeADefectAreStillProduced()
    {
        Iterator<Chunk> it = ChunkSplitter.split(concat(visChunk(1L), new byte[] { 0x05 })).iterator();

        assertTrue(it.hasNext());
        assertEquals(40, it.next().length());
        assertTrue(it.hasNext());
        assertThrows(TruncatedLengthPrefixException.class, it::next);
    }

    @Test
    void readLengthPrefixIsLittleEndian()
    {
        assertEquals(0x1234, ChunkSplitter.readLengthPrefix(new byte[] { 0x34, 0x12 }, 0));
        assertEquals(0xFFFF, ChunkSplitter.readLengthPrefix(new byte[] { 0x00, (byte) 0xFF, (byte) 0xFF }, 1));
    }

    private static int count(Iterable<Chunk> chunks)
    {
        int n = 0;
        for (Chunk ignored : chunks) {
            n++;
        }
        return n;
    }
}
