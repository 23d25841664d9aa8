package com.mimecast.sendeml.mime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Raw byte line scanner.
 *
 * <p>Splits a byte buffer into lines terminated by LF.
 * <p>Every returned line keeps its own terminator (LF, or CRLF when the CR precedes it).
 * <br>The last line may be unterminated if the buffer does not end with LF.
 * <p>Lines are copies, the source buffer is never aliased.
 */
public final class LineScanner {

    /**
     * Carriage return byte.
     */
    public static final byte CR = 13; // \r

    /**
     * Line feed byte.
     */
    public static final byte LF = 10; // \n

    /**
     * Space byte.
     */
    public static final byte SPACE = 32;

    /**
     * Horizontal tab byte.
     */
    public static final byte HTAB = 9;

    private LineScanner() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Finds the index of given byte starting at offset.
     *
     * @param buf    Byte array.
     * @param value  Byte to look for.
     * @param offset Start offset.
     * @return Index or -1 if not found.
     */
    public static int indexOf(byte[] buf, byte value, int offset) {
        for (int i = Math.max(offset, 0); i < buf.length; i++) {
            if (buf[i] == value) {
                return i;
            }
        }

        return -1;
    }

    /**
     * Finds the indices of all LF bytes.
     *
     * @param buf Byte array.
     * @return List of indices in ascending order.
     */
    public static List<Integer> lfIndices(byte[] buf) {
        List<Integer> indices = new ArrayList<>();
        int offset = 0;
        int idx;
        while ((idx = indexOf(buf, LF, offset)) != -1) {
            indices.add(idx);
            offset = idx + 1;
        }

        return indices;
    }

    /**
     * Splits buffer into lines.
     * <p>The lines cover the whole buffer with no gaps and no overlaps.
     * <br>An empty buffer yields an empty list.
     *
     * @param buf Byte array.
     * @return List of line byte arrays.
     */
    public static List<byte[]> lines(byte[] buf) {
        List<byte[]> lines = new ArrayList<>();
        int offset = 0;
        for (int idx : lfIndices(buf)) {
            lines.add(Arrays.copyOfRange(buf, offset, idx + 1));
            offset = idx + 1;
        }

        // Unterminated tail.
        if (offset < buf.length) {
            lines.add(Arrays.copyOfRange(buf, offset, buf.length));
        }

        return lines;
    }

    /**
     * Concatenates byte arrays into a new buffer.
     *
     * @param chunks Byte arrays.
     * @return New byte array.
     */
    public static byte[] concat(List<byte[]> chunks) {
        int size = 0;
        for (byte[] chunk : chunks) {
            size += chunk.length;
        }

        byte[] buf = new byte[size];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, buf, offset, chunk.length);
            offset += chunk.length;
        }

        return buf;
    }

    /**
     * Is folding whitespace (space or horizontal tab).
     *
     * @param b Byte.
     * @return Boolean.
     */
    public static boolean isWsp(byte b) {
        return b == SPACE || b == HTAB;
    }

    /**
     * Is line a folding continuation.
     * <p>A continuation line starts with space or horizontal tab.
     *
     * @param line Line bytes.
     * @return Boolean.
     */
    public static boolean isContinuation(byte[] line) {
        return line.length > 0 && isWsp(line[0]);
    }
}
