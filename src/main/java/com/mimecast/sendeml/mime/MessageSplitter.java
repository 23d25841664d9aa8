package com.mimecast.sendeml.mime;

import java.util.Arrays;
import java.util.List;

import static com.mimecast.sendeml.mime.LineScanner.CR;
import static com.mimecast.sendeml.mime.LineScanner.LF;

/**
 * Header and body splitter.
 *
 * <p>The header block ends at the first blank line (CRLF CRLF).
 * <br>The four blank line bytes belong to neither part.
 */
public final class MessageSplitter {

    /**
     * Blank line separating header from body.
     */
    public static final byte[] EMPTY_LINE = {CR, LF, CR, LF};

    private MessageSplitter() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Finds the offset of the first CRLF CRLF sequence.
     *
     * @param buf Message bytes.
     * @return Offset of the first CR or -1 if not found.
     */
    public static int findEmptyLine(byte[] buf) {
        int offset = 0;
        while (true) {
            int idx = LineScanner.indexOf(buf, CR, offset);
            if (idx == -1 || idx + 3 >= buf.length) {
                return -1;
            }

            if (buf[idx + 1] == LF && buf[idx + 2] == CR && buf[idx + 3] == LF) {
                return idx;
            }

            offset = idx + 1;
        }
    }

    /**
     * Splits message into header and body.
     *
     * @param buf Message bytes.
     * @return Parts instance holding copies of both blocks.
     * @throws MalformedMessageException No blank line found.
     */
    public static Parts split(byte[] buf) throws MalformedMessageException {
        int idx = findEmptyLine(buf);
        if (idx == -1) {
            throw new MalformedMessageException("Invalid mail");
        }

        return new Parts(
                Arrays.copyOfRange(buf, 0, idx),
                Arrays.copyOfRange(buf, idx + EMPTY_LINE.length, buf.length));
    }

    /**
     * Combines header and body with a blank line in between.
     *
     * @param header Header bytes.
     * @param body   Body bytes.
     * @return New message byte array.
     */
    public static byte[] combine(byte[] header, byte[] body) {
        return LineScanner.concat(List.of(header, EMPTY_LINE, body));
    }

    /**
     * Split message container.
     *
     * @param header Header block without the blank line.
     * @param body   Body block after the blank line.
     */
    public record Parts(byte[] header, byte[] body) {
    }
}
