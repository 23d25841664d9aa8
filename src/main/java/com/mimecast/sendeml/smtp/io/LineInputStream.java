package com.mimecast.sendeml.smtp.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>InputStream implementation returns lines with EOL as byte array and counts lines.
 * <p>Lines end at LF, a lone CR is treated as line end too.
 */
public class LineInputStream extends PushbackInputStream {

    /**
     * Carrige return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Initial line buffer size (typical SMTP reply line is well under 512 bytes).
     */
    private static final int LINE_BUFFER_INITIAL_SIZE = 512;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(LINE_BUFFER_INITIAL_SIZE);

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        super(stream);
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array or null if end of stream was reached before any byte.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        int intByte;
        while ((intByte = read()) != -1) {
            lineBuffer.write(intByte);

            if (intByte == LF) {
                break;
            }

            if (intByte == CR) {
                int next = read();
                if (next == LF) {
                    lineBuffer.write(next);
                } else if (next != -1) {
                    unread(next);
                }
                break;
            }
        }

        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }
}
