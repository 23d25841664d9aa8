package com.mimecast.sendeml.mime.headers;

import com.mimecast.sendeml.mime.LineScanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Date and Message-ID header rewriter.
 *
 * <p>Replaces the first <i>Date:</i> and/or <i>Message-ID:</i> line of a header block
 * with a freshly generated single line value.
 * <p>Folded continuation lines of a replaced field are dropped since the new line carries the full value.
 * <p>Every other header byte is preserved as is.
 */
public class HeaderRewriter {
    private static final Logger log = LogManager.getLogger(HeaderRewriter.class);

    /**
     * Clock used for new Date values.
     */
    private final Clock clock;

    /**
     * Constructs a new HeaderRewriter instance using the system clock and zone.
     */
    public HeaderRewriter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Constructs a new HeaderRewriter instance with given clock.
     *
     * @param clock Clock instance.
     */
    public HeaderRewriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Rewrites header block.
     * <p>If neither update is requested the same array instance is returned.
     *
     * @param header          Header block bytes without the separating blank line.
     * @param updateDate      Replace Date line.
     * @param updateMessageId Replace Message-ID line.
     * @return Header bytes.
     */
    public byte[] rewrite(byte[] header, boolean updateDate, boolean updateMessageId) {
        if (!updateDate && !updateMessageId) {
            return header;
        }

        List<byte[]> lines = rewriteLines(LineScanner.lines(header), updateDate, updateMessageId);
        byte[] result = LineScanner.concat(lines);

        // The header block ends right before the blank line so its last line carries no EOL.
        // A generated line replacing it must not add one or the body would gain a leading empty line.
        if (!endsWithLf(header) && endsWithLf(result)) {
            int trim = result.length > 1 && result[result.length - 2] == LineScanner.CR ? 2 : 1;
            byte[] trimmed = new byte[result.length - trim];
            System.arraycopy(result, 0, trimmed, 0, trimmed.length);
            result = trimmed;
        }

        return result;
    }

    /**
     * Rewrites header lines.
     * <p>The given list is modified in place and returned.
     *
     * @param lines           Mutable list of header lines.
     * @param updateDate      Replace Date line.
     * @param updateMessageId Replace Message-ID line.
     * @return Lines list.
     */
    public List<byte[]> rewriteLines(List<byte[]> lines, boolean updateDate, boolean updateMessageId) {
        if (updateDate) {
            replaceLine(lines, HeaderLines::isDateLine, () -> HeaderLines.makeDateLine(clock));
        }
        if (updateMessageId) {
            replaceLine(lines, HeaderLines::isMessageIdLine, HeaderLines::makeRandomMessageIdLine);
        }

        return lines;
    }

    /**
     * Finds the first matching line.
     *
     * @param lines   Header lines.
     * @param matcher Line predicate.
     * @return Index or -1 if not found.
     */
    public static int findLine(List<byte[]> lines, Predicate<byte[]> matcher) {
        for (int i = 0; i < lines.size(); i++) {
            if (matcher.test(lines.get(i))) {
                return i;
            }
        }

        return -1;
    }

    /**
     * Replaces the first matching line and removes its folded continuation lines.
     *
     * @param lines    Header lines.
     * @param matcher  Line predicate.
     * @param supplier New line supplier.
     */
    private void replaceLine(List<byte[]> lines, Predicate<byte[]> matcher, Supplier<String> supplier) {
        int idx = findLine(lines, matcher);
        if (idx == -1) {
            log.debug("Header line not found, nothing to replace");
            return;
        }

        String line = supplier.get();
        lines.set(idx, line.getBytes(StandardCharsets.UTF_8));
        log.debug("Replaced header line: {}", line.trim());

        int removed = 0;
        while (idx + 1 < lines.size() && LineScanner.isContinuation(lines.get(idx + 1))) {
            lines.remove(idx + 1);
            removed++;
        }

        if (removed > 0) {
            log.debug("Removed {} folded continuation line(s)", removed);
        }
    }

    /**
     * Does buffer end with LF.
     *
     * @param buf Byte array.
     * @return Boolean.
     */
    private static boolean endsWithLf(byte[] buf) {
        return buf.length > 0 && buf[buf.length - 1] == LineScanner.LF;
    }
}
