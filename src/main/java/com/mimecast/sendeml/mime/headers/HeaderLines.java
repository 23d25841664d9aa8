package com.mimecast.sendeml.mime.headers;

import org.apache.commons.lang3.RandomStringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Date and Message-ID header line matchers and generators.
 *
 * <p>Matching is an exact, case sensitive prefix comparison on the raw line bytes.
 * <br>So <i>X-Date:</i> never matches <i>Date:</i>.
 */
public final class HeaderLines {

    /**
     * Date field name with colon.
     */
    public static final String DATE = "Date:";

    /**
     * Message-ID field name with colon.
     */
    public static final String MESSAGE_ID = "Message-ID:";

    /**
     * Random Message-ID local part length.
     */
    public static final int MESSAGE_ID_LENGTH = 62;

    private static final byte[] DATE_BYTES = DATE.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MESSAGE_ID_BYTES = MESSAGE_ID.getBytes(StandardCharsets.US_ASCII);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);

    private HeaderLines() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Does line start with given field bytes.
     *
     * @param line  Line bytes.
     * @param field Field name bytes including colon.
     * @return Boolean.
     */
    public static boolean matchField(byte[] line, byte[] field) {
        if (line.length < field.length) {
            return false;
        }

        for (int i = 0; i < field.length; i++) {
            if (line[i] != field[i]) {
                return false;
            }
        }

        return true;
    }

    /**
     * Is Date line.
     *
     * @param line Line bytes.
     * @return Boolean.
     */
    public static boolean isDateLine(byte[] line) {
        return matchField(line, DATE_BYTES);
    }

    /**
     * Is Message-ID line.
     *
     * @param line Line bytes.
     * @return Boolean.
     */
    public static boolean isMessageIdLine(byte[] line) {
        return matchField(line, MESSAGE_ID_BYTES);
    }

    /**
     * Makes a Date line for the current time of given clock.
     * <p>Example: <i>Date: Mon, 19 Oct 2026 09:05:01 +0900</i> followed by CRLF.
     *
     * @param clock Clock instance.
     * @return Line string with CRLF.
     */
    public static String makeDateLine(Clock clock) {
        return "Date: " + ZonedDateTime.now(clock).format(DATE_FORMAT) + "\r\n";
    }

    /**
     * Makes a Message-ID line with a random alphanumeric identifier.
     *
     * @return Line string with CRLF.
     */
    public static String makeRandomMessageIdLine() {
        return "Message-ID: <" + RandomStringUtils.randomAlphanumeric(MESSAGE_ID_LENGTH) + ">\r\n";
    }
}
