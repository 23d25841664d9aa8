package com.mimecast.sendeml.smtp;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single SMTP reply line.
 *
 * <p>A reply line is a three digit code followed by a space (last line) or hyphen (more lines follow).
 * <br>A bare code with no text is accepted as a last line.
 *
 * @param code         Three digit status code or -1 if the line does not follow the reply grammar.
 * @param continuation True if more lines of the same reply follow.
 * @param text         Text after the separator.
 * @param line         Full line as received, trailing whitespace removed.
 */
public record SmtpReply(int code, boolean continuation, String text, String line) {

    /**
     * Reply line pattern.
     */
    private static final Pattern REPLY_PATTERN = Pattern.compile("^(\\d{3})(?:([ -])(.*))?$");

    /**
     * Parses reply line.
     *
     * @param line Line string without EOL.
     * @return SmtpReply instance.
     */
    public static SmtpReply parse(String line) {
        Matcher matcher = REPLY_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return new SmtpReply(-1, true, line, line);
        }

        boolean continuation = "-".equals(matcher.group(2));
        String text = matcher.group(3) != null ? matcher.group(3) : "";
        return new SmtpReply(Integer.parseInt(matcher.group(1)), continuation, text, line);
    }

    /**
     * Is last line of a reply.
     *
     * @return Boolean.
     */
    public boolean isLast() {
        return code != -1 && !continuation;
    }

    /**
     * Is positive reply.
     * <p>First digit 2 (completion) or 3 (intermediate).
     *
     * @return Boolean.
     */
    public boolean isPositive() {
        return line.startsWith("2") || line.startsWith("3");
    }

    @Override
    public String toString() {
        return line;
    }
}
