package com.mimecast.sendeml.mime.headers;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class HeaderLinesTest {

    private static byte[] bytes(String string) {
        return string.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void isDateLine() {
        assertTrue(HeaderLines.isDateLine(bytes("Date: xxx")));
        assertTrue(HeaderLines.isDateLine(bytes("Date:")));
        assertFalse(HeaderLines.isDateLine(bytes("xxx: Date")));
        assertFalse(HeaderLines.isDateLine(bytes("X-Date: xxx")));
        assertFalse(HeaderLines.isDateLine(bytes("date: xxx")));
        assertFalse(HeaderLines.isDateLine(bytes("Date")));
        assertFalse(HeaderLines.isDateLine(new byte[0]));
    }

    @Test
    void isMessageIdLine() {
        assertTrue(HeaderLines.isMessageIdLine(bytes("Message-ID: xxx")));
        assertFalse(HeaderLines.isMessageIdLine(bytes("xxx: Message-ID")));
        assertFalse(HeaderLines.isMessageIdLine(bytes("X-Message-ID: xxx")));
        assertFalse(HeaderLines.isMessageIdLine(bytes("Message-Id: xxx")));
    }

    @Test
    void makeDateLine() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:05:01Z"), ZoneOffset.ofHours(9));

        assertEquals("Date: Mon, 19 Oct 2026 18:05:01 +0900\r\n", HeaderLines.makeDateLine(clock));
    }

    @Test
    void makeDateLineNegativeOffset() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-05T03:00:00Z"), ZoneOffset.ofHoursMinutes(-3, -30));

        assertEquals("Date: Sun, 04 Jan 2026 23:30:00 -0330\r\n", HeaderLines.makeDateLine(clock));
    }

    @Test
    void makeNowDateLine() {
        String line = HeaderLines.makeDateLine(Clock.systemDefaultZone());

        assertTrue(line.startsWith("Date: "));
        assertTrue(line.endsWith("\r\n"));
        assertTrue(line.length() <= 80);
    }

    @Test
    void makeRandomMessageIdLine() {
        Pattern pattern = Pattern.compile("^Message-ID: <[A-Za-z0-9]{62}>\r\n$");

        Set<String> lines = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String line = HeaderLines.makeRandomMessageIdLine();
            assertTrue(pattern.matcher(line).matches(), line);
            assertTrue(line.length() <= 80);
            lines.add(line);
        }

        assertEquals(100, lines.size());
    }
}
