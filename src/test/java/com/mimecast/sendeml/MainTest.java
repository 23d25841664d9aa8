package com.mimecast.sendeml;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static class CapturingMain extends Main {
        private final List<String> lines = new ArrayList<>();

        CapturingMain(String... args) {
            super(args);
        }

        @Override
        void log(String string) {
            lines.add(string);
        }
    }

    @Test
    void version() {
        CapturingMain main = new CapturingMain("--version");

        assertEquals(0, main.run());
        assertEquals(List.of("SendEML / Version: 1.5"), main.lines);
    }

    @Test
    void usage() {
        CapturingMain main = new CapturingMain();

        assertEquals(0, main.run());
        assertEquals(Main.USAGE, main.lines.get(0));
        assertEquals("---", main.lines.get(1));
        assertTrue(main.lines.contains("json_file sample:"));
        assertTrue(main.lines.get(main.lines.size() - 1).contains("\"smtpHost\""));
    }

    @Test
    void help() {
        CapturingMain main = new CapturingMain("-h");

        assertEquals(0, main.run());
        assertEquals(Main.USAGE, main.lines.get(0));

        String help = String.join("\n", main.lines);
        assertTrue(help.contains("--version"));
        assertTrue(help.contains("Show version"));
        assertTrue(help.contains("--help"));
    }

    @Test
    void missingSettings() {
        CapturingMain main = new CapturingMain("src/test/resources/cfg/missing.json", "src/test/resources/cfg/other.json");

        assertEquals(2, main.run());
    }
}
