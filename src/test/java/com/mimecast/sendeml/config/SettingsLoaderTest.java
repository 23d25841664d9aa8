package com.mimecast.sendeml.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettingsLoaderTest {

    static final String dir = "src/test/resources/";

    private static final String MINIMAL = "{\"smtpHost\": \"localhost\", \"smtpPort\": 2525, " +
            "\"fromAddress\": \"a001@ah62.example.jp\", \"toAddresses\": [\"a002@ah62.example.jp\"], " +
            "\"emlFiles\": [\"test1.eml\"]}";

    private static String replace(String key, String value) {
        return MINIMAL.replaceFirst("\"" + key + "\": (\\[[^\\]]*\\]|\"[^\"]*\"|\\d+)", "\"" + key + "\": " + value);
    }

    private static String message(String json) {
        return assertThrows(SettingsException.class, () -> SettingsLoader.fromText(json)).getMessage();
    }

    @Test
    @DisplayName("Load settings file with comments")
    void load() throws SettingsException {
        Settings settings = SettingsLoader.load(dir + "cfg/settings.json");

        assertEquals("172.16.3.151", settings.getSmtpHost());
        assertEquals(25, settings.getSmtpPort());
        assertEquals("a001@ah62.example.jp", settings.getFromAddress());
        assertEquals(List.of("a001@ah62.example.jp", "a002@ah62.example.jp", "a003@ah62.example.jp"), settings.getToAddresses());
        assertEquals(List.of("test1.eml", "test2.eml", "test3.eml"), settings.getEmlFiles());
        assertTrue(settings.isUpdateDate());
        assertFalse(settings.isUpdateMessageId());
        assertTrue(settings.isUseParallel());
        assertEquals(30000, settings.getTimeout());
    }

    @Test
    void defaults() throws SettingsException {
        Settings settings = SettingsLoader.fromText(MINIMAL);

        assertEquals("localhost", settings.getSmtpHost());
        assertEquals(2525, settings.getSmtpPort());
        assertTrue(settings.isUpdateDate());
        assertTrue(settings.isUpdateMessageId());
        assertFalse(settings.isUseParallel());
        assertEquals(0, settings.getTimeout());
    }

    @Test
    void sample() throws SettingsException {
        Settings settings = SettingsLoader.fromText(SettingsLoader.sample());

        assertEquals(3, settings.getToAddresses().size());
        assertEquals(3, settings.getEmlFiles().size());
        assertFalse(settings.isUseParallel());
    }

    @Test
    void missingFile() {
        SettingsException e = assertThrows(SettingsException.class, () -> SettingsLoader.load(dir + "cfg/missing.json"));
        assertEquals("Json file does not exist", e.getMessage());

        e = assertThrows(SettingsException.class, () -> SettingsLoader.load(dir + "cfg"));
        assertEquals("Json file does not exist", e.getMessage());
    }

    @Test
    void missingKeys() {
        for (String key : SettingsLoader.REQUIRED_KEYS) {
            String json = MINIMAL.replace("\"" + key + "\"", "\"_" + key + "\"");
            assertEquals(key + " key does not exist", message(json));
        }
    }

    @Test
    void invalidTypes() {
        assertEquals("smtpHost: Invalid type: 1", message(replace("smtpHost", "1")));
        assertEquals("smtpPort: Invalid type: \"25\"", message(replace("smtpPort", "\"25\"")));
        assertEquals("fromAddress: Invalid type: true", message(replace("fromAddress", "true")));
        assertEquals("toAddresses: Invalid type (array): \"a@b\"", message(replace("toAddresses", "\"a@b\"")));
        assertEquals("emlFiles: Invalid type (element): 1", message(replace("emlFiles", "[\"a.eml\", 1]")));
        assertEquals("updateDate: Invalid type: \"true\"", message(MINIMAL.replace("}", ", \"updateDate\": \"true\"}")));
        assertEquals("updateMessageId: Invalid type: 1", message(MINIMAL.replace("}", ", \"updateMessageId\": 1}")));
        assertEquals("useParallel: Invalid type: null", message(MINIMAL.replace("}", ", \"useParallel\": null}")));
    }

    @Test
    void emptyArrays() {
        assertEquals("toAddresses: Empty array", message(replace("toAddresses", "[]")));
        assertEquals("emlFiles: Empty array", message(replace("emlFiles", "[]")));
    }

    @Test
    void invalidValues() {
        assertEquals("smtpPort: Invalid value: 0", message(replace("smtpPort", "0")));
        assertEquals("smtpPort: Invalid value: 65536", message(replace("smtpPort", "65536")));
        assertEquals("smtpPort: Invalid value: 25.5", message(replace("smtpPort", "25.5")));
        assertEquals("timeout: Invalid value: -1", message(MINIMAL.replace("}", ", \"timeout\": -1}")));
    }

    @Test
    void invalidJson() {
        assertTrue(message("{\"smtpHost\": ").startsWith("Invalid json: "));
        assertEquals("Invalid json: root is not an object", message("[1, 2]"));
        assertEquals("Invalid json: root is not an object", message(""));
    }

    @Test
    void unknownKeysIgnored() throws SettingsException {
        assertEquals(2525, SettingsLoader.fromText(MINIMAL.replace("}", ", \"other\": {\"a\": 1}}")).getSmtpPort());
    }

    @Test
    void loadTemp(@TempDir Path tmp) throws IOException, SettingsException {
        Path file = tmp.resolve("settings.json");
        Files.write(file, MINIMAL.getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of("test1.eml"), SettingsLoader.load(file.toString()).getEmlFiles());
    }

    @Test
    void withEmlFiles() throws SettingsException {
        Settings settings = SettingsLoader.fromText(MINIMAL);
        Settings single = settings.withEmlFiles(List.of("other.eml"));

        assertEquals(List.of("other.eml"), single.getEmlFiles());
        assertEquals(List.of("test1.eml"), settings.getEmlFiles());
        assertEquals(settings.getToAddresses(), single.getToAddresses());
        assertEquals(settings.getSmtpPort(), single.getSmtpPort());
    }
}
