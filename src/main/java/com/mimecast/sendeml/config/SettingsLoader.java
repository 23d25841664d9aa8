package com.mimecast.sendeml.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Settings file loader.
 *
 * <p>Parses a JSON settings file, checks every key and maps it to {@link Settings}.
 * <p>JSON is read leniently so comments are allowed.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *     "smtpHost": "172.16.3.151",
 *     "smtpPort": 25,
 *     "fromAddress": "a001@ah62.example.jp",
 *     "toAddresses": [ "a001@ah62.example.jp", "a002@ah62.example.jp" ],
 *     "emlFiles": [ "test1.eml", "test2.eml" ],
 *     "updateDate": true,
 *     "updateMessageId": true,
 *     "useParallel": false
 * }
 * </pre>
 */
public final class SettingsLoader {
    private static final Logger log = LogManager.getLogger(SettingsLoader.class);

    /**
     * Keys that must be present.
     */
    static final List<String> REQUIRED_KEYS = List.of("smtpHost", "smtpPort", "fromAddress", "toAddresses", "emlFiles");

    private SettingsLoader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Loads settings from file.
     *
     * @param file Settings file path.
     * @return Settings instance.
     * @throws SettingsException Missing file or invalid settings.
     */
    public static Settings load(String file) throws SettingsException {
        Path path = Paths.get(file).toAbsolutePath();
        if (!Files.isRegularFile(path)) {
            throw new SettingsException("Json file does not exist");
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            log.debug("Loading settings: {}", path);
            return map(check(parse(reader)));
        } catch (IOException e) {
            throw new SettingsException("Unable to read settings: " + e.getMessage(), e);
        }
    }

    /**
     * Loads settings from JSON text.
     *
     * @param text JSON string.
     * @return Settings instance.
     * @throws SettingsException Invalid settings.
     */
    public static Settings fromText(String text) throws SettingsException {
        return map(check(parse(new StringReader(text))));
    }

    /**
     * Parses JSON into an object.
     *
     * @param reader Reader instance.
     * @return JsonObject instance.
     * @throws SettingsException Invalid JSON or not an object.
     */
    static JsonObject parse(Reader reader) throws SettingsException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new SettingsException("Invalid json: " + e.getMessage(), e);
        }

        if (!root.isJsonObject()) {
            throw new SettingsException("Invalid json: root is not an object");
        }

        return root.getAsJsonObject();
    }

    /**
     * Checks settings keys and value types.
     *
     * @param root JsonObject instance.
     * @return Same JsonObject instance.
     * @throws SettingsException Missing key or invalid value.
     */
    static JsonObject check(JsonObject root) throws SettingsException {
        for (String key : REQUIRED_KEYS) {
            if (!root.has(key)) {
                throw new SettingsException(key + " key does not exist");
            }
        }

        checkValue(root, "smtpHost", SettingsLoader::isString);
        checkValue(root, "smtpPort", SettingsLoader::isNumber);
        checkValue(root, "fromAddress", SettingsLoader::isString);
        checkArrayValue(root, "toAddresses");
        checkArrayValue(root, "emlFiles");
        checkValue(root, "updateDate", SettingsLoader::isBoolean);
        checkValue(root, "updateMessageId", SettingsLoader::isBoolean);
        checkValue(root, "useParallel", SettingsLoader::isBoolean);
        checkValue(root, "timeout", SettingsLoader::isNumber);

        double port = root.get("smtpPort").getAsDouble();
        if (port != Math.rint(port) || port < 1 || port > 65535) {
            throw new SettingsException("smtpPort: Invalid value: " + root.get("smtpPort"));
        }

        if (root.has("timeout")) {
            double timeout = root.get("timeout").getAsDouble();
            if (timeout != Math.rint(timeout) || timeout < 0 || timeout > Integer.MAX_VALUE) {
                throw new SettingsException("timeout: Invalid value: " + root.get("timeout"));
            }
        }

        return root;
    }

    /**
     * Maps checked JSON to settings.
     *
     * @param root Checked JsonObject instance.
     * @return Settings instance.
     */
    static Settings map(JsonObject root) {
        return new Settings(
                root.get("smtpHost").getAsString(),
                root.get("smtpPort").getAsInt(),
                root.get("fromAddress").getAsString(),
                getStrings(root.getAsJsonArray("toAddresses")),
                getStrings(root.getAsJsonArray("emlFiles")),
                getBoolean(root, "updateDate", true),
                getBoolean(root, "updateMessageId", true),
                getBoolean(root, "useParallel", false),
                root.has("timeout") ? root.get("timeout").getAsInt() : 0);
    }

    /**
     * Checks value type if the key is present.
     *
     * @param root  JsonObject instance.
     * @param name  Key name.
     * @param check Type predicate.
     * @throws SettingsException Invalid type.
     */
    private static void checkValue(JsonObject root, String name, Predicate<JsonElement> check) throws SettingsException {
        if (root.has(name) && !check.test(root.get(name))) {
            throw new SettingsException(name + ": Invalid type: " + root.get(name));
        }
    }

    /**
     * Checks array of strings if the key is present.
     *
     * @param root JsonObject instance.
     * @param name Key name.
     * @throws SettingsException Not an array, empty or non string element.
     */
    private static void checkArrayValue(JsonObject root, String name) throws SettingsException {
        if (!root.has(name)) {
            return;
        }

        JsonElement prop = root.get(name);
        if (!prop.isJsonArray()) {
            throw new SettingsException(name + ": Invalid type (array): " + prop);
        }

        JsonArray array = prop.getAsJsonArray();
        if (array.isEmpty()) {
            throw new SettingsException(name + ": Empty array");
        }

        for (JsonElement element : array) {
            if (!isString(element)) {
                throw new SettingsException(name + ": Invalid type (element): " + element);
            }
        }
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static boolean isNumber(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }

    private static boolean isBoolean(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean();
    }

    private static List<String> getStrings(JsonArray array) {
        List<String> list = new ArrayList<>();
        for (JsonElement element : array) {
            list.add(element.getAsString());
        }

        return list;
    }

    private static boolean getBoolean(JsonObject root, String name, boolean defaultValue) {
        JsonPrimitive value = root.getAsJsonPrimitive(name);
        return value != null ? value.getAsBoolean() : defaultValue;
    }

    /**
     * Gets settings sample.
     *
     * @return JSON string.
     */
    public static String sample() {
        return "{\n" +
                "    \"smtpHost\": \"172.16.3.151\",\n" +
                "    \"smtpPort\": 25,\n" +
                "    \"fromAddress\": \"a001@ah62.example.jp\",\n" +
                "    \"toAddresses\": [\n" +
                "        \"a001@ah62.example.jp\",\n" +
                "        \"a002@ah62.example.jp\",\n" +
                "        \"a003@ah62.example.jp\"\n" +
                "    ],\n" +
                "    \"emlFiles\": [\n" +
                "        \"test1.eml\",\n" +
                "        \"test2.eml\",\n" +
                "        \"test3.eml\"\n" +
                "    ],\n" +
                "    \"updateDate\": true,\n" +
                "    \"updateMessageId\": true,\n" +
                "    \"useParallel\": false\n" +
                "}";
    }
}
