package org.truetranslation.scripture.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads and writes {@code config.json} in the per-user configuration directory.
 * Every key has a default, so a missing or partial file is never an error.
 */
public class ConfigManager {
    public static final String APP_DIR_NAME = "scripture-ref-cli";
    public static final int DEFAULT_DEBOUNCE_MS = 300;
    public static final int DEFAULT_SUGGESTION_LIMIT = 5;
    public static final int DEFAULT_VERSE_COUNT = 31;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    private final Path configFilePath;
    private final LocalizationManager loc = LocalizationManager.getInstance();
    private Map<String, Object> config;

    public ConfigManager() {
        this(defaultConfigDir());
    }

    public ConfigManager(Path configDir) {
        this.configFilePath = configDir.resolve("config.json");
        loadConfig();
    }

    private static Path defaultConfigDir() {
        String userHome = System.getProperty("user.home");
        String os = System.getProperty("os.name").toLowerCase();
        if (os.contains("win")) {
            return Paths.get(System.getenv("APPDATA"), APP_DIR_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_DIR_NAME);
        }
        return Paths.get(userHome, ".config", APP_DIR_NAME);
    }

    private void loadConfig() {
        try {
            if (Files.exists(configFilePath)) {
                try (Reader reader = Files.newBufferedReader(configFilePath)) {
                    Type type = new TypeToken<Map<String, Object>>() {}.getType();
                    config = GSON.fromJson(reader, type);
                }
                if (config == null) config = new HashMap<>();
            } else {
                config = new HashMap<>();
                saveConfig();
            }
        } catch (IOException | JsonSyntaxException e) {
            System.err.println(loc.getString("error.config.read", configFilePath, e.getMessage()));
            config = new HashMap<>();
        }
        config.putIfAbsent("modules_path", "");
        config.putIfAbsent("last_used_module", "");
        config.putIfAbsent("verbosity", 1.0);
        config.putIfAbsent("debounce_ms", (double) DEFAULT_DEBOUNCE_MS);
        config.putIfAbsent("suggestion_limit", (double) DEFAULT_SUGGESTION_LIMIT);
        config.putIfAbsent("default_verse_count", (double) DEFAULT_VERSE_COUNT);
        config.putIfAbsent("abbreviations_file", "");
    }

    private void saveConfig() {
        try {
            Files.createDirectories(configFilePath.getParent());
            try (Writer writer = Files.newBufferedWriter(configFilePath)) {
                GSON.toJson(config, writer);
            }
        } catch (IOException e) {
            System.err.println(loc.getString("error.config.save", e.getMessage()));
        }
    }

    public String getModulesPath() { return getString("modules_path"); }
    public void setModulesPath(String path) { config.put("modules_path", path); saveConfig(); }
    public String getLastUsedModule() { return getString("last_used_module"); }
    public void setLastUsedModule(String moduleName) { config.put("last_used_module", moduleName); saveConfig(); }
    public String getAbbreviationsFile() { return getString("abbreviations_file"); }
    public Path getDefaultConfigDir() { return configFilePath.getParent(); }

    public int getVerbosity() { return getInt("verbosity", 1); }
    public void setVerbosity(int level) {
        config.put("verbosity", (double) level);
        saveConfig();
    }

    public int getDebounceMillis() { return getInt("debounce_ms", DEFAULT_DEBOUNCE_MS); }
    public int getSuggestionLimit() { return getInt("suggestion_limit", DEFAULT_SUGGESTION_LIMIT); }
    public int getDefaultVerseCount() { return getInt("default_verse_count", DEFAULT_VERSE_COUNT); }

    private String getString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : "";
    }

    // Gson reads every JSON number into a Double.
    private int getInt(String key, int fallback) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return fallback;
    }
}
