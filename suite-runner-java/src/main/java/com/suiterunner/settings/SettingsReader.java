package com.suiterunner.settings;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class SettingsReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes the settings JSON from the given path.
     * The settings' base directory becomes the directory containing the file.
     *
     * @throws SettingsReadException if the file is missing, malformed, or has no lib_path
     */
    public RunnerSettings read(Path settingsPath) {
        if (!settingsPath.toFile().exists()) {
            throw new SettingsReadException("Settings file not found: " + settingsPath);
        }
        try (FileReader reader = new FileReader(settingsPath.toFile())) {
            RunnerSettings settings = GSON.fromJson(reader, RunnerSettings.class);
            if (settings == null) {
                throw new SettingsReadException("Settings file is empty or invalid JSON: " + settingsPath);
            }
            if (settings.getLibPath() == null || settings.getLibPath().isBlank()) {
                throw new SettingsReadException("Settings file has no lib_path: " + settingsPath);
            }
            return settings.withBaseDir(settingsPath.toAbsolutePath().getParent());
        } catch (FileNotFoundException e) {
            throw new SettingsReadException("Settings file not found: " + settingsPath, e);
        } catch (JsonParseException e) {
            throw new SettingsReadException("Settings file is not valid JSON: " + settingsPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SettingsReadException("Failed to read settings: " + settingsPath + ": " + e.getMessage(), e);
        }
    }

    public static class SettingsReadException extends RuntimeException {
        public SettingsReadException(String message) { super(message); }
        public SettingsReadException(String message, Throwable cause) { super(message, cause); }
    }
}
