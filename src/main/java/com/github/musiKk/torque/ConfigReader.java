package com.github.musiKk.torque;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@code torque-ast.cfg}. A file in the working directory wins over the
 * one on the classpath; with neither present the defaults apply.
 */
@Slf4j
public class ConfigReader {

    public static final String CONFIG_FILE = "torque-ast.cfg";

    public static Config readConfig() {
        return readConfigFrom(Path.of(""));
    }

    static Config readConfigFrom(Path workingDirectory) {
        var local = workingDirectory.resolve(CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            return readConfig(local);
        }
        try (var in = ConfigReader.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in == null) {
                log.debug("no {} found, using defaults", CONFIG_FILE);
                return new Config();
            }
            return readConfig(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Config readConfig(Path path) {
        try (var in = Files.newInputStream(path)) {
            log.debug("reading config from {}", path);
            return readConfig(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read config " + path, e);
        }
    }

    static Config readConfig(InputStream in) throws IOException {
        var properties = new Properties();
        properties.load(in);

        var config = new Config();
        config.checkBareExpressions = flag(properties, "check.bareExpressions", config.checkBareExpressions);
        config.checkAssignTargets = flag(properties, "check.assignTargets", config.checkAssignTargets);
        config.checkTopLevelStatements = flag(properties, "check.topLevelStatements", config.checkTopLevelStatements);
        log.debug("loaded {}", config);
        return config;
    }

    private static boolean flag(Properties properties, String key, boolean defaultValue) {
        var value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        value = value.trim();
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("expected true or false for " + key + " but got " + value);
        }
        return Boolean.parseBoolean(value);
    }

    @ToString
    @Getter
    @Accessors(fluent = true)
    public static class Config {
        private boolean checkBareExpressions = true;
        private boolean checkAssignTargets = true;
        private boolean checkTopLevelStatements = false;

        public void applyConfig(ConfigTarget ct) {
            ct.setCheckBareExpressions(checkBareExpressions);
            ct.setCheckAssignTargets(checkAssignTargets);
            ct.setCheckTopLevelStatements(checkTopLevelStatements);
        }
    }

    public interface ConfigTarget {
        void setCheckBareExpressions(boolean checkBareExpressions);
        void setCheckAssignTargets(boolean checkAssignTargets);
        void setCheckTopLevelStatements(boolean checkTopLevelStatements);
    }

}
