package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.lint.ConfigurationException;
import io.github.eutro.flowlint.lint.LintConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class LintConfigTest {
    @Test
    void testDefaults() {
        LintConfig config = LintConfig.defaults();
        assertTrue(config.getChecks().isEmpty());
        assertEquals(1, config.getParallelism());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(LintConfig.CHECKS, " SA4005, SA4006,,SA4005 ");
        properties.setProperty(LintConfig.PARALLELISM, "4");
        LintConfig config = LintConfig.fromProperties(properties);
        assertEquals(Arrays.asList("SA4005", "SA4006"), config.getChecks());
        assertEquals(4, config.getParallelism());
    }

    @Test
    void testMalformedParallelism() {
        Properties properties = new Properties();
        properties.setProperty(LintConfig.PARALLELISM, "many");
        assertThrows(ConfigurationException.class, () -> LintConfig.fromProperties(properties));
        properties.setProperty(LintConfig.PARALLELISM, "0");
        assertThrows(ConfigurationException.class, () -> LintConfig.fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> LintConfig.builder().parallelism(0));
    }

    @Test
    void testLoad(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("flowlint.properties");
        Files.write(file, Arrays.asList(
                "# checks to run",
                LintConfig.CHECKS + "=SA5007",
                LintConfig.PARALLELISM + "=2"
        ), StandardCharsets.UTF_8);
        LintConfig config = LintConfig.load(file);
        assertEquals(Arrays.asList("SA5007"), config.getChecks());
        assertEquals(2, config.getParallelism());
    }
}
