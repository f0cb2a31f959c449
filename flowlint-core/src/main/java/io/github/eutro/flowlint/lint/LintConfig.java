package io.github.eutro.flowlint.lint;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Which checks a {@link Linter} runs, and on how many threads.
 */
public final class LintConfig {
    /**
     * The property listing the checks to run, comma separated. Absent or empty means every registered check.
     */
    public static final String CHECKS = "flowlint.checks";
    /**
     * The property giving the number of worker threads.
     */
    public static final String PARALLELISM = "flowlint.parallelism";

    private static final LintConfig DEFAULT = builder().build();

    private final List<String> checks;
    private final int parallelism;

    private LintConfig(Builder builder) {
        this.checks = Collections.unmodifiableList(new ArrayList<>(builder.checks));
        this.parallelism = builder.parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the configuration that runs every registered check on the calling thread.
     *
     * @return The default configuration.
     */
    public static LintConfig defaults() {
        return DEFAULT;
    }

    /**
     * Read a configuration from properties.
     *
     * @param properties The properties.
     * @return The configuration.
     * @throws ConfigurationException If a value is malformed.
     */
    public static LintConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String checks = properties.getProperty(CHECKS);
        if (checks != null) {
            for (String check : checks.split(",")) {
                String id = check.trim();
                if (!id.isEmpty()) builder.check(id);
            }
        }
        String parallelism = properties.getProperty(PARALLELISM);
        if (parallelism != null) {
            int threads;
            try {
                threads = Integer.parseInt(parallelism.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(PARALLELISM + " is not a number: " + parallelism, e);
            }
            if (threads < 1) throw new ConfigurationException(PARALLELISM + " must be positive, got " + threads);
            builder.parallelism(threads);
        }
        return builder.build();
    }

    /**
     * Read a configuration from a properties file.
     *
     * @param path The file.
     * @return The configuration.
     * @throws IOException            If the file could not be read.
     * @throws ConfigurationException If a value is malformed.
     */
    public static LintConfig load(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    /**
     * Get the requested check identifiers, in the order requested.
     *
     * @return The identifiers, empty to request every registered check.
     */
    public List<String> getChecks() {
        return checks;
    }

    public int getParallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return "LintConfig{checks=" + checks + ", parallelism=" + parallelism + '}';
    }

    public static final class Builder {
        private final Set<String> checks = new LinkedHashSet<>();
        private int parallelism = 1;

        private Builder() {
        }

        public Builder check(String id) {
            checks.add(Objects.requireNonNull(id, "id"));
            return this;
        }

        public Builder checks(Collection<String> ids) {
            for (String id : ids) {
                check(id);
            }
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
            this.parallelism = parallelism;
            return this;
        }

        public LintConfig build() {
            return new LintConfig(this);
        }
    }
}
