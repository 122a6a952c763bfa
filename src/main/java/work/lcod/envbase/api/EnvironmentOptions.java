package work.lcod.envbase.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.envbase.config.ConfigLoader;
import work.lcod.envbase.monitor.MonitorSettings;

/**
 * Immutable settings of an {@link EnvironmentBase}.
 *
 * @param projectDirectory directory holding the {@code templates} output directory and {@code ami_cache.json}
 * @param configFile configuration file, relative paths resolve against {@code projectDirectory}
 * @param createMissingFiles write factory defaults for a missing config file or AMI table instead of failing
 * @param config configuration supplied directly; when present no file is read
 */
public record EnvironmentOptions(
    Path projectDirectory,
    Path configFile,
    boolean createMissingFiles,
    Optional<Map<String, Object>> config,
    MonitorSettings monitorSettings
) {
    public EnvironmentOptions {
        Objects.requireNonNull(projectDirectory, "projectDirectory");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(monitorSettings, "monitorSettings");
        projectDirectory = projectDirectory.toAbsolutePath().normalize();
        configFile = projectDirectory.resolve(configFile).normalize();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path projectDirectory = Paths.get("").toAbsolutePath();
        private Path configFile = Path.of(ConfigLoader.DEFAULT_CONFIG_FILENAME);
        private boolean createMissingFiles = true;
        private Optional<Map<String, Object>> config = Optional.empty();
        private MonitorSettings monitorSettings = MonitorSettings.defaults();

        public Builder projectDirectory(Path projectDirectory) {
            this.projectDirectory = projectDirectory;
            return this;
        }

        public Builder configFile(Path configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder createMissingFiles(boolean createMissingFiles) {
            this.createMissingFiles = createMissingFiles;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = Optional.ofNullable(config);
            return this;
        }

        public Builder monitorSettings(MonitorSettings monitorSettings) {
            this.monitorSettings = monitorSettings;
            return this;
        }

        public EnvironmentOptions build() {
            return new EnvironmentOptions(projectDirectory, configFile, createMissingFiles, config, monitorSettings);
        }
    }
}
