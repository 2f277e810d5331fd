package com.delivery.console.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.env.PropertySourceLoader;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Adds YAML files from {@code app.config.dir} as property sources: {@code base.yml} first, then
 * every file under {@code secrets/} in name order. Keeps method keys out of the packaged
 * {@code application.yml}.
 */
@Slf4j
public class ConfigDirectoryEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {
    static final String CONFIG_DIR_PROP = "app.config.dir";
    private static final List<String> BASE_FILES = List.of("base.yml", "base.yaml");
    private static final String SECRETS_DIR = "secrets";

    private final PropertySourceLoader loader = new YamlPropertySourceLoader();

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String configDir = environment.getProperty(CONFIG_DIR_PROP);
        if (configDir == null || configDir.isBlank()) {
            return;
        }
        Path root = Path.of(configDir);
        if (!Files.isDirectory(root)) {
            LOG.warn("Config directory not found: {}", root.toAbsolutePath());
            return;
        }

        MutablePropertySources sources = environment.getPropertySources();
        for (String name : BASE_FILES) {
            load(sources, root.resolve(name));
        }
        loadDirectory(sources, root.resolve(SECRETS_DIR));
    }

    private void loadDirectory(MutablePropertySources sources, Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            List<Path> files = stream
                    .filter(path -> Files.isRegularFile(path) && isYaml(path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString().toLowerCase()))
                    .toList();
            for (Path file : files) {
                load(sources, file);
            }
        } catch (IOException e) {
            LOG.warn("Failed to list config directory {}: {}", dir.toAbsolutePath(), e.getMessage());
        }
    }

    private void load(MutablePropertySources sources, Path path) {
        if (!Files.isRegularFile(path)) {
            return;
        }
        try {
            for (PropertySource<?> source : loader.load(path.toString(), new FileSystemResource(path))) {
                sources.addLast(source);
                LOG.info("Loaded config: {}", path.toAbsolutePath());
            }
        } catch (IOException e) {
            LOG.warn("Failed to load config file {}: {}", path.toAbsolutePath(), e.getMessage());
        }
    }

    private boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
