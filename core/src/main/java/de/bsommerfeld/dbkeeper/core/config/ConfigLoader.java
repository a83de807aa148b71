package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link DbKeeperConfig} from a TOML file. A missing file is created
 * with the defaults so operators have a template to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    public static DbKeeperConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            DbKeeperConfig defaults = new DbKeeperConfig();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            MAPPER.writeValue(path.toFile(), defaults);
            LOG.info("No configuration at {}, wrote defaults.", path);
            return defaults;
        }
        return MAPPER.readValue(path.toFile(), DbKeeperConfig.class);
    }
}
