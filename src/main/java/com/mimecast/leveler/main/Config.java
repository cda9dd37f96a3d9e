package com.mimecast.leveler.main;

import com.mimecast.leveler.config.LevelerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the leveler configuration loaded from {@code leveler.json5}.
 * <p>Defaults to an empty configuration, which runs everything in memory with default settings.
 *
 * @see LevelerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Leveler configuration.
     */
    private static LevelerConfig leveler = new LevelerConfig();

    /**
     * Gets leveler config.
     *
     * @return LevelerConfig.
     */
    public static LevelerConfig getLeveler() {
        return leveler;
    }

    /**
     * Init leveler config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initLeveler(String path) throws IOException {
        leveler = new LevelerConfig(path);
        log.info("Loaded configuration file: {}", path);
    }

    /**
     * Sets leveler config.
     *
     * @param config LevelerConfig instance.
     */
    public static void setLeveler(LevelerConfig config) {
        leveler = config;
    }
}
