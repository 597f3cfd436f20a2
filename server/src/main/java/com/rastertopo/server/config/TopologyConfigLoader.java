package com.rastertopo.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class TopologyConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(TopologyConfigLoader.class);

    public static final String CONFIG_PROPERTY = "rastertopo.config";
    public static final String CLASSPATH_CONFIG = "/topology_config.json";

    /**
     * Resolves the configuration in order: the file named by the
     * {@value #CONFIG_PROPERTY} system property, then {@value #CLASSPATH_CONFIG}
     * on the classpath, then built-in defaults.
     */
    public static TopologyConfig load() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. Check System Property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            try {
                TopologyConfig config = mapper.readValue(new File(path), TopologyConfig.class);
                logger.info("Loaded topology config from {}", path);
                return config.withDefaults();
            } catch (IOException e) {
                logger.warn("Failed to read topology config from {}, trying classpath. Error: {}", path,
                        e.getMessage());
            }
        }

        // 2. Check Classpath
        try (InputStream is = TopologyConfigLoader.class.getResourceAsStream(CLASSPATH_CONFIG)) {
            if (is != null) {
                return load(is);
            }
            logger.warn("{} not found on classpath, using defaults", CLASSPATH_CONFIG);
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults. Error: {}", CLASSPATH_CONFIG, e.getMessage());
        }

        // 3. Default
        return TopologyConfig.defaults();
    }

    public static TopologyConfig load(InputStream json) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        TopologyConfig config = mapper.readValue(json, TopologyConfig.class);
        if (config == null) {
            return TopologyConfig.defaults();
        }
        return config.withDefaults();
    }
}
