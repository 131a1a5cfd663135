package com.hailmary.transform;

import com.hailmary.config.SourceConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates {@link DocumentTransformer} instances from configuration using reflection.
 * Keeps the pipeline engine agnostic to concrete document shapes.
 */
@Slf4j
public final class TransformerFactory {

    private TransformerFactory() {
        // utility class
    }

    /**
     * Instantiates the transformer named in the config (or a {@link ColumnCopyTransformer}
     * when none is named), then initialises it.
     *
     * @param config the source configuration
     * @return an initialised transformer instance
     */
    public static DocumentTransformer create(SourceConfig config) {
        String className = config.getTransformerClassName();
        if (className == null || className.isBlank()) {
            DocumentTransformer transformer = new ColumnCopyTransformer();
            transformer.init(config);
            return transformer;
        }
        try {
            Class<?> clazz = Class.forName(className);
            if (!DocumentTransformer.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException(
                        "Class " + className + " does not implement DocumentTransformer");
            }
            DocumentTransformer transformer = (DocumentTransformer) clazz.getDeclaredConstructor().newInstance();
            transformer.init(config);
            log.info("Created transformer for source '{}' from class {}", config.getName(), className);
            return transformer;
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create transformer for source: " + config.getName(), e);
        }
    }
}
