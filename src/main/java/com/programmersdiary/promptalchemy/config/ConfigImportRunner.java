package com.programmersdiary.promptalchemy.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ConfigImportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConfigImportRunner.class);

    private final boolean enabled;
    private final SiblingConfigLocator locator;
    private final ConfigImportMerger merger;
    private final ConfigRepository configRepository;

    public ConfigImportRunner(@Value("${promptalchemy.import-sibling-config:true}") boolean enabled,
                              SiblingConfigLocator locator,
                              ConfigImportMerger merger,
                              ConfigRepository configRepository) {
        this.enabled = enabled;
        this.locator = locator;
        this.merger = merger;
        this.configRepository = configRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) return;
        try {
            var source = locator.locate();
            if (source.isPresent() && merger.importOnce(source.get())) {
                configRepository.save();
                log.info("Imported settings from sibling application config");
            }
        } catch (RuntimeException e) {
            log.warn("Failed to import sibling application config: {}", e.getMessage());
        }
    }
}
