package org.csits.mig.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.MigrationConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将迁移定义映射为 Java 对象。
 */
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public MigrationConfig loadMigrationConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return normalize(yamlMapper.readValue(in, MigrationConfig.class));
        }
    }

    public MigrationConfig loadMigrationConfigFromString(String yaml) throws IOException {
        return normalize(yamlMapper.readValue(new StringReader(yaml), MigrationConfig.class));
    }

    /**
     * YAML 中显式写 null 的区块补为默认值。
     */
    private MigrationConfig normalize(MigrationConfig config) {
        if (config == null) {
            config = new MigrationConfig();
        }
        if (config.getMigration() == null) {
            config.setMigration(new ArrayList<>());
        }
        if (config.getLedger() == null) {
            config.setLedger(new MigrationConfig.LedgerRootConfig());
        }
        if (config.getSettings() == null) {
            config.setSettings(new MigrationConfig.Settings());
        }
        config.getMigration().forEach(job -> {
            if (job.getDependsOn() == null) {
                job.setDependsOn(new ArrayList<>());
            }
            if (job.getExtract() == null) {
                job.setExtract(new ArrayList<>());
            }
            if (job.getTransform() == null) {
                job.setTransform(new ArrayList<>());
            }
            if (job.getLoad() == null) {
                job.setLoad(new ArrayList<>());
            }
            if (job.getLedger() == null) {
                job.setLedger(new JobConfig.JobLedgerConfig());
            }
        });
        return config;
    }
}
