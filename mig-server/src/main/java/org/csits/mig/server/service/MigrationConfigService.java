package org.csits.mig.server.service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.LedgerSchema;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.dto.MigrationConfig;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.exception.UnknownAdapterTypeException;
import org.csits.mig.server.worker.core.ExtractorRegistry;
import org.csits.mig.server.worker.core.LoaderRegistry;
import org.csits.mig.server.worker.core.TransformerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载迁移定义并在加载时校验：作业名非空、适配器类型已注册、账本结构类型合法。
 * 依赖关系的校验由 {@link JobGraphValidator} 负责。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;
    private final ExtractorRegistry extractorRegistry;
    private final TransformerRegistry transformerRegistry;
    private final LoaderRegistry loaderRegistry;

    @Value("${mig.conf.path:classpath:conf/migration.yaml}")
    private String confPath;

    private MigrationConfig current;

    public MigrationConfig getMigrationConfig() {
        if (current == null) {
            Resource resource = resourceLoader.getResource(confPath);
            if (!resource.exists()) {
                throw new InvalidConfigurationException("迁移配置不存在: " + confPath);
            }
            load(resource);
        }
        return current;
    }

    public MigrationConfig load(Resource resource) {
        MigrationConfig config;
        try {
            config = yamlConfigLoader.loadMigrationConfig(resource);
        } catch (IOException e) {
            throw new InvalidConfigurationException("迁移配置解析失败: " + resource.getDescription(), e);
        }
        return use(config);
    }

    public MigrationConfig loadFromString(String yaml) {
        try {
            return use(yamlConfigLoader.loadMigrationConfigFromString(yaml));
        } catch (IOException e) {
            throw new InvalidConfigurationException("迁移配置解析失败", e);
        }
    }

    private MigrationConfig use(MigrationConfig config) {
        check(config);
        current = config;
        log.info("已加载迁移配置: jobs={}, ledgerRoot={}", config.getMigration().size(), config.getLedger().getPath());
        return config;
    }

    public Optional<JobConfig> findJob(String name) {
        return getMigrationConfig().getMigration().stream()
            .filter(job -> name.equals(job.getName()))
            .findFirst();
    }

    public MigrationConfig.Settings getSettings() {
        return getMigrationConfig().getSettings();
    }

    /**
     * 作业账本目录：{ledger.path}/{job.ledger.path}。
     */
    public Path resolveLedgerDir(JobConfig job) {
        Path root = Paths.get(getMigrationConfig().getLedger().getPath());
        String sub = job.getLedger() == null ? null : job.getLedger().getPath();
        if (sub == null || sub.trim().isEmpty()) {
            return root;
        }
        return root.resolve(sub.trim());
    }

    private void check(MigrationConfig config) {
        Set<String> jobNames = new HashSet<>();
        for (JobConfig job : config.getMigration()) {
            if (job.getName() == null || job.getName().trim().isEmpty()) {
                throw new InvalidConfigurationException("作业 name 不能为空");
            }
            jobNames.add(job.getName());
        }
        Set<String> loaderNames = new HashSet<>();
        for (JobConfig job : config.getMigration()) {
            String jobName = job.getName();
            for (StepConfig step : job.getExtract()) {
                if (!extractorRegistry.supports(step.getType())) {
                    throw new UnknownAdapterTypeException("抽取器", step.getType(), jobName);
                }
            }
            for (StepConfig step : job.getTransform()) {
                if (!transformerRegistry.supports(step.getType())) {
                    throw new UnknownAdapterTypeException("转换器", step.getType(), jobName);
                }
            }
            loaderNames.clear();
            for (LoadStepConfig step : job.getLoad()) {
                if (!loaderRegistry.supports(step.getType())) {
                    throw new UnknownAdapterTypeException("加载器", step.getType(), jobName);
                }
                if (step.getName() == null || step.getName().trim().isEmpty()) {
                    throw new InvalidConfigurationException("作业 " + jobName + " 的加载器 name 不能为空");
                }
                if (!loaderNames.add(step.getName())) {
                    throw new InvalidConfigurationException("作业 " + jobName + " 的加载器重名: " + step.getName());
                }
                // 加载器账本与作业账本共用 {name}-ledger-{ts}.json 命名
                if (jobNames.contains(step.getName())) {
                    throw new InvalidConfigurationException(
                        "作业 " + jobName + " 的加载器与作业同名: " + step.getName());
                }
                if (step.getLedger() != null && step.getLedger().getSchema() != null) {
                    try {
                        LedgerSchema.of(step.getLedger().getSchema());
                    } catch (IllegalArgumentException e) {
                        throw new InvalidConfigurationException(
                            "作业 " + jobName + " 加载器 " + step.getName() + " 的账本结构非法: " + e.getMessage(), e);
                    }
                }
            }
        }
    }
}
