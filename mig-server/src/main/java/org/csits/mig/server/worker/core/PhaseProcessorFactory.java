package org.csits.mig.server.worker.core;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.service.LedgerManager;
import org.springframework.stereotype.Component;

/**
 * 按作业配置创建各阶段处理器，适配器经类型注册表实例化。
 */
@Component
@RequiredArgsConstructor
public class PhaseProcessorFactory {

    private final ExtractorRegistry extractorRegistry;
    private final TransformerRegistry transformerRegistry;
    private final LoaderRegistry loaderRegistry;
    private final LedgerManager ledgerManager;

    public PhaseProcessor create(PhaseType phase, JobRunContext context) throws Exception {
        JobConfig job = context.getJobConfig();
        switch (phase) {
            case EXTRACT:
                List<Extractor> extractors = new ArrayList<>();
                for (StepConfig step : job.getExtract()) {
                    extractors.add(extractorRegistry.create(step, context));
                }
                return new ExtractPhaseProcessor(job.getName(), extractors);
            case TRANSFORM:
                List<Transformer> transformers = new ArrayList<>();
                for (StepConfig step : job.getTransform()) {
                    transformers.add(transformerRegistry.create(step, context));
                }
                return new TransformPhaseProcessor(job.getName(), transformers);
            case LOAD:
                List<Loader> loaders = new ArrayList<>();
                for (LoadStepConfig step : job.getLoad()) {
                    loaders.add(loaderRegistry.create(step, context));
                }
                return new LoadPhaseProcessor(context, loaders, ledgerManager);
            default:
                throw new IllegalArgumentException("未知阶段: " + phase);
        }
    }
}
