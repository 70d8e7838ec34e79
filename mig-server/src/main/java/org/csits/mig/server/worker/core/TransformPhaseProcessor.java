package org.csits.mig.server.worker.core;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.PipelineState;

/**
 * 转换阶段：转换器按声明顺序串联。
 */
@Slf4j
public class TransformPhaseProcessor implements PhaseProcessor {

    private final String jobName;

    private final List<Transformer> transformers;

    public TransformPhaseProcessor(String jobName, List<Transformer> transformers) {
        this.jobName = jobName;
        this.transformers = transformers;
    }

    @Override
    public PhaseType getPhaseType() {
        return PhaseType.TRANSFORM;
    }

    @Override
    public PipelineState process(PipelineState state) throws Exception {
        Batch rows = state.getRows();
        for (Transformer transformer : transformers) {
            rows = transformer.transform(rows);
        }
        log.info("转换阶段完成: job={}, transformers={}, rows={}", jobName, transformers.size(), rows.size());
        return state.withRows(rows);
    }
}
