package org.csits.mig.server.worker.core;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.PipelineState;

/**
 * 抽取阶段：依次执行各抽取器，结果按声明顺序追加到状态中。
 */
@Slf4j
public class ExtractPhaseProcessor implements PhaseProcessor {

    private final String jobName;

    private final List<Extractor> extractors;

    public ExtractPhaseProcessor(String jobName, List<Extractor> extractors) {
        this.jobName = jobName;
        this.extractors = extractors;
    }

    @Override
    public PhaseType getPhaseType() {
        return PhaseType.EXTRACT;
    }

    @Override
    public PipelineState process(PipelineState state) throws Exception {
        Batch rows = state.getRows();
        for (Extractor extractor : extractors) {
            Batch extracted = extractor.extract();
            log.debug("抽取完成: job={}, extractor={}, rows={}",
                jobName, extractor.getClass().getSimpleName(), extracted.size());
            rows = rows.append(extracted);
        }
        log.info("抽取阶段完成: job={}, rows={}", jobName, rows.size());
        return state.withRows(rows);
    }
}
