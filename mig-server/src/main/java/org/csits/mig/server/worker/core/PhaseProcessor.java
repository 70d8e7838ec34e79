package org.csits.mig.server.worker.core;

import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.PipelineState;

/**
 * 阶段处理器：接收上一阶段的状态，返回新的状态。
 */
public interface PhaseProcessor {

    PhaseType getPhaseType();

    PipelineState process(PipelineState state) throws Exception;
}
