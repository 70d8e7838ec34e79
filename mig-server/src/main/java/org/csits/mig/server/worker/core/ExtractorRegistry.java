package org.csits.mig.server.worker.core;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.UnknownAdapterTypeException;
import org.csits.mig.server.plugin.ExtractorFactory;
import org.springframework.stereotype.Component;

/**
 * 抽取器类型注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class ExtractorRegistry {

    private final List<ExtractorFactory> factories;

    public ExtractorFactory select(String type) {
        if (type == null) {
            return null;
        }
        return factories.stream()
            .filter(f -> type.equalsIgnoreCase(f.getType()))
            .findFirst()
            .orElse(null);
    }

    public boolean supports(String type) {
        return select(type) != null;
    }

    public Extractor create(StepConfig step, JobRunContext context) throws Exception {
        ExtractorFactory factory = select(step.getType());
        if (factory == null) {
            throw new UnknownAdapterTypeException("抽取器", step.getType(), context.getJobName());
        }
        return factory.create(step, context);
    }
}
