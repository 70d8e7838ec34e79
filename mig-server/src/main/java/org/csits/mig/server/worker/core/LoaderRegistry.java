package org.csits.mig.server.worker.core;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.exception.UnknownAdapterTypeException;
import org.csits.mig.server.plugin.LoaderFactory;
import org.springframework.stereotype.Component;

/**
 * 加载器类型注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class LoaderRegistry {

    private final List<LoaderFactory> factories;

    public LoaderFactory select(String type) {
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

    public Loader create(LoadStepConfig step, JobRunContext context) throws Exception {
        LoaderFactory factory = select(step.getType());
        if (factory == null) {
            throw new UnknownAdapterTypeException("加载器", step.getType(), context.getJobName());
        }
        return factory.create(step, context);
    }
}
