package org.csits.mig.server.plugin.transform;

import java.util.Map;
import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.TransformerFactory;
import org.springframework.stereotype.Component;

/**
 * type: rename，参数 fields（原字段名 -> 新字段名）。
 */
@Component
public class RenameTransformerFactory implements TransformerFactory {

    @Override
    public String getType() {
        return "rename";
    }

    @Override
    public Transformer create(StepConfig step, JobRunContext context) {
        Map<String, String> fields = step.getStringMap("fields");
        if (fields.isEmpty()) {
            throw new InvalidConfigurationException("rename 缺少 fields: job=" + context.getJobName());
        }
        return new RenameTransformer(fields);
    }
}
