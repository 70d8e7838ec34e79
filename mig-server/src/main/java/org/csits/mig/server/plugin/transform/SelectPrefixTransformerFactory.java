package org.csits.mig.server.plugin.transform;

import java.util.List;
import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.TransformerFactory;
import org.springframework.stereotype.Component;

/**
 * type: select_prefix，参数 prefix（字符串或列表）、remove_prefix（默认 false）。
 */
@Component
public class SelectPrefixTransformerFactory implements TransformerFactory {

    @Override
    public String getType() {
        return "select_prefix";
    }

    @Override
    public Transformer create(StepConfig step, JobRunContext context) {
        List<String> prefixes = step.getStringList("prefix");
        if (prefixes.isEmpty()) {
            throw new InvalidConfigurationException("select_prefix 缺少 prefix: job=" + context.getJobName());
        }
        return new SelectPrefixTransformer(prefixes, step.getBoolean("remove_prefix", false));
    }
}
