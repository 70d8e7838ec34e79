package org.csits.mig.server.plugin.ledger;

import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.ExtractorFactory;
import org.springframework.stereotype.Component;

/**
 * type: ledger，参数 job（依赖作业名）、prefix（默认同 job）、required（默认 true）。
 */
@Component
public class LedgerExtractorFactory implements ExtractorFactory {

    @Override
    public String getType() {
        return "ledger";
    }

    @Override
    public Extractor create(StepConfig step, JobRunContext context) {
        String job = step.getString("job");
        if (job == null || job.isEmpty()) {
            throw new InvalidConfigurationException("ledger 抽取器缺少 job: job=" + context.getJobName());
        }
        String prefix = step.getString("prefix");
        return new LedgerExtractor(context.getLedgerRegistry(), job,
            prefix == null || prefix.isEmpty() ? job : prefix,
            step.getBoolean("required", true));
    }
}
