package org.csits.mig.server.plugin.ledger;

import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.TransformerFactory;
import org.springframework.stereotype.Component;

/**
 * type: ledger_lookup
 *
 * <pre>
 * - type: ledger_lookup
 *   job: terms            # 依赖作业
 *   key: post.category    # 行中用于匹配的字段
 *   ledger_key: slug      # 账本中被匹配的字段，默认 uid
 *   fields: [term_id]     # 要并入的账本字段，默认全部
 *   prefix: term          # 并入后的字段前缀，默认同 job
 *   required: true        # 账本缺失时作业失败，默认 false
 * </pre>
 */
@Component
public class LedgerLookupTransformerFactory implements TransformerFactory {

    @Override
    public String getType() {
        return "ledger_lookup";
    }

    @Override
    public Transformer create(StepConfig step, JobRunContext context) {
        String job = step.getString("job");
        String key = step.getString("key");
        if (job == null || job.isEmpty() || key == null || key.isEmpty()) {
            throw new InvalidConfigurationException("ledger_lookup 需要 job 与 key: job=" + context.getJobName());
        }
        String ledgerKey = step.getString("ledger_key");
        String prefix = step.getString("prefix");
        return new LedgerLookupTransformer(context.getLedgerRegistry(), job, key,
            ledgerKey == null || ledgerKey.isEmpty() ? "uid" : ledgerKey,
            step.getStringList("fields"),
            prefix == null || prefix.isEmpty() ? job : prefix,
            step.getBoolean("required", false));
    }
}
