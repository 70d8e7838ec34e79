package org.csits.mig.server.plugin.ledger;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.plugin.AbstractLoader;

/**
 * 把每行中 ledger. 前缀的字段（去掉前缀）记为一条账本条目。无论是否配置 ledger 区块都会记录账本。
 */
@Slf4j
public class LedgerLoader extends AbstractLoader {

    static final String LEDGER_PREFIX = "ledger";

    public LedgerLoader(LoadStepConfig step, String jobName) {
        super(step, jobName, true);
    }

    @Override
    public void load(Batch batch) {
        for (Row row : batch) {
            Map<String, Object> fields = row.reduceOnPrefix(LEDGER_PREFIX);
            createLedgerEntry(row.uid(), fields);
        }
        log.debug("账本加载: loader={}, rows={}, entries={}", getName(), batch.size(), getLedger().size());
    }
}
