package org.csits.mig.server.worker.core;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.UnifiedLedger;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.PipelineState;
import org.csits.mig.server.exception.FatalMigrationException;
import org.csits.mig.server.service.LedgerManager;

/**
 * 加载阶段：按批大小切分，每批交给加载器链；全部批次完成后关闭加载器并生成账本。
 * 开启 reclaim_memory 时不保留已处理的行，返回的状态不带行数据。
 */
@Slf4j
public class LoadPhaseProcessor implements PhaseProcessor {

    private final JobRunContext context;

    private final List<Loader> loaders;

    private final LedgerManager ledgerManager;

    private final LoaderChainExecutor executor;

    public LoadPhaseProcessor(JobRunContext context, List<Loader> loaders, LedgerManager ledgerManager) {
        this(context, loaders, ledgerManager,
            new LoaderChainExecutor(context.getJobName(), context.isReclaimMemory()));
    }

    LoadPhaseProcessor(JobRunContext context, List<Loader> loaders, LedgerManager ledgerManager,
                       LoaderChainExecutor executor) {
        this.context = context;
        this.loaders = loaders;
        this.ledgerManager = ledgerManager;
        this.executor = executor;
    }

    @Override
    public PhaseType getPhaseType() {
        return PhaseType.LOAD;
    }

    @Override
    public PipelineState process(PipelineState state) throws Exception {
        String jobName = context.getJobName();
        if (loaders.isEmpty()) {
            log.info("作业未配置加载器，跳过加载: job={}", jobName);
            return state;
        }
        boolean retainRows = !context.isReclaimMemory();
        Batch loaded = Batch.empty();
        int loadedRows = 0;
        int batchNo = 0;
        for (Batch batch : state.getRows().split(context.getBatchSize())) {
            batchNo++;
            LoaderChainResult result = executor.run(loaders, batch, context.getReporter());
            if (result.hasFailures()) {
                log.warn("批次存在加载失败: job={}, batch={}, outcomes={}", jobName, batchNo, result.getOutcomes());
            }
            loadedRows += result.getBatch().size();
            if (retainRows) {
                loaded = loaded.append(result.getBatch());
            }
        }
        closeLoaders(jobName);
        Optional<UnifiedLedger> ledger = ledgerManager.finalize(context.getJobConfig(), loaders, context.getRunId());
        log.info("加载阶段完成: job={}, batches={}, rows={}, retained={}", jobName, batchNo, loadedRows, retainRows);
        return state.withRows(loaded).withLedger(ledger.orElse(null));
    }

    private void closeLoaders(String jobName) {
        for (Loader loader : loaders) {
            try {
                loader.close();
            } catch (FatalMigrationException e) {
                throw e;
            } catch (Exception e) {
                log.error("加载器关闭失败: job={}, loader={}", jobName, loader.getName(), e);
            }
        }
    }
}
