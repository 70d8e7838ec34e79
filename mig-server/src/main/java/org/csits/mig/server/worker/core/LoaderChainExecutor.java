package org.csits.mig.server.worker.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.manager.plugin.RowMutator;
import org.csits.mig.server.constants.LoaderOutcome;
import org.csits.mig.server.exception.FatalMigrationException;
import org.csits.mig.server.exception.RecoverableWriteException;
import org.csits.mig.server.service.JobProgressReporter;

/**
 * 同步加载器链：同一批行按声明顺序依次交给每个加载器，前一个加载器改写的行对后续加载器可见。
 *
 * <p>失败策略：{@link RecoverableWriteException} 告警后继续；{@link FatalMigrationException} 向上抛出终止运行；
 * 其余异常记录错误后继续，不重试。加载器在失败前已改写的行仍会替换进后续输入。
 */
@Slf4j
public class LoaderChainExecutor {

    private final String jobName;

    private final boolean reclaimMemory;

    public LoaderChainExecutor(String jobName, boolean reclaimMemory) {
        this.jobName = jobName;
        this.reclaimMemory = reclaimMemory;
    }

    public LoaderChainResult run(List<Loader> loaders, Batch batch, JobProgressReporter reporter) {
        Batch current = batch;
        Map<String, LoaderOutcome> outcomes = new LinkedHashMap<>();
        for (Loader loader : loaders) {
            String loaderName = loader.getName();
            LoaderOutcome outcome = LoaderOutcome.SUCCEEDED;
            try {
                loader.load(current);
            } catch (RecoverableWriteException e) {
                outcome = LoaderOutcome.RECOVERABLE_FAILURE;
                log.warn("加载器写入失败，继续后续加载器: job={}, loader={}, uid={}, error={}",
                    jobName, loaderName, firstUid(current), e.getMessage());
            } catch (FatalMigrationException e) {
                log.error("加载器致命错误，终止运行: job={}, loader={}, uid={}",
                    jobName, loaderName, firstUid(current), e);
                throw e;
            } catch (Exception e) {
                outcome = LoaderOutcome.FAILED;
                log.error("加载器未识别的错误，继续后续加载器: job={}, loader={}, uid={}",
                    jobName, loaderName, firstUid(current), e);
            }
            current = applyMutations(loader, current);
            outcomes.put(loaderName, outcome);
            if (reporter != null) {
                reporter.rowsProcessed(loaderName, current.size());
            }
        }
        if (reclaimMemory) {
            System.gc();
        }
        return new LoaderChainResult(current, outcomes);
    }

    private Batch applyMutations(Loader loader, Batch current) {
        if (!(loader instanceof RowMutator)) {
            return current;
        }
        RowMutator mutator = (RowMutator) loader;
        if (!mutator.hasMutatedRows()) {
            return current;
        }
        Map<String, Row> mutated = mutator.collectMutatedRows();
        log.debug("应用改写行: job={}, loader={}, rows={}", jobName, loader.getName(), mutated.size());
        return current.replace(mutated);
    }

    private String firstUid(Batch batch) {
        return batch.isEmpty() ? null : batch.getRows().get(0).uid();
    }
}
