package org.csits.mig.server.worker.core;

import java.util.Collections;
import java.util.Map;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.server.constants.LoaderOutcome;

/**
 * 一批行经过加载器链后的结果：替换了全部改写行的最终批，以及各加载器的处理结果。
 */
public class LoaderChainResult {

    private final Batch batch;

    private final Map<String, LoaderOutcome> outcomes;

    public LoaderChainResult(Batch batch, Map<String, LoaderOutcome> outcomes) {
        this.batch = batch;
        this.outcomes = Collections.unmodifiableMap(outcomes);
    }

    public Batch getBatch() {
        return batch;
    }

    /**
     * 按加载器声明顺序。
     */
    public Map<String, LoaderOutcome> getOutcomes() {
        return outcomes;
    }

    public LoaderOutcome getOutcome(String loaderName) {
        return outcomes.get(loaderName);
    }

    public boolean hasFailures() {
        return outcomes.values().stream().anyMatch(o -> o != LoaderOutcome.SUCCEEDED);
    }
}
