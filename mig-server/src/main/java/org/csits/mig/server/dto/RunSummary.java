package org.csits.mig.server.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 运行汇总。
 */
@Data
public class RunSummary {

    private int processed;

    private int succeeded;

    private int failed;

    private int skipped;

    private List<String> failedJobs = new ArrayList<>();

    public void recordSuccess() {
        processed++;
        succeeded++;
    }

    public void recordFailure(String jobName) {
        processed++;
        failed++;
        failedJobs.add(jobName);
    }
}
