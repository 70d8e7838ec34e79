package org.csits.mig.server.dto;

import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Data;
import org.csits.mig.server.constants.PhaseType;

/**
 * 一次运行的命令行选项。
 */
@Data
public class RunOptions {

    /**
     * 非空时只运行这些作业。
     */
    private Set<String> jobs = new LinkedHashSet<>();

    private Set<String> skip = new LinkedHashSet<>();

    /**
     * 非空时每个作业只执行到该阶段为止。
     */
    private PhaseType phase;

    private boolean dryRun;
}
