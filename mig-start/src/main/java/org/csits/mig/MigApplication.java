package org.csits.mig;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.RunOptions;
import org.csits.mig.server.dto.RunSummary;
import org.csits.mig.server.service.MigrationPipeline;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类，通过命令行参数执行迁移。
 *
 * 示例：
 *  java -jar mig-start.jar
 *  java -jar mig-start.jar --jobs=terms,posts --skip=media
 *  java -jar mig-start.jar --phase=transform
 *  java -jar mig-start.jar --dry-run
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.mig")
@RequiredArgsConstructor
public class MigApplication implements CommandLineRunner {

    private final MigrationPipeline migrationPipeline;

    public static void main(String[] args) {
        SpringApplication.run(MigApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        RunOptions options = parseOptions(args);
        RunSummary summary = migrationPipeline.run(options);
        if (summary.getFailed() > 0) {
            log.warn("存在失败的作业: {}", summary.getFailedJobs());
        }
    }

    static RunOptions parseOptions(String... args) {
        RunOptions options = new RunOptions();
        for (String arg : args) {
            if (arg.startsWith("--jobs=")) {
                options.setJobs(splitNames(arg.substring("--jobs=".length())));
            } else if (arg.startsWith("--skip=")) {
                options.setSkip(splitNames(arg.substring("--skip=".length())));
            } else if (arg.startsWith("--phase=")) {
                options.setPhase(PhaseType.fromName(arg.substring("--phase=".length())));
            } else if ("--dry-run".equals(arg)) {
                options.setDryRun(true);
            }
        }
        return options;
    }

    private static Set<String> splitNames(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
