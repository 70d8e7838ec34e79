package org.csits.mig.server.plugin.csv;

import lombok.RequiredArgsConstructor;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.AbstractFileLoader;
import org.csits.mig.server.plugin.LoaderFactory;
import org.springframework.stereotype.Component;

/**
 * type: csv，参数 path（目录，默认 settings.output_path）、file（文件名前缀，默认加载器名）、
 * prefix（可选）、overwrite（为 true 时文件名不带运行时间戳，默认 false）、separator（默认逗号）。
 */
@Component
@RequiredArgsConstructor
public class CsvFileLoaderFactory implements LoaderFactory {

    private final FileSystemManager fileSystemManager;

    @Override
    public String getType() {
        return "csv";
    }

    @Override
    public Loader create(LoadStepConfig step, JobRunContext context) {
        return new CsvFileLoader(step, context.getJobName(), fileSystemManager,
            AbstractFileLoader.resolveTarget(step, context, "csv"), step.getStringList("prefix"),
            separator(step, context));
    }

    static char separator(StepConfig step, JobRunContext context) {
        String separator = step.getString("separator");
        if (separator == null || separator.isEmpty()) {
            return ',';
        }
        if (separator.length() != 1) {
            throw new InvalidConfigurationException("csv 分隔符只能是单个字符: job=" + context.getJobName()
                + ", separator=" + separator);
        }
        return separator.charAt(0);
    }
}
