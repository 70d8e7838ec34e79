package org.csits.mig.server.plugin.csv;

import java.nio.file.Paths;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.ExtractorFactory;
import org.springframework.stereotype.Component;

/**
 * type: csv，参数 path（文件）、prefix（可选）、separator（列分隔符，默认逗号）。
 */
@Component
public class CsvFileExtractorFactory implements ExtractorFactory {

    @Override
    public String getType() {
        return "csv";
    }

    @Override
    public Extractor create(StepConfig step, JobRunContext context) {
        String path = step.getString("path");
        if (path == null || path.isEmpty()) {
            throw new InvalidConfigurationException("csv 抽取器缺少 path: job=" + context.getJobName());
        }
        return new CsvFileExtractor(Paths.get(path), step.getString("prefix"),
            CsvFileLoaderFactory.separator(step, context));
    }
}
