package org.csits.mig.server.plugin.json;

import java.nio.file.Paths;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.csits.mig.server.plugin.ExtractorFactory;
import org.springframework.stereotype.Component;

/**
 * type: json，参数 path（文件）、prefix（可选）。
 */
@Component
public class JsonFileExtractorFactory implements ExtractorFactory {

    @Override
    public String getType() {
        return "json";
    }

    @Override
    public Extractor create(StepConfig step, JobRunContext context) {
        String path = step.getString("path");
        if (path == null || path.isEmpty()) {
            throw new InvalidConfigurationException("json 抽取器缺少 path: job=" + context.getJobName());
        }
        return new JsonFileExtractor(Paths.get(path), step.getString("prefix"));
    }
}
