package org.csits.mig.server.plugin.json;

import lombok.RequiredArgsConstructor;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.plugin.AbstractFileLoader;
import org.csits.mig.server.plugin.LoaderFactory;
import org.springframework.stereotype.Component;

/**
 * type: json，参数 path（目录，默认 settings.output_path）、file（文件名前缀，默认加载器名）、
 * prefix（可选）、overwrite（为 true 时文件名不带运行时间戳，默认 false）。
 */
@Component
@RequiredArgsConstructor
public class JsonFileLoaderFactory implements LoaderFactory {

    private final FileSystemManager fileSystemManager;

    @Override
    public String getType() {
        return "json";
    }

    @Override
    public Loader create(LoadStepConfig step, JobRunContext context) {
        return new JsonFileLoader(step, context.getJobName(), fileSystemManager,
            AbstractFileLoader.resolveTarget(step, context, "json"), step.getStringList("prefix"));
    }
}
