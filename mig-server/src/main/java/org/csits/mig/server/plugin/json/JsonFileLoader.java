package org.csits.mig.server.plugin.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.plugin.AbstractFileLoader;

/**
 * 把行写成一个 JSON 数组。
 */
public class JsonFileLoader extends AbstractFileLoader {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public JsonFileLoader(LoadStepConfig step, String jobName, FileSystemManager fileSystemManager, Path target,
                          List<String> prefixes) {
        super(step, jobName, fileSystemManager, target, prefixes);
    }

    @Override
    protected void write(Path target, List<Map<String, Object>> records) throws IOException {
        objectMapper.writeValue(target.toFile(), records);
    }
}
