package org.csits.mig.manager.filesystem;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * 本地文件系统实现。
 */
@Component
public class LocalFileSystemManager implements FileSystemManager {

    @Override
    public Path ensureDirectory(Path dir) throws IOException {
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }

    @Override
    public List<Path> listFiles(Path dir, String glob) throws IOException {
        if (Files.notExists(dir) || !Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        PathMatcher matcher = matcher(glob);
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> matcher.matches(p.getFileName()))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    private PathMatcher matcher(String glob) {
        String pattern = glob == null || glob.isEmpty() ? "*" : glob;
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }
}
