package org.csits.mig.manager.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 文件系统操作抽象。
 */
public interface FileSystemManager {

    Path ensureDirectory(Path dir) throws IOException;

    /**
     * 列出目录下（不递归）文件名匹配 glob 的文件，按文件名升序。
     */
    List<Path> listFiles(Path dir, String glob) throws IOException;
}
