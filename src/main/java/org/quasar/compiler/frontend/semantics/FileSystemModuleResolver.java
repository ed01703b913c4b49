package org.quasar.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves local imports against a base directory on the file system.
 */
public class FileSystemModuleResolver implements ModuleResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemModuleResolver.class);

    private final Path baseDirectory;

    /**
     * @param baseDirectory The directory relative import paths are resolved against.
     */
    public FileSystemModuleResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public boolean exists(String path) {
        Path resolved = baseDirectory.resolve(path).normalize();
        boolean exists = Files.isRegularFile(resolved);
        LOG.debug("Module '{}' resolved to {} (exists: {})", path, resolved, exists);
        return exists;
    }
}
