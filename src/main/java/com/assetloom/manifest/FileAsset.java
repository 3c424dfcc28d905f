package com.assetloom.manifest;

import com.assetloom.asset.Asset;
import com.assetloom.asset.LoadCompletion;
import com.assetloom.asset.UnloadCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Asset whose content is the raw bytes of a file, read on an I/O executor.
 */
public class FileAsset extends Asset {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileAsset.class);

    private final Path file;
    private final Executor ioExecutor;

    public FileAsset(long id, List<Long> dependencyIds, Path file, Executor ioExecutor) {
        super(id, dependencyIds);
        this.file = Objects.requireNonNull(file, "file");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
    }

    public Path getFile() {
        return file;
    }

    /**
     * Gets a copy of the file bytes.
     *
     * {@link #getContent()} returns the shared array itself, which callers must not modify.
     *
     * @return the content, or null unless loaded
     */
    public byte[] getBytes() {
        byte[] bytes = getContent(byte[].class);
        return bytes == null ? null : bytes.clone();
    }

    @Override
    protected void beginContentLoad(LoadCompletion completion) {
        ioExecutor.execute(() -> {
            try {
                byte[] bytes = Files.readAllBytes(file);
                LOGGER.debug("Read {} bytes for asset {} from {}", bytes.length, getId(), file);
                completion.complete(bytes);
            } catch (IOException | RuntimeException e) {
                completion.fail(e);
            }
        });
    }

    @Override
    protected void beginContentUnload(Object content, UnloadCompletion completion) {
        // Nothing to release beyond the byte array, which the asset drops itself
        completion.complete();
    }
}
