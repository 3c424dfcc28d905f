package com.assetloom.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Parsed asset manifest.
 *
 * @param source the file the manifest was read from
 * @param entries valid entries in file order
 */
public record AssetManifest(Path source, List<Entry> entries) {

    public AssetManifest {
        entries = List.copyOf(entries);
    }

    /**
     * Creates one file-backed asset per entry.
     *
     * @param assetRoot directory entry paths are resolved against
     * @param ioExecutor executor the file reads run on
     * @return the assets in manifest order
     */
    public List<FileAsset> toAssets(Path assetRoot, Executor ioExecutor) {
        List<FileAsset> assets = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            assets.add(new FileAsset(entry.id(), entry.dependsOn(),
                assetRoot.resolve(entry.path()).normalize(), ioExecutor));
        }
        return assets;
    }

    /**
     * One asset declaration.
     *
     * @param id the asset id
     * @param path file path relative to the asset root
     * @param dependsOn ids of the asset's dependencies
     */
    public record Entry(long id, String path, List<Long> dependsOn) {

        public Entry {
            dependsOn = List.copyOf(dependsOn);
        }
    }
}
