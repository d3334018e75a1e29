package name.nkonev.versionfolders.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import name.nkonev.versionfolders.reader.MigrateResource;
import name.nkonev.versionfolders.reader.VersionFolderReader;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Collects sql scripts from version folders, i.e. subfolders of {@link VersionFoldersProperties#getResourcesPath()}.
 * Every script is named "folder/file", so equally named files from different folders stay distinct.
 * <p>
 * Without a target version every folder is taken in enumeration order. With a target version each folder
 * name (after the filter) must parse with {@link VersionParser}, folders above the target are excluded and
 * two accepted folders of the same version fail the resolution.
 */
public abstract class VersionFolders {

    private static final Logger LOGGER = Loggers.getLogger(VersionFolders.class);

    // entrypoint
    public static List<SqlScript> resolve(VersionFoldersProperties properties, VersionFolderReader reader) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        if (properties.getResourcesPath() == null || properties.getResourcesPath().isEmpty()) {
            throw new IllegalArgumentException("resourcesPath should be set in " + properties);
        }
        LOGGER.info("Configured with {}", properties);

        List<SqlScript> scripts = properties.hasTargetVersion()
            ? getScriptsWithTargetVersion(properties, reader)
            : getScriptsWithoutTargetVersion(properties, reader);

        LOGGER.info("Found {} sql scripts", scripts.size());
        return scripts;
    }

    /**
     * Same as {@link #resolve(VersionFoldersProperties, VersionFolderReader)}, performed on subscription.
     */
    public static Mono<List<SqlScript>> resolveLater(VersionFoldersProperties properties, VersionFolderReader reader) {
        return Mono.fromCallable(() -> resolve(properties, reader));
    }

    private static List<SqlScript> getScriptsWithoutTargetVersion(VersionFoldersProperties properties, VersionFolderReader reader) {
        List<SqlScript> scripts = new ArrayList<>();
        for (String folderName : reader.getFolderNames(properties.getResourcesPath())) {
            scripts.addAll(getScriptsFromFolder(properties, reader, folderName));
        }
        return scripts;
    }

    private static List<SqlScript> getScriptsWithTargetVersion(VersionFoldersProperties properties, VersionFolderReader reader) {
        List<String> folderNames = reader.getFolderNames(properties.getResourcesPath());

        Predicate<String> filter = properties.getFilter();
        if (filter != null) {
            folderNames = folderNames.stream().filter(filter).collect(Collectors.toList());
        }

        List<SqlScript> scripts = new ArrayList<>();
        if (folderNames.isEmpty()) {
            return scripts;
        }

        Version target = VersionParser.parse(properties.getTargetVersion());
        Set<Version> parsedVersions = new HashSet<>();

        for (String folderName : folderNames) {
            // all the folder names left here are expected to be parseable
            Version folderVersion = VersionParser.parse(folderName);

            if (folderVersion.compareTo(target) > 0) {
                LOGGER.debug("Skipping folder '{}' of version {} above target {}", folderName, folderVersion, target);
                continue;
            }
            if (!parsedVersions.add(folderVersion)) {
                throw new AmbiguousVersionException(folderVersion, folderName);
            }
            LOGGER.debug("Taking folder '{}' of version {}", folderName, folderVersion);
            scripts.addAll(getScriptsFromFolder(properties, reader, folderName));
        }
        return scripts;
    }

    private static List<SqlScript> getScriptsFromFolder(VersionFoldersProperties properties, VersionFolderReader reader, String folderName) {
        String folderPath = getFolderPath(properties.getResourcesPath(), folderName);
        Predicate<String> filter = properties.getFilter();

        List<SqlScript> scripts = new ArrayList<>();
        for (MigrateResource resource : reader.getResources(folderPath, properties.getFilenamePattern())) {
            String scriptName = folderName + "/" + resource.getFilename();
            if (filter != null && !filter.test(scriptName)) {
                LOGGER.debug("Filtered out {}", scriptName);
                continue;
            }
            LOGGER.debug("Reading {}", resource);
            scripts.add(FileReader.read(scriptName, resource, properties.getFileCharset()));
        }
        return scripts;
    }

    static String getFolderPath(String resourcesPath, String folderName) {
        if (resourcesPath.endsWith("/")) {
            return resourcesPath + folderName;
        }
        return resourcesPath + "/" + folderName;
    }
}
