package name.nkonev.versionfolders.reader;

import java.util.List;

/**
 * Enumerates version folders and the script files inside them.
 * Failures during enumeration are reported as {@link java.io.UncheckedIOException}.
 */
public interface VersionFolderReader {

    /**
     * @param rootPath directory holding the version folders
     * @return names (not paths) of the immediate subfolders, in enumeration order
     */
    List<String> getFolderNames(String rootPath);

    /**
     * @param folderPath version folder, i.e. rootPath + "/" + folderName
     * @param filenamePattern glob matched against file names, e.g. *.sql
     * @return files located directly in the folder, in enumeration order
     */
    List<MigrateResource> getResources(String folderPath, String filenamePattern);

}
