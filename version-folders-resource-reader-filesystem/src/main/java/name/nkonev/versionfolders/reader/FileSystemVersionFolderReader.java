package name.nkonev.versionfolders.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads version folders from the default file system. Glob matching follows the file system's
 * own case sensitivity.
 */
public class FileSystemVersionFolderReader implements VersionFolderReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemVersionFolderReader.class);

    @Override
    public List<String> getFolderNames(String rootPath) {
        List<String> folderNames = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(rootPath), Files::isDirectory)) {
            for (Path folder : stream) {
                LOGGER.debug("Got folder {}", folder);
                folderNames.add(folder.getFileName().toString());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error during listing folders of '" + rootPath + "'", e);
        }
        return folderNames;
    }

    @Override
    public List<MigrateResource> getResources(String folderPath, String filenamePattern) {
        List<MigrateResource> resources = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(folderPath), filenamePattern)) {
            for (Path file : stream) {
                // a dangling link stays, reading it fails the resolution
                if (!Files.isDirectory(file)) {
                    LOGGER.debug("Got resource {}", file);
                    resources.add(new PathResource(file));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error during listing files of '" + folderPath + "'", e);
        }
        return resources;
    }
}
