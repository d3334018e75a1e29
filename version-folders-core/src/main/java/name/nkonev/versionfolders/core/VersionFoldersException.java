package name.nkonev.versionfolders.core;

/**
 * Base of everything that makes a resolution fail.
 */
public class VersionFoldersException extends RuntimeException {

    public VersionFoldersException(String message) {
        super(message);
    }

    public VersionFoldersException(String message, Throwable cause) {
        super(message, cause);
    }
}
