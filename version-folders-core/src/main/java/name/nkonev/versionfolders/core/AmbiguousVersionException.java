package name.nkonev.versionfolders.core;

/**
 * Two folders under the target version have names meaning the same version, e.g. "1.0" and "01.0".
 */
public class AmbiguousVersionException extends VersionFoldersException {

    private final Version version;
    private final String folderName;

    public AmbiguousVersionException(Version version, String folderName) {
        super("Version '" + version + "' parsed for folder '" + folderName + "' is ambiguous.");
        this.version = version;
        this.folderName = folderName;
    }

    public Version getVersion() {
        return version;
    }

    public String getFolderName() {
        return folderName;
    }
}
