package name.nkonev.versionfolders.core;

public class MalformedVersionException extends VersionFoldersException {

    private final String input;

    public MalformedVersionException(String input) {
        super("Error parsing version from string '" + input + "'.");
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
