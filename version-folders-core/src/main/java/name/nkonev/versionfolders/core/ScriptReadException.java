package name.nkonev.versionfolders.core;

import java.io.IOException;

public class ScriptReadException extends VersionFoldersException {

    public ScriptReadException(String scriptName, IOException cause) {
        super("Error during reading file '" + scriptName + "'", cause);
    }
}
