package name.nkonev.versionfolders.core;

import name.nkonev.versionfolders.reader.MigrateResource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;

public abstract class FileReader {

    public static SqlScript read(String scriptName, MigrateResource resource, Charset fileCharset) {
        try (InputStream inputStream = resource.getInputStream()) {
            return SqlScript.fromStream(scriptName, inputStream, fileCharset);
        } catch (IOException e) {
            throw new ScriptReadException(scriptName, e);
        }
    }

}
