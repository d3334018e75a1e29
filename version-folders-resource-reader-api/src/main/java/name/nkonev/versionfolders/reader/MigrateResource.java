package name.nkonev.versionfolders.reader;

import java.io.IOException;
import java.io.InputStream;

/**
 * A script file found inside a version folder, something from where we can get InputStream
 */
public interface MigrateResource {

    /**
     * Opens the file for read. The caller closes the stream.
     */
    InputStream getInputStream() throws IOException;

    /**
     * @return file name without any folder part, e.g. V1__create_customers.sql
     */
    String getFilename();
}
