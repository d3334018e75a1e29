package name.nkonev.versionfolders.reader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.springframework.core.io.Resource;

/**
 * A script found by {@link SpringVersionFolderReader}, either a file or a jar entry.
 */
public class SpringResource implements MigrateResource {

    private final Resource springResource;

    public SpringResource(Resource springResource) {
        this.springResource = springResource;
    }

    /**
     * Subfolders match a glob like *.sql as well. A dangling link or an unreadable file is not a directory
     * and stays a script, so reading it fails later.
     */
    boolean isDirectory() {
        if (springResource.isFile()) {
            try {
                return springResource.getFile().isDirectory();
            } catch (IOException e) {
                throw new UncheckedIOException("Error during getting file of " + springResource, e);
            }
        }
        // jar:file:/app.jar!/migrations/1.0/
        String filename = springResource.getFilename();
        return filename == null || filename.isEmpty();
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return springResource.getInputStream();
    }

    @Override
    public String getFilename() {
        return springResource.getFilename();
    }

    @Override
    public String toString() {
        return "SpringResource{" + springResource.getDescription() + '}';
    }
}
