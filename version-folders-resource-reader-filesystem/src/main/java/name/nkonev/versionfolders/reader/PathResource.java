package name.nkonev.versionfolders.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class PathResource implements MigrateResource {

    // /var/migrations/1.0/V1__create_customers.sql
    private final Path path;

    public PathResource(Path path) {
        this.path = path;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public String getFilename() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return "PathResource{" + path + '}';
    }
}
