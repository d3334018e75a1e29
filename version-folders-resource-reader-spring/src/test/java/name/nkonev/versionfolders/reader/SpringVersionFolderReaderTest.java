package name.nkonev.versionfolders.reader;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

class SpringVersionFolderReaderTest {

    private final SpringVersionFolderReader reader = new SpringVersionFolderReader();

    @TempDir
    Path root;

    private static List<String> filenames(List<MigrateResource> resources) {
        return resources.stream().map(MigrateResource::getFilename).sorted().collect(Collectors.toList());
    }

    @Test
    void testClasspathFolderNames() {
        List<String> folderNames = reader.getFolderNames("classpath:/folders");
        Assertions.assertEquals(List.of("1.0", "2.0"), folderNames.stream().sorted().collect(Collectors.toList()));
    }

    @Test
    void testClasspathResources() {
        Assertions.assertEquals(List.of("a.sql", "b.sql"), filenames(reader.getResources("classpath:/folders/1.0", "*.sql")));
        Assertions.assertEquals(List.of("a.sql"), filenames(reader.getResources("classpath:/folders/2.0/", "*.sql")));
    }

    @Test
    void testFileLocation() throws IOException {
        FileUtils.writeStringToFile(new File(root.toFile(), "1 0/a.sql"), "select 1;", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(new File(root.toFile(), "3.0/b.sql"), "select 3;", StandardCharsets.UTF_8);
        FileUtils.forceMkdir(new File(root.toFile(), "empty"));

        String location = "file:" + root.toAbsolutePath();

        Assertions.assertEquals(List.of("1 0", "3.0"), reader.getFolderNames(location).stream().sorted().collect(Collectors.toList()));
        Assertions.assertEquals(List.of("b.sql"), filenames(reader.getResources(location + "/3.0", "*.sql")));
    }

    @Test
    void testDanglingLinkIsReturnedAndSubfolderIsNot() throws IOException {
        Path folder = root.resolve("1.0");
        FileUtils.writeStringToFile(folder.resolve("a.sql").toFile(), "select 1;", StandardCharsets.UTF_8);
        Files.createSymbolicLink(folder.resolve("b.sql"), folder.resolve("missing.sql"));
        FileUtils.forceMkdir(folder.resolve("c.sql").toFile());

        List<MigrateResource> resources = reader.getResources("file:" + folder.toAbsolutePath(), "*.sql");

        Assertions.assertEquals(List.of("a.sql", "b.sql"), filenames(resources));
        MigrateResource dangling = resources.stream().filter(r -> r.getFilename().equals("b.sql")).findFirst().orElseThrow();
        Assertions.assertThrows(IOException.class, dangling::getInputStream);
    }

    @Test
    void testFolderPathWithPatternCharacters() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> reader.getResources("classpath:/folders/1.*", "*.sql"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> reader.getResources("classpath:/folders/{version}", "*.sql"));
    }

    @Test
    void testMissingResource() {
        Assertions.assertEquals(List.of(), reader.getResources("classpath:/folders/1.0", "absent.sql"));
    }

    @Test
    void testParentName() {
        Assertions.assertEquals("1.0", SpringVersionFolderReader.getParentName(new FileSystemResource("/var/migrations/1.0/a.sql")));
    }
}
