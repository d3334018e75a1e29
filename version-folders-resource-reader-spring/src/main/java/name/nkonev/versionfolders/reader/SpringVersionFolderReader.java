package name.nkonev.versionfolders.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.util.StringUtils;

/**
 * Reads version folders from Spring resource locations, e.g. classpath:/migrations or file:/var/migrations.
 * <p>
 * Folders are discovered through the entries they contain, so a folder without any entry is not reported.
 * Every matching entry except subfolders is returned, readable or not.
 * <p>
 * Spring locations are Ant-style patterns without escaping, so a folder path containing {@code *}, {@code ?}
 * or braces is rejected with {@link IllegalArgumentException} instead of being expanded.
 */
public class SpringVersionFolderReader implements VersionFolderReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpringVersionFolderReader.class);

    private final ResourcePatternResolver resolver;

    private final PathMatcher pathMatcher = new AntPathMatcher();

    public SpringVersionFolderReader() {
        resolver = new PathMatchingResourcePatternResolver();
    }

    public SpringVersionFolderReader(ResourcePatternResolver resourcePatternResolver) {
        resolver = resourcePatternResolver;
    }

    @Override
    public List<String> getFolderNames(String rootPath) {
        Set<String> folderNames = new LinkedHashSet<>();
        for (Resource resource : getSpringResources(withoutTrailingSlash(rootPath) + "/*/*")) {
            String folderName = getParentName(resource);
            if (folderName != null && folderNames.add(folderName)) {
                LOGGER.debug("Got folder {}", folderName);
            }
        }
        return new ArrayList<>(folderNames);
    }

    @Override
    public List<MigrateResource> getResources(String folderPath, String filenamePattern) {
        if (pathMatcher.isPattern(folderPath)) {
            throw new IllegalArgumentException("Folder path '" + folderPath + "' contains pattern characters");
        }
        String location = withoutTrailingSlash(folderPath) + "/" + filenamePattern;
        // without wildcards the resolver returns the location itself, existing or not
        boolean literal = !pathMatcher.isPattern(location);
        return Arrays.stream(getSpringResources(location))
            .filter(resource -> !literal || resource.exists())
            .map(SpringResource::new)
            .filter(resource -> !resource.isDirectory())
            .peek(resource -> LOGGER.debug("Got resource {}", resource))
            .collect(Collectors.<MigrateResource>toList());
    }

    private Resource[] getSpringResources(String locationPattern) {
        try {
            return resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new UncheckedIOException("Error during resolving '" + locationPattern + "'", e);
        }
    }

    // file:/var/migrations/1.0/V1__init.sql -> 1.0
    static String getParentName(Resource resource) {
        String path;
        try {
            path = StringUtils.uriDecode(resource.getURL().getPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Error during getting url of " + resource, e);
        }
        String[] split = withoutTrailingSlash(path).split("/");
        if (split.length < 2) {
            return null;
        }
        return split[split.length - 2];
    }

    private static String withoutTrailingSlash(String s) {
        String result = s;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
