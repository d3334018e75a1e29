package name.nkonev.versionfolders.core;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.function.Predicate;
import java.util.regex.Pattern;

public class VersionFoldersProperties {
    private boolean enable = true;
    private String resourcesPath;
    private String targetVersion;
    private Charset fileCharset = StandardCharsets.UTF_8;
    private String filenamePattern = "*.sql";
    private Predicate<String> filter;
    private String filterRegex;

    public VersionFoldersProperties() {
    }

    public boolean isEnable() {
        return enable;
    }

    public void setEnable(boolean enable) {
        this.enable = enable;
    }

    /**
     * Directory holding the version folders.
     */
    public String getResourcesPath() {
        return resourcesPath;
    }

    public void setResourcesPath(String resourcesPath) {
        this.resourcesPath = resourcesPath;
    }

    /**
     * Folders with a higher version are excluded. Null or empty means all folders are taken as is.
     */
    public String getTargetVersion() {
        return targetVersion;
    }

    public void setTargetVersion(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    public boolean hasTargetVersion() {
        return targetVersion != null && !targetVersion.isEmpty();
    }

    public Charset getFileCharset() {
        return fileCharset;
    }

    public void setFileCharset(Charset fileCharset) {
        this.fileCharset = fileCharset;
    }

    public String getFilenamePattern() {
        return filenamePattern;
    }

    public void setFilenamePattern(String filenamePattern) {
        this.filenamePattern = filenamePattern;
    }

    /**
     * Applied to folder names when a target version is set, and to "folder/file" names always.
     *
     * @return the predicate set programmatically, otherwise one made from {@link #getFilterRegex()}, otherwise null
     */
    public Predicate<String> getFilter() {
        if (filter != null) {
            return filter;
        }
        if (filterRegex != null && !filterRegex.isEmpty()) {
            return Pattern.compile(filterRegex).asMatchPredicate();
        }
        return null;
    }

    public void setFilter(Predicate<String> filter) {
        this.filter = filter;
    }

    public String getFilterRegex() {
        return filterRegex;
    }

    public void setFilterRegex(String filterRegex) {
        this.filterRegex = filterRegex;
    }

    @Override
    public String toString() {
        return "VersionFoldersProperties{" +
            "enable=" + enable +
            ", resourcesPath='" + resourcesPath + '\'' +
            ", targetVersion='" + targetVersion + '\'' +
            ", fileCharset=" + fileCharset +
            ", filenamePattern='" + filenamePattern + '\'' +
            ", filter=" + (filter != null ? "custom" : null) +
            ", filterRegex='" + filterRegex + '\'' +
            '}';
    }
}
