package name.nkonev.versionfolders.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Four-component version of a folder: major.minor.build.revision. Absent components are 0.
 */
public final class Version implements Comparable<Version> {

    private static final Comparator<Version> COMPARATOR = Comparator
        .comparingInt(Version::getMajor)
        .thenComparingInt(Version::getMinor)
        .thenComparingInt(Version::getBuild)
        .thenComparingInt(Version::getRevision);

    private final int major;
    private final int minor;
    private final int build;
    private final int revision;

    public Version(int major, int minor, int build, int revision) {
        if (major < 0 || minor < 0 || build < 0 || revision < 0) {
            throw new IllegalArgumentException("Version components cannot be negative: " + major + "." + minor + "." + build + "." + revision);
        }
        this.major = major;
        this.minor = minor;
        this.build = build;
        this.revision = revision;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getBuild() {
        return build;
    }

    public int getRevision() {
        return revision;
    }

    @Override
    public int compareTo(Version other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Version version = (Version) o;
        return major == version.major && minor == version.minor && build == version.build && revision == version.revision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, build, revision);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + build + "." + revision;
    }
}
