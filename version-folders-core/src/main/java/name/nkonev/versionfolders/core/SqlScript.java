package name.nkonev.versionfolders.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;

public class SqlScript {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // 1.0/V1__create_customers.sql
    private final String name;
    private final String contents;

    public SqlScript(String name, String contents) {
        this.name = Objects.requireNonNull(name, "name");
        this.contents = Objects.requireNonNull(contents, "contents");
    }

    /**
     * Reads the stream to its end, leaves it open.
     */
    public static SqlScript fromStream(String name, InputStream inputStream, Charset charset) throws IOException {
        String contents = new String(inputStream.readAllBytes(), charset);
        if (!contents.isEmpty() && contents.charAt(0) == BYTE_ORDER_MARK) {
            contents = contents.substring(1);
        }
        return new SqlScript(name, contents);
    }

    public String getName() {
        return name;
    }

    public String getContents() {
        return contents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SqlScript sqlScript = (SqlScript) o;
        return name.equals(sqlScript.name) && contents.equals(sqlScript.contents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, contents);
    }

    @Override
    public String toString() {
        return "SqlScript{" +
            "name='" + name + '\'' +
            ", contents.length=" + contents.length() +
            '}';
    }
}
