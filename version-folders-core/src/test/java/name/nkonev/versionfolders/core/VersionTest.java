package name.nkonev.versionfolders.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class VersionTest {

    @Test
    void testOrdering() {
        Version v1000 = new Version(1, 0, 0, 0);
        Version v1001 = new Version(1, 0, 0, 1);
        Version v1100 = new Version(1, 1, 0, 0);
        Version v2000 = new Version(2, 0, 0, 0);

        Assertions.assertTrue(v1000.compareTo(v1001) < 0);
        Assertions.assertTrue(v1001.compareTo(v1100) < 0);
        Assertions.assertTrue(v1100.compareTo(v2000) < 0);
        Assertions.assertTrue(v2000.compareTo(v1000) > 0);
        Assertions.assertEquals(0, v1100.compareTo(new Version(1, 1, 0, 0)));

        List<Version> versions = new ArrayList<>(List.of(v2000, v1100, v1000, v1001));
        Collections.sort(versions);
        Assertions.assertEquals(List.of(v1000, v1001, v1100, v2000), versions);
    }

    @Test
    void testBuildIsComparedBeforeRevision() {
        Assertions.assertTrue(new Version(1, 0, 1, 0).compareTo(new Version(1, 0, 0, 9)) > 0);
    }

    @Test
    void testEquality() {
        Assertions.assertEquals(new Version(3, 2, 1, 0), new Version(3, 2, 1, 0));
        Assertions.assertEquals(new Version(3, 2, 1, 0).hashCode(), new Version(3, 2, 1, 0).hashCode());
        Assertions.assertNotEquals(new Version(3, 2, 1, 0), new Version(3, 2, 0, 1));
    }

    @Test
    void testToString() {
        Assertions.assertEquals("1.2.0.0", new Version(1, 2, 0, 0).toString());
    }

    @Test
    void testNegativeComponent() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Version(1, -1, 0, 0));
    }
}
