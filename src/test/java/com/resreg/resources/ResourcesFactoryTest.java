package com.resreg.resources;

import com.resreg.Fixtures;
import com.resreg.errors.BundleInitException;
import com.resreg.errors.ResourcesException;
import com.resreg.errors.ResourcesKeyException;
import com.resreg.locale.SystemLocale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourcesFactoryTest {
    private static final SystemLocale GERMANY = SystemLocale.parse(SystemLocale.GERMANY);

    @Test
    void getResourcesShouldReturnSameInstancePerName(@TempDir Path dir) throws Exception {
        String base = Fixtures.propertyBundles(dir);
        PropertyResourcesFactory factory = new PropertyResourcesFactory();

        Resources first = factory.getResources("app", base);
        Resources second = factory.getResources("app", "ignored-on-second-call");

        assertSame(first, second);
        assertTrue(first instanceof PropertyResources);
        assertEquals(base, ((PropertyResources) first).getConfig());
        assertEquals(1, factory.size());
    }

    @Test
    void releaseShouldDestroyRegistriesAndLetThemBeRebuilt(@TempDir Path dir) throws Exception {
        String base = Fixtures.propertyBundles(dir);
        PropertyResourcesFactory factory = new PropertyResourcesFactory();
        Resources before = factory.getResources("app", base);
        assertEquals("Testwert", before.find("test.key", GERMANY));

        factory.release();

        assertEquals(0, factory.size());
        assertTrue(before.getLoadedLocales().isEmpty());
        Resources after = factory.getResources("app", base);
        assertNotSame(before, after);
        assertEquals("Testwert", after.find("test.key", GERMANY));
    }

    @Test
    void returnNullPolicyShouldApplyToRegistriesCreatedAfterwards(@TempDir Path dir) throws Exception {
        String base = Fixtures.propertyBundles(dir);
        PropertyResourcesFactory factory = new PropertyResourcesFactory();
        Resources lenient = factory.getResources("lenient", base);

        factory.setReturnNull(false);
        Resources strict = factory.getResources("strict", base);

        assertTrue(lenient.isReturnNull());
        assertFalse(strict.isReturnNull());
        assertEquals("", lenient.find("missing", GERMANY));
        assertThrows(ResourcesKeyException.class, () -> strict.find("missing", GERMANY));
    }

    @Test
    void defaultLocaleShouldBeHandedToNewRegistries(@TempDir Path dir) throws Exception {
        String base = Fixtures.propertyBundles(dir);
        PropertyResourcesFactory factory = new PropertyResourcesFactory();
        factory.setDefaultSystemLocale(GERMANY);

        Resources resources = factory.getResources("app", base);

        assertEquals(GERMANY, resources.getDefaultSystemLocale());
        assertEquals("Testwert", resources.find("test.key"));
    }

    @Test
    void nameOnlyLookupShouldRequireCachedRegistry(@TempDir Path dir) throws Exception {
        PropertyResourcesFactory properties = new PropertyResourcesFactory();
        DbResourcesFactory databases = new DbResourcesFactory();

        assertThrows(ResourcesException.class, () -> properties.getResources("app"));
        assertThrows(ResourcesException.class, () -> databases.getResources("db", " "));
        assertEquals(0, properties.size());
        assertEquals(0, databases.size());

        Resources created = properties.getResources("app", Fixtures.propertyBundles(dir));
        assertSame(created, properties.getResources("app"));
        assertEquals("Testwert", properties.getResources("app").find("test.key", GERMANY));
    }

    @Test
    void emptyNameShouldBeRejected() {
        PropertyResourcesFactory factory = new PropertyResourcesFactory();

        assertThrows(IllegalArgumentException.class, () -> factory.getResources(" ", "x"));
        assertThrows(IllegalArgumentException.class, () -> factory.getResources(null));
    }

    @Test
    void dbFactoryShouldBuildDatabaseRegistries(@TempDir Path dir) throws Exception {
        String locator = Fixtures.database(dir);
        ResourcesFactory factory = Backend.fromName("db").newFactory();
        try {
            Resources resources = factory.getResources("db", locator);

            assertTrue(resources instanceof DbResources);
            assertEquals("Testwert", resources.find("test.key", GERMANY));
        } finally {
            factory.release();
        }
    }

    @Test
    void bundleFailureShouldNotPoisonTheFactory(@TempDir Path dir) throws Exception {
        PropertyResourcesFactory factory = new PropertyResourcesFactory();
        Resources resources = factory.getResources("app", dir.resolve("testresources").toString());

        assertThrows(BundleInitException.class, () -> resources.find("test.key", GERMANY));

        Fixtures.propertyBundles(dir);
        assertEquals("Testwert", resources.find("test.key", GERMANY));
    }

    @Test
    void backendShouldResolveAliases() {
        assertEquals(Backend.PROPERTY, Backend.fromName("Properties"));
        assertEquals(Backend.DATABASE, Backend.fromName("jdbc"));
        assertThrows(IllegalArgumentException.class, () -> Backend.fromName("ldap"));
    }
}
