package info.isaksson.erland.recordnames.core;

import info.isaksson.erland.recordnames.core.fixtures.Catalog;
import info.isaksson.erland.recordnames.core.fixtures.Pair;
import info.isaksson.erland.recordnames.extract.DeclaredRecordName;
import info.isaksson.erland.recordnames.extract.GenericUsage;
import info.isaksson.erland.recordnames.model.ResolvedName;
import info.isaksson.erland.recordnames.reflect.ReflectiveNamer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Names the fixture types from their source files and from their loaded classes,
 * and checks that both front ends agree.
 */
public class FrontEndConsistencyTest {

    private static final String PKG = "info.isaksson.erland.recordnames.core.fixtures";

    private static final RecordNamesService service = new RecordNamesService();
    private static RecordNamesResult fromSource;

    @BeforeAll
    static void nameSources() throws Exception {
        fromSource = service.resolveFromSource(TestPaths.fixtureSources(), new RecordNamesOptions());
        assertTrue(fromSource.parseErrors.isEmpty(), "fixtures must parse: " + fromSource.parseErrors);
    }

    @Test
    void declarationsResolveTheSameWay() {
        Catalog<String> catalog = new Catalog<>();
        Map<String, Class<?>> classes = new LinkedHashMap<>();
        classes.put(PKG + ".Catalog", Catalog.class);
        classes.put(PKG + ".Catalog.Entry", Catalog.Entry.class);
        classes.put(PKG + ".Catalog.Label", Catalog.Label.class);
        classes.put(PKG + ".Catalog.Slot", Catalog.Slot.class);
        classes.put(PKG + ".Catalog.Reference", Catalog.Reference.class);
        classes.put(PKG + ".Catalog.<local new>.Builder", catalog.built);
        classes.put(PKG + ".Catalog.<local new>.Kept", catalog.kept);
        classes.put(PKG + ".Catalog.<local new>.Early", catalog.early);
        classes.put(PKG + ".Catalog.<local finderType>.Finder", Catalog.finderType());
        classes.put(PKG + ".Pair", Pair.class);

        assertEquals(classes.size(), fromSource.declarations.size());

        ReflectiveNamer reflect = service.reflectiveNamer();
        for (Map.Entry<String, Class<?>> e : classes.entrySet()) {
            DeclaredRecordName declared = fromSource.declarations.stream()
                    .filter(d -> d.qualifiedName.equals(e.getKey()))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("not declared in source: " + e.getKey()));

            assertEquals(declared.descriptor, reflect.descriptorOf(e.getValue()), e.getKey());
            assertEquals(declared.overrides, reflect.overridesOf(e.getValue()), e.getKey());
            assertEquals(declared.resolved, reflect.resolve(e.getValue()), e.getKey());
        }
    }

    @Test
    void fieldUsagesResolveTheSameWay() {
        SortedMap<String, ResolvedName> sourceUsages = new TreeMap<>();
        for (GenericUsage u : fromSource.genericUsages) {
            if (u.declaringType.equals(PKG + ".Catalog")) sourceUsages.put(u.member, u.resolved);
        }

        SortedMap<String, ResolvedName> reflected = service.reflectiveNamer().genericUsagesOf(Catalog.class);

        assertEquals(reflected, sourceUsages);
        assertEquals(PKG + ".Pair__K_Array", reflected.get("keyed").fullName);
        assertEquals(PKG + ".Catalog.Slot", reflected.get("slot").fullName);
        assertEquals("java.util.Map__String_List", reflected.get("index").fullName);
    }

    @Test
    void constantOverrideValuesMatchTheCompiledAnnotation() {
        DeclaredRecordName reference = fromSource.declarations.stream()
                .filter(d -> d.qualifiedName.equals(PKG + ".Catalog.Reference"))
                .findFirst()
                .orElseThrow();

        assertEquals("CatRef", reference.overrides.name);
        assertEquals(PKG + ".Catalog.CatRef", service.reflectiveNamer().resolve(Catalog.Reference.class).fullName);
    }

    @Test
    void localTypesLoseTheirScopeMarker() {
        ResolvedName finder = service.reflectiveNamer().resolve(Catalog.finderType());
        assertEquals(PKG + ".Catalog", finder.namespace);
        assertEquals("Finder", finder.name);
    }
}
