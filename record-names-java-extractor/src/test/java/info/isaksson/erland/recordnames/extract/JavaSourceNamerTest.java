package info.isaksson.erland.recordnames.extract;

import info.isaksson.erland.recordnames.model.NameResolver;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.TypeDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JavaSourceNamerTest {

    private final JavaSourceNamer namer = new JavaSourceNamer();

    @Test
    void namesTopLevelAndNestedTypes() {
        String code = "package com.acme;\n" +
                "public class Outer {\n" +
                "  public static class Inner { }\n" +
                "  enum Mode { A, B }\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("com/acme/Outer.java", code));

        assertEquals(List.of("com.acme.Outer", "com.acme.Outer.Inner", "com.acme.Outer.Mode"),
                model.declarations.stream().map(d -> d.qualifiedName).collect(Collectors.toList()));
        DeclaredRecordName inner = model.declaration("com.acme.Outer.Inner").orElseThrow();
        assertEquals("com.acme.Outer", inner.resolved.namespace);
        assertEquals("Inner", inner.resolved.name);
        assertEquals("com/acme/Outer.java", inner.sourcePath);
        assertFalse(inner.local);
    }

    @Test
    void genericDeclarationEncodesItsTypeParameters() {
        String code = "package com.acme;\n" +
                "public class Pair<A, B> { A first; B second; }\n";

        DeclaredRecordName pair = namer.extractFromStrings(Map.of("Pair.java", code))
                .declaration("com.acme.Pair").orElseThrow();

        assertEquals(List.of(TypeDescriptor.unscoped("A"), TypeDescriptor.unscoped("B")), pair.descriptor.typeArguments);
        assertEquals("com.acme.Pair__A_B", pair.resolved.fullName);
    }

    @Test
    void readsOverrideAnnotationsBySimpleAndQualifiedName() {
        String code = "package com.acme;\n" +
                "import info.isaksson.erland.recordnames.model.annotations.*;\n" +
                "@RecordName(\"Person\")\n" +
                "@info.isaksson.erland.recordnames.model.annotations.RecordNamespace(value = \"org.people\")\n" +
                "public class Human { }\n" +
                "@ErasedName\n" +
                "class Box<T> { }\n" +
                "@RecordNamespace(\"\")\n" +
                "class Loose { }\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("Human.java", code));

        DeclaredRecordName human = model.declaration("com.acme.Human").orElseThrow();
        assertEquals(new OverrideSet("Person", "org.people", false), human.overrides);
        assertEquals("org.people.Person", human.resolved.fullName);

        DeclaredRecordName box = model.declaration("com.acme.Box").orElseThrow();
        assertTrue(box.overrides.erased);
        assertEquals("com.acme.Box", box.resolved.fullName);

        assertEquals("Loose", model.declaration("com.acme.Loose").orElseThrow().resolved.fullName);
    }

    @Test
    void localTypesGetAMarkedOwnerThatIsStrippedFromTheNamespace() {
        String code = "package com.acme;\n" +
                "public class Service {\n" +
                "  Service() { class Built { } }\n" +
                "  static { class Boot { } }\n" +
                "  void run() {\n" +
                "    class Step { class Detail { } }\n" +
                "    record Point(int x, int y) { }\n" +
                "    Runnable r = new Runnable() { public void run() { class Hidden { } } };\n" +
                "  }\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("Service.java", code));

        DeclaredRecordName step = model.declaration("com.acme.Service.<local run>.Step").orElseThrow();
        assertTrue(step.local);
        assertEquals("com.acme.Service.<local run>", step.descriptor.ownerPath);
        assertEquals("com.acme.Service.Step", step.resolved.fullName);

        DeclaredRecordName detail = model.declaration("com.acme.Service.<local run>.Step.Detail").orElseThrow();
        assertTrue(detail.local);
        assertEquals("com.acme.Service.Step.Detail", detail.resolved.fullName);

        assertEquals("com.acme.Service.Point", model.declaration("com.acme.Service.<local run>.Point").orElseThrow().resolved.fullName);
        assertTrue(model.declaration("com.acme.Service.<local new>.Built").isPresent());
        assertTrue(model.declaration("com.acme.Service.<local init>.Boot").isPresent());
        assertTrue(model.declarations.stream().noneMatch(d -> d.qualifiedName.endsWith("Hidden")),
                "types inside anonymous classes are not named");
    }

    @Test
    void lambdaScopesFollowTheMemberHoldingTheLambda() {
        String code = "package com.acme;\n" +
                "import java.util.function.Supplier;\n" +
                "public class Holder {\n" +
                "  static final Supplier<Object> SHARED = () -> { class StaticLocal { } return new StaticLocal(); };\n" +
                "  final Supplier<Object> own = () -> { class FieldLocal { } return new FieldLocal(); };\n" +
                "  {\n" +
                "    class BlockLocal { }\n" +
                "    Runnable r = () -> { class BlockLambdaLocal { } };\n" +
                "  }\n" +
                "  static { Runnable r = () -> { class StaticBlockLocal { } }; }\n" +
                "}\n" +
                "interface Defaults {\n" +
                "  Supplier<Object> FALLBACK = () -> { class InterfaceLocal { } return new InterfaceLocal(); };\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("com/acme/Holder.java", code));

        assertTrue(model.declaration("com.acme.Holder.<local init>.StaticLocal").isPresent());
        assertTrue(model.declaration("com.acme.Holder.<local init>.BlockLocal").isPresent());
        assertTrue(model.declaration("com.acme.Holder.<local new>.BlockLambdaLocal").isPresent());
        assertTrue(model.declaration("com.acme.Holder.<local init>.StaticBlockLocal").isPresent());
        assertTrue(model.declaration("com.acme.Defaults.<local init>.InterfaceLocal").isPresent());

        DeclaredRecordName fieldLocal = model.declaration("com.acme.Holder.<local new>.FieldLocal").orElseThrow();
        assertTrue(fieldLocal.local);
        assertEquals("com.acme.Holder.FieldLocal", fieldLocal.resolved.fullName);
        assertEquals(8, model.declarations.size());
    }

    @Test
    void constantOverrideValuesAreEvaluated() {
        String names = "package p;\n" +
                "public final class Names {\n" +
                "  public static final String PREFIX = \"Pre\";\n" +
                "  public static final String NAME = PREFIX + \"fix\" + 2;\n" +
                "  public static final String SPACE = \"org.\" + \"shop\";\n" +
                "}\n";
        String models = "package p;\n" +
                "import info.isaksson.erland.recordnames.model.annotations.*;\n" +
                "import static p.Names.SPACE;\n" +
                "@RecordName(\"Jo\" + \"ined\")\n" +
                "class Concat { }\n" +
                "@RecordName(Names.NAME)\n" +
                "class Qualified { }\n" +
                "@RecordNamespace(SPACE)\n" +
                "class Imported { }\n" +
                "class Outer {\n" +
                "  static final String INNER = \"Renamed\";\n" +
                "  @RecordName(INNER) static class Inner { }\n" +
                "  @RecordName((INNER + \"_\") + 'x') static class Chained { }\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("p/Names.java", names, "p/Models.java", models));

        assertEquals(List.of(), model.parseErrors);
        assertEquals("p.Joined", model.declaration("p.Concat").orElseThrow().resolved.fullName);
        assertEquals("p.Prefix2", model.declaration("p.Qualified").orElseThrow().resolved.fullName);
        assertEquals(new OverrideSet(null, "org.shop", false), model.declaration("p.Imported").orElseThrow().overrides);
        assertEquals("org.shop.Imported", model.declaration("p.Imported").orElseThrow().resolved.fullName);
        assertEquals("p.Outer.Renamed", model.declaration("p.Outer.Inner").orElseThrow().resolved.fullName);
        assertEquals("p.Outer.Renamed_x", model.declaration("p.Outer.Chained").orElseThrow().resolved.fullName);
    }

    @Test
    void overrideValuesThatAreNotConstantsAreReportedAndIgnored() {
        String code = "package p;\n" +
                "import info.isaksson.erland.recordnames.model.annotations.RecordName;\n" +
                "import info.isaksson.erland.recordnames.model.annotations.RecordNamespace;\n" +
                "import org.other.External;\n" +
                "@RecordName(External.NAME)\n" +
                "class Foreign { }\n" +
                "@RecordNamespace(\"ns\".toUpperCase())\n" +
                "class Called { }\n" +
                "class Loop {\n" +
                "  static final String A = B;\n" +
                "  static final String B = A;\n" +
                "  @RecordName(A) static class Inner { }\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("p/Odd.java", code));

        DeclaredRecordName foreign = model.declaration("p.Foreign").orElseThrow();
        assertEquals(OverrideSet.none(), foreign.overrides);
        assertEquals("p.Foreign", foreign.resolved.fullName);
        assertEquals("p.Called", model.declaration("p.Called").orElseThrow().resolved.fullName);
        assertEquals("p.Loop.Inner", model.declaration("p.Loop.Inner").orElseThrow().resolved.fullName);

        assertEquals(3, model.parseErrors.size(), model.parseErrors.toString());
        assertTrue(model.parseErrors.stream().allMatch(e -> e.startsWith("p/Odd.java: @")), model.parseErrors.toString());
        assertTrue(model.parseErrors.stream().anyMatch(e -> e.contains("External.NAME") && e.contains("p.Foreign")));
        assertTrue(model.parseErrors.stream().anyMatch(e -> e.contains("override ignored")));
    }

    @Test
    void parameterizedFieldTypesAreNamedWithTheirArguments() {
        String pair = "package com.acme.model;\n" +
                "import info.isaksson.erland.recordnames.model.annotations.RecordNamespace;\n" +
                "@RecordNamespace(\"shared\")\n" +
                "public class Pair<A, B> { }\n";
        String order = "package com.acme.orders;\n" +
                "import com.acme.model.Pair;\n" +
                "import java.util.List;\n" +
                "import java.util.Map;\n" +
                "public class Order<T> {\n" +
                "  Pair<Integer, String> line;\n" +
                "  List<Pair<Long, int[]>> history;\n" +
                "  Map.Entry<String, ? extends Number> entry;\n" +
                "  Pair<T, Item> generic;\n" +
                "  static List<String> CACHE;\n" +
                "  String plain;\n" +
                "  public static class Item { }\n" +
                "}\n";

        SourceNamingModel model = namer.extractFromStrings(Map.of("Pair.java", pair, "Order.java", order));

        assertEquals(List.of("entry", "generic", "history", "line"),
                model.genericUsages.stream().map(u -> u.member).collect(Collectors.toList()));

        GenericUsage line = model.usage("com.acme.orders.Order", "line").orElseThrow();
        assertEquals("com.acme.model", line.descriptor.ownerPath);
        assertEquals("shared.Pair__Integer_String", line.resolved.fullName, "declaration overrides apply to usages");

        GenericUsage history = model.usage("com.acme.orders.Order", "history").orElseThrow();
        assertEquals("java.util.List__Pair", history.resolved.fullName);
        assertEquals("Pair__Long_Array", NameResolver.genericName(history.descriptor.typeArguments.get(0)));

        GenericUsage entry = model.usage("com.acme.orders.Order", "entry").orElseThrow();
        assertEquals("java.util.Map", entry.descriptor.ownerPath);
        assertEquals("Entry__String_Number", entry.resolved.name);

        GenericUsage generic = model.usage("com.acme.orders.Order", "generic").orElseThrow();
        assertEquals(TypeDescriptor.unscoped("T"), generic.descriptor.typeArguments.get(0));
        assertEquals(TypeDescriptor.of("com.acme.orders.Order", "Item"), generic.descriptor.typeArguments.get(1));
        assertEquals("shared.Pair__T_Item", generic.resolved.fullName);
    }

    @Test
    void collectsParseErrorsAndContinues(@TempDir Path root) throws Exception {
        Path good = root.resolve("p/Good.java");
        Path bad = root.resolve("p/Bad.java");
        Files.createDirectories(good.getParent());
        Files.writeString(good, "package p; public class Good { }", StandardCharsets.UTF_8);
        Files.writeString(bad, "package p; public class Bad { void broken( }", StandardCharsets.UTF_8);

        SourceNamingModel model = namer.extract(root, List.of(bad, good));

        assertEquals(1, model.parseErrors.size());
        assertTrue(model.parseErrors.get(0).startsWith("p/Bad.java: parse error"));
        assertEquals("p.Good", model.declarations.get(0).resolved.fullName);
        assertEquals("p/Good.java", model.declarations.get(0).sourcePath);
    }

    @Test
    void defaultPackageTypesHaveNoNamespace() {
        SourceNamingModel model = namer.extractFromStrings(Map.of("Top.java", "class Top { class Nested { } }"));

        assertEquals("Top", model.declaration("Top").orElseThrow().resolved.fullName);
        assertEquals("Top.Nested", model.declaration("Top.Nested").orElseThrow().resolved.fullName);
    }
}
