package info.isaksson.erland.recordnames.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeDescriptorTest {

    @Test
    void constructor_isNullSafe_andCopiesArguments() {
        List<TypeDescriptor> args = new ArrayList<>();
        args.add(TypeDescriptor.unscoped("T"));
        TypeDescriptor d = new TypeDescriptor("Box", null, args);
        args.add(TypeDescriptor.unscoped("U"));

        assertEquals("", d.ownerPath);
        assertEquals(1, d.typeArguments.size());
        assertThrows(UnsupportedOperationException.class, () -> d.typeArguments.add(TypeDescriptor.unscoped("X")));
        assertTrue(new TypeDescriptor("Plain", "p", null).typeArguments.isEmpty());
    }

    @Test
    void rejectsMissingShortName() {
        assertThrows(IllegalArgumentException.class, () -> new TypeDescriptor(null, "com.example", null));
        assertThrows(IllegalArgumentException.class, () -> new TypeDescriptor("", "com.example", null));
    }

    @Test
    void valueEqualityCoversAllFields() {
        TypeDescriptor a = TypeDescriptor.generic("p", "Box", TypeDescriptor.unscoped("T"));
        TypeDescriptor b = TypeDescriptor.generic("p", "Box", TypeDescriptor.unscoped("T"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, TypeDescriptor.generic("p", "Box", TypeDescriptor.unscoped("U")));
        assertNotEquals(a, TypeDescriptor.of("p", "Box"));
        assertEquals("p.Box<[T]>", a.toString());
    }
}
