package configreader.expression;

import configreader.value.IntValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionRegistryTest {

    @Test
    void withDefaults_registersStandardFunctionsAndConstants() {
        ExpressionRegistry registry = ExpressionRegistry.withDefaults();

        for (String name : new String[]{"sin", "cos", "tan", "exp", "sqrt", "root", "sum", "int", "float", "bool", "str"}) {
            assertNotNull(registry.getFunction(name), name);
        }
        for (String name : new String[]{"pi", "Pi", "PI", "e", "E"}) {
            assertNotNull(registry.getConstant(name), name);
        }
    }

    @Test
    void empty_hasNothing() {
        ExpressionRegistry registry = ExpressionRegistry.empty();

        assertTrue(registry.getFunctions().isEmpty());
        assertNull(registry.getConstant("pi"));
    }

    @Test
    void freeze_rejectsLaterRegistration() {
        ExpressionRegistry registry = ExpressionRegistry.empty();
        registry.registerConstant("a", IntValue.of(1));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.registerConstant("b", IntValue.of(2)));
        assertThrows(IllegalStateException.class,
                () -> registry.registerFunction("f", (arguments, keywords) -> IntValue.of(0)));
    }

    @Test
    void copy_isIndependentAndMutable() {
        ExpressionRegistry original = ExpressionRegistry.withDefaults();
        original.freeze();

        ExpressionRegistry copy = original.copy();
        copy.registerConstant("c", IntValue.of(3));

        assertFalse(copy.isFrozen());
        assertEquals(IntValue.of(3), copy.getConstant("c"));
        assertNull(original.getConstant("c"));
    }

    @Test
    void register_validatesArguments() {
        ExpressionRegistry registry = ExpressionRegistry.empty();

        assertThrows(IllegalArgumentException.class, () -> registry.registerConstant("", IntValue.of(1)));
        assertThrows(NullPointerException.class, () -> registry.registerConstant("a", null));
    }
}
