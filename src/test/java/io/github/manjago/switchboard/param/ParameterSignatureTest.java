package io.github.manjago.switchboard.param;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.manjago.switchboard.param.Parameter.*;
import static org.junit.jupiter.api.Assertions.*;

class ParameterSignatureTest {
    
    @Test
    @DisplayName("Required, optional, variadic in order is valid")
    void validOrder() {
        ParameterSignature signature = ParameterSignature.of(
                required("a"), required("b"), optional("c", "x"), optional("d", null), variadic("rest"));
        
        assertEquals(List.of("a", "b"), signature.required().stream().map(Parameter::name).toList());
        assertEquals(List.of("c", "d"), signature.optional().stream().map(Parameter::name).toList());
        assertEquals("rest", signature.variadic().name());
        assertEquals("<a> <b> [<c>] [<d>] [<rest>] ...", signature.usage());
    }
    
    @Test
    @DisplayName("Required after optional fails construction")
    void requiredAfterOptional() {
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.of(optional("a", "x"), required("b")));
    }
    
    @Test
    @DisplayName("Two variadic slots fail construction")
    void twoVariadics() {
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.of(variadic("a"), variadic("b")));
    }
    
    @Test
    @DisplayName("Variadic not last fails construction")
    void variadicNotLast() {
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.of(variadic("a"), optional("b", "x")));
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.of(required("a"), variadic("b"), required("c")));
    }
    
    @Test
    @DisplayName("Duplicate names fail construction")
    void duplicateNames() {
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.of(required("a"), optional("a", "x")));
    }
    
    @Test
    @DisplayName("Builder produces the same checks")
    void builder() {
        assertThrows(ConfigurationException.class,
                () -> ParameterSignature.builder().optional("a", "x").required("b").build());
        assertTrue(ParameterSignature.builder().build().isEmpty());
    }
    
    @Test
    @DisplayName("Only optional parameters carry defaults")
    void defaultsOnlyOnOptional() {
        assertThrows(ConfigurationException.class,
                () -> new Parameter("a", Kind.REQUIRED, "x"));
    }
}
