package io.github.manjago.switchboard.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenStreamTest {
    
    @Test
    @DisplayName("Stream copies its input")
    void copiesInput() {
        List<String> input = new ArrayList<>(List.of("a", "b"));
        TokenStream stream = TokenStream.of(input);
        input.add("c");
        
        assertEquals(List.of("a", "b"), stream.tokens());
    }
    
    @Test
    @DisplayName("Null tokens are rejected")
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> TokenStream.of(Arrays.asList("a", null)));
    }
    
    @Test
    @DisplayName("peek and pop consume from the head")
    void peekAndPop() {
        TokenStream stream = TokenStream.of("build", "app");
        
        assertEquals("build", stream.peek());
        assertEquals("build", stream.pop());
        assertEquals("app", stream.peek());
        assertEquals("app", stream.pop());
        assertNull(stream.peek());
        assertTrue(stream.isEmpty());
        assertThrows(IllegalStateException.class, stream::pop);
    }
    
    @Test
    @DisplayName("split replaces one token in place, keeping order")
    void splitKeepsOrder() {
        TokenStream stream = TokenStream.of("x", "-ab", "y");
        stream.split(1, List.of("-a", "-b"));
        
        assertEquals(List.of("x", "-a", "-b", "y"), stream.tokens());
    }
    
    @Test
    @DisplayName("split into nothing is not allowed")
    void splitIntoNothing() {
        TokenStream stream = TokenStream.of("x");
        assertThrows(IllegalArgumentException.class, () -> stream.split(0, List.of()));
    }
    
    @Test
    @DisplayName("insert and remove work at any position")
    void insertAndRemove() {
        TokenStream stream = TokenStream.of("a", "c");
        stream.insert(1, "b");
        assertEquals(List.of("a", "b", "c"), stream.tokens());
        
        assertEquals("b", stream.remove(1));
        assertEquals(List.of("a", "c"), stream.tokens());
        assertEquals(2, stream.size());
    }
    
    @Test
    @DisplayName("Snapshot is immutable")
    void snapshotImmutable() {
        TokenStream stream = TokenStream.of("a");
        assertThrows(UnsupportedOperationException.class, () -> stream.tokens().add("b"));
    }
}
