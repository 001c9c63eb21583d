package io.github.manjago.switchboard.route;

import io.github.manjago.switchboard.TestRegistries;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.core.TokenStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRouterTest {
    
    private CommandRegistry registry;
    private Router router;
    
    @BeforeEach
    void setUp() {
        registry = TestRegistries.tool();
        router = new DefaultRouter();
    }
    
    private RouteResult.Resolved resolve(TokenStream stream) {
        RouteResult result = router.route(registry, stream);
        return assertInstanceOf(RouteResult.Resolved.class, result);
    }
    
    private RouteResult.RoutingFailure fail(TokenStream stream) {
        RouteResult result = router.route(registry, stream);
        return assertInstanceOf(RouteResult.RoutingFailure.class, result);
    }
    
    @Test
    @DisplayName("Top-level command is resolved and consumed")
    void topLevel() {
        TokenStream stream = TokenStream.of("build", "app", "-r");
        RouteResult.Resolved resolved = resolve(stream);
        
        assertEquals("build", resolved.path().command().name());
        assertTrue(resolved.path().groups().groups().isEmpty());
        assertEquals(List.of("app", "-r"), stream.tokens());
    }
    
    @Test
    @DisplayName("Nested command records the groups traversed")
    void nested() {
        TokenStream stream = TokenStream.of("test", "unit", "fast");
        RouteResult.Resolved resolved = resolve(stream);
        
        assertEquals("unit", resolved.path().command().name());
        assertEquals(List.of("test"), resolved.path().groups().names());
        assertEquals("tool test unit", resolved.path().invocation());
        assertEquals(List.of("fast"), stream.tokens());
    }
    
    @Test
    @DisplayName("Failure inside a group reports that group, not the root")
    void failureLocality() {
        TokenStream stream = TokenStream.of("test", "bogus");
        RouteResult.RoutingFailure failure = fail(stream);
        
        assertEquals(List.of("test"), failure.partialPath().names());
        assertEquals("bogus", failure.unmatchedToken());
        assertEquals(List.of("bogus"), stream.tokens());
    }
    
    @Test
    @DisplayName("Unknown top-level command fails at the root")
    void unknownAtRoot() {
        RouteResult.RoutingFailure failure = fail(TokenStream.of("deploy"));
        
        assertTrue(failure.partialPath().names().isEmpty());
        assertEquals("deploy", failure.unmatchedToken());
    }
    
    @Test
    @DisplayName("Exhausted stream fails without an unmatched token")
    void exhausted() {
        RouteResult.RoutingFailure empty = fail(TokenStream.of());
        assertTrue(empty.partialPath().names().isEmpty());
        assertNull(empty.unmatchedToken());
        
        RouteResult.RoutingFailure group = fail(TokenStream.of("test"));
        assertEquals(List.of("test"), group.partialPath().names());
        assertNull(group.unmatchedToken());
    }
    
    @ParameterizedTest
    @CsvSource({"-h, help", "-v, version"})
    @DisplayName("Alias routes like its target")
    void aliasIdempotence(String alias, String target) {
        TokenStream viaAlias = TokenStream.of(alias, "x");
        TokenStream direct = TokenStream.of(target, "x");
        
        RouteResult.Resolved a = resolve(viaAlias);
        RouteResult.Resolved b = resolve(direct);
        
        assertSame(b.path().command(), a.path().command());
        assertEquals(direct.tokens(), viaAlias.tokens());
    }
    
    @Test
    @DisplayName("User aliases apply at every level")
    void aliasInsideGroup() {
        registry = TestRegistries.toolBuilder().alias("u", "unit").build();
        
        RouteResult.Resolved resolved = resolve(TokenStream.of("test", "u"));
        assertEquals("unit", resolved.path().command().name());
    }
    
    @Test
    @DisplayName("Alias to a disabled built-in is a routing failure")
    void aliasToDisabledBuiltin() {
        registry = TestRegistries.toolBuilder().version(null).build();
        
        RouteResult.RoutingFailure failure = fail(TokenStream.of("-v"));
        assertEquals("-v", failure.unmatchedToken());
        assertTrue(failure.partialPath().names().isEmpty());
    }
    
    @Test
    @DisplayName("Matching is exact and case-sensitive")
    void exactMatch() {
        assertEquals("Build", fail(TokenStream.of("Build")).unmatchedToken());
        assertEquals("bui", fail(TokenStream.of("bui")).unmatchedToken());
    }
}
