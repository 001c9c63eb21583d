package io.github.manjago.switchboard.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, mutable sequence of the unconsumed command-line tokens.
 * 
 * One stream is created per invocation and handed from stage to stage.
 * Tokens are never reordered: a stage may only split a token into
 * several, insert, or remove (consume) tokens in place.
 */
public final class TokenStream {
    
    private final List<String> tokens;
    
    private TokenStream(List<String> tokens) {
        this.tokens = tokens;
    }
    
    /**
     * Create a stream over a copy of the given tokens.
     * 
     * @param tokens command-line tokens, program name excluded
     * @throws NullPointerException if any token is null
     */
    public static @NotNull TokenStream of(@NotNull Collection<String> tokens) {
        List<String> copy = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            copy.add(Objects.requireNonNull(token, "Null tokens not allowed"));
        }
        return new TokenStream(copy);
    }
    
    public static @NotNull TokenStream of(String... tokens) {
        return of(List.of(tokens));
    }
    
    // ========== Queries ==========
    
    public int size() {
        return tokens.size();
    }
    
    public boolean isEmpty() {
        return tokens.isEmpty();
    }
    
    public @NotNull String get(int index) {
        return tokens.get(index);
    }
    
    /**
     * @return the first unconsumed token, or null if the stream is exhausted
     */
    @Contract(pure = true)
    public @Nullable String peek() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }
    
    /**
     * @return immutable snapshot of the remaining tokens, in order
     */
    public @NotNull List<String> tokens() {
        return List.copyOf(tokens);
    }
    
    // ========== Mutation ==========
    
    /**
     * Consume the first token.
     * 
     * @throws IllegalStateException if the stream is exhausted
     */
    public @NotNull String pop() {
        if (tokens.isEmpty()) {
            throw new IllegalStateException("Token stream is exhausted");
        }
        return tokens.remove(0);
    }
    
    /**
     * Consume the token at the given position.
     */
    public @NotNull String remove(int index) {
        return tokens.remove(index);
    }
    
    public void insert(int index, @NotNull String token) {
        tokens.add(index, Objects.requireNonNull(token, "token"));
    }
    
    /**
     * Replace the token at {@code index} by {@code parts}, keeping their order.
     * 
     * @throws IllegalArgumentException if parts is empty
     */
    public void split(int index, @NotNull List<String> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Cannot split a token into nothing");
        }
        tokens.remove(index);
        tokens.addAll(index, parts);
    }
    
    @Override
    public String toString() {
        return "TokenStream" + tokens;
    }
}
