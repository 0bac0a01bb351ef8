package com.platform.scaffold.security;

import com.platform.scaffold.config.EnvResolver;

import java.util.Collection;
import java.util.Set;

/**
 * The set of accepted bearer tokens.
 * 
 * Populated once at startup from {@code API_KEYS} (comma-separated), falling back to
 * {@code API_TOKENS}. The set itself is immutable; the reference is only swapped by
 * {@link #override(Collection)}, which tests use to install a replacement and restore
 * the original on close. Production code never writes after startup, so readers need
 * no locking.
 */
public class TokenStore {
    
    public static final String TOKEN_SOURCE = "API_KEYS";
    public static final String LEGACY_TOKEN_SOURCE = "API_TOKENS";
    
    private volatile Set<String> tokens;
    
    public TokenStore(Collection<String> tokens) {
        this.tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
    }
    
    public static TokenStore fromEnvironment(EnvResolver env) {
        String source = env.isSet(TOKEN_SOURCE) ? TOKEN_SOURCE : LEGACY_TOKEN_SOURCE;
        return new TokenStore(env.resolveList(source));
    }
    
    public boolean isConfigured() {
        return !tokens.isEmpty();
    }
    
    public boolean contains(String token) {
        return token != null && tokens.contains(token);
    }
    
    public int size() {
        return tokens.size();
    }
    
    /**
     * Install {@code replacement} (null means no tokens) until the returned handle is closed.
     * Not for use while requests are being served.
     */
    public TemporaryTokens override(Collection<String> replacement) {
        Set<String> saved = tokens;
        tokens = replacement == null ? Set.of() : Set.copyOf(replacement);
        return new TemporaryTokens(saved);
    }
    
    /**
     * Restores the snapshot taken by {@link #override(Collection)}.
     */
    public final class TemporaryTokens implements AutoCloseable {
        
        private final Set<String> saved;
        
        private TemporaryTokens(Set<String> saved) {
            this.saved = saved;
        }
        
        @Override
        public void close() {
            tokens = saved;
        }
    }
}
