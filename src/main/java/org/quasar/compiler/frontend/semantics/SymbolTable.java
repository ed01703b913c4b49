package org.quasar.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and symbols during semantic analysis.
 * Scopes form a stack; the bottom frame is the global scope and is never removed.
 * Lookups walk from the innermost frame outwards, so inner declarations shadow outer ones.
 * <p>
 * Prefer {@link #enterScope()} in a try-with-resources statement: the returned guard pops the frame
 * even when analysis is aborted by an error.
 */
public class SymbolTable {

    private final Deque<Map<String, Symbol>> frames = new ArrayDeque<>();

    /**
     * Constructs a new symbol table holding only the global scope.
     */
    public SymbolTable() {
        frames.push(new HashMap<>());
    }

    /**
     * Pushes a new scope.
     * @return A guard whose {@link ScopeGuard#close()} pops exactly this scope.
     */
    public ScopeGuard enterScope() {
        Map<String, Symbol> frame = new HashMap<>();
        frames.push(frame);
        return new ScopeGuard(frame);
    }

    /**
     * Pops the innermost scope. The global scope is never popped.
     */
    public void exitScope() {
        if (frames.size() > 1) {
            frames.pop();
        }
    }

    /**
     * Defines a symbol in the innermost scope.
     * @param symbol The symbol to define.
     * @return {@code false} if the innermost scope already holds a symbol of that name. Outer scopes are not consulted.
     */
    public boolean define(Symbol symbol) {
        Map<String, Symbol> frame = frames.peek();
        if (frame.containsKey(symbol.name())) {
            return false;
        }
        frame.put(symbol.name(), symbol);
        return true;
    }

    /**
     * Resolves a name, searching from the innermost scope outwards.
     * @param name The name to resolve.
     * @return The nearest symbol with that name.
     */
    public Optional<Symbol> lookup(String name) {
        for (Map<String, Symbol> frame : frames) {
            Symbol symbol = frame.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a name in the innermost scope only.
     * @param name The name to resolve.
     * @return The symbol, if declared in the innermost scope.
     */
    public Optional<Symbol> lookupCurrentScope(String name) {
        return Optional.ofNullable(frames.peek().get(name));
    }

    /**
     * @return The number of frames on the stack, 1 when only the global scope is open.
     */
    public int depth() {
        return frames.size();
    }

    /**
     * Closes the scope it was created for. Closing twice, or after the scope was already
     * popped by {@link #exitScope()}, has no effect.
     */
    public final class ScopeGuard implements AutoCloseable {
        private final Map<String, Symbol> frame;
        private boolean closed;

        private ScopeGuard(Map<String, Symbol> frame) {
            this.frame = frame;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (frames.stream().noneMatch(open -> open == frame)) {
                return;
            }
            // Also drop frames left open above this one.
            while (frames.size() > 1) {
                Map<String, Symbol> popped = frames.pop();
                if (popped == frame) {
                    return;
                }
            }
        }
    }
}
