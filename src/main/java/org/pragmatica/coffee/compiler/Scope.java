package org.pragmatica.coffee.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable lexical scope that tracks declared identifiers during compilation.
 * One scope exists per function literal; lookups walk up the parent chain while
 * declarations only ever touch the current level.
 *
 * <p>Temporary names come from a single generator shared by the whole scope chain,
 * so they are unique across the entire compilation.
 */
public final class Scope {
    private static final Logger log = LoggerFactory.getLogger(Scope.class);

    private final Optional<Scope> parent;
    private final Set<String> variables;
    private final TemporaryNames temporaries;

    private Scope(Optional<Scope> parent, TemporaryNames temporaries) {
        this.parent = parent;
        this.variables = new LinkedHashSet<>();
        this.temporaries = temporaries;
    }

    /**
     * Create a top-level scope with the default temporary prefix.
     */
    public static Scope root() {
        return root(CompilerConfig.DEFAULT.temporaryPrefix());
    }

    /**
     * Create a top-level scope minting temporaries with the given prefix.
     */
    public static Scope root(String temporaryPrefix) {
        return new Scope(Optional.empty(), new TemporaryNames(temporaryPrefix));
    }

    /**
     * Create a nested scope whose parent is this scope.
     */
    public Scope childScope() {
        return new Scope(Optional.of(this), temporaries);
    }

    public Optional<Scope> parent() {
        return parent;
    }

    // === Declarations ===

    /**
     * Check whether the name is declared at this level or any enclosing one.
     */
    public boolean declared(String name) {
        return variables.contains(name)
               || parent.map(scope -> scope.declared(name))
                        .orElse(false);
    }

    /**
     * Record the name as declared at this level. Idempotent.
     */
    public void declare(String name) {
        variables.add(name);
    }

    /**
     * Declare the name unless it is already visible.
     *
     * @return true if the name was visible before the call, false if it has just been declared
     */
    public boolean declareIfAbsent(String name) {
        if (declared(name)) {
            return true;
        }
        declare(name);
        return false;
    }

    /**
     * Names declared at this level, in declaration order.
     */
    public List<String> variables() {
        return List.copyOf(variables);
    }

    // === Temporaries ===

    /**
     * Keep the name away from minted temporaries, wherever in the program it is used.
     */
    public void reserve(String name) {
        temporaries.reserve(name);
    }

    /**
     * Mint a name never issued before in this compilation, neither visible as a declared name nor reserved.
     * The name is declared at this level.
     */
    public String freshTemporary() {
        var name = temporaries.current();
        while (declared(name) || temporaries.isReserved(name)) {
            name = temporaries.advance();
        }
        declare(name);
        temporaries.advance();
        log.trace("Minted temporary {}", name);
        return name;
    }

    /**
     * Generator of candidate names: prefix followed by a, b, ..., z, aa, ab, ...
     */
    private static final class TemporaryNames {
        private final String prefix;
        private final StringBuilder letters;
        private final Set<String> reserved;

        private TemporaryNames(String prefix) {
            this.prefix = prefix;
            this.letters = new StringBuilder("a");
            this.reserved = new HashSet<>();
        }

        void reserve(String name) {
            reserved.add(name);
        }

        boolean isReserved(String name) {
            return reserved.contains(name);
        }

        String current() {
            return prefix + letters;
        }

        String advance() {
            int i = letters.length() - 1;
            while (i >= 0 && letters.charAt(i) == 'z') {
                letters.setCharAt(i, 'a');
                i--;
            }
            if (i < 0) {
                letters.insert(0, 'a');
            } else {
                letters.setCharAt(i, (char) (letters.charAt(i) + 1));
            }
            return current();
        }
    }
}
