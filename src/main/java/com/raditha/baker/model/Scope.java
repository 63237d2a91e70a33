package com.raditha.baker.model;

/**
 * A lexical scope whose direct statements are analysed on their own.
 *
 * @param kind   Scope kind
 * @param start  Index of the scope opener token (open tag or {@code {})
 * @param end    Index of the last token belonging to the scope
 * @param parent Enclosing scope, null for the file scope
 */
public record Scope(
        ScopeKind kind,
        int start,
        int end,
        Scope parent) {

    public Scope {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (end < start) {
            throw new IllegalArgumentException(
                    String.format("Scope end %d is before its start %d", end, start));
        }
        if (kind == ScopeKind.FILE && parent != null) {
            throw new IllegalArgumentException("A file scope cannot have a parent");
        }
    }

    /**
     * Create the root scope of a unit.
     */
    public static Scope file(int start, int end) {
        return new Scope(ScopeKind.FILE, start, end, null);
    }

    /**
     * Create a scope nested inside this one.
     */
    public Scope nested(ScopeKind kind, int start, int end) {
        return new Scope(kind, start, end, this);
    }

    /**
     * Nesting depth, 0 for the file scope.
     */
    public int depth() {
        int depth = 0;
        for (Scope s = parent; s != null; s = s.parent()) {
            depth++;
        }
        return depth;
    }
}
