package com.raditha.baker.analysis;

import com.raditha.baker.fix.FixEmitter;
import com.raditha.baker.fix.MarkerCall;
import com.raditha.baker.model.Call;
import com.raditha.baker.model.Scope;
import com.raditha.baker.model.ScopeKind;
import com.raditha.baker.model.Token;
import com.raditha.baker.model.TokenKind;
import com.raditha.baker.model.Verdict;
import com.raditha.baker.model.VerdictKind;
import com.raditha.baker.tokenizer.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a unit scope by scope and classifies every call made directly in
 * each scope.
 * <p>
 * Nested routines and closures are walked recursively and never influence
 * the verdict of the scope that contains them: each scope executes, and is
 * cached, on its own. Once a scope is marked (by a fix or by an explicit
 * marker call) its own calls are no longer classified, but nested scopes
 * further down are still visited.
 */
public class ScopeWalker {

    private static final Logger logger = LoggerFactory.getLogger(ScopeWalker.class);

    /**
     * What a token means to the walker.
     */
    enum TokenRole {
        /** Keyword of a named routine */
        NESTED_ROUTINE,
        /** Keyword of an anonymous closure */
        NESTED_CLOSURE,
        /** {@code Cache::noCache} marker call */
        MARKER,
        /** Name of a global function call */
        CALL,
        OTHER
    }

    private final CallClassifier classifier;
    private final FixEmitter emitter;
    private int scopesVisited;
    private int alreadyMarkedCalls;
    private boolean malformed;

    public ScopeWalker(CallClassifier classifier, FixEmitter emitter) {
        this.classifier = classifier;
        this.emitter = emitter;
    }

    /**
     * Analyse the direct body of {@code scope} and recurse into nested scopes.
     *
     * @param stream    token stream of the unit
     * @param scope     scope to walk
     * @param namespace namespace of the unit, resolved on first fix
     * @return index of the last token of the scope, where the caller resumes
     * @throws NamespaceException if a fix is needed and no namespace can be resolved
     */
    public int walk(TokenStream stream, Scope scope, LazyNamespace namespace) {
        scopesVisited++;
        boolean marked = false;

        int i = scope.start() + 1;
        while (i <= scope.end()) {
            Token token = stream.get(i);
            switch (roleOf(stream, i)) {
                case NESTED_ROUTINE, NESTED_CLOSURE -> {
                    int opener = stream.scopeOpenerOf(i);
                    if (opener == TokenStream.NO_MATCH) {
                        // Declaration without a body.
                        i++;
                        continue;
                    }
                    int closer = stream.closerOf(opener);
                    if (closer == TokenStream.NO_MATCH || closer > scope.end()) {
                        return abandon(scope, opener, stream);
                    }
                    ScopeKind kind = token.kind() == TokenKind.CLOSURE ? ScopeKind.CLOSURE : ScopeKind.ROUTINE;
                    i = walk(stream, scope.nested(kind, opener, closer), namespace) + 1;
                }
                case MARKER -> {
                    if (!marked) {
                        logger.debug("{} scope at token {} is already marked", scope.kind(), scope.start());
                    }
                    marked = true;
                    i++;
                }
                case CALL -> {
                    int open = stream.nextNonEmpty(i + 1, stream.size());
                    int close = stream.closerOf(open);
                    if (close == TokenStream.NO_MATCH) {
                        return abandon(scope, open, stream);
                    }
                    Verdict verdict;
                    try {
                        verdict = classify(stream, new Call(i, open, close), marked);
                    } catch (MalformedScopeBoundaryException e) {
                        return abandon(scope, e.getOpenerIndex(), stream);
                    }
                    if (verdict.isDynamic()) {
                        marked = report(stream, scope, i, verdict, namespace);
                    } else if (verdict.kind() == VerdictKind.ALREADY_MARKED) {
                        alreadyMarkedCalls++;
                    }
                    // Arguments may contain further calls, e.g. date('Y', time()).
                    i++;
                }
                case OTHER -> {
                    if (token.kind().isOpener() && stream.closerOf(i) == TokenStream.NO_MATCH) {
                        return abandon(scope, i, stream);
                    }
                    i++;
                }
            }
        }
        return scope.end();
    }

    /**
     * Calls in a scope that is already marked are not looked up in the catalogue.
     */
    private Verdict classify(TokenStream stream, Call call, boolean marked) {
        return marked ? Verdict.alreadyMarked() : classifier.classify(stream, call);
    }

    /**
     * Hand a dynamic verdict to the emitter unless a fix would duplicate an
     * explicit marker written later in the same scope.
     *
     * @return true if the scope counts as marked from here on
     */
    private boolean report(TokenStream stream, Scope scope, int nameIndex, Verdict verdict,
            LazyNamespace namespace) {
        if (emitter.isFixMode() && hasDirectMarker(stream, scope, nameIndex + 1)) {
            logger.debug("Skipping fix for {}() on line {}: scope already contains a marker",
                    stream.get(nameIndex).text(), stream.get(nameIndex).line());
            return true;
        }
        return emitter.emit(verdict, stream.get(nameIndex), scope, namespace);
    }

    /**
     * Check the rest of a scope's direct body, skipping nested scopes, for a marker call.
     */
    private boolean hasDirectMarker(TokenStream stream, Scope scope, int from) {
        int i = from;
        while (i <= scope.end()) {
            TokenRole role = roleOf(stream, i);
            if (role == TokenRole.MARKER) {
                return true;
            }
            if (role == TokenRole.NESTED_ROUTINE || role == TokenRole.NESTED_CLOSURE) {
                int opener = stream.scopeOpenerOf(i);
                int closer = opener == TokenStream.NO_MATCH ? TokenStream.NO_MATCH : stream.closerOf(opener);
                if (closer != TokenStream.NO_MATCH) {
                    i = closer;
                }
            }
            i++;
        }
        return false;
    }

    /**
     * Stop scanning a scope whose boundaries cannot be trusted.
     */
    private int abandon(Scope scope, int openerIndex, TokenStream stream) {
        malformed = true;
        Token opener = stream.get(openerIndex);
        logger.warn("Unclosed '{}' on line {}; skipping the rest of the {} scope opened at token {}",
                opener.text(), opener.line(), scope.kind(), scope.start());
        return scope.end();
    }

    /**
     * Classify a token by what it means for the walk.
     */
    TokenRole roleOf(TokenStream stream, int index) {
        Token token = stream.get(index);
        return switch (token.kind()) {
            case FUNCTION -> TokenRole.NESTED_ROUTINE;
            case CLOSURE -> TokenRole.NESTED_CLOSURE;
            case IDENTIFIER -> identifierRole(stream, index);
            default -> TokenRole.OTHER;
        };
    }

    private TokenRole identifierRole(TokenStream stream, int index) {
        if (MarkerCall.isMarkerAt(stream, index)) {
            return TokenRole.MARKER;
        }
        int next = stream.nextNonEmpty(index + 1, stream.size());
        if (next == TokenStream.NO_MATCH || stream.get(next).kind() != TokenKind.OPEN_PARENTHESIS) {
            return TokenRole.OTHER;
        }
        return isGlobalFunctionName(stream, index) ? TokenRole.CALL : TokenRole.OTHER;
    }

    /**
     * Method calls, static calls, instantiations, declarations and names
     * qualified with a namespace never refer to a catalogued global function.
     */
    private boolean isGlobalFunctionName(TokenStream stream, int index) {
        int previous = stream.previousNonEmpty(index);
        if (previous == TokenStream.NO_MATCH) {
            return true;
        }
        TokenKind kind = stream.get(previous).kind();
        return switch (kind) {
            case OBJECT_OPERATOR, NULLSAFE_OBJECT_OPERATOR, DOUBLE_COLON, NEW, FUNCTION -> false;
            case OPERATOR -> {
                // function &name() returns by reference
                int keyword = stream.previousNonEmpty(previous);
                yield !(stream.get(previous).text().equals("&")
                        && keyword != TokenStream.NO_MATCH
                        && stream.get(keyword).kind() == TokenKind.FUNCTION);
            }
            case NS_SEPARATOR -> {
                int qualifier = stream.previousNonEmpty(previous);
                yield qualifier == TokenStream.NO_MATCH
                        || (stream.get(qualifier).kind() != TokenKind.IDENTIFIER
                                && stream.get(qualifier).kind() != TokenKind.NAMESPACE);
            }
            default -> true;
        };
    }

    public int getScopesVisited() {
        return scopesVisited;
    }

    /**
     * Number of calls skipped because their scope was already marked.
     */
    public int getAlreadyMarkedCalls() {
        return alreadyMarkedCalls;
    }

    public boolean isMalformed() {
        return malformed;
    }
}
