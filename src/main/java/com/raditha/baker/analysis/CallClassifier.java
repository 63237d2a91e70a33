package com.raditha.baker.analysis;

import com.raditha.baker.config.DeterminismCatalogue;
import com.raditha.baker.config.DeterminismRule;
import com.raditha.baker.model.Call;
import com.raditha.baker.model.Verdict;
import com.raditha.baker.tokenizer.TokenStream;

import java.util.Optional;

/**
 * Decides whether a call site makes its scope non-deterministic.
 * The decision uses only the call's name and its syntactic argument list.
 */
public class CallClassifier {

    private final DeterminismCatalogue catalogue;
    private final ArgumentCounter argumentCounter;

    public CallClassifier(DeterminismCatalogue catalogue) {
        this(catalogue, new ArgumentCounter());
    }

    public CallClassifier(DeterminismCatalogue catalogue, ArgumentCounter argumentCounter) {
        if (catalogue == null) {
            throw new IllegalArgumentException("catalogue cannot be null");
        }
        this.catalogue = catalogue;
        this.argumentCounter = argumentCounter;
    }

    /**
     * Classify a call from its name and counted arguments.
     *
     * @param name      function name as written (case does not matter)
     * @param argCount  number of top-level arguments
     * @param hasUnpack true if the argument list uses top-level unpacking
     */
    public Verdict classify(String name, int argCount, boolean hasUnpack) {
        Optional<DeterminismRule> rule = catalogue.lookup(name);
        if (rule.isEmpty()) {
            return Verdict.clear();
        }
        if (rule.get().isAlwaysDynamic()) {
            return Verdict.alwaysDynamic();
        }

        int threshold = rule.get().threshold();
        if (hasUnpack) {
            return Verdict.unknownArgumentCount(threshold);
        }
        if (argCount >= threshold) {
            return Verdict.clear();
        }
        return Verdict.insufficientArguments(argCount, threshold);
    }

    /**
     * Classify a call site in a token stream. Arguments are only counted for
     * catalogued functions.
     *
     * @throws MalformedScopeBoundaryException if the argument list contains an unclosed group
     */
    public Verdict classify(TokenStream stream, Call call) {
        String name = stream.get(call.nameTokenIndex()).text();
        Optional<DeterminismRule> rule = catalogue.lookup(name);
        if (rule.isEmpty()) {
            return Verdict.clear();
        }

        ArgumentCount count = argumentCounter.count(stream, call.argListStart(), call.argListEnd());
        if (count.callableReference()) {
            return Verdict.clear();
        }
        return classify(name, count.count(), count.hasUnpack());
    }

    public DeterminismCatalogue getCatalogue() {
        return catalogue;
    }
}
