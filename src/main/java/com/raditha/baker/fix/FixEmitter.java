package com.raditha.baker.fix;

import com.raditha.baker.analysis.LazyNamespace;
import com.raditha.baker.model.Diagnostic;
import com.raditha.baker.model.DiagnosticCode;
import com.raditha.baker.model.Scope;
import com.raditha.baker.model.Token;
import com.raditha.baker.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns dynamic verdicts into diagnostics and, in fix mode, into a marker
 * statement at the start of the offending scope.
 */
public class FixEmitter {

    private static final Logger logger = LoggerFactory.getLogger(FixEmitter.class);

    private final SourceFixer fixer;
    private final boolean fixMode;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int fixesApplied;

    /**
     * @param fixer   edit buffer of the unit being analysed
     * @param fixMode true to insert markers, false to only report
     */
    public FixEmitter(SourceFixer fixer, boolean fixMode) {
        if (fixMode && fixer == null) {
            throw new IllegalArgumentException("fix mode requires a fixer");
        }
        this.fixer = fixer;
        this.fixMode = fixMode;
    }

    /**
     * Report a dynamic call and, in fix mode, mark its scope.
     *
     * @param verdict   verdict of the call, must be dynamic
     * @param callName  name token of the call
     * @param scope     scope directly containing the call
     * @param namespace namespace of the unit; only resolved when a marker is written
     * @return true if a marker was inserted and the caller must stop scanning the scope
     * @throws com.raditha.baker.analysis.NamespaceException if the namespace cannot be resolved
     */
    public boolean emit(Verdict verdict, Token callName, Scope scope, LazyNamespace namespace) {
        if (!verdict.isDynamic()) {
            return false;
        }

        DiagnosticCode code = DiagnosticCode.of(verdict.kind());
        String message = formatMessage(verdict, callName.text());

        if (!fixMode) {
            diagnostics.add(new Diagnostic(code, message, callName.text(),
                    callName.line(), callName.column(), false));
            return false;
        }

        String marker = MarkerCall.statement(namespace.get());
        fixer.addContent(scope.start(), marker);
        fixesApplied++;
        diagnostics.add(new Diagnostic(code, message, callName.text(),
                callName.line(), callName.column(), true));
        logger.debug("Marked {} scope at token {} because of {}() on line {}",
                scope.kind(), scope.start(), callName.text(), callName.line());
        return true;
    }

    /**
     * Build the finding message with singular/plural wording matching the counts.
     */
    static String formatMessage(Verdict verdict, String name) {
        return switch (verdict.kind()) {
            case ALWAYS_DYNAMIC -> String.format(
                    "The %s() function makes the code block dynamic for all requests", name);
            case INSUFFICIENT_ARGUMENTS -> String.format(
                    "The %s() function with %d %s makes the code block dynamic for all requests; "
                            + "use at least %d %s to make it a static call",
                    name, verdict.actual(), arguments(verdict.actual()),
                    verdict.required(), arguments(verdict.required()));
            case UNKNOWN_ARGUMENT_COUNT -> String.format(
                    "The %s() function requires at least %d %s to make it a static call, "
                            + "but the call cannot be checked due to the use of argument unpacking",
                    name, verdict.required(), arguments(verdict.required()));
            case CLEAR, ALREADY_MARKED -> throw new IllegalArgumentException(
                    "Verdict " + verdict.kind() + " is not a finding");
        };
    }

    private static String arguments(int count) {
        return count == 1 ? "argument" : "arguments";
    }

    public boolean isFixMode() {
        return fixMode;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int getFixesApplied() {
        return fixesApplied;
    }
}
