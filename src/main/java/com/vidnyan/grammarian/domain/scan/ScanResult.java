package com.vidnyan.grammarian.domain.scan;

import com.vidnyan.grammarian.domain.model.GrammarImport;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.Issue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of the source scanner: the comment-free view of the text plus declaration spans.
 * {@code cleanSource} has exactly the length and line layout of {@code source}.
 */
public record ScanResult(
    String source,
    String cleanSource,
    LineIndex lines,
    String grammarName,
    GrammarKind grammarKind,
    int declarationLine,
    List<GrammarImport> imports,
    Map<String, String> options,
    List<String> declaredTokens,
    List<String> declaredChannels,
    List<RuleSpan> rules,
    List<ModeSpan> modes,
    List<Issue> issues,
    int headerEnd
) {

    public boolean hasDeclaration() {
        return grammarName != null;
    }

    public Optional<RuleSpan> findRule(String name) {
        return rules.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * Text of a span in the original source.
     */
    public String text(int start, int end) {
        return source.substring(start, end);
    }

    /**
     * Text of a span in the comment-free view.
     */
    public String cleanText(int start, int end) {
        return cleanSource.substring(start, end);
    }
}
