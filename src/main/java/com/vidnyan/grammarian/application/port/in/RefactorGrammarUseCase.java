package com.vidnyan.grammarian.application.port.in;

import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteResult;
import com.vidnyan.grammarian.domain.rewrite.AddRuleRequest;
import com.vidnyan.grammarian.domain.rewrite.MovePosition;
import com.vidnyan.grammarian.domain.rewrite.RewriteResult;
import com.vidnyan.grammarian.domain.rewrite.SortOptions;
import com.vidnyan.grammarian.domain.rewrite.SortStrategy;

import java.nio.file.Path;
import java.util.Set;

/**
 * Text-preserving edits to a single grammar.
 * Every operation takes grammar text and returns new text; on failure the text is unchanged.
 */
public interface RefactorGrammarUseCase {

    RewriteResult addRule(String source, AddRuleRequest request);

    RewriteResult removeRule(String source, String ruleName);

    /**
     * Replace a rule's body, keeping everything else byte for byte.
     */
    RewriteResult updateRule(String source, String ruleName, String newBody);

    RewriteResult renameRule(String source, String oldName, String newName);

    /**
     * Replace references with the rule's body and delete the definition.
     */
    RewriteResult inlineRule(String source, String ruleName, boolean forceParentheses, boolean dryRun);

    RewriteResult sortRules(String source, SortStrategy strategy, SortOptions options);

    RewriteResult moveRule(String source, String ruleName, String anchor, MovePosition position);

    RewriteResult mergeRules(String source, String first, String second, String newName);

    RewriteResult extractFragment(String source, String fragmentName, String pattern);

    RewriteResult addMode(String source, String modeName);

    /**
     * Turn optional groups that end an alternative into zero-or-more groups in rules whose
     * quantifiers look wrong.
     */
    RewriteResult fixSuspiciousQuantifiers(String source, Set<String> ruleNames, boolean dryRun);

    /**
     * Write a successful rewrite back to a file through the write guard.
     * Failed rewrites are not written.
     */
    WriteResult save(Path file, RewriteResult result);
}
