package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.application.port.in.RefactorGrammarUseCase;
import com.vidnyan.grammarian.application.port.out.GrammarFileWriter;
import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteResult;
import com.vidnyan.grammarian.domain.rewrite.AddRuleRequest;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import com.vidnyan.grammarian.domain.rewrite.MovePosition;
import com.vidnyan.grammarian.domain.rewrite.RewriteResult;
import com.vidnyan.grammarian.domain.rewrite.SortOptions;
import com.vidnyan.grammarian.domain.rewrite.SortStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Set;

/**
 * Refactoring entry point. Each call logs its outcome; the rewriter does the work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarRefactoringService implements RefactorGrammarUseCase {

    private final GrammarRewriter rewriter;
    private final GrammarFileWriter fileWriter;

    @Override
    public RewriteResult addRule(String source, AddRuleRequest request) {
        return logged("add " + request.name(), rewriter.addRule(source, request));
    }

    @Override
    public RewriteResult removeRule(String source, String ruleName) {
        return logged("remove " + ruleName, rewriter.removeRule(source, ruleName));
    }

    @Override
    public RewriteResult updateRule(String source, String ruleName, String newBody) {
        return logged("update " + ruleName, rewriter.updateRule(source, ruleName, newBody));
    }

    @Override
    public RewriteResult renameRule(String source, String oldName, String newName) {
        return logged("rename " + oldName, rewriter.renameRule(source, oldName, newName));
    }

    @Override
    public RewriteResult inlineRule(String source, String ruleName, boolean forceParentheses, boolean dryRun) {
        return logged("inline " + ruleName, rewriter.inlineRule(source, ruleName, forceParentheses, dryRun));
    }

    @Override
    public RewriteResult sortRules(String source, SortStrategy strategy, SortOptions options) {
        return logged("sort " + strategy, rewriter.sortRules(source, strategy, options));
    }

    @Override
    public RewriteResult moveRule(String source, String ruleName, String anchor, MovePosition position) {
        return logged("move " + ruleName, rewriter.moveRule(source, ruleName, anchor, position));
    }

    @Override
    public RewriteResult mergeRules(String source, String first, String second, String newName) {
        return logged("merge " + first + "+" + second, rewriter.mergeRules(source, first, second, newName));
    }

    @Override
    public RewriteResult extractFragment(String source, String fragmentName, String pattern) {
        return logged("extract " + fragmentName, rewriter.extractFragment(source, fragmentName, pattern));
    }

    @Override
    public RewriteResult addMode(String source, String modeName) {
        return logged("add mode " + modeName, rewriter.addMode(source, modeName));
    }

    @Override
    public RewriteResult fixSuspiciousQuantifiers(String source, Set<String> ruleNames, boolean dryRun) {
        return logged("fix quantifiers", rewriter.fixSuspiciousQuantifiers(source, ruleNames, dryRun));
    }

    @Override
    public WriteResult save(Path file, RewriteResult result) {
        if (!result.isSuccess()) {
            log.warn("Not writing {}: rewrite failed ({})", file, result.message());
            return WriteResult.refused(file, 0, 0, "Rewrite failed: " + result.message());
        }
        WriteResult written = fileWriter.write(file, result.content());
        log.info("Write {}: {} ({})", file, written.status(), written.message());
        return written;
    }

    private RewriteResult logged(String operation, RewriteResult result) {
        if (result.isSuccess()) {
            log.info("Refactoring '{}' succeeded: {}", operation, result.message());
        } else {
            log.info("Refactoring '{}' failed: {}", operation, result.message());
        }
        return result;
    }
}
