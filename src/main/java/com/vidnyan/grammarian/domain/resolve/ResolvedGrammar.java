package com.vidnyan.grammarian.domain.resolve;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;

import java.util.List;

/**
 * A main grammar, the files it pulls in and the merged model.
 *
 * @param files      main file first, then imports in load order
 * @param merged     rules of every file, first definition of a name winning
 * @param issues     resolution problems: circular, unresolved or unreadable imports
 */
public record ResolvedGrammar(List<LoadedGrammar> files, Grammar merged, List<Issue> issues) {

    public ResolvedGrammar {
        files = List.copyOf(files);
        issues = List.copyOf(issues);
    }

    public LoadedGrammar main() {
        return files.get(0);
    }

    public List<LoadedGrammar> imported() {
        return files.subList(1, files.size());
    }
}
