package com.vidnyan.grammarian.domain.syntax;

import com.vidnyan.grammarian.domain.syntax.BodyToken.Type;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the identifiers of a rule body that refer to other rules.
 * Literals, sets and actions never produce references; labels, keywords and lexer command
 * arguments (other than {@code type(X)}) are skipped.
 */
public final class RuleReferences {

    public static final Set<String> KEYWORDS = Set.of(
            "grammar", "lexer", "parser", "import", "options", "tokens", "channels",
            "fragment", "returns", "throws", "locals", "catch", "finally", "mode", "EOF");

    private RuleReferences() {
    }

    /**
     * Reference tokens in body order.
     */
    public static List<BodyToken> sites(List<BodyToken> body) {
        List<BodyToken> sites = new ArrayList<>();
        int depth = 0;
        boolean inCommands = false;
        int commandDepth = 0;
        for (int i = 0; i < body.size(); i++) {
            BodyToken t = body.get(i);
            switch (t.type()) {
                case LPAREN -> depth++;
                case RPAREN -> {
                    depth--;
                    if (inCommands && depth < commandDepth) {
                        inCommands = false;
                    }
                }
                case PIPE -> {
                    if (inCommands && depth <= commandDepth) {
                        inCommands = false;
                    }
                }
                case ARROW -> {
                    inCommands = true;
                    commandDepth = depth;
                }
                case IDENT -> {
                    if (inCommands) {
                        if (i >= 2 && body.get(i - 1).is(Type.LPAREN) && body.get(i - 2).isIdent("type")) {
                            sites.add(t);
                        }
                    } else if (isReference(body, i)) {
                        sites.add(t);
                    }
                }
                default -> {
                }
            }
        }
        return sites;
    }

    /**
     * Distinct referenced names in first-use order.
     */
    public static List<String> names(List<BodyToken> body) {
        Set<String> names = new LinkedHashSet<>();
        for (BodyToken t : sites(body)) {
            names.add(t.text());
        }
        return List.copyOf(names);
    }

    private static boolean isReference(List<BodyToken> body, int i) {
        BodyToken t = body.get(i);
        if (KEYWORDS.contains(t.text())) {
            return false;
        }
        if (i + 1 < body.size()) {
            Type next = body.get(i + 1).type();
            if (next == Type.ASSIGN || next == Type.PLUS_ASSIGN) {
                return false;
            }
        }
        if (i > 0) {
            Type prev = body.get(i - 1).type();
            return prev != Type.HASH && prev != Type.AT;
        }
        return true;
    }
}
