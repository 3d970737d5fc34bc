package com.vidnyan.grammarian.domain.format;

import com.vidnyan.grammarian.domain.model.FormattingStyle;
import com.vidnyan.grammarian.domain.model.FormattingStyle.Placement;
import com.vidnyan.grammarian.domain.scan.LineIndex;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.scan.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Learns the layout conventions of a grammar file from its first rules.
 */
@Slf4j
public class FormattingInferencer {

    public static final int DEFAULT_SAMPLE_SIZE = 50;

    // share of samples one placement needs before it counts as the file's convention
    private static final double PLACEMENT_MAJORITY = 0.75;

    private final int sampleSize;

    public FormattingInferencer() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public FormattingInferencer(int sampleSize) {
        this.sampleSize = sampleSize > 0 ? sampleSize : DEFAULT_SAMPLE_SIZE;
    }

    /**
     * Infer the style of a scanned file. Files without rules get {@link FormattingStyle#defaults()}
     * with the file's own line separator.
     */
    public FormattingStyle infer(ScanResult scan) {
        String source = scan.source();
        String separator = source.contains("\r\n") ? "\r\n" : "\n";
        List<RuleSpan> sample = scan.rules().stream()
                .filter(RuleSpan::hasColon)
                .limit(sampleSize)
                .toList();
        if (sample.isEmpty()) {
            FormattingStyle defaults = FormattingStyle.defaults();
            return new FormattingStyle(defaults.colonPlacement(), defaults.semicolonPlacement(),
                    defaults.spaceBeforeColon(), defaults.indent(), defaults.blankLinesBetweenRules(), separator);
        }

        LineIndex lines = scan.lines();
        int colonSameLine = 0;
        int colonNewLine = 0;
        int spaceBefore = 0;
        int noSpaceBefore = 0;
        int semiSameLine = 0;
        int semiNewLine = 0;
        Map<String, Integer> indents = new HashMap<>();

        for (RuleSpan rule : sample) {
            int colonLine = lines.lineOf(rule.colonOffset());
            if (colonLine == rule.nameLine()) {
                colonSameLine++;
                if (rule.colonOffset() > 0 && Character.isWhitespace(source.charAt(rule.colonOffset() - 1))) {
                    spaceBefore++;
                } else {
                    noSpaceBefore++;
                }
            } else {
                colonNewLine++;
            }

            if (rule.terminated() && rule.endLine() > rule.nameLine()) {
                int semi = rule.semicolonOffset();
                String beforeSemi = source.substring(lines.lineStart(lines.lineOf(semi)), semi);
                if (beforeSemi.isBlank()) {
                    semiNewLine++;
                } else {
                    semiSameLine++;
                }
            }

            for (int line = rule.nameLine() + 1; line <= rule.endLine(); line++) {
                String text = lines.line(source, line);
                if (text.isBlank()) {
                    continue;
                }
                String indent = leadingWhitespace(text);
                if (!indent.isEmpty()) {
                    indents.merge(indent, 1, Integer::sum);
                }
            }
        }

        String indent = indents.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().length()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(FormattingStyle.defaults().indent());

        FormattingStyle style = new FormattingStyle(
                placement(colonSameLine, colonNewLine),
                placement(semiSameLine, semiNewLine),
                spaceBefore >= noSpaceBefore,
                indent,
                blankLinesBetweenRules(scan, sample),
                separator
        );
        log.debug("Inferred formatting from {} rules: {}", sample.size(), style);
        return style;
    }

    /**
     * Blank lines count as the convention when more than half of the adjacent rule pairs
     * are separated by one.
     */
    private boolean blankLinesBetweenRules(ScanResult scan, List<RuleSpan> sample) {
        int pairs = 0;
        int separated = 0;
        for (int i = 1; i < sample.size(); i++) {
            RuleSpan previous = sample.get(i - 1);
            RuleSpan current = sample.get(i);
            if (current.startLine() <= previous.endLine()) {
                continue;
            }
            pairs++;
            for (int line = previous.endLine() + 1; line < current.startLine(); line++) {
                if (scan.lines().isBlank(scan.source(), line)) {
                    separated++;
                    break;
                }
            }
        }
        return pairs == 0 ? FormattingStyle.defaults().blankLinesBetweenRules() : separated * 2 > pairs;
    }

    private static Placement placement(int sameLine, int newLine) {
        int total = sameLine + newLine;
        if (total == 0) {
            return Placement.SAME_LINE;
        }
        if (sameLine >= total * PLACEMENT_MAJORITY) {
            return Placement.SAME_LINE;
        }
        if (newLine >= total * PLACEMENT_MAJORITY) {
            return Placement.NEW_LINE;
        }
        return Placement.MIXED;
    }

    static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }
}
