package com.vidnyan.grammarian.adapter.in.cli;

import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.adapter.out.check.GrammarStructureCheck;
import com.vidnyan.grammarian.adapter.out.file.FileSystemGrammarSourceRepository;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisRequest;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisResult;
import com.vidnyan.grammarian.application.service.GrammarAnalysisService;
import com.vidnyan.grammarian.application.service.GrammarResolutionService;
import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarCliRunnerTest {

    @TempDir
    Path tempDir;

    private static GrammarAnalysisService service() {
        GrammarModelBuilder builder = new GrammarModelBuilder();
        FileSystemGrammarSourceRepository repository = new FileSystemGrammarSourceRepository();
        GrammarResolutionService resolver = new GrammarResolutionService(repository, builder, new GrammarRewriter());
        return new GrammarAnalysisService(repository, resolver, List.of(new GrammarStructureCheck()), builder,
                new FormattingInferencer(), new GrammarianProperties());
    }

    @Test
    void reportOf_ShouldHandleGrammarWithoutDeclaration() {
        // Arrange
        AnalysisResult result = service().analyze(AnalysisRequest.forSource("start : ID ;\nID : [a-z]+ ;\n"));

        // Act
        GrammarCliRunner.CliReport report = GrammarCliRunner.reportOf(result);

        // Assert
        assertNull(report.kind());
        assertTrue(report.issues().stream().anyMatch(i -> i.type().equals("missing-grammar-declaration")));
    }

    @Test
    void reportOf_ShouldHandleUnreadableFile() {
        // Arrange
        AnalysisResult result = service().analyze(AnalysisRequest.forPath(tempDir.resolve("Missing.g4")));

        // Act
        GrammarCliRunner.CliReport report = GrammarCliRunner.reportOf(result);

        // Assert
        assertNull(report.kind());
        assertEquals("SAME_LINE", report.style().get("colonPlacement"));
        assertTrue(report.issues().stream().anyMatch(i -> i.type().equals("unreadable-grammar")));
    }
}
