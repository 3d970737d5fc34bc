package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.adapter.out.file.SafeGrammarFileWriter;
import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteResult;
import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteStatus;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import com.vidnyan.grammarian.domain.rewrite.RewriteResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GrammarRefactoringServiceTest {

    private static final String SOURCE = "grammar T;\n\nstart : value EOF ;\n\nvalue : ID ;\n\nID : [a-z]+ ;\n";

    @TempDir
    Path tempDir;

    private final GrammarRefactoringService service =
            new GrammarRefactoringService(new GrammarRewriter(), new SafeGrammarFileWriter());

    @Test
    void save_ShouldWriteSuccessfulRewrite() throws IOException {
        // Arrange
        Path file = tempDir.resolve("T.g4");
        Files.writeString(file, SOURCE);
        RewriteResult renamed = service.renameRule(SOURCE, "value", "item");

        // Act
        WriteResult written = service.save(file, renamed);

        // Assert
        assertEquals(WriteStatus.WRITTEN, written.status());
        assertEquals(SOURCE.replace("value", "item"), Files.readString(file));
    }

    @Test
    void save_ShouldNotWriteFailedRewrite() throws IOException {
        // Arrange
        Path file = tempDir.resolve("T.g4");
        Files.writeString(file, SOURCE);
        RewriteResult failed = service.removeRule(SOURCE, "missing");

        // Act
        WriteResult written = service.save(file, failed);

        // Assert
        assertFalse(failed.isSuccess());
        assertEquals(WriteStatus.REFUSED, written.status());
        assertTrue(written.message().startsWith("Rewrite failed"));
        assertEquals(SOURCE, Files.readString(file));
    }

    @Test
    void inlineRule_ShouldDelegateToRewriter() {
        // Act
        RewriteResult result = service.inlineRule(SOURCE, "value", false, false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertFalse(result.content().contains("value"));
    }

    @Test
    void fixSuspiciousQuantifiers_ShouldReportNothingToFixForCleanGrammar() {
        // Act
        RewriteResult result = service.fixSuspiciousQuantifiers(SOURCE, Set.of(), false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(SOURCE, result.content());
        assertEquals("Fixed 0 of 0 flagged rules", result.message());
    }
}
