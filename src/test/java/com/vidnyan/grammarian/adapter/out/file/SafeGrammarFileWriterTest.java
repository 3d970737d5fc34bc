package com.vidnyan.grammarian.adapter.out.file;

import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteResult;
import com.vidnyan.grammarian.application.port.out.GrammarFileWriter.WriteStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SafeGrammarFileWriterTest {

    @TempDir
    Path tempDir;

    private final SafeGrammarFileWriter writer = new SafeGrammarFileWriter();

    private static String lines(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("r").append(i).append(" : A ;\n");
        }
        return sb.toString();
    }

    @Test
    void write_ShouldRefuseContentThatDropsMostLines() throws IOException {
        // Arrange
        Path file = tempDir.resolve("Big.g4");
        Files.writeString(file, lines(20));

        // Act
        WriteResult result = writer.write(file, lines(5));

        // Assert
        assertEquals(WriteStatus.REFUSED, result.status());
        assertEquals(20, result.oldLineCount());
        assertEquals(5, result.newLineCount());
        assertEquals(lines(20), Files.readString(file));
    }

    @Test
    void write_ShouldAllowModerateShrink() throws IOException {
        // Arrange
        Path file = tempDir.resolve("Big.g4");
        Files.writeString(file, lines(20));

        // Act
        WriteResult result = writer.write(file, lines(15));

        // Assert
        assertEquals(WriteStatus.WRITTEN, result.status());
        assertEquals(lines(15), Files.readString(file));
    }

    @Test
    void write_ShouldNotGuardSmallFiles() throws IOException {
        // Arrange
        Path file = tempDir.resolve("Small.g4");
        Files.writeString(file, lines(8));

        // Act
        WriteResult result = writer.write(file, lines(1));

        // Assert
        assertTrue(result.isWritten());
    }

    @Test
    void write_ShouldCreateMissingDirectoriesAndReportUnchanged() throws IOException {
        // Arrange
        Path file = tempDir.resolve("nested/dir/New.g4");

        // Act
        WriteResult first = writer.write(file, lines(3));
        WriteResult second = writer.write(file, lines(3));

        // Assert
        assertEquals(WriteStatus.WRITTEN, first.status());
        assertEquals(WriteStatus.UNCHANGED, second.status());
        assertTrue(Files.exists(file));
    }

    @Test
    void lineCount_ShouldNotCountTrailingNewline() {
        assertEquals(0, SafeGrammarFileWriter.lineCount(""));
        assertEquals(2, SafeGrammarFileWriter.lineCount("a\nb\n"));
        assertEquals(2, SafeGrammarFileWriter.lineCount("a\nb"));
    }
}
