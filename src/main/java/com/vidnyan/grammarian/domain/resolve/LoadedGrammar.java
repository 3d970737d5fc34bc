package com.vidnyan.grammarian.domain.resolve;

import com.vidnyan.grammarian.domain.model.Grammar;

import java.nio.file.Path;

/**
 * One file taking part in a multi-file resolution.
 *
 * @param importedAs name under which the file was requested ({@code import} or {@code tokenVocab})
 */
public record LoadedGrammar(String importedAs, Path path, String source, Grammar grammar) {}
