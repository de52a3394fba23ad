package de.bsommerfeld.slideshow.crawler;

import de.bsommerfeld.slideshow.core.exception.MissingPrerequisiteException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the accounts file: one handle or profile URL per line, blank lines
 * and {@code #} comments skipped.
 */
public final class AccountsFile {

    private AccountsFile() {
    }

    /**
     * @throws MissingPrerequisiteException if the file does not exist
     */
    public static List<String> read(Path file) {
        if (file == null || !Files.isRegularFile(file))
            throw new MissingPrerequisiteException("Accounts file not found: " + file);

        List<String> accounts = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String entry = line.strip();
                if (entry.isEmpty() || entry.startsWith("#"))
                    continue;
                accounts.add(entry);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read accounts file " + file, e);
        }
        return accounts;
    }
}
