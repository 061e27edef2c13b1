package com.doseobjectives.converter.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists {@code *.xlsx} and {@code *.csv} files directly inside a directory, sorted by name.
 * Excel lock files ({@code ~$name.xlsx}) are skipped.
 */
public class FileSystemTemplateLocator implements TemplateLocator {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemTemplateLocator.class);

    @Override
    public List<Path> locate(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(FileSystemTemplateLocator::isTemplate)
                    .sorted()
                    .collect(Collectors.toList());
            logger.info("Found {} template file(s) in {}.", files.size(), directory);
            return files;
        }
    }

    static boolean isTemplate(Path file) {
        String name = file.getFileName().toString();
        if (name.startsWith("~$")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xlsx") || lower.endsWith(".csv");
    }
}
