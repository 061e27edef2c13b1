package com.doseobjectives.converter.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Lists the constraint spreadsheets to convert in batch mode.
 */
public interface TemplateLocator {

    /**
     * @param directory the directory to scan
     * @return the files to convert, in a stable order
     * @throws IOException if the directory cannot be listed
     */
    List<Path> locate(Path directory) throws IOException;
}
