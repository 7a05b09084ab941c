package org.nullmask.io;

import org.nullmask.model.Dataset;

import java.io.IOException;
import java.nio.file.Path;

public interface DatasetReader {

    /**
     * @throws IOException                                   if the file cannot be read or parsed
     * @throws org.nullmask.model.SchemaMismatchException if the content has no columns or uneven rows
     */
    Dataset read(Path path) throws IOException;
}
