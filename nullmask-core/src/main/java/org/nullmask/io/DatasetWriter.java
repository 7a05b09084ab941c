package org.nullmask.io;

import org.nullmask.model.Dataset;

import java.io.IOException;
import java.nio.file.Path;

public interface DatasetWriter {

    /**
     * Writes the dataset, creating missing parent directories. The null marker is written as the
     * format's absent-value token.
     */
    void write(Dataset dataset, Path path) throws IOException;
}
