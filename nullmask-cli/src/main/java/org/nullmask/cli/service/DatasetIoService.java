package org.nullmask.cli.service;

import org.nullmask.io.DatasetFormat;
import org.nullmask.model.Dataset;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service for reading and writing dataset files.
 * Picks the reader and writer from each file's extension.
 */
public class DatasetIoService {

    /**
     * Loads a dataset from a .csv or .json file.
     *
     * @param input the input file
     * @return the loaded dataset
     * @throws FileNotFoundException    if the file does not exist
     * @throws IllegalArgumentException if the extension is not supported
     * @throws IOException              if the file cannot be read
     */
    public Dataset load(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new FileNotFoundException("Input file not found: " + input);
        }
        return DatasetFormat.fromPath(input).reader().read(input);
    }

    /**
     * Writes a dataset in the format implied by the output file's extension.
     *
     * @param dataset the dataset to write
     * @param output  the output file
     * @throws IOException if the file cannot be written
     */
    public void save(Dataset dataset, Path output) throws IOException {
        DatasetFormat.fromPath(output).writer().write(dataset, output);
    }

    /**
     * Fails early on an unsupported output extension, before any work is done.
     *
     * @param output the output file
     * @throws IllegalArgumentException if the extension is not supported
     */
    public void checkWritable(Path output) {
        DatasetFormat.fromPath(output);
    }
}
