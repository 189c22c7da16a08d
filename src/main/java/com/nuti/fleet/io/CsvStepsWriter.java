package com.nuti.fleet.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class CsvStepsWriter {

    public void write(Path path, int[] driving, int[] arrived, int[] waiting, int[] failed) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter w = Files.newBufferedWriter(path)) {
                w.write("step,driving,arrived,waiting,failed");
                w.newLine();
                for (int s = 0; s < driving.length; s++) {
                    w.write(Integer.toString(s));
                    w.write(',');
                    w.write(Integer.toString(driving[s]));
                    w.write(',');
                    w.write(Integer.toString(arrived[s]));
                    w.write(',');
                    w.write(Integer.toString(waiting[s]));
                    w.write(',');
                    w.write(Integer.toString(failed[s]));
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write steps CSV: " + path, e);
        }
    }
}
