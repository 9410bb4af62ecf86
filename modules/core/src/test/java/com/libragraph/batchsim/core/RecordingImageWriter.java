package com.libragraph.batchsim.core;

import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.util.image.PixelImage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Image writer that keeps what it was asked to write instead of touching disk.
 */
public class RecordingImageWriter implements ImageWriter {

    public enum Kind { SINGLE, MULTI, CUBE }

    public record Write(Kind kind, Path path, List<PixelImage> images) {
    }

    private final List<Write> writes = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void writeSingle(PixelImage image, Path path) {
        writes.add(new Write(Kind.SINGLE, path, List.of(image)));
    }

    @Override
    public void writeMultiExtension(List<PixelImage> images, Path path) {
        writes.add(new Write(Kind.MULTI, path, List.copyOf(images)));
    }

    @Override
    public void writeCube(List<PixelImage> images, Path path) {
        writes.add(new Write(Kind.CUBE, path, List.copyOf(images)));
    }

    public List<Write> writes() {
        synchronized (writes) {
            return List.copyOf(writes);
        }
    }

    public List<Write> writesTo(Path path) {
        List<Write> matching = new ArrayList<>();
        for (Write w : writes()) {
            if (w.path().equals(path)) matching.add(w);
        }
        return matching;
    }
}
