package com.imagemeta.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * The parsed chunk sequence of a PNG file, in file order, IHDR first and IEND last.
 * Bytes found after IEND are kept so they can be written back as they were.
 */
public final class PngChunkStream {

    private final List<PngChunk> chunks;
    private final byte[] trailer;

    public PngChunkStream(List<PngChunk> chunks, byte[] trailer) {
        this.chunks = new ArrayList<>(chunks);
        this.trailer = trailer != null ? trailer : new byte[0];
    }

    public List<PngChunk> getChunks() {
        return chunks;
    }

    public byte[] getTrailer() {
        return trailer;
    }

    public int indexOf(String type) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).getType().equals(type)) {
                return i;
            }
        }
        return -1;
    }
}
