package de.mirkosertic.sheetwatch.baseline;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Locale;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Compression codecs a baseline artifact can be written with. The codec is identified by the
 * artifact's file extension, so a store can hold artifacts of several codecs at the same time.
 * <p>
 * The declaration order is the probe order used when loading.
 */
public enum BaselineCodec {

    GZIP("gzip", ".baseline.json.gz") {
        @Override
        public OutputStream encode(final OutputStream out) throws IOException {
            return new GZIPOutputStream(out, 64 * 1024);
        }

        @Override
        public InputStream decode(final InputStream in) throws IOException {
            return new GZIPInputStream(in, 64 * 1024);
        }
    },

    /** Raw zlib stream at best compression, used for archiving inactive baselines. */
    DEFLATE("deflate", ".baseline.json.deflate") {
        @Override
        public OutputStream encode(final OutputStream out) {
            final Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
            return new DeflaterOutputStream(out, deflater, 64 * 1024) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        deflater.end();
                    }
                }
            };
        }

        @Override
        public InputStream decode(final InputStream in) {
            final Inflater inflater = new Inflater();
            return new InflaterInputStream(in, inflater, 64 * 1024) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        inflater.end();
                    }
                }
            };
        }
    },

    PLAIN("plain", ".baseline.json") {
        @Override
        public OutputStream encode(final OutputStream out) {
            return out;
        }

        @Override
        public InputStream decode(final InputStream in) {
            return in;
        }
    };

    private final String codecName;
    private final String extension;

    BaselineCodec(final String codecName, final String extension) {
        this.codecName = codecName;
        this.extension = extension;
    }

    public abstract OutputStream encode(OutputStream out) throws IOException;

    public abstract InputStream decode(InputStream in) throws IOException;

    public String codecName() {
        return codecName;
    }

    public String extension() {
        return extension;
    }

    public String artifactName(final String fileKey) {
        return fileKey + extension;
    }

    public static List<BaselineCodec> probeOrder() {
        return List.of(values());
    }

    public static BaselineCodec byName(final String name) {
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final BaselineCodec codec : values()) {
            if (codec.codecName.equals(normalized)) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown baseline codec: " + name);
    }

    /**
     * Codec whose extension terminates the given artifact file name, or null for foreign files.
     * Longer extensions are checked first so ".baseline.json.gz" is not taken for ".baseline.json".
     */
    public static @Nullable BaselineCodec forArtifactName(final String artifactName) {
        BaselineCodec best = null;
        for (final BaselineCodec codec : values()) {
            if (artifactName.endsWith(codec.extension)
                    && (best == null || codec.extension.length() > best.extension.length())) {
                best = codec;
            }
        }
        return best;
    }
}
