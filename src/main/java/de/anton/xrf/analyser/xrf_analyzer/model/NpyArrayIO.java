package de.anton.xrf.analyser.xrf_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes two-dimensional arrays in the NumPy {@code .npy} format (version 1.0).
 * Writes little-endian float64 in C order; reads float64 and 32/64-bit integers of either byte
 * order, in C or Fortran order.
 */
public final class NpyArrayIO {

    private static final Logger logger = LoggerFactory.getLogger(NpyArrayIO.class);

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int PREAMBLE_LENGTH = MAGIC.length + 2 + 2; // magic, version, header length
    private static final int ALIGNMENT = 64;
    private static final Pattern DESCR_PATTERN = Pattern.compile("'descr'\\s*:\\s*'([<>|=])([fi])(\\d)'");
    private static final Pattern FORTRAN_PATTERN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE_PATTERN = Pattern.compile("'shape'\\s*:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,?\\s*\\)");

    private NpyArrayIO() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    public static void write(Path file, double[][] data) throws IOException {
        Objects.requireNonNull(file, "Output file cannot be null.");
        if (data == null || data.length == 0 || data[0].length == 0) {
            throw new IllegalArgumentException("Array to write must have at least one row and one column.");
        }
        int rows = data.length;
        int cols = data[0].length;

        String dict = String.format("{'descr': '<f8', 'fortran_order': False, 'shape': (%d, %d), }", rows, cols);
        int unpadded = PREAMBLE_LENGTH + dict.length() + 1; // trailing newline
        int padding = (ALIGNMENT - unpadded % ALIGNMENT) % ALIGNMENT;
        StringBuilder header = new StringBuilder(dict);
        for (int i = 0; i < padding; i++) {
            header.append(' ');
        }
        header.append('\n');
        byte[] headerBytes = header.toString().getBytes(StandardCharsets.US_ASCII);

        ByteBuffer buffer = ByteBuffer.allocate(PREAMBLE_LENGTH + headerBytes.length + rows * cols * Double.BYTES)
                                      .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC).put((byte) 1).put((byte) 0).putShort((short) headerBytes.length).put(headerBytes);
        for (int r = 0; r < rows; r++) {
            if (data[r].length != cols) {
                throw new IllegalArgumentException("Array is not rectangular at row " + r + ".");
            }
            for (int c = 0; c < cols; c++) {
                buffer.putDouble(data[r][c]);
            }
        }

        try (OutputStream out = Files.newOutputStream(file)) {
            out.write(buffer.array());
        }
        logger.trace("Wrote {}x{} array to {}", rows, cols, file);
    }

    public static double[][] read(Path file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        byte[] bytes;
        try (InputStream in = Files.newInputStream(file)) {
            bytes = in.readAllBytes();
        }
        if (bytes.length < PREAMBLE_LENGTH) {
            throw new IOException("Not an .npy file (too short): " + file);
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (bytes[i] != MAGIC[i]) {
                throw new IOException("Not an .npy file (bad magic): " + file);
            }
        }
        int major = bytes[6];
        ByteBuffer preamble = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int headerLength;
        int dataOffset;
        if (major == 1) {
            headerLength = Short.toUnsignedInt(preamble.getShort(8));
            dataOffset = 10 + headerLength;
        } else if (major == 2 || major == 3) {
            headerLength = preamble.getInt(8);
            dataOffset = 12 + headerLength;
        } else {
            throw new IOException("Unsupported .npy version " + major + ": " + file);
        }
        if (headerLength < 0 || dataOffset > bytes.length) {
            throw new IOException("Truncated .npy header: " + file);
        }
        String header = new String(bytes, dataOffset - headerLength, headerLength, StandardCharsets.US_ASCII);

        Matcher descr = DESCR_PATTERN.matcher(header);
        Matcher fortran = FORTRAN_PATTERN.matcher(header);
        Matcher shape = SHAPE_PATTERN.matcher(header);
        if (!descr.find() || !fortran.find() || !shape.find()) {
            throw new IOException("Unsupported .npy header (expected a 2-D numeric array): " + header.trim());
        }
        ByteOrder order = ">".equals(descr.group(1)) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        char kind = descr.group(2).charAt(0);
        int itemSize = Integer.parseInt(descr.group(3));
        boolean fortranOrder = "True".equals(fortran.group(1));
        int rows = Integer.parseInt(shape.group(1));
        int cols = Integer.parseInt(shape.group(2));
        if ((kind == 'f' && itemSize != 8) || (kind == 'i' && itemSize != 4 && itemSize != 8)) {
            throw new IOException("Unsupported .npy dtype " + descr.group() + ": " + file);
        }
        long expected = (long) rows * cols * itemSize;
        if (bytes.length - dataOffset < expected) {
            throw new IOException("Truncated .npy data: expected " + expected + " bytes in " + file);
        }

        ByteBuffer data = ByteBuffer.wrap(bytes, dataOffset, bytes.length - dataOffset).slice().order(order);
        double[][] result = new double[rows][cols];
        for (int i = 0; i < rows * cols; i++) {
            double value;
            if (kind == 'f') {
                value = data.getDouble();
            } else if (itemSize == 8) {
                value = data.getLong();
            } else {
                value = data.getInt();
            }
            if (fortranOrder) {
                result[i % rows][i / rows] = value;
            } else {
                result[i / cols][i % cols] = value;
            }
        }
        return result;
    }
}
