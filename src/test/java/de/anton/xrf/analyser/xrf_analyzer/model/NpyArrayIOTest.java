package de.anton.xrf.analyser.xrf_analyzer.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NpyArrayIO} against the NumPy .npy v1.0 layout.
 */
class NpyArrayIOTest {

    @TempDir
    Path dir;

    @Test
    void writesAlignedLittleEndianFloat64Header() throws Exception {
        Path file = dir.resolve("10264_Fe.npy");
        NpyArrayIO.write(file, new double[][] {{1.5, 2.0, 0.0}, {4.0, 5.25, 6.0}});

        byte[] bytes = Files.readAllBytes(file);
        int headerLength = (bytes[8] & 0xff) | ((bytes[9] & 0xff) << 8);
        String header = new String(bytes, 10, headerLength, StandardCharsets.US_ASCII);

        assertThat(bytes[0]).isEqualTo((byte) 0x93);
        assertThat(new String(bytes, 1, 5, StandardCharsets.US_ASCII)).isEqualTo("NUMPY");
        assertThat(bytes[6]).isEqualTo((byte) 1);
        assertThat((10 + headerLength) % 64).isZero();
        assertThat(header).contains("'descr': '<f8'").contains("'fortran_order': False").contains("'shape': (2, 3)");
        assertThat(header).endsWith("\n");
        assertThat(bytes.length).isEqualTo(10 + headerLength + 6 * 8);
    }

    @Test
    void readReturnsWrittenValuesBitForBit() throws Exception {
        double[][] data = {{0.1, Double.MIN_VALUE, 1e300}, {-0.0, 42.0, 7.0 / 3.0}};
        Path file = dir.resolve("map.npy");

        NpyArrayIO.write(file, data);

        assertThat(NpyArrayIO.read(file)).isDeepEqualTo(data);
    }

    @Test
    void readsBigEndianIntegersInFortranOrder() throws Exception {
        String dict = "{'descr': '>i4', 'fortran_order': True, 'shape': (2, 2), }";
        StringBuilder header = new StringBuilder(dict);
        while ((10 + header.length() + 1) % 64 != 0) {
            header.append(' ');
        }
        header.append('\n');
        byte[] headerBytes = header.toString().getBytes(StandardCharsets.US_ASCII);
        ByteBuffer buffer = ByteBuffer.allocate(10 + headerBytes.length + 16);
        buffer.put(new byte[] {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0});
        buffer.order(ByteOrder.LITTLE_ENDIAN).putShort((short) headerBytes.length);
        buffer.put(headerBytes);
        buffer.order(ByteOrder.BIG_ENDIAN).putInt(1).putInt(3).putInt(2).putInt(4); // column-major
        Path file = dir.resolve("ints.npy");
        Files.write(file, buffer.array());

        assertThat(NpyArrayIO.read(file)).isDeepEqualTo(new double[][] {{1, 2}, {3, 4}});
    }

    @Test
    void rejectsFilesWithoutMagic() throws Exception {
        Path file = dir.resolve("junk.npy");
        Files.writeString(file, "definitely not numpy");

        assertThatThrownBy(() -> NpyArrayIO.read(file)).isInstanceOf(IOException.class).hasMessageContaining("magic");
    }

    @Test
    void rejectsTruncatedData() throws Exception {
        Path file = dir.resolve("short.npy");
        NpyArrayIO.write(file, new double[][] {{1, 2}, {3, 4}});
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length - 8));

        assertThatThrownBy(() -> NpyArrayIO.read(file)).isInstanceOf(IOException.class).hasMessageContaining("Truncated");
    }
}
