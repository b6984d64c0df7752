/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.store;

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.IndexFormatTooNewException;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.calendar.DimensionName;
import org.opensearch.calendarseries.core.utils.Constants;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

import static org.opensearch.calendarseries.core.calendar.DimensionName.DAY;
import static org.opensearch.calendarseries.core.calendar.DimensionName.HOUR;
import static org.opensearch.calendarseries.core.calendar.DimensionName.MONTH;
import static org.opensearch.calendarseries.core.calendar.DimensionName.WEEK;
import static org.opensearch.calendarseries.core.calendar.DimensionName.YEAR;

public class SeriesHeaderIOTests extends OpenSearchTestCase {

    public void testEncodeAndDecodeAllDimensionSets() throws IOException {
        for (List<DimensionName> dimensions : SlotLayoutTests.ALL_DIMENSION_SETS) {
            SeriesMetadata metadata = new SeriesMetadata(dimensions, randomIntBetween(1, 9000), randomIntBetween(1, 999));
            byte[] header = SeriesHeaderIO.encode(metadata);
            assertEquals(Constants.Store.HEADER_LENGTH, header.length);
            assertEquals(metadata, SeriesHeaderIO.decode(header, "test"));
        }
    }

    public void testHeaderFieldsAreLittleEndian() throws IOException {
        SeriesMetadata metadata = SeriesMetadata.of(2023, 2, YEAR, MONTH, DAY, HOUR);
        byte[] header = SeriesHeaderIO.encode(metadata);
        int offset = CodecUtil.headerLength(Constants.Store.CODEC_NAME);

        assertEquals(0b11011, header[offset]);
        // 2023 = 0x07E7
        assertEquals((byte) 0xE7, header[offset + 1]);
        assertEquals((byte) 0x07, header[offset + 2]);
        assertEquals(0, header[offset + 3]);
        assertEquals(0, header[offset + 4]);
        assertEquals(2, header[offset + 5]);
        assertEquals(Double.BYTES, header[offset + 9]);
        for (int i = offset + 10; i < header.length; i++) {
            assertEquals("padding at " + i, 0, header[i]);
        }
    }

    public void testUnitFollowsValueWidth() throws IOException {
        SeriesMetadata metadata = SeriesMetadata.of(2023, 2, YEAR, MONTH).withUnit("m\u00B3/s");
        byte[] header = SeriesHeaderIO.encode(metadata);
        int offset = CodecUtil.headerLength(Constants.Store.CODEC_NAME);
        byte[] unit = "m\u00B3/s".getBytes(StandardCharsets.UTF_8);

        assertEquals(unit.length, header[offset + 10]);
        assertArrayEquals(unit, Arrays.copyOfRange(header, offset + 11, offset + 11 + unit.length));
        assertEquals(metadata, SeriesHeaderIO.decode(header, "test"));
    }

    public void testLongestUnitFitsInHeader() throws IOException {
        SeriesMetadata metadata = SeriesMetadata.of(2023, 2, YEAR, WEEK, DAY, HOUR).withUnit("u".repeat(Constants.Store.MAX_UNIT_BYTES));
        byte[] header = SeriesHeaderIO.encode(metadata);
        assertEquals(Constants.Store.HEADER_LENGTH, header.length);
        assertEquals(metadata, SeriesHeaderIO.decode(header, "test"));
    }

    public void testVersionOneHeaderHasNoUnit() throws IOException {
        ByteBuffersDataOutput output = new ByteBuffersDataOutput();
        CodecUtil.writeHeader(output, Constants.Store.CODEC_NAME, Constants.Store.VERSION_1);
        output.writeByte(SeriesHeaderIO.dimensionMask(List.of(YEAR, MONTH)));
        output.writeInt(2024);
        output.writeInt(1);
        output.writeByte((byte) Double.BYTES);
        byte[] header = new byte[Constants.Store.HEADER_LENGTH];
        byte[] written = output.toArrayCopy();
        System.arraycopy(written, 0, header, 0, written.length);
        // garbage where a later version keeps the unit
        Arrays.fill(header, written.length, header.length, (byte) 0x7F);

        SeriesMetadata decoded = SeriesHeaderIO.decode(header, "test");
        assertEquals(SeriesMetadata.of(2024, 1, YEAR, MONTH), decoded);
        assertEquals("", decoded.unit());
    }

    public void testCorruptUnitLength() throws IOException {
        byte[] header = SeriesHeaderIO.encode(SeriesMetadata.of(2024, 1, YEAR, MONTH));
        int offset = CodecUtil.headerLength(Constants.Store.CODEC_NAME);
        header[offset + 10] = (byte) (Constants.Store.MAX_UNIT_BYTES + 1);
        CorruptIndexException e = expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(header, "test"));
        assertTrue(e.getMessage(), e.getMessage().contains("unit length"));
    }

    public void testDimensionMask() throws IOException {
        byte mask = SeriesHeaderIO.dimensionMask(List.of(YEAR, WEEK, HOUR));
        assertEquals(List.of(YEAR, WEEK, HOUR), SeriesHeaderIO.dimensionsFromMask(mask, "test"));
        expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.dimensionsFromMask((byte) 0x40, "test"));
    }

    public void testCorruptMagic() throws IOException {
        byte[] header = SeriesHeaderIO.encode(SeriesMetadata.of(2024, 1, YEAR));
        header[0] ^= 0x01;
        expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(header, "test"));
    }

    public void testWrongCodecName() throws IOException {
        ByteBuffersDataOutput output = new ByteBuffersDataOutput();
        CodecUtil.writeHeader(output, "OtherCodec", Constants.Store.VERSION_CURRENT);
        byte[] header = new byte[Constants.Store.HEADER_LENGTH];
        byte[] written = output.toArrayCopy();
        System.arraycopy(written, 0, header, 0, written.length);
        expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(header, "test"));
    }

    public void testVersionTooNew() throws IOException {
        ByteBuffersDataOutput output = new ByteBuffersDataOutput();
        CodecUtil.writeHeader(output, Constants.Store.CODEC_NAME, Constants.Store.VERSION_CURRENT + 1);
        byte[] header = new byte[Constants.Store.HEADER_LENGTH];
        byte[] written = output.toArrayCopy();
        System.arraycopy(written, 0, header, 0, written.length);
        expectThrows(IndexFormatTooNewException.class, () -> SeriesHeaderIO.decode(header, "test"));
    }

    public void testInvalidMetadataIsCorruption() throws IOException {
        byte[] header = SeriesHeaderIO.encode(SeriesMetadata.of(2024, 1, YEAR, MONTH));
        int offset = CodecUtil.headerLength(Constants.Store.CODEC_NAME);
        // month and week together
        header[offset] = SeriesHeaderIO.dimensionMask(List.of(YEAR, MONTH, WEEK));
        CorruptIndexException e = expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(header, "test"));
        assertTrue(e.getMessage(), e.getMessage().contains("month"));

        byte[] zeroYears = SeriesHeaderIO.encode(SeriesMetadata.of(2024, 1, YEAR, MONTH));
        zeroYears[offset + 5] = 0;
        expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(zeroYears, "test"));
    }

    public void testTruncatedHeader() throws IOException {
        expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.decode(new byte[10], "test"));

        Path file = createTempDir().resolve("short.cseries");
        Files.write(file, new byte[] { 1, 2, 3 });
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            expectThrows(CorruptIndexException.class, () -> SeriesHeaderIO.readHeader(channel, file.toString()));
        }
    }

    public void testWriteAndReadThroughChannel() throws IOException {
        SeriesMetadata metadata = SeriesMetadata.of(2020, 3, YEAR, WEEK, DAY);
        Path file = createTempDir().resolve("header.cseries");
        try (
            FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE)
        ) {
            SeriesHeaderIO.writeHeader(channel, metadata);
            assertEquals(Constants.Store.HEADER_LENGTH, channel.size());
            assertEquals(metadata, SeriesHeaderIO.readHeader(channel, file.toString()));
        }
    }
}
