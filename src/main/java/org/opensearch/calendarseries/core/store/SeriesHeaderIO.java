/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.core.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.calendar.DimensionName;
import org.opensearch.calendarseries.core.utils.Constants;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the fixed-size header of a series file.
 *
 * <p>Layout, {@link Constants.Store#HEADER_LENGTH} bytes in total:</p>
 * <ul>
 *   <li>Lucene codec header: magic, codec name {@link Constants.Store#CODEC_NAME}, format version</li>
 *   <li>dimension bitmask, one byte, bit {@code n} set for the dimension of ordinal {@code n}</li>
 *   <li>start year, little-endian int</li>
 *   <li>year count, little-endian int</li>
 *   <li>value width in bytes, one byte</li>
 *   <li>unit, a vInt byte length and UTF-8 bytes; absent before {@link Constants.Store#VERSION_UNIT}</li>
 *   <li>zero padding</li>
 * </ul>
 */
public class SeriesHeaderIO {

    private static final Logger logger = LogManager.getLogger(SeriesHeaderIO.class);

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private SeriesHeaderIO() {
        // Utility class
    }

    /**
     * Encode metadata into a header block.
     *
     * @param metadata the series metadata
     * @return exactly {@link Constants.Store#HEADER_LENGTH} bytes
     * @throws IOException if encoding fails
     */
    public static byte[] encode(SeriesMetadata metadata) throws IOException {
        ByteBuffersDataOutput output = new ByteBuffersDataOutput();
        CodecUtil.writeHeader(output, Constants.Store.CODEC_NAME, Constants.Store.VERSION_CURRENT);
        output.writeByte(dimensionMask(metadata.dimensions()));
        output.writeInt(metadata.startYear());
        output.writeInt(metadata.yearCount());
        output.writeByte((byte) metadata.valueWidth());
        output.writeString(metadata.unit());

        byte[] encoded = output.toArrayCopy();
        if (encoded.length > Constants.Store.HEADER_LENGTH) {
            throw new IllegalStateException("Encoded header takes " + encoded.length + " bytes, limit is " + Constants.Store.HEADER_LENGTH);
        }
        byte[] header = new byte[Constants.Store.HEADER_LENGTH];
        System.arraycopy(encoded, 0, header, 0, encoded.length);
        return header;
    }

    /**
     * Decode metadata from a header block.
     *
     * @param header the header bytes
     * @param resourceDescription file name used in error messages
     * @return the decoded metadata
     * @throws CorruptIndexException if the magic, codec name or fields are invalid
     * @throws org.apache.lucene.index.IndexFormatTooNewException if the format version is unknown
     * @throws IOException if reading fails
     */
    public static SeriesMetadata decode(byte[] header, String resourceDescription) throws IOException {
        if (header.length < Constants.Store.HEADER_LENGTH) {
            throw new CorruptIndexException("Truncated header: " + header.length + " bytes", resourceDescription);
        }
        ByteArrayDataInput input = new ByteArrayDataInput(header);
        int version = CodecUtil.checkHeader(input, Constants.Store.CODEC_NAME, Constants.Store.VERSION_1, Constants.Store.VERSION_CURRENT);
        logger.debug("Reading series header version {} from {}", version, resourceDescription);

        byte mask = input.readByte();
        int startYear = input.readInt();
        int yearCount = input.readInt();
        int valueWidth = input.readByte();
        String unit = version >= Constants.Store.VERSION_UNIT ? readUnit(input, resourceDescription) : "";

        List<DimensionName> dimensions = dimensionsFromMask(mask, resourceDescription);
        try {
            return new SeriesMetadata(dimensions, startYear, yearCount, valueWidth, unit);
        } catch (IllegalArgumentException e) {
            throw new CorruptIndexException("Invalid series metadata: " + e.getMessage(), resourceDescription, e);
        }
    }

    /**
     * Write the header of a series at the start of a channel.
     *
     * @param channel the channel to write to
     * @param metadata the series metadata
     * @throws IOException if writing fails
     */
    public static void writeHeader(FileChannel channel, SeriesMetadata metadata) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(encode(metadata));
        long position = 0;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    /**
     * Read the header of a series from the start of a channel.
     *
     * @param channel the channel to read from
     * @param resourceDescription file name used in error messages
     * @return the decoded metadata
     * @throws IOException if reading fails or the header is invalid
     */
    public static SeriesMetadata readHeader(FileChannel channel, String resourceDescription) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Constants.Store.HEADER_LENGTH);
        long position = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new CorruptIndexException(
                    "Truncated header",
                    resourceDescription,
                    new EOFException("Expected " + Constants.Store.HEADER_LENGTH + " bytes, got " + position)
                );
            }
            position += read;
        }
        return decode(buffer.array(), resourceDescription);
    }

    private static String readUnit(ByteArrayDataInput input, String resourceDescription) throws IOException {
        int length = input.readVInt();
        if (length < 0 || length > Constants.Store.MAX_UNIT_BYTES) {
            throw new CorruptIndexException("Invalid unit length: " + length, resourceDescription);
        }
        byte[] bytes = new byte[length];
        input.readBytes(bytes, 0, length);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static byte dimensionMask(List<DimensionName> dimensions) {
        int mask = 0;
        for (DimensionName dimension : dimensions) {
            mask |= 1 << dimension.ordinal();
        }
        return (byte) mask;
    }

    static List<DimensionName> dimensionsFromMask(byte mask, String resourceDescription) throws CorruptIndexException {
        int bits = mask & 0xFF;
        List<DimensionName> dimensions = new ArrayList<>();
        for (DimensionName dimension : DimensionName.values()) {
            if ((bits & (1 << dimension.ordinal())) != 0) {
                dimensions.add(dimension);
                bits &= ~(1 << dimension.ordinal());
            }
        }
        if (bits != 0) {
            throw new CorruptIndexException("Unknown dimension bits in mask: 0x" + Integer.toHexString(mask & 0xFF), resourceDescription);
        }
        return dimensions;
    }
}
