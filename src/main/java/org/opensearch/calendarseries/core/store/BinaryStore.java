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
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.util.IOUtils;
import org.opensearch.calendarseries.core.address.DimensionAddress;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.errors.AddressRangeException;
import org.opensearch.calendarseries.core.errors.SchemaMismatchException;
import org.opensearch.calendarseries.metrics.CalendarSeriesMetrics;
import org.opensearch.calendarseries.settings.CalendarSeriesSettings;
import org.opensearch.common.settings.Settings;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Owner of one open series file: a fixed-size header followed by a dense array of little-endian
 * doubles, one slot per address in odometer order.
 *
 * <p>A store is created by {@link #open} and released by {@link #close()}, which is idempotent;
 * use it with try-with-resources so the file is released on every exit path. Ownership can be
 * handed to a new instance with {@link #transfer()}, after which this instance is closed. A store
 * is not thread safe and takes no file lock: callers must not open the same file twice.</p>
 *
 * <p>Files are zero-filled on creation, so slots never written read back as {@code 0.0}. A run
 * write failing part way may leave some of its slots updated.</p>
 */
public final class BinaryStore implements Closeable {

    private static final Logger logger = LogManager.getLogger(BinaryStore.class);

    private final Path path;
    private final OpenMode mode;
    private final SeriesMetadata metadata;
    private final long totalSlots;
    private final boolean fsyncOnClose;
    private FileChannel channel;

    private BinaryStore(Path path, OpenMode mode, SeriesMetadata metadata, boolean fsyncOnClose, FileChannel channel) {
        this.path = path;
        this.mode = mode;
        this.metadata = metadata;
        this.totalSlots = SlotLayout.totalSlots(metadata);
        this.fsyncOnClose = fsyncOnClose;
        this.channel = channel;
    }

    /**
     * Open an existing series file, recovering its metadata from the header.
     *
     * @see #open(Path, OpenMode, SeriesMetadata, Settings)
     */
    public static BinaryStore open(Path path, OpenMode mode) throws IOException {
        return open(path, mode, null, Settings.EMPTY);
    }

    /**
     * @see #open(Path, OpenMode, SeriesMetadata, Settings)
     */
    public static BinaryStore open(Path path, OpenMode mode, SeriesMetadata metadata) throws IOException {
        return open(path, mode, metadata, Settings.EMPTY);
    }

    /**
     * Open or create a series file.
     *
     * @param path the series file
     * @param mode {@link OpenMode#CREATE} writes a new zero-filled file for {@code metadata};
     *             the other modes open an existing file
     * @param metadata required on create; optional otherwise, in which case it must equal the
     *                 metadata stored in the file
     * @param settings store settings
     * @return the open store
     * @throws java.nio.file.FileAlreadyExistsException on create when the file exists
     * @throws java.nio.file.NoSuchFileException when opening a missing file
     * @throws CorruptIndexException if the header or file size is invalid
     * @throws SchemaMismatchException if {@code metadata} differs from the stored metadata
     * @throws IOException on any other file system failure
     */
    public static BinaryStore open(Path path, OpenMode mode, SeriesMetadata metadata, Settings settings) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Open mode cannot be null");
        }
        boolean fsyncOnClose = CalendarSeriesSettings.STORE_FSYNC_ON_CLOSE.get(settings);
        if (mode == OpenMode.CREATE) {
            return create(path, metadata, fsyncOnClose, CalendarSeriesSettings.STORE_ZERO_FILL_BATCH_SLOTS.get(settings));
        }
        return openExisting(path, mode, metadata, fsyncOnClose);
    }

    private static BinaryStore create(Path path, SeriesMetadata metadata, boolean fsyncOnClose, int zeroFillBatchSlots)
        throws IOException {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata must be provided when creating a series file");
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
        boolean success = false;
        try {
            SeriesHeaderIO.writeHeader(channel, metadata);
            zeroFill(channel, metadata, zeroFillBatchSlots);
            success = true;
        } finally {
            if (success == false) {
                IOUtils.closeWhileHandlingException(channel);
                IOUtils.deleteFilesIgnoringExceptions(path);
            }
        }
        CalendarSeriesMetrics.incrementCounter(CalendarSeriesMetrics.STORE.storesCreated, 1);
        logger.info("Created series file {} with {} slots: {}", path, SlotLayout.totalSlots(metadata), metadata);
        return new BinaryStore(path, OpenMode.CREATE, metadata, fsyncOnClose, channel);
    }

    private static BinaryStore openExisting(Path path, OpenMode mode, SeriesMetadata expected, boolean fsyncOnClose) throws IOException {
        FileChannel channel = mode.isWritable()
            ? FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)
            : FileChannel.open(path, StandardOpenOption.READ);
        boolean success = false;
        try {
            SeriesMetadata stored = SeriesHeaderIO.readHeader(channel, path.toString());
            if (expected != null && expected.equals(stored) == false) {
                throw new SchemaMismatchException("Series file " + path + " holds " + stored + " but " + expected + " was expected");
            }
            long expectedLength = SlotLayout.fileLength(stored);
            long actualLength = channel.size();
            if (actualLength != expectedLength) {
                throw new CorruptIndexException(
                    "Series file is " + actualLength + " bytes, expected " + expectedLength + " for " + stored,
                    path.toString()
                );
            }
            BinaryStore store = new BinaryStore(path, mode, stored, fsyncOnClose, channel);
            success = true;
            logger.info("Opened series file {} in {} mode: {}", path, mode, stored);
            return store;
        } finally {
            if (success == false) {
                IOUtils.closeWhileHandlingException(channel);
            }
        }
    }

    private static void zeroFill(FileChannel channel, SeriesMetadata metadata, int batchSlots) throws IOException {
        long remaining = SlotLayout.totalSlots(metadata) * metadata.valueWidth();
        ByteBuffer zeros = ByteBuffer.allocate((int) Math.min(remaining, (long) batchSlots * metadata.valueWidth()));
        long position = SlotLayout.byteOffset(0, metadata);
        while (remaining > 0) {
            zeros.clear();
            zeros.limit((int) Math.min(remaining, zeros.capacity()));
            while (zeros.hasRemaining()) {
                int written = channel.write(zeros, position);
                position += written;
                remaining -= written;
            }
        }
    }

    /**
     * Zero-based slot of an address; constant time.
     *
     * @param address the address
     * @param metadata the series
     * @return the slot index
     * @throws AddressRangeException if the address is not valid for the series
     */
    public static long position(DimensionAddress address, SeriesMetadata metadata) {
        metadata.validate(address);
        return SlotLayout.position(address, metadata);
    }

    /**
     * Read the value stored at an address.
     *
     * @param address the address
     * @return the stored value, {@code 0.0} if never written
     * @throws AddressRangeException if the address is not valid for the series
     * @throws AlreadyClosedException if the store is closed
     * @throws IOException if reading fails
     */
    public double read(DimensionAddress address) throws IOException {
        ensureOpen();
        return readSlots(position(address, metadata), 1)[0];
    }

    /**
     * Read {@code count} consecutive values starting at an address, in odometer order.
     *
     * @throws AddressRangeException if the address is invalid or the run passes the series end
     */
    public double[] read(DimensionAddress address, int count) throws IOException {
        ensureOpen();
        long start = position(address, metadata);
        checkRun(address, start, count);
        return readSlots(start, count);
    }

    /**
     * Write a contiguous run of values, the first at {@code address} and each following one at
     * the next address in odometer order. A run may cross month, day or year boundaries.
     *
     * @param address the address of the first value
     * @param values the values to store
     * @throws AddressRangeException if the address is invalid or the run passes the series end
     * @throws AlreadyClosedException if the store is closed
     * @throws IllegalStateException if the store was opened read-only
     * @throws IOException if writing fails
     */
    public void write(DimensionAddress address, double... values) throws IOException {
        ensureOpen();
        ensureWritable();
        if (values == null) {
            throw new IllegalArgumentException("Values cannot be null");
        }
        long start = position(address, metadata);
        checkRun(address, start, values.length);
        writeSlots(start, values);
    }

    /**
     * Read raw slots in odometer order.
     *
     * @param firstSlot the first slot to read
     * @param count how many slots
     * @return the values
     */
    public double[] readSlots(long firstSlot, int count) throws IOException {
        ensureOpen();
        checkSlots(firstSlot, count);
        ByteBuffer buffer = ByteBuffer.allocate(count * metadata.valueWidth()).order(ByteOrder.LITTLE_ENDIAN);
        long offset = SlotLayout.byteOffset(firstSlot, metadata);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset);
            if (read < 0) {
                throw new EOFException("Unexpected end of series file " + path + " at byte " + offset);
            }
            offset += read;
        }
        buffer.flip();
        double[] values = new double[count];
        buffer.asDoubleBuffer().get(values);
        CalendarSeriesMetrics.incrementCounter(CalendarSeriesMetrics.STORE.slotsRead, count);
        return values;
    }

    /**
     * Write raw slots in odometer order.
     *
     * @param firstSlot the slot receiving {@code values[0]}
     * @param values the values
     */
    public void writeSlots(long firstSlot, double[] values) throws IOException {
        ensureOpen();
        ensureWritable();
        checkSlots(firstSlot, values.length);
        ByteBuffer buffer = ByteBuffer.allocate(values.length * metadata.valueWidth()).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asDoubleBuffer().put(values);
        long offset = SlotLayout.byteOffset(firstSlot, metadata);
        while (buffer.hasRemaining()) {
            offset += channel.write(buffer, offset);
        }
        CalendarSeriesMetrics.incrementCounter(CalendarSeriesMetrics.STORE.slotsWritten, values.length);
        logger.debug("Wrote {} slots at slot {} of {}", values.length, firstSlot, path);
    }

    /**
     * Force written values to disk.
     */
    public void flush() throws IOException {
        ensureOpen();
        if (mode.isWritable()) {
            channel.force(false);
        }
    }

    /**
     * Hand ownership of the file to a new store. This store is closed afterwards, without
     * flushing, and the returned one must be closed by the new owner.
     *
     * @return the store now owning the file
     */
    public BinaryStore transfer() {
        ensureOpen();
        BinaryStore moved = new BinaryStore(path, mode, metadata, fsyncOnClose, channel);
        channel = null;
        return moved;
    }

    /**
     * Flush and release the file. Closing a closed store does nothing.
     */
    @Override
    public void close() throws IOException {
        if (channel == null) {
            return;
        }
        FileChannel toClose = channel;
        channel = null;
        try {
            if (mode.isWritable() && fsyncOnClose) {
                toClose.force(true);
            }
        } finally {
            toClose.close();
        }
        logger.info("Closed series file {}", path);
    }

    public boolean isOpen() {
        return channel != null;
    }

    public SeriesMetadata metadata() {
        return metadata;
    }

    public Path path() {
        return path;
    }

    public OpenMode mode() {
        return mode;
    }

    /**
     * @return number of slots in the file
     */
    public long totalSlots() {
        return totalSlots;
    }

    private void ensureOpen() {
        if (channel == null) {
            throw new AlreadyClosedException("Series file " + path + " is closed");
        }
    }

    private void ensureWritable() {
        if (mode.isWritable() == false) {
            throw new IllegalStateException("Series file " + path + " was opened read-only");
        }
    }

    private void checkRun(DimensionAddress address, long start, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Run length must not be negative, got: " + count);
        }
        if (start + count > totalSlots) {
            throw new AddressRangeException(
                "Run of " + count + " values starting at " + address + " passes the series end: slot " + start + " of " + totalSlots
            );
        }
    }

    private void checkSlots(long firstSlot, int count) {
        if (firstSlot < 0 || count < 0 || firstSlot + count > totalSlots) {
            throw new IllegalArgumentException("Slots [" + firstSlot + ", " + (firstSlot + count) + ") outside [0, " + totalSlots + ")");
        }
    }

    @Override
    public String toString() {
        return "BinaryStore{path=" + path + ", mode=" + mode + ", open=" + isOpen() + ", metadata=" + metadata + "}";
    }
}
