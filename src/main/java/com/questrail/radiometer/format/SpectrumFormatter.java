package com.questrail.radiometer.format;

import com.questrail.radiometer.model.AccelStats;
import com.questrail.radiometer.model.SpectrumHeader;
import com.questrail.radiometer.model.SpectrumRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Text shown alongside a spectrum: list entries, header values, plot titles
 * and export file names.
 *
 * <p>Timestamps are rendered in UTC. Decimal values are rounded half to even
 * and never depend on the host locale.</p>
 */
public final class SpectrumFormatter
{
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final String SEQUENCE_EXTENSION = ".spe";

    private SpectrumFormatter() {}

    /**
     * List entry for the record at 1-based {@code position}:
     * {@code 3-1700000000000-VIS-DIRECT}.
     */
    public static String listLabel(int position, SpectrumRecord record) {
        SpectrumHeader header = Objects.requireNonNull(record, "record").header();
        return position + "-" + header.timestamp()
                + "-" + header.spectrumType().radiometer().displayName()
                + "-" + header.spectrumType().optics().displayName();
    }

    /**
     * Acquisition time as {@code yyyy-MM-dd HH:mm:ss} in UTC.
     */
    public static String timestampText(SpectrumHeader header) {
        return TIMESTAMP.format(Objects.requireNonNull(header, "header").acquiredAt());
    }

    public static String temperatureText(SpectrumHeader header) {
        return twoDecimals(Objects.requireNonNull(header, "header").temperature());
    }

    /**
     * Plot title: {@code VIS DIRECT, 100ms, 23.50 °C}.
     */
    public static String plotTitle(SpectrumHeader header) {
        Objects.requireNonNull(header, "header");
        return header.spectrumType().radiometer().displayName()
                + " " + header.spectrumType().optics().displayName()
                + ", " + header.exposureTime() + "ms, "
                + temperatureText(header) + " °C";
    }

    /**
     * One accelerometer axis as {@code mean ±std} in g, two decimals.
     */
    public static String accelText(int rawMean, int rawStd) {
        return twoDecimals(AccelStats.toG(rawMean)) + " ±" + twoDecimals(AccelStats.toG(rawStd));
    }

    public static String accelXText(AccelStats stats) {
        return accelText(stats.meanX(), stats.stdX());
    }

    public static String accelYText(AccelStats stats) {
        return accelText(stats.meanY(), stats.stdY());
    }

    public static String accelZText(AccelStats stats) {
        return accelText(stats.meanZ(), stats.stdZ());
    }

    /**
     * Suggested PNG name when exporting the plot of the record at 1-based
     * {@code position}: {@code <measurement>_<sequence id>_<position>.png}.
     *
     * <p>The sequence id is the second {@code _}-separated token of the sequence
     * file name (e.g. {@code 0042} in {@code SEQ_0042_A.spe}). Names without one
     * contribute their whole base name.</p>
     *
     * @param measurement      name of the measurement directory holding the sequence
     * @param sequenceFileName sequence file name
     * @param position         1-based record position within the sequence
     */
    public static String exportFileName(String measurement, String sequenceFileName, int position) {
        Objects.requireNonNull(measurement, "measurement");
        Objects.requireNonNull(sequenceFileName, "sequenceFileName");

        String[] tokens = sequenceFileName.split("_");
        String sequenceId = (tokens.length > 1) ? tokens[1] : stripExtension(sequenceFileName);
        return measurement + "_" + sequenceId + "_" + position + ".png";
    }

    /**
     * Two decimals, ties to even on the exact binary value ({@code 21.125 -> 21.12}).
     */
    static String twoDecimals(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String stripExtension(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(SEQUENCE_EXTENSION)
                ? fileName.substring(0, fileName.length() - SEQUENCE_EXTENSION.length())
                : fileName;
    }
}
