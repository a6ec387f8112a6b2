package com.questrail.radiometer.calibration;

import com.questrail.radiometer.model.Radiometer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Builds a {@link CalibrationTable} from properties.
 *
 * <p>One entry per channel, coefficients comma separated, highest power first:</p>
 * <pre>
 *   calibration.VIS=1.2e-8, -8.0e-6, -1.07e-3, 2.69, 310.0
 * </pre>
 *
 * <p>Keys outside the {@value #KEY_PREFIX} namespace are ignored.</p>
 */
public final class CalibrationTableLoader
{
    public static final String KEY_PREFIX = "calibration.";

    private CalibrationTableLoader() {}

    /**
     * @throws IllegalArgumentException if a key names no known radiometer or a
     *         value is not five numeric coefficients
     */
    public static CalibrationTable fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        CalibrationTable.Builder builder = CalibrationTable.builder();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(KEY_PREFIX)) {
                continue;
            }
            String channel = key.substring(KEY_PREFIX.length()).trim();
            builder.withChannel(parseRadiometer(key, channel), parseCoefficients(key, properties.getProperty(key)));
        }
        return builder.build();
    }

    /**
     * Loads a properties file (UTF-8).
     */
    public static CalibrationTable fromPath(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return fromProperties(properties);
        }
    }

    /**
     * Loads a properties resource (UTF-8) from the classpath.
     *
     * @throws IllegalStateException if the resource does not exist or is malformed
     */
    public static CalibrationTable fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = CalibrationTableLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Calibration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return fromProperties(properties);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read calibration resource " + resource, e);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed calibration resource " + resource, e);
        }
    }

    private static Radiometer parseRadiometer(String key, String channel) {
        try {
            return Radiometer.valueOf(channel.toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown radiometer channel in key '" + key + "'", e);
        }
    }

    private static CalibrationPolynomial parseCoefficients(String key, String value) {
        String[] parts = value.split(",");
        double[] coefficients = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                coefficients[i] = Double.parseDouble(parts[i].trim());
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Coefficient " + i + " of '" + key + "' is not a number: '" + parts[i].trim() + "'", e);
            }
        }
        try {
            return CalibrationPolynomial.of(coefficients);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid coefficients for '" + key + "': " + e.getMessage(), e);
        }
    }
}
