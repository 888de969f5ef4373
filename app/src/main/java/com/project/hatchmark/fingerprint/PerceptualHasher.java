package com.project.hatchmark.fingerprint;

import com.project.hatchmark.core.DecodeException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * DCT perceptual hash.
 *
 * <ol>
 *   <li>Resample to a {@code N×N} grid with an area-averaging (box) filter.</li>
 *   <li>Luminance per cell: {@code 0.299·R + 0.587·G + 0.114·B}.</li>
 *   <li>Separable 2-D DCT with the shared cosine basis.</li>
 *   <li>Keep the top-left {@code M×M} block; the median is taken over its {@code M·M−1} AC coefficients.</li>
 *   <li>Row-major bits: DC is always 0, every other bit is 1 iff its coefficient exceeds the median.</li>
 * </ol>
 *
 * Stateless and safe for concurrent use.
 */
public class PerceptualHasher {

    public static final int HASH_SIZE = 8;

    private final DctBasis basis;
    private final int hashSize;

    public PerceptualHasher() {
        this(DctBasis.standard(), HASH_SIZE);
    }

    public PerceptualHasher(DctBasis basis, int hashSize) {
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
        if (hashSize <= 1 || hashSize > basis.size() || (hashSize * hashSize) % 4 != 0) {
            throw new IllegalArgumentException("invalid hash size " + hashSize + " for basis " + basis.size());
        }
        this.hashSize = hashSize;
    }

    /**
     * Fingerprint encoded image bytes (any format ImageIO can read).
     *
     * @throws DecodeException if the bytes are not a readable image
     */
    public Fingerprint fingerprint(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new DecodeException("image data is empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new DecodeException("Unsupported or corrupt image data (" + encoded.length + " bytes)");
        }
        return fingerprint(image);
    }

    public Fingerprint fingerprint(Path file) {
        try {
            return fingerprint(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new DecodeException("Failed to read image file " + file + ": " + e.getMessage(), e);
        }
    }

    public Fingerprint fingerprint(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new DecodeException("image has no pixels");
        }
        double[][] luminance = luminanceGrid(image, basis.size());
        double[][] coefficients = basis.transform2d(luminance);
        return encode(coefficients);
    }

    Fingerprint encode(double[][] coefficients) {
        double[] ac = new double[hashSize * hashSize - 1];
        int i = 0;
        for (int v = 0; v < hashSize; v++) {
            for (int u = 0; u < hashSize; u++) {
                if (u == 0 && v == 0) {
                    continue;
                }
                ac[i++] = coefficients[v][u];
            }
        }
        double[] sorted = ac.clone();
        Arrays.sort(sorted);
        double median = sorted[sorted.length / 2];

        boolean[] bits = new boolean[hashSize * hashSize];
        for (int v = 0; v < hashSize; v++) {
            for (int u = 0; u < hashSize; u++) {
                bits[v * hashSize + u] = !(u == 0 && v == 0) && coefficients[v][u] > median;
            }
        }
        return Fingerprint.fromBits(bits);
    }

    /**
     * Resample to {@code size×size} and convert to luminance.
     */
    static double[][] luminanceGrid(BufferedImage image, int size) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);

        double[][] grid = new double[size][size];
        if (width == size && height == size) {
            for (int y = 0; y < size; y++) {
                for (int x = 0; x < size; x++) {
                    int p = argb[y * width + x];
                    grid[y][x] = luminance((p >> 16) & 0xff, (p >> 8) & 0xff, p & 0xff);
                }
            }
            return grid;
        }

        double scaleX = (double) width / size;
        double scaleY = (double) height / size;
        for (int oy = 0; oy < size; oy++) {
            double y0 = oy * scaleY;
            double y1 = y0 + scaleY;
            for (int ox = 0; ox < size; ox++) {
                double x0 = ox * scaleX;
                double x1 = x0 + scaleX;
                double r = 0;
                double g = 0;
                double b = 0;
                double area = 0;
                int yEnd = Math.min(height, (int) Math.ceil(y1));
                int xEnd = Math.min(width, (int) Math.ceil(x1));
                for (int iy = (int) Math.floor(y0); iy < yEnd; iy++) {
                    double wy = Math.min(y1, iy + 1) - Math.max(y0, iy);
                    if (wy <= 0) {
                        continue;
                    }
                    for (int ix = (int) Math.floor(x0); ix < xEnd; ix++) {
                        double wx = Math.min(x1, ix + 1) - Math.max(x0, ix);
                        if (wx <= 0) {
                            continue;
                        }
                        double weight = wx * wy;
                        int p = argb[iy * width + ix];
                        r += ((p >> 16) & 0xff) * weight;
                        g += ((p >> 8) & 0xff) * weight;
                        b += (p & 0xff) * weight;
                        area += weight;
                    }
                }
                grid[oy][ox] = luminance(r / area, g / area, b / area);
            }
        }
        return grid;
    }

    static double luminance(double r, double g, double b) {
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }
}
