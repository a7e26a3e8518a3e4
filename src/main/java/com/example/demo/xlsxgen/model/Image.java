package com.example.demo.xlsxgen.model;

import com.example.demo.xlsxgen.exception.ParameterException;
import lombok.Getter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Image bytes for a worksheet or header/footer. Only the type and the pixel
 * size are read from the data; the bytes are stored unchanged.
 */
@Getter
public class Image {
    private final byte[] data;
    private final ImageType type;
    private final int width;
    private final int height;
    private final String digest;

    private Image(byte[] data, ImageType type, int width, int height) {
        this.data = data;
        this.type = type;
        this.width = width;
        this.height = height;
        this.digest = sha256(data);
    }

    public static Image fromPath(Path path) throws IOException {
        return fromBytes(Files.readAllBytes(path));
    }

    public static Image fromBytes(byte[] data) {
        byte[] copy = data.clone();
        if (isPng(copy)) {
            return new Image(copy, ImageType.PNG, readIntBigEndian(copy, 16), readIntBigEndian(copy, 20));
        }
        if (copy.length > 10 && copy[0] == 'G' && copy[1] == 'I' && copy[2] == 'F') {
            return new Image(copy, ImageType.GIF, readShortLittleEndian(copy, 6), readShortLittleEndian(copy, 8));
        }
        if (copy.length > 26 && copy[0] == 'B' && copy[1] == 'M') {
            return new Image(copy, ImageType.BMP, readIntLittleEndian(copy, 18), Math.abs(readIntLittleEndian(copy, 22)));
        }
        if (copy.length > 4 && (copy[0] & 0xFF) == 0xFF && (copy[1] & 0xFF) == 0xD8) {
            int[] size = jpegSize(copy);
            return new Image(copy, ImageType.JPEG, size[0], size[1]);
        }
        throw new ParameterException("Unsupported image format, expected PNG, JPEG, GIF or BMP data");
    }

    private static boolean isPng(byte[] data) {
        return data.length > 24 && (data[0] & 0xFF) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G';
    }

    // Walks the JPEG markers up to the first start-of-frame segment.
    private static int[] jpegSize(byte[] data) {
        int offset = 2;
        while (offset + 9 < data.length) {
            if ((data[offset] & 0xFF) != 0xFF) {
                offset++;
                continue;
            }
            int marker = data[offset + 1] & 0xFF;
            int length = ((data[offset + 2] & 0xFF) << 8) | (data[offset + 3] & 0xFF);
            boolean startOfFrame = marker >= 0xC0 && marker <= 0xCF
                    && marker != 0xC4 && marker != 0xC8 && marker != 0xCC;
            if (startOfFrame) {
                int height = ((data[offset + 5] & 0xFF) << 8) | (data[offset + 6] & 0xFF);
                int width = ((data[offset + 7] & 0xFF) << 8) | (data[offset + 8] & 0xFF);
                return new int[] {width, height};
            }
            offset += 2 + length;
        }
        throw new ParameterException("JPEG image has no frame header");
    }

    private static int readIntBigEndian(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 24) | ((data[offset + 1] & 0xFF) << 16)
                | ((data[offset + 2] & 0xFF) << 8) | (data[offset + 3] & 0xFF);
    }

    private static int readIntLittleEndian(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8)
                | ((data[offset + 2] & 0xFF) << 16) | ((data[offset + 3] & 0xFF) << 24);
    }

    private static int readShortLittleEndian(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    private static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
