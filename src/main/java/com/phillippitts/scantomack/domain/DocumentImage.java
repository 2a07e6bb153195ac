package com.phillippitts.scantomack.domain;

import com.phillippitts.scantomack.exception.InvalidDocumentException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.DigestUtils;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;

/**
 * Encoded document image plus its identity and geometry.
 *
 * <p>The identity is the MD5 hex digest of the bytes, so two uploads of the same file share an
 * identity (used for request deduplication and caching). Width and height are read from the
 * image header; both are 0 when no installed ImageIO reader understands the bytes.
 *
 * <p>Equality is by identity only; the byte array is never compared element-wise.
 *
 * @param id     content digest
 * @param bytes  encoded image bytes (not copied; callers must not mutate)
 * @param format lowercase format name reported by ImageIO, or "unknown"
 * @param width  pixel width, 0 if unknown
 * @param height pixel height, 0 if unknown
 */
public record DocumentImage(String id, byte[] bytes, String format, int width, int height) {

    private static final Logger LOG = LogManager.getLogger(DocumentImage.class);

    public DocumentImage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bytes, "bytes");
        format = format == null ? "unknown" : format;
    }

    /**
     * Wraps raw bytes, computing identity and probing geometry.
     *
     * @throws InvalidDocumentException if bytes are null or empty
     */
    public static DocumentImage of(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidDocumentException("Document image is empty");
        }
        String id = DigestUtils.md5DigestAsHex(bytes);
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                return new DocumentImage(id, bytes, "unknown", 0, 0);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                return new DocumentImage(id, bytes, reader.getFormatName().toLowerCase(Locale.ROOT),
                        reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not read image header for {}: {}", id, e.toString());
            return new DocumentImage(id, bytes, "unknown", 0, 0);
        }
    }

    /**
     * @return true if a reader recognized the image and reported positive dimensions
     */
    public boolean hasGeometry() {
        return width > 0 && height > 0;
    }

    /**
     * Decodes the full raster, e.g. for native recognition.
     *
     * @throws InvalidDocumentException if the bytes cannot be decoded
     */
    public BufferedImage decode() {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new InvalidDocumentException(bytes.length, "unsupported or corrupt image format");
            }
            return image;
        } catch (IOException e) {
            throw new InvalidDocumentException(bytes.length, "image could not be decoded: " + e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DocumentImage other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentImage[id=" + id + ", format=" + format + ", size=" + bytes.length
                + "B, " + width + "x" + height + "]";
    }
}
