package com.mimecast.phishguard.image;

import com.mimecast.phishguard.http.ImageFetcher;
import org.apache.commons.codec.binary.Base64;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Image input decoder.
 *
 * <p>Exactly one strategy is tried, chosen by prefix:
 * <ul>
 *     <li><b>data:image</b> - base64 data URI.</li>
 *     <li><b>http</b> - remote URL downloaded through the {@link ImageFetcher}.</li>
 *     <li>anything else - local file path.</li>
 * </ul>
 */
public class ImageLoader {
    private static final Logger log = LogManager.getLogger(ImageLoader.class);

    private final ImageFetcher fetcher;

    /**
     * Constructs a new ImageLoader instance.
     *
     * @param fetcher ImageFetcher instance.
     */
    public ImageLoader(ImageFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Loads an image.
     *
     * @param imageData Data URI, URL or file path.
     * @return BufferedImage instance.
     * @throws IOException Unable to obtain or decode the image.
     */
    public BufferedImage load(String imageData) throws IOException {
        if (imageData == null || imageData.isBlank()) {
            throw new IOException("No image data");
        }

        String input = imageData.trim();
        if (input.startsWith("data:image")) {
            int comma = input.indexOf(',');
            if (comma < 0) {
                throw new IOException("Malformed data URI");
            }
            log.debug("Decoding data URI image");
            return decode(Base64.decodeBase64(input.substring(comma + 1)));
        }

        if (input.startsWith("http")) {
            log.debug("Fetching remote image");
            return decode(fetcher.fetch(input));
        }

        Path path = Paths.get(input);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + input);
        }
        log.debug("Reading image file {}", path);
        return decode(Files.readAllBytes(path));
    }

    /**
     * Decodes image bytes.
     *
     * @param bytes Encoded image.
     * @return BufferedImage instance.
     * @throws IOException Unsupported or corrupt image.
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Empty image");
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new IOException("Unsupported or corrupt image");
        }
        return image;
    }
}
