package au.org.ala.imagedate.util;

import au.org.ala.imagedate.metadata.CompositeTagLookup;
import au.org.ala.imagedate.metadata.ImageIOTagLookup;
import au.org.ala.imagedate.metadata.MetadataReaderTagLookup;
import au.org.ala.imagedate.metadata.PhotometricHintExtractor;
import au.org.ala.imagedate.metadata.TagLookup;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.AutoDetectParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Decodes the first image of a file with ImageIO and collects its tags from both the reader's metadata and the
 * metadata-extractor library.
 */
public class ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private final ImageReaderSelectionStrategy selectionStrategy;
    private final PhotometricHintExtractor hintExtractor = new PhotometricHintExtractor();

    public ImageDecoder() {
        this(DefaultImageReaderSelectionStrategy.INSTANCE);
    }

    public ImageDecoder(ImageReaderSelectionStrategy selectionStrategy) {
        this.selectionStrategy = selectionStrategy;
    }

    public DecodedImage decode(File file) throws DecodeFailureException {
        return decode(Files.asByteSource(file), file.getName());
    }

    public DecodedImage decode(ByteSource imageBytes, String filename) throws DecodeFailureException {
        String contentType = detectContentType(imageBytes, filename);
        log.debug("Decoding {} ({})", filename, contentType);

        BufferedImage image;
        IIOMetadata iioMetadata = null;
        try (InputStream is = imageBytes.openBufferedStream();
             ImageInputStream iis = ImageIO.createImageInputStream(is)) {
            if (iis == null) {
                throw new DecodeFailureException(filename, "no ImageInputStream could be created");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            ImageReader reader = selectionStrategy.selectImageReader(readers);
            if (reader == null) {
                throw new DecodeFailureException(filename, "no compatible ImageReader for content type " + contentType);
            }

            try {
                reader.setInput(iis, true, false); // metadata is needed for photometric and orientation tags
                try {
                    iioMetadata = reader.getImageMetadata(0);
                } catch (IOException | RuntimeException e) {
                    log.debug("Could not read image metadata of {} with {}", filename, reader.getClass().getName(), e);
                }
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to decode {}", filename, e);
            throw new DecodeFailureException(filename, String.valueOf(e.getMessage()), e);
        }

        if (image == null) {
            throw new DecodeFailureException(filename, "the reader returned no image");
        }
        TagLookup tags;
        RasterImage raster;
        try {
            tags = new CompositeTagLookup(new ImageIOTagLookup(iioMetadata), MetadataReaderTagLookup.read(imageBytes));
            raster = RasterImages.fromBufferedImage(image, hintExtractor.isWhiteIsZero(tags));
        } catch (RuntimeException e) {
            log.error("Failed to read the samples or tags of {}", filename, e);
            throw new DecodeFailureException(filename, String.valueOf(e.getMessage()), e);
        }
        log.debug("Decoded {} as {}", filename, raster);
        return new DecodedImage(filename, contentType, raster, tags);
    }

    /**
     * @return the media type Tika detects from the content and file name, {@code application/octet-stream} if unknown
     */
    public String detectContentType(ByteSource byteSource, String filename) {
        try (InputStream bis = byteSource.openBufferedStream()) {
            AutoDetectParser parser = new AutoDetectParser();
            Detector detector = parser.getDetector();

            Metadata md = new Metadata();
            if (filename != null) {
                md.add(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            }
            MediaType mediaType = detector.detect(bis, md);
            return mediaType.toString();
        } catch (IOException ex) {
            log.warn("Exception occurred detecting content type of {}", filename, ex);
        }
        return MediaType.OCTET_STREAM.toString();
    }
}
