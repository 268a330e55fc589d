package au.org.ala.imagedate.dates;

import org.apache.commons.imaging.ImageFormat;
import org.apache.commons.imaging.ImageFormats;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffImageWriterLossless;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Stamps a date into the DateTime, DateTimeOriginal and DateTimeDigitized tags of an image file.
 * <p/>
 * JPEG and TIFF files are rewritten losslessly, keeping their other tags and their pixel data. Anything else, or a file
 * whose tags can't be rewritten, is decoded and saved again in its own format without metadata. Output always goes to a temporary file
 * next to the original which then replaces it.
 */
public class ImageDateWriter {

    private static final Logger log = LoggerFactory.getLogger(ImageDateWriter.class);

    /** The time of day is always noon. */
    public static final String DEFAULT_TAG_PATTERN = "yyyy:MM:dd 12:00:00";

    private final DateTimeFormatter tagFormatter;

    public ImageDateWriter() {
        this(DEFAULT_TAG_PATTERN);
    }

    public ImageDateWriter(String tagPattern) {
        this.tagFormatter = DateTimeFormatter.ofPattern(tagPattern, Locale.ROOT);
    }

    public String format(LocalDateTime date) {
        return tagFormatter.format(date);
    }

    public DateWriteResult write(File file, LocalDateTime date) {
        String dateStamp = format(date);

        String reason;
        ImageFormat format = guessFormat(file);
        if (format == ImageFormats.JPEG || format == ImageFormats.TIFF) {
            try {
                if (format == ImageFormats.JPEG) {
                    replace(file, out -> rewriteExif(file, dateStamp, out));
                } else {
                    replace(file, out -> rewriteTiff(file, dateStamp, out));
                }
                log.info("Wrote date {} to {}", dateStamp, file);
                return DateWriteResult.tagsWritten(dateStamp);
            } catch (IOException | RuntimeException e) {
                log.warn("Could not rewrite the tags of {}, saving without them", file, e);
                reason = String.valueOf(e.getMessage());
            }
        } else {
            reason = "date tags can only be written to JPEG and TIFF files";
        }

        try {
            replace(file, out -> resave(file, out));
            log.info("Saved {} without date tags: {}", file, reason);
            return DateWriteResult.savedWithoutTags(dateStamp, reason);
        } catch (IOException e) {
            log.error("Could not save {}", file, e);
            return DateWriteResult.failed(dateStamp, e.getMessage());
        }
    }

    private static ImageFormat guessFormat(File file) {
        try {
            return Imaging.guessFormat(file);
        } catch (IOException e) {
            log.debug("Could not guess the format of {}", file, e);
            return ImageFormats.UNKNOWN;
        }
    }

    private static void rewriteExif(File file, String dateStamp, OutputStream out) throws IOException {
        TiffOutputSet outputSet = null;
        ImageMetadata metadata = Imaging.getMetadata(file);
        if (metadata instanceof JpegImageMetadata) {
            TiffImageMetadata exif = ((JpegImageMetadata) metadata).getExif();
            if (exif != null) {
                outputSet = exif.getOutputSet();
            }
        }
        if (outputSet == null) {
            outputSet = new TiffOutputSet();
        }
        stampDates(outputSet, dateStamp);
        new ExifRewriter().updateExifMetadataLossless(file, out, outputSet);
    }

    private static void rewriteTiff(File file, String dateStamp, OutputStream out) throws IOException {
        ImageMetadata metadata = Imaging.getMetadata(file);
        if (!(metadata instanceof TiffImageMetadata)) {
            throw new IOException("no TIFF directories in " + file.getName());
        }
        TiffOutputSet outputSet = ((TiffImageMetadata) metadata).getOutputSet();
        stampDates(outputSet, dateStamp);
        // strips and tiles are copied byte for byte, so keep the file's byte order
        new TiffImageWriterLossless(outputSet.byteOrder, FileUtils.readFileToByteArray(file)).write(out, outputSet);
    }

    private static void stampDates(TiffOutputSet outputSet, String dateStamp) throws IOException {
        TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
        root.removeField(TiffTagConstants.TIFF_TAG_DATE_TIME);
        root.add(TiffTagConstants.TIFF_TAG_DATE_TIME, dateStamp);

        TiffOutputDirectory exifDirectory = outputSet.getOrCreateExifDirectory();
        exifDirectory.removeField(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
        exifDirectory.add(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL, dateStamp);
        exifDirectory.removeField(ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED);
        exifDirectory.add(ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED, dateStamp);
    }

    private static void resave(File file, OutputStream out) throws IOException {
        BufferedImage image = ImageIO.read(file);
        if (image == null) {
            throw new IOException("no ImageReader could decode " + file.getName());
        }
        String formatName = FilenameUtils.getExtension(file.getName()).toLowerCase(Locale.ROOT);
        if (!ImageIO.write(image, formatName, out)) {
            throw new IOException("no ImageWriter for format " + formatName);
        }
    }

    private static void replace(File target, ImageOutput output) throws IOException {
        File temp = new File(target.getParentFile(), "." + target.getName() + ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(new FileOutputStream(temp))) {
                output.writeTo(out);
            }
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } finally {
            FileUtils.deleteQuietly(temp);
        }
    }

    @FunctionalInterface
    private interface ImageOutput {
        void writeTo(OutputStream out) throws IOException;
    }
}
