package au.org.ala.imagedate.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.google.common.io.ByteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A {@link TagLookup} backed by the metadata-extractor library's EXIF IFD0 directories. For TIFF files these hold the
 * baseline TIFF tags (photometric interpretation, sample ranges) as well as orientation.
 */
public class MetadataReaderTagLookup implements TagLookup {

    private static final Logger log = LoggerFactory.getLogger(MetadataReaderTagLookup.class);

    private final Collection<ExifIFD0Directory> directories;

    public MetadataReaderTagLookup(Metadata metadata) {
        this.directories = metadata != null ? metadata.getDirectoriesOfType(ExifIFD0Directory.class) : List.of();
    }

    /**
     * Read the metadata of an encoded image. Unreadable metadata yields a lookup with no tags.
     */
    public static MetadataReaderTagLookup read(ByteSource byteSource) {
        Metadata metadata = null;
        try (InputStream bis = byteSource.openBufferedStream()) {
            metadata = ImageMetadataReader.readMetadata(bis);
        } catch (ImageProcessingException | IOException | RuntimeException e) {
            log.debug("No readable metadata: {}", e.getMessage());
        }
        return new MetadataReaderTagLookup(metadata);
    }

    @Override
    public Optional<Object> lookup(int tagCode) {
        for (ExifIFD0Directory directory : directories) {
            if (directory.containsTag(tagCode)) {
                return Optional.ofNullable(directory.getObject(tagCode));
            }
        }
        return Optional.empty();
    }
}
