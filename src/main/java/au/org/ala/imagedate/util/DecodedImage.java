package au.org.ala.imagedate.util;

import au.org.ala.imagedate.metadata.TagLookup;
import au.org.ala.imagedate.raster.RasterImage;
import com.google.common.base.MoreObjects;

/**
 * The output of {@link ImageDecoder}: raw samples plus the tags they came with.
 */
public class DecodedImage {

    private final String filename;
    private final String contentType;
    private final RasterImage raster;
    private final TagLookup tags;

    public DecodedImage(String filename, String contentType, RasterImage raster, TagLookup tags) {
        this.filename = filename;
        this.contentType = contentType;
        this.raster = raster;
        this.tags = tags;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public RasterImage getRaster() {
        return raster;
    }

    public TagLookup getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("filename", filename)
                .add("contentType", contentType)
                .add("raster", raster)
                .toString();
    }
}
