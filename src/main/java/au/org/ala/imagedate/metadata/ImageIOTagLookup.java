package au.org.ala.imagedate.metadata;

import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link TagLookup} over the metadata an {@link javax.imageio.ImageReader} reports.
 * <p/>
 * TIFF readers (the JDK's and TwelveMonkeys') expose every IFD entry in their native tree as a {@code TIFFField}
 * element with a {@code number} attribute; those become the tags. When no Orientation field is present, a
 * non-normal {@code ImageOrientation} from the plug-in neutral tree is reported under tag 274.
 */
public class ImageIOTagLookup implements TagLookup {

    private static final Logger log = LoggerFactory.getLogger(ImageIOTagLookup.class);

    private final Map<Integer, List<Object>> fields;

    public ImageIOTagLookup(IIOMetadata metadata) {
        Map<Integer, List<Object>> parsed = new HashMap<>();
        if (metadata != null) {
            readNativeTree(metadata, parsed);
            if (!parsed.containsKey(TiffTagConstants.TIFF_TAG_ORIENTATION.tag)) {
                findImageOrientation(metadata).ifPresent(o ->
                        parsed.put(TiffTagConstants.TIFF_TAG_ORIENTATION.tag, List.of(o.value())));
            }
        }
        this.fields = Collections.unmodifiableMap(parsed);
    }

    @Override
    public Optional<Object> lookup(int tagCode) {
        List<Object> values = fields.get(tagCode);
        if (values == null) {
            return Optional.empty();
        }
        return Optional.of(values.size() == 1 ? values.get(0) : values);
    }

    private static void readNativeTree(IIOMetadata metadata, Map<Integer, List<Object>> parsed) {
        String formatName = metadata.getNativeMetadataFormatName();
        if (formatName == null) {
            return;
        }
        Node root;
        try {
            root = metadata.getAsTree(formatName);
        } catch (IllegalArgumentException e) {
            log.debug("Native metadata format {} not readable as a tree", formatName, e);
            return;
        }
        if (!(root instanceof Element)) {
            return;
        }
        NodeList tiffFields = ((Element) root).getElementsByTagName("TIFFField");
        for (int i = 0; i < tiffFields.getLength(); i++) {
            Element field = (Element) tiffFields.item(i);
            int number;
            try {
                number = Integer.parseInt(field.getAttribute("number"));
            } catch (NumberFormatException e) {
                continue;
            }
            if (parsed.containsKey(number)) {
                continue;
            }
            List<Object> values = new ArrayList<>();
            collectValues(field, values);
            if (!values.isEmpty()) {
                parsed.put(number, values);
            }
        }
        log.trace("Read {} TIFF fields from {} metadata", parsed.size(), formatName);
    }

    // the value elements (TIFFShort, TIFFRational, TIFFAscii...) sit one container below the field
    private static void collectValues(Element field, List<Object> values) {
        NodeList containers = field.getChildNodes();
        for (int i = 0; i < containers.getLength(); i++) {
            Node container = containers.item(i);
            if (!(container instanceof Element) || "TIFFIFD".equals(container.getNodeName())) {
                continue;
            }
            NodeList entries = container.getChildNodes();
            for (int j = 0; j < entries.getLength(); j++) {
                Node entry = entries.item(j);
                if (entry instanceof Element && ((Element) entry).hasAttribute("value")) {
                    values.add(toValue(((Element) entry).getAttribute("value")));
                }
            }
        }
    }

    static Object toValue(String text) {
        int slash = text.indexOf('/');
        if (slash > 0) {
            try {
                double numerator = Double.parseDouble(text.substring(0, slash));
                double denominator = Double.parseDouble(text.substring(slash + 1));
                return numerator / denominator;
            } catch (NumberFormatException e) {
                return text;
            }
        }
        return text;
    }

    /**
     * Finds the {@code ImageOrientation} node of the standard (plug-in neutral) metadata tree, if any.
     *
     * @see <a href="https://docs.oracle.com/javase/7/docs/api/javax/imageio/metadata/doc-files/standard_metadata.html">Standard (Plug-in Neutral) Metadata Format Specification</a>
     */
    private static Optional<Orientation> findImageOrientation(final IIOMetadata metadata) {
        if (!metadata.isStandardMetadataFormatSupported()) {
            return Optional.empty();
        }
        try {
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
            NodeList imageOrientations = root.getElementsByTagName("ImageOrientation");
            if (imageOrientations != null && imageOrientations.getLength() > 0) {
                IIOMetadataNode imageOrientation = (IIOMetadataNode) imageOrientations.item(0);
                String orientationValue = imageOrientation.getAttribute("value");
                log.trace("Found ImageOrientation tag with value: {}", orientationValue);
                Orientation orientation = Orientation.fromMetadataOrientation(orientationValue);
                // readers that don't parse EXIF always report Normal
                return orientation == Orientation.Normal ? Optional.empty() : Optional.of(orientation);
            }
        } catch (IllegalArgumentException | ClassCastException e) {
            log.debug("Standard metadata tree not available", e);
        }
        return Optional.empty();
    }
}
